package io.github.drompincen.playdeck.runtime.lock;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.time.Duration;

@Aspect
@Order(0)
@Component
public class ServiceLockAspect {

    private static final Logger log = LoggerFactory.getLogger(ServiceLockAspect.class);

    private final LockService lockService;

    public ServiceLockAspect(LockService lockService) {
        this.lockService = lockService;
    }

    @Around("@annotation(serviceLock)")
    public Object applyLock(ProceedingJoinPoint joinPoint, ServiceLock serviceLock) throws Throwable {
        String key = resolveKey(joinPoint, serviceLock);
        if (key == null) {
            return joinPoint.proceed();
        }
        try (Lock lock = lockService.acquire(key, null,
                Duration.ofSeconds(serviceLock.repeat()), serviceLock.errorMessage())) {
            log.debug("Holding lock {} for {}", lock.getId(), joinPoint.getSignature().toShortString());
            return joinPoint.proceed();
        }
    }

    String resolveKey(ProceedingJoinPoint joinPoint, ServiceLock serviceLock) {
        if (!serviceLock.key().isEmpty()) {
            return serviceLock.key();
        }
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        Annotation[][] parameterAnnotations = method.getParameterAnnotations();
        Object[] args = joinPoint.getArgs();
        for (int i = 0; i < parameterAnnotations.length; i++) {
            for (Annotation annotation : parameterAnnotations[i]) {
                if (annotation instanceof LockKey) {
                    return args[i] != null ? String.valueOf(args[i]) : null;
                }
            }
        }
        return null;
    }
}
