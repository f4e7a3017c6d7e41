package io.github.drompincen.playdeck.runtime.error;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Applies {@link WithTraceback} and {@link SuppressErrors}. Runs outside the service lock
 * so lock failures get a traceback as well.
 */
@Aspect
@Order(Ordered.HIGHEST_PRECEDENCE)
@Component
public class ErrorContextAspect {

    @Around("@annotation(withTraceback)")
    public Object attachTraceback(ProceedingJoinPoint joinPoint, WithTraceback withTraceback) throws Throwable {
        try {
            return joinPoint.proceed();
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            throw ExceptionWithTraceback.attach(t);
        }
    }

    @Around("@annotation(suppressErrors)")
    public Object suppress(ProceedingJoinPoint joinPoint, SuppressErrors suppressErrors) {
        RaiseContext context = RaiseContext.of(suppressErrors.propagate()).verbose(suppressErrors.verbose());
        return context.execute(() -> {
            try {
                return joinPoint.proceed();
            } catch (Exception | Error e) {
                throw e;
            } catch (Throwable t) {
                throw new PMException(t.getMessage(), t);
            }
        }).orElse(null);
    }
}
