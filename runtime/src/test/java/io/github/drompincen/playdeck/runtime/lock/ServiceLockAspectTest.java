package io.github.drompincen.playdeck.runtime.lock;

import io.github.drompincen.playdeck.runtime.cache.InMemoryKeyValueCache;
import io.github.drompincen.playdeck.runtime.error.ErrorContextAspect;
import io.github.drompincen.playdeck.runtime.error.PMException;
import io.github.drompincen.playdeck.runtime.error.WithTraceback;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceLockAspectTest {

    public static class DeployService {
        final List<Boolean> lockedDuringCall = new ArrayList<>();
        LockService lockService;

        @ServiceLock
        public String deploy(@LockKey String projectId) {
            lockedDuringCall.add(lockService.isLocked(projectId));
            return "deployed " + projectId;
        }

        @ServiceLock(key = Lock.GLOBAL, errorMessage = "Global deploy running")
        public void deployAll() {
            lockedDuringCall.add(lockService.isLocked(Lock.GLOBAL));
        }

        @ServiceLock
        public void failing(@LockKey String projectId) {
            throw new IllegalStateException("playbook failed");
        }

        @WithTraceback
        @ServiceLock(repeat = 0)
        public void traced(@LockKey String projectId) {
        }
    }

    private LockService lockService;
    private DeployService target;
    private DeployService proxy;

    @BeforeEach
    void setUp() {
        lockService = new LockService(new InMemoryKeyValueCache());
        target = new DeployService();
        target.lockService = lockService;

        AspectJProxyFactory factory = new AspectJProxyFactory(target);
        factory.setProxyTargetClass(true);
        factory.addAspect(new ErrorContextAspect());
        factory.addAspect(new ServiceLockAspect(lockService));
        proxy = factory.getProxy();
    }

    @Test
    void locksOnAnnotatedArgumentAndReleasesAfter() {
        String result = proxy.deploy("p-1");

        assertThat(result).isEqualTo("deployed p-1");
        assertThat(target.lockedDuringCall).containsExactly(true);
        assertThat(lockService.isLocked("p-1")).isFalse();
    }

    @Test
    void fixedKeyTakesPrecedence() {
        proxy.deployAll();

        assertThat(target.lockedDuringCall).containsExactly(true);
        assertThat(lockService.isLocked(Lock.GLOBAL)).isFalse();
    }

    @Test
    void nullKeyRunsUnlocked() {
        proxy.deploy(null);

        assertThat(target.lockedDuringCall).containsExactly(false);
    }

    @Test
    void releasesWhenMethodThrows() {
        assertThatThrownBy(() -> proxy.failing("p-2"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("playbook failed");

        assertThat(lockService.isLocked("p-2")).isFalse();
    }

    @Test
    void heldKeyRejectsCallWithDefaultMessage() {
        try (Lock ignored = lockService.acquire("p-3")) {
            assertThatThrownBy(() -> proxy.deploy("p-3"))
                    .isInstanceOf(AcquireLockException.class)
                    .hasMessage(ServiceLock.DEFAULT_ERROR);
        }
        assertThat(target.lockedDuringCall).isEmpty();
    }

    @Test
    void heldGlobalKeyUsesCustomMessage() {
        try (Lock ignored = lockService.acquire(Lock.GLOBAL)) {
            assertThatThrownBy(() -> proxy.deployAll())
                    .isInstanceOf(AcquireLockException.class)
                    .hasMessage("Global deploy running");
        }
    }

    @Test
    void lockFailureCarriesTraceback() {
        try (Lock ignored = lockService.acquire("p-4")) {
            assertThatThrownBy(() -> proxy.traced("p-4"))
                    .isInstanceOf(AcquireLockException.class)
                    .satisfies(e -> assertThat(((PMException) e).getTraceback())
                            .contains("AcquireLockException"));
        }
    }
}
