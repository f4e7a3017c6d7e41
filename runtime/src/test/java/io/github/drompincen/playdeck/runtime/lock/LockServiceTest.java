package io.github.drompincen.playdeck.runtime.lock;

import io.github.drompincen.playdeck.runtime.cache.InMemoryKeyValueCache;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LockServiceTest {

    private final LockService lockService = new LockService(new InMemoryKeyValueCache());

    @Test
    void isLockedReflectsHeldLock() {
        try (Lock ignored = lockService.acquire(Lock.GLOBAL)) {
            assertThat(lockService.isLocked(Lock.GLOBAL)).isTrue();
        }
        assertThat(lockService.isLocked(Lock.GLOBAL)).isFalse();
    }

    @Test
    void defaultAcquireUsesDefaultMessage() {
        try (Lock ignored = lockService.acquire("task-1")) {
            assertThatThrownBy(() -> lockService.acquire("task-1"))
                    .isInstanceOf(AcquireLockException.class)
                    .hasMessage(ServiceLock.DEFAULT_ERROR);
        }
    }
}
