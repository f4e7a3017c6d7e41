package io.github.drompincen.playdeck.runtime.lock;

import io.github.drompincen.playdeck.runtime.cache.KeyValueCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class LockService {

    private static final Logger log = LoggerFactory.getLogger(LockService.class);

    public static final Duration DEFAULT_REPEAT = Duration.ofSeconds(1);

    private final KeyValueCache cache;

    public LockService(KeyValueCache cache) {
        this.cache = cache;
    }

    public Lock acquire(String id) {
        return acquire(id, null, DEFAULT_REPEAT, ServiceLock.DEFAULT_ERROR);
    }

    public Lock acquire(String id, Object payload, Duration repeat, String errMsg) {
        Lock lock = new Lock(cache, id, payload, repeat, errMsg);
        log.debug("Acquired lock {}", id);
        return lock;
    }

    public boolean isLocked(String id) {
        return cache.contains(id);
    }
}
