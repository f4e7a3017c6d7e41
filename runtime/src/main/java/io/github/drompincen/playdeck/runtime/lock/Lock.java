package io.github.drompincen.playdeck.runtime.lock;

import io.github.drompincen.playdeck.runtime.cache.KeyValueCache;

import java.lang.ref.Cleaner;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutual-exclusion token over a {@link KeyValueCache} key.
 *
 * <p>The constructor polls {@code cache.add(id, payload, TIMEOUT)} every
 * {@value #POLL_INTERVAL_MS} ms until it succeeds or {@code repeat} has elapsed, then
 * throws {@link AcquireLockException} with the caller's message. Waiters are not queued:
 * whoever polls first after a release wins.
 *
 * <p>The key is deleted once, on the first {@link #release()} / {@link #close()}, or
 * when the lock becomes unreachable without having been released. {@link #TIMEOUT}
 * bounds the lifetime of a key whose holder crashed.
 */
public class Lock implements AutoCloseable {

    public static final Duration TIMEOUT = Duration.ofHours(24);
    public static final String GLOBAL = "global-deploy";
    public static final String SCHEDULER = "celery-beat";

    static final long POLL_INTERVAL_MS = 10;

    private static final Cleaner CLEANER = Cleaner.create();

    private final String id;
    private final Release release;
    private final Cleaner.Cleanable cleanable;

    public Lock(KeyValueCache cache, String id, Object payload, Duration repeat, String errMsg) {
        if (!poll(cache, id, payload, repeat)) {
            throw new AcquireLockException(id, errMsg);
        }
        this.id = id;
        this.release = new Release(cache, id);
        this.cleanable = CLEANER.register(this, release);
    }

    private static boolean poll(KeyValueCache cache, String id, Object payload, Duration repeat) {
        long deadline = System.nanoTime() + repeat.toNanos();
        while (true) {
            if (cache.add(id, payload, TIMEOUT)) {
                return true;
            }
            if (System.nanoTime() - deadline >= 0) {
                return false;
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    public String getId() {
        return id;
    }

    public boolean isReleased() {
        return release.done.get();
    }

    public void release() {
        cleanable.clean();
    }

    @Override
    public void close() {
        release();
    }

    // Must not reference the Lock itself, or the Cleaner would never see it unreachable.
    private static final class Release implements Runnable {
        private final KeyValueCache cache;
        private final String key;
        private final AtomicBoolean done = new AtomicBoolean(false);

        private Release(KeyValueCache cache, String key) {
            this.cache = cache;
            this.key = key;
        }

        @Override
        public void run() {
            if (done.compareAndSet(false, true)) {
                cache.delete(key);
            }
        }
    }
}
