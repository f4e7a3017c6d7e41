package io.github.drompincen.playdeck.runtime.cache;

import java.time.Duration;

/**
 * Cache shared by every worker process. {@link #add} is the primitive the distributed
 * lock is built on, so implementations must make it atomic across processes.
 */
public interface KeyValueCache {

    /**
     * Stores {@code payload} under {@code key} unless a live entry already exists.
     *
     * @return {@code true} if the entry was added
     */
    boolean add(String key, Object payload, Duration ttl);

    /** Removes the entry; a missing key is not an error. */
    void delete(String key);

    boolean contains(String key);
}
