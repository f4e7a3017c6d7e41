package io.github.drompincen.playdeck.runtime.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local cache for single-node deployments and tests.
 */
public class InMemoryKeyValueCache implements KeyValueCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueCache() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean add(String key, Object payload, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean added = new AtomicBoolean(false);
        entries.compute(key, (k, existing) -> {
            if (existing != null && existing.expiresAt().isAfter(now)) {
                return existing;
            }
            added.set(true);
            return new Entry(payload, now.plus(ttl));
        });
        return added.get();
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public boolean contains(String key) {
        Entry entry = entries.get(key);
        return entry != null && entry.expiresAt().isAfter(clock.instant());
    }

    public int size() {
        return entries.size();
    }

    private record Entry(Object payload, Instant expiresAt) {}
}
