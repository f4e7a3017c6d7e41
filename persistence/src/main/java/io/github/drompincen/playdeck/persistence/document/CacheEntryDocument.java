package io.github.drompincen.playdeck.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Entry of the shared cache. Mongo drops it once {@code expiresAt} has passed.
 */
@Document(collection = "cache_entries")
public class CacheEntryDocument {

    @Id
    private String key;
    private Object payload;

    @Indexed(expireAfterSeconds = 0)
    private Instant expiresAt;
    private Instant createdAt;

    public CacheEntryDocument() {}

    public CacheEntryDocument(String key, Object payload, Instant createdAt, Instant expiresAt) {
        this.key = key;
        this.payload = payload;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public Object getPayload() { return payload; }
    public void setPayload(Object payload) { this.payload = payload; }

    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
