package io.github.drompincen.playdeck.runtime.cache;

import io.github.drompincen.playdeck.persistence.document.CacheEntryDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cache entries in the {@code cache_entries} collection. The unique {@code _id} makes
 * {@link #add} atomic: a concurrent insert of the same key fails with a duplicate key error.
 * Mongo's TTL monitor only runs once a minute, so expired entries are also removed here.
 */
public class MongoKeyValueCache implements KeyValueCache {

    private static final Logger log = LoggerFactory.getLogger(MongoKeyValueCache.class);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoKeyValueCache(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    public MongoKeyValueCache(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @Override
    public boolean add(String key, Object payload, Duration ttl) {
        Instant now = clock.instant();
        mongoTemplate.remove(
                Query.query(Criteria.where("_id").is(key).and("expiresAt").lte(now)),
                CacheEntryDocument.class);
        try {
            mongoTemplate.insert(new CacheEntryDocument(key, payload, now, now.plus(ttl)));
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Cache key {} already present", key);
            return false;
        }
    }

    @Override
    public void delete(String key) {
        mongoTemplate.remove(Query.query(Criteria.where("_id").is(key)), CacheEntryDocument.class);
    }

    @Override
    public boolean contains(String key) {
        return mongoTemplate.exists(
                Query.query(Criteria.where("_id").is(key).and("expiresAt").gt(clock.instant())),
                CacheEntryDocument.class);
    }
}
