package io.github.drompincen.playdeck.gateway.config;

import io.github.drompincen.playdeck.runtime.cache.InMemoryKeyValueCache;
import io.github.drompincen.playdeck.runtime.cache.KeyValueCache;
import io.github.drompincen.playdeck.runtime.cache.MongoKeyValueCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Selects the cache behind locks. {@code memory} only works for a single node.
 */
@Configuration
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    KeyValueCache keyValueCache(@Value("${playdeck.cache.backend:mongo}") String backend,
                                MongoTemplate mongoTemplate) {
        switch (backend.toLowerCase()) {
            case "mongo":
                log.info("Using MongoDB lock cache");
                return new MongoKeyValueCache(mongoTemplate);
            case "memory":
                log.warn("Using in-memory lock cache; locks are not shared between nodes");
                return new InMemoryKeyValueCache();
            default:
                throw new IllegalStateException("Unknown playdeck.cache.backend: " + backend);
        }
    }
}
