package com.openforge.chatrouter.cache;

import com.openforge.chatrouter.classifier.QueryType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * chat-router:
 *   cache:
 *     maximum-size: 10000
 *     ttl:
 *       temporal: 5m
 *       personal: 2m
 *       general: 1h
 *     skip-types: []
 *
 * Query types listed in {@code skip-types} are neither looked up nor stored.
 */
@ConfigurationProperties(prefix = "chat-router.cache")
public record CacheProperties(
        @DefaultValue("true")  boolean enabled,
        @DefaultValue("10000") long    maximumSize,
        Map<QueryType, Duration> ttl,
        Set<QueryType> skipTypes
) {

    static final Map<QueryType, Duration> DEFAULT_TTL = Map.of(
            QueryType.TEMPORAL, Duration.ofMinutes(5),
            QueryType.PERSONAL, Duration.ofMinutes(2),
            QueryType.GENERAL,  Duration.ofHours(1));

    public CacheProperties {
        Map<QueryType, Duration> merged = new EnumMap<>(DEFAULT_TTL);
        if (ttl != null) merged.putAll(ttl);
        ttl       = Map.copyOf(merged);
        skipTypes = skipTypes == null ? Set.of() : Set.copyOf(skipTypes);
    }

    public static CacheProperties defaults() {
        return new CacheProperties(true, 10_000, null, null);
    }
}
