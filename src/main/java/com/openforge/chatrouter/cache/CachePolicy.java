package com.openforge.chatrouter.cache;

import com.openforge.chatrouter.classifier.QueryType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/** Per-classification cache decisions taken from {@link CacheProperties}. */
@Component
@RequiredArgsConstructor
public class CachePolicy {

    private final CacheProperties props;

    public boolean applies(QueryType type) {
        return props.enabled() && !props.skipTypes().contains(type);
    }

    public Duration ttlFor(QueryType type) {
        return props.ttl().getOrDefault(type, CacheProperties.DEFAULT_TTL.get(type));
    }
}
