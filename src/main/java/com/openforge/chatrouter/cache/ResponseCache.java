package com.openforge.chatrouter.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * TTL-keyed store of earlier replies, backed by Caffeine.
 *
 * Every entry carries its own TTL (per-entry {@link Expiry}), so temporal,
 * personal and general answers can share one cache.  The cache is advisory:
 * any failure reads as a miss and is logged, never thrown.
 */
@Slf4j
@Component
@EnableConfigurationProperties(CacheProperties.class)
public class ResponseCache {

    private final Cache<String, CachedResponse> cache;
    private final Clock                         clock;

    public ResponseCache(CacheProperties props, Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(props.maximumSize())
                .expireAfter(new PerEntryExpiry())
                .ticker(() -> clock.millis() * 1_000_000L)
                .recordStats()
                .build();
        log.info("[Cache] Initialized response cache: maximumSize={} ttl={}", props.maximumSize(), props.ttl());
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public Optional<CachedResponse> get(String key) {
        try {
            CachedResponse cached = cache.getIfPresent(key);
            if (cached == null) {
                return Optional.empty();
            }
            if (cached.expiredAt(clock.instant())) {
                cache.invalidate(key);
                return Optional.empty();
            }
            return Optional.of(cached);
        } catch (RuntimeException e) {
            log.warn("[Cache] Lookup failed for key {}: {}", abbreviate(key), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Stores {@code value} for {@code ttl}.  The stored entry is stamped with
     * the current time and the given TTL; non-positive TTLs are ignored.
     */
    public void set(String key, CachedResponse value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        try {
            CachedResponse stamped = new CachedResponse(value.content(), value.provider(), value.model(),
                    value.tokensUsed(), value.memoryReferences(), clock.instant(), ttl);
            cache.put(key, stamped);
            log.debug("[Cache] Stored {} ttl={}", abbreviate(key), ttl);
        } catch (RuntimeException e) {
            log.warn("[Cache] Store failed for key {}: {}", abbreviate(key), e.getMessage());
        }
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.info("[Cache] All entries invalidated");
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public long size() {
        return cache.estimatedSize();
    }

    // ── Private ──────────────────────────────────────────────────────────────

    private static String abbreviate(String key) {
        return key.length() > 12 ? key.substring(0, 12) : key;
    }

    private static final class PerEntryExpiry implements Expiry<String, CachedResponse> {

        @Override
        public long expireAfterCreate(String key, CachedResponse value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedResponse value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedResponse value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
