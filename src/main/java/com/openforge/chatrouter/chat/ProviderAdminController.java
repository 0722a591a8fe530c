package com.openforge.chatrouter.chat;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.openforge.chatrouter.cache.ResponseCache;
import com.openforge.chatrouter.chat.dto.CooldownRequest;
import com.openforge.chatrouter.chat.dto.ProviderStatusResponse;
import com.openforge.chatrouter.ratelimit.ProviderUsage;
import com.openforge.chatrouter.ratelimit.RateLimitTracker;
import com.openforge.chatrouter.router.FallbackEventLog;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;

/**
 * Operator endpoints for provider health.
 *
 *   GET  /api/providers/status          usage, recommendations, recent fallback events, cache stats
 *   POST /api/providers/reload          re-enable providers disabled by auth errors
 *   POST /api/providers/{id}/cooldown   force a cooldown
 *   POST /api/providers/{id}/reset      clear windows, counters, cooldown and disable
 */
@RestController
@RequestMapping("/api/providers")
@RequiredArgsConstructor
public class ProviderAdminController {

    static final int RECENT_EVENTS = 50;

    private final RateLimitTracker tracker;
    private final FallbackEventLog eventLog;
    private final ResponseCache    cache;

    @GetMapping("/status")
    public ResponseEntity<ProviderStatusResponse> status() {
        CacheStats stats = cache.stats();
        return ResponseEntity.ok(new ProviderStatusResponse(
                tracker.snapshot(),
                tracker.recommendations(),
                eventLog.counts(),
                eventLog.recent(RECENT_EVENTS),
                new ProviderStatusResponse.CacheSummary(cache.size(), stats.hitCount(), stats.missCount(),
                        stats.hitRate())));
    }

    @PostMapping("/reload")
    public ResponseEntity<Void> reload() {
        tracker.reload();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/cooldown")
    public ResponseEntity<ProviderUsage> cooldown(@PathVariable String id, @Valid @RequestBody CooldownRequest req) {
        requireKnown(id);
        tracker.forceCooldown(id, Duration.ofSeconds(req.seconds()));
        return ResponseEntity.ok(tracker.usage(id));
    }

    @PostMapping("/{id}/reset")
    public ResponseEntity<ProviderUsage> reset(@PathVariable String id) {
        requireKnown(id);
        tracker.resetStats(id);
        return ResponseEntity.ok(tracker.usage(id));
    }

    private void requireKnown(String id) {
        if (!tracker.isRegistered(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown provider: " + id);
        }
    }
}
