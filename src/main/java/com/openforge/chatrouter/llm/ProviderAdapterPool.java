package com.openforge.chatrouter.llm;

import com.openforge.chatrouter.config.ConfigurationException;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Holds every configured provider adapter, ordered by tier rank.
 *
 * The pool executes single attempts; it never decides which provider to try
 * next.  Each attempt runs on {@code providerCallExecutor} and is bounded by
 * the provider's Resilience4j {@link io.github.resilience4j.timelimiter.TimeLimiter}.
 * Whatever happens inside the adapter comes back as a {@link ProviderOutcome}.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class ProviderAdapterPool {

    private final List<PooledProvider> providers;
    private final ExecutorService      providerCallExecutor;

    @Autowired
    public ProviderAdapterPool(LlmProperties properties,
                               ProviderAdapterFactory factory,
                               TimeLimiterRegistry timeLimiterRegistry,
                               @Qualifier("providerCallExecutor") ExecutorService providerCallExecutor) {
        this(properties.providers().stream()
                        .map(cfg -> new PooledProvider(cfg.id(), cfg.tier(), factory.create(cfg),
                                timeLimiterRegistry.timeLimiter(cfg.id(), TimeLimiterConfig.custom()
                                        .timeoutDuration(Duration.ofSeconds(cfg.timeoutSeconds()))
                                        .cancelRunningFuture(true)
                                        .build())))
                        .toList(),
                providerCallExecutor);
    }

    public ProviderAdapterPool(List<PooledProvider> providers, ExecutorService providerCallExecutor) {
        validate(providers);
        this.providers = providers.stream()
                .sorted(Comparator.comparingInt(PooledProvider::tier))
                .toList();
        this.providerCallExecutor = providerCallExecutor;
        log.info("[Pool] {} provider(s) in tier order: {}", this.providers.size(),
                this.providers.stream().map(p -> p.id() + "@" + p.tier()).toList());
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /** All providers, lowest tier rank first; ties keep configuration order. */
    public List<PooledProvider> tiers() {
        return providers;
    }

    public int size() {
        return providers.size();
    }

    public Optional<PooledProvider> find(String providerId) {
        return providers.stream().filter(p -> p.id().equals(providerId)).findFirst();
    }

    /**
     * Executes one bounded attempt against a provider.
     *
     * @throws RequestCancelledException if the calling thread is interrupted
     *         while waiting; the in-flight call is cancelled
     */
    public ProviderOutcome invoke(PooledProvider provider, ProviderPrompt prompt, SendParams params) {
        long start = System.nanoTime();
        Future<ProviderReply> future;
        try {
            future = providerCallExecutor.submit(() -> provider.adapter().send(prompt, params));
        } catch (RejectedExecutionException e) {
            return ProviderOutcome.failure(provider.id(), FailureKind.TRANSIENT_ERROR,
                    "Provider call queue is full", 0L);
        }

        try {
            ProviderReply reply = provider.timeLimiter().executeFutureSupplier(() -> future);
            return ProviderOutcome.success(provider.id(), reply);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(
                    "Caller cancelled while waiting on provider [%s]".formatted(provider.id()));
        } catch (TimeoutException e) {
            return ProviderOutcome.failure(provider.id(), FailureKind.TRANSIENT_ERROR,
                    "Timed out after %s".formatted(provider.timeLimiter().getTimeLimiterConfig().getTimeoutDuration()),
                    elapsedMs(start));
        } catch (ProviderException e) {
            return ProviderOutcome.failure(provider.id(), e.getKind(), e.getMessage(), elapsedMs(start));
        } catch (Exception e) {
            log.warn("[Pool] Unexpected {} from provider {}: {}",
                    e.getClass().getSimpleName(), provider.id(), e.getMessage());
            return ProviderOutcome.failure(provider.id(), FailureKind.INVALID_RESPONSE,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), elapsedMs(start));
        }
    }

    // ── Private ──────────────────────────────────────────────────────────────

    private static void validate(List<PooledProvider> providers) {
        if (providers == null || providers.isEmpty()) {
            throw new ConfigurationException(
                    "No language-model providers configured (chat-router.llm.providers is empty)");
        }
        Set<String> seen = new HashSet<>();
        for (PooledProvider p : providers) {
            if (p.id() == null || p.id().isBlank()) {
                throw new ConfigurationException("Every provider needs a non-blank id");
            }
            if (!seen.add(p.id())) {
                throw new ConfigurationException("Duplicate provider id: " + p.id());
            }
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
