package com.openforge.chatrouter.llm;

import com.openforge.chatrouter.config.ConfigurationException;
import com.openforge.chatrouter.llm.model.Message;
import com.openforge.chatrouter.support.StubProviderAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderAdapterPoolTest {

    private static final ProviderPrompt PROMPT = ProviderPrompt.of(Message.user("Hi"));
    private static final SendParams     PARAMS = new SendParams(0.7, 128);

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("should order providers by tier")
        void ordersByTier() {
            PooledProvider b = StubProviderAdapter.replying("b", "x").pooled(2);
            PooledProvider a = StubProviderAdapter.replying("a", "x").pooled(1);

            ProviderAdapterPool pool = new ProviderAdapterPool(List.of(b, a), executor);

            assertThat(pool.tiers()).extracting(PooledProvider::id).containsExactly("a", "b");
            assertThat(pool.find("b")).isPresent();
            assertThat(pool.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("should refuse an empty provider list")
        void emptyList() {
            assertThatThrownBy(() -> new ProviderAdapterPool(List.of(), executor))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should refuse duplicate provider ids")
        void duplicates() {
            PooledProvider a1 = StubProviderAdapter.replying("a", "x").pooled(1);
            PooledProvider a2 = StubProviderAdapter.replying("a", "y").pooled(2);

            assertThatThrownBy(() -> new ProviderAdapterPool(List.of(a1, a2), executor))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Duplicate");
        }
    }

    @Nested
    @DisplayName("invoke")
    class Invoke {

        @Test
        @DisplayName("should return the reply on success")
        void success() {
            PooledProvider p = StubProviderAdapter.replying("a", "Hello").pooled(1);
            ProviderAdapterPool pool = new ProviderAdapterPool(List.of(p), executor);

            ProviderOutcome outcome = pool.invoke(p, PROMPT, PARAMS);

            assertThat(outcome.succeeded()).isTrue();
            assertThat(outcome.reply().text()).isEqualTo("Hello");
        }

        @Test
        @DisplayName("should keep the failure kind reported by the adapter")
        void providerFailure() {
            PooledProvider p = StubProviderAdapter.failing("a", FailureKind.AUTH_ERROR).pooled(1);
            ProviderAdapterPool pool = new ProviderAdapterPool(List.of(p), executor);

            ProviderOutcome outcome = pool.invoke(p, PROMPT, PARAMS);

            assertThat(outcome.succeeded()).isFalse();
            assertThat(outcome.failure()).isEqualTo(FailureKind.AUTH_ERROR);
        }

        @Test
        @DisplayName("should treat unexpected exceptions as INVALID_RESPONSE")
        void unexpectedException() {
            PooledProvider p = StubProviderAdapter.throwing("a", new IllegalStateException("boom")).pooled(1);
            ProviderAdapterPool pool = new ProviderAdapterPool(List.of(p), executor);

            ProviderOutcome outcome = pool.invoke(p, PROMPT, PARAMS);

            assertThat(outcome.failure()).isEqualTo(FailureKind.INVALID_RESPONSE);
            assertThat(outcome.detail()).contains("boom");
        }

        @Test
        @DisplayName("should bound a hanging call and report TRANSIENT_ERROR")
        void timeout() {
            StubProviderAdapter hanging = StubProviderAdapter.hanging("a", new CountDownLatch(1));
            PooledProvider p = hanging.pooled(1, Duration.ofMillis(150));
            ProviderAdapterPool pool = new ProviderAdapterPool(List.of(p), executor);

            long start = System.nanoTime();
            ProviderOutcome outcome = pool.invoke(p, PROMPT, PARAMS);

            assertThat(outcome.failure()).isEqualTo(FailureKind.TRANSIENT_ERROR);
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("should raise RequestCancelledException when the caller is interrupted")
        void cancellation() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            PooledProvider p = StubProviderAdapter.hanging("a", started).pooled(1, Duration.ofSeconds(30));
            ProviderAdapterPool pool = new ProviderAdapterPool(List.of(p), executor);
            AtomicReference<Throwable> thrown = new AtomicReference<>();

            Thread caller = new Thread(() -> {
                try {
                    pool.invoke(p, PROMPT, PARAMS);
                } catch (Throwable t) {
                    thrown.set(t);
                }
            });
            caller.start();
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            caller.interrupt();
            caller.join(5_000);

            assertThat(thrown.get()).isInstanceOf(RequestCancelledException.class);
        }
    }
}
