package com.openforge.chatrouter.router;

import com.openforge.chatrouter.classifier.QueryType;
import com.openforge.chatrouter.llm.PooledProvider;
import com.openforge.chatrouter.ratelimit.ProviderUsage;
import com.openforge.chatrouter.ratelimit.QuotaLevel;
import com.openforge.chatrouter.support.StubProviderAdapter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateSelectorTest {

    private final PooledProvider groq    = StubProviderAdapter.replying("groq", "x").pooled(1);
    private final PooledProvider gemini  = StubProviderAdapter.replying("gemini", "x").pooled(2);
    private final PooledProvider mistral = StubProviderAdapter.replying("mistral", "x").pooled(3);
    private final List<PooledProvider> tiers = List.of(groq, gemini, mistral);

    private static ProviderUsage usage(String id, QuotaLevel level) {
        return new ProviderUsage(id, true, null, 0, 10, 0, 0, level, null, 0, 0, 0);
    }

    @Test
    @DisplayName("should keep tier order without preferences or pressure")
    void tierOrder() {
        List<PooledProvider> order = CandidateSelector.order(tiers, QueryType.GENERAL, Map.of(),
                id -> usage(id, QuotaLevel.OK));

        assertThat(order).containsExactly(groq, gemini, mistral);
    }

    @Test
    @DisplayName("should put preferred providers first for the matching query type")
    void preferenceFirst() {
        List<PooledProvider> order = CandidateSelector.order(tiers, QueryType.TEMPORAL,
                Map.of(QueryType.TEMPORAL, List.of("gemini")), id -> usage(id, QuotaLevel.OK));

        assertThat(order).containsExactly(gemini, groq, mistral);
    }

    @Test
    @DisplayName("should demote providers past their soft threshold")
    void demotesWarning() {
        List<PooledProvider> order = CandidateSelector.order(tiers, QueryType.GENERAL, Map.of(),
                id -> usage(id, id.equals("groq") ? QuotaLevel.WARNING : QuotaLevel.OK));

        assertThat(order).containsExactly(gemini, mistral, groq);
    }

    @Test
    @DisplayName("should tolerate providers without usage data")
    void missingUsage() {
        List<PooledProvider> order = CandidateSelector.order(tiers, QueryType.GENERAL, Map.of(), id -> null);

        assertThat(order).containsExactly(groq, gemini, mistral);
    }
}
