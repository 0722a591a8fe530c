package com.openforge.chatrouter.router;

import com.openforge.chatrouter.classifier.QueryType;
import com.openforge.chatrouter.llm.PooledProvider;
import com.openforge.chatrouter.ratelimit.ProviderUsage;
import com.openforge.chatrouter.ratelimit.QuotaLevel;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Orders the candidate list for one routing pass.
 *
 * Pure: the result depends only on the arguments ({@code usage} may return
 * null for unknown providers).  Sort keys, in order:
 *   1. providers at {@link QuotaLevel#WARNING} go behind every other provider
 *   2. providers preferred for the query type, in preference order
 *   3. tier rank (the input order, kept stable)
 *
 * Nothing is filtered out here, so the router can record a skip event for
 * every provider it does not call.
 */
public final class CandidateSelector {

    private CandidateSelector() {}

    public static List<PooledProvider> order(List<PooledProvider> tiers,
                                             QueryType queryType,
                                             Map<QueryType, List<String>> preferences,
                                             Function<String, ProviderUsage> usage) {
        List<String> preferred = preferences.getOrDefault(queryType, List.of());
        Comparator<PooledProvider> bySoftLimit = Comparator.comparingInt(p -> {
            ProviderUsage u = usage.apply(p.id());
            return u != null && u.level() == QuotaLevel.WARNING ? 1 : 0;
        });
        Comparator<PooledProvider> byPreference = Comparator.comparingInt(p -> {
            int idx = preferred.indexOf(p.id());
            return idx < 0 ? Integer.MAX_VALUE : idx;
        });
        Comparator<PooledProvider> byTier = Comparator.comparingInt(PooledProvider::tier);

        return tiers.stream()
                .sorted(bySoftLimit.thenComparing(byPreference).thenComparing(byTier))
                .toList();
    }
}
