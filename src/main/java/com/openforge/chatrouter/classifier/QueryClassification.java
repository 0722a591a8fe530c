package com.openforge.chatrouter.classifier;

import java.util.List;

/**
 * Result of {@link QueryClassifier#classify}.
 *
 * @param type       chosen category
 * @param confidence 0.0 – 1.0
 * @param signals    the phrases that triggered the category, in match order
 */
public record QueryClassification(
        QueryType type,
        double confidence,
        List<String> signals
) {

    public QueryClassification {
        signals = signals == null ? List.of() : List.copyOf(signals);
    }

    public static QueryClassification general() {
        return new QueryClassification(QueryType.GENERAL, QueryClassifier.DEFAULT_CONFIDENCE, List.of());
    }

    public boolean isPersonal() {
        return type == QueryType.PERSONAL;
    }
}
