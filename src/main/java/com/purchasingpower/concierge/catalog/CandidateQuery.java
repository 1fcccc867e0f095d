package com.purchasingpower.concierge.catalog;

import java.util.Set;

/**
 * @param text Free-text search, usually the user's message
 * @param excludedIngredients Normalized tokens no returned candidate may contain
 * @param limit Maximum candidates
 */
public record CandidateQuery(String text, Set<String> excludedIngredients, int limit) {

    public CandidateQuery {
        excludedIngredients = excludedIngredients != null ? Set.copyOf(excludedIngredients) : Set.of();
    }
}
