package com.purchasingpower.concierge.workflow.state;

import java.util.Arrays;
import java.util.Locale;

/**
 * Intent vocabulary of the classifier plus the two outcomes the router assigns itself.
 */
public enum Intent {
    PRODUCT_SEARCH("product_search", true),
    INGREDIENT_CHECK("ingredient_check", true),
    ROUTINE_ADVICE("routine_advice", true),
    GENERAL_CHAT("general_chat", false),
    MEMORY_QUERY("memory_query", false),
    /** Classifier answered outside the vocabulary. */
    UNRECOGNIZED("unrecognized", false),
    /** Turn stopped by the override detector before routing. */
    SAFETY_OVERRIDE_BLOCKED("safety_override_blocked", false);

    private final String label;
    private final boolean recommendsProducts;

    Intent(String label, boolean recommendsProducts) {
        this.label = label;
        this.recommendsProducts = recommendsProducts;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether the turn runs pre_filter, discovery and post_filter.
     */
    public boolean recommendsProducts() {
        return recommendsProducts;
    }

    /**
     * Map a classifier answer onto the vocabulary. Surrounding quotes and
     * punctuation are ignored; anything else unknown is {@link #UNRECOGNIZED}.
     */
    public static Intent fromLabel(String raw) {
        if (raw == null) {
            return UNRECOGNIZED;
        }
        String label = raw.strip().toLowerCase(Locale.ROOT).replaceAll("^[\"'`]+|[\"'`.!]+$", "");
        return Arrays.stream(values())
                .filter(i -> i != SAFETY_OVERRIDE_BLOCKED && i != UNRECOGNIZED)
                .filter(i -> i.label.equals(label))
                .findFirst()
                .orElse(UNRECOGNIZED);
    }
}
