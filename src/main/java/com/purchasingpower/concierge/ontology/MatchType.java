package com.purchasingpower.concierge.ontology;

public enum MatchType {
    /** Ingredient equals one of the declared allergens. */
    DIRECT,
    /** Ingredient belongs to the same allergen group as a declared allergen. */
    GROUP
}
