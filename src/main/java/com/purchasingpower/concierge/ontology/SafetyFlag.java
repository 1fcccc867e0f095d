package com.purchasingpower.concierge.ontology;

import java.io.Serializable;

/**
 * Why a product's safety score was reduced.
 *
 * @param ingredient Ingredient as listed on the product
 * @param type IRRITANT or COMEDOGENIC
 * @param risk Irritant risk level, null for comedogenic flags
 * @param rating Comedogenic rating 0-5, null for irritant flags
 * @param concern Human-readable explanation
 */
public record SafetyFlag(String ingredient, FlagType type, Severity risk, Integer rating, String concern)
        implements Serializable {

    public enum FlagType {
        IRRITANT,
        COMEDOGENIC
    }
}
