package com.purchasingpower.concierge.ontology;

import java.io.Serializable;

/**
 * Advisory warning about two ingredients of one product that should not be combined.
 *
 * @param ingredientA Ingredient matched from the rule's first group, original spelling
 * @param ingredientB Ingredient matched from the rule's second group, original spelling
 * @param severity Rule severity
 * @param label Rule label, unique within one product's warnings
 * @param concern Explanation shown to the user
 */
public record InteractionWarning(
        String ingredientA,
        String ingredientB,
        Severity severity,
        String label,
        String concern
) implements Serializable {
}
