package com.purchasingpower.concierge.safety;

import com.purchasingpower.concierge.ontology.AllergenMatch;
import com.purchasingpower.concierge.ontology.MatchType;

import java.io.Serializable;
import java.util.List;

/**
 * Record of one vetoed candidate.
 *
 * @param productName Name of the removed candidate
 * @param matchedIngredient First offending ingredient (null for LLM_CHECK)
 * @param matchedAllergen Allergen or group it hit (null for LLM_CHECK)
 * @param matchType DIRECT or GROUP (null for LLM_CHECK)
 * @param gate Gate that removed the candidate
 * @param reason Human-readable reason
 * @param matches Every allergen match found by the rule-based gate
 */
public record Violation(
        String productName,
        String matchedIngredient,
        String matchedAllergen,
        MatchType matchType,
        Gate gate,
        String reason,
        List<AllergenMatch> matches
) implements Serializable {

    public Violation {
        matches = matches != null ? List.copyOf(matches) : List.of();
    }

    public static Violation ruleBased(String productName, List<AllergenMatch> matches) {
        AllergenMatch first = matches.get(0);
        String reason = "Contains " + first.ingredient() + " (" + first.allergen() + ")";
        return new Violation(productName, first.ingredient(), first.allergen(), first.matchType(),
                Gate.RULE_BASED, reason, matches);
    }

    public static Violation llmCheck(String productName, String reason) {
        return new Violation(productName, null, null, null, Gate.LLM_CHECK, reason, List.of());
    }
}
