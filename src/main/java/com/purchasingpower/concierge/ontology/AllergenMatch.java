package com.purchasingpower.concierge.ontology;

import java.io.Serializable;

/**
 * One ingredient of a product that hit a declared allergen.
 *
 * @param ingredient Ingredient as it appeared in the product list
 * @param allergen The declared allergen (DIRECT) or the group name (GROUP)
 * @param matchType How the match was made
 */
public record AllergenMatch(String ingredient, String allergen, MatchType matchType) implements Serializable {
}
