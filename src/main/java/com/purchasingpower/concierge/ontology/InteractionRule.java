package com.purchasingpower.concierge.ontology;

import java.util.List;

/**
 * One entry of the ingredient interaction table.
 *
 * Entries are directional data: {@code groupA → groupB} does not imply a
 * reverse entry. See {@link InteractionTable#missingReverseEntries()}.
 *
 * @param groupA First ingredient group, normalized, in lookup order
 * @param groupB Second ingredient group, normalized, in lookup order
 * @param severity How serious the combination is
 * @param label Short label, unique per rule
 * @param concern Human-readable explanation
 */
public record InteractionRule(List<String> groupA, List<String> groupB, Severity severity, String label, String concern) {

    public InteractionRule {
        groupA = groupA.stream().map(IngredientParser::normalize).toList();
        groupB = groupB.stream().map(IngredientParser::normalize).toList();
    }
}
