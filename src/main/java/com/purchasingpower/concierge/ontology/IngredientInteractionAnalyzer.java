package com.purchasingpower.concierge.ontology;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flags incompatible ingredient combinations within a single product.
 * Advisory only: it never removes a product.
 */
@Component
@RequiredArgsConstructor
public class IngredientInteractionAnalyzer {

    private final InteractionTable table;

    public List<InteractionWarning> findInteractions(List<String> ingredients) {
        List<InteractionWarning> warnings = new ArrayList<>();
        if (ingredients == null || ingredients.isEmpty()) {
            return warnings;
        }

        // normalized -> first original spelling
        Map<String, String> present = new LinkedHashMap<>();
        for (String ingredient : ingredients) {
            present.putIfAbsent(IngredientParser.normalize(ingredient), ingredient);
        }

        Set<String> seenLabels = new HashSet<>();
        for (InteractionRule rule : table.rules()) {
            String matchA = firstPresent(rule.groupA(), present);
            if (matchA == null) {
                continue;
            }
            String matchB = firstPresent(rule.groupB(), present);
            if (matchB == null) {
                continue;
            }
            if (!seenLabels.add(rule.label())) {
                continue;
            }
            warnings.add(new InteractionWarning(matchA, matchB, rule.severity(), rule.label(), rule.concern()));
        }
        return warnings;
    }

    private static String firstPresent(List<String> group, Map<String, String> present) {
        for (String member : group) {
            String original = present.get(member);
            if (original != null) {
                return original;
            }
        }
        return null;
    }
}
