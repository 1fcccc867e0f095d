package com.purchasingpower.concierge.ontology;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scores a product's ingredient list against irritant and comedogenic tables.
 *
 * Scoring starts at 10. Irritants cost 2.0 / 1.0 / 0.5 for high / medium / low
 * risk; comedogenic ratings of 4-5 cost 1.5 and a rating of 3 costs 0.5.
 * An empty list scores a neutral 5.0.
 */
public class SafetyIndex {

    private static final double MAX_SCORE = 10.0;
    private static final double UNKNOWN_SCORE = 5.0;

    private final String version;
    private final Map<String, Irritant> irritants;
    private final Map<String, Integer> comedogenic;

    public SafetyIndex(String version, Map<String, Irritant> irritants, Map<String, Integer> comedogenic) {
        this.version = version;
        this.irritants = Map.copyOf(irritants);
        this.comedogenic = Map.copyOf(comedogenic);
    }

    public String getVersion() {
        return version;
    }

    public SafetyAssessment score(List<String> ingredients) {
        if (ingredients == null || ingredients.isEmpty()) {
            return new SafetyAssessment(UNKNOWN_SCORE, List.of());
        }

        double score = MAX_SCORE;
        List<SafetyFlag> flags = new ArrayList<>();

        for (String ingredient : ingredients) {
            String normalized = IngredientParser.normalize(ingredient);

            Irritant irritant = irritants.get(normalized);
            if (irritant != null) {
                score -= penalty(irritant.risk());
                flags.add(new SafetyFlag(ingredient, SafetyFlag.FlagType.IRRITANT,
                        irritant.risk(), null, irritant.concern()));
            }

            Integer rating = comedogenic.get(normalized);
            if (rating != null && rating >= 3) {
                score -= rating >= 4 ? 1.5 : 0.5;
                flags.add(new SafetyFlag(ingredient, SafetyFlag.FlagType.COMEDOGENIC,
                        null, rating, "comedogenic rating " + rating + "/5"));
            }
        }

        double clamped = Math.max(0.0, Math.min(MAX_SCORE, score));
        return new SafetyAssessment(Math.round(clamped * 10.0) / 10.0, flags);
    }

    private static double penalty(Severity risk) {
        return switch (risk) {
            case HIGH -> 2.0;
            case MEDIUM -> 1.0;
            case LOW -> 0.5;
        };
    }

    /**
     * @param risk How strongly the ingredient irritates
     * @param concern Explanation
     */
    public record Irritant(Severity risk, String concern) {
    }
}
