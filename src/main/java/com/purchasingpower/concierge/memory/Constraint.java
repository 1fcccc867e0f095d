package com.purchasingpower.concierge.memory;

import java.io.Serializable;

/**
 * Ingredient or allergen group the user must not be recommended.
 * Never mutated; replaced or deleted.
 *
 * @param ingredient Ingredient or group name as stated
 * @param severity How strictly it is enforced
 * @param source Where it came from
 * @param content Readable summary, e.g. "Allergic to parabens"
 */
public record Constraint(String ingredient, ConstraintSeverity severity, ConstraintSource source, String content)
        implements Serializable {

    public static Constraint of(String ingredient, ConstraintSeverity severity, ConstraintSource source) {
        String content = switch (severity) {
            case ABSOLUTE -> "Allergic to " + ingredient;
            case HIGH -> "Sensitive to " + ingredient;
            case PREFERENCE -> "Prefers to avoid " + ingredient;
        };
        return new Constraint(ingredient, severity, source, content);
    }
}
