package com.purchasingpower.concierge.memory;

import java.io.Serializable;
import java.util.List;

/**
 * @param constraints Loaded constraints; empty when loading failed
 * @param failed True when the store could not be read in time
 */
public record ConstraintLoadResult(List<Constraint> constraints, boolean failed) implements Serializable {

    public ConstraintLoadResult {
        constraints = List.copyOf(constraints);
    }

    public static ConstraintLoadResult loaded(List<Constraint> constraints) {
        return new ConstraintLoadResult(constraints, false);
    }

    public static ConstraintLoadResult failure() {
        return new ConstraintLoadResult(List.of(), true);
    }

    /**
     * Ingredients that must be filtered out (allergies and sensitivities).
     */
    public List<String> enforcedIngredients() {
        return constraints.stream()
                .filter(c -> c.severity().isEnforced())
                .map(Constraint::ingredient)
                .distinct()
                .toList();
    }
}
