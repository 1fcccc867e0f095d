package com.purchasingpower.concierge.ontology;

import java.io.Serializable;
import java.util.List;

/**
 * @param score 0.0 - 10.0, one decimal
 * @param flags Reasons for every deduction
 */
public record SafetyAssessment(double score, List<SafetyFlag> flags) implements Serializable {

    public SafetyAssessment {
        flags = List.copyOf(flags);
    }
}
