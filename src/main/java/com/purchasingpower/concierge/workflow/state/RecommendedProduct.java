package com.purchasingpower.concierge.workflow.state;

import com.purchasingpower.concierge.catalog.Candidate;
import com.purchasingpower.concierge.ontology.InteractionWarning;
import com.purchasingpower.concierge.ontology.SafetyFlag;

import java.io.Serializable;
import java.util.List;

/**
 * A candidate that survived both safety gates, with advisory annotations.
 *
 * @param product The surviving candidate
 * @param interactionWarnings Incompatible ingredient pairs inside the product
 * @param safetyScore 0.0 - 10.0
 * @param safetyFlags Irritant and comedogenic findings behind the score
 */
public record RecommendedProduct(
        Candidate product,
        List<InteractionWarning> interactionWarnings,
        double safetyScore,
        List<SafetyFlag> safetyFlags
) implements Serializable {

    public RecommendedProduct {
        interactionWarnings = List.copyOf(interactionWarnings);
        safetyFlags = List.copyOf(safetyFlags);
    }
}
