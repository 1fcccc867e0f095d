package com.purchasingpower.concierge.workflow.agents;

import com.purchasingpower.concierge.catalog.Candidate;
import com.purchasingpower.concierge.ontology.IngredientInteractionAnalyzer;
import com.purchasingpower.concierge.ontology.InteractionWarning;
import com.purchasingpower.concierge.ontology.SafetyAssessment;
import com.purchasingpower.concierge.ontology.SafetyIndex;
import com.purchasingpower.concierge.safety.DualGateSafetyFilter;
import com.purchasingpower.concierge.safety.SafetyFilterResult;
import com.purchasingpower.concierge.workflow.state.ConciergeState;
import com.purchasingpower.concierge.workflow.state.RecommendedProduct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the dual-gate filter over discovery's candidates, then annotates each
 * survivor with interaction warnings and a safety score.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SafetyPostFilterAgent {

    private final DualGateSafetyFilter safetyFilter;
    private final IngredientInteractionAnalyzer interactionAnalyzer;
    private final SafetyIndex safetyIndex;

    public Map<String, Object> execute(ConciergeState state) {
        SafetyFilterResult result = safetyFilter.filter(state.getCandidates(), state.getExpandedConstraints());

        List<RecommendedProduct> recommendations = new ArrayList<>();
        for (Candidate survivor : result.survivors()) {
            List<String> ingredients = survivor.ingredientList();
            List<InteractionWarning> warnings = interactionAnalyzer.findInteractions(ingredients);
            SafetyAssessment assessment = safetyIndex.score(ingredients);
            recommendations.add(new RecommendedProduct(survivor, warnings, assessment.score(), assessment.flags()));

            if (!warnings.isEmpty()) {
                log.info("⚠️ '{}' has {} interaction warning(s)", survivor.getName(), warnings.size());
            }
        }

        return Map.of(
                ConciergeState.SAFETY_RESULT, result,
                ConciergeState.VIOLATIONS, new ArrayList<>(result.violations()),
                ConciergeState.RECOMMENDATIONS, recommendations
        );
    }
}
