package com.purchasingpower.concierge.workflow.agents;

import com.purchasingpower.concierge.configuration.AppProperties;
import com.purchasingpower.concierge.configuration.SafetyProperties;
import com.purchasingpower.concierge.ontology.AllergenMatcher;
import com.purchasingpower.concierge.workflow.state.ConciergeState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Map;
import java.util.Set;

/**
 * Expands the user's constraints into every token discovery and the safety gates
 * must avoid. Blocks recommendations when constraints could not be loaded and the
 * failure policy is FAIL_CLOSED.
 */
@Slf4j
@Component
public class SafetyPreFilterAgent {

    private final AllergenMatcher matcher;
    private final SafetyProperties properties;

    public SafetyPreFilterAgent(AllergenMatcher matcher, AppProperties appProperties) {
        this.matcher = matcher;
        this.properties = appProperties.getSafety();
    }

    public Map<String, Object> execute(ConciergeState state) {
        if (state.isConstraintsLoadFailed()
                && properties.getConstraintLoadFailurePolicy() == SafetyProperties.ConstraintLoadFailurePolicy.FAIL_CLOSED) {
            log.warn("🛑 Constraints unavailable for user {} - recommendations blocked this turn", state.getUserId());
            return Map.of(ConciergeState.RECOMMENDATIONS_BLOCKED, true);
        }

        Set<String> expanded = matcher.expand(state.getConstraints());
        log.info("Safety pre-filter: {} constraint(s) expanded to {} token(s)",
                state.getConstraints().size(), expanded.size());

        return Map.of(
                ConciergeState.EXPANDED_CONSTRAINTS, new ArrayList<>(expanded),
                ConciergeState.RECOMMENDATIONS_BLOCKED, false
        );
    }
}
