package com.purchasingpower.concierge.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class SafetyProperties {

    /**
     * Whether the probabilistic (LLM) gate runs after the rule-based gate.
     */
    private boolean llmCheckEnabled = true;

    /**
     * Upper bound for the single LLM safety check attempt per turn.
     * On expiry the turn keeps the rule-based survivors.
     */
    @NotNull
    private Duration llmCheckTimeout = Duration.ofSeconds(10);

    /**
     * Ingredients per product included in the LLM safety prompt.
     */
    @Min(1)
    private int maxIngredientsInPrompt = 30;

    /**
     * What a turn does when the user's constraints cannot be loaded.
     */
    @NotNull
    private ConstraintLoadFailurePolicy constraintLoadFailurePolicy = ConstraintLoadFailurePolicy.FAIL_CLOSED;

    public enum ConstraintLoadFailurePolicy {
        /** Block recommendations for the turn. */
        FAIL_CLOSED,
        /** Proceed with an empty constraint set. */
        FAIL_OPEN
    }
}
