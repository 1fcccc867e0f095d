package com.purchasingpower.concierge.safety;

public enum Gate {
    /** Deterministic allergen match against the ontology. */
    RULE_BASED,
    /** Generative second opinion on rule-based survivors. */
    LLM_CHECK
}
