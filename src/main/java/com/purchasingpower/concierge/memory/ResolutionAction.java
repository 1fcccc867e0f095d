package com.purchasingpower.concierge.memory;

public enum ResolutionAction {
    /** Drop the old fact; the new one is already stored. */
    ACCEPT_NEW,
    /** Keep the old fact with a qualifier next to the new one. */
    KEEP_BOTH,
    /** Count one more unanswered surfacing. */
    IGNORE
}
