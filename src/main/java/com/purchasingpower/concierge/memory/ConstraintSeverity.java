package com.purchasingpower.concierge.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConstraintSeverity {
    /** Allergy. Always filtered. */
    ABSOLUTE,
    /** Sensitivity. Filtered. */
    HIGH,
    /** Soft dislike. Reported as context only. */
    PREFERENCE;

    public boolean isEnforced() {
        return this != PREFERENCE;
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConstraintSeverity fromJson(String label) {
        return valueOf(label.strip().toUpperCase(Locale.ROOT));
    }
}
