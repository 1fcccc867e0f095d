package com.purchasingpower.concierge.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConstraintSource {
    USER_STATED,
    USER_API,
    MIGRATED;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConstraintSource fromJson(String label) {
        return valueOf(label.strip().toUpperCase(Locale.ROOT));
    }
}
