package com.purchasingpower.concierge.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum FactCategory {
    SKIN_TYPE("skin_type"),
    AGE("age"),
    ALLERGY("allergy"),
    SENSITIVITY("sensitivity"),
    PREFERENCE("preference"),
    AVERSION("aversion");

    private final String label;

    FactCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Optional<FactCategory> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String wanted = label.strip().toLowerCase(Locale.ROOT).replace(' ', '_');
        return Arrays.stream(values()).filter(c -> c.label.equals(wanted)).findFirst();
    }

    @JsonCreator
    public static FactCategory fromJson(String label) {
        return fromLabel(label).orElseThrow(() -> new IllegalArgumentException("Unknown fact category: " + label));
    }
}
