package com.purchasingpower.concierge.model;

/**
 * External collaborators whose calls are logged through
 * {@link com.purchasingpower.concierge.util.ExternalCallLogger}.
 */
public enum ServiceType {
    LLM("🔴", "LLM"),
    FACT_STORE("🟢", "FactStore"),
    CATALOG("🔵", "Catalog");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
