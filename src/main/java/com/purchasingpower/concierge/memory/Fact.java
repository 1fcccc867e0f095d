package com.purchasingpower.concierge.memory;

/**
 * Something the user stated about themselves.
 *
 * @param category What kind of fact
 * @param value Stated value, e.g. "oily" or "fragrance"
 * @param sourceText Message the fact was taken from
 */
public record Fact(FactCategory category, String value, String sourceText) {

    /**
     * One-line form used in memory context, e.g. {@code skin_type: oily}.
     */
    public String describe() {
        return category.getLabel() + ": " + value;
    }
}
