package com.purchasingpower.concierge.memory;

import java.time.Instant;

/**
 * Unresolved contradiction between a stored fact and a newer statement.
 *
 * @param category Contradiction-eligible category
 * @param oldKey Store key of the older fact
 * @param oldValue Older value
 * @param newValue Newly stated value
 * @param detectedAt When the contradiction was found
 * @param attempts Turns it has been surfaced without an explicit answer
 * @param sourceQuote Statement that raised it
 */
public record PendingConfirmation(
        FactCategory category,
        String oldKey,
        String oldValue,
        String newValue,
        Instant detectedAt,
        int attempts,
        String sourceQuote
) {

    public PendingConfirmation withAttempts(int newAttempts) {
        return new PendingConfirmation(category, oldKey, oldValue, newValue, detectedAt, newAttempts, sourceQuote);
    }

    /**
     * Instruction for the response layer to raise this naturally.
     */
    public String toPrompt() {
        String cat = category.getLabel();
        return "The user previously mentioned having " + oldValue + " " + cat
                + ", but recently indicated " + newValue + " " + cat + ". "
                + "Naturally ask if their " + cat + " has changed or if it varies seasonally.";
    }
}
