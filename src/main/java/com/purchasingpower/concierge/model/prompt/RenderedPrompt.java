package com.purchasingpower.concierge.model.prompt;

/**
 * A prompt template after variable substitution.
 *
 * @param systemPrompt Rendered system instructions
 * @param userPrompt Rendered user turn, empty when the template has none
 */
public record RenderedPrompt(String systemPrompt, String userPrompt) {
}
