package com.purchasingpower.concierge.client;

import com.purchasingpower.concierge.workflow.state.ChatMessage;

import java.util.List;

/**
 * Opaque generative text collaborator.
 *
 * Implementations may fail or be slow; callers decide whether a failure is
 * fatal for them. Failures surface as {@link com.purchasingpower.concierge.exception.GenerativeServiceException}.
 */
public interface GenerativeTextService {

    /**
     * Generate a reply.
     *
     * @param systemPrompt Instructions for the model
     * @param messages Conversation messages, oldest first
     * @param caller Name of the calling component (for logging)
     * @return The generated text, never blank
     */
    String generate(String systemPrompt, List<ChatMessage> messages, String caller);
}
