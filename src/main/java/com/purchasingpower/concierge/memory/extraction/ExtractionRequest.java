package com.purchasingpower.concierge.memory.extraction;

import com.purchasingpower.concierge.workflow.state.ChatMessage;

import java.util.List;

/**
 * @param conversationId Idempotency key: one pending extraction per conversation
 * @param userId Owner of the extracted facts
 * @param transcript Messages so far, oldest first
 */
public record ExtractionRequest(String conversationId, String userId, List<ChatMessage> transcript) {

    public ExtractionRequest {
        transcript = List.copyOf(transcript);
    }
}
