package com.purchasingpower.concierge.model.dto;

import com.purchasingpower.concierge.workflow.state.ChatMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One inbound user message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConciergeRequest {
    private String userId;
    private String conversationId;
    private String message;

    /**
     * Earlier messages of the conversation, oldest first, excluding {@link #message}.
     */
    @Builder.Default
    private List<ChatMessage> history = new ArrayList<>();
}
