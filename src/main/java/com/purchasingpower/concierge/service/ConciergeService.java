package com.purchasingpower.concierge.service;

import com.purchasingpower.concierge.memory.extraction.ExtractionRequest;
import com.purchasingpower.concierge.memory.extraction.FactExtractionQueue;
import com.purchasingpower.concierge.model.dto.ConciergeReply;
import com.purchasingpower.concierge.model.dto.ConciergeRequest;
import com.purchasingpower.concierge.safety.OverrideAttemptDetector;
import com.purchasingpower.concierge.workflow.ConciergeWorkflow;
import com.purchasingpower.concierge.workflow.state.ChatMessage;
import com.purchasingpower.concierge.workflow.state.ConciergeState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for one conversational turn.
 *
 * The override check runs first, synchronously, before any model or store call.
 * A detected override attempt (or a failure inside the detector) ends the turn
 * with the fixed refusal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConciergeService {

    private final OverrideAttemptDetector overrideDetector;
    private final ConciergeWorkflow workflow;
    private final FactExtractionQueue extractionQueue;

    public ConciergeReply handleTurn(ConciergeRequest request) {
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new IllegalArgumentException("A turn requires a user id");
        }
        String conversationId = request.getConversationId();
        String message = request.getMessage() != null ? request.getMessage() : "";

        if (isBlocked(message)) {
            log.info("🛑 Turn blocked for conversation {}: safety override attempt", conversationId);
            return ConciergeReply.overrideBlocked(conversationId, OverrideAttemptDetector.REFUSAL);
        }

        List<ChatMessage> history = request.getHistory() != null ? request.getHistory() : List.of();

        Map<String, Object> input = new HashMap<>();
        input.put(ConciergeState.USER_ID, request.getUserId());
        if (conversationId != null) {
            input.put(ConciergeState.CONVERSATION_ID, conversationId);
        }
        input.put(ConciergeState.MESSAGE, message);
        input.put(ConciergeState.HISTORY, new ArrayList<>(history));

        ConciergeState state = workflow.run(input);
        ConciergeReply reply = ConciergeReply.fromState(state);

        scheduleExtraction(request, history, message, reply.getReply());

        log.info("✅ Turn complete for conversation {}: intent={}, recommendations={}, violations={}",
                conversationId, reply.getIntent().getLabel(), reply.getRecommendations().size(), reply.getViolations().size());
        return reply;
    }

    private boolean isBlocked(String message) {
        try {
            return overrideDetector.isOverrideAttempt(message);
        } catch (RuntimeException e) {
            log.error("Override detection failed - blocking turn", e);
            return true;
        }
    }

    private void scheduleExtraction(ConciergeRequest request, List<ChatMessage> history, String message, String reply) {
        if (request.getConversationId() == null) {
            return;
        }
        List<ChatMessage> transcript = new ArrayList<>(history);
        transcript.add(ChatMessage.user(message));
        if (reply != null) {
            transcript.add(ChatMessage.assistant(reply));
        }
        try {
            extractionQueue.schedule(new ExtractionRequest(request.getConversationId(), request.getUserId(), transcript));
        } catch (RuntimeException e) {
            log.warn("Could not schedule fact extraction for conversation {}: {}", request.getConversationId(), e.getMessage());
        }
    }
}
