package com.purchasingpower.concierge.workflow.state;

import com.purchasingpower.concierge.catalog.Candidate;
import com.purchasingpower.concierge.safety.SafetyFilterResult;
import com.purchasingpower.concierge.safety.Violation;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request-scoped state of one conversational turn.
 *
 * Merge rules: {@link #VIOLATIONS}, {@link #MEMORY_CONTEXT} and {@link #NOTIFICATIONS}
 * append; every other key is overwritten by the node that returns it. Nodes return
 * only the keys they change.
 */
public class ConciergeState extends AgentState {

    public static final String USER_ID = "userId";
    public static final String CONVERSATION_ID = "conversationId";
    public static final String MESSAGE = "message";
    public static final String HISTORY = "history";
    public static final String INTENT = "intent";
    public static final String CONSTRAINTS = "constraints";
    public static final String CONSTRAINTS_LOAD_FAILED = "constraintsLoadFailed";
    public static final String EXPANDED_CONSTRAINTS = "expandedConstraints";
    public static final String RECOMMENDATIONS_BLOCKED = "recommendationsBlocked";
    public static final String CANDIDATES = "candidates";
    public static final String SAFETY_RESULT = "safetyResult";
    public static final String RECOMMENDATIONS = "recommendations";
    public static final String CONFLICT_PROMPTS = "conflictPrompts";
    public static final String REPLY = "reply";

    public static final String VIOLATIONS = "violations";
    public static final String MEMORY_CONTEXT = "memoryContext";
    public static final String NOTIFICATIONS = "notifications";

    public static final Map<String, Channel<?>> SCHEMA = Map.of(
            VIOLATIONS, appendAll(),
            MEMORY_CONTEXT, appendAll(),
            NOTIFICATIONS, appendAll()
    );

    public ConciergeState(Map<String, Object> initData) {
        super(initData);
    }

    /**
     * Appends every update in order. Equal entries are kept: two same-named
     * products vetoed for the same ingredient are two violations.
     */
    static <T> Channel<List<T>> appendAll() {
        return Channels.<List<T>>base((current, update) -> {
            List<T> merged = current != null ? new ArrayList<>(current) : new ArrayList<>();
            if (update != null) {
                merged.addAll(update);
            }
            return merged;
        }, ArrayList::new);
    }

    public String getUserId() {
        return this.<String>value(USER_ID).orElse(null);
    }

    public String getConversationId() {
        return this.<String>value(CONVERSATION_ID).orElse(null);
    }

    public String getMessage() {
        return this.<String>value(MESSAGE).orElse("");
    }

    public List<ChatMessage> getHistory() {
        return this.<List<ChatMessage>>value(HISTORY).orElse(List.of());
    }

    public Intent getIntent() {
        return this.<Intent>value(INTENT).orElse(Intent.GENERAL_CHAT);
    }

    /**
     * Enforced constraint ingredients as loaded for this turn, before expansion.
     */
    public List<String> getConstraints() {
        return this.<List<String>>value(CONSTRAINTS).orElse(List.of());
    }

    public boolean isConstraintsLoadFailed() {
        return this.<Boolean>value(CONSTRAINTS_LOAD_FAILED).orElse(false);
    }

    public List<String> getExpandedConstraints() {
        return this.<List<String>>value(EXPANDED_CONSTRAINTS).orElse(List.of());
    }

    public boolean isRecommendationsBlocked() {
        return this.<Boolean>value(RECOMMENDATIONS_BLOCKED).orElse(false);
    }

    public List<Candidate> getCandidates() {
        return this.<List<Candidate>>value(CANDIDATES).orElse(List.of());
    }

    public SafetyFilterResult getSafetyResult() {
        return this.<SafetyFilterResult>value(SAFETY_RESULT).orElse(null);
    }

    public boolean isAllVetoed() {
        SafetyFilterResult result = getSafetyResult();
        return result != null && result.allVetoed();
    }

    public List<RecommendedProduct> getRecommendations() {
        return this.<List<RecommendedProduct>>value(RECOMMENDATIONS).orElse(List.of());
    }

    public List<Violation> getViolations() {
        return this.<List<Violation>>value(VIOLATIONS).orElse(List.of());
    }

    public List<String> getMemoryContext() {
        return this.<List<String>>value(MEMORY_CONTEXT).orElse(List.of());
    }

    public List<String> getNotifications() {
        return this.<List<String>>value(NOTIFICATIONS).orElse(List.of());
    }

    public List<String> getConflictPrompts() {
        return this.<List<String>>value(CONFLICT_PROMPTS).orElse(List.of());
    }

    public String getReply() {
        return this.<String>value(REPLY).orElse(null);
    }
}
