package com.purchasingpower.concierge.model.dto;

import com.purchasingpower.concierge.safety.Violation;
import com.purchasingpower.concierge.workflow.state.ConciergeState;
import com.purchasingpower.concierge.workflow.state.Intent;
import com.purchasingpower.concierge.workflow.state.RecommendedProduct;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one turn, handed to whatever transport delivers it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConciergeReply {
    private String conversationId;
    private String reply;
    private Intent intent;

    @Builder.Default
    private List<RecommendedProduct> recommendations = new ArrayList<>();

    @Builder.Default
    private List<Violation> violations = new ArrayList<>();

    private boolean allVetoed;

    /**
     * True when constraints could not be loaded and the turn failed closed.
     */
    private boolean recommendationsBlocked;

    @Builder.Default
    private List<String> notifications = new ArrayList<>();

    @Builder.Default
    private List<String> conflictPrompts = new ArrayList<>();

    public static ConciergeReply fromState(ConciergeState state) {
        return ConciergeReply.builder()
                .conversationId(state.getConversationId())
                .reply(state.getReply())
                .intent(state.getIntent())
                .recommendations(new ArrayList<>(state.getRecommendations()))
                .violations(new ArrayList<>(state.getViolations()))
                .allVetoed(state.isAllVetoed())
                .recommendationsBlocked(state.isRecommendationsBlocked())
                .notifications(new ArrayList<>(state.getNotifications()))
                .conflictPrompts(new ArrayList<>(state.getConflictPrompts()))
                .build();
    }

    public static ConciergeReply overrideBlocked(String conversationId, String refusal) {
        return ConciergeReply.builder()
                .conversationId(conversationId)
                .reply(refusal)
                .intent(Intent.SAFETY_OVERRIDE_BLOCKED)
                .build();
    }
}
