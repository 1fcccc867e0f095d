package com.purchasingpower.concierge.workflow.agents;

import com.purchasingpower.concierge.client.GenerativeTextService;
import com.purchasingpower.concierge.model.prompt.RenderedPrompt;
import com.purchasingpower.concierge.ontology.InteractionWarning;
import com.purchasingpower.concierge.safety.Violation;
import com.purchasingpower.concierge.service.PromptLibraryService;
import com.purchasingpower.concierge.workflow.state.ChatMessage;
import com.purchasingpower.concierge.workflow.state.ConciergeState;
import com.purchasingpower.concierge.workflow.state.RecommendedProduct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Terminal node: merges memory, safety results and recommendations into the
 * response prompt and asks the response model for the reply.
 */
@Slf4j
@Component
public class ResponseAgent {

    public static final String FAILURE_REPLY =
            "I'm sorry, I encountered an issue generating a response. Please try again.";

    private final GenerativeTextService textService;
    private final PromptLibraryService promptLibrary;

    public ResponseAgent(
            @Qualifier("responseTextService") GenerativeTextService textService,
            PromptLibraryService promptLibrary) {
        this.textService = textService;
        this.promptLibrary = promptLibrary;
    }

    public Map<String, Object> execute(ConciergeState state) {
        String context = buildContext(state);

        List<ChatMessage> messages = new ArrayList<>(state.getHistory());
        messages.add(ChatMessage.user(state.getMessage()));

        String reply;
        try {
            RenderedPrompt prompt = promptLibrary.render("response", Map.of("context", context));
            reply = textService.generate(prompt.systemPrompt(), messages, "ResponseSynthesis").strip();
        } catch (RuntimeException e) {
            log.error("Response synthesis failed: {}", e.getMessage());
            reply = FAILURE_REPLY;
        }
        return Map.of(ConciergeState.REPLY, reply);
    }

    String buildContext(ConciergeState state) {
        List<String> parts = new ArrayList<>();

        List<String> memory = state.getMemoryContext();
        if (!memory.isEmpty()) {
            parts.add("User context from previous conversations:\n" + bullets(memory));
        }

        List<String> notifications = state.getNotifications();
        if (!notifications.isEmpty()) {
            parts.add("Let the user know you saved what they told you:\n" + bullets(notifications));
        }

        if (!state.getIntent().recommendsProducts()) {
            return String.join("\n\n", parts);
        }

        if (state.isRecommendationsBlocked()) {
            parts.add("The user's allergy and sensitivity profile could not be loaded, so no products can be "
                    + "recommended right now. Apologize briefly and suggest trying again shortly.");
            return String.join("\n\n", parts);
        }

        List<Violation> violations = state.getViolations();
        if (!violations.isEmpty()) {
            parts.add("Safety violations found:\n" + violations.stream()
                    .map(v -> "- " + v.productName() + ": flagged for " + v.reason())
                    .collect(Collectors.joining("\n")));
        }

        List<RecommendedProduct> recommendations = state.getRecommendations();
        if (!recommendations.isEmpty()) {
            parts.add("Safe products found:\n" + recommendations.stream()
                    .map(ResponseAgent::describe)
                    .collect(Collectors.joining("\n")));
        } else if (state.isAllVetoed()) {
            parts.add("All products were filtered out due to safety constraints. "
                    + "Suggest the user broaden their search or offer general advice.");
        }

        return String.join("\n\n", parts);
    }

    private static String describe(RecommendedProduct recommendation) {
        StringBuilder line = new StringBuilder("- ")
                .append(recommendation.product().getName())
                .append(" by ")
                .append(recommendation.product().getBrand() != null ? recommendation.product().getBrand() : "Unknown")
                .append(" (safety: ")
                .append(recommendation.safetyScore())
                .append("/10)");
        for (InteractionWarning warning : recommendation.interactionWarnings()) {
            line.append("\n  - Interaction warning (").append(warning.severity().name().toLowerCase(Locale.ROOT))
                    .append("): ").append(warning.label()).append(". ").append(warning.concern());
        }
        return line.toString();
    }

    private static String bullets(List<String> lines) {
        return lines.stream().map(l -> "- " + l).collect(Collectors.joining("\n"));
    }
}
