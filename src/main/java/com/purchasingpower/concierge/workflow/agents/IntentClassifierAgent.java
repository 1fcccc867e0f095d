package com.purchasingpower.concierge.workflow.agents;

import com.purchasingpower.concierge.client.GenerativeTextService;
import com.purchasingpower.concierge.memory.Constraint;
import com.purchasingpower.concierge.memory.ConstraintLoadResult;
import com.purchasingpower.concierge.memory.Fact;
import com.purchasingpower.concierge.memory.FactDetector;
import com.purchasingpower.concierge.memory.LongTermMemoryService;
import com.purchasingpower.concierge.memory.MemoryConflictResolver;
import com.purchasingpower.concierge.memory.PendingConfirmation;
import com.purchasingpower.concierge.model.prompt.RenderedPrompt;
import com.purchasingpower.concierge.service.PromptLibraryService;
import com.purchasingpower.concierge.workflow.state.ChatMessage;
import com.purchasingpower.concierge.workflow.state.ConciergeState;
import com.purchasingpower.concierge.workflow.state.Intent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry node of every turn.
 *
 * <ol>
 *   <li>Surfaces pending memory confirmations and loads stored facts as context.</li>
 *   <li>Classifies the message intent (failure → general_chat).</li>
 *   <li>Stores self-statements found in the message.</li>
 *   <li>Loads the user's constraints, including any declared in this message.</li>
 * </ol>
 */
@Slf4j
@Component
public class IntentClassifierAgent {

    private final GenerativeTextService textService;
    private final PromptLibraryService promptLibrary;
    private final LongTermMemoryService memoryService;
    private final FactDetector factDetector;

    public IntentClassifierAgent(
            @Qualifier("deterministicTextService") GenerativeTextService textService,
            PromptLibraryService promptLibrary,
            LongTermMemoryService memoryService,
            FactDetector factDetector) {
        this.textService = textService;
        this.promptLibrary = promptLibrary;
        this.memoryService = memoryService;
        this.factDetector = factDetector;
    }

    public Map<String, Object> execute(ConciergeState state) {
        String userId = state.getUserId();
        String message = state.getMessage();
        Map<String, Object> updates = new HashMap<>();

        List<String> memoryContext = new ArrayList<>(memoryService.loadFactContext(userId));
        List<PendingConfirmation> surfaced = memoryService.surfacePendingConfirmations(userId);
        if (!surfaced.isEmpty()) {
            memoryContext.add(MemoryConflictResolver.formatPrompt(surfaced));
            updates.put(ConciergeState.CONFLICT_PROMPTS,
                    new ArrayList<>(surfaced.stream().map(PendingConfirmation::toPrompt).toList()));
            log.info("⚖️ Surfacing {} pending confirmation(s) for user {}", surfaced.size(), userId);
        }

        Intent intent = classify(message);
        updates.put(ConciergeState.INTENT, intent);

        List<Fact> facts = factDetector.detect(message);
        if (!facts.isEmpty()) {
            List<String> notifications = memoryService.ingest(userId, facts);
            if (!notifications.isEmpty()) {
                updates.put(ConciergeState.NOTIFICATIONS, new ArrayList<>(notifications));
            }
        }

        ConstraintLoadResult constraints = memoryService.loadConstraints(userId);
        updates.put(ConciergeState.CONSTRAINTS, new ArrayList<>(constraints.enforcedIngredients()));
        updates.put(ConciergeState.CONSTRAINTS_LOAD_FAILED, constraints.failed());
        constraints.constraints().stream().map(Constraint::content).forEach(memoryContext::add);

        if (!memoryContext.isEmpty()) {
            updates.put(ConciergeState.MEMORY_CONTEXT, memoryContext);
        }

        log.info("🔀 Intent: {} (constraints={}, facts detected={})",
                intent.getLabel(), constraints.failed() ? "load failed" : constraints.constraints().size(), facts.size());
        return updates;
    }

    private Intent classify(String message) {
        if (message == null || message.isBlank()) {
            return Intent.GENERAL_CHAT;
        }
        try {
            RenderedPrompt prompt = promptLibrary.render("intent-classification", Map.of("message", message));
            String raw = textService.generate(prompt.systemPrompt(),
                    List.of(ChatMessage.user(prompt.userPrompt())), "IntentClassifier");
            Intent intent = Intent.fromLabel(raw);
            if (intent == Intent.UNRECOGNIZED) {
                log.warn("Unknown intent from classifier: '{}'", raw.strip());
            }
            return intent;
        } catch (RuntimeException e) {
            log.error("Intent classification failed, defaulting to general_chat: {}", e.getMessage());
            return Intent.GENERAL_CHAT;
        }
    }
}
