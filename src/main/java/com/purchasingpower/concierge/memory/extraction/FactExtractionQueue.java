package com.purchasingpower.concierge.memory.extraction;

import com.purchasingpower.concierge.client.GenerativeTextService;
import com.purchasingpower.concierge.configuration.AppProperties;
import com.purchasingpower.concierge.configuration.MemoryProperties;
import com.purchasingpower.concierge.memory.Fact;
import com.purchasingpower.concierge.memory.FactCategory;
import com.purchasingpower.concierge.memory.LongTermMemoryService;
import com.purchasingpower.concierge.model.prompt.RenderedPrompt;
import com.purchasingpower.concierge.service.PromptLibraryService;
import com.purchasingpower.concierge.workflow.state.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;

/**
 * Delayed background mining of conversation transcripts for long-term facts.
 *
 * Keyed by conversation id: scheduling again cancels the conversation's pending
 * extraction and restarts the delay, and a transcript that was already mined
 * up to its current length is skipped. The mined length is kept in the fact
 * store; the queue itself only tracks conversations with a task in flight.
 */
@Slf4j
@Component
public class FactExtractionQueue {

    private static final String NONE = "none";

    private final TaskScheduler scheduler;
    private final GenerativeTextService textService;
    private final PromptLibraryService promptLibrary;
    private final LongTermMemoryService memoryService;
    private final MemoryProperties.Extraction properties;

    private final Map<String, ExtractionHandle> pending = new ConcurrentHashMap<>();

    public FactExtractionQueue(
            @Qualifier("extractionScheduler") TaskScheduler scheduler,
            @Qualifier("deterministicTextService") GenerativeTextService textService,
            PromptLibraryService promptLibrary,
            LongTermMemoryService memoryService,
            AppProperties appProperties) {
        this.scheduler = scheduler;
        this.textService = textService;
        this.promptLibrary = promptLibrary;
        this.memoryService = memoryService;
        this.properties = appProperties.getMemory().getExtraction();
    }

    public Optional<ExtractionHandle> schedule(ExtractionRequest request) {
        if (!properties.isEnabled()) {
            return Optional.empty();
        }

        String conversationId = request.conversationId();
        if (memoryService.processedMessages(request.userId(), conversationId) >= request.transcript().size()) {
            log.debug("Conversation {} already processed", conversationId);
            return Optional.empty();
        }

        ExtractionHandle previous = pending.remove(conversationId);
        if (previous != null && previous.cancel()) {
            log.debug("Cancelled pending extraction for conversation {}", conversationId);
        }

        CompletableFuture<List<Fact>> completion = new CompletableFuture<>();
        ScheduledFuture<?> task = scheduler.schedule(
                () -> run(request, completion),
                Instant.now().plus(properties.getDelay()));

        ExtractionHandle handle = new ExtractionHandle(conversationId, task, completion);
        pending.put(conversationId, handle);
        if (completion.isDone()) {
            pending.remove(conversationId, handle);
        }
        log.debug("Fact extraction scheduled for conversation {} in {}", conversationId, properties.getDelay());
        return Optional.of(handle);
    }

    public boolean isPending(String conversationId) {
        return pending.containsKey(conversationId);
    }

    private void run(ExtractionRequest request, CompletableFuture<List<Fact>> completion) {
        String conversationId = request.conversationId();
        try {
            List<Fact> facts = extract(request);
            memoryService.ingest(request.userId(), facts);
            memoryService.markProcessed(request.userId(), conversationId, request.transcript().size());
            log.info("Background extraction for conversation {}: {} fact(s) from {} messages",
                    conversationId, facts.size(), request.transcript().size());
            release(conversationId, completion);
            completion.complete(facts);
        } catch (RuntimeException e) {
            log.warn("Background extraction failed for conversation {}: {}", conversationId, e.getMessage());
            release(conversationId, completion);
            completion.completeExceptionally(e);
        }
    }

    // a newer handle for the same conversation stays registered
    private void release(String conversationId, CompletableFuture<List<Fact>> completion) {
        pending.computeIfPresent(conversationId, (id, handle) -> handle.completion() == completion ? null : handle);
    }

    private List<Fact> extract(ExtractionRequest request) {
        String transcript = request.transcript().stream()
                .map(m -> m.getRole() + ": " + m.getContent())
                .collect(Collectors.joining("\n"));

        RenderedPrompt prompt = promptLibrary.render("fact-extraction", Map.of("transcript", transcript));
        String reply = textService.generate(prompt.systemPrompt(),
                List.of(ChatMessage.user(prompt.userPrompt())), "FactExtraction");

        return parse(reply, "conversation " + request.conversationId());
    }

    /**
     * Parse {@code category: value} lines; anything else is ignored.
     */
    static List<Fact> parse(String reply, String sourceText) {
        List<Fact> facts = new ArrayList<>();
        if (reply == null) {
            return facts;
        }
        for (String raw : reply.split("\\R")) {
            String line = raw.strip();
            if (line.startsWith("-")) {
                line = line.substring(1).strip();
            }
            int colon = line.indexOf(':');
            if (line.isEmpty() || line.equalsIgnoreCase(NONE) || colon <= 0) {
                continue;
            }
            String value = line.substring(colon + 1).strip();
            if (value.isEmpty()) {
                continue;
            }
            FactCategory.fromLabel(line.substring(0, colon))
                    .ifPresent(category -> facts.add(new Fact(category, value.toLowerCase(Locale.ROOT), sourceText)));
        }
        return facts;
    }
}
