package com.purchasingpower.concierge.memory.extraction;

import com.purchasingpower.concierge.TestFixtures;
import com.purchasingpower.concierge.client.GenerativeTextService;
import com.purchasingpower.concierge.configuration.AppProperties;
import com.purchasingpower.concierge.memory.ConstraintService;
import com.purchasingpower.concierge.memory.Fact;
import com.purchasingpower.concierge.memory.FactCategory;
import com.purchasingpower.concierge.memory.FactDocuments;
import com.purchasingpower.concierge.memory.LongTermMemoryService;
import com.purchasingpower.concierge.memory.MemoryConflictResolver;
import com.purchasingpower.concierge.memory.store.FactNamespace;
import com.purchasingpower.concierge.memory.store.InMemoryFactStore;
import com.purchasingpower.concierge.workflow.state.ChatMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Fact Extraction Queue Tests")
class FactExtractionQueueTest {

    private static final String USER = "user-1";

    private final AtomicInteger calls = new AtomicInteger();

    private AppProperties properties;
    private ThreadPoolTaskScheduler scheduler;
    private LongTermMemoryService memoryService;
    private ConstraintService constraintService;
    private InMemoryFactStore store;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.getMemory().getExtraction().setDelay(Duration.ofMillis(50));

        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.initialize();

        store = new InMemoryFactStore();
        FactDocuments documents = TestFixtures.documents();
        constraintService = new ConstraintService(store, documents);
        memoryService = new LongTermMemoryService(store, documents, constraintService,
                new MemoryConflictResolver(store, documents, properties), properties, TestFixtures.DIRECT);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private FactExtractionQueue queue(String reply) {
        GenerativeTextService textService = (systemPrompt, messages, caller) -> {
            calls.incrementAndGet();
            return reply;
        };
        return new FactExtractionQueue(scheduler, textService, TestFixtures.prompts(), memoryService, properties);
    }

    private static ExtractionRequest request(String conversationId, String... userMessages) {
        List<ChatMessage> transcript = Arrays.stream(userMessages).map(ChatMessage::user).toList();
        return new ExtractionRequest(conversationId, USER, transcript);
    }

    @Test
    @DisplayName("Extraction should run after the delay and store the facts it finds")
    void testSchedule_RunsAndIngests() throws Exception {
        FactExtractionQueue queue = queue("allergy: Parabens\nskin_type: combination");

        ExtractionHandle handle = queue.schedule(request("conv-1", "parabens make me itch")).orElseThrow();
        List<Fact> facts = handle.completion().get(5, TimeUnit.SECONDS);

        assertEquals(2, facts.size());
        assertEquals(List.of("parabens"),
                memoryService.loadConstraints(USER).enforcedIngredients());
        assertFalse(queue.isPending("conv-1"));
    }

    @Test
    @DisplayName("A newer turn should cancel the pending extraction of the same conversation")
    void testSchedule_ReschedulingCancelsPrevious() throws Exception {
        properties.getMemory().getExtraction().setDelay(Duration.ofMillis(500));
        FactExtractionQueue queue = queue("NONE");

        ExtractionHandle first = queue.schedule(request("conv-1", "hello")).orElseThrow();
        ExtractionHandle second = queue.schedule(request("conv-1", "hello", "I have dry skin")).orElseThrow();

        assertTrue(first.isCancelled());
        assertTrue(queue.isPending("conv-1"));

        assertTrue(second.completion().get(5, TimeUnit.SECONDS).isEmpty());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("A transcript already mined up to its length should be skipped")
    void testSchedule_AlreadyProcessed() throws Exception {
        FactExtractionQueue queue = queue("skin_type: oily");

        queue.schedule(request("conv-1", "I have oily skin")).orElseThrow().completion().get(5, TimeUnit.SECONDS);

        assertTrue(queue.schedule(request("conv-1", "I have oily skin")).isEmpty());
        assertTrue(queue.schedule(request("conv-1", "I have oily skin", "thanks")).isPresent());
    }

    @Test
    @DisplayName("Mined length should live in the fact store, not in the queue")
    void testSchedule_ProgressHeldInStore() throws Exception {
        // Given: a conversation mined to two messages
        FactExtractionQueue queue = queue("NONE");
        queue.schedule(request("conv-1", "hello", "I have dry skin")).orElseThrow()
                .completion().get(5, TimeUnit.SECONDS);

        // Then: the queue keeps nothing for the finished conversation
        assertFalse(queue.isPending("conv-1"));
        assertEquals(2, memoryService.processedMessages(USER, "conv-1"));
        assertEquals(1, store.search(FactNamespace.extractionProgress(USER)).size());

        // And: a fresh queue over the same store still skips it
        FactExtractionQueue restarted = queue("NONE");
        assertTrue(restarted.schedule(request("conv-1", "hello", "I have dry skin")).isEmpty());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Disabled extraction should schedule nothing")
    void testSchedule_Disabled() {
        properties.getMemory().getExtraction().setEnabled(false);

        Optional<ExtractionHandle> handle = queue("allergy: nickel").schedule(request("conv-1", "hi"));

        assertTrue(handle.isEmpty());
        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("Model failure should complete the handle exceptionally")
    void testSchedule_ModelFailure() {
        GenerativeTextService failing = (systemPrompt, messages, caller) -> {
            throw new IllegalStateException("model down");
        };
        FactExtractionQueue queue = new FactExtractionQueue(scheduler, failing, TestFixtures.prompts(),
                memoryService, properties);

        ExtractionHandle handle = queue.schedule(request("conv-1", "I'm allergic to latex")).orElseThrow();

        assertThrows(ExecutionException.class, () -> handle.completion().get(5, TimeUnit.SECONDS));
        assertTrue(constraintService.listConstraints(USER).isEmpty());
    }

    @Test
    @DisplayName("Parser should read category lines and ignore everything else")
    void testParse() {
        List<Fact> facts = FactExtractionQueue.parse("""
                - skin_type: Oily
                allergy: parabens
                NONE
                favorite_color: blue
                not a fact
                sensitivity:
                """, "conversation conv-1");

        assertEquals(2, facts.size());
        assertEquals(new Fact(FactCategory.SKIN_TYPE, "oily", "conversation conv-1"), facts.get(0));
        assertEquals(FactCategory.ALLERGY, facts.get(1).category());
        assertTrue(FactExtractionQueue.parse("NONE", "x").isEmpty());
        assertTrue(FactExtractionQueue.parse(null, "x").isEmpty());
    }
}
