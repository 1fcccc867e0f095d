package com.purchasingpower.concierge.workflow;

import com.purchasingpower.concierge.ConciergeTestHarness;
import com.purchasingpower.concierge.TestFixtures;
import com.purchasingpower.concierge.catalog.Candidate;
import com.purchasingpower.concierge.configuration.SafetyProperties;
import com.purchasingpower.concierge.exception.FactStoreException;
import com.purchasingpower.concierge.memory.ConstraintSeverity;
import com.purchasingpower.concierge.memory.Fact;
import com.purchasingpower.concierge.memory.FactCategory;
import com.purchasingpower.concierge.memory.store.FactNamespace;
import com.purchasingpower.concierge.memory.store.InMemoryFactStore;
import com.purchasingpower.concierge.memory.store.StoredItem;
import com.purchasingpower.concierge.ontology.Severity;
import com.purchasingpower.concierge.safety.Gate;
import com.purchasingpower.concierge.workflow.agents.ResponseAgent;
import com.purchasingpower.concierge.workflow.state.ConciergeState;
import com.purchasingpower.concierge.workflow.state.Intent;
import com.purchasingpower.concierge.workflow.state.RecommendedProduct;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Concierge Workflow Tests")
class ConciergeWorkflowTest {

    private static final String USER = "user-1";

    private static final Candidate CLEAN = TestFixtures.product("Clean Moisturizer", "water", "glycerin", "shea butter");
    private static final Candidate PARABEN_CREAM = TestFixtures.product("Paraben Cream", "water", "methylparaben");
    private static final Candidate NIGHT_SERUM = TestFixtures.product("Night Serum", "water", "retinol", "glycolic acid");

    private ConciergeTestHarness harness;

    @BeforeEach
    void setUp() {
        harness = new ConciergeTestHarness();
        harness.catalog = List.of(CLEAN, PARABEN_CREAM, NIGHT_SERUM);
    }

    private ConciergeState turn(String message) throws Exception {
        Map<String, Object> input = new HashMap<>();
        input.put(ConciergeState.USER_ID, USER);
        input.put(ConciergeState.CONVERSATION_ID, "conv-1");
        input.put(ConciergeState.MESSAGE, message);
        input.put(ConciergeState.HISTORY, new ArrayList<>());
        return harness.workflow().run(input);
    }

    @Test
    @DisplayName("Product search should veto constrained products and annotate survivors")
    void testRun_ProductSearch() throws Exception {
        // Given: a stored paraben allergy
        harness.constraintService.addConstraint(USER, "paraben", ConstraintSeverity.ABSOLUTE);

        // When
        ConciergeState state = turn("show me moisturizers");

        // Then: the paraben product is vetoed by the rule-based gate
        assertEquals(Intent.PRODUCT_SEARCH, state.getIntent());
        assertEquals(1, state.getViolations().size());
        assertEquals("Paraben Cream", state.getViolations().get(0).productName());
        assertEquals(Gate.RULE_BASED, state.getViolations().get(0).gate());

        // And: survivors carry interaction warnings and a score
        List<String> names = state.getRecommendations().stream().map(r -> r.product().getName()).toList();
        assertEquals(List.of("Clean Moisturizer", "Night Serum"), names);
        RecommendedProduct serum = state.getRecommendations().get(1);
        assertEquals(1, serum.interactionWarnings().size());
        assertEquals("Retinoid + AHA", serum.interactionWarnings().get(0).label());
        assertEquals(Severity.HIGH, serum.interactionWarnings().get(0).severity());
        assertEquals(10.0, state.getRecommendations().get(0).safetyScore());

        // And: discovery was asked to exclude the whole paraben group
        assertTrue(harness.queries.get(0).excludedIngredients().contains("methylparaben"));
        assertFalse(state.isAllVetoed());
        assertEquals("Here is what I found.", state.getReply());
    }

    @Test
    @DisplayName("Response context should carry violations, products and interaction warnings")
    void testRun_ResponseContext() throws Exception {
        harness.constraintService.addConstraint(USER, "paraben", ConstraintSeverity.ABSOLUTE);

        turn("show me moisturizers");

        String context = harness.lastResponseContext();
        assertTrue(context.contains("Allergic to paraben"));
        assertTrue(context.contains("Safety violations found"));
        assertTrue(context.contains("Paraben Cream: flagged for Contains methylparaben (paraben)"));
        assertTrue(context.contains("Night Serum by Test Brand"));
        assertTrue(context.contains("Interaction warning (high): Retinoid + AHA"));
    }

    @Test
    @DisplayName("Allergy stated in the same message should be enforced in that turn")
    void testRun_AllergyDeclaredThisTurn() throws Exception {
        ConciergeState state = turn("I'm allergic to parabens, show me moisturizers");

        assertEquals(1, state.getNotifications().size());
        assertTrue(state.getNotifications().get(0).contains("parabens allergy"));
        assertEquals(List.of("parabens"), state.getConstraints());
        assertEquals(1, state.getViolations().size());
        assertEquals("Paraben Cream", state.getViolations().get(0).productName());
        assertEquals("paraben", state.getViolations().get(0).matchedAllergen());
    }

    @Test
    @DisplayName("Same-named products vetoed for the same ingredient should each keep a violation")
    void testRun_DuplicateViolationsKept() throws Exception {
        // Given: the catalog returns the same product twice
        harness.catalog = List.of(PARABEN_CREAM, PARABEN_CREAM, CLEAN);
        harness.constraintService.addConstraint(USER, "paraben", ConstraintSeverity.ABSOLUTE);

        // When
        ConciergeState state = turn("show me moisturizers");

        // Then: both vetoes reach the merged turn state
        assertEquals(2, state.getSafetyResult().violations().size());
        assertEquals(2, state.getViolations().size());
        assertEquals(state.getViolations().get(0), state.getViolations().get(1));
        assertEquals(3, state.getViolations().size() + state.getRecommendations().size());
    }

    @Test
    @DisplayName("All candidates vetoed should be flagged for the response")
    void testRun_AllVetoed() throws Exception {
        harness.catalog = List.of(PARABEN_CREAM);
        harness.constraintService.addConstraint(USER, "paraben", ConstraintSeverity.ABSOLUTE);

        ConciergeState state = turn("show me creams");

        assertTrue(state.isAllVetoed());
        assertTrue(state.getRecommendations().isEmpty());
        assertTrue(harness.lastResponseContext().contains("All products were filtered out"));
    }

    @Test
    @DisplayName("Gate 2 should remove a product the model marks unsafe")
    void testRun_LlmGate() throws Exception {
        harness.constraintService.addConstraint(USER, "fragrance", ConstraintSeverity.HIGH);
        harness.safetyReply = "Clean Moisturizer: UNSAFE - shea butter may carry added scent\nNight Serum: SAFE";

        ConciergeState state = turn("show me moisturizers");

        assertEquals(1, state.getViolations().size());
        assertEquals(Gate.LLM_CHECK, state.getViolations().get(0).gate());
        assertEquals(2, state.getRecommendations().size());
    }

    @Test
    @DisplayName("Non-product intents should go straight to the response")
    void testRun_GeneralChat() throws Exception {
        harness.intentReply = "general_chat";

        ConciergeState state = turn("hi there!");

        assertEquals(Intent.GENERAL_CHAT, state.getIntent());
        assertTrue(harness.queries.isEmpty());
        assertTrue(state.getCandidates().isEmpty());
        assertFalse(harness.modelCalls.contains("SafetyGate"));
        assertEquals("Here is what I found.", state.getReply());
    }

    @Test
    @DisplayName("Unknown classifier answers should not run discovery")
    void testRun_UnrecognizedIntent() throws Exception {
        harness.intentReply = "buy_stuff";

        ConciergeState state = turn("hmm");

        assertEquals(Intent.UNRECOGNIZED, state.getIntent());
        assertTrue(harness.queries.isEmpty());
    }

    @Test
    @DisplayName("Constraint load failure should block recommendations by default")
    void testRun_FailClosed() throws Exception {
        harness = new ConciergeTestHarness(new ConstraintOutageStore());
        harness.catalog = List.of(CLEAN);

        ConciergeState state = turn("show me moisturizers");

        assertTrue(state.isConstraintsLoadFailed());
        assertTrue(state.isRecommendationsBlocked());
        assertTrue(harness.queries.isEmpty());
        assertTrue(state.getRecommendations().isEmpty());
        assertTrue(harness.lastResponseContext().contains("could not be loaded"));
    }

    @Test
    @DisplayName("Fail-open policy should proceed without constraints")
    void testRun_FailOpen() throws Exception {
        harness = new ConciergeTestHarness(new ConstraintOutageStore());
        harness.catalog = List.of(CLEAN);
        harness.properties.getSafety()
                .setConstraintLoadFailurePolicy(SafetyProperties.ConstraintLoadFailurePolicy.FAIL_OPEN);

        ConciergeState state = turn("show me moisturizers");

        assertFalse(state.isRecommendationsBlocked());
        assertEquals(1, state.getRecommendations().size());
    }

    @Test
    @DisplayName("Pending confirmations should be surfaced into the response context")
    void testRun_SurfacesConfirmation() throws Exception {
        harness.intentReply = "general_chat";
        harness.memoryService.ingest(USER, List.of(new Fact(FactCategory.SKIN_TYPE, "oily", "I have oily skin")));
        harness.memoryService.ingest(USER, List.of(new Fact(FactCategory.SKIN_TYPE, "dry", "my skin is dry")));

        ConciergeState state = turn("what should I use at night?");

        assertEquals(1, state.getConflictPrompts().size());
        assertTrue(state.getConflictPrompts().get(0).contains("previously mentioned having oily"));
        assertTrue(harness.lastResponseContext().contains("PENDING CONFIRMATIONS"));
        assertTrue(harness.lastResponseContext().contains("skin_type: dry"));
    }

    @Test
    @DisplayName("Response model failure should yield the apology reply")
    void testRun_ResponseFailure() throws Exception {
        harness.intentReply = "general_chat";
        harness.responseFails = true;

        ConciergeState state = turn("hello");

        assertEquals(ResponseAgent.FAILURE_REPLY, state.getReply());
    }

    @Test
    @DisplayName("Router should send product intents to the pre-filter only")
    void testRouteFromIntent() {
        for (Intent intent : Intent.values()) {
            ConciergeState state = new ConciergeState(Map.of(ConciergeState.INTENT, intent));
            String expected = intent.recommendsProducts() ? ConciergeWorkflow.PRE_FILTER : ConciergeWorkflow.RESPONSE;
            assertEquals(expected, ConciergeWorkflow.routeFromIntent(state), intent.getLabel());
        }
    }

    @Test
    @DisplayName("Blocked pre-filter should skip discovery")
    void testRouteFromPreFilter() {
        assertEquals(ConciergeWorkflow.RESPONSE, ConciergeWorkflow.routeFromPreFilter(
                new ConciergeState(Map.of(ConciergeState.RECOMMENDATIONS_BLOCKED, true))));
        assertEquals(ConciergeWorkflow.DISCOVERY, ConciergeWorkflow.routeFromPreFilter(
                new ConciergeState(Map.of(ConciergeState.RECOMMENDATIONS_BLOCKED, false))));
    }

    /** Constraints namespace unavailable; everything else works. */
    private static class ConstraintOutageStore extends InMemoryFactStore {

        @Override
        public List<StoredItem> search(FactNamespace namespace) {
            if (namespace.kind() == FactNamespace.Kind.CONSTRAINTS) {
                throw new FactStoreException(namespace.toString(), "constraints shard offline", null);
            }
            return super.search(namespace);
        }
    }
}
