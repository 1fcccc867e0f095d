package com.purchasingpower.concierge.workflow;

import com.purchasingpower.concierge.workflow.agents.IntentClassifierAgent;
import com.purchasingpower.concierge.workflow.agents.ProductDiscoveryAgent;
import com.purchasingpower.concierge.workflow.agents.ResponseAgent;
import com.purchasingpower.concierge.workflow.agents.SafetyPostFilterAgent;
import com.purchasingpower.concierge.workflow.agents.SafetyPreFilterAgent;
import com.purchasingpower.concierge.workflow.state.ConciergeState;
import com.purchasingpower.concierge.workflow.state.Intent;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Turn router.
 *
 * <pre>
 * intent_classification ─┬─ product intents ─→ pre_filter ─┬─→ discovery → post_filter → response
 *                        │                                 └─ blocked ───────────────────→ response
 *                        └─ everything else ─────────────────────────────────────────────→ response
 * </pre>
 */
@Slf4j
@Component
public class ConciergeWorkflow {

    static final String INTENT_CLASSIFICATION = "intent_classification";
    static final String PRE_FILTER = "pre_filter";
    static final String DISCOVERY = "discovery";
    static final String POST_FILTER = "post_filter";
    static final String RESPONSE = "response";

    private final IntentClassifierAgent intentClassifier;
    private final SafetyPreFilterAgent preFilter;
    private final ProductDiscoveryAgent discovery;
    private final SafetyPostFilterAgent postFilter;
    private final ResponseAgent response;

    private CompiledGraph<ConciergeState> compiledGraph;

    public ConciergeWorkflow(
            IntentClassifierAgent intentClassifier,
            SafetyPreFilterAgent preFilter,
            ProductDiscoveryAgent discovery,
            SafetyPostFilterAgent postFilter,
            ResponseAgent response) {
        this.intentClassifier = intentClassifier;
        this.preFilter = preFilter;
        this.discovery = discovery;
        this.postFilter = postFilter;
        this.response = response;
    }

    @PostConstruct
    public void initialize() throws GraphStateException {
        log.info("🚀 Initializing concierge workflow graph...");
        StateGraph<ConciergeState> graph = new StateGraph<>(ConciergeState.SCHEMA, ConciergeState::new);

        graph.addNode(INTENT_CLASSIFICATION, node_async(intentClassifier::execute));
        graph.addNode(PRE_FILTER, node_async(preFilter::execute));
        graph.addNode(DISCOVERY, node_async(discovery::execute));
        graph.addNode(POST_FILTER, node_async(postFilter::execute));
        graph.addNode(RESPONSE, node_async(response::execute));

        graph.addEdge(START, INTENT_CLASSIFICATION);

        graph.addConditionalEdges(INTENT_CLASSIFICATION,
                edge_async(ConciergeWorkflow::routeFromIntent),
                Map.of(PRE_FILTER, PRE_FILTER, RESPONSE, RESPONSE));

        graph.addConditionalEdges(PRE_FILTER,
                edge_async(ConciergeWorkflow::routeFromPreFilter),
                Map.of(DISCOVERY, DISCOVERY, RESPONSE, RESPONSE));

        graph.addEdge(DISCOVERY, POST_FILTER);
        graph.addEdge(POST_FILTER, RESPONSE);
        graph.addEdge(RESPONSE, END);

        this.compiledGraph = graph.compile();
        log.info("✅ Concierge workflow compiled");
    }

    static String routeFromIntent(ConciergeState state) {
        Intent intent = state.getIntent();
        String next = intent.recommendsProducts() ? PRE_FILTER : RESPONSE;
        log.debug("🔀 {} → {}", intent.getLabel(), next);
        return next;
    }

    static String routeFromPreFilter(ConciergeState state) {
        return state.isRecommendationsBlocked() ? RESPONSE : DISCOVERY;
    }

    /**
     * Run one turn. Never throws: a graph failure yields a state carrying the apology reply.
     */
    public ConciergeState run(Map<String, Object> input) {
        try {
            Optional<ConciergeState> result = compiledGraph.invoke(input);
            return result.orElseGet(() -> failed(input, "workflow produced no state"));
        } catch (Exception e) {
            log.error("Concierge workflow failed", e);
            return failed(input, e.getMessage());
        }
    }

    private static ConciergeState failed(Map<String, Object> input, String reason) {
        log.warn("Turn for conversation {} ended without a result: {}", input.get(ConciergeState.CONVERSATION_ID), reason);
        Map<String, Object> data = new HashMap<>(input);
        data.put(ConciergeState.REPLY, ResponseAgent.FAILURE_REPLY);
        return new ConciergeState(data);
    }
}
