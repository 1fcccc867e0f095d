package com.purchasingpower.concierge.workflow.agents;

import com.purchasingpower.concierge.catalog.Candidate;
import com.purchasingpower.concierge.catalog.CandidateFetcher;
import com.purchasingpower.concierge.catalog.CandidateQuery;
import com.purchasingpower.concierge.configuration.AppProperties;
import com.purchasingpower.concierge.configuration.DiscoveryProperties;
import com.purchasingpower.concierge.model.CallContext;
import com.purchasingpower.concierge.model.ServiceType;
import com.purchasingpower.concierge.util.ExternalCallLogger;
import com.purchasingpower.concierge.workflow.state.ConciergeState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fetches candidates for the user's message, excluding the expanded constraint tokens.
 * Any fetch failure or timeout yields no candidates.
 */
@Slf4j
@Component
public class ProductDiscoveryAgent {

    private final CandidateFetcher fetcher;
    private final DiscoveryProperties properties;
    private final Executor ioExecutor;

    public ProductDiscoveryAgent(
            CandidateFetcher fetcher,
            AppProperties appProperties,
            @Qualifier("turnIoExecutor") Executor ioExecutor) {
        this.fetcher = fetcher;
        this.properties = appProperties.getDiscovery();
        this.ioExecutor = ioExecutor;
    }

    public Map<String, Object> execute(ConciergeState state) {
        CandidateQuery query = new CandidateQuery(
                state.getMessage(),
                new HashSet<>(state.getExpandedConstraints()),
                properties.getMaxCandidates());

        return Map.of(ConciergeState.CANDIDATES, new ArrayList<>(fetch(query)));
    }

    private List<Candidate> fetch(CandidateQuery query) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.CATALOG, "fetchCandidates", log);
        ctx.logRequest(ExternalCallLogger.truncate(query.text(), 100),
                "excluded", query.excludedIngredients().size());

        CompletableFuture<List<Candidate>> future = CompletableFuture.supplyAsync(() -> fetcher.fetch(query), ioExecutor);
        try {
            List<Candidate> candidates = future.get(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            ctx.logResponse(candidates.size() + " candidates");
            return candidates;
        } catch (TimeoutException e) {
            future.cancel(true);
            ctx.logError("Timed out after " + properties.getTimeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.logError("Interrupted", e);
        } catch (ExecutionException e) {
            ctx.logError(e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
        return List.of();
    }
}
