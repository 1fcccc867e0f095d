package com.purchasingpower.concierge.safety;

import com.purchasingpower.concierge.catalog.Candidate;
import com.purchasingpower.concierge.client.GenerativeTextService;
import com.purchasingpower.concierge.configuration.AppProperties;
import com.purchasingpower.concierge.configuration.SafetyProperties;
import com.purchasingpower.concierge.model.prompt.RenderedPrompt;
import com.purchasingpower.concierge.ontology.AllergenMatch;
import com.purchasingpower.concierge.ontology.AllergenMatcher;
import com.purchasingpower.concierge.service.PromptLibraryService;
import com.purchasingpower.concierge.workflow.state.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Two sequential veto gates over discovery candidates.
 *
 * <ol>
 *   <li>RULE_BASED: ontology match of each candidate's ingredients against the
 *       expanded constraint set. Always applies.</li>
 *   <li>LLM_CHECK: a single best-effort generative review of the survivors for
 *       synonyms and derivatives literal matching misses. Any failure keeps the
 *       rule-based survivors.</li>
 * </ol>
 */
@Slf4j
@Component
public class DualGateSafetyFilter {

    private static final String UNSAFE_MARKER = "unsafe";

    private final AllergenMatcher matcher;
    private final GenerativeTextService textService;
    private final PromptLibraryService promptLibrary;
    private final SafetyProperties properties;
    private final Executor ioExecutor;

    public DualGateSafetyFilter(
            AllergenMatcher matcher,
            @Qualifier("deterministicTextService") GenerativeTextService textService,
            PromptLibraryService promptLibrary,
            AppProperties appProperties,
            @Qualifier("turnIoExecutor") Executor ioExecutor) {
        this.matcher = matcher;
        this.textService = textService;
        this.promptLibrary = promptLibrary;
        this.properties = appProperties.getSafety();
        this.ioExecutor = ioExecutor;
    }

    public SafetyFilterResult filter(List<Candidate> candidates, Collection<String> constraints) {
        if (candidates == null || candidates.isEmpty()) {
            return SafetyFilterResult.passThrough(List.of());
        }
        if (constraints == null || constraints.isEmpty()) {
            log.debug("No constraints - {} candidates pass unchecked", candidates.size());
            return SafetyFilterResult.passThrough(candidates);
        }

        List<Candidate> survivors = new ArrayList<>();
        List<Violation> violations = new ArrayList<>();

        // Gate 1
        for (Candidate candidate : candidates) {
            List<AllergenMatch> matches = matcher.findAllergenMatches(candidate.ingredientList(), constraints);
            if (matches.isEmpty()) {
                survivors.add(candidate);
            } else {
                violations.add(Violation.ruleBased(candidate.getName(), matches));
                log.info("🚫 Gate 1 vetoed '{}': {} match(es), first={}",
                        candidate.getName(), matches.size(), matches.get(0).ingredient());
            }
        }

        // Gate 2
        if (properties.isLlmCheckEnabled() && !survivors.isEmpty()) {
            applyLlmCheck(survivors, violations, constraints);
        }

        boolean allVetoed = survivors.isEmpty();
        log.info("Safety filter: {} candidates → {} survivors, {} violations{}",
                candidates.size(), survivors.size(), violations.size(), allVetoed ? " (all vetoed)" : "");

        return new SafetyFilterResult(survivors, violations, allVetoed);
    }

    private void applyLlmCheck(List<Candidate> survivors, List<Violation> violations, Collection<String> constraints) {
        String reply;
        try {
            reply = requestLlmVerdict(survivors, constraints);
        } catch (TimeoutException e) {
            log.warn("⚠️ Gate 2 timed out after {} - keeping rule-based results", properties.getLlmCheckTimeout());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠️ Gate 2 interrupted - keeping rule-based results");
            return;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("⚠️ Gate 2 failed - keeping rule-based results: {}", cause.getMessage());
            return;
        } catch (RuntimeException e) {
            log.warn("⚠️ Gate 2 could not run - keeping rule-based results: {}", e.getMessage());
            return;
        }

        for (String line : reply.split("\\R")) {
            String lower = line.toLowerCase(Locale.ROOT);
            if (!lower.contains(UNSAFE_MARKER)) {
                continue;
            }
            Iterator<Candidate> it = survivors.iterator();
            while (it.hasNext()) {
                Candidate candidate = it.next();
                String name = candidate.getName();
                if (name == null || name.isBlank()) {
                    continue;
                }
                if (lower.contains(name.toLowerCase(Locale.ROOT))) {
                    it.remove();
                    violations.add(Violation.llmCheck(name, line.strip()));
                    log.info("🚫 Gate 2 vetoed '{}': {}", name, line.strip());
                }
            }
        }
    }

    private String requestLlmVerdict(List<Candidate> survivors, Collection<String> constraints)
            throws InterruptedException, ExecutionException, TimeoutException {
        RenderedPrompt prompt = promptLibrary.render("safety-check", Map.of(
                "allergies", String.join(", ", constraints),
                "products", describe(survivors)
        ));

        CompletableFuture<String> future = CompletableFuture.supplyAsync(
                () -> textService.generate(prompt.systemPrompt(),
                        List.of(ChatMessage.user(prompt.userPrompt())), "SafetyGate"),
                ioExecutor);
        try {
            return future.get(properties.getLlmCheckTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        }
    }

    private String describe(List<Candidate> survivors) {
        int limit = properties.getMaxIngredientsInPrompt();
        return survivors.stream()
                .map(c -> "- " + c.getName() + ": " + c.ingredientList().stream()
                        .limit(limit)
                        .collect(Collectors.joining(", ")))
                .collect(Collectors.joining("\n"));
    }
}
