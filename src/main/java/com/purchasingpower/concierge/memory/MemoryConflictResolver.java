package com.purchasingpower.concierge.memory;

import com.purchasingpower.concierge.configuration.AppProperties;
import com.purchasingpower.concierge.configuration.MemoryProperties;
import com.purchasingpower.concierge.exception.FactStoreException;
import com.purchasingpower.concierge.memory.store.FactNamespace;
import com.purchasingpower.concierge.memory.store.FactStore;
import com.purchasingpower.concierge.memory.store.StoredItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Detects contradictions between stored and newly stated facts and drives each
 * resulting {@link PendingConfirmation} to a terminal state.
 *
 * A confirmation that is surfaced but never answered is auto-accepted after
 * {@code app.memory.max-ignored-attempts} turns, so none lives forever.
 * Concurrent turns of one user are last-writer-wins on the attempt counter.
 */
@Slf4j
@Component
public class MemoryConflictResolver {

    static final String PROMPT_HEADER = "PENDING CONFIRMATIONS — address these naturally in your response:";

    private final FactStore store;
    private final FactDocuments documents;
    private final MemoryProperties properties;

    public MemoryConflictResolver(FactStore store, FactDocuments documents, AppProperties appProperties) {
        this.store = store;
        this.documents = documents;
        this.properties = appProperties.getMemory();
    }

    public boolean isContradictionEligible(FactCategory category) {
        return properties.getContradictionCategories().contains(category.getLabel());
    }

    /**
     * Record a pending confirmation if {@code newFact} contradicts a stored fact.
     * Only the first contradicting fact is recorded.
     *
     * @return key of the created confirmation
     */
    public Optional<String> detectConflict(String userId, String newKey, Fact newFact) {
        if (!isContradictionEligible(newFact.category())) {
            return Optional.empty();
        }

        List<StoredItem> existing;
        try {
            existing = store.search(FactNamespace.userFacts(userId));
        } catch (FactStoreException e) {
            log.warn("Failed to search for conflicts for user {}: {}", userId, e.getMessage());
            return Optional.empty();
        }

        for (StoredItem item : existing) {
            if (item.key().equals(newKey)) {
                continue;
            }
            Optional<Fact> stored = documents.read(item, Fact.class);
            if (stored.isEmpty() || stored.get().category() != newFact.category()) {
                continue;
            }
            if (stored.get().value().equals(newFact.value())) {
                continue;
            }

            String conflictKey = "conflict_" + newFact.category().getLabel() + "_" + item.key();
            PendingConfirmation confirmation = new PendingConfirmation(
                    newFact.category(),
                    item.key(),
                    stored.get().value(),
                    newFact.value(),
                    Instant.now(),
                    0,
                    newFact.sourceText());
            store.put(FactNamespace.pendingConfirmations(userId), conflictKey, documents.toDocument(confirmation));

            log.info("⚖️ Memory conflict for user {}: {} '{}' → '{}'",
                    userId, newFact.category().getLabel(), stored.get().value(), newFact.value());
            return Optional.of(conflictKey);
        }
        return Optional.empty();
    }

    /**
     * All open confirmations keyed by store key, in creation order.
     */
    public Map<String, PendingConfirmation> loadPending(String userId) {
        Map<String, PendingConfirmation> pending = new LinkedHashMap<>();
        for (StoredItem item : store.search(FactNamespace.pendingConfirmations(userId))) {
            documents.read(item, PendingConfirmation.class).ifPresent(c -> pending.put(item.key(), c));
        }
        return pending;
    }

    /**
     * Count one implicit {@link ResolutionAction#IGNORE} for each confirmation the
     * user was actually shown.
     */
    public void recordIgnored(String userId, Map<String, PendingConfirmation> shown) {
        shown.forEach((key, confirmation) -> apply(userId, key, confirmation, ResolutionAction.IGNORE));
    }

    /**
     * Explicit resolution by the user.
     *
     * @return false if no such confirmation exists
     */
    public boolean resolve(String userId, String conflictKey, ResolutionAction action) {
        Optional<PendingConfirmation> confirmation = store.get(FactNamespace.pendingConfirmations(userId), conflictKey)
                .flatMap(item -> documents.read(item, PendingConfirmation.class));
        if (confirmation.isEmpty()) {
            log.debug("No pending confirmation {} for user {}", conflictKey, userId);
            return false;
        }
        apply(userId, conflictKey, confirmation.get(), action);
        return true;
    }

    void apply(String userId, String conflictKey, PendingConfirmation confirmation, ResolutionAction action) {
        FactNamespace facts = FactNamespace.userFacts(userId);
        FactNamespace confirmations = FactNamespace.pendingConfirmations(userId);
        String category = confirmation.category().getLabel();

        switch (action) {
            case ACCEPT_NEW -> {
                store.delete(facts, confirmation.oldKey());
                store.delete(confirmations, conflictKey);
                log.info("Conflict resolved for user {}: accepted new {}", userId, category);
            }
            case KEEP_BOTH -> {
                Fact kept = new Fact(confirmation.category(),
                        confirmation.oldValue() + " " + properties.getKeepBothQualifier(),
                        confirmation.sourceQuote());
                store.put(facts, confirmation.oldKey(), documents.toDocument(kept));
                store.delete(confirmations, conflictKey);
                log.info("Conflict resolved for user {}: keeping both {} values", userId, category);
            }
            case IGNORE -> {
                int attempts = confirmation.attempts() + 1;
                if (attempts >= properties.getMaxIgnoredAttempts()) {
                    store.delete(facts, confirmation.oldKey());
                    store.delete(confirmations, conflictKey);
                    log.info("Conflict auto-resolved for user {} after {} attempts: {}", userId, attempts, category);
                } else {
                    store.put(confirmations, conflictKey, documents.toDocument(confirmation.withAttempts(attempts)));
                    log.debug("Conflict {} ignored, attempts={}", conflictKey, attempts);
                }
            }
        }
    }

    /**
     * Render confirmations as one context block for the response layer; empty if none.
     */
    public static String formatPrompt(Collection<PendingConfirmation> confirmations) {
        if (confirmations == null || confirmations.isEmpty()) {
            return "";
        }
        return PROMPT_HEADER + "\n" + confirmations.stream()
                .map(c -> "- " + c.toPrompt())
                .collect(Collectors.joining("\n"));
    }
}
