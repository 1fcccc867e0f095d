package com.purchasingpower.concierge.memory;

import com.purchasingpower.concierge.configuration.AppProperties;
import com.purchasingpower.concierge.configuration.MemoryProperties;
import com.purchasingpower.concierge.exception.FactStoreException;
import com.purchasingpower.concierge.memory.store.FactNamespace;
import com.purchasingpower.concierge.memory.store.FactStore;
import com.purchasingpower.concierge.memory.store.StoredItem;
import com.purchasingpower.concierge.model.CallContext;
import com.purchasingpower.concierge.model.ServiceType;
import com.purchasingpower.concierge.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Per-turn access to a user's long-term memory.
 *
 * Reads are bounded by {@code app.memory.store-timeout}. Fact and confirmation
 * reads degrade to empty on failure; a failed constraint read is reported to the
 * caller, which applies the constraint-load failure policy.
 */
@Slf4j
@Service
public class LongTermMemoryService {

    private static final String PROCESSED_MESSAGES = "processedMessages";

    private final FactStore store;
    private final FactDocuments documents;
    private final ConstraintService constraintService;
    private final MemoryConflictResolver conflictResolver;
    private final MemoryProperties properties;
    private final Executor ioExecutor;

    public LongTermMemoryService(
            FactStore store,
            FactDocuments documents,
            ConstraintService constraintService,
            MemoryConflictResolver conflictResolver,
            AppProperties appProperties,
            @Qualifier("turnIoExecutor") Executor ioExecutor) {
        this.store = store;
        this.documents = documents;
        this.constraintService = constraintService;
        this.conflictResolver = conflictResolver;
        this.properties = appProperties.getMemory();
        this.ioExecutor = ioExecutor;
    }

    public ConstraintLoadResult loadConstraints(String userId) {
        try {
            List<Constraint> constraints = timed("loadConstraints", FactNamespace.constraints(userId),
                    () -> constraintService.listConstraints(userId));
            return ConstraintLoadResult.loaded(constraints);
        } catch (FactStoreException e) {
            log.warn("⚠️ Constraint load failed for user {}: {}", userId, e.getMessage());
            return ConstraintLoadResult.failure();
        }
    }

    /**
     * Stored facts as one-line descriptions for the response context.
     */
    public List<String> loadFactContext(String userId) {
        try {
            return timed("loadFacts", FactNamespace.userFacts(userId), () -> {
                List<String> context = new ArrayList<>();
                for (StoredItem item : store.search(FactNamespace.userFacts(userId))) {
                    documents.read(item, Fact.class).map(Fact::describe).ifPresent(context::add);
                }
                return context;
            });
        } catch (FactStoreException e) {
            log.warn("Fact load failed for user {}, continuing without: {}", userId, e.getMessage());
            return List.of();
        }
    }

    /**
     * Surface this turn's pending confirmations (each counted as ignored once).
     *
     * Only the load is bounded; the ignore counters are written afterwards for
     * exactly the confirmations returned, so a timed-out load counts nothing.
     */
    public List<PendingConfirmation> surfacePendingConfirmations(String userId) {
        Map<String, PendingConfirmation> pending;
        try {
            pending = timed("loadConfirmations", FactNamespace.pendingConfirmations(userId),
                    () -> conflictResolver.loadPending(userId));
        } catch (FactStoreException e) {
            log.warn("Pending confirmation load failed for user {}, continuing without: {}", userId, e.getMessage());
            return List.of();
        }
        try {
            conflictResolver.recordIgnored(userId, pending);
        } catch (FactStoreException e) {
            log.warn("Could not count ignored confirmations for user {}: {}", userId, e.getMessage());
        }
        return List.copyOf(pending.values());
    }

    /**
     * Store detected facts. Allergies and sensitivities become constraints; every
     * other fact is conflict-checked and stored under a fresh key.
     *
     * @return one notification per stored fact that the user should hear about
     */
    public List<String> ingest(String userId, List<Fact> facts) {
        List<String> notifications = new ArrayList<>();
        for (Fact fact : facts) {
            try {
                ingestOne(userId, fact, notifications);
            } catch (FactStoreException e) {
                log.warn("Could not store {} fact for user {}: {}", fact.category().getLabel(), userId, e.getMessage());
            }
        }
        if (!facts.isEmpty()) {
            log.info("Ingested {} fact(s) for user {}", facts.size(), userId);
        }
        return notifications;
    }

    /**
     * Transcript length already mined for facts in this conversation; 0 if none
     * or if the store cannot say.
     */
    public int processedMessages(String userId, String conversationId) {
        FactNamespace namespace = FactNamespace.extractionProgress(userId);
        try {
            return timed("loadExtractionProgress", namespace, () -> store.get(namespace, conversationId)
                    .map(item -> item.value().get(PROCESSED_MESSAGES))
                    .filter(Number.class::isInstance)
                    .map(value -> ((Number) value).intValue())
                    .orElse(0));
        } catch (FactStoreException e) {
            log.warn("Extraction progress load failed for conversation {}: {}", conversationId, e.getMessage());
            return 0;
        }
    }

    /**
     * Record that the conversation was mined up to {@code messages}. Never lowers
     * an existing mark.
     */
    public void markProcessed(String userId, String conversationId, int messages) {
        FactNamespace namespace = FactNamespace.extractionProgress(userId);
        int current = store.get(namespace, conversationId)
                .map(item -> item.value().get(PROCESSED_MESSAGES))
                .filter(Number.class::isInstance)
                .map(value -> ((Number) value).intValue())
                .orElse(0);
        if (messages > current) {
            store.put(namespace, conversationId, Map.of(PROCESSED_MESSAGES, messages));
        }
    }

    private void ingestOne(String userId, Fact fact, List<String> notifications) {
        String value = fact.value();
        switch (fact.category()) {
            case ALLERGY -> {
                constraintService.save(userId, Constraint.of(value, ConstraintSeverity.ABSOLUTE, ConstraintSource.USER_STATED));
                notifications.add("I've noted your " + value + " allergy — I'll filter out products containing "
                        + value + " going forward.");
            }
            case SENSITIVITY -> {
                constraintService.save(userId, Constraint.of(value, ConstraintSeverity.HIGH, ConstraintSource.USER_STATED));
                notifications.add("I've noted your sensitivity to " + value + " — I'll avoid recommending products with "
                        + value + ".");
            }
            default -> {
                String key = fact.category().getLabel() + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
                conflictResolver.detectConflict(userId, key, fact);
                store.put(FactNamespace.userFacts(userId), key, documents.toDocument(fact));
                switch (fact.category()) {
                    case SKIN_TYPE -> notifications.add("I've noted that you have " + value + " skin.");
                    case PREFERENCE -> notifications.add("I've noted your preference for " + value + ".");
                    case AVERSION -> notifications.add("I've noted that you prefer to avoid " + value + ".");
                    default -> {
                    }
                }
            }
        }
    }

    private <T> T timed(String operation, FactNamespace namespace, Supplier<T> call) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.FACT_STORE, operation, log);
        ctx.logRequest(namespace.toString());

        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, ioExecutor);
        try {
            T result = future.get(properties.getStoreTimeout().toMillis(), TimeUnit.MILLISECONDS);
            ctx.logResponse(null);
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            ctx.logError("Timed out after " + properties.getStoreTimeout(), e);
            throw new FactStoreException(namespace.toString(), operation + " timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.logError("Interrupted", e);
            throw new FactStoreException(namespace.toString(), operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            ctx.logError(cause.getMessage(), cause);
            if (cause instanceof FactStoreException storeException) {
                throw storeException;
            }
            throw new FactStoreException(namespace.toString(), operation + " failed: " + cause.getMessage(), cause);
        }
    }
}
