package com.purchasingpower.concierge.memory;

import com.purchasingpower.concierge.memory.store.FactNamespace;
import com.purchasingpower.concierge.memory.store.FactStore;
import com.purchasingpower.concierge.memory.store.StoredItem;
import com.purchasingpower.concierge.ontology.IngredientParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A user's allergy, sensitivity and avoidance constraints in the long-term store.
 *
 * Keys are derived from severity and ingredient, so stating the same allergy
 * twice (in chat or through the API) replaces rather than duplicates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConstraintService {

    private final FactStore store;
    private final FactDocuments documents;

    public static String keyFor(ConstraintSeverity severity, String ingredient) {
        String prefix = switch (severity) {
            case ABSOLUTE -> "allergy_";
            case HIGH -> "sensitivity_";
            case PREFERENCE -> "preference_";
        };
        return prefix + ingredient.strip().replace(' ', '_');
    }

    /**
     * Constraint added through the API rather than stated in conversation.
     */
    public Constraint addConstraint(String userId, String ingredient, ConstraintSeverity severity) {
        String normalized = IngredientParser.normalize(ingredient);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Constraint ingredient must not be blank");
        }
        Constraint constraint = Constraint.of(normalized, severity, ConstraintSource.USER_API);
        save(userId, constraint);
        return constraint;
    }

    public String save(String userId, Constraint constraint) {
        String key = keyFor(constraint.severity(), constraint.ingredient());
        store.put(FactNamespace.constraints(userId), key, documents.toDocument(constraint));
        log.info("Constraint stored for user {}: {} ({}, {})",
                userId, constraint.ingredient(), constraint.severity().getLabel(), constraint.source().getLabel());
        return key;
    }

    /**
     * Remove every constraint on {@code ingredient}, whatever its severity.
     *
     * @return true if anything was removed
     */
    public boolean removeConstraint(String userId, String ingredient) {
        String normalized = IngredientParser.normalize(ingredient);
        FactNamespace namespace = FactNamespace.constraints(userId);

        boolean removed = false;
        for (StoredItem item : store.search(namespace)) {
            Optional<Constraint> constraint = documents.read(item, Constraint.class);
            if (constraint.isPresent() && IngredientParser.normalize(constraint.get().ingredient()).equals(normalized)) {
                removed |= store.delete(namespace, item.key());
            }
        }
        log.info("Constraint {} for user {}: {}", removed ? "removed" : "not found", userId, normalized);
        return removed;
    }

    public List<Constraint> listConstraints(String userId) {
        List<Constraint> constraints = new ArrayList<>();
        for (StoredItem item : store.search(FactNamespace.constraints(userId))) {
            documents.read(item, Constraint.class).ifPresent(constraints::add);
        }
        return constraints;
    }
}
