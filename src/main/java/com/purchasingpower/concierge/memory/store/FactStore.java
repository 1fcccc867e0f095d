package com.purchasingpower.concierge.memory.store;

import com.purchasingpower.concierge.exception.FactStoreException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Namespaced key-value store holding a user's long-term facts, constraints and
 * pending confirmations.
 *
 * Every method may throw {@link FactStoreException}. Callers decide whether a
 * failure degrades or blocks the turn.
 */
public interface FactStore {

    /**
     * All items of the namespace in insertion order.
     */
    List<StoredItem> search(FactNamespace namespace);

    Optional<StoredItem> get(FactNamespace namespace, String key);

    /**
     * Insert or replace. A replaced key keeps its position in {@link #search}.
     */
    void put(FactNamespace namespace, String key, Map<String, Object> value);

    /**
     * @return true if the key existed
     */
    boolean delete(FactNamespace namespace, String key);
}
