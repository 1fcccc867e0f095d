package com.purchasingpower.concierge.memory.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link FactStore}. Safe for concurrent users; concurrent writes to
 * one key are last-writer-wins.
 */
@Slf4j
@Component
public class InMemoryFactStore implements FactStore {

    private final Map<FactNamespace, Map<String, StoredItem>> namespaces = new ConcurrentHashMap<>();

    @Override
    public List<StoredItem> search(FactNamespace namespace) {
        Map<String, StoredItem> items = namespaces.get(namespace);
        if (items == null) {
            return List.of();
        }
        synchronized (items) {
            return new ArrayList<>(items.values());
        }
    }

    @Override
    public Optional<StoredItem> get(FactNamespace namespace, String key) {
        Map<String, StoredItem> items = namespaces.get(namespace);
        return items == null ? Optional.empty() : Optional.ofNullable(items.get(key));
    }

    @Override
    public void put(FactNamespace namespace, String key, Map<String, Object> value) {
        namespaces.computeIfAbsent(namespace, ns -> Collections.synchronizedMap(new LinkedHashMap<>()))
                .put(key, new StoredItem(key, value, Instant.now()));
        log.debug("Stored {} in {}", key, namespace);
    }

    @Override
    public boolean delete(FactNamespace namespace, String key) {
        Map<String, StoredItem> items = namespaces.get(namespace);
        boolean removed = items != null && items.remove(key) != null;
        log.debug("Deleted {} from {}: {}", key, namespace, removed);
        return removed;
    }
}
