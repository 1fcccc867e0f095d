package com.purchasingpower.concierge.memory.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param key Key within the namespace
 * @param value Stored document
 * @param updatedAt Last write time
 */
public record StoredItem(String key, Map<String, Object> value, Instant updatedAt) {

    public StoredItem {
        value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
    }
}
