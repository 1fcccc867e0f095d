package com.purchasingpower.concierge.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.concierge.memory.store.StoredItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Converts between typed memory records and the documents held by the fact store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FactDocuments {

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public Map<String, Object> toDocument(Object value) {
        return objectMapper.convertValue(value, DOCUMENT);
    }

    /**
     * Empty when the stored document does not describe a {@code type}; the item is skipped, not fatal.
     */
    public <T> Optional<T> read(StoredItem item, Class<T> type) {
        try {
            return Optional.of(objectMapper.convertValue(item.value(), type));
        } catch (IllegalArgumentException e) {
            log.warn("Skipping unreadable {} document '{}': {}", type.getSimpleName(), item.key(), e.getMessage());
            return Optional.empty();
        }
    }
}
