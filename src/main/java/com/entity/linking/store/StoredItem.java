package com.entity.linking.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An item as held by the item store.
 *
 * @param id         store-assigned id, used for deletes
 * @param collection collection the item lives in
 * @param key        caller-owned key, may be null for unkeyed items
 * @param data       item payload; values may be null
 * @param tags       lookup tags
 */
public record StoredItem(String id, String collection, String key, Map<String, Object> data, List<String> tags) {

    public StoredItem {
        Objects.requireNonNull(id, "id is required");
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public String dataString(String field) {
        Object value = data.get(field);
        return value != null ? String.valueOf(value) : null;
    }
}
