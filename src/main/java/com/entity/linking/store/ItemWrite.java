package com.entity.linking.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An upsert into the item store. Writing the same collection and key twice replaces the data.
 * Data values may be null.
 */
public record ItemWrite(String skillId, String collection, String key, Map<String, Object> data, List<String> tags) {

    public ItemWrite {
        Objects.requireNonNull(skillId, "skillId is required");
        Objects.requireNonNull(collection, "collection is required");
        Objects.requireNonNull(key, "key is required");
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }
}
