package com.entity.linking.store;

import java.util.Objects;

/**
 * A bounded content search.
 *
 * @param query      search text
 * @param types      comma-separated result type filter, e.g. {@code work_item}
 * @param limit      maximum number of results, always positive
 * @param semantic   whether to rank by embedding similarity
 */
public record SearchQuery(String query, String types, int limit, boolean semantic) {

    public SearchQuery {
        Objects.requireNonNull(query, "query is required");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }
}
