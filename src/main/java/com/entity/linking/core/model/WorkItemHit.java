package com.entity.linking.core.model;

import java.util.Objects;

/**
 * A content search result, normalized from the search backend's payload.
 *
 * @param id    work item id
 * @param title work item title, never null
 * @param score similarity score reported by the backend
 * @param kind  the backend's "kind" metadata, may be null
 */
public record WorkItemHit(String id, String title, double score, String kind) {

    public WorkItemHit {
        Objects.requireNonNull(id, "id is required");
        title = title != null ? title : "";
    }
}
