package com.entity.linking.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for creating a manual link.
 */
public record CreateLinkRequest(
        @JsonProperty("source_type") String sourceType,
        @JsonProperty("source_id") String sourceId,
        @JsonProperty("target_type") String targetType,
        @JsonProperty("target_ref") String targetRef,
        @JsonProperty("label") String label
) {
    public CreateLinkRequest {
        if (sourceType == null || sourceType.isBlank()) {
            throw new IllegalArgumentException("source_type is required");
        }
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("source_id is required");
        }
        if (targetType == null || targetType.isBlank()) {
            throw new IllegalArgumentException("target_type is required");
        }
        if (targetRef == null || targetRef.isBlank()) {
            throw new IllegalArgumentException("target_ref is required");
        }
    }
}
