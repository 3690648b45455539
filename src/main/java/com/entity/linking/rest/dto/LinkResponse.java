package com.entity.linking.rest.dto;

import com.entity.linking.core.model.EntityLink;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for one stored link.
 */
public record LinkResponse(
        @JsonProperty("source_type") String sourceType,
        @JsonProperty("source_id") String sourceId,
        @JsonProperty("target_type") String targetType,
        @JsonProperty("target_ref") String targetRef,
        @JsonProperty("label") String label,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("auto_linked") boolean autoLinked
) {
    public static LinkResponse from(EntityLink link) {
        return new LinkResponse(
                link.sourceType().wireName(),
                link.sourceId(),
                link.targetType().wireName(),
                link.targetRef(),
                link.label(),
                link.createdAt() != null ? link.createdAt().toString() : null,
                link.autoLinked()
        );
    }
}
