package com.entity.linking.rest.dto;

import com.entity.linking.link.LinkRemovalResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for a link removal.
 */
public record LinkRemovalResponse(
        @JsonProperty("status") String status,
        @JsonProperty("deleted") int deleted,
        @JsonProperty("found") int found,
        @JsonProperty("failed") List<String> failed
) {
    public static LinkRemovalResponse from(LinkRemovalResult result) {
        return new LinkRemovalResponse(result.status().name(), result.deletedCount(),
                result.foundCount(), result.failed());
    }
}
