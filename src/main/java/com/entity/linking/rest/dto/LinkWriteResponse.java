package com.entity.linking.rest.dto;

import com.entity.linking.link.LinkWriteResult;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for a link write.
 */
public record LinkWriteResponse(
        @JsonProperty("created") boolean created,
        @JsonProperty("outcome") String outcome,
        @JsonProperty("forward_key") String forwardKey,
        @JsonProperty("reverse_key") String reverseKey
) {
    public static LinkWriteResponse from(LinkWriteResult result) {
        return new LinkWriteResponse(result.isCreated(), result.outcome().name(),
                result.forwardKey(), result.reverseKey());
    }
}
