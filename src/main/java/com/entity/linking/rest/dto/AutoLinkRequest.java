package com.entity.linking.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for auto-linking an inbound message.
 */
public record AutoLinkRequest(
        @JsonProperty("thread_id") String threadId,
        @JsonProperty("sender_phone") String senderPhone,
        @JsonProperty("sender_email") String senderEmail,
        @JsonProperty("content") String content,
        @JsonProperty("similarity_threshold") Double similarityThreshold
) {
    public AutoLinkRequest {
        if (threadId == null || threadId.isBlank()) {
            throw new IllegalArgumentException("thread_id is required");
        }
        if (similarityThreshold != null && (similarityThreshold < 0.0 || similarityThreshold > 1.0)) {
            throw new IllegalArgumentException("similarity_threshold must be between 0.0 and 1.0");
        }
    }
}
