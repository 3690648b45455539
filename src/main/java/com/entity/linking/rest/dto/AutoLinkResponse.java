package com.entity.linking.rest.dto;

import com.entity.linking.core.model.AutoLinkResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for an auto-link run.
 */
public record AutoLinkResponse(
        @JsonProperty("links_created") int linksCreated,
        @JsonProperty("matches") Matches matches
) {
    public static AutoLinkResponse from(AutoLinkResult result) {
        AutoLinkResult.Matches m = result.matches();
        return new AutoLinkResponse(result.linksCreated(), new Matches(m.contacts(), m.projects(), m.todos()));
    }

    public record Matches(
            @JsonProperty("contacts") List<String> contacts,
            @JsonProperty("projects") List<String> projects,
            @JsonProperty("todos") List<String> todos
    ) {
    }
}
