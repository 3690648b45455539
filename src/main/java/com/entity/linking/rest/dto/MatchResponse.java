package com.entity.linking.rest.dto;

import com.entity.linking.core.model.Endpoint;
import com.entity.linking.core.model.MatchCandidate;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * Response DTO for contact match suggestions.
 */
public record MatchResponse(
        @JsonProperty("matches") List<Match> matches
) {

    public static MatchResponse from(List<MatchCandidate> candidates) {
        return new MatchResponse(candidates.stream().map(Match::from).toList());
    }

    public record Match(
            @JsonProperty("contact_id") String contactId,
            @JsonProperty("display_name") String displayName,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("matched_signals") int matchedSignals,
            @JsonProperty("endpoints") List<EndpointView> endpoints
    ) {
        static Match from(MatchCandidate candidate) {
            return new Match(candidate.contactId(), candidate.displayName(), candidate.confidence(),
                    candidate.matchedSignals(), candidate.endpoints().stream().map(EndpointView::from).toList());
        }
    }

    public record EndpointView(
            @JsonProperty("type") String type,
            @JsonProperty("value") String value
    ) {
        static EndpointView from(Endpoint endpoint) {
            return new EndpointView(endpoint.type().name().toLowerCase(Locale.ROOT), endpoint.value());
        }
    }
}
