package com.entity.linking.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A ranked contact match. Transient: lives for one request and is never persisted.
 *
 * @param contactId      matched contact id
 * @param displayName    contact display name
 * @param endpoints      all endpoints of the contact
 * @param confidence     combined score in [0,1]
 * @param matchedSignals number of query signals that scored above zero
 */
public record MatchCandidate(
        String contactId,
        String displayName,
        List<Endpoint> endpoints,
        double confidence,
        int matchedSignals
) {
    public MatchCandidate {
        Objects.requireNonNull(contactId, "contactId is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got " + confidence);
        }
        endpoints = endpoints != null ? List.copyOf(endpoints) : List.of();
    }

    public boolean isAtLeast(double threshold) {
        return confidence >= threshold;
    }
}
