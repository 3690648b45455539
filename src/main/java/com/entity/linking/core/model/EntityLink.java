package com.entity.linking.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One direction of a stored entity link.
 * Every accepted link is stored as a forward record and its {@link #reversed()} counterpart.
 */
public record EntityLink(
        EntityType sourceType,
        String sourceId,
        EntityType targetType,
        String targetRef,
        String label,
        Instant createdAt,
        boolean autoLinked
) {
    public EntityLink {
        Objects.requireNonNull(sourceType, "sourceType is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(targetType, "targetType is required");
        Objects.requireNonNull(targetRef, "targetRef is required");
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /**
     * The same edge seen from the target side. Label, timestamp and origin are shared.
     */
    public EntityLink reversed() {
        return new EntityLink(targetType, targetRef, sourceType, sourceId, label, createdAt, autoLinked);
    }
}
