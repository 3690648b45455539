package com.entity.linking.core.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Maps the free-form "kind" metadata of a work item search hit onto a linkable entity type.
 */
public final class WorkItemKind {

    private static final Set<String> PROJECT_KINDS = Set.of("project");
    private static final Set<String> TODO_KINDS = Set.of("task", "issue", "epic", "initiative");

    private WorkItemKind() {
    }

    /**
     * Returns {@link EntityType#PROJECT} or {@link EntityType#TODO}, or empty for kinds that are not linkable.
     */
    public static Optional<EntityType> toEntityType(String kind) {
        if (kind == null) {
            return Optional.empty();
        }
        String normalized = kind.trim().toLowerCase(Locale.ROOT);
        if (PROJECT_KINDS.contains(normalized)) {
            return Optional.of(EntityType.PROJECT);
        }
        if (TODO_KINDS.contains(normalized)) {
            return Optional.of(EntityType.TODO);
        }
        return Optional.empty();
    }
}
