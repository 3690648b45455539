package com.entity.linking.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of entity that can sit at either end of an entity link.
 * Internal types are addressed by UUID; external references carry free-form refs.
 */
public enum EntityType {
    MEMORY("memory", true),
    TODO("todo", true),
    PROJECT("project", true),
    CONTACT("contact", true),
    THREAD("thread", true),
    GITHUB_ISSUE("github_issue", false),
    URL("url", false);

    private final String wireName;
    private final boolean internal;

    EntityType(String wireName, boolean internal) {
        this.wireName = wireName;
        this.internal = internal;
    }

    /**
     * Name used in composite keys, tags and stored records.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Whether entities of this type are owned by the backend and addressed by UUID.
     */
    public boolean isInternal() {
        return internal;
    }

    public static Optional<EntityType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(normalized))
                .findFirst();
    }

    /**
     * Parses a wire name, rejecting unknown values.
     *
     * @throws IllegalArgumentException if the value is not a known entity type
     */
    public static EntityType parse(String value) {
        return fromWireName(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity type: '" + value + "'"));
    }
}
