package com.entity.linking.link;

import com.entity.linking.core.model.EntityType;

/**
 * Storage addressing for entity link records.
 */
public final class LinkKeys {

    /** Skill id the link records are stored under. */
    public static final String SKILL_ID = "entity-links";

    /** Collection holding both directions of every link. */
    public static final String COLLECTION = "entity_links";

    private LinkKeys() {
    }

    /**
     * Composite key {@code sourceType:sourceId:targetType:targetRef}; the idempotency key of one direction.
     */
    public static String linkKey(EntityType sourceType, String sourceId, EntityType targetType, String targetRef) {
        return sourceType.wireName() + ":" + sourceId + ":" + targetType.wireName() + ":" + targetRef;
    }

    /**
     * Tag {@code src:type:id} used to list every link leaving an entity.
     */
    public static String sourceTag(EntityType type, String id) {
        return "src:" + type.wireName() + ":" + id;
    }
}
