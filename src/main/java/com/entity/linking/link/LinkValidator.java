package com.entity.linking.link;

import com.entity.linking.core.model.EntityType;

import java.util.regex.Pattern;

/**
 * Argument checks for link operations. Internal entity types must be addressed by UUID,
 * external references just need to be non-empty.
 */
public final class LinkValidator {

    /** Maximum label length. */
    public static final int MAX_LABEL_LENGTH = 100;

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    private LinkValidator() {
        // utility class
    }

    /**
     * @throws IllegalArgumentException if the source cannot own links or its id is malformed
     */
    public static void validateSource(EntityType sourceType, String sourceId) {
        if (sourceType == null) {
            throw new IllegalArgumentException("source type is required");
        }
        if (!sourceType.isInternal()) {
            throw new IllegalArgumentException("source type must be an internal entity type, got '"
                    + sourceType.wireName() + "'");
        }
        requireUuid(sourceId, "source id");
    }

    /**
     * @throws IllegalArgumentException if the target reference is empty, or not a UUID for an internal type
     */
    public static void validateTarget(EntityType targetType, String targetRef) {
        if (targetType == null) {
            throw new IllegalArgumentException("target type is required");
        }
        if (targetRef == null || targetRef.isBlank()) {
            throw new IllegalArgumentException("target ref cannot be empty");
        }
        if (targetType.isInternal()) {
            requireUuid(targetRef, "target ref for internal type '" + targetType.wireName() + "'");
        }
    }

    /**
     * @throws IllegalArgumentException if the label is too long
     */
    public static void validateLabel(String label) {
        if (label != null && label.length() > MAX_LABEL_LENGTH) {
            throw new IllegalArgumentException("label must be " + MAX_LABEL_LENGTH + " characters or less");
        }
    }

    public static boolean isUuid(String value) {
        return value != null && UUID_PATTERN.matcher(value).matches();
    }

    private static void requireUuid(String value, String name) {
        if (!isUuid(value)) {
            throw new IllegalArgumentException(name + " must be a valid UUID");
        }
    }
}
