package com.entity.linking.link;

import java.util.List;

/**
 * Outcome of removing both directions of a link.
 *
 * @param status       what happened
 * @param deletedCount records deleted
 * @param foundCount   records that existed
 * @param failed       which directions could not be deleted ("forward", "reverse")
 */
public record LinkRemovalResult(Status status, int deletedCount, int foundCount, List<String> failed) {

    public enum Status {
        /** Every record that existed was deleted. */
        REMOVED,
        /** Neither direction existed. */
        NOT_FOUND,
        /** At least one existing record could not be deleted. */
        PARTIAL
    }

    public LinkRemovalResult {
        failed = failed != null ? List.copyOf(failed) : List.of();
    }

    public boolean isRemoved() {
        return status == Status.REMOVED;
    }
}
