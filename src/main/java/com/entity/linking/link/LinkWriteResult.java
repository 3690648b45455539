package com.entity.linking.link;

/**
 * Outcome of a bidirectional link write.
 *
 * @param outcome    what happened
 * @param forwardKey composite key of the forward record
 * @param reverseKey composite key of the reverse record
 * @param forwardId  store id of the forward record, null if it was never written or was rolled back
 * @param reverseId  store id of the reverse record, null unless the write was created
 */
public record LinkWriteResult(Outcome outcome, String forwardKey, String reverseKey, String forwardId, String reverseId) {

    public enum Outcome {
        /** Both records are stored. */
        CREATED,
        /** The forward write failed; nothing was stored. */
        FORWARD_FAILED,
        /** The reverse write failed and the forward record was deleted again. */
        ROLLED_BACK,
        /** The reverse write failed on a repeated call; the forward record predates it and was left in place. */
        KEPT_EXISTING,
        /** The reverse write failed and so did the rollback: the forward record is orphaned. */
        ORPHANED
    }

    public boolean isCreated() {
        return outcome == Outcome.CREATED;
    }

    /**
     * True for the one state that breaks the both-or-neither invariant.
     */
    public boolean isPartialState() {
        return outcome == Outcome.ORPHANED;
    }
}
