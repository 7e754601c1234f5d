package io.forkrecovery.core.recovery;

/**
 * Why a recovery session stopped short of its target.
 * Transient reasons are worth asking again (another peer, later); permanent ones are not.
 */
public enum FailureReason {
    /** A peer or the local store could not produce a requested block. */
    MISSING_BLOCK(true),
    /** A peer produced something other than the requested block. */
    MALFORMED_BLOCK(true),
    /** The consensus gate refused a block. */
    VALIDATION_REJECTED(false),
    /** The recovered chain could not be persisted. */
    STORAGE_FAILURE(false),
    /** The work list ran out before the target was reached. */
    PENDING_EXHAUSTED(false),
    CANCELLED(false),
    TIMED_OUT(false),
    UNEXPECTED_ERROR(false);

    private final boolean transientFailure;

    FailureReason(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
