package io.forkrecovery.core.recovery;

/**
 * Caller side of a recovery session. Exactly one of the two callbacks fires per session.
 */
public interface RecoveryListener {

    /** The target chain was verified and persisted. */
    void onForkRecovered(ForkRecovered message);

    /** The session ended without adopting the target. Nothing was persisted. */
    default void onRecoveryAborted(RecoveryOutcome outcome) {
    }
}
