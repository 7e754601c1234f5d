package io.forkrecovery.core.recovery;

/** A recovery step failed; carries the classification used for the terminal outcome. */
public final class RecoveryStepException extends RuntimeException {
    private final FailureReason reason;

    public RecoveryStepException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RecoveryStepException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason reason() {
        return reason;
    }
}
