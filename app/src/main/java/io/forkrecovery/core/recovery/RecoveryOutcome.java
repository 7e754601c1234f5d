package io.forkrecovery.core.recovery;

import io.forkrecovery.core.protocol.HashChain;

import java.util.Objects;

/**
 * Terminal result of one recovery attempt.
 * newChain is set unless aborted; reason is set only when aborted.
 */
public record RecoveryOutcome(Status status, HashChain newChain, FailureReason reason, String detail, int blocksVerified) {

    public enum Status {
        RECOVERED,
        ABORTED,
        ALREADY_SYNCHRONIZED
    }

    public RecoveryOutcome {
        Objects.requireNonNull(status, "status");
        if (status == Status.ABORTED) {
            Objects.requireNonNull(reason, "reason");
        } else {
            Objects.requireNonNull(newChain, "newChain");
        }
    }

    public static RecoveryOutcome recovered(HashChain newChain, int blocksVerified) {
        return new RecoveryOutcome(Status.RECOVERED, newChain, null, null, blocksVerified);
    }

    public static RecoveryOutcome aborted(FailureReason reason, String detail, int blocksVerified) {
        return new RecoveryOutcome(Status.ABORTED, null, reason, detail, blocksVerified);
    }

    public static RecoveryOutcome alreadySynchronized(HashChain localChain) {
        return new RecoveryOutcome(Status.ALREADY_SYNCHRONIZED, localChain, null, null, 0);
    }

    public boolean isRecovered() {
        return status == Status.RECOVERED;
    }

    public boolean isAborted() {
        return status == Status.ABORTED;
    }
}
