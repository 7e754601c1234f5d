package io.forkrecovery.core.recovery;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** Caller's view of a recovery started by {@link ForkRecoveryService}. */
public final class RecoveryHandle {
    private final RecoverySession session;   // null when no session was needed
    private final Future<?> task;
    private final CompletableFuture<RecoveryOutcome> outcome;

    RecoveryHandle(RecoverySession session, Future<?> task) {
        this.session = session;
        this.task = task;
        this.outcome = session.completion();
    }

    private RecoveryHandle(RecoveryOutcome completed) {
        this.session = null;
        this.task = null;
        this.outcome = CompletableFuture.completedFuture(completed);
    }

    static RecoveryHandle completed(RecoveryOutcome outcome) {
        return new RecoveryHandle(outcome);
    }

    public Optional<RecoverySession> session() {
        return Optional.ofNullable(session);
    }

    public CompletableFuture<RecoveryOutcome> outcome() {
        return outcome;
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    /** Wait for the terminal outcome. */
    public RecoveryOutcome await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            return outcome.get(timeout, unit);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Recovery session failed without an outcome", e.getCause());
        }
    }

    /** Cancel the session; a blocking peer fetch in progress is interrupted. */
    public void cancel() {
        if (session == null) return;
        session.cancel();
        if (task != null) {
            task.cancel(true);
        }
    }
}
