package io.forkrecovery.core.recovery;

import io.forkrecovery.core.metrics.RecoveryMetrics;
import io.forkrecovery.core.p2p.PeerSet;
import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.Hash;
import io.forkrecovery.core.protocol.HashChain;
import io.forkrecovery.core.state.WalletState;
import io.forkrecovery.core.storage.StorageException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One attempt to move the local node onto a target block's chain.
 *
 * The session walks the hashes the local chain does not share with the target, oldest first.
 * Each step fetches the next block from peers, finds its predecessor (local store for the first
 * step, the last verified block afterwards), fetches the recall block and runs the consensus
 * gate. Verified blocks are held in memory until the target itself verifies, then all of them
 * are persisted in one batch and the target's chain is reported. Any failure ends the session
 * with nothing persisted.
 *
 * A session runs once. {@link #run()} blocks the calling thread; {@link #cancel()} may be
 * called from any thread.
 */
public final class RecoverySession {
    private static final Logger LOG = Logger.getLogger(RecoverySession.class.getName());

    public enum State {
        INITIALIZING,
        STEPPING,
        RECOVERED,
        ABORTED
    }

    private final PeerSet peers;
    private final Block target;
    private final RecoveryContext context;
    private final RecoveryListener listener;

    // Newest first; confined to the running thread.
    private final Deque<Block> accumulated = new ArrayDeque<>();
    // Oldest first; confined to the running thread.
    private final Deque<Hash> pending;

    private final AtomicReference<State> state = new AtomicReference<>(State.INITIALIZING);
    private final CompletableFuture<RecoveryOutcome> completion = new CompletableFuture<>();
    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private volatile boolean cancelled;
    private long deadline = Long.MAX_VALUE;

    public RecoverySession(PeerSet peers, Block target, List<Hash> pending,
                           RecoveryContext context, RecoveryListener listener) {
        this.peers = Objects.requireNonNull(peers, "peers");
        this.target = Objects.requireNonNull(target, "target");
        this.pending = new ArrayDeque<>(Objects.requireNonNull(pending, "pending"));
        this.context = Objects.requireNonNull(context, "context");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Build a session for {@code target}: the work list is the part of the target's ancestry
     * the local chain does not share, followed by the target itself.
     */
    public static RecoverySession create(PeerSet peers, Block target, HashChain localChain,
                                         RecoveryContext context, RecoveryListener listener) {
        List<Hash> work = new ArrayList<>(DivergenceResolver.resolve(
                localChain.oldestFirst(), target.hashList().oldestFirst()));
        work.add(target.indepHash());
        return new RecoverySession(peers, target, work, context, listener);
    }

    /**
     * Drive the session to a terminal state and return the outcome.
     * Calling it again, or after {@link #cancel()}, returns the outcome already reached.
     */
    public RecoveryOutcome run() {
        if (!state.compareAndSet(State.INITIALIZING, State.STEPPING)) {
            return completion.join();
        }
        RecoveryMetrics.sessionStarted();
        long timeout = context.config().sessionTimeoutMillis;
        if (timeout > 0) {
            deadline = context.clock().getAsLong() + timeout;
        }
        LOG.info(() -> "Fork recovery towards " + target + " started: " + pending.size()
                + " block(s) to verify via " + peers.size() + " peer(s)");
        try {
            while (true) {
                checkContinue();
                Hash next = pending.peekFirst();
                if (next == null) {
                    throw new RecoveryStepException(FailureReason.PENDING_EXHAUSTED,
                            "work list exhausted after " + accumulated.size() + " block(s) without reaching target");
                }
                PredecessorLookup lookup = PredecessorLookup.forAccumulated(accumulated.isEmpty());
                Block verified = RecoveryMetrics.recordStep(() -> step(lookup, next));
                accumulated.addFirst(verified);
                pending.removeFirst();
                RecoveryMetrics.blockVerified();
                LOG.fine(() -> "Verified " + verified);
                if (verified.sameAs(target)) {
                    return finish();
                }
            }
        } catch (RecoveryStepException e) {
            return abort(e.reason(), e.getMessage(), e.getCause());
        } catch (CancellationException e) {
            return abort(FailureReason.CANCELLED, e.getMessage(), null);
        } catch (RuntimeException e) {
            return abort(FailureReason.UNEXPECTED_ERROR, String.valueOf(e.getMessage()), e);
        }
    }

    /** Ask the session to stop. It aborts with CANCELLED at its next check and persists nothing. */
    public void cancel() {
        cancelled = true;
        cancelSignal.countDown();
        if (state.compareAndSet(State.INITIALIZING, State.ABORTED)) {
            // Never started: nobody else will complete it.
            deliverAbort(RecoveryOutcome.aborted(FailureReason.CANCELLED, "cancelled before start", 0));
        }
    }

    public State state() {
        return state.get();
    }

    public Block target() {
        return target;
    }

    /** Completes once with the terminal outcome. */
    public CompletableFuture<RecoveryOutcome> completion() {
        return completion;
    }

    /** Blocks verified so far, newest first. Read after the session has ended. */
    public List<Block> accumulated() {
        return List.copyOf(accumulated);
    }

    /** Hashes still to verify, oldest first. Read after the session has ended. */
    public List<Hash> pending() {
        return List.copyOf(pending);
    }

    private Block step(PredecessorLookup lookup, Hash nextHash) {
        Block next = fetch(nextHash, "block");
        Block predecessor = switch (lookup) {
            case FROM_STORAGE -> readPredecessor(next);
            case FROM_ACCUMULATED -> accumulated.peekFirst();
        };
        Hash recallHash = context.recallSelector().selectRecallHash(predecessor, predecessor.hashList());
        Block recall = fetch(recallHash, "recall block");

        WalletState updated;
        boolean valid;
        try {
            updated = context.validator().applyTransactions(predecessor.walletState(), next.transactions());
            valid = context.validator().validate(predecessor.chain(), updated, next, predecessor, recall);
        } catch (RuntimeException e) {
            throw new RecoveryStepException(FailureReason.VALIDATION_REJECTED,
                    "validator failed on " + next + ": " + e.getMessage(), e);
        }
        if (!valid) {
            throw new RecoveryStepException(FailureReason.VALIDATION_REJECTED,
                    next + " does not extend " + predecessor);
        }
        return next;
    }

    private Block readPredecessor(Block next) {
        Optional<Block> stored;
        try {
            stored = context.store().readBlock(next.previousBlock());
        } catch (StorageException e) {
            throw new RecoveryStepException(FailureReason.STORAGE_FAILURE,
                    "reading predecessor " + next.previousBlock() + " failed", e);
        }
        return stored.orElseThrow(() -> new RecoveryStepException(FailureReason.MISSING_BLOCK,
                "predecessor " + next.previousBlock() + " of " + next + " is not stored locally"));
    }

    /** Fetch a block from the peer set, retrying missing or malformed answers with linear backoff. */
    private Block fetch(Hash hash, String what) {
        int maxAttempts = context.config().maxFetchAttempts;
        for (int attempt = 1; ; attempt++) {
            checkContinue();
            Optional<Block> answer = context.peerSource().getBlock(peers, hash);
            RecoveryStepException failure = classify(hash, what, answer);
            if (failure == null) {
                return answer.get();
            }
            if (attempt >= maxAttempts) {
                throw new RecoveryStepException(failure.reason(),
                        failure.getMessage() + " (" + attempt + " attempt(s))");
            }
            RecoveryMetrics.fetchRetried();
            int failedAttempt = attempt;
            LOG.fine(() -> "Retrying " + what + " " + hash + " after attempt " + failedAttempt + ": " + failure.getMessage());
            backoff(attempt);
        }
    }

    private RecoveryStepException classify(Hash hash, String what, Optional<Block> answer) {
        if (answer.isEmpty()) {
            return new RecoveryStepException(FailureReason.MISSING_BLOCK,
                    what + " " + hash + " not available from " + peers.size() + " peer(s)");
        }
        Block block = answer.get();
        if (!block.indepHash().equals(hash)) {
            return new RecoveryStepException(FailureReason.MALFORMED_BLOCK,
                    "asked for " + what + " " + hash + ", got " + block);
        }
        try {
            block.basicValidate();
        } catch (IllegalArgumentException e) {
            return new RecoveryStepException(FailureReason.MALFORMED_BLOCK,
                    what + " " + hash + " is malformed: " + e.getMessage(), e);
        }
        return null;
    }

    private void backoff(int attempt) {
        long waitMillis = context.config().retryBackoffMillis * attempt;
        if (waitMillis <= 0) return;
        try {
            if (cancelSignal.await(waitMillis, TimeUnit.MILLISECONDS)) {
                throw new RecoveryStepException(FailureReason.CANCELLED, "cancelled during retry backoff");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecoveryStepException(FailureReason.CANCELLED, "interrupted during retry backoff", e);
        }
    }

    private void checkContinue() {
        if (cancelled || Thread.currentThread().isInterrupted()) {
            throw new RecoveryStepException(FailureReason.CANCELLED, "cancelled");
        }
        if (context.clock().getAsLong() > deadline) {
            throw new RecoveryStepException(FailureReason.TIMED_OUT,
                    "deadline of " + context.config().sessionTimeoutMillis + " ms exceeded");
        }
    }

    private RecoveryOutcome finish() {
        List<Block> oldestFirst = new ArrayList<>(accumulated);
        Collections.reverse(oldestFirst);
        try {
            context.store().writeBlocks(oldestFirst);
        } catch (StorageException e) {
            return abort(FailureReason.STORAGE_FAILURE, "persisting " + oldestFirst.size() + " block(s) failed", e);
        }
        HashChain newChain = target.chain();
        RecoveryOutcome outcome = RecoveryOutcome.recovered(newChain, accumulated.size());
        state.set(State.RECOVERED);
        RecoveryMetrics.sessionRecovered();
        LOG.info(() -> "Fork recovered at " + target + " after verifying " + outcome.blocksVerified() + " block(s)");
        try {
            listener.onForkRecovered(new ForkRecovered(newChain));
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Recovery listener failed handling fork recovered", e);
        }
        completion.complete(outcome);
        return outcome;
    }

    private RecoveryOutcome abort(FailureReason reason, String detail, Throwable cause) {
        state.set(State.ABORTED);
        RecoveryOutcome outcome = RecoveryOutcome.aborted(reason, detail, accumulated.size());
        String message = "Fork recovery towards " + target + " aborted (" + reason + "): " + detail;
        if (cause != null && reason == FailureReason.UNEXPECTED_ERROR) {
            LOG.log(Level.SEVERE, message, cause);
        } else if (cause != null) {
            LOG.log(Level.WARNING, message, cause);
        } else {
            LOG.warning(message);
        }
        deliverAbort(outcome);
        return outcome;
    }

    private void deliverAbort(RecoveryOutcome outcome) {
        RecoveryMetrics.sessionAborted(outcome.reason().name());
        try {
            listener.onRecoveryAborted(outcome);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Recovery listener failed handling abort", e);
        }
        completion.complete(outcome);
    }
}
