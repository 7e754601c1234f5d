package io.forkrecovery.core.recovery;

import io.forkrecovery.core.p2p.PeerSet;
import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.Hash;
import io.forkrecovery.core.protocol.HashChain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Runs recovery sessions one at a time on a dedicated worker thread.
 * Starting a recovery towards a block outside the active target's chain cancels the one in flight,
 * so two sessions never write to storage together. A request the active session already covers
 * joins it instead.
 */
public final class ForkRecoveryService implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ForkRecoveryService.class.getName());

    private final RecoveryContext context;
    private final RecoveryListener listener;
    private final ExecutorService worker;
    private RecoveryHandle active;   // guarded by this

    public ForkRecoveryService(RecoveryContext context, RecoveryListener listener) {
        this.context = Objects.requireNonNull(context, "context");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "fork-recovery");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start recovering towards {@code target}. When the local chain already holds the target's
     * whole chain no session is started and the handle completes as already synchronized. When the
     * active session's target chain already includes {@code target}, that session's handle is returned.
     */
    public synchronized RecoveryHandle startRecovery(PeerSet peers, Block target, HashChain localChain) {
        Objects.requireNonNull(peers, "peers");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(localChain, "localChain");
        if (worker.isShutdown()) {
            throw new IllegalStateException("Fork recovery service is shut down");
        }

        List<Hash> missing = DivergenceResolver.resolve(localChain.oldestFirst(), target.chain().oldestFirst());
        if (missing.isEmpty()) {
            LOG.fine(() -> "Already on the chain of " + target);
            return RecoveryHandle.completed(RecoveryOutcome.alreadySynchronized(localChain));
        }

        if (active != null && !active.isDone()) {
            Optional<Block> activeTarget = active.session().map(RecoverySession::target);
            if (activeTarget.isPresent() && activeTarget.get().chain().contains(target.indepHash())) {
                LOG.fine(() -> "Recovery towards " + activeTarget.get() + " already covers " + target);
                return active;
            }
            LOG.info(() -> "Superseding recovery towards " + active.session().map(RecoverySession::target).orElse(null)
                    + " with " + target);
            active.cancel();
        }
        RecoverySession session = RecoverySession.create(peers, target, localChain, context, listener);
        Future<?> task = worker.submit(session::run);
        active = new RecoveryHandle(session, task);
        return active;
    }

    /** The session currently running or queued, if any. */
    public synchronized Optional<RecoveryHandle> activeRecovery() {
        return active == null || active.isDone() ? Optional.empty() : Optional.of(active);
    }

    /** Cancel the active session and stop the worker. */
    public void shutdown() {
        synchronized (this) {
            if (active != null) {
                active.cancel();
            }
            worker.shutdown();
        }
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
