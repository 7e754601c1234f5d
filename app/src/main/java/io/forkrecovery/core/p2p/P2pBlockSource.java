package io.forkrecovery.core.p2p;

import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.Hash;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PeerBlockSource over the Netty transport: asks each peer of the set in order
 * and returns the first block produced, waiting at most requestTimeoutMillis per peer.
 */
public final class P2pBlockSource implements PeerBlockSource {
    private static final Logger LOG = Logger.getLogger(P2pBlockSource.class.getName());

    private final P2pServer server;
    private final long requestTimeoutMillis;

    public P2pBlockSource(P2pServer server, long requestTimeoutMillis) {
        this.server = server;
        this.requestTimeoutMillis = Math.max(1L, requestTimeoutMillis);
    }

    @Override
    public Optional<Block> getBlock(PeerSet peers, Hash hash) {
        for (String peer : peers.peers()) {
            CompletableFuture<Optional<Block>> request = server.requestBlock(peer, hash);
            try {
                Optional<Block> block = request.get(requestTimeoutMillis, TimeUnit.MILLISECONDS);
                if (block.isPresent()) {
                    return block;
                }
                LOG.fine(() -> "Peer " + peer + " has no block " + hash);
            } catch (TimeoutException e) {
                request.cancel(false);
                LOG.fine(() -> "Peer " + peer + " timed out serving " + hash);
            } catch (ExecutionException e) {
                LOG.log(Level.FINE, "Peer " + peer + " failed serving " + hash, e.getCause());
            } catch (InterruptedException e) {
                request.cancel(false);
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while fetching " + hash);
            }
        }
        return Optional.empty();
    }
}
