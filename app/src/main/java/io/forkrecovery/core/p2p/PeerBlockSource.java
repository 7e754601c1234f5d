package io.forkrecovery.core.p2p;

import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.Hash;

import java.util.Optional;

/** Resolves a block hash to a full block through a set of peers. */
@FunctionalInterface
public interface PeerBlockSource {

    /**
     * Blocking fetch. Empty when no peer of the set could produce the block.
     * Implementations may throw {@link java.util.concurrent.CancellationException} when the
     * calling thread is interrupted.
     */
    Optional<Block> getBlock(PeerSet peers, Hash hash);
}
