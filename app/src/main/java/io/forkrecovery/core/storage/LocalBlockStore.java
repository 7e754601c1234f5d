package io.forkrecovery.core.storage;

import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.Hash;

import java.util.List;
import java.util.Optional;

/**
 * Local block persistence, keyed by independent hash.
 */
public interface LocalBlockStore {

    /** Fetch a block by its independent hash. */
    Optional<Block> readBlock(Hash hash);

    /**
     * Persist a finished sequence of blocks as one atomic commit.
     * Idempotent for blocks that are already stored.
     *
     * @throws StorageException if the commit fails; then none of the blocks count as written
     */
    void writeBlocks(List<Block> blocks);

    /** Current canonical tip, if one was set. */
    Optional<Hash> getHead();

    /** Point the canonical tip at a stored block. */
    void setHead(Hash hash);

    /** Number of stored blocks. */
    long size();

    default void writeBlock(Block block) {
        writeBlocks(List.of(block));
    }

    default boolean contains(Hash hash) {
        return readBlock(hash).isPresent();
    }
}
