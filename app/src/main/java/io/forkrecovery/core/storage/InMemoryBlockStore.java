package io.forkrecovery.core.storage;

import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.Hash;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Simple in-memory block store for tests and throwaway nodes.
 * writeBlocks holds the store lock for the whole batch, so readers never see half a commit.
 */
public final class InMemoryBlockStore implements LocalBlockStore {

    private final Map<Hash, Block> blocks = new HashMap<>();

    /** Current head (best tip) */
    private Hash head; // null until set

    @Override
    public synchronized Optional<Block> readBlock(Hash hash) {
        if (hash == null) return Optional.empty();
        return Optional.ofNullable(blocks.get(hash));
    }

    @Override
    public synchronized void writeBlocks(List<Block> batch) {
        if (batch == null || batch.isEmpty()) return;
        for (Block block : batch) {
            if (block == null) throw new StorageException("null block in batch");
        }
        for (Block block : batch) {
            blocks.put(block.indepHash(), block);
        }
    }

    @Override
    public synchronized Optional<Hash> getHead() {
        return Optional.ofNullable(head);
    }

    @Override
    public synchronized void setHead(Hash hash) {
        if (hash == null) {
            head = null;
            return;
        }
        if (!blocks.containsKey(hash)) {
            throw new IllegalArgumentException("Unknown head hash (store the block first)");
        }
        head = hash;
    }

    @Override
    public synchronized long size() {
        return blocks.size();
    }
}
