package io.forkrecovery.core.node;

import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.Hash;
import io.forkrecovery.core.protocol.HashChain;
import io.forkrecovery.core.state.WalletState;
import io.forkrecovery.core.storage.LocalBlockStore;

import java.util.List;
import java.util.Map;

/**
 * Creates the genesis block and stores it as head of an empty store.
 * - Height = 0, previous block = 32 zero bytes, empty hash list
 * - Wallets seeded from the configured allocations
 * - Fixed timestamp, so nodes with the same allocations share a genesis
 */
public final class Genesis {
    public static final long TIMESTAMP = 1_700_000_000_000L;

    private Genesis() {}

    public static Block build(Map<String, Long> allocations, long difficultyBits) {
        return Block.builder()
                .height(0)
                .previousBlock(Hash.ZERO)
                .hashList(HashChain.empty())
                .walletState(WalletState.fromAllocations(allocations))
                .transactions(List.of())
                .timestamp(TIMESTAMP)
                .difficulty(difficultyBits)
                .nonce(0)
                .build();
    }

    /**
     * If the store has no head, store genesis and point head at it.
     * Idempotent: returns the existing head block otherwise.
     */
    public static Block initIfNeeded(LocalBlockStore store, Map<String, Long> allocations, long difficultyBits) {
        var head = store.getHead();
        if (head.isPresent()) {
            return store.readBlock(head.get())
                    .orElseThrow(() -> new IllegalStateException("Head " + head.get() + " is not stored"));
        }
        Block genesis = build(allocations, difficultyBits);
        store.writeBlock(genesis);
        store.setHead(genesis.indepHash());
        return genesis;
    }
}
