package io.forkrecovery.core.consensus;

import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.Hash;
import io.forkrecovery.core.protocol.HashChain;

import java.math.BigInteger;

/**
 * Recall index = unsigned(block.indepHash) mod chain size, taken over the oldest-first chain.
 * With an empty chain (extending genesis) the block recalls itself.
 */
public final class ModuloRecallSelector implements RecallSelector {

    @Override
    public Hash selectRecallHash(Block block, HashChain chain) {
        if (chain == null || chain.isEmpty()) {
            return block.indepHash();
        }
        int index = block.indepHash().toUnsigned()
                .mod(BigInteger.valueOf(chain.size()))
                .intValue();
        return chain.oldestFirst().get(index);
    }
}
