package io.forkrecovery.core.consensus;

import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.Hash;
import io.forkrecovery.core.protocol.HashChain;

/** Picks the recall block whose presence must be proven to extend {@code block}. */
@FunctionalInterface
public interface RecallSelector {
    Hash selectRecallHash(Block block, HashChain chain);
}
