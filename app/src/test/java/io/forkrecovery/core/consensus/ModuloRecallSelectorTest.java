package io.forkrecovery.core.consensus;

import io.forkrecovery.core.common.ChainFixture;
import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.Hash;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModuloRecallSelectorTest {

    private final ModuloRecallSelector selector = new ModuloRecallSelector();

    @Test
    void blockWithoutAncestryRecallsItself() {
        Block genesis = ChainFixture.genesis();
        assertEquals(genesis.indepHash(), selector.selectRecallHash(genesis, genesis.hashList()));
    }

    @Test
    void indexIsHashModuloChainSizeOverOldestFirst() {
        List<Block> chain = ChainFixture.chain(5);
        Block tip = chain.get(5);
        int expected = tip.indepHash().toUnsigned().mod(BigInteger.valueOf(5)).intValue();

        Hash recall = selector.selectRecallHash(tip, tip.hashList());

        assertEquals(chain.get(expected).indepHash(), recall);
        assertTrue(tip.hashList().contains(recall));
    }
}
