package io.forkrecovery.core.consensus;

import io.forkrecovery.core.common.ChainFixture;
import io.forkrecovery.core.protocol.Block;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProofOfWorkTest {

    private final ProofOfWork pow = new ProofOfWork();

    @Test
    void leadingZeroBitsAcrossByteBoundary() {
        byte[] hash = new byte[32];
        hash[0] = 0;
        hash[1] = 0x0F;
        assertTrue(ProofOfWork.hasLeadingZeroBits(hash, 12));
        assertFalse(ProofOfWork.hasLeadingZeroBits(hash, 13));
        assertTrue(ProofOfWork.hasLeadingZeroBits(hash, 0));
        assertFalse(ProofOfWork.hasLeadingZeroBits(hash, 257));
    }

    @Test
    void minedBlockMeetsTargetOnlyForItsRecallBlock() {
        Block genesis = ChainFixture.genesis();
        Block b1 = ChainFixture.next(genesis);
        Block b2 = ChainFixture.next(b1);

        assertTrue(pow.meetsTarget(b1, genesis.indepHash()));
        Optional<Block> again = pow.mine(b1, genesis.indepHash(), 1);
        assertEquals(Optional.of(b1), again);
        assertNotEquals(b1.indepHash(), b2.indepHash());
    }

    @Test
    void givesUpAfterMaxTries() {
        Block genesis = ChainFixture.genesis();
        Block hard = ChainFixture.next(genesis).toBuilder().difficulty(200L).nonce(0L).build();
        assertTrue(pow.mine(hard, genesis.indepHash(), 50).isEmpty());
    }
}
