package io.forkrecovery.core.storage;

import io.forkrecovery.core.common.ChainFixture;
import io.forkrecovery.core.protocol.Block;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static io.forkrecovery.core.common.ChainFixture.ALICE;
import static io.forkrecovery.core.common.ChainFixture.BOB;
import static org.junit.jupiter.api.Assertions.*;

class RocksDBBlockStoreTest {

    @TempDir
    Path dataDir;

    @Test
    void blocksAndHeadSurviveReopen() {
        Block genesis = ChainFixture.genesis();
        Block b1 = ChainFixture.next(genesis, List.of(ChainFixture.transfer(ALICE, BOB, 42L, 0L)));
        Block b2 = ChainFixture.next(b1);

        try (RocksDBBlockStore store = RocksDBBlockStore.open(dataDir.toString())) {
            store.writeBlocks(List.of(genesis, b1, b2));
            store.setHead(b2.indepHash());
        }

        try (RocksDBBlockStore store = RocksDBBlockStore.open(dataDir.toString())) {
            assertEquals(3, store.size());
            assertEquals(b2.indepHash(), store.getHead().orElseThrow());
            Block read = store.readBlock(b1.indepHash()).orElseThrow();
            assertEquals(b1.indepHash(), read.indepHash());
            assertEquals(b1.walletState(), read.walletState());
            assertEquals(b1.transactions(), read.transactions());
            assertEquals(b1.hashList(), read.hashList());
        }
    }

    @Test
    void unknownHeadIsRejected() {
        try (RocksDBBlockStore store = RocksDBBlockStore.open(dataDir.toString())) {
            assertTrue(store.getHead().isEmpty());
            assertThrows(IllegalArgumentException.class, () -> store.setHead(ChainFixture.genesis().indepHash()));
        }
    }
}
