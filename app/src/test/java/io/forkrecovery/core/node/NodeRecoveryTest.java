package io.forkrecovery.core.node;

import io.forkrecovery.core.common.ChainFixture;
import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.state.WalletState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class NodeRecoveryTest {

    private static final RecoveryConfig CONFIG = RecoveryConfig.defaultLocal()
            .withDifficulty(ChainFixture.DIFFICULTY)
            .withGenesisAllocations(ChainFixture.ALLOCATIONS)
            .withRetries(3, 50L)
            .withTimeouts(2_000L, 0L);

    private final List<Node> nodes = new CopyOnWriteArrayList<>();

    @TempDir
    Path dataDir;

    @AfterEach
    void tearDown() {
        for (Node node : nodes) {
            node.close();
        }
        nodes.clear();
    }

    @Test
    void laggingNodeRecoversAnnouncedChain() throws Exception {
        Node a = startNode("node-A");
        Node b = startNode("node-B");
        assertEquals(ChainFixture.genesis().indepHash(), a.tip().indepHash());

        List<Block> blocks = ChainFixture.extend(ChainFixture.genesis(), 5);
        for (Block block : blocks) {
            assertTrue(a.acceptBlock(block));
        }
        connect(b, a);

        Block b6 = ChainFixture.next(ChainFixture.last(blocks));
        assertTrue(a.acceptBlock(b6));

        waitUntil(() -> b.height() == 6, 10_000L);
        assertEquals(b6.indepHash(), b.tip().indepHash());
        assertEquals(a.canonicalChain(), b.canonicalChain());
        for (Block block : blocks) {
            assertTrue(b.store().contains(block.indepHash()));
        }
    }

    @Test
    void nodeOnShorterForkSwitchesToLongerChain() throws Exception {
        Node a = startNode("node-A");
        Node b = startNode("node-B");
        Block genesis = ChainFixture.genesis();

        List<Block> common = ChainFixture.extend(genesis, 2);
        for (Block block : common) {
            assertTrue(a.acceptBlock(block));
            assertTrue(b.acceptBlock(block));
        }
        List<Block> localFork = ChainFixture.extend(ChainFixture.last(common), 1, 700L);
        List<Block> remoteFork = ChainFixture.extend(ChainFixture.last(common), 3);
        assertTrue(b.acceptBlock(localFork.get(0)));
        for (Block block : remoteFork.subList(0, 2)) {
            assertTrue(a.acceptBlock(block));
        }
        connect(b, a);

        assertTrue(a.acceptBlock(remoteFork.get(2)));

        waitUntil(() -> b.height() == 5, 10_000L);
        assertEquals(a.tip().indepHash(), b.tip().indepHash());
        assertTrue(b.store().contains(localFork.get(0).indepHash()));
        assertFalse(b.canonicalChain().contains(localFork.get(0).indepHash()));
    }

    @Test
    void acceptBlockRejectsInvalidSuccessor() {
        Node a = startNode("node-A");
        Block genesis = ChainFixture.genesis();
        Block bad = ChainFixture.mine(genesis, builder -> builder.walletState(WalletState.fromAllocations(Map.of("mallory", 1L))));
        Block notOnTip = ChainFixture.next(ChainFixture.next(genesis));

        assertFalse(a.acceptBlock(bad));
        assertFalse(a.acceptBlock(notOnTip));
        assertEquals(0, a.height());
    }

    @Test
    void rocksNodeKeepsHeadAcrossRestart() throws Exception {
        List<Block> blocks = ChainFixture.extend(ChainFixture.genesis(), 3);
        Node first = Node.rocks("node-R", freePort(), CONFIG, dataDir.toString());
        first.start();
        for (Block block : blocks) {
            assertTrue(first.acceptBlock(block));
        }
        first.close();

        Node second = Node.rocks("node-R", freePort(), CONFIG, dataDir.toString());
        nodes.add(second);
        second.start();
        assertEquals(3, second.height());
        assertEquals(ChainFixture.last(blocks).indepHash(), second.tip().indepHash());
    }

    private Node startNode(String nodeId) {
        try {
            Node node = Node.inMemory(nodeId, freePort(), CONFIG);
            nodes.add(node);
            node.start();
            return node;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static void connect(Node from, Node to) throws Exception {
        from.connect("127.0.0.1", to.p2p().port());
        waitUntil(() -> from.p2p().peers().size() == 1 && to.p2p().peers().size() == 1, 5_000L);
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }

    private static void waitUntil(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within " + timeoutMillis + " ms");
            }
            Thread.sleep(25L);
        }
    }
}
