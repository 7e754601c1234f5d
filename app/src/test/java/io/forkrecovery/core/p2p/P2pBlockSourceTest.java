package io.forkrecovery.core.p2p;

import io.forkrecovery.core.common.ChainFixture;
import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.Hash;
import io.forkrecovery.core.storage.InMemoryBlockStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class P2pBlockSourceTest {

    private final List<P2pServer> servers = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        for (P2pServer server : servers) {
            server.stop();
        }
        servers.clear();
    }

    @Test
    void fetchesBlocksFromConnectedPeer() throws Exception {
        List<Block> chain = ChainFixture.chain(3);
        InMemoryBlockStore storeA = new InMemoryBlockStore();
        storeA.writeBlocks(chain);

        CountDownLatch handshake = new CountDownLatch(2);
        P2pServer serverA = createServer("node-A", storeA, handshake);
        P2pServer serverB = createServer("node-B", new InMemoryBlockStore(), handshake);
        serverA.start();
        serverB.start();
        serverB.connect("127.0.0.1", serverA.port());
        assertTrue(handshake.await(5, TimeUnit.SECONDS), "Peers should handshake in time");

        P2pBlockSource source = new P2pBlockSource(serverB, 2_000L);
        Block wanted = chain.get(2);

        Optional<Block> fetched = source.getBlock(PeerSet.of("node-A"), wanted.indepHash());
        assertEquals(Optional.of(wanted), fetched);
        assertEquals(wanted.chain(), fetched.orElseThrow().chain());

        // Unknown peers are skipped; the next one in the set is asked.
        assertEquals(Optional.of(wanted), source.getBlock(PeerSet.of("ghost", "node-A"), wanted.indepHash()));
        assertTrue(source.getBlock(PeerSet.of("node-A"), Hash.ZERO).isEmpty());
        assertTrue(source.getBlock(PeerSet.of("ghost"), wanted.indepHash()).isEmpty());
    }

    @Test
    void stoppedServerCompletesOutstandingRequestsEmpty() throws Exception {
        CountDownLatch handshake = new CountDownLatch(2);
        P2pServer serverA = createServer("node-A", new InMemoryBlockStore(), handshake);
        P2pServer serverB = createServer("node-B", new InMemoryBlockStore(), handshake);
        serverA.start();
        serverB.start();
        serverB.connect("127.0.0.1", serverA.port());
        assertTrue(handshake.await(5, TimeUnit.SECONDS));

        var request = serverB.requestBlock("node-A", ChainFixture.genesis().indepHash());
        assertEquals(Optional.empty(), request.get(5, TimeUnit.SECONDS));

        serverB.stop();
        servers.remove(serverB);
        assertEquals(Optional.empty(),
                serverB.requestBlock("node-A", Hash.ZERO).get(1, TimeUnit.SECONDS));
    }

    private P2pServer createServer(String nodeId, InMemoryBlockStore store, CountDownLatch handshake) throws Exception {
        int port = freePort();
        P2pServer server = new P2pServer(nodeId, port, store::readBlock, new HandshakeListener(handshake));
        servers.add(server);
        return server;
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }

    private static final class HandshakeListener implements P2pServer.PeerListener {
        private final CountDownLatch latch;

        HandshakeListener(CountDownLatch latch) {
            this.latch = latch;
        }

        @Override
        public void onPeerConnected(P2pServer.Peer peer) {
            latch.countDown();
        }

        @Override
        public void onPeerDisconnected(P2pServer.Peer peer) {
        }

        @Override
        public void onMessage(P2pServer.Peer peer, P2pMessage message) {
        }
    }
}
