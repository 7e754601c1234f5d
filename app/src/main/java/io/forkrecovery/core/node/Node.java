package io.forkrecovery.core.node;

import io.forkrecovery.core.consensus.ModuloRecallSelector;
import io.forkrecovery.core.consensus.RecallSelector;
import io.forkrecovery.core.consensus.WeaveChainValidator;
import io.forkrecovery.core.p2p.P2pBlockSource;
import io.forkrecovery.core.p2p.P2pMessage;
import io.forkrecovery.core.p2p.P2pServer;
import io.forkrecovery.core.p2p.PeerSet;
import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.BlockCodec;
import io.forkrecovery.core.protocol.Hash;
import io.forkrecovery.core.protocol.HashChain;
import io.forkrecovery.core.recovery.ForkRecovered;
import io.forkrecovery.core.recovery.ForkRecoveryService;
import io.forkrecovery.core.recovery.RecoveryContext;
import io.forkrecovery.core.recovery.RecoveryHandle;
import io.forkrecovery.core.recovery.RecoveryListener;
import io.forkrecovery.core.recovery.RecoveryOutcome;
import io.forkrecovery.core.storage.InMemoryBlockStore;
import io.forkrecovery.core.storage.LocalBlockStore;
import io.forkrecovery.core.storage.RocksDBBlockStore;

import java.util.Collection;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires storage, consensus, the P2P transport and fork recovery.
 * Start once; blocks announced by peers either extend the tip directly or,
 * when they belong to a longer chain we do not have, trigger a recovery.
 */
public final class Node implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final String nodeId;
    private final RecoveryConfig config;
    private final LocalBlockStore store;
    private final RecallSelector recallSelector = new ModuloRecallSelector();
    private final WeaveChainValidator validator;
    private final P2pServer p2p;
    private final ForkRecoveryService recovery;

    private volatile HashChain canonical = HashChain.empty();

    public Node(String nodeId, int p2pPort, LocalBlockStore store, RecoveryConfig config) {
        this.nodeId = nodeId;
        this.config = config;
        this.store = store;
        this.validator = new WeaveChainValidator(recallSelector, config.maxFutureDriftMillis, config.maxDifficultyStep);
        this.p2p = new P2pServer(nodeId, p2pPort, store::readBlock, new AnnouncementListener());
        RecoveryContext context = new RecoveryContext(
                new P2pBlockSource(p2p, config.peerRequestTimeoutMillis),
                store, validator, recallSelector, config);
        this.recovery = new ForkRecoveryService(context, new AdoptingListener());
    }

    /** Convenience factory for an in-memory node. */
    public static Node inMemory(String nodeId, int p2pPort, RecoveryConfig config) {
        return new Node(nodeId, p2pPort, new InMemoryBlockStore(), config);
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static Node rocks(String nodeId, int p2pPort, RecoveryConfig config, String dataDir) {
        return new Node(nodeId, p2pPort, RocksDBBlockStore.open(dataDir), config);
    }

    /** Ensure genesis exists, load the canonical chain and start listening for peers. */
    public void start() {
        synchronized (this) {
            Block head = Genesis.initIfNeeded(store, config.genesisAllocations, config.difficultyBits);
            canonical = head.chain();
            LOG.info(() -> "Node " + nodeId + " at height " + head.height() + " (" + head.indepHash() + ")");
        }
        p2p.start();
    }

    public void connect(Collection<String> endpoints) {
        p2p.connect(endpoints);
    }

    public void connect(String host, int port) {
        p2p.connect(host, port);
    }

    /**
     * Accept a block that directly extends the current tip: validate, persist, move head and announce.
     *
     * @return false when the block does not extend the tip or fails validation
     */
    public synchronized boolean acceptBlock(Block block) {
        Block tip = tip();
        if (!block.previousBlock().equals(tip.indepHash())) {
            return false;
        }
        Optional<Block> recall = store.readBlock(recallSelector.selectRecallHash(tip, tip.hashList()));
        if (recall.isEmpty()) {
            LOG.warning(() -> "Recall block for " + block + " is not stored locally");
            return false;
        }
        var updated = validator.applyTransactions(tip.walletState(), block.transactions());
        Optional<String> violation = validator.findViolation(tip.chain(), updated, block, tip, recall.get());
        if (violation.isPresent()) {
            LOG.info(() -> "Rejected " + block + ": " + violation.get());
            return false;
        }
        store.writeBlock(block);
        store.setHead(block.indepHash());
        canonical = block.chain();
        LOG.info(() -> "Accepted " + block);
        p2p.announce(block);
        return true;
    }

    /** Recover towards a block from the given peers, on the recovery worker. */
    public RecoveryHandle recover(PeerSet peers, Block target) {
        return recovery.startRecovery(peers, target, canonical);
    }

    /** Head block of the canonical chain. */
    public Block tip() {
        Hash head = canonical.tip().orElseThrow(() -> new IllegalStateException("Node not started"));
        return store.readBlock(head).orElseThrow(() -> new IllegalStateException("Head " + head + " is not stored"));
    }

    public long height() {
        return canonical.size() - 1L;
    }

    public HashChain canonicalChain() {
        return canonical;
    }

    public String nodeId() {
        return nodeId;
    }

    public LocalBlockStore store() {
        return store;
    }

    public P2pServer p2p() {
        return p2p;
    }

    public ForkRecoveryService recovery() {
        return recovery;
    }

    private void onAnnounced(String peerId, Block block) {
        if (store.contains(block.indepHash())) {
            return;
        }
        if (block.previousBlock().equals(canonical.tip().orElse(null)) && acceptBlock(block)) {
            return;
        }
        if (block.height() > height()) {
            LOG.info(() -> "Peer " + peerId + " announced " + block + " above our height " + height() + "; recovering");
            recover(PeerSet.of(peerId), block);
        } else {
            LOG.fine(() -> "Ignoring " + block + " from " + peerId + " at or below our height");
        }
    }

    private synchronized void adopt(HashChain newChain) {
        if (newChain.size() <= canonical.size()) {
            LOG.info(() -> "Recovered chain of height " + (newChain.size() - 1) + " is no longer longer than ours");
            return;
        }
        Hash tipHash = newChain.tip().orElseThrow();
        store.setHead(tipHash);
        canonical = newChain;
        LOG.info(() -> "Adopted recovered chain at height " + height() + " (" + tipHash + ")");
        store.readBlock(tipHash).ifPresent(p2p::announce);
    }

    /** Stop recovery and networking, then close the store if it holds resources. */
    @Override
    public void close() {
        recovery.shutdown();
        p2p.stop();
        if (store instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close block store", e);
            }
        }
    }

    private final class AnnouncementListener implements P2pServer.PeerListener {
        @Override
        public void onPeerConnected(P2pServer.Peer peer) {
            LOG.info(() -> "Peer connected: " + peer);
        }

        @Override
        public void onPeerDisconnected(P2pServer.Peer peer) {
            LOG.info(() -> "Peer disconnected: " + peer);
        }

        @Override
        public void onMessage(P2pServer.Peer peer, P2pMessage message) {
            if (!P2pMessage.NEW_BLOCK.equals(message.type())) {
                return;
            }
            try {
                onAnnounced(peer.nodeId(), BlockCodec.fromObject(message.payload().get("block")));
            } catch (IllegalArgumentException e) {
                LOG.log(Level.WARNING, "Malformed new_block from " + peer.nodeId(), e);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Handling new_block from " + peer.nodeId() + " failed", e);
            }
        }
    }

    private final class AdoptingListener implements RecoveryListener {
        @Override
        public void onForkRecovered(ForkRecovered message) {
            adopt(message.newChain());
        }

        @Override
        public void onRecoveryAborted(RecoveryOutcome outcome) {
            LOG.info(() -> "Staying on height " + height() + " after " + outcome.reason());
        }
    }
}
