package io.forkrecovery.core.recovery;

import io.forkrecovery.core.common.ChainFixture;
import io.forkrecovery.core.common.FakeBlockSource;
import io.forkrecovery.core.common.RecordingListener;
import io.forkrecovery.core.node.RecoveryConfig;
import io.forkrecovery.core.p2p.PeerBlockSource;
import io.forkrecovery.core.p2p.PeerSet;
import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.Hash;
import io.forkrecovery.core.protocol.HashChain;
import io.forkrecovery.core.storage.InMemoryBlockStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ForkRecoveryServiceTest {

    private static final RecoveryConfig CONFIG = RecoveryConfig.defaultLocal().withRetries(2, 0L);

    private final List<Block> chain = ChainFixture.chain(7);
    private final List<Block> local = chain.subList(0, 5);
    private final RecordingListener listener = new RecordingListener();
    private ForkRecoveryService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.shutdown();
        }
    }

    @Test
    void recoversOnWorkerAndNotifiesOnce() throws Exception {
        service = serviceWith(new FakeBlockSource().peer("peer-1", chain));

        RecoveryHandle handle = service.startRecovery(PeerSet.of("peer-1"), chain.get(7), chainOf(local));
        RecoveryOutcome outcome = handle.await(10, TimeUnit.SECONDS);

        assertTrue(outcome.isRecovered());
        assertEquals(chain.get(7).chain(), outcome.newChain());
        assertTrue(handle.session().isPresent());
        assertEquals(1, listener.recovered.size());
        assertTrue(service.activeRecovery().isEmpty());
    }

    @Test
    void targetAlreadyOnLocalChainIsSynchronized() throws Exception {
        service = serviceWith(new FakeBlockSource());
        HashChain localChain = chainOf(local);

        RecoveryHandle handle = service.startRecovery(PeerSet.of("peer-1"), local.get(3), localChain);

        assertTrue(handle.isDone());
        assertTrue(handle.session().isEmpty());
        RecoveryOutcome outcome = handle.await(1, TimeUnit.SECONDS);
        assertEquals(RecoveryOutcome.Status.ALREADY_SYNCHRONIZED, outcome.status());
        assertEquals(localChain, outcome.newChain());
        assertTrue(listener.recovered.isEmpty());
    }

    @Test
    void newRecoveryCancelsTheActiveOne() throws Exception {
        CountDownLatch slowStarted = new CountDownLatch(1);
        FakeBlockSource fast = new FakeBlockSource().peer("fast", chain);
        PeerBlockSource source = (peers, hash) -> {
            if (peers.peers().contains("slow")) {
                slowStarted.countDown();
                return blockUntilInterrupted();
            }
            return fast.getBlock(peers, hash);
        };
        service = serviceWith(source);

        RecoveryHandle first = service.startRecovery(PeerSet.of("slow"), chain.get(6), chainOf(local));
        assertTrue(slowStarted.await(5, TimeUnit.SECONDS));
        assertTrue(service.activeRecovery().isPresent());

        RecoveryHandle second = service.startRecovery(PeerSet.of("fast"), chain.get(7), chainOf(local));

        RecoveryOutcome firstOutcome = first.await(5, TimeUnit.SECONDS);
        assertEquals(FailureReason.CANCELLED, firstOutcome.reason());
        RecoveryOutcome secondOutcome = second.await(10, TimeUnit.SECONDS);
        assertTrue(secondOutcome.isRecovered());
        assertEquals(List.of(secondOutcome.newChain()),
                listener.recovered.stream().map(ForkRecovered::newChain).collect(Collectors.toList()));
    }

    @Test
    void repeatedRequestForCoveredTargetJoinsActiveSession() throws Exception {
        CountDownLatch firstFetch = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FakeBlockSource peer = new FakeBlockSource().peer("peer-1", chain);
        service = serviceWith((peers, hash) -> {
            firstFetch.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("interrupted");
            }
            return peer.getBlock(peers, hash);
        });

        RecoveryHandle first = service.startRecovery(PeerSet.of("peer-1"), chain.get(7), chainOf(local));
        assertTrue(firstFetch.await(5, TimeUnit.SECONDS));

        RecoveryHandle again = service.startRecovery(PeerSet.of("peer-2"), chain.get(7), chainOf(local));
        RecoveryHandle ancestor = service.startRecovery(PeerSet.of("peer-3"), chain.get(6), chainOf(local));
        release.countDown();

        assertSame(first, again);
        assertSame(first, ancestor);
        RecoveryOutcome outcome = first.await(10, TimeUnit.SECONDS);
        assertTrue(outcome.isRecovered());
        assertEquals(chain.get(7).chain(), outcome.newChain());
        assertEquals(1, listener.recovered.size());
    }

    @Test
    void shutdownCancelsActiveSessionAndRejectsNewOnes() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        service = serviceWith((peers, hash) -> {
            started.countDown();
            return blockUntilInterrupted();
        });

        RecoveryHandle handle = service.startRecovery(PeerSet.of("peer-1"), chain.get(7), chainOf(local));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        service.shutdown();

        assertEquals(FailureReason.CANCELLED, handle.await(5, TimeUnit.SECONDS).reason());
        assertThrows(IllegalStateException.class,
                () -> service.startRecovery(PeerSet.of("peer-1"), chain.get(7), chainOf(local)));
    }

    private ForkRecoveryService serviceWith(PeerBlockSource source) {
        InMemoryBlockStore store = new InMemoryBlockStore();
        store.writeBlocks(local);
        store.setHead(ChainFixture.last(local).indepHash());
        return new ForkRecoveryService(
                new RecoveryContext(source, store, ChainFixture.validator(), ChainFixture.RECALL, CONFIG), listener);
    }

    private static Optional<Block> blockUntilInterrupted() {
        try {
            new CountDownLatch(1).await();
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted");
        }
    }

    private static HashChain chainOf(List<Block> blocks) {
        return HashChain.ofOldestFirst(blocks.stream().map(Block::indepHash).collect(Collectors.<Hash>toList()));
    }
}
