package io.forkrecovery.core.recovery;

import io.forkrecovery.core.consensus.ChainValidator;
import io.forkrecovery.core.consensus.RecallSelector;
import io.forkrecovery.core.node.RecoveryConfig;
import io.forkrecovery.core.p2p.PeerBlockSource;
import io.forkrecovery.core.storage.LocalBlockStore;

import java.util.Objects;
import java.util.function.LongSupplier;

/** Collaborators shared by every session of a node. */
public record RecoveryContext(PeerBlockSource peerSource,
                              LocalBlockStore store,
                              ChainValidator validator,
                              RecallSelector recallSelector,
                              RecoveryConfig config,
                              LongSupplier clock) {
    public RecoveryContext {
        Objects.requireNonNull(peerSource, "peerSource");
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(validator, "validator");
        Objects.requireNonNull(recallSelector, "recallSelector");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
    }

    public RecoveryContext(PeerBlockSource peerSource, LocalBlockStore store, ChainValidator validator,
                           RecallSelector recallSelector, RecoveryConfig config) {
        this(peerSource, store, validator, recallSelector, config, System::currentTimeMillis);
    }
}
