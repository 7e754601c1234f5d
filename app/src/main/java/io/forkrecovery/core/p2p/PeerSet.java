package io.forkrecovery.core.p2p;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** Ordered, immutable set of peer node ids used for all fetches of one recovery. */
public record PeerSet(List<String> peers) {
    public PeerSet {
        Objects.requireNonNull(peers, "peers");
        peers = peers.stream().filter(p -> p != null && !p.isBlank()).distinct().toList();
    }

    public static PeerSet of(String... peers) {
        return new PeerSet(Arrays.asList(peers));
    }

    public boolean isEmpty() {
        return peers.isEmpty();
    }

    public int size() {
        return peers.size();
    }
}
