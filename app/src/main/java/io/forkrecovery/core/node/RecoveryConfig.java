package io.forkrecovery.core.node;

import java.util.HashMap;
import java.util.Map;

/** Simple config holder for fork recovery and the node around it. */
public final class RecoveryConfig {
    public final int maxFetchAttempts;
    public final long retryBackoffMillis;
    public final long peerRequestTimeoutMillis;
    public final long sessionTimeoutMillis;      // 0 = no deadline
    public final long maxFutureDriftMillis;
    public final long maxDifficultyStep;
    public final long difficultyBits;
    public final Map<String, Long> genesisAllocations;

    public RecoveryConfig(int maxFetchAttempts,
                          long retryBackoffMillis,
                          long peerRequestTimeoutMillis,
                          long sessionTimeoutMillis,
                          long maxFutureDriftMillis,
                          long maxDifficultyStep,
                          long difficultyBits,
                          Map<String, Long> genesisAllocations) {
        if (maxFetchAttempts < 1) throw new IllegalArgumentException("maxFetchAttempts must be >= 1");
        if (retryBackoffMillis < 0) throw new IllegalArgumentException("retryBackoffMillis must be >= 0");
        if (peerRequestTimeoutMillis <= 0) throw new IllegalArgumentException("peerRequestTimeoutMillis must be > 0");
        if (sessionTimeoutMillis < 0) throw new IllegalArgumentException("sessionTimeoutMillis must be >= 0");
        this.maxFetchAttempts = maxFetchAttempts;
        this.retryBackoffMillis = retryBackoffMillis;
        this.peerRequestTimeoutMillis = peerRequestTimeoutMillis;
        this.sessionTimeoutMillis = sessionTimeoutMillis;
        this.maxFutureDriftMillis = maxFutureDriftMillis;
        this.maxDifficultyStep = maxDifficultyStep;
        this.difficultyBits = difficultyBits;
        this.genesisAllocations = genesisAllocations;
    }

    public static RecoveryConfig defaultLocal() {
        Map<String, Long> alloc = new HashMap<String, Long>();
        alloc.put("alice123456", 1_000_000L);
        alloc.put("bob654321",     500_000L);
        return new RecoveryConfig(
                3,            // fetch attempts per block
                250L,         // linear backoff unit
                5_000L,       // per-peer request timeout
                0L,           // no session deadline
                60_000L,      // timestamp drift allowed into the future
                2L,           // max difficulty change per block
                8L,           // easy PoW for local chains
                alloc
        );
    }

    public RecoveryConfig withRetries(int maxFetchAttempts, long retryBackoffMillis) {
        return new RecoveryConfig(maxFetchAttempts, retryBackoffMillis, peerRequestTimeoutMillis,
                sessionTimeoutMillis, maxFutureDriftMillis, maxDifficultyStep, difficultyBits, genesisAllocations);
    }

    public RecoveryConfig withTimeouts(long peerRequestTimeoutMillis, long sessionTimeoutMillis) {
        return new RecoveryConfig(maxFetchAttempts, retryBackoffMillis, peerRequestTimeoutMillis,
                sessionTimeoutMillis, maxFutureDriftMillis, maxDifficultyStep, difficultyBits, genesisAllocations);
    }

    public RecoveryConfig withDifficulty(long difficultyBits) {
        return new RecoveryConfig(maxFetchAttempts, retryBackoffMillis, peerRequestTimeoutMillis,
                sessionTimeoutMillis, maxFutureDriftMillis, maxDifficultyStep, difficultyBits, genesisAllocations);
    }

    public RecoveryConfig withGenesisAllocations(Map<String, Long> allocations) {
        return new RecoveryConfig(maxFetchAttempts, retryBackoffMillis, peerRequestTimeoutMillis,
                sessionTimeoutMillis, maxFutureDriftMillis, maxDifficultyStep, difficultyBits, allocations);
    }
}
