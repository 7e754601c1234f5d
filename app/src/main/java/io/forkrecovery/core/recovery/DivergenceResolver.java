package io.forkrecovery.core.recovery;

import io.forkrecovery.core.protocol.Hash;

import java.util.List;

/**
 * Finds the part of a target chain the local node does not share.
 */
public final class DivergenceResolver {
    private DivergenceResolver() {}

    /**
     * Walk both oldest-first chains in step, drop positions with equal hashes and stop at the
     * first mismatch or at the end of either chain.
     *
     * @return the remaining suffix of {@code targetChain}, oldest-first; empty when the local
     *         chain already contains all of it
     */
    public static List<Hash> resolve(List<Hash> localChain, List<Hash> targetChain) {
        int shared = 0;
        int limit = Math.min(localChain.size(), targetChain.size());
        while (shared < limit && localChain.get(shared).equals(targetChain.get(shared))) {
            shared++;
        }
        return List.copyOf(targetChain.subList(shared, targetChain.size()));
    }
}
