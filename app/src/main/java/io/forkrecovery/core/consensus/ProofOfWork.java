package io.forkrecovery.core.consensus;

import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.Hash;
import io.forkrecovery.core.protocol.Hashes;
import io.forkrecovery.core.protocol.ProtocolLimits;

import java.util.Optional;

/**
 * Proof of work bound to proof of access:
 * - Proof hash = SHA-256(block.serialize() || recallHash).
 * - block.difficulty is the number of leading zero BITS the proof hash must have.
 *
 * A miner can only produce a valid proof if it holds the recall block, since its hash is
 * part of the hashed data.
 */
public final class ProofOfWork {

    /** Does this block's proof meet its own difficulty for the given recall block? */
    public boolean meetsTarget(Block block, Hash recallHash) {
        int requiredBits = toRequiredBits(block.difficulty());
        byte[] proof = Hashes.sha256(block.serialize(), recallHash.bytes());
        return hasLeadingZeroBits(proof, requiredBits);
    }

    /**
     * Try nonces starting at template.nonce() up to maxTries.
     * Returns a NEW block carrying the winning nonce, or empty.
     */
    public Optional<Block> mine(Block template, Hash recallHash, long maxTries) {
        if (template == null) return Optional.empty();
        long nonce = template.nonce();
        for (long i = 0; i < maxTries; i++, nonce++) {
            Block candidate = nonce == template.nonce() ? template : template.withNonce(nonce);
            if (meetsTarget(candidate, recallHash)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /** Clamp difficulty to a sane non-negative int. */
    private static int toRequiredBits(long difficulty) {
        if (difficulty < 0) return 0;
        if (difficulty > ProtocolLimits.MAX_DIFFICULTY_BITS) return ProtocolLimits.MAX_DIFFICULTY_BITS;
        return (int) difficulty;
    }

    /**
     * Check for N leading zero bits in the hash.
     * Fast path: count whole zero bytes, then the first non-zero byte's leading zeros.
     */
    static boolean hasLeadingZeroBits(byte[] hash, int requiredBits) {
        if (requiredBits <= 0) return true;
        if (requiredBits > hash.length * 8) return false;

        int fullBytes = requiredBits / 8;
        int remBits = requiredBits % 8;

        for (int i = 0; i < fullBytes; i++) {
            if (hash[i] != 0) return false;
        }
        if (remBits == 0) return true;

        int next = hash[fullBytes] & 0xff;
        return Integer.numberOfLeadingZeros(next) - 24 >= remBits;
    }
}
