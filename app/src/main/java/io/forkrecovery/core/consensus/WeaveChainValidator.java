package io.forkrecovery.core.consensus;

import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.HashChain;
import io.forkrecovery.core.protocol.Transaction;
import io.forkrecovery.core.state.WalletState;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Consensus rules for extending a block with its successor:
 * linkage, proof of access (recall block), proof of work, difficulty step,
 * timestamp bounds and transaction legality against the wallet snapshot.
 */
public final class WeaveChainValidator implements ChainValidator {
    private static final Logger LOG = Logger.getLogger(WeaveChainValidator.class.getName());

    private final RecallSelector recallSelector;
    private final ProofOfWork pow;
    private final long maxFutureDriftMillis;
    private final long maxDifficultyStep;
    private final LongSupplier clock;

    public WeaveChainValidator(RecallSelector recallSelector, long maxFutureDriftMillis, long maxDifficultyStep) {
        this(recallSelector, new ProofOfWork(), maxFutureDriftMillis, maxDifficultyStep, System::currentTimeMillis);
    }

    public WeaveChainValidator(RecallSelector recallSelector, ProofOfWork pow,
                               long maxFutureDriftMillis, long maxDifficultyStep, LongSupplier clock) {
        this.recallSelector = recallSelector;
        this.pow = pow;
        this.maxFutureDriftMillis = Math.max(0L, maxFutureDriftMillis);
        this.maxDifficultyStep = Math.max(0L, maxDifficultyStep);
        this.clock = clock;
    }

    @Override
    public WalletState applyTransactions(WalletState walletState, List<Transaction> txs) {
        WalletState out = walletState;
        for (Transaction tx : txs) {
            out = out.apply(tx);
        }
        return out;
    }

    @Override
    public boolean validate(HashChain hashChain, WalletState walletState, Block candidate, Block predecessor, Block recall) {
        Optional<String> violation = findViolation(hashChain, walletState, candidate, predecessor, recall);
        violation.ifPresent(v -> LOG.fine(() -> "Rejected " + candidate + ": " + v));
        return violation.isEmpty();
    }

    /** First broken rule, if any. */
    public Optional<String> findViolation(HashChain hashChain, WalletState walletState,
                                          Block candidate, Block predecessor, Block recall) {
        try {
            checkRules(hashChain, walletState, candidate, predecessor, recall);
            return Optional.empty();
        } catch (IllegalArgumentException | ArithmeticException e) {
            return Optional.of(e.getMessage());
        }
    }

    private void checkRules(HashChain hashChain, WalletState walletState,
                            Block candidate, Block predecessor, Block recall) {
        // 1) Linkage
        if (!candidate.previousBlock().equals(predecessor.indepHash())) {
            throw new IllegalArgumentException("previous block mismatch");
        }
        if (candidate.height() != predecessor.height() + 1) {
            throw new IllegalArgumentException("Bad block height: expected " + (predecessor.height() + 1)
                    + ", got " + candidate.height());
        }
        if (!candidate.hashList().equals(hashChain)) {
            throw new IllegalArgumentException("hash list does not extend predecessor chain");
        }

        // 2) Proof of access
        if (!recall.indepHash().equals(recallSelector.selectRecallHash(predecessor, predecessor.hashList()))) {
            throw new IllegalArgumentException("wrong recall block");
        }

        // 3) Proof of work over the recall block
        if (!pow.meetsTarget(candidate, recall.indepHash())) {
            throw new IllegalArgumentException("Proof-of-Work target not met");
        }

        // 4) Difficulty adjustment
        if (Math.abs(candidate.difficulty() - predecessor.difficulty()) > maxDifficultyStep) {
            throw new IllegalArgumentException("difficulty step too large: " + predecessor.difficulty()
                    + " -> " + candidate.difficulty());
        }

        // 5) Timestamp sanity
        if (candidate.timestamp() < predecessor.timestamp()) {
            throw new IllegalArgumentException("Timestamp before predecessor");
        }
        if (candidate.timestamp() > clock.getAsLong() + maxFutureDriftMillis) {
            throw new IllegalArgumentException("Timestamp too far in future");
        }

        // 6) Transactions against the predecessor's wallets
        Map<String, Long> nonces = new HashMap<>();
        for (Transaction tx : candidate.transactions()) {
            long expected = nonces.computeIfAbsent(tx.from(), a -> predecessor.walletState().nonceOf(a));
            if (tx.nonce() != expected) {
                throw new IllegalArgumentException("Bad nonce for " + tx.from() + ": expected " + expected
                        + ", got " + tx.nonce());
            }
            nonces.put(tx.from(), expected + 1);
        }
        if (!walletState.isSolvent()) {
            throw new IllegalArgumentException("Insufficient balance");
        }
        if (!candidate.walletState().equals(walletState)) {
            throw new IllegalArgumentException("wallet list mismatch");
        }
    }
}
