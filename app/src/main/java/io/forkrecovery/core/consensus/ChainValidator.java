package io.forkrecovery.core.consensus;

import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.HashChain;
import io.forkrecovery.core.protocol.Transaction;
import io.forkrecovery.core.state.WalletState;

import java.util.List;

/**
 * Consensus gate used by fork recovery.
 */
public interface ChainValidator {

    /** Wallet snapshot after applying {@code txs} in order to {@code walletState}. */
    WalletState applyTransactions(WalletState walletState, List<Transaction> txs);

    /**
     * Validate {@code candidate} as the successor of {@code predecessor}.
     *
     * @param hashChain   predecessor's hash prepended to the predecessor's own ancestry
     * @param walletState wallet snapshot after applying the candidate's transactions
     * @param recall      recall block selected from the predecessor
     * @return true when every consensus rule holds
     */
    boolean validate(HashChain hashChain, WalletState walletState, Block candidate, Block predecessor, Block recall);
}
