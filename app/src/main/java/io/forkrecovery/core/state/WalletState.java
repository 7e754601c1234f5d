package io.forkrecovery.core.state;

import io.forkrecovery.core.protocol.Transaction;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable account snapshot: balances + nonces, keyed by address.
 * Every block carries the snapshot that results from applying its transactions.
 * Entries are kept sorted so the encoding is deterministic.
 */
public final class WalletState {

    public record Account(long balance, long nonce) {}

    private static final WalletState EMPTY = new WalletState(new TreeMap<>());

    private final SortedMap<String, Account> accounts;

    private WalletState(SortedMap<String, Account> accounts) {
        this.accounts = Collections.unmodifiableSortedMap(accounts);
    }

    public static WalletState empty() {
        return EMPTY;
    }

    /** Genesis snapshot from an allocations map (address -> balance, nonce 0). */
    public static WalletState fromAllocations(Map<String, Long> allocations) {
        if (allocations == null || allocations.isEmpty()) return EMPTY;
        SortedMap<String, Account> out = new TreeMap<>();
        for (Map.Entry<String, Long> e : allocations.entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) continue;
            long amount = e.getValue() == null ? 0L : e.getValue();
            out.put(e.getKey(), new Account(amount, 0L));
        }
        return new WalletState(out);
    }

    public static WalletState of(Map<String, Account> accounts) {
        if (accounts == null || accounts.isEmpty()) return EMPTY;
        return new WalletState(new TreeMap<>(accounts));
    }

    public long balanceOf(String address) {
        Account a = accounts.get(address);
        return a == null ? 0L : a.balance();
    }

    public long nonceOf(String address) {
        Account a = accounts.get(address);
        return a == null ? 0L : a.nonce();
    }

    public Map<String, Account> accounts() {
        return accounts;
    }

    /**
     * Apply one transfer. Sender pays amount + fee (fee is burned) and its nonce moves past tx.nonce.
     * Balances may go negative here; solvency is a consensus check, see {@link #isSolvent()}.
     */
    public WalletState apply(Transaction tx) {
        SortedMap<String, Account> next = new TreeMap<>(accounts);
        Account sender = next.getOrDefault(tx.from(), new Account(0L, 0L));
        long debit = Math.addExact(tx.amountMinor(), tx.feeMinor());
        next.put(tx.from(), new Account(Math.subtractExact(sender.balance(), debit), tx.nonce() + 1));
        Account recipient = next.getOrDefault(tx.to(), new Account(0L, 0L));
        next.put(tx.to(), new Account(Math.addExact(recipient.balance(), tx.amountMinor()), recipient.nonce()));
        return new WalletState(next);
    }

    public boolean isSolvent() {
        for (Account a : accounts.values()) {
            if (a.balance() < 0) return false;
        }
        return true;
    }

    /** Deterministic encoding: count || (address, balance, nonce)* in address order. */
    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(ByteBuffer.allocate(4).putInt(accounts.size()).array());
        for (Map.Entry<String, Account> e : accounts.entrySet()) {
            byte[] addr = e.getKey().getBytes(StandardCharsets.UTF_8);
            ByteBuffer buf = ByteBuffer.allocate(4 + addr.length + 16);
            buf.putInt(addr.length).put(addr);
            buf.putLong(e.getValue().balance());
            buf.putLong(e.getValue().nonce());
            out.writeBytes(buf.array());
        }
        return out.toByteArray();
    }

    @Override public boolean equals(Object o) {
        return o instanceof WalletState && accounts.equals(((WalletState) o).accounts);
    }

    @Override public int hashCode() { return accounts.hashCode(); }

    @Override public String toString() {
        return "WalletState{accounts=" + accounts.size() + "}";
    }
}
