package io.forkrecovery.core.protocol;

import io.forkrecovery.core.state.WalletState;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

/**
 * Immutable block of the weave.
 * hashList holds every ancestor newest-first, so for non-genesis blocks its tip is previousBlock
 * and its size equals the height. indepHash = SHA-256(serialize()).
 */
public final class Block {
    private final long height;
    private final Hash previousBlock;
    private final HashChain hashList;
    private final WalletState walletState;
    private final List<Transaction> transactions;
    private final long timestamp;
    private final long difficulty;
    private final long nonce;

    private final Hash indepHash;

    private Block(Builder b) {
        this.height = b.height;
        this.previousBlock = b.previousBlock != null ? b.previousBlock : Hash.ZERO;
        this.hashList = b.hashList != null ? b.hashList : HashChain.empty();
        this.walletState = b.walletState != null ? b.walletState : WalletState.empty();
        this.transactions = b.transactions != null ? List.copyOf(b.transactions) : List.of();
        this.timestamp = b.timestamp;
        this.difficulty = b.difficulty;
        this.nonce = b.nonce;
        basicValidate();
        this.indepHash = Hash.sha256(serialize());
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private long height;
        private Hash previousBlock;
        private HashChain hashList;
        private WalletState walletState;
        private List<Transaction> transactions;
        private long timestamp = System.currentTimeMillis();
        private long difficulty;
        private long nonce;

        public Builder height(long h) { this.height = h; return this; }
        public Builder previousBlock(Hash p) { this.previousBlock = p; return this; }
        public Builder hashList(HashChain c) { this.hashList = c; return this; }
        public Builder walletState(WalletState w) { this.walletState = w; return this; }
        public Builder transactions(List<Transaction> txs) { this.transactions = txs; return this; }
        public Builder timestamp(long ts) { this.timestamp = ts; return this; }
        public Builder difficulty(long d) { this.difficulty = d; return this; }
        public Builder nonce(long n) { this.nonce = n; return this; }

        public Block build() { return new Block(this); }
    }

    public long height() { return height; }
    public Hash indepHash() { return indepHash; }
    public Hash previousBlock() { return previousBlock; }
    public HashChain hashList() { return hashList; }
    public WalletState walletState() { return walletState; }
    public List<Transaction> transactions() { return transactions; }
    public long timestamp() { return timestamp; }
    public long difficulty() { return difficulty; }
    public long nonce() { return nonce; }

    public boolean isGenesis() { return height == 0; }

    /** This block's own hash prepended to its ancestry. */
    public HashChain chain() { return hashList.prepend(indepHash); }

    /** Same independent hash and height. */
    public boolean sameAs(Block other) {
        return other != null && indepHash.equals(other.indepHash) && height == other.height;
    }

    /** Copy with another nonce (mining). */
    public Block withNonce(long newNonce) {
        return toBuilder().nonce(newNonce).build();
    }

    public Builder toBuilder() {
        return builder()
                .height(height)
                .previousBlock(previousBlock)
                .hashList(hashList)
                .walletState(walletState)
                .transactions(transactions)
                .timestamp(timestamp)
                .difficulty(difficulty)
                .nonce(nonce);
    }

    /** Deterministic encoding of every field except indepHash. */
    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteBuffer head = ByteBuffer.allocate(8 + Hash.LENGTH + 4);
        head.putLong(height);
        head.put(previousBlock.bytes());
        head.putInt(hashList.size());
        out.writeBytes(head.array());
        for (Hash h : hashList) {
            out.writeBytes(h.bytes());
        }
        byte[] wallets = walletState.serialize();
        out.writeBytes(ByteBuffer.allocate(4).putInt(wallets.length).array());
        out.writeBytes(wallets);
        out.writeBytes(ByteBuffer.allocate(4).putInt(transactions.size()).array());
        for (Transaction tx : transactions) {
            byte[] b = tx.serialize();
            out.writeBytes(ByteBuffer.allocate(4).putInt(b.length).array());
            out.writeBytes(b);
        }
        ByteBuffer tail = ByteBuffer.allocate(8 * 3);
        tail.putLong(timestamp);
        tail.putLong(difficulty);
        tail.putLong(nonce);
        out.writeBytes(tail.array());
        return out.toByteArray();
    }

    public void basicValidate() {
        if (height < 0) throw new IllegalArgumentException("height must be >= 0");
        if (timestamp <= 0) throw new IllegalArgumentException("timestamp must be > 0");
        if (difficulty < 0 || difficulty > ProtocolLimits.MAX_DIFFICULTY_BITS) {
            throw new IllegalArgumentException("difficulty out of range: " + difficulty);
        }
        if (transactions.size() > ProtocolLimits.MAX_TXS_PER_BLOCK) throw new IllegalArgumentException("too many txs");
        if (hashList.size() != height) {
            throw new IllegalArgumentException("hash list size " + hashList.size() + " != height " + height);
        }
        if (height == 0) {
            if (!previousBlock.isZero()) throw new IllegalArgumentException("genesis must have zero previous block");
        } else if (!Objects.equals(hashList.tip().orElse(null), previousBlock)) {
            throw new IllegalArgumentException("hash list tip does not match previous block");
        }
    }

    @Override public boolean equals(Object o) {
        return o instanceof Block && indepHash.equals(((Block) o).indepHash);
    }

    @Override public int hashCode() { return indepHash.hashCode(); }

    @Override public String toString() {
        return "Block{height=" + height + ", hash=" + indepHash + ", txs=" + transactions.size() + "}";
    }
}
