package io.forkrecovery.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Value transfer between two wallet addresses.
 * The id is the SHA-256 of the canonical encoding.
 */
public final class Transaction {

    private final String from;
    private final String to;
    private final long amountMinor;
    private final long feeMinor;
    private final long nonce;
    private final long timestamp;

    private final Hash id;

    private Transaction(String from, String to, long amountMinor, long feeMinor, long nonce, long timestamp) {
        this.from = from;
        this.to = to;
        this.amountMinor = amountMinor;
        this.feeMinor = feeMinor;
        this.nonce = nonce;
        this.timestamp = timestamp;
        basicValidate();
        this.id = Hash.sha256(serialize());
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String from;
        private String to;
        private long amountMinor;
        private long feeMinor;
        private long nonce;
        private long timestamp = System.currentTimeMillis();

        public Builder from(String f) { this.from = f; return this; }
        public Builder to(String t) { this.to = t; return this; }
        public Builder amountMinor(long a) { this.amountMinor = a; return this; }
        public Builder feeMinor(long f) { this.feeMinor = f; return this; }
        public Builder nonce(long n) { this.nonce = n; return this; }
        public Builder timestamp(long ts) { this.timestamp = ts; return this; }

        public Transaction build() {
            return new Transaction(from, to, amountMinor, feeMinor, nonce, timestamp);
        }
    }

    public String from() { return from; }
    public String to() { return to; }
    public long amountMinor() { return amountMinor; }
    public long feeMinor() { return feeMinor; }
    public long nonce() { return nonce; }
    public long timestamp() { return timestamp; }
    public Hash id() { return id; }

    public byte[] serialize() {
        byte[] f = from.getBytes(StandardCharsets.UTF_8);
        byte[] t = to.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(4 + f.length + 4 + t.length + 8 * 4);
        buf.putInt(f.length).put(f);
        buf.putInt(t.length).put(t);
        buf.putLong(amountMinor);
        buf.putLong(feeMinor);
        buf.putLong(nonce);
        buf.putLong(timestamp);
        return buf.array();
    }

    public void basicValidate() {
        if (from == null || from.isBlank()) throw new IllegalArgumentException("Missing from");
        if (to == null || to.isBlank()) throw new IllegalArgumentException("Missing to");
        if (from.length() > ProtocolLimits.MAX_ADDRESS_LEN || to.length() > ProtocolLimits.MAX_ADDRESS_LEN) {
            throw new IllegalArgumentException("Address too long");
        }
        if (Objects.equals(from, to)) throw new IllegalArgumentException("from == to");
        if (amountMinor <= 0) throw new IllegalArgumentException("amount must be > 0");
        if (feeMinor < 0) throw new IllegalArgumentException("fee must be >= 0");
        if (nonce < 0) throw new IllegalArgumentException("nonce must be >= 0");
        if (timestamp <= 0) throw new IllegalArgumentException("timestamp must be > 0");
    }

    @Override public boolean equals(Object o) {
        return o instanceof Transaction && id.equals(((Transaction) o).id);
    }

    @Override public int hashCode() { return id.hashCode(); }

    @Override public String toString() {
        return "Transaction{" + from + "->" + to + ", amount=" + amountMinor + ", nonce=" + nonce + "}";
    }
}
