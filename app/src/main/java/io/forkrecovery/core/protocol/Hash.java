package io.forkrecovery.core.protocol;

import java.math.BigInteger;
import java.util.Arrays;

/** 32-byte content identifier with value semantics. */
public final class Hash {
    public static final int LENGTH = 32;
    public static final Hash ZERO = new Hash(new byte[LENGTH]);

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;

    public Hash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static Hash of(byte[] bytes) {
        return new Hash(bytes);
    }

    public static Hash sha256(byte[] data) {
        return new Hash(Hashes.sha256(data));
    }

    public static Hash fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Hash hex must be 64 chars");
        }
        byte[] out = new byte[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            int hi = Character.digit(hex.charAt(2 * i), 16);
            int lo = Character.digit(hex.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Invalid hex in hash: " + hex);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return new Hash(out);
    }

    public byte[] bytes() { return bytes.clone(); }

    public boolean isZero() { return equals(ZERO); }

    /** Hash read as an unsigned big-endian integer. */
    public BigInteger toUnsigned() { return new BigInteger(1, bytes); }

    public String hex() {
        char[] out = new char[bytes.length * 2];
        for (int i = 0, j = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    @Override public boolean equals(Object o){ return o instanceof Hash && Arrays.equals(bytes, ((Hash)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Hash("+hex().substring(0,8)+"…)"; }
}
