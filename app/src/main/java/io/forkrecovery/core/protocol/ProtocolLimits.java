package io.forkrecovery.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_ADDRESS_LEN = 128;         // sanity cap
    public static final int MAX_TXS_PER_BLOCK = 100_000;
    public static final int MAX_FRAME_BYTES = 16 * 1024 * 1024;
    public static final int MAX_DIFFICULTY_BITS = 256;      // SHA-256 cap
}
