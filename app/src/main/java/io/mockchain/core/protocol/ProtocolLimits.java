package io.mockchain.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    /** SHA-256 rendered as hex has 64 characters. */
    public static final int MAX_DIFFICULTY = 64;
    public static final int MAX_TXS_PER_BLOCK = 100_000;
    public static final long DEFAULT_BLOCK_REWARD = 50L;
}
