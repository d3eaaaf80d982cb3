package io.mockchain.core.node;

import java.time.Duration;

/**
 * @param maxTxPerBlock      cap on transactions taken from the pool per candidate
 * @param produceEmptyBlocks mine even when nothing is pending
 * @param idlePoll           pause after an attempt that produced nothing
 */
public record ProducerSettings(int maxTxPerBlock, boolean produceEmptyBlocks, Duration idlePoll) {

    public ProducerSettings {
        if (maxTxPerBlock <= 0) throw new IllegalArgumentException("maxTxPerBlock must be > 0");
        idlePoll = idlePoll == null ? Duration.ofMillis(200) : idlePoll;
        if (idlePoll.isNegative()) throw new IllegalArgumentException("idlePoll must not be negative");
    }

    public static ProducerSettings defaults() {
        return new ProducerSettings(1000, false, Duration.ofMillis(200));
    }
}
