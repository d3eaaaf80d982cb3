package io.mockchain.core.ledger;

import io.mockchain.core.protocol.Block;

import java.util.List;

/**
 * Creates the genesis block.
 * - index = 0
 * - previousHash = "0"
 * - no transactions, no miner (so no reward)
 * - hash computed normally, no proof of work
 */
public final class GenesisBuilder {
    private GenesisBuilder(){}

    public static Block buildGenesis() {
        return buildGenesis(System.currentTimeMillis());
    }

    public static Block buildGenesis(long timestamp) {
        return Block.create(0L, timestamp, List.of(), Block.GENESIS_PREVIOUS_HASH, 0L, "");
    }
}
