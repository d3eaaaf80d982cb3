package io.mockchain.core.state;

import io.mockchain.core.protocol.Block;
import io.mockchain.core.protocol.Transaction;

import java.util.Map;

/**
 * Account balances derived from committed blocks.
 */
public interface StateStore {
    long getBalance(String address);

    /**
     * Apply a single transaction: faucet credits mint, transfers move value.
     *
     * @throws IllegalStateException if the sender cannot cover the amount
     */
    void applyTransaction(Transaction tx);

    /** Apply all txs in a block (in order), then credit {@code reward} to its miner if it has one. */
    void applyBlock(Block block, long reward);

    /** Mint {@code amount} to an address. */
    void credit(String address, long amount);

    /** Total ever minted (rewards + faucet credits). */
    long totalSupply();

    /** Non-zero balances, by address. */
    Map<String, Long> balances();

    /** Independent deep copy, used to stage a block before committing it. */
    StateStore copy();

    /** Overwrite every balance and the supply with those of {@code staged}. */
    void replaceWith(StateStore staged);
}
