package io.mockchain.core.state;

import io.mockchain.core.protocol.Block;
import io.mockchain.core.protocol.Transaction;

import java.util.HashMap;
import java.util.Map;

/**
 * In-memory implementation of StateStore.
 * Tracks balances and the minted total using a simple HashMap.
 * Not synchronized: the owning Ledger serializes all access.
 */
public final class InMemoryStateStore implements StateStore {

    private final Map<String, Long> balances;
    private long totalSupply;

    public InMemoryStateStore() {
        this(new HashMap<>(), 0L);
    }

    private InMemoryStateStore(Map<String, Long> balances, long totalSupply) {
        this.balances = balances;
        this.totalSupply = totalSupply;
    }

    @Override
    public long getBalance(String address) {
        return balances.getOrDefault(address, 0L);
    }

    @Override
    public void applyTransaction(Transaction tx) {
        if (tx.isFaucet()) {
            credit(tx.to(), tx.amount());
            return;
        }
        long fromBal = getBalance(tx.from());
        if (fromBal < tx.amount()) {
            throw new IllegalStateException("Insufficient balance for " + tx.id() + ": has " + fromBal + ", needs " + tx.amount());
        }

        // debit sender
        put(tx.from(), fromBal - tx.amount());

        // credit recipient
        put(tx.to(), Math.addExact(getBalance(tx.to()), tx.amount()));
    }

    @Override
    public void applyBlock(Block block, long reward) {
        for (Transaction tx : block.transactions()) {
            applyTransaction(tx);
        }
        if (reward > 0 && block.hasMiner()) {
            credit(block.miner(), reward);
        }
    }

    @Override
    public void credit(String address, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("credit must be >= 0");
        }
        put(address, Math.addExact(getBalance(address), amount));
        totalSupply = Math.addExact(totalSupply, amount);
    }

    @Override
    public long totalSupply() {
        return totalSupply;
    }

    @Override
    public Map<String, Long> balances() {
        return Map.copyOf(balances);
    }

    @Override
    public InMemoryStateStore copy() {
        return new InMemoryStateStore(new HashMap<>(balances), totalSupply);
    }

    @Override
    public void replaceWith(StateStore staged) {
        Map<String, Long> next = staged.balances();
        balances.clear();
        balances.putAll(next);
        totalSupply = staged.totalSupply();
    }

    private void put(String address, long value) {
        if (value == 0L) {
            balances.remove(address);
        } else {
            balances.put(address, value);
        }
    }
}
