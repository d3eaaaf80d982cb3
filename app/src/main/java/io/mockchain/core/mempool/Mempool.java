package io.mockchain.core.mempool;

import io.mockchain.core.protocol.Transaction;
import io.mockchain.core.protocol.TransactionRejectedException;
import io.mockchain.core.protocol.TransactionRejectedException.Reason;
import io.mockchain.core.state.StateStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pending pool:
 * - holds verified transactions keyed by id, iterated in FIFO (submission) order
 * - tracks each address's net pending delta so a sender can never queue more than it will have
 * Not synchronized: the owning Ledger serializes all access.
 */
public final class Mempool {

    private final Map<String, Transaction> fifo = new LinkedHashMap<>();
    private final Map<String, Long> pendingDelta = new HashMap<>();
    private long pendingMinted;
    private final TxValidator validator;
    private final int maxSize;

    public Mempool(TxValidator validator, int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.validator = validator;
        this.maxSize = maxSize;
    }

    /** Validate and add a tx. */
    public boolean add(Transaction tx) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction required");
        }
        if (fifo.containsKey(tx.id())) {
            throw new TransactionRejectedException(Reason.DUPLICATE_TRANSACTION, "Transaction " + tx.id() + " is already pending");
        }
        if (fifo.size() >= maxSize) {
            throw new TransactionRejectedException(Reason.POOL_FULL, "Pending pool is full (" + maxSize + ")");
        }
        validator.validate(tx, pendingDelta(tx.from()), pendingDelta(tx.to()), pendingMinted);
        fifo.put(tx.id(), tx);
        track(tx, 1);
        return true;
    }

    /** Up to {@code max} transactions in FIFO order, left in the pool. */
    public List<Transaction> snapshot(int max) {
        List<Transaction> out = new ArrayList<>(Math.min(max, fifo.size()));
        for (Transaction tx : fifo.values()) {
            if (out.size() >= max) break;
            out.add(tx);
        }
        return out;
    }

    /** Remove included txs by id. */
    public void removeAll(Collection<Transaction> included) {
        for (Transaction tx : included) {
            Transaction removed = fifo.remove(tx.id());
            if (removed != null) {
                track(removed, -1);
            }
        }
    }

    /**
     * Replays the pool in order on top of {@code committed} and evicts every transaction that
     * would no longer apply. Returns the evicted ones.
     */
    public List<Transaction> prune(StateStore committed) {
        StateStore simulated = committed.copy();
        List<Transaction> evicted = new ArrayList<>();
        Iterator<Transaction> it = fifo.values().iterator();
        while (it.hasNext()) {
            Transaction tx = it.next();
            if (applies(simulated, tx)) {
                simulated.applyTransaction(tx);
            } else {
                it.remove();
                track(tx, -1);
                evicted.add(tx);
            }
        }
        return evicted;
    }

    public boolean contains(String txId) { return fifo.containsKey(txId); }

    public long pendingDelta(String address) {
        return pendingDelta.getOrDefault(address, 0L);
    }

    public long pendingMinted() { return pendingMinted; }

    public int size() { return fifo.size(); }

    private static boolean applies(StateStore simulated, Transaction tx) {
        if (!tx.isFaucet() && simulated.getBalance(tx.from()) < tx.amount()) {
            return false;
        }
        try {
            Math.addExact(simulated.getBalance(tx.to()), tx.amount());
            if (tx.isFaucet()) {
                Math.addExact(simulated.totalSupply(), tx.amount());
            }
            return true;
        } catch (ArithmeticException e) {
            return false;
        }
    }

    private void track(Transaction tx, int sign) {
        long signed = sign * tx.amount();
        if (tx.isFaucet()) {
            pendingMinted = Math.addExact(pendingMinted, signed);
        } else {
            adjust(tx.from(), -signed);
        }
        adjust(tx.to(), signed);
    }

    private void adjust(String address, long delta) {
        long next = Math.addExact(pendingDelta.getOrDefault(address, 0L), delta);
        if (next == 0L) {
            pendingDelta.remove(address);
        } else {
            pendingDelta.put(address, next);
        }
    }
}
