package io.mockchain.core.ledger;

import io.mockchain.core.protocol.Transaction;

import java.util.List;

/** Tip and pending transactions captured together under the ledger lock. */
public record LedgerSnapshot(long nextIndex, String tipHash, List<Transaction> transactions) {
    public LedgerSnapshot {
        transactions = List.copyOf(transactions);
    }
}
