package io.mockchain.core.mempool;

import io.mockchain.core.protocol.Transaction;
import io.mockchain.core.protocol.TransactionRejectedException;
import io.mockchain.core.protocol.TransactionRejectedException.Reason;
import io.mockchain.core.state.StateStore;

/**
 * Admission rules for the pending pool: signature and amount, then funds, then headroom so
 * committing the pool can never overflow a balance or the minted supply.
 */
public class TxValidator {
    private final StateStore state;
    private final long supplyReserve;

    public TxValidator(StateStore state) {
        this(state, 0L);
    }

    /**
     * @param supplyReserve supply kept free for the block reward minted alongside pending credits
     */
    public TxValidator(StateStore state, long supplyReserve) {
        if (supplyReserve < 0) {
            throw new IllegalArgumentException("supplyReserve must be >= 0");
        }
        this.state = state;
        this.supplyReserve = supplyReserve;
    }

    /**
     * @param senderDelta    net effect of already-pending transactions on the sender's balance
     * @param recipientDelta net effect of already-pending transactions on the recipient's balance
     * @param pendingMinted  faucet credits already pending
     * @throws TransactionRejectedException on the first rule the transaction breaks
     */
    public void validate(Transaction tx, long senderDelta, long recipientDelta, long pendingMinted) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction required");
        }
        tx.verify();
        if (!tx.isFaucet()) {
            long available = state.getBalance(tx.from()) + senderDelta;
            if (available < tx.amount()) {
                throw new TransactionRejectedException(Reason.INSUFFICIENT_FUNDS,
                        "Insufficient balance: available " + Math.max(0L, available) + ", amount " + tx.amount());
            }
        }
        try {
            Math.addExact(Math.addExact(state.getBalance(tx.to()), Math.max(0L, recipientDelta)), tx.amount());
            if (tx.isFaucet()) {
                Math.addExact(Math.addExact(Math.addExact(state.totalSupply(), pendingMinted), supplyReserve), tx.amount());
            }
        } catch (ArithmeticException e) {
            throw new TransactionRejectedException(Reason.INVALID_AMOUNT,
                    "Amount " + tx.amount() + " would overflow the balance of " + tx.to() + " or the total supply");
        }
    }
}
