package io.mockchain.core.ledger;

/**
 * A block could not be appended, or derived state disagrees with the chain. Signals a race
 * (the tip moved under a producer) or corruption; never swallowed silently.
 */
public class ChainConsistencyException extends IllegalStateException {

    public enum Reason {
        INDEX_MISMATCH,
        LINKAGE_MISMATCH,
        INVALID_BLOCK,
        INVALID_TRANSACTION,
        BALANCE_DIVERGENCE
    }

    private final Reason reason;

    public ChainConsistencyException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() { return reason; }

    /** True for rejections caused by another block landing first. */
    public boolean isStaleTip() {
        return reason == Reason.INDEX_MISMATCH || reason == Reason.LINKAGE_MISMATCH;
    }
}
