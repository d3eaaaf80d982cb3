package io.mockchain.core.protocol;

/**
 * A transaction failed validation. Nothing was enqueued or changed; the caller may retry
 * with corrected input.
 */
public class TransactionRejectedException extends IllegalArgumentException {

    public enum Reason {
        INVALID_SIGNATURE("invalid_signature"),
        INVALID_AMOUNT("invalid_amount"),
        INSUFFICIENT_FUNDS("insufficient_funds"),
        DUPLICATE_TRANSACTION("duplicate_transaction"),
        POOL_FULL("pool_full");

        private final String code;

        Reason(String code) { this.code = code; }

        /** Stable snake_case code used in API responses and metric tags. */
        public String code() { return code; }
    }

    private final Reason reason;

    public TransactionRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() { return reason; }
}
