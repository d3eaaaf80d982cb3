package io.mockchain.core.node;

import java.time.Duration;

/** Outcome of a faucet request. {@code txId} is set only when granted. */
public record FaucetResult(Status status, long amount, String txId, Duration retryAfter) {

    public enum Status { GRANTED, RATE_LIMITED }

    public static FaucetResult granted(String txId, long amount) {
        return new FaucetResult(Status.GRANTED, amount, txId, Duration.ZERO);
    }

    public static FaucetResult rateLimited(Duration retryAfter) {
        return new FaucetResult(Status.RATE_LIMITED, 0L, null, retryAfter);
    }

    public boolean granted() {
        return status == Status.GRANTED;
    }
}
