package io.mockchain.core.node;

import io.mockchain.core.ledger.Ledger;
import io.mockchain.core.metrics.BlockMetrics;
import io.mockchain.core.protocol.Transaction;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Mints test funds by submitting a system-sourced credit to the ledger. The credit lands in
 * the pool like any other transaction and becomes spendable once a block commits it.
 *
 * With a non-zero cooldown an address gets at most one grant per cooldown window.
 */
public final class Faucet {
    private static final Logger LOG = Logger.getLogger(Faucet.class.getName());

    public static final long DEFAULT_AMOUNT = 1000L;

    private final Ledger ledger;
    private final long amount;
    private final Duration cooldown;
    private final Clock clock;
    private final Map<String, Instant> lastGrant = new HashMap<>();
    private long lastTimestamp;

    public Faucet(Ledger ledger, long amount, Duration cooldown, Clock clock) {
        if (amount <= 0) {
            throw new IllegalArgumentException("faucet amount must be > 0");
        }
        this.ledger = ledger;
        this.amount = amount;
        this.cooldown = cooldown == null ? Duration.ZERO : cooldown;
        this.clock = clock;
    }

    public long amount() { return amount; }

    /** Addresses currently remembered for the cooldown check. */
    synchronized int trackedAddresses() { return lastGrant.size(); }

    public synchronized FaucetResult requestFaucet(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address required");
        }
        LOG.info(() -> "Faucet request for address: " + address);
        Instant now = clock.instant();
        if (!cooldown.isZero()) {
            Instant previous = lastGrant.get(address);
            if (previous != null && now.isBefore(previous.plus(cooldown))) {
                Duration retryAfter = Duration.between(now, previous.plus(cooldown));
                BlockMetrics.recordFaucet(false);
                LOG.info(() -> "Faucet rate limited " + address + " for another " + retryAfter.toMillis() + "ms");
                return FaucetResult.rateLimited(retryAfter);
            }
        }

        Transaction credit = Transaction.faucet(address, amount, nextTimestamp(now.toEpochMilli()));
        ledger.submitTransaction(credit);
        if (!cooldown.isZero()) {
            lastGrant.put(address, now);
        }
        BlockMetrics.recordFaucet(true);
        return FaucetResult.granted(credit.id(), amount);
    }

    /** Strictly increasing, so two grants to one address never share an id. */
    private long nextTimestamp(long nowMillis) {
        lastTimestamp = Math.max(nowMillis, lastTimestamp + 1);
        return lastTimestamp;
    }
}
