package io.mockchain.core.metrics;

import io.mockchain.core.ledger.ChainConsistencyException;
import io.mockchain.core.protocol.TransactionRejectedException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Comparator;
import java.util.Locale;
import java.util.function.Supplier;

public final class BlockMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksMined = registry.counter("blocks.mined");
    private static final Counter candidatesDiscarded = registry.counter("blocks.candidates.discarded");
    private static final Counter balanceAudits = registry.counter("ledger.balance.audits");
    private static final Counter faucetGrants = registry.counter("faucet.requests", "outcome", "granted");
    private static final Counter faucetRateLimited = registry.counter("faucet.requests", "outcome", "rate_limited");
    private static final Timer miningTime = registry.timer("block.mining.time");

    private BlockMetrics() {}

    public static <T> T recordMining(Supplier<T> blockProductionLogic) {
        return miningTime.record(blockProductionLogic);
    }

    public static void incrementBlocks() {
        blocksMined.increment();
    }

    public static void recordDiscardedCandidate() {
        candidatesDiscarded.increment();
    }

    public static void recordAudit() {
        balanceAudits.increment();
    }

    public static void recordFaucet(boolean granted) {
        (granted ? faucetGrants : faucetRateLimited).increment();
    }

    public static void recordRejectedTransaction(TransactionRejectedException.Reason reason) {
        registry.counter("transactions.rejected", "reason", reason.code()).increment();
    }

    public static void recordRejectedBlock(ChainConsistencyException.Reason reason) {
        registry.counter("blocks.rejected", "reason", reason.name().toLowerCase(Locale.ROOT)).increment();
    }

    public static Timer.Sample startRequest() {
        return Timer.start(registry);
    }

    /** Gateway request timer, tagged with the error code the response carried ("none" on success). */
    public static void recordRequest(Timer.Sample sample, String method, String path, int status, String errorCode) {
        sample.stop(registry.timer("api.requests",
                "method", method,
                "path", path,
                "status", Integer.toString(status),
                "error", errorCode == null ? "none" : errorCode));
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        registry.getMeters().stream()
                .sorted(Comparator.comparing(m -> m.getId().getName()))
                .forEach(m -> appendMeter(sb, m));
        return sb.toString();
    }

    private static void appendMeter(StringBuilder sb, Meter m) {
        StringBuilder tags = new StringBuilder();
        m.getId().getTags().forEach(t -> tags.append(',').append(t.getKey()).append('=').append(t.getValue()));
        for (Measurement meas : m.measure()) {
            sb.append(m.getId().getName())
              .append("{stat=")
              .append(meas.getStatistic())
              .append(tags)
              .append("} ")
              .append(meas.getValue())
              .append("\n");
        }
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
