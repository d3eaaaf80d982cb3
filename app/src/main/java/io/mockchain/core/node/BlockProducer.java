package io.mockchain.core.node;

import io.mockchain.core.consensus.ConsensusEngine;
import io.mockchain.core.ledger.ChainConsistencyException;
import io.mockchain.core.ledger.Ledger;
import io.mockchain.core.ledger.LedgerSnapshot;
import io.mockchain.core.metrics.BlockMetrics;
import io.mockchain.core.protocol.Block;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Snapshots the ledger, builds a candidate under the active consensus engine without holding
 * the ledger lock, self-checks it and tries to append it. A candidate whose snapshot went
 * stale is thrown away; the next attempt starts from a fresh snapshot.
 */
public final class BlockProducer {
    private static final Logger LOG = Logger.getLogger(BlockProducer.class.getName());

    private final Ledger ledger;
    private final ConsensusEngine consensus;
    private final ProducerSettings settings;

    private volatile boolean stopRequested;
    private ExecutorService executor;

    public BlockProducer(Ledger ledger, ConsensusEngine consensus, ProducerSettings settings) {
        this.ledger = ledger;
        this.consensus = consensus;
        this.settings = settings;
    }

    /** One production attempt: returns the appended block if one was produced. */
    public Optional<Block> tick() {
        // 1) Snapshot tip + pool
        LedgerSnapshot snapshot = ledger.snapshot(settings.maxTxPerBlock());
        if (snapshot.transactions().isEmpty() && !settings.produceEmptyBlocks()) {
            return Optional.empty();
        }

        // 2) Generate outside the lock; gives up if the tip moves or we are stopping
        Optional<Block> candidate;
        try {
            candidate = BlockMetrics.recordMining(() -> consensus.generateBlock(
                    snapshot.nextIndex(),
                    snapshot.transactions(),
                    snapshot.tipHash(),
                    () -> stopRequested || ledger.isStale(snapshot)));
        } catch (IllegalStateException e) {
            LOG.warning("Block generation failed: " + e.getMessage());
            return Optional.empty();
        }
        if (candidate.isEmpty()) {
            BlockMetrics.recordDiscardedCandidate();
            LOG.fine(() -> "Abandoned candidate for index " + snapshot.nextIndex() + " (stale snapshot or stopping)");
            return Optional.empty();
        }
        Block block = candidate.get();

        // 3) Self-check
        if (!consensus.validateBlock(block, snapshot.tipHash())) {
            BlockMetrics.recordDiscardedCandidate();
            LOG.severe("Generated " + block + " fails " + consensus.name() + " validation; discarding");
            return Optional.empty();
        }

        // 4) Append; a moved tip rejects it and we retry from scratch next tick
        try {
            ledger.appendBlock(block);
        } catch (ChainConsistencyException e) {
            BlockMetrics.recordDiscardedCandidate();
            LOG.warning("Discarding candidate block " + block.index() + ": " + e.getMessage());
            return Optional.empty();
        }
        BlockMetrics.incrementBlocks();
        LOG.info("Mined block " + block.index() + " with hash " + block.hash() + " (" + block.transactions().size() + " txs)");
        return Optional.of(block);
    }

    /** Runs {@link #tick()} continuously on a dedicated daemon thread. */
    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Block producer already running");
        }
        stopRequested = false;
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mockchain-producer");
            t.setDaemon(true);
            return t;
        });
        executor.execute(this::runLoop);
        LOG.info(() -> consensus.name() + " producer started (max " + settings.maxTxPerBlock() + " txs per block)");
    }

    /** Cancels any in-flight search and waits briefly for the loop to exit. */
    public synchronized void stop() {
        stopRequested = true;
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warning("Block producer did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
        LOG.info("Block producer stopped");
    }

    public synchronized boolean isRunning() {
        return executor != null && !stopRequested;
    }

    private void runLoop() {
        while (!stopRequested && !Thread.currentThread().isInterrupted()) {
            boolean produced = false;
            try {
                produced = tick().isPresent();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Block production attempt failed", e);
            }
            long pause = consensus.productionInterval().toMillis();
            if (!produced) {
                pause = Math.max(pause, settings.idlePoll().toMillis());
            }
            if (pause > 0) {
                try {
                    Thread.sleep(pause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }
}
