package io.mockchain.core.node;

import io.mockchain.core.consensus.ConsensusEngine;
import io.mockchain.core.ledger.Ledger;
import io.mockchain.core.protocol.Block;
import io.mockchain.core.protocol.Transaction;
import io.mockchain.core.wallet.Wallet;

import java.time.Clock;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Wires consensus, ledger, faucet and the block producer, and exposes the operations the
 * API gateway calls. Call {@link #start()} to begin continuous production, or {@link #tick()}
 * to produce on demand.
 */
public final class Node implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final NodeConfig config;
    private final String minerAddress;
    private final ConsensusEngine consensus;
    private final Ledger ledger;
    private final Faucet faucet;
    private final BlockProducer manualProducer;
    private BlockProducer producer;

    public Node(NodeConfig config, Clock clock) {
        this.config = config;
        if (config.minerAddress != null) {
            this.minerAddress = config.minerAddress;
        } else {
            this.minerAddress = Wallet.generate().getAddress();
            LOG.info(() -> "No miner address configured; generated " + minerAddress);
        }
        this.consensus = config.consensus.create(minerAddress);
        this.ledger = new Ledger(consensus, config.ledgerSettings());
        this.faucet = new Faucet(ledger, config.faucetAmount, config.faucetCooldown, clock);
        this.manualProducer = new BlockProducer(ledger, consensus, config.producerSettings());
        LOG.info(() -> "Node using " + config.consensus.describe() + ", rewards -> " + minerAddress);
    }

    /** Convenience factory for an in-memory local node. */
    public static Node inMemory(NodeConfig config) {
        return new Node(config, Clock.systemUTC());
    }

    /** Start the background producer. Safe to call multiple times. */
    public synchronized void start() {
        if (producer == null) {
            producer = consensus.start(ledger, config.producerSettings());
        }
    }

    /** Try to produce one block on the calling thread. */
    public Optional<Block> tick() {
        return manualProducer.tick();
    }

    public void submitTransaction(Transaction tx) {
        ledger.submitTransaction(tx);
    }

    public long getBalance(String address) {
        return ledger.getBalance(address);
    }

    public FaucetResult requestFaucet(String address) {
        return faucet.requestFaucet(address);
    }

    @Override
    public synchronized void close() {
        if (producer != null) {
            producer.stop();
            producer = null;
        }
    }

    public boolean isProducing() {
        BlockProducer p;
        synchronized (this) {
            p = producer;
        }
        return p != null && p.isRunning();
    }

    public Ledger ledger() { return ledger; }
    public ConsensusEngine consensus() { return consensus; }
    public String minerAddress() { return minerAddress; }
    public NodeConfig config() { return config; }
}
