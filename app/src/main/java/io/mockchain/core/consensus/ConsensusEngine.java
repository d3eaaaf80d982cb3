package io.mockchain.core.consensus;

import io.mockchain.core.ledger.Ledger;
import io.mockchain.core.node.BlockProducer;
import io.mockchain.core.node.ProducerSettings;
import io.mockchain.core.protocol.Block;
import io.mockchain.core.protocol.Transaction;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * A block production and validation policy. Generation and validation are separate so any
 * producer's output can be re-checked independently, including by the producer itself.
 */
public interface ConsensusEngine {

    String name();

    /** Produces a block that already satisfies {@link #validateBlock} for {@code previousHash}. */
    default Block generateBlock(long index, List<Transaction> transactions, String previousHash) {
        return generateBlock(index, transactions, previousHash, () -> false)
                .orElseThrow(() -> new IllegalStateException("block generation was cancelled"));
    }

    /**
     * Like {@link #generateBlock(long, List, String)}, but gives up and returns empty once
     * {@code cancelled} reports true. Engines poll it between units of work.
     */
    Optional<Block> generateBlock(long index, List<Transaction> transactions, String previousHash,
                                  BooleanSupplier cancelled);

    /** Pure predicate, never mutates anything. */
    boolean validateBlock(Block block, String previousHash);

    /** Pause between production attempts. */
    Duration productionInterval();

    /** Starts the continuous production loop against {@code ledger}. */
    default BlockProducer start(Ledger ledger, ProducerSettings settings) {
        BlockProducer producer = new BlockProducer(ledger, this, settings);
        producer.start();
        return producer;
    }
}
