package io.mockchain.core.storage;

import io.mockchain.core.protocol.Block;

import java.util.List;
import java.util.Optional;

/**
 * Append-only block sequence.
 * Callers are responsible for linkage checks and for serializing access; a store only
 * enforces that blocks arrive with contiguous indexes.
 */
public interface ChainStore {

    /** Append the next block. Fails if {@code block.index()} is not {@link #size()}. */
    void append(Block block);

    Optional<Block> getBlock(long index);

    Optional<Block> getBlockByHash(String hash);

    /** Latest block if any. */
    Optional<Block> getHead();

    /** Number of blocks stored, which is also the index of the next block. */
    long size();

    /** Whether a committed block already contains a transaction with this id. */
    boolean containsTransaction(String txId);

    /** Blocks from genesis to head. */
    List<Block> getBlocksInOrder();
}
