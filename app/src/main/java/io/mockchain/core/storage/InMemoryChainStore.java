package io.mockchain.core.storage;

import io.mockchain.core.protocol.Block;
import io.mockchain.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory chain, lost when the process exits.
 * Not synchronized: the owning Ledger serializes all access.
 */
public final class InMemoryChainStore implements ChainStore {

    private final List<Block> blocks = new ArrayList<>();

    /** Map: blockHash -> index */
    private final Map<String, Integer> byHash = new HashMap<>();

    /** Ids of every committed transaction, for replay protection. */
    private final Set<String> txIds = new HashSet<>();

    @Override
    public void append(Block block) {
        if (block == null) throw new IllegalArgumentException("block required");
        if (block.index() != blocks.size()) {
            throw new IllegalArgumentException("Expected block index " + blocks.size() + ", got " + block.index());
        }
        blocks.add(block);
        byHash.put(block.hash(), blocks.size() - 1);
        for (Transaction tx : block.transactions()) {
            txIds.add(tx.id());
        }
    }

    @Override
    public Optional<Block> getBlock(long index) {
        if (index < 0 || index >= blocks.size()) return Optional.empty();
        return Optional.of(blocks.get((int) index));
    }

    @Override
    public Optional<Block> getBlockByHash(String hash) {
        if (hash == null) return Optional.empty();
        Integer idx = byHash.get(hash);
        return idx == null ? Optional.empty() : Optional.of(blocks.get(idx));
    }

    @Override
    public Optional<Block> getHead() {
        if (blocks.isEmpty()) return Optional.empty();
        return Optional.of(blocks.get(blocks.size() - 1));
    }

    @Override
    public long size() {
        return blocks.size();
    }

    @Override
    public boolean containsTransaction(String txId) {
        return txIds.contains(txId);
    }

    @Override
    public List<Block> getBlocksInOrder() {
        return List.copyOf(blocks);
    }
}
