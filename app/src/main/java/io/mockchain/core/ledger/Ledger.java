package io.mockchain.core.ledger;

import io.mockchain.core.consensus.ConsensusEngine;
import io.mockchain.core.ledger.ChainConsistencyException.Reason;
import io.mockchain.core.mempool.Mempool;
import io.mockchain.core.mempool.TxValidator;
import io.mockchain.core.metrics.BlockMetrics;
import io.mockchain.core.protocol.Block;
import io.mockchain.core.protocol.Transaction;
import io.mockchain.core.protocol.TransactionRejectedException;
import io.mockchain.core.state.InMemoryStateStore;
import io.mockchain.core.state.StateReplayer;
import io.mockchain.core.state.StateStore;
import io.mockchain.core.storage.ChainStore;
import io.mockchain.core.storage.InMemoryChainStore;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The committed chain, the pending pool and the balances derived from the chain, owned
 * together and reachable only through these guarded methods.
 *
 * Mutations (submit, append) take the write lock; reads take the read lock, so a reader never
 * sees a half-applied block. Block generation happens outside: producers {@link #snapshot}
 * the tip and pool, build a candidate without holding any lock, then {@link #appendBlock}.
 *
 * Balances are maintained incrementally on every append and audited against a full replay
 * of the chain every {@link LedgerSettings#balanceAuditInterval()} appends.
 */
public final class Ledger {
    private static final Logger LOG = Logger.getLogger(Ledger.class.getName());

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ConsensusEngine consensus;
    private final ChainStore chain;
    private final StateStore state;
    private final Mempool mempool;
    private final LedgerSettings settings;
    private int appendsSinceAudit;

    public Ledger(ConsensusEngine consensus) {
        this(consensus, new InMemoryChainStore(), LedgerSettings.defaults());
    }

    public Ledger(ConsensusEngine consensus, LedgerSettings settings) {
        this(consensus, new InMemoryChainStore(), settings);
    }

    public Ledger(ConsensusEngine consensus, ChainStore chain, LedgerSettings settings) {
        this.consensus = Objects.requireNonNull(consensus, "consensus");
        this.chain = Objects.requireNonNull(chain, "chain");
        this.settings = Objects.requireNonNull(settings, "settings");
        if (chain.size() != 0) {
            throw new IllegalArgumentException("Ledger must start from an empty chain store");
        }
        this.state = new InMemoryStateStore();
        this.mempool = new Mempool(new TxValidator(state, settings.blockReward()), settings.maxPendingTransactions());

        Block genesis = GenesisBuilder.buildGenesis();
        chain.append(genesis);
        LOG.info(() -> "Creating new blockchain with " + consensus.name() + " consensus, genesis " + genesis.hash());
    }

    // -------------------- mutations --------------------

    /**
     * Verify and enqueue a transaction. Nothing changes when it is rejected.
     *
     * @throws TransactionRejectedException invalid signature or amount, insufficient funds,
     *                                      duplicate, or a full pool
     */
    public void submitTransaction(Transaction tx) {
        lock.writeLock().lock();
        try {
            if (tx != null && chain.containsTransaction(tx.id())) {
                throw new TransactionRejectedException(TransactionRejectedException.Reason.DUPLICATE_TRANSACTION,
                        "Transaction " + tx.id() + " is already committed");
            }
            mempool.add(tx);
        } catch (TransactionRejectedException e) {
            BlockMetrics.recordRejectedTransaction(e.reason());
            LOG.warning("Transaction rejected (" + e.reason().code() + "): " + e.getMessage());
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
        if (tx.isFaucet()) {
            LOG.info(() -> "Adding faucet transaction to pool: FAUCET -> " + tx.to() + ", amount: " + tx.amount());
        } else {
            LOG.info(() -> "Adding transaction to pool: " + tx);
        }
    }

    /**
     * Commit the next block. On success the block is appended, its transactions leave the pool,
     * the miner is credited and any pending entry that no longer fits is evicted.
     *
     * @throws ChainConsistencyException when the index or linkage does not extend the current tip,
     *                                   the consensus predicate fails, or a transaction does not apply
     */
    public void appendBlock(Block block) {
        Objects.requireNonNull(block, "block");
        lock.writeLock().lock();
        try {
            Block tip = tipLocked();
            long expectedIndex = chain.size();
            if (block.index() != expectedIndex) {
                throw reject(Reason.INDEX_MISMATCH, "Block index " + block.index() + " does not extend chain of length " + expectedIndex);
            }
            if (!block.previousHash().equals(tip.hash())) {
                throw reject(Reason.LINKAGE_MISMATCH, "Block " + block.index() + " links to " + block.previousHash() + ", tip is " + tip.hash());
            }
            if (!consensus.validateBlock(block, tip.hash())) {
                throw reject(Reason.INVALID_BLOCK, "Block " + block.index() + " fails " + consensus.name() + " validation");
            }

            // stage the whole block, reward included, on a copy; live balances change only on commit
            StateStore staged = state.copy();
            Set<String> seen = new HashSet<>();
            for (Transaction tx : block.transactions()) {
                if (!seen.add(tx.id()) || chain.containsTransaction(tx.id())) {
                    throw reject(Reason.INVALID_TRANSACTION, "Block " + block.index() + " repeats transaction " + tx.id());
                }
                try {
                    tx.verify();
                    staged.applyTransaction(tx);
                } catch (TransactionRejectedException | IllegalStateException | ArithmeticException e) {
                    throw reject(Reason.INVALID_TRANSACTION, "Block " + block.index() + " carries an invalid transaction: " + e.getMessage());
                }
            }
            if (settings.blockReward() > 0 && block.hasMiner()) {
                try {
                    staged.credit(block.miner(), settings.blockReward());
                } catch (ArithmeticException e) {
                    throw reject(Reason.INVALID_TRANSACTION, "Block " + block.index() + " reward overflows the supply");
                }
            }

            chain.append(block);
            state.replaceWith(staged);
            mempool.removeAll(block.transactions());
            List<Transaction> evicted = mempool.prune(state);
            if (!evicted.isEmpty()) {
                LOG.warning("Evicted " + evicted.size() + " pending transaction(s) that no longer apply after block " + block.index());
            }
            LOG.fine(() -> "Appended " + block);

            if (settings.balanceAuditInterval() > 0 && ++appendsSinceAudit >= settings.balanceAuditInterval()) {
                appendsSinceAudit = 0;
                auditLocked();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    // -------------------- producer support --------------------

    /** Up to {@code max} pending transactions in submission order. They stay pending until committed. */
    public List<Transaction> drainPending(int max) {
        lock.readLock().lock();
        try {
            return mempool.snapshot(max);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Tip and pending transactions, captured atomically. */
    public LedgerSnapshot snapshot(int maxTransactions) {
        lock.readLock().lock();
        try {
            Block tip = tipLocked();
            return new LedgerSnapshot(chain.size(), tip.hash(), mempool.snapshot(maxTransactions));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Whether the chain moved past {@code snapshot}, making a candidate built from it unappendable. */
    public boolean isStale(LedgerSnapshot snapshot) {
        lock.readLock().lock();
        try {
            return chain.size() != snapshot.nextIndex() || !tipLocked().hash().equals(snapshot.tipHash());
        } finally {
            lock.readLock().unlock();
        }
    }

    // -------------------- reads --------------------

    /** Committed balance; pending transactions do not count. */
    public long getBalance(String address) {
        lock.readLock().lock();
        try {
            return state.getBalance(address);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replays the whole chain and compares the result with the incremental balances.
     *
     * @throws ChainConsistencyException with {@code BALANCE_DIVERGENCE} when they differ
     */
    public void auditBalances() {
        lock.readLock().lock();
        try {
            auditLocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long length() {
        lock.readLock().lock();
        try {
            return chain.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Block tip() {
        lock.readLock().lock();
        try {
            return tipLocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Block> block(long index) {
        lock.readLock().lock();
        try {
            return chain.getBlock(index);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Block> blocks() {
        lock.readLock().lock();
        try {
            return chain.getBlocksInOrder();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int pendingCount() {
        lock.readLock().lock();
        try {
            return mempool.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isPending(String txId) {
        lock.readLock().lock();
        try {
            return mempool.contains(txId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public long totalSupply() {
        lock.readLock().lock();
        try {
            return state.totalSupply();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, Long> balances() {
        lock.readLock().lock();
        try {
            return state.balances();
        } finally {
            lock.readLock().unlock();
        }
    }

    public String consensusName() {
        return consensus.name();
    }

    public long blockReward() {
        return settings.blockReward();
    }

    // -------------------- helpers --------------------

    private Block tipLocked() {
        return chain.getHead().orElseThrow(() -> new IllegalStateException("chain has no genesis block"));
    }

    private void auditLocked() {
        String diff;
        try {
            StateStore replayed = StateReplayer.replay(chain.getBlocksInOrder(), settings.blockReward());
            diff = StateReplayer.diff(state, replayed);
        } catch (ArithmeticException e) {
            LOG.severe("Chain replay overflowed: " + e.getMessage());
            throw new ChainConsistencyException(Reason.BALANCE_DIVERGENCE, "Chain replay overflowed: " + e.getMessage());
        }
        if (!diff.isEmpty()) {
            LOG.severe("Incremental balances diverged from chain replay: " + diff);
            throw new ChainConsistencyException(Reason.BALANCE_DIVERGENCE, "Balances diverged from chain replay: " + diff);
        }
        BlockMetrics.recordAudit();
    }

    private static ChainConsistencyException reject(Reason reason, String message) {
        BlockMetrics.recordRejectedBlock(reason);
        LOG.log(Level.WARNING, "Block rejected (" + reason + "): " + message);
        return new ChainConsistencyException(reason, message);
    }
}
