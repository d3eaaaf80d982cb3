package io.mockchain.core.mempool;

import io.mockchain.core.protocol.Transaction;
import io.mockchain.core.protocol.TransactionRejectedException;
import io.mockchain.core.protocol.TransactionRejectedException.Reason;
import io.mockchain.core.state.InMemoryStateStore;
import io.mockchain.core.state.StateStore;
import io.mockchain.core.wallet.Wallet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MempoolTest {

    private Wallet alice;
    private StateStore state;
    private Mempool mempool;

    @BeforeEach
    void setUp() {
        alice = Wallet.generate();
        state = new InMemoryStateStore();
        mempool = new Mempool(new TxValidator(state), 10);
    }

    @Test
    void addRejectsWhenBalanceInsufficient() {
        Transaction tx = alice.transfer("bob", 10, 1L);

        TransactionRejectedException ex = assertThrows(TransactionRejectedException.class, () -> mempool.add(tx));
        assertEquals(Reason.INSUFFICIENT_FUNDS, ex.reason());
        assertEquals(0, mempool.size());
    }

    @Test
    void addAcceptsValidTransaction() {
        state.credit(alice.getAddress(), 50);
        Transaction tx = alice.transfer("bob", 50, 1L);

        assertTrue(mempool.add(tx));
        assertEquals(1, mempool.size());
        assertTrue(mempool.contains(tx.id()));
        assertEquals(-50, mempool.pendingDelta(alice.getAddress()));
        assertEquals(50, mempool.pendingDelta("bob"));
    }

    @Test
    void pendingDebitsCountAgainstAvailableBalance() {
        state.credit(alice.getAddress(), 100);
        mempool.add(alice.transfer("bob", 60, 1L));

        TransactionRejectedException ex = assertThrows(TransactionRejectedException.class,
                () -> mempool.add(alice.transfer("carol", 60, 2L)));

        assertEquals(Reason.INSUFFICIENT_FUNDS, ex.reason());
        assertEquals(1, mempool.size());
        assertTrue(mempool.add(alice.transfer("carol", 40, 3L)));
    }

    @Test
    void pendingFaucetCreditCanBeSpent() {
        mempool.add(Transaction.faucet(alice.getAddress(), 100, 1L));

        assertTrue(mempool.add(alice.transfer("bob", 10, 2L)));
        assertEquals(90, mempool.pendingDelta(alice.getAddress()));
    }

    @Test
    void duplicateIsRejected() {
        Transaction credit = Transaction.faucet("alice", 5, 1L);
        mempool.add(credit);

        TransactionRejectedException ex = assertThrows(TransactionRejectedException.class, () -> mempool.add(credit));
        assertEquals(Reason.DUPLICATE_TRANSACTION, ex.reason());
        assertEquals(1, mempool.size());
    }

    @Test
    void fullPoolRejects() {
        Mempool small = new Mempool(new TxValidator(state), 2);
        small.add(Transaction.faucet("a", 1, 1L));
        small.add(Transaction.faucet("a", 1, 2L));

        TransactionRejectedException ex = assertThrows(TransactionRejectedException.class,
                () -> small.add(Transaction.faucet("a", 1, 3L)));
        assertEquals(Reason.POOL_FULL, ex.reason());
        assertEquals(2, small.size());
    }

    @Test
    void invalidSignatureIsRejectedBeforeFundsCheck() {
        state.credit(alice.getAddress(), 100);
        Transaction unsigned = Transaction.builder().from(alice.getAddress()).to("bob").amount(5).build();

        TransactionRejectedException ex = assertThrows(TransactionRejectedException.class, () -> mempool.add(unsigned));
        assertEquals(Reason.INVALID_SIGNATURE, ex.reason());
    }

    @Test
    void snapshotIsFifoAndLeavesPoolIntact() {
        Transaction first = Transaction.faucet("a", 1, 1L);
        Transaction second = Transaction.faucet("b", 1, 2L);
        Transaction third = Transaction.faucet("c", 1, 3L);
        mempool.add(first);
        mempool.add(second);
        mempool.add(third);

        assertEquals(List.of(first, second), mempool.snapshot(2));
        assertEquals(List.of(first, second, third), mempool.snapshot(10));
        assertEquals(3, mempool.size());
    }

    @Test
    void removeAllDropsIncludedAndRestoresDelta() {
        Transaction credit = Transaction.faucet("a", 7, 1L);
        mempool.add(credit);

        mempool.removeAll(List.of(credit));

        assertEquals(0, mempool.size());
        assertEquals(0, mempool.pendingDelta("a"));
    }

    @Test
    void pruneEvictsTransactionsThatNoLongerApply() {
        state.credit(alice.getAddress(), 100);
        Transaction spend = alice.transfer("bob", 80, 1L);
        Transaction credit = Transaction.faucet("carol", 5, 2L);
        mempool.add(spend);
        mempool.add(credit);

        StateStore drained = new InMemoryStateStore();
        drained.credit(alice.getAddress(), 50);
        List<Transaction> evicted = mempool.prune(drained);

        assertEquals(List.of(spend), evicted);
        assertFalse(mempool.contains(spend.id()));
        assertTrue(mempool.contains(credit.id()));
        assertEquals(0, mempool.pendingDelta(alice.getAddress()));
    }

    @Test
    void nullIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> mempool.add(null));
    }

    @Test
    void pendingCreditsThatWouldOverflowAreRejected() {
        mempool.add(Transaction.faucet("bob", Long.MAX_VALUE / 2 + 1, 1L));

        TransactionRejectedException ex = assertThrows(TransactionRejectedException.class,
                () -> mempool.add(Transaction.faucet("carol", Long.MAX_VALUE / 2 + 1, 2L)));

        assertEquals(Reason.INVALID_AMOUNT, ex.reason());
        assertEquals(1, mempool.size());
        assertEquals(Long.MAX_VALUE / 2 + 1, mempool.pendingMinted());
    }
}
