package io.mockchain.core.state;

import io.mockchain.core.protocol.Block;
import io.mockchain.core.protocol.Transaction;
import io.mockchain.core.wallet.Wallet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStateStoreTest {

    @Test
    void faucetCreditMintsSupply() {
        StateStore state = new InMemoryStateStore();

        state.applyTransaction(Transaction.faucet("alice", 100, 1L));

        assertEquals(100, state.getBalance("alice"));
        assertEquals(100, state.totalSupply());
        assertEquals(0, state.getBalance(Transaction.FAUCET_ADDRESS));
    }

    @Test
    void transferMovesFundsWithoutChangingSupply() {
        Wallet alice = Wallet.generate();
        StateStore state = new InMemoryStateStore();
        state.credit(alice.getAddress(), 100);

        state.applyTransaction(alice.transfer("bob", 30, 1L));

        assertEquals(70, state.getBalance(alice.getAddress()));
        assertEquals(30, state.getBalance("bob"));
        assertEquals(100, state.totalSupply());
    }

    @Test
    void overdraftThrowsAndLeavesBalancesUntouched() {
        Wallet alice = Wallet.generate();
        StateStore state = new InMemoryStateStore();
        state.credit(alice.getAddress(), 5);

        assertThrows(IllegalStateException.class, () -> state.applyTransaction(alice.transfer("bob", 6, 1L)));
        assertEquals(5, state.getBalance(alice.getAddress()));
        assertEquals(0, state.getBalance("bob"));
    }

    @Test
    void blockRewardGoesOnlyToNamedMiner() {
        StateStore state = new InMemoryStateStore();

        state.applyBlock(Block.create(1, 1L, List.of(Transaction.faucet("a", 10, 1L)), "p", 0L, "miner"), 50);
        state.applyBlock(Block.create(2, 2L, List.of(), "q", 0L, ""), 50);

        assertEquals(50, state.getBalance("miner"));
        assertEquals(60, state.totalSupply());
    }

    @Test
    void copyIsIndependent() {
        StateStore state = new InMemoryStateStore();
        state.credit("alice", 10);
        StateStore copy = state.copy();

        copy.credit("alice", 5);

        assertEquals(10, state.getBalance("alice"));
        assertEquals(15, copy.getBalance("alice"));
    }

    @Test
    void emptiedAccountsDisappearFromSnapshot() {
        Wallet alice = Wallet.generate();
        StateStore state = new InMemoryStateStore();
        state.credit(alice.getAddress(), 10);

        state.applyTransaction(alice.transfer("bob", 10, 1L));

        assertEquals(Map.of("bob", 10L), state.balances());
    }

    @Test
    void negativeCreditIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryStateStore().credit("a", -1));
    }
}
