package io.mockchain.core.protocol;

import io.mockchain.core.ledger.GenesisBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockTest {

    private static final List<Transaction> TXS = List.of(
            Transaction.faucet("alice", 100, 1L),
            Transaction.faucet("bob", 50, 2L));

    @Test
    void hashIsDeterministic() {
        Block a = Block.create(1, 1_000L, TXS, "abc", 7L, "miner");
        Block b = Block.create(1, 1_000L, TXS, "abc", 7L, "miner");

        assertEquals(a.hash(), b.hash());
        assertEquals(a.hash(), a.computeHash());
        assertEquals(64, a.hash().length());
    }

    @Test
    void everyHashedFieldChangesTheHash() {
        Block base = Block.create(1, 1_000L, TXS, "abc", 7L, "miner");

        assertNotEquals(base.hash(), Block.create(2, 1_000L, TXS, "abc", 7L, "miner").hash());
        assertNotEquals(base.hash(), Block.create(1, 1_001L, TXS, "abc", 7L, "miner").hash());
        assertNotEquals(base.hash(), Block.create(1, 1_000L, TXS, "abd", 7L, "miner").hash());
        assertNotEquals(base.hash(), Block.create(1, 1_000L, TXS, "abc", 8L, "miner").hash());
        assertNotEquals(base.hash(), Block.create(1, 1_000L, TXS, "abc", 7L, "other").hash());
        assertNotEquals(base.hash(), Block.create(1, 1_000L, TXS.subList(0, 1), "abc", 7L, "miner").hash());
        assertNotEquals(base.hash(), base.withNonce(8L).hash());
    }

    @Test
    void changingOneTransactionAmountChangesTheHash() {
        List<Transaction> altered = List.of(
                Transaction.faucet("alice", 101, 1L),
                Transaction.faucet("bob", 50, 2L));

        assertNotEquals(Block.create(1, 1_000L, TXS, "abc", 0L, "m").hash(),
                Block.create(1, 1_000L, altered, "abc", 0L, "m").hash());
    }

    @Test
    void storedHashIsKeptAsGiven() {
        Block honest = Block.create(3, 5L, TXS, "prev", 0L, "m");
        char flipped = honest.hash().charAt(0) == '0' ? '1' : '0';
        Block tampered = new Block(3, 5L, TXS, "prev", flipped + honest.hash().substring(1), 0L, "m");

        assertNotEquals(tampered.hash(), tampered.computeHash());
        assertEquals(honest.hash(), tampered.computeHash());
    }

    @Test
    void nonceOccupiesTheLastEightPreimageBytes() {
        Block block = Block.create(1, 1L, TXS, "p", 0x0102030405060708L, "m");
        byte[] preimage = block.hashPreimage();

        assertEquals(0x08, preimage[preimage.length - 1]);
        assertEquals(0x01, preimage[preimage.length - 8]);
    }

    @Test
    void genesisHasFixedShape() {
        Block genesis = GenesisBuilder.buildGenesis(0L);

        assertTrue(genesis.isGenesis());
        assertEquals(0, genesis.index());
        assertEquals(Block.GENESIS_PREVIOUS_HASH, genesis.previousHash());
        assertTrue(genesis.transactions().isEmpty());
        assertFalse(genesis.hasMiner());
        assertEquals(genesis.computeHash(), genesis.hash());
    }

    @Test
    void negativeIndexIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Block.create(-1, 0L, List.of(), "p", 0L, "m"));
    }
}
