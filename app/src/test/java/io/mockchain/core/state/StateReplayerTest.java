package io.mockchain.core.state;

import io.mockchain.core.ledger.GenesisBuilder;
import io.mockchain.core.protocol.Block;
import io.mockchain.core.protocol.Transaction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateReplayerTest {

    private static List<Block> chain() {
        Block genesis = GenesisBuilder.buildGenesis(0L);
        Block one = Block.create(1, 1L, List.of(Transaction.faucet("alice", 100, 1L)), genesis.hash(), 0L, "miner");
        Block two = Block.create(2, 2L, List.of(Transaction.faucet("bob", 20, 2L)), one.hash(), 0L, "miner");
        return List.of(genesis, one, two);
    }

    @Test
    void replayFoldsEveryBlockWithReward() {
        StateStore replayed = StateReplayer.replay(chain(), 50);

        assertEquals(100, replayed.getBalance("alice"));
        assertEquals(20, replayed.getBalance("bob"));
        assertEquals(100, replayed.getBalance("miner"));
        assertEquals(220, replayed.totalSupply());
    }

    @Test
    void matchingStoresHaveNoDiff() {
        StateStore live = new InMemoryStateStore();
        for (Block block : chain()) {
            live.applyBlock(block, 50);
        }

        assertEquals("", StateReplayer.diff(live, StateReplayer.replay(chain(), 50)));
    }

    @Test
    void divergenceIsReported() {
        StateStore live = StateReplayer.replay(chain(), 50);
        live.credit("alice", 1);

        String diff = StateReplayer.diff(live, StateReplayer.replay(chain(), 50));

        assertTrue(diff.contains("alice: live=101 replay=100"), diff);
        assertTrue(diff.contains("supply"), diff);
    }
}
