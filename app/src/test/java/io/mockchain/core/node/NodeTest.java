package io.mockchain.core.node;

import io.mockchain.core.consensus.ConsensusSettings;
import io.mockchain.core.consensus.ProofOfStake;
import io.mockchain.core.protocol.Block;
import io.mockchain.core.wallet.Wallet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    private Node node;

    @AfterEach
    void tearDown() {
        if (node != null) {
            node.close();
        }
    }

    @Test
    void proofOfWorkScenario() {
        node = Node.inMemory(NodeConfig.builder()
                .consensus(ConsensusSettings.proofOfWork(2))
                .minerAddress("miner")
                .faucetAmount(100)
                .build());
        Wallet a = Wallet.generate();
        Wallet b = Wallet.generate();

        assertTrue(node.requestFaucet(a.getAddress()).granted());
        node.submitTransaction(a.transfer(b.getAddress(), 10));
        Block block = node.tick().orElseThrow();

        assertTrue(block.hash().startsWith("00"));
        assertEquals(2, node.ledger().length());
        assertEquals(90, node.getBalance(a.getAddress()));
        assertEquals(10, node.getBalance(b.getAddress()));
        assertEquals(50, node.getBalance("miner"));
    }

    @Test
    void proofOfStakeNodeProducesAsLocalValidator() {
        node = Node.inMemory(NodeConfig.builder()
                .consensus(ConsensusSettings.proofOfStake(100, Map.of()))
                .minerAddress("validator-1")
                .build());

        node.requestFaucet("alice");
        Block block = node.tick().orElseThrow();

        assertEquals("validator-1", block.miner());
        assertEquals("Proof of Stake", node.ledger().consensusName());
        assertEquals(100, ((ProofOfStake) node.consensus()).stakeOf("validator-1"));
        assertEquals(Faucet.DEFAULT_AMOUNT, node.getBalance("alice"));
        assertEquals(50, node.getBalance("validator-1"));
    }

    @Test
    void generatesMinerAddressWhenNoneConfigured() {
        node = Node.inMemory(NodeConfig.defaultLocal());

        assertNotNull(node.minerAddress());
        assertFalse(node.minerAddress().isBlank());
    }

    @Test
    void backgroundProducerCommitsSubmittedTransactions() throws Exception {
        node = Node.inMemory(NodeConfig.builder()
                .consensus(ConsensusSettings.proofOfWork(1))
                .minerAddress("miner")
                .idlePoll(Duration.ofMillis(5))
                .build());
        node.start();
        assertTrue(node.isProducing());

        node.requestFaucet("alice");

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (node.getBalance("alice") == 0) {
            assertTrue(System.nanoTime() < deadline, "faucet credit was never committed");
            Thread.sleep(10);
        }
        node.close();

        assertFalse(node.isProducing());
        assertEquals(Faucet.DEFAULT_AMOUNT, node.getBalance("alice"));
    }
}
