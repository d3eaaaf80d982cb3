package io.mockchain.core;

import io.mockchain.core.consensus.ConsensusSettings;
import io.mockchain.core.consensus.ConsensusType;
import io.mockchain.core.node.NodeConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    private static Main.CliOptions parse(String... args) {
        return Main.CliOptions.parse(args, key -> null);
    }

    @Test
    void parsesDefaults() {
        Main.CliOptions options = parse();
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertEquals(ConsensusType.PROOF_OF_WORK, options.consensus());
        assertEquals(ConsensusSettings.DEFAULT_DIFFICULTY, options.difficulty());
        assertFalse(options.enableApi());
        assertTrue(options.demo());
        assertFalse(options.keepAlive());
        assertNull(options.minerAddress());
        assertEquals(50, options.blockReward());
        assertEquals(1000, options.faucetAmount());
        assertEquals(0, options.faucetCooldownMillis());
    }

    @Test
    void proofOfStakeWithValidators() {
        Main.CliOptions options = parse(
                "--consensus=pos",
                "--min-stake=200",
                "--validator=v1:500",
                "--validator=v2:300",
                "--slot-ms=250",
                "--miner-address=v1");

        assertNull(options.errorMessage());
        assertEquals(ConsensusType.PROOF_OF_STAKE, options.consensus());
        assertEquals(Map.of("v1", 500L, "v2", 300L), options.validators());

        ConsensusSettings settings = options.consensusSettings();
        assertEquals(200, settings.minStake());
        assertEquals(Duration.ofMillis(250), settings.slotInterval());
        NodeConfig config = options.toNodeConfig();
        assertEquals("v1", config.minerAddress);
    }

    @Test
    void enablesApiWithToken() {
        Main.CliOptions options = parse(
                "--enable-api",
                "--api-bind=0.0.0.0",
                "--api-port=8181",
                "--api-token=test-api",
                "--no-demo",
                "--faucet-amount=25",
                "--faucet-cooldown-ms=60000",
                "--produce-empty-blocks");
        assertFalse(options.showHelp());
        assertTrue(options.enableApi());
        assertEquals("0.0.0.0", options.apiBind());
        assertEquals(8181, options.apiPort());
        assertEquals("test-api", options.apiToken());
        assertFalse(options.demo());
        assertTrue(options.keepAlive());

        NodeConfig config = options.toNodeConfig();
        assertEquals(25, config.faucetAmount);
        assertEquals(Duration.ofMinutes(1), config.faucetCooldown);
        assertTrue(config.produceEmptyBlocks);
    }

    @Test
    void environmentSuppliesFallbacks() {
        Map<String, String> env = Map.of(
                "MOCKCHAIN_CONSENSUS", "pos",
                "MOCKCHAIN_BLOCK_REWARD", "7",
                "MOCKCHAIN_API_TOKEN", "from-env",
                "MOCKCHAIN_KEEP_ALIVE", "true");

        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--block-reward=9"}, env::get);

        assertEquals(ConsensusType.PROOF_OF_STAKE, options.consensus());
        assertEquals(9, options.blockReward());
        assertEquals("from-env", options.apiToken());
        assertTrue(options.keepAlive());
    }

    @Test
    void invalidValuesSetError() {
        Main.CliOptions badDifficulty = parse("--difficulty=99");
        assertTrue(badDifficulty.showHelp());
        assertTrue(badDifficulty.errorMessage().contains("--difficulty"));

        Main.CliOptions badValidator = parse("--validator=nostake");
        assertTrue(badValidator.showHelp());
        assertTrue(badValidator.errorMessage().contains("--validator"));

        Main.CliOptions badConsensus = parse("--consensus=raft");
        assertTrue(badConsensus.showHelp());
        assertNotNull(badConsensus.errorMessage());

        assertTrue(parse("--faucet-amount=0").showHelp());
        assertTrue(parse("--demo-duration-ms=-1").errorMessage().contains("--demo-duration-ms"));
    }

    @Test
    void unknownFlagTriggersHelp() {
        Main.CliOptions options = parse("--unknown-flag");
        assertTrue(options.showHelp());
        assertEquals("Unknown option: --unknown-flag", options.errorMessage());
    }
}
