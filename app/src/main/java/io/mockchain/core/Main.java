package io.mockchain.core;

import io.mockchain.core.api.ApiServer;
import io.mockchain.core.consensus.ConsensusSettings;
import io.mockchain.core.consensus.ConsensusType;
import io.mockchain.core.metrics.BlockMetrics;
import io.mockchain.core.node.FaucetResult;
import io.mockchain.core.node.Node;
import io.mockchain.core.node.NodeConfig;
import io.mockchain.core.protocol.Block;
import io.mockchain.core.protocol.ProtocolLimits;
import io.mockchain.core.protocol.Transaction;
import io.mockchain.core.wallet.Wallet;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.function.UnaryOperator;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        NodeConfig config = options.toNodeConfig();
        Node node = Node.inMemory(config);
        LOG.info("Block rewards -> " + node.minerAddress() + " (reward " + config.blockReward + ")");

        ApiServer apiServer = null;
        try {
            boolean keepAlive = options.keepAlive() || options.enableApi();
            if (keepAlive) {
                node.start();
            }

            if (options.demo()) {
                runDemoFlow(node);
            } else {
                LOG.info("Demo flow disabled (--no-demo)");
            }

            if (options.enableApi()) {
                apiServer = new ApiServer(node, options.apiBind(), options.apiPort(), options.apiToken());
                apiServer.start();
            }

            if (keepAlive) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "mockchain-shutdown"));
                LOG.info("Node running. Press CTRL+C to exit.");
                shutdownLatch.await();
            } else if (options.demoDurationMillis() > 0) {
                try {
                    Thread.sleep(options.demoDurationMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        } finally {
            if (apiServer != null) {
                apiServer.stop();
            }
            node.close();
        }
    }

    /** Loads the bundled logging.properties unless the JVM was pointed at another file. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load bundled logging.properties: " + e.getMessage());
        }
    }

    private static void runDemoFlow(Node node) {
        Wallet alice = Wallet.generate();
        Wallet bob = Wallet.generate();
        LOG.info("Alice addr=" + alice.getAddress());
        LOG.info("Bob   addr=" + bob.getAddress());

        FaucetResult grant = node.requestFaucet(alice.getAddress());
        LOG.info("Faucet " + grant.status() + " for alice: " + grant.amount());

        Transaction transfer = alice.transfer(bob.getAddress(), 10);
        node.submitTransaction(transfer);
        LOG.info("Tx signed and added to pool: " + transfer.id());

        for (int i = 0; i < 5 && node.ledger().pendingCount() > 0; i++) {
            Optional<Block> mined = node.tick();
            mined.ifPresent(b -> LOG.info("Demo block " + b.index() + " committed " + b.transactions().size() + " transaction(s)"));
        }

        LOG.info("Chain length=" + node.ledger().length());
        LOG.info("Alice balance=" + node.getBalance(alice.getAddress()));
        LOG.info("Bob   balance=" + node.getBalance(bob.getAddress()));
        LOG.info("Miner balance=" + node.getBalance(node.minerAddress()));
        LOG.info("=== Metrics ===\n" + BlockMetrics.scrapeMetrics());
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            ConsensusType consensus,
            int difficulty,
            long minStake,
            Map<String, Long> validators,
            long slotMillis,
            String minerAddress,
            long blockReward,
            long faucetAmount,
            long faucetCooldownMillis,
            boolean produceEmptyBlocks,
            boolean keepAlive,
            boolean demo,
            long demoDurationMillis,
            boolean enableApi,
            String apiBind,
            int apiPort,
            String apiToken
    ) {
        static CliOptions parse(String[] args) {
            return parse(args, System::getenv);
        }

        static CliOptions parse(String[] args, UnaryOperator<String> env) {
            boolean showHelp = false;
            String error = null;
            ConsensusType consensus = ConsensusType.PROOF_OF_WORK;
            int difficulty = ConsensusSettings.DEFAULT_DIFFICULTY;
            long minStake = ConsensusSettings.DEFAULT_MIN_STAKE;
            Map<String, Long> validators = new LinkedHashMap<>();
            long slotMillis = ConsensusSettings.DEFAULT_SLOT_INTERVAL.toMillis();
            NodeConfig defaults = NodeConfig.defaultLocal();
            long blockReward = defaults.blockReward;
            long faucetAmount = defaults.faucetAmount;
            long faucetCooldownMillis = defaults.faucetCooldown.toMillis();
            boolean produceEmptyBlocks = "true".equalsIgnoreCase(env.apply("MOCKCHAIN_PRODUCE_EMPTY_BLOCKS"));
            boolean keepAlive = false;
            boolean demo = true;
            long demoDurationMillis = 0L;
            boolean enableApi = "true".equalsIgnoreCase(env.apply("MOCKCHAIN_ENABLE_API"));
            String apiBind = envOrDefault(env, "MOCKCHAIN_API_BIND", "127.0.0.1");
            int apiPort = 8080;
            String apiToken = env.apply("MOCKCHAIN_API_TOKEN");
            String minerAddress = envOrDefault(env, "MOCKCHAIN_MINER_ADDRESS", null);

            try {
                String value = env.apply("MOCKCHAIN_CONSENSUS");
                if (value != null && !value.isBlank()) {
                    consensus = ConsensusType.parse(value);
                }
                value = env.apply("MOCKCHAIN_DIFFICULTY");
                if (value != null && !value.isBlank()) {
                    difficulty = parseDifficulty(value, "MOCKCHAIN_DIFFICULTY");
                }
                value = env.apply("MOCKCHAIN_MIN_STAKE");
                if (value != null && !value.isBlank()) {
                    minStake = parsePositiveLong(value, "MOCKCHAIN_MIN_STAKE");
                }
                value = env.apply("MOCKCHAIN_BLOCK_REWARD");
                if (value != null && !value.isBlank()) {
                    blockReward = parsePositiveLong(value, "MOCKCHAIN_BLOCK_REWARD");
                }
                value = env.apply("MOCKCHAIN_FAUCET_AMOUNT");
                if (value != null && !value.isBlank()) {
                    faucetAmount = parsePositiveLong(value, "MOCKCHAIN_FAUCET_AMOUNT");
                }
                value = env.apply("MOCKCHAIN_FAUCET_COOLDOWN_MS");
                if (value != null && !value.isBlank()) {
                    faucetCooldownMillis = parsePositiveLong(value, "MOCKCHAIN_FAUCET_COOLDOWN_MS");
                }
                value = env.apply("MOCKCHAIN_API_PORT");
                if (value != null && !value.isBlank()) {
                    apiPort = parsePort(value, "MOCKCHAIN_API_PORT");
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--consensus=")) {
                            consensus = ConsensusType.parse(arg.substring("--consensus=".length()));
                        } else if (arg.startsWith("--difficulty=")) {
                            difficulty = parseDifficulty(arg.substring("--difficulty=".length()), "--difficulty");
                        } else if (arg.startsWith("--min-stake=")) {
                            minStake = parsePositiveLong(arg.substring("--min-stake=".length()), "--min-stake");
                        } else if (arg.startsWith("--validator=")) {
                            parseValidator(arg.substring("--validator=".length()), validators);
                        } else if (arg.startsWith("--slot-ms=")) {
                            slotMillis = parsePositiveLong(arg.substring("--slot-ms=".length()), "--slot-ms");
                        } else if (arg.startsWith("--miner-address=")) {
                            minerAddress = arg.substring("--miner-address=".length()).trim();
                        } else if (arg.startsWith("--block-reward=")) {
                            blockReward = parsePositiveLong(arg.substring("--block-reward=".length()), "--block-reward");
                        } else if (arg.startsWith("--faucet-amount=")) {
                            faucetAmount = parsePositiveLong(arg.substring("--faucet-amount=".length()), "--faucet-amount");
                        } else if (arg.startsWith("--faucet-cooldown-ms=")) {
                            faucetCooldownMillis = parsePositiveLong(arg.substring("--faucet-cooldown-ms=".length()), "--faucet-cooldown-ms");
                        } else if (arg.equals("--produce-empty-blocks")) {
                            produceEmptyBlocks = true;
                        } else if (arg.equals("--keep-alive")) {
                            keepAlive = true;
                        } else if (arg.equals("--demo")) {
                            demo = true;
                        } else if (arg.equals("--no-demo")) {
                            demo = false;
                        } else if (arg.startsWith("--demo-duration-ms=")) {
                            demoDurationMillis = parsePositiveLong(arg.substring("--demo-duration-ms=".length()), "--demo-duration-ms");
                        } else if (arg.equals("--enable-api")) {
                            enableApi = true;
                        } else if (arg.startsWith("--api-bind=")) {
                            apiBind = arg.substring("--api-bind=".length());
                        } else if (arg.startsWith("--api-port=")) {
                            apiPort = parsePort(arg.substring("--api-port=".length()), "--api-port");
                        } else if (arg.startsWith("--api-token=")) {
                            apiToken = arg.substring("--api-token=".length());
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        error = ex.getMessage();
                    }
                }
            }

            if (faucetAmount == 0 && error == null) {
                showHelp = true;
                error = "Faucet amount must be > 0";
            }
            if (slotMillis == 0 && error == null) {
                showHelp = true;
                error = "Slot interval must be > 0";
            }
            if (apiToken != null && apiToken.isBlank()) {
                apiToken = null;
            }
            if (minerAddress != null && minerAddress.isBlank()) {
                minerAddress = null;
            }
            keepAlive = keepAlive || enableApi || "true".equalsIgnoreCase(env.apply("MOCKCHAIN_KEEP_ALIVE"));

            return new CliOptions(
                    showHelp,
                    error,
                    consensus,
                    difficulty,
                    minStake,
                    Map.copyOf(validators),
                    slotMillis,
                    minerAddress,
                    blockReward,
                    faucetAmount,
                    faucetCooldownMillis,
                    produceEmptyBlocks,
                    keepAlive,
                    demo,
                    demoDurationMillis,
                    enableApi,
                    apiBind,
                    apiPort,
                    apiToken
            );
        }

        ConsensusSettings consensusSettings() {
            ConsensusSettings settings = consensus == ConsensusType.PROOF_OF_STAKE
                    ? ConsensusSettings.proofOfStake(minStake, validators)
                    : ConsensusSettings.proofOfWork(difficulty);
            return settings.withSlotInterval(Duration.ofMillis(slotMillis));
        }

        NodeConfig toNodeConfig() {
            return NodeConfig.builder()
                    .consensus(consensusSettings())
                    .minerAddress(minerAddress)
                    .blockReward(blockReward)
                    .faucetAmount(faucetAmount)
                    .faucetCooldown(Duration.ofMillis(faucetCooldownMillis))
                    .produceEmptyBlocks(produceEmptyBlocks)
                    .build();
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: mockchain [options]

Options:
  --help, -h                 Show this help message and exit
  --consensus=<pow|pos>      Consensus policy (default pow)
  --difficulty=<n>           Leading zero hex digits required under pow (default 3)
  --min-stake=<n>            Minimum stake for a pos validator (default 100)
  --validator=<addr>:<stake> Register a pos validator stake (repeatable)
  --slot-ms=<ms>             Block interval under pos (default 10000)
  --miner-address=<addr>     Address credited with block rewards (generated if absent)
  --block-reward=<n>         Reward credited per produced block (default 50)
  --faucet-amount=<n>        Amount granted per faucet request (default 1000)
  --faucet-cooldown-ms=<ms>  Per-address faucet cooldown, 0 for unlimited (default 0)
  --produce-empty-blocks     Keep producing blocks while the pool is empty
  --keep-alive               Keep the node producing until interrupted
  --demo / --no-demo         Enable (default) or disable the demo transaction flow
  --demo-duration-ms=<ms>    How long to keep the JVM alive when not using --keep-alive (default 0)
  --enable-api               Start the HTTP API (default bind 127.0.0.1:8080)
  --api-bind=<host>          Bind address for the HTTP API
  --api-port=<port>          Port for the HTTP API (default 8080)
  --api-token=<token>        Require Bearer/X-API-Key token for the HTTP API

Environment overrides:
  MOCKCHAIN_CONSENSUS, MOCKCHAIN_DIFFICULTY, MOCKCHAIN_MIN_STAKE, MOCKCHAIN_MINER_ADDRESS,
  MOCKCHAIN_BLOCK_REWARD, MOCKCHAIN_FAUCET_AMOUNT, MOCKCHAIN_FAUCET_COOLDOWN_MS,
  MOCKCHAIN_PRODUCE_EMPTY_BLOCKS, MOCKCHAIN_ENABLE_API, MOCKCHAIN_API_BIND,
  MOCKCHAIN_API_PORT, MOCKCHAIN_API_TOKEN, MOCKCHAIN_KEEP_ALIVE
""");
        }

        private static String envOrDefault(UnaryOperator<String> env, String key, String fallback) {
            String value = env.apply(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static void parseValidator(String value, Map<String, Long> validators) {
            int sep = value.lastIndexOf(':');
            if (sep <= 0 || sep == value.length() - 1) {
                throw new IllegalArgumentException("Invalid value for --validator: " + value + " (expected <addr>:<stake>)");
            }
            String address = value.substring(0, sep).trim();
            long stake = parsePositiveLong(value.substring(sep + 1), "--validator");
            validators.merge(address, stake, Long::sum);
        }

        private static int parseDifficulty(String value, String flag) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed < 0 || parsed > ProtocolLimits.MAX_DIFFICULTY) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value + " (expected 0-64)");
            }
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value.trim());
                if (port < 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static long parsePositiveLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value.trim());
                if (parsed < 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
