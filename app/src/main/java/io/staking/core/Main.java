package io.staking.core;

import io.staking.core.clock.LedgerClock;
import io.staking.core.clock.ManualClock;
import io.staking.core.clock.SystemLedgerClock;
import io.staking.core.metrics.LedgerMetrics;
import io.staking.core.node.LedgerBootstrap;
import io.staking.core.node.NodeConfig;
import io.staking.core.node.StakingNode;
import io.staking.core.protocol.Pool;
import io.staking.core.protocol.ProtocolStats;
import io.staking.core.protocol.Receipt;
import io.staking.core.protocol.Tier;
import io.staking.core.protocol.TierBenefit;
import io.staking.core.protocol.TierClaim;
import io.staking.core.rpc.RpcServer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final long DAY = Tier.SECONDS_PER_DAY;

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

        NodeConfig config = NodeConfig.defaultLocal()
                .withOperator(options.operator())
                .withLoyaltyEnabled(options.loyaltyEnabled());
        if (options.tierBenefitsFile() != null) {
            Map<Tier, TierBenefit> benefits = LedgerBootstrap.loadTierBenefits(options.tierBenefitsFile());
            config = config.withTierBenefits(benefits);
            LOG.info("Tier benefits loaded from " + options.tierBenefitsFile());
        }

        if (options.demo()) {
            runDemoFlow(config);
        } else {
            LOG.info("Demo flow disabled (--no-demo)");
        }

        if (!options.keepAlive()) {
            LOG.info(LedgerMetrics.scrapeMetrics());
            return;
        }

        LedgerClock clock = new SystemLedgerClock();
        StakingNode node;
        if (options.journalDir() != null) {
            Path journalPath = options.journalDir().toAbsolutePath().normalize();
            Files.createDirectories(journalPath);
            node = StakingNode.rocks(config, clock, journalPath.toString());
            LOG.info("Event journal at " + journalPath);
        } else {
            node = StakingNode.inMemory(config, clock);
            LOG.info("Event journal in memory (no --journal-dir)");
        }

        RpcServer rpcServer = null;
        try {
            node.start();
            if (options.enableRpc()) {
                rpcServer = new RpcServer(
                        node,
                        options.rpcBind(),
                        options.rpcPort(),
                        options.rpcToken()
                );
                rpcServer.start();
            }
            CountDownLatch shutdownLatch = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "staking-ledger-shutdown"));
            LOG.info("Node running. Press CTRL+C to exit.");
            shutdownLatch.await();
        } finally {
            if (rpcServer != null) {
                rpcServer.stop();
            }
            node.close();
        }
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not load bundled logging.properties", e);
        }
    }

    /**
     * Walks one pool through its lifecycle on a throwaway in-memory node whose
     * clock is advanced by hand.
     */
    static void runDemoFlow(NodeConfig config) {
        String op = config.operator;
        String alice = "alice";
        String bob = "bob";
        Map<String, Long> balances = new LinkedHashMap<>();
        balances.put(op, 1_000_000_000_000L);
        balances.put(alice, 100_000_000_000L);
        balances.put(bob, 50_000_000_000L);

        ManualClock clock = new ManualClock(1_700_000_000L);
        try (StakingNode node = StakingNode.inMemory(config.withInitialBalances(balances), clock)) {
            node.start();

            long poolId = node.createPool(op, "Demo 5%/day", 500, 1_000_000, 7 * DAY, DAY, OptionalLong.empty()).value();
            node.fundRewardPool(op, poolId, 10_000_000_000L);
            node.deposit(alice, poolId, 10_000_000L);
            node.deposit(bob, poolId, 5_000_000L);
            LOG.info("Pool #" + poolId + " opened, alice and bob staked");

            clock.advance(DAY);
            long net = node.claim(alice, poolId).value();
            LOG.info("Alice claimed " + net + " after one day");

            long early = node.withdraw(bob, poolId, 5_000_000L).value();
            LOG.info("Bob exited early and received " + early);

            clock.advance(30 * DAY);
            Receipt<TierClaim> tierClaim = node.claimWithTierBonus(alice, poolId);
            LOG.info("Alice tier claim: " + tierClaim.value());

            clock.advance(DAY);
            long compounded = node.compound(alice, poolId).value();
            LOG.info("Alice compounded " + compounded);

            long cooldownEnds = node.startCooldown(alice, poolId).value();
            clock.advance(cooldownEnds - clock.now());
            long stake = node.getPosition(poolId, alice).orElseThrow().amount();
            long out = node.withdraw(alice, poolId, stake).value();
            LOG.info("Alice withdrew " + out + " after cooldown");

            Pool pool = node.getPool(poolId).orElseThrow();
            ProtocolStats stats = node.protocolStats();
            LOG.info("Pool after demo: " + pool);
            LOG.info("Protocol stats: " + stats);
        }
    }

    record CliOptions(
            boolean showHelp,
            String errorMessage,
            boolean keepAlive,
            boolean demo,
            String operator,
            boolean loyaltyEnabled,
            Path tierBenefitsFile,
            Path journalDir,
            boolean enableRpc,
            String rpcBind,
            int rpcPort,
            String rpcToken
    ) {
        static CliOptions parse(String[] args) {
            boolean keepAlive = false;
            boolean demo = true;
            NodeConfig defaults = NodeConfig.defaultLocal();
            String operator = envOrDefault("STAKING_LEDGER_OPERATOR", defaults.operator);
            boolean loyalty = !"false".equalsIgnoreCase(System.getenv("STAKING_LEDGER_LOYALTY"));
            Path tierBenefits = envPath("STAKING_LEDGER_TIER_BENEFITS", null);
            Path journalDir = envPath("STAKING_LEDGER_JOURNAL_DIR", null);
            boolean enableRpc = "true".equalsIgnoreCase(System.getenv("STAKING_LEDGER_ENABLE_RPC"));
            String rpcBind = envOrDefault("STAKING_LEDGER_RPC_BIND", "127.0.0.1");
            int rpcPort = 9090;
            String rpcToken = System.getenv("STAKING_LEDGER_RPC_TOKEN");
            boolean showHelp = false;
            String error = null;

            try {
                rpcPort = envPort("STAKING_LEDGER_RPC_PORT", 9090);
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (arg.startsWith("--operator=")) {
                        operator = arg.substring("--operator=".length()).trim();
                    } else if (arg.equals("--no-loyalty")) {
                        loyalty = false;
                    } else if (arg.startsWith("--tier-benefits=")) {
                        tierBenefits = Path.of(arg.substring("--tier-benefits=".length()));
                    } else if (arg.startsWith("--journal-dir=")) {
                        journalDir = Path.of(arg.substring("--journal-dir=".length()));
                    } else if (arg.equals("--enable-rpc")) {
                        enableRpc = true;
                    } else if (arg.startsWith("--rpc-bind=")) {
                        rpcBind = arg.substring("--rpc-bind=".length());
                    } else if (arg.startsWith("--rpc-port=")) {
                        try {
                            rpcPort = parsePort(arg.substring("--rpc-port=".length()), "--rpc-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--rpc-token=")) {
                        rpcToken = arg.substring("--rpc-token=".length());
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (rpcToken == null || rpcToken.isBlank()) {
                rpcToken = System.getenv("STAKING_LEDGER_RPC_TOKEN");
            }
            if (operator == null || operator.isBlank()) {
                if (error == null) {
                    showHelp = true;
                    error = "Operator identity must not be blank";
                }
                operator = defaults.operator;
            }

            keepAlive = keepAlive || enableRpc || "true".equalsIgnoreCase(System.getenv("STAKING_LEDGER_KEEP_ALIVE"));

            return new CliOptions(
                    showHelp,
                    error,
                    keepAlive,
                    demo,
                    operator,
                    loyalty,
                    tierBenefits,
                    journalDir,
                    enableRpc,
                    rpcBind,
                    rpcPort,
                    rpcToken
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: staking-ledger [options]

Options:
  --help, -h                 Show this help message and exit
  --keep-alive               Keep the node running until interrupted
  --demo / --no-demo         Enable (default) or disable the simulated demo flow
  --operator=<id>            Identity allowed to run pool administration (default operator)
  --no-loyalty               Start with the loyalty program disabled
  --tier-benefits=<file>     JSON file with the tier benefit table
  --journal-dir=<path>       Journal events to RocksDB under this directory (default in memory)
  --enable-rpc               Start the RPC server (default bind 127.0.0.1:9090)
  --rpc-bind=<host>          Bind address for the RPC server
  --rpc-port=<port>          Port for the RPC server (default 9090)
  --rpc-token=<token>        Require Bearer/X-API-Key token for the RPC server

Environment overrides:
  STAKING_LEDGER_OPERATOR        Override --operator
  STAKING_LEDGER_LOYALTY         Set to "false" to disable the loyalty program
  STAKING_LEDGER_TIER_BENEFITS   Override --tier-benefits
  STAKING_LEDGER_JOURNAL_DIR     Override --journal-dir
  STAKING_LEDGER_ENABLE_RPC      Set to "true" to enable RPC without CLI flag
  STAKING_LEDGER_RPC_BIND        Override --rpc-bind
  STAKING_LEDGER_RPC_PORT        Override --rpc-port
  STAKING_LEDGER_RPC_TOKEN       Token for RPC auth (if --rpc-token not supplied)
  STAKING_LEDGER_KEEP_ALIVE      Set to "true" to force keep-alive mode
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }
    }
}
