package io.forkrecovery.core;

import io.forkrecovery.core.metrics.RecoveryMetrics;
import io.forkrecovery.core.node.Node;
import io.forkrecovery.core.node.RecoveryConfig;
import io.forkrecovery.core.protocol.ProtocolLimits;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.function.Function;
import java.util.logging.Level;
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

        RecoveryConfig config = options.toConfig();
        String nodeId = options.nodeId() == null ? UUID.randomUUID().toString() : options.nodeId();
        Node node;
        if (options.inMemory()) {
            node = Node.inMemory(nodeId, options.p2pPort(), config);
        } else {
            Path dataPath = options.dataDir().toAbsolutePath().normalize();
            Files.createDirectories(dataPath);
            node = Node.rocks(nodeId, options.p2pPort(), config, dataPath.toString());
        }

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "fork-recovery-shutdown"));
        try {
            node.start();
            LOG.info("P2P node id=" + nodeId + " listening on " + options.p2pPort());
            node.connect(options.p2pPeers());
            LOG.info("Node running. Press CTRL+C to exit.");
            shutdownLatch.await();
        } finally {
            LOG.info("=== Metrics ===\n" + RecoveryMetrics.scrapeMetrics());
            node.close();
        }
    }

    /** Bundled logging.properties unless one was given on the command line. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to load bundled logging configuration", e);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            boolean inMemory,
            int p2pPort,
            String nodeId,
            List<String> p2pPeers,
            int maxFetchAttempts,
            long retryBackoffMillis,
            long peerTimeoutMillis,
            long sessionTimeoutMillis,
            long difficultyBits
    ) {
        static CliOptions parse(String[] args) {
            return parse(args, System::getenv);
        }

        static CliOptions parse(String[] args, Function<String, String> env) {
            RecoveryConfig defaults = RecoveryConfig.defaultLocal();
            Path dataDir = envPath(env, "FORK_RECOVERY_DATA_DIR", Path.of("./data/chain"));
            boolean inMemory = "true".equalsIgnoreCase(env.apply("FORK_RECOVERY_IN_MEMORY"));
            String nodeId = envOrDefault(env, "FORK_RECOVERY_NODE_ID", null);
            List<String> p2pPeers = new ArrayList<>();
            String peersEnv = env.apply("FORK_RECOVERY_P2P_PEERS");
            if (peersEnv != null && !peersEnv.isBlank()) {
                for (String endpoint : peersEnv.split(",")) {
                    if (endpoint != null && !endpoint.isBlank()) {
                        p2pPeers.add(endpoint.trim());
                    }
                }
            }
            int p2pPort = 9000;
            int maxFetchAttempts = defaults.maxFetchAttempts;
            long retryBackoffMillis = defaults.retryBackoffMillis;
            long peerTimeoutMillis = defaults.peerRequestTimeoutMillis;
            long sessionTimeoutMillis = defaults.sessionTimeoutMillis;
            long difficultyBits = defaults.difficultyBits;
            boolean showHelp = false;
            String error = null;

            try {
                p2pPort = envPort(env, "FORK_RECOVERY_P2P_PORT", p2pPort);
                maxFetchAttempts = (int) envLong(env, "FORK_RECOVERY_MAX_FETCH_ATTEMPTS", maxFetchAttempts, true);
                retryBackoffMillis = envLong(env, "FORK_RECOVERY_RETRY_BACKOFF_MS", retryBackoffMillis, false);
                peerTimeoutMillis = envLong(env, "FORK_RECOVERY_PEER_TIMEOUT_MS", peerTimeoutMillis, true);
                sessionTimeoutMillis = envLong(env, "FORK_RECOVERY_SESSION_TIMEOUT_MS", sessionTimeoutMillis, false);
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
                        } else if (arg.startsWith("--data-dir=")) {
                            dataDir = Path.of(arg.substring("--data-dir=".length()));
                        } else if (arg.equals("--in-memory")) {
                            inMemory = true;
                        } else if (arg.startsWith("--p2p-port=")) {
                            p2pPort = parsePort(arg.substring("--p2p-port=".length()), "--p2p-port");
                        } else if (arg.startsWith("--p2p-peer=")) {
                            p2pPeers.add(arg.substring("--p2p-peer=".length()));
                        } else if (arg.startsWith("--node-id=")) {
                            nodeId = arg.substring("--node-id=".length());
                        } else if (arg.startsWith("--max-fetch-attempts=")) {
                            maxFetchAttempts = (int) parseAtLeastOne(arg.substring("--max-fetch-attempts=".length()), "--max-fetch-attempts");
                        } else if (arg.startsWith("--retry-backoff-ms=")) {
                            retryBackoffMillis = parsePositiveLong(arg.substring("--retry-backoff-ms=".length()), "--retry-backoff-ms");
                        } else if (arg.startsWith("--peer-timeout-ms=")) {
                            peerTimeoutMillis = parseAtLeastOne(arg.substring("--peer-timeout-ms=".length()), "--peer-timeout-ms");
                        } else if (arg.startsWith("--session-timeout-ms=")) {
                            sessionTimeoutMillis = parsePositiveLong(arg.substring("--session-timeout-ms=".length()), "--session-timeout-ms");
                        } else if (arg.startsWith("--difficulty=")) {
                            difficultyBits = parseDifficulty(arg.substring("--difficulty=".length()), "--difficulty");
                        } else if (!arg.startsWith("--")) {
                            dataDir = Path.of(arg);
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        if (error == null) {
                            error = ex.getMessage();
                        }
                    }
                }
            }

            if (nodeId != null && nodeId.isBlank()) {
                nodeId = null;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    inMemory,
                    p2pPort,
                    nodeId,
                    List.copyOf(p2pPeers),
                    maxFetchAttempts,
                    retryBackoffMillis,
                    peerTimeoutMillis,
                    sessionTimeoutMillis,
                    difficultyBits
            );
        }

        RecoveryConfig toConfig() {
            return RecoveryConfig.defaultLocal()
                    .withRetries(maxFetchAttempts, retryBackoffMillis)
                    .withTimeouts(peerTimeoutMillis, sessionTimeoutMillis)
                    .withDifficulty(difficultyBits);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: fork-recovery-node [options]

Options:
  --help, -h                    Show this help message and exit
  --data-dir=<path>             Path for block data (default ./data/chain)
  --in-memory                   Keep blocks in memory instead of RocksDB
  --p2p-port=<port>             Port for the P2P listener (default 9000)
  --p2p-peer=<host:port>        Add a bootstrap peer (repeatable)
  --node-id=<id>                Explicit node identifier advertised to peers
  --max-fetch-attempts=<n>      Attempts per block fetch during recovery (default 3)
  --retry-backoff-ms=<ms>       Linear backoff unit between fetch attempts (default 250)
  --peer-timeout-ms=<ms>        Wait per peer block request (default 5000)
  --session-timeout-ms=<ms>     Deadline for one recovery, 0 for none (default 0)
  --difficulty=<bits>           Genesis proof-of-work difficulty (default 8)

Environment overrides:
  FORK_RECOVERY_DATA_DIR            Override --data-dir
  FORK_RECOVERY_IN_MEMORY           Set to "true" to use the in-memory store
  FORK_RECOVERY_P2P_PORT            Override --p2p-port
  FORK_RECOVERY_P2P_PEERS           Comma-separated bootstrap peers (host:port)
  FORK_RECOVERY_NODE_ID             Override/generated node identifier
  FORK_RECOVERY_MAX_FETCH_ATTEMPTS  Override --max-fetch-attempts
  FORK_RECOVERY_RETRY_BACKOFF_MS    Override --retry-backoff-ms
  FORK_RECOVERY_PEER_TIMEOUT_MS     Override --peer-timeout-ms
  FORK_RECOVERY_SESSION_TIMEOUT_MS  Override --session-timeout-ms
""");
        }

        private static Path envPath(Function<String, String> env, String key, Path fallback) {
            String value = env.apply(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(Function<String, String> env, String key, String fallback) {
            String value = env.apply(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(Function<String, String> env, String key, int fallback) {
            String value = env.apply(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static long envLong(Function<String, String> env, String key, long fallback, boolean atLeastOne) {
            String value = env.apply(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return atLeastOne ? parseAtLeastOne(value, key) : parsePositiveLong(value, key);
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

        private static long parsePositiveLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed < 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }

        private static long parseDifficulty(String value, String flag) {
            long parsed = parsePositiveLong(value, flag);
            if (parsed > ProtocolLimits.MAX_DIFFICULTY_BITS) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value
                        + " (max " + ProtocolLimits.MAX_DIFFICULTY_BITS + ")");
            }
            return parsed;
        }

        private static long parseAtLeastOne(String value, String flag) {
            long parsed = parsePositiveLong(value, flag);
            if (parsed < 1 || parsed > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
            return parsed;
        }
    }
}
