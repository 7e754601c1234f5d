package io.forkrecovery.core;

import io.forkrecovery.core.node.RecoveryConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    @Test
    void parsesDefaults() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {});
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertEquals(Path.of("./data/chain").normalize(), options.dataDir().normalize());
        assertTrue(options.p2pPeers().isEmpty());
        assertNull(options.nodeId());
        assertEquals(RecoveryConfig.defaultLocal().maxFetchAttempts, options.maxFetchAttempts());
    }

    @Test
    void parsesRecoveryTuningAndPeers() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--in-memory",
                "--p2p-port=9100",
                "--p2p-peer=peer1:9000",
                "--p2p-peer=peer2:9001",
                "--node-id=my-node",
                "--max-fetch-attempts=5",
                "--retry-backoff-ms=10",
                "--peer-timeout-ms=1500",
                "--session-timeout-ms=60000",
                "--difficulty=6"
        });
        assertFalse(options.showHelp());
        assertTrue(options.inMemory());
        assertEquals(9100, options.p2pPort());
        assertEquals("my-node", options.nodeId());
        assertEquals(2, options.p2pPeers().size());
        assertTrue(options.p2pPeers().contains("peer2:9001"));

        RecoveryConfig config = options.toConfig();
        assertEquals(5, config.maxFetchAttempts);
        assertEquals(10L, config.retryBackoffMillis);
        assertEquals(1_500L, config.peerRequestTimeoutMillis);
        assertEquals(60_000L, config.sessionTimeoutMillis);
        assertEquals(6L, config.difficultyBits);
    }

    @Test
    void invalidPortSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--p2p-port=70000"});
        assertTrue(options.showHelp());
        assertEquals("Invalid port for --p2p-port: 70000", options.errorMessage());
    }

    @Test
    void zeroFetchAttemptsIsRejected() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--max-fetch-attempts=0"});
        assertTrue(options.showHelp());
        assertNotNull(options.errorMessage());
    }

    @Test
    void envFetchAttemptsOutOfRangeShowsHelp() {
        Main.CliOptions zero = Main.CliOptions.parse(new String[] {},
                Map.of("FORK_RECOVERY_MAX_FETCH_ATTEMPTS", "0")::get);
        assertTrue(zero.showHelp());
        assertEquals("Invalid value for FORK_RECOVERY_MAX_FETCH_ATTEMPTS: 0", zero.errorMessage());

        Main.CliOptions huge = Main.CliOptions.parse(new String[] {},
                Map.of("FORK_RECOVERY_MAX_FETCH_ATTEMPTS", "4294967297")::get);
        assertTrue(huge.showHelp());
        assertNotNull(huge.errorMessage());
    }

    @Test
    void envZeroPeerTimeoutShowsHelp() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {},
                Map.of("FORK_RECOVERY_PEER_TIMEOUT_MS", "0")::get);
        assertTrue(options.showHelp());
        assertEquals("Invalid value for FORK_RECOVERY_PEER_TIMEOUT_MS: 0", options.errorMessage());
    }

    @Test
    void envOverridesApplyToConfig() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {}, Map.of(
                "FORK_RECOVERY_MAX_FETCH_ATTEMPTS", "7",
                "FORK_RECOVERY_SESSION_TIMEOUT_MS", "0",
                "FORK_RECOVERY_P2P_PEERS", "a:1, b:2")::get);
        assertFalse(options.showHelp());
        assertEquals(7, options.toConfig().maxFetchAttempts);
        assertEquals(0L, options.toConfig().sessionTimeoutMillis);
        assertEquals(List.of("a:1", "b:2"), options.p2pPeers());
    }

    @Test
    void difficultyAboveHashWidthIsRejected() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--difficulty=257"});
        assertTrue(options.showHelp());
        assertEquals("Invalid value for --difficulty: 257 (max 256)", options.errorMessage());
        assertEquals(256L, Main.CliOptions.parse(new String[] {"--difficulty=256"}).difficultyBits());
    }

    @Test
    void unknownOptionShowsHelp() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--mine"});
        assertTrue(options.showHelp());
        assertEquals("Unknown option: --mine", options.errorMessage());
    }

    @Test
    void positionalArgumentIsDataDir() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"/tmp/chain-b"});
        assertEquals(Path.of("/tmp/chain-b"), options.dataDir());
    }
}
