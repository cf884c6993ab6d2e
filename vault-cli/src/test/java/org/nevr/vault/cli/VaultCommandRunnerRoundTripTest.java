package org.nevr.vault.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nevr.vault.cli.config.VaultCoreConfig;
import org.nevr.vault.cli.config.VaultProperties;
import org.nevr.vault.core.service.AuditLedgerService;
import org.nevr.vault.core.service.VaultService;
import org.nevr.vault.core.util.EnvCodec;
import reactor.core.scheduler.Scheduler;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the real core through the command runner, wired the same way the application context does
 */
class VaultCommandRunnerRoundTripTest {

    @TempDir
    Path cwd;

    private Scheduler cryptoScheduler;
    private VaultCommandRunner runner;
    private ByteArrayOutputStream out;

    @BeforeEach
    void setUp() {
        VaultProperties properties = new VaultProperties();
        properties.setIterations(1_000);
        properties.setActor("alice");

        VaultCoreConfig config = new VaultCoreConfig();
        ObjectMapper mapper = config.vaultObjectMapper();
        cryptoScheduler = config.vaultCryptoScheduler(properties);
        AuditLedgerService auditLedger = config.auditLedgerService(mapper);
        VaultService vaultService = config.vaultService(
                config.vaultOrchestrator(config.keyManager(), config.cryptoEngine(properties, cryptoScheduler),
                        config.vaultEnvelopeCodec(mapper), auditLedger, config.vaultWriteQueue()),
                auditLedger);
        runner = new VaultCommandRunner(vaultService, properties, mapper);
    }

    @AfterEach
    void tearDown() {
        cryptoScheduler.dispose();
    }

    @Test
    void testKeygenPushPull_RestoresVariablesAndAudits() throws Exception {
        // Given
        Path env = cwd.resolve(".env");
        Files.writeString(env, "API_URL=https://api.example.com\nTOKEN=\"s3cr3t value\"\n");

        // When
        assertEquals(VaultCommandRunner.EXIT_OK, run("--operation", "keygen"));
        String token = EnvCodec.parse(Files.readString(env)).get("NEVR_ENV_KEY");
        assertNotNull(token);
        assertEquals(VaultCommandRunner.EXIT_OK, run("--operation", "push"));
        Files.delete(env);
        assertEquals(VaultCommandRunner.EXIT_OK, run("--operation", "pull", "--key", token));

        // Then
        Map<String, String> restored = EnvCodec.parse(Files.readString(env));
        assertEquals("https://api.example.com", restored.get("API_URL"));
        assertEquals("s3cr3t value", restored.get("TOKEN"));
        assertEquals(token, restored.get("NEVR_ENV_KEY"));
        assertTrue(Files.exists(cwd.resolve(".nevr-env.vault")));
        assertFalse(Files.readString(cwd.resolve(".nevr-env.vault")).contains("s3cr3t"));

        out.reset();
        assertEquals(VaultCommandRunner.EXIT_OK, run("--operation", "audit-verify"));
        assertTrue(stdout().contains("3 entries verified"));
    }

    @Test
    void testPull_WrongKeyFails() throws Exception {
        Files.writeString(cwd.resolve(".env"), "A=1\n");
        assertEquals(VaultCommandRunner.EXIT_OK, run("--operation", "keygen"));
        assertEquals(VaultCommandRunner.EXIT_OK, run("--operation", "push"));

        String otherKey = "nevr_" + "A".repeat(43);
        int code = run("--operation", "pull", "--key", otherKey, "--env", ".env.restored");

        assertEquals(VaultCommandRunner.EXIT_FAILED, code);
        assertFalse(Files.exists(cwd.resolve(".env.restored")));
    }

    @Test
    void testStatus_WorksWithoutKey() {
        int code = run("--operation", "status");

        assertEquals(VaultCommandRunner.EXIT_OK, code);
        assertTrue(stdout().contains("Key:   not found"));
        assertTrue(stdout().contains("(missing)"));
    }

    private int run(String... args) {
        String[] withDir = new String[args.length + 2];
        System.arraycopy(args, 0, withDir, 0, args.length);
        withDir[args.length] = "--dir";
        withDir[args.length + 1] = cwd.toString();
        if (out == null) {
            out = new ByteArrayOutputStream();
        }
        return runner.execute(withDir, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8), Map.of());
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }
}
