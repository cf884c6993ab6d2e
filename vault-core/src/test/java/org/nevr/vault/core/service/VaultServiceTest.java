package org.nevr.vault.core.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nevr.vault.core.dto.AuditLogEntry;
import org.nevr.vault.core.dto.KeySources;
import org.nevr.vault.core.dto.PushReport;
import org.nevr.vault.core.dto.VaultOptions;
import org.nevr.vault.core.enums.AuditExportFormat;
import org.nevr.vault.core.enums.AuditOperation;
import org.nevr.vault.core.result.VaultErrorKind;
import org.nevr.vault.core.result.VaultResult;
import org.nevr.vault.core.service.impl.AuditLedgerServiceImpl;
import org.nevr.vault.core.util.JsonMappers;
import reactor.core.publisher.Mono;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VaultServiceTest {

    @Mock
    private VaultOrchestrator orchestrator;

    @TempDir
    Path cwd;

    private final AuditLedgerService auditLedger = new AuditLedgerServiceImpl(JsonMappers.vaultObjectMapper());
    private final VaultOptions options = VaultOptions.builder().actor("ops").build();
    private VaultService vaultService;
    private Path ledger;

    @BeforeEach
    void setUp() {
        vaultService = new VaultService(orchestrator, auditLedger);
        ledger = cwd.resolve(options.auditFile());
    }

    @Test
    void testPush_DelegatesAndBlocksForResult() {
        // Given
        KeySources sources = KeySources.defaults();
        PushReport report = PushReport.builder().variables(3).build();
        when(orchestrator.push(cwd, sources, options)).thenReturn(Mono.just(VaultResult.ok(report)));

        // When
        VaultResult<PushReport> result = vaultService.push(cwd, sources, options);

        // Then
        assertSame(report, result.orElseThrow());
        verify(orchestrator).push(cwd, sources, options);
    }

    @Test
    void testPush_EmptyMonoIsAnError() {
        KeySources sources = KeySources.defaults();
        when(orchestrator.push(cwd, sources, options)).thenReturn(Mono.empty());

        assertThrows(IllegalStateException.class, () -> vaultService.push(cwd, sources, options));
    }

    @Test
    void testVerifyAudit_CoversArchivesAndActiveChain() throws Exception {
        // Given
        appendEntries(3);
        Thread.sleep(5);
        vaultService.rotateAudit(cwd, options, Instant.now()).orElseThrow();
        appendEntries(2);
        Thread.sleep(5);
        vaultService.rotateAudit(cwd, options, Instant.now()).orElseThrow();
        appendEntries(1);

        // When
        VaultResult<Integer> result = vaultService.verifyAudit(cwd, options);

        // Then
        assertEquals(2, vaultService.archivesOf(ledger).size());
        assertEquals(8, result.orElseThrow());
    }

    @Test
    void testVerifyAudit_DetectsEditedArchive() throws Exception {
        // Given
        appendEntries(3);
        Thread.sleep(5);
        Path archive = vaultService.rotateAudit(cwd, options, Instant.now()).orElseThrow().getArchivePath();
        assertTrue(archive.toFile().setWritable(true));
        List<String> lines = new ArrayList<>(Files.readAllLines(archive));
        lines.set(1, lines.get(1).replace("\"ops\"", "\"intruder\"").replace("\"PUSH\"", "\"PULL\""));
        Files.write(archive, lines);

        // When
        VaultResult<Integer> result = vaultService.verifyAudit(cwd, options);

        // Then
        VaultResult.Err<?> err = assertInstanceOf(VaultResult.Err.class, result);
        assertEquals(VaultErrorKind.AUDIT_CHAIN_BROKEN, err.error().getKind());
        assertEquals(2L, err.error().getSequence());
    }

    @Test
    void testVerifyAudit_DetectsOldestEntriesRemovedFromLedger() throws Exception {
        // Given
        appendEntries(4);
        List<String> lines = Files.readAllLines(ledger);
        Files.write(ledger, lines.subList(2, 4));

        // When
        VaultResult<Integer> result = vaultService.verifyAudit(cwd, options);

        // Then
        VaultResult.Err<?> err = assertInstanceOf(VaultResult.Err.class, result);
        assertEquals(VaultErrorKind.AUDIT_CHAIN_BROKEN, err.error().getKind());
        assertEquals(3L, err.error().getSequence());
    }

    @Test
    void testVerifyAudit_DetectsDeletedOldestArchive() throws Exception {
        // Given
        appendEntries(3);
        Thread.sleep(5);
        Path oldest = vaultService.rotateAudit(cwd, options, Instant.now()).orElseThrow().getArchivePath();
        appendEntries(2);
        Thread.sleep(5);
        vaultService.rotateAudit(cwd, options, Instant.now()).orElseThrow();
        Files.delete(oldest);

        // When
        VaultResult<Integer> result = vaultService.verifyAudit(cwd, options);

        // Then
        assertEquals(1, vaultService.archivesOf(ledger).size());
        VaultResult.Err<?> err = assertInstanceOf(VaultResult.Err.class, result);
        assertEquals(VaultErrorKind.AUDIT_CHAIN_BROKEN, err.error().getKind());
        assertEquals(4L, err.error().getSequence());
    }

    @Test
    void testVerifyAudit_NoLedgerVerifiesNothing() {
        assertEquals(0, vaultService.verifyAudit(cwd, options).orElseThrow());
    }

    @Test
    void testExportAudit_UsesLedgerNextToVault() {
        appendEntries(2);

        String csv = vaultService.exportAudit(cwd, options, AuditExportFormat.CSV).orElseThrow();

        assertEquals(3, csv.split("\n").length);
    }

    private void appendEntries(int count) {
        for (int i = 0; i < count; i++) {
            AuditLogEntry entry = auditLedger.append(ledger, AuditOperation.PUSH, "ops", "00").orElseThrow();
            assertNotNull(entry.getHash());
        }
    }
}
