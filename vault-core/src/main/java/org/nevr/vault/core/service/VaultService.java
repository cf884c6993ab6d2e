package org.nevr.vault.core.service;

import lombok.RequiredArgsConstructor;
import org.nevr.vault.core.dto.AuditLogEntry;
import org.nevr.vault.core.dto.AuditQuery;
import org.nevr.vault.core.dto.AuditRotation;
import org.nevr.vault.core.dto.AuditSummary;
import org.nevr.vault.core.dto.DiffReport;
import org.nevr.vault.core.dto.KeySources;
import org.nevr.vault.core.dto.KeygenReport;
import org.nevr.vault.core.dto.PullReport;
import org.nevr.vault.core.dto.PushReport;
import org.nevr.vault.core.dto.StatusReport;
import org.nevr.vault.core.dto.SyncReport;
import org.nevr.vault.core.dto.VaultOptions;
import org.nevr.vault.core.enums.AuditExportFormat;
import org.nevr.vault.core.exception.AuditLedgerException;
import org.nevr.vault.core.result.VaultResult;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Blocking facade over {@link VaultOrchestrator} and {@link AuditLedgerService} for callers
 * without a reactive pipeline, such as the command line.
 */
@RequiredArgsConstructor
public class VaultService {

    private final VaultOrchestrator orchestrator;
    private final AuditLedgerService auditLedger;

    public VaultResult<PushReport> push(Path cwd, KeySources sources, VaultOptions options) {
        return await(orchestrator.push(cwd, sources, options));
    }

    public VaultResult<PullReport> pull(Path cwd, KeySources sources, VaultOptions options) {
        return await(orchestrator.pull(cwd, sources, options));
    }

    public VaultResult<StatusReport> status(Path cwd, KeySources sources, VaultOptions options) {
        return await(orchestrator.status(cwd, sources, options));
    }

    public VaultResult<KeygenReport> keygen(Path cwd, KeySources sources, VaultOptions options) {
        return await(orchestrator.keygen(cwd, sources, options));
    }

    public VaultResult<SyncReport> sync(Path cwd, KeySources sources, VaultOptions options) {
        return await(orchestrator.sync(cwd, sources, options));
    }

    public VaultResult<DiffReport> diff(Path cwd, KeySources sources, VaultOptions options) {
        return await(orchestrator.diff(cwd, sources, options));
    }

    /**
     * Verify the active ledger together with every archive rotated out of it
     *
     * @return number of entries verified across all files
     */
    public VaultResult<Integer> verifyAudit(Path cwd, VaultOptions options) {
        Path ledger = cwd.resolve(options.auditFile());
        List<Path> archives;
        try {
            archives = archivesOf(ledger);
        } catch (AuditLedgerException e) {
            return VaultResult.fromException(e);
        }

        return auditLedger.verifyLedger(ledger, archives);
    }

    public VaultResult<AuditRotation> rotateAudit(Path cwd, VaultOptions options, Instant cutoff) {
        return auditLedger.rotate(cwd.resolve(options.auditFile()), cutoff, options.getActor());
    }

    public VaultResult<String> exportAudit(Path cwd, VaultOptions options, AuditExportFormat format) {
        return auditLedger.export(cwd.resolve(options.auditFile()), format);
    }

    public VaultResult<List<AuditLogEntry>> queryAudit(Path cwd, VaultOptions options, AuditQuery query) {
        return auditLedger.query(cwd.resolve(options.auditFile()), query);
    }

    public VaultResult<AuditSummary> summarizeAudit(Path cwd, VaultOptions options, Instant from, Instant to) {
        return auditLedger.summarize(cwd.resolve(options.auditFile()), from, to);
    }

    /**
     * Archive files written by rotation: {@code <ledger>.<epochMillis>.archive}
     */
    List<Path> archivesOf(Path ledger) {
        Path dir = ledger.toAbsolutePath().getParent();
        String prefix = ledger.getFileName().toString() + ".";
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(prefix) && name.endsWith(".archive");
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new AuditLedgerException("Failed to list audit archives in " + dir, e);
        }
    }

    private static <T> VaultResult<T> await(Mono<VaultResult<T>> operation) {
        VaultResult<T> result = operation.block();
        if (result == null) {
            throw new IllegalStateException("Vault operation completed without a result");
        }
        return result;
    }
}
