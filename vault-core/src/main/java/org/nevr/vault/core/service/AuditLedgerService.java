package org.nevr.vault.core.service;

import org.nevr.vault.core.dto.AuditLogEntry;
import org.nevr.vault.core.dto.AuditQuery;
import org.nevr.vault.core.dto.AuditRotation;
import org.nevr.vault.core.dto.AuditSummary;
import org.nevr.vault.core.enums.AuditExportFormat;
import org.nevr.vault.core.enums.AuditOperation;
import org.nevr.vault.core.result.VaultResult;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Append-only, hash-chained ledger of vault operations stored as NDJSON
 */
public interface AuditLedgerService {

    String GENESIS_HASH = "0".repeat(64);

    VaultResult<AuditLogEntry> append(Path ledger, AuditOperation operation, String actor, String payloadDigest);

    VaultResult<List<AuditLogEntry>> load(Path ledger);

    /**
     * Recompute every hash in order. The chain must start at sequence 1 from the genesis hash;
     * a chain starting later needs the entry it continues from, see {@link #verify(List, AuditLogEntry)}.
     *
     * @return number of entries verified, or AUDIT_CHAIN_BROKEN carrying the first bad sequence
     */
    default VaultResult<Integer> verify(List<AuditLogEntry> entries) {
        return verify(entries, null);
    }

    /**
     * Verify a chain whose first entry continues from {@code anchor}, or from genesis when
     * {@code anchor} is null
     */
    VaultResult<Integer> verify(List<AuditLogEntry> entries, AuditLogEntry anchor);

    /**
     * Verify the archived entries from genesis and the active chain as their continuation
     */
    VaultResult<Integer> verifyAcrossArchive(List<AuditLogEntry> archived, List<AuditLogEntry> active);

    /**
     * Verify a ledger together with the archive files rotated out of it. Besides the chain, every
     * ROTATE entry must name, by digest, one of the given archive files as it was written.
     */
    VaultResult<Integer> verifyLedger(Path ledger, List<Path> archives);

    /**
     * Move entries older than {@code cutoff} to an immutable archive file next to the ledger and
     * append a ROTATE entry referencing the archive's digest to the remaining chain
     */
    VaultResult<AuditRotation> rotate(Path ledger, Instant cutoff, String actor);

    VaultResult<List<AuditLogEntry>> query(Path ledger, AuditQuery query);

    VaultResult<AuditSummary> summarize(Path ledger, Instant from, Instant to);

    VaultResult<String> export(Path ledger, AuditExportFormat format);

    /**
     * Hash for an entry whose other fields are set
     */
    String computeHash(AuditLogEntry entry);
}
