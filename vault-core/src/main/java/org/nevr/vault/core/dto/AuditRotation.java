package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of rotating a ledger: what went to the archive and the chain that stays active
 */
@Value
@Builder
public class AuditRotation {
    Path archivePath;
    List<AuditLogEntry> archived;
    List<AuditLogEntry> activeChain;
}
