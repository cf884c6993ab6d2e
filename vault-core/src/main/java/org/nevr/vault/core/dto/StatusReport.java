package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Vault state gathered without a key; nothing is decrypted
 */
@Value
@Builder
public class StatusReport {
    KeySourceReport keySource;
    Path vaultPath;
    boolean vaultExists;
    VaultMetadata metadata;
    /**
     * Set when the vault file exists but does not parse as an envelope
     */
    String formatProblem;
    Path envPath;
    boolean envExists;
    List<AuditLogEntry> recentAudit;
}
