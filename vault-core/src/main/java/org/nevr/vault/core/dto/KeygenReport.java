package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

@Value
@Builder
public class KeygenReport {
    VaultKey key;
    /**
     * Null when the key was only generated, not saved
     */
    Path savedTo;
    List<String> gitignoreAdded;
    AuditLogEntry auditEntry;
}
