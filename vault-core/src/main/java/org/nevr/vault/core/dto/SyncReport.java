package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Variable names touched by a sync. Values are never reported.
 */
@Value
@Builder
public class SyncReport {
    List<String> added;
    List<String> updated;
    List<String> fromVault;
    int variables;
    AuditLogEntry auditEntry;
}
