package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

@Value
@Builder
public class PushReport {
    Path vaultPath;
    int variables;
    boolean keyVariableExcluded;
    List<String> gitignoreAdded;
    AuditLogEntry auditEntry;
}
