package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

@Value
@Builder
public class PullReport {
    Path envPath;
    int variables;
    /**
     * True when the destination's own key-carrier line was kept as is
     */
    boolean keyPreserved;
    Instant updatedAt;
    AuditLogEntry auditEntry;
}
