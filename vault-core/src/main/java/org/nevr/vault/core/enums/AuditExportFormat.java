package org.nevr.vault.core.enums;

public enum AuditExportFormat {
    JSON,
    CSV,
    PLAINTEXT
}
