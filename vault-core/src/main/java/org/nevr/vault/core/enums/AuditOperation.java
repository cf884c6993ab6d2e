package org.nevr.vault.core.enums;

/**
 * Operations recorded in the audit ledger
 */
public enum AuditOperation {
    PUSH,
    PULL,
    STATUS,
    KEYGEN,
    SYNC,
    ROTATE
}
