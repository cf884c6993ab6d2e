package org.nevr.vault.core.enums;

/**
 * Where a vault key can come from, in discovery priority order
 */
public enum KeySourceType {
    EXPLICIT,
    LOCAL_FILE,
    SHARED_FILE,
    ENVIRONMENT
}
