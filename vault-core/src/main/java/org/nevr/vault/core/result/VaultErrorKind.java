package org.nevr.vault.core.result;

/**
 * Classification of every failure a vault operation can report
 */
public enum VaultErrorKind {
    KEY_NOT_FOUND,
    FORMAT,
    INTEGRITY,
    DECRYPTION,
    FILE_NOT_FOUND,
    IO,
    AUDIT,
    AUDIT_CHAIN_BROKEN,
    TIMEOUT;

    /**
     * Fatal kinds where the user has to act (supply a key, restore a file) before retrying.
     * Crypto failures are never transient, so no kind is retryable.
     */
    public boolean isRecoverableByCreation() {
        return this == FILE_NOT_FOUND;
    }
}
