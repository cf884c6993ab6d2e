package org.nevr.vault.core.exception;

import lombok.Getter;
import org.nevr.vault.core.result.VaultError;
import org.nevr.vault.core.result.VaultErrorKind;

/**
 * Base exception for vault failures. Travels through Reactor error signals inside the core
 * and is converted to a {@link VaultError} at every public operation boundary.
 */
@Getter
public class VaultException extends RuntimeException {

    private final VaultErrorKind kind;
    private final Long sequence;

    public VaultException(VaultErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public VaultException(VaultErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    protected VaultException(VaultErrorKind kind, String message, Long sequence, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.sequence = sequence;
    }

    public VaultError toError() {
        return new VaultError(kind, getMessage(), sequence);
    }

    public static VaultException of(VaultError error) {
        return switch (error.getKind()) {
            case KEY_NOT_FOUND -> new KeyNotFoundException(error.getMessage());
            case FORMAT -> new VaultFormatException(error.getMessage());
            case INTEGRITY -> new VaultIntegrityException();
            case DECRYPTION -> new VaultDecryptionException(null);
            case FILE_NOT_FOUND -> new VaultFileNotFoundException(error.getMessage());
            default -> new VaultException(error.getKind(), error.getMessage(), error.getSequence(), null);
        };
    }
}
