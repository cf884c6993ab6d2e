package org.nevr.vault.core.exception;

import org.nevr.vault.core.result.VaultErrorKind;

/**
 * Exception thrown when a vault file is not a well-formed version 1 envelope
 */
public class VaultFormatException extends VaultException {

    public VaultFormatException(String message) {
        super(VaultErrorKind.FORMAT, message);
    }

    public VaultFormatException(String message, Throwable cause) {
        super(VaultErrorKind.FORMAT, message, cause);
    }
}
