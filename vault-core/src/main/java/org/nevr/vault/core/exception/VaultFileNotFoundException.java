package org.nevr.vault.core.exception;

import org.nevr.vault.core.result.VaultErrorKind;

import java.nio.file.Path;

/**
 * Exception thrown when the vault file or a plaintext source does not exist
 */
public class VaultFileNotFoundException extends VaultException {

    public VaultFileNotFoundException(Path path, String hint) {
        super(VaultErrorKind.FILE_NOT_FOUND, String.format("File not found: %s. %s", path, hint));
    }

    public VaultFileNotFoundException(String message) {
        super(VaultErrorKind.FILE_NOT_FOUND, message);
    }
}
