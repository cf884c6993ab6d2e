package org.nevr.vault.core.exception;

import org.nevr.vault.core.result.VaultErrorKind;

/**
 * AEAD tag verification failed after the integrity check passed
 */
public class VaultDecryptionException extends VaultException {

    public VaultDecryptionException(Throwable cause) {
        super(VaultErrorKind.DECRYPTION, VaultIntegrityException.GENERIC_MESSAGE, cause);
    }
}
