package org.nevr.vault.core.exception;

import org.nevr.vault.core.result.VaultErrorKind;

/**
 * Keyed integrity tag mismatch. Same message as {@link VaultDecryptionException}.
 */
public class VaultIntegrityException extends VaultException {

    public static final String GENERIC_MESSAGE = "Wrong key or tampered vault file.";

    public VaultIntegrityException() {
        super(VaultErrorKind.INTEGRITY, GENERIC_MESSAGE);
    }
}
