package org.nevr.vault.core.result;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Error half of a {@link VaultResult}.
 * {@code sequence} is only set for {@link VaultErrorKind#AUDIT_CHAIN_BROKEN}.
 */
@Value
@AllArgsConstructor
public class VaultError {

    VaultErrorKind kind;
    String message;
    Long sequence;

    public VaultError(VaultErrorKind kind, String message) {
        this(kind, message, null);
    }

    public static VaultError chainBrokenAt(long sequence, String message) {
        return new VaultError(VaultErrorKind.AUDIT_CHAIN_BROKEN, message, sequence);
    }
}
