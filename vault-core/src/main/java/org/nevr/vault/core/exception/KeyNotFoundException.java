package org.nevr.vault.core.exception;

import org.nevr.vault.core.result.VaultErrorKind;

import java.util.List;

/**
 * Exception thrown when no valid vault key could be discovered
 */
public class KeyNotFoundException extends VaultException {

    public KeyNotFoundException(String variable, List<String> checkedSources) {
        super(VaultErrorKind.KEY_NOT_FOUND, String.format(
                "%s not found or invalid. Checked: %s. Generate one with: nevr-vault --operation keygen",
                variable, String.join(", ", checkedSources)));
    }

    public KeyNotFoundException(String message) {
        super(VaultErrorKind.KEY_NOT_FOUND, message);
    }
}
