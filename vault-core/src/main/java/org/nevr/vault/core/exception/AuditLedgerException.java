package org.nevr.vault.core.exception;

import org.nevr.vault.core.result.VaultErrorKind;

/**
 * Reading or appending the audit ledger failed
 */
public class AuditLedgerException extends VaultException {

    public AuditLedgerException(String message, Throwable cause) {
        super(VaultErrorKind.AUDIT, message, cause);
    }
}
