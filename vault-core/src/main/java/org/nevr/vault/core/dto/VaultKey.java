package org.nevr.vault.core.dto;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A vault key token: fixed prefix followed by 43 URL-safe base64 characters (32 bytes).
 * {@link #toString()} never prints the secret part.
 */
@Getter
@EqualsAndHashCode
public final class VaultKey {

    public static final String PREFIX = "nevr_";

    private final String token;

    public VaultKey(String token) {
        this.token = token;
    }

    public String redacted() {
        return token.substring(0, Math.min(PREFIX.length() + 4, token.length())) + "...";
    }

    @Override
    public String toString() {
        return "VaultKey[" + redacted() + "]";
    }
}
