package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;

/**
 * The persisted vault structure. Holds only ciphertext and the public parameters needed to
 * re-derive keys; the key itself is never part of it.
 */
@Value
@Builder(toBuilder = true)
public class VaultEnvelope {

    public static final int CURRENT_VERSION = 1;
    public static final int SALT_LENGTH = 32;
    public static final int IV_LENGTH = 16;
    public static final int AUTH_TAG_LENGTH = 16;
    public static final int HMAC_LENGTH = 32;

    int version;
    byte[] salt;
    byte[] iv;
    byte[] authTag;
    byte[] encrypted;
    byte[] hmac;
    VaultMetadata metadata;
}
