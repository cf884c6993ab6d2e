package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Tunables of the key derivation. Every party opening a vault must use the same iteration
 * count, because it is not stored in the envelope.
 */
@Value
@Builder
public class CryptoSettings {

    public static final int DEFAULT_ITERATIONS = 600_000;

    @Builder.Default
    int iterations = DEFAULT_ITERATIONS;

    public static CryptoSettings defaults() {
        return CryptoSettings.builder().build();
    }
}
