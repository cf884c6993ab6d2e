package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Explicit description of every place a vault key may be looked up.
 * Passed into each operation; the core never reads process-wide state on its own.
 */
@Value
@Builder(toBuilder = true)
public class KeySources {

    public static final String DEFAULT_KEY_VARIABLE = "NEVR_ENV_KEY";

    /**
     * Highest priority, e.g. a {@code --key} command line flag
     */
    String explicitKey;

    /**
     * Local-only plaintext file, never shared
     */
    @Builder.Default
    String localFile = ".env.local";

    /**
     * Shared plaintext file
     */
    @Builder.Default
    String sharedFile = ".env";

    /**
     * Snapshot of the ambient environment variables
     */
    @Builder.Default
    Map<String, String> environment = Map.of();

    /**
     * Name of the key-carrier variable
     */
    @Builder.Default
    String keyVariable = DEFAULT_KEY_VARIABLE;

    public static KeySources defaults() {
        return KeySources.builder().build();
    }
}
