package org.nevr.vault.core.service;

import org.nevr.vault.core.dto.DiscoveredKey;
import org.nevr.vault.core.dto.KeySourceReport;
import org.nevr.vault.core.dto.KeySources;
import org.nevr.vault.core.dto.VaultKey;
import org.nevr.vault.core.result.VaultResult;

import java.nio.file.Path;

/**
 * Generates, validates and discovers the shared key protecting a vault
 */
public interface KeyManager {

    /**
     * @return a fresh key from 32 secure random bytes
     */
    VaultKey generateKey();

    /**
     * Format check only: prefix, charset and a 32-byte decoded length.
     * Says nothing about whether the key opens any vault.
     */
    boolean validateKey(String candidate);

    /**
     * Look for the key-carrier variable in: explicit override, local-only file, shared file,
     * ambient environment. The first valid candidate wins; invalid ones are skipped.
     *
     * @return the key and where it came from, or KEY_NOT_FOUND naming every source checked
     */
    VaultResult<DiscoveredKey> discoverKey(KeySources sources, Path cwd);

    /**
     * Same search as {@link #discoverKey} but only reports where a candidate was seen
     */
    KeySourceReport describeSources(KeySources sources, Path cwd);

    default boolean hasVaultAccess(KeySources sources, Path cwd) {
        return discoverKey(sources, cwd).isOk();
    }
}
