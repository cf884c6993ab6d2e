package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * File layout and behaviour switches for one orchestrator call. Paths are relative to the
 * working directory passed alongside.
 */
@Value
@Builder(toBuilder = true)
public class VaultOptions {

    public static final String DEFAULT_VAULT_FILE = ".nevr-env.vault";
    public static final String DEFAULT_ENV_FILE = ".env";

    @Builder.Default
    String vaultFile = DEFAULT_VAULT_FILE;

    /**
     * Plaintext destination for pull/sync and the key file for keygen
     */
    @Builder.Default
    String envFile = DEFAULT_ENV_FILE;

    /**
     * Plaintext files merged (later wins) to form the push payload. Empty means {@link #envFile}.
     */
    @Builder.Default
    List<String> sourceFiles = List.of();

    /**
     * Recorded as {@code createdBy} on a new vault and as the audit actor
     */
    String actor;

    @Builder.Default
    boolean autoGitignore = true;

    /**
     * Write the discovered key into the pulled file when it has no key line yet
     */
    @Builder.Default
    boolean persistKeyOnPull = true;

    @Builder.Default
    boolean saveGeneratedKey = true;

    @Builder.Default
    int recentAuditEntries = 5;

    @Builder.Default
    Duration cryptoTimeout = Duration.ofMinutes(2);

    public List<String> effectiveSourceFiles() {
        return sourceFiles == null || sourceFiles.isEmpty() ? List.of(envFile) : sourceFiles;
    }

    /**
     * Ledger colocated with the vault: {@code .nevr-env.vault} becomes {@code .nevr-env.audit.log}
     */
    public String auditFile() {
        String base = vaultFile.endsWith(".vault")
                ? vaultFile.substring(0, vaultFile.length() - ".vault".length())
                : vaultFile;
        return base + ".audit.log";
    }

    public static VaultOptions defaults() {
        return VaultOptions.builder().build();
    }
}
