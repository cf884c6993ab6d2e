package org.nevr.vault.cli.config;

import lombok.Data;
import org.nevr.vault.core.dto.CryptoSettings;
import org.nevr.vault.core.dto.KeySources;
import org.nevr.vault.core.dto.VaultOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "nevr.vault")
@Data
public class VaultProperties {

    private String vaultFile = VaultOptions.DEFAULT_VAULT_FILE;
    private String envFile = VaultOptions.DEFAULT_ENV_FILE;
    private String localFile = ".env.local";
    private List<String> sourceFiles = new ArrayList<>();
    private String keyVariable = KeySources.DEFAULT_KEY_VARIABLE;

    // Must match across every machine opening the same vault
    private int iterations = CryptoSettings.DEFAULT_ITERATIONS;
    private Duration cryptoTimeout = Duration.ofMinutes(2);
    private int workerThreads = 2;

    private int recentAuditEntries = 5;
    private boolean autoGitignore = true;
    private boolean persistKeyOnPull = true;
    private String actor; // falls back to the OS user name

    /**
     * Options for one command, before per-invocation overrides such as {@code --env}
     */
    public VaultOptions toOptions() {
        return VaultOptions.builder()
                .vaultFile(vaultFile)
                .envFile(envFile)
                .sourceFiles(List.copyOf(sourceFiles))
                .actor(actor != null ? actor : System.getProperty("user.name"))
                .autoGitignore(autoGitignore)
                .persistKeyOnPull(persistKeyOnPull)
                .recentAuditEntries(recentAuditEntries)
                .cryptoTimeout(cryptoTimeout)
                .build();
    }
}
