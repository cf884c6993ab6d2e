package org.nevr.vault.core.service;

import org.nevr.vault.core.dto.DiffReport;
import org.nevr.vault.core.dto.KeySources;
import org.nevr.vault.core.dto.KeygenReport;
import org.nevr.vault.core.dto.PullReport;
import org.nevr.vault.core.dto.PushReport;
import org.nevr.vault.core.dto.StatusReport;
import org.nevr.vault.core.dto.SyncReport;
import org.nevr.vault.core.dto.VaultOptions;
import org.nevr.vault.core.result.VaultResult;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;

/**
 * User-level vault operations. Each call resolves files against {@code cwd}, takes its key
 * sources explicitly and completes with a {@link VaultResult}; the returned {@link Mono} never
 * signals an error. Cancelling it before the crypto step finishes leaves no file written.
 */
public interface VaultOrchestrator {

    /**
     * Encrypt the merged source files into the vault, replacing it atomically, then audit PUSH.
     * Calls for the same vault path run one at a time in call order.
     */
    Mono<VaultResult<PushReport>> push(Path cwd, KeySources sources, VaultOptions options);

    /**
     * Decrypt the vault and merge its variables into the destination env file, then audit PULL
     */
    Mono<VaultResult<PullReport>> pull(Path cwd, KeySources sources, VaultOptions options);

    /**
     * Report key, vault and env file state without decrypting anything
     */
    Mono<VaultResult<StatusReport>> status(Path cwd, KeySources sources, VaultOptions options);

    Mono<VaultResult<KeygenReport>> keygen(Path cwd, KeySources sources, VaultOptions options);

    /**
     * Two-way merge where local values win; both the vault and the env file are rewritten
     */
    Mono<VaultResult<SyncReport>> sync(Path cwd, KeySources sources, VaultOptions options);

    Mono<VaultResult<DiffReport>> diff(Path cwd, KeySources sources, VaultOptions options);

    /**
     * @return the .gitignore patterns added, empty when nothing was needed
     */
    Mono<VaultResult<List<String>>> ensureGitignore(Path root, String envFile);
}
