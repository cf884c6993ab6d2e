package org.nevr.vault.core.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.nevr.vault.core.dto.AuditLogEntry;
import org.nevr.vault.core.dto.AuditQuery;
import org.nevr.vault.core.dto.DiffReport;
import org.nevr.vault.core.dto.KeySourceReport;
import org.nevr.vault.core.dto.KeySources;
import org.nevr.vault.core.dto.KeygenReport;
import org.nevr.vault.core.dto.PullReport;
import org.nevr.vault.core.dto.PushReport;
import org.nevr.vault.core.dto.StatusReport;
import org.nevr.vault.core.dto.SyncReport;
import org.nevr.vault.core.dto.VaultEnvelope;
import org.nevr.vault.core.dto.VaultKey;
import org.nevr.vault.core.dto.VaultMetadata;
import org.nevr.vault.core.dto.VaultOptions;
import org.nevr.vault.core.enums.AuditOperation;
import org.nevr.vault.core.exception.VaultException;
import org.nevr.vault.core.exception.VaultFileNotFoundException;
import org.nevr.vault.core.result.VaultErrorKind;
import org.nevr.vault.core.result.VaultResult;
import org.nevr.vault.core.service.AuditLedgerService;
import org.nevr.vault.core.service.CryptoEngine;
import org.nevr.vault.core.service.KeyManager;
import org.nevr.vault.core.service.VaultEnvelopeCodec;
import org.nevr.vault.core.service.VaultOrchestrator;
import org.nevr.vault.core.util.AtomicFiles;
import org.nevr.vault.core.util.EnvCodec;
import org.nevr.vault.core.util.GitignoreHelper;
import org.nevr.vault.core.util.VaultWriteQueue;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link VaultOrchestrator}.
 *
 * File reads and writes run on an I/O scheduler, crypto on the engine's own scheduler. Every
 * file is written only after the crypto it depends on has completed, and the audit entry only
 * after the files, so a cancelled or timed out call commits nothing.
 */
@Slf4j
public class VaultOrchestratorImpl implements VaultOrchestrator {

    private final KeyManager keyManager;
    private final CryptoEngine cryptoEngine;
    private final VaultEnvelopeCodec envelopeCodec;
    private final AuditLedgerService auditLedger;
    private final VaultWriteQueue writeQueue;
    private final Scheduler ioScheduler;

    public VaultOrchestratorImpl(KeyManager keyManager,
                                 CryptoEngine cryptoEngine,
                                 VaultEnvelopeCodec envelopeCodec,
                                 AuditLedgerService auditLedger,
                                 VaultWriteQueue writeQueue) {
        this(keyManager, cryptoEngine, envelopeCodec, auditLedger, writeQueue, Schedulers.boundedElastic());
    }

    public VaultOrchestratorImpl(KeyManager keyManager,
                                 CryptoEngine cryptoEngine,
                                 VaultEnvelopeCodec envelopeCodec,
                                 AuditLedgerService auditLedger,
                                 VaultWriteQueue writeQueue,
                                 Scheduler ioScheduler) {
        this.keyManager = keyManager;
        this.cryptoEngine = cryptoEngine;
        this.envelopeCodec = envelopeCodec;
        this.auditLedger = auditLedger;
        this.writeQueue = writeQueue;
        this.ioScheduler = ioScheduler;
    }

    @Override
    public Mono<VaultResult<PushReport>> push(Path cwd, KeySources sources, VaultOptions options) {
        Path vaultPath = cwd.resolve(options.getVaultFile());

        Mono<PushReport> work = io(() -> keyManager.discoverKey(sources, cwd).orElseThrow())
                .flatMap(key -> writeQueue.submit(vaultPath, () ->
                        io(() -> preparePush(cwd, sources, options, vaultPath))
                                .flatMap(plan -> withTimeout(cryptoEngine.encrypt(plan.payload(),
                                                key.getKey().getToken(), plan.existingMetadata()), options)
                                        .flatMap(envelope -> io(() -> commitPush(cwd, options, vaultPath, plan, envelope))))));

        return toResult("push", work);
    }

    @Override
    public Mono<VaultResult<PullReport>> pull(Path cwd, KeySources sources, VaultOptions options) {
        Path vaultPath = cwd.resolve(options.getVaultFile());

        Mono<PullReport> work = writeQueue.submit(vaultPath, () ->
                io(() -> loadVault(vaultPath))
                        .flatMap(loaded -> io(() -> keyManager.discoverKey(sources, cwd).orElseThrow())
                                .flatMap(key -> withTimeout(cryptoEngine.decrypt(loaded.envelope(),
                                        key.getKey().getToken()), options)
                                        .flatMap(plaintext -> io(() ->
                                                commitPull(cwd, sources, options, loaded, key.getKey(), plaintext))))));

        return toResult("pull", work);
    }

    @Override
    public Mono<VaultResult<StatusReport>> status(Path cwd, KeySources sources, VaultOptions options) {
        return toResult("status", io(() -> buildStatus(cwd, sources, options)));
    }

    @Override
    public Mono<VaultResult<KeygenReport>> keygen(Path cwd, KeySources sources, VaultOptions options) {
        return toResult("keygen", io(() -> generateAndSave(cwd, sources, options)));
    }

    @Override
    public Mono<VaultResult<SyncReport>> sync(Path cwd, KeySources sources, VaultOptions options) {
        Path vaultPath = cwd.resolve(options.getVaultFile());

        Mono<SyncReport> work = writeQueue.submit(vaultPath, () ->
                io(() -> prepareSync(cwd, sources, options, vaultPath))
                        .flatMap(plan -> decryptVariables(plan.vault(), plan.key(), sources, options)
                                .flatMap(vaultVars -> {
                                    SyncPlan merged = plan.withVaultVariables(vaultVars);
                                    return withTimeout(cryptoEngine.encrypt(merged.payload(sources.getKeyVariable()),
                                            plan.key().getToken(), merged.existingMetadata(options)), options)
                                            .flatMap(envelope -> io(() ->
                                                    commitSync(cwd, sources, options, vaultPath, merged, envelope)));
                                })));

        return toResult("sync", work);
    }

    @Override
    public Mono<VaultResult<DiffReport>> diff(Path cwd, KeySources sources, VaultOptions options) {
        Path vaultPath = cwd.resolve(options.getVaultFile());
        Path envPath = cwd.resolve(options.getEnvFile());

        Mono<DiffReport> work = io(() -> loadVault(vaultPath))
                .flatMap(loaded -> io(() -> keyManager.discoverKey(sources, cwd).orElseThrow())
                        .flatMap(key -> decryptVariables(loaded, key.getKey(), sources, options))
                        .flatMap(vaultVars -> io(() -> {
                            Map<String, String> local = EnvCodec.without(
                                    EnvCodec.parse(AtomicFiles.readIfExists(envPath)), sources.getKeyVariable());
                            return compare(vaultVars, local);
                        })));

        return toResult("diff", work);
    }

    @Override
    public Mono<VaultResult<List<String>>> ensureGitignore(Path root, String envFile) {
        return toResult("ensureGitignore", io(() -> GitignoreHelper.ensureIgnored(root, envFile)));
    }

    // push

    private PushPlan preparePush(Path cwd, KeySources sources, VaultOptions options, Path vaultPath) throws IOException {
        Map<String, String> merged = new LinkedHashMap<>();
        boolean anySource = false;
        for (String file : options.effectiveSourceFiles()) {
            String content = AtomicFiles.readIfExists(cwd.resolve(file));
            if (content == null) {
                log.debug("Push source {} not found, skipping", file);
                continue;
            }
            anySource = true;
            merged = EnvCodec.merge(merged, EnvCodec.parse(content));
        }
        if (!anySource) {
            throw new VaultFileNotFoundException(cwd.resolve(options.effectiveSourceFiles().get(0)),
                    "Nothing to push.");
        }

        String keyVariable = sources.getKeyVariable();
        Map<String, String> protectedVars = EnvCodec.without(merged, keyVariable);

        VaultMetadata existing = existingMetadata(vaultPath);
        if (existing == null) {
            existing = VaultMetadata.builder().createdBy(options.getActor()).build();
        } else if (existing.getCreatedBy() == null) {
            existing = existing.toBuilder().createdBy(options.getActor()).build();
        }

        return new PushPlan(EnvCodec.stringify(protectedVars).getBytes(StandardCharsets.UTF_8), existing,
                protectedVars.size(), merged.containsKey(keyVariable));
    }

    private PushReport commitPush(Path cwd, VaultOptions options, Path vaultPath, PushPlan plan,
                                  VaultEnvelope envelope) throws IOException {
        String serialized = envelopeCodec.serialize(envelope);
        AtomicFiles.write(vaultPath, serialized, false);
        log.info("Vault written to {} ({} variables)", vaultPath, plan.variables());

        List<String> gitignoreAdded = options.isAutoGitignore()
                ? ignoreEnvFiles(cwd, options.getEnvFile())
                : List.of();

        return PushReport.builder()
                .vaultPath(vaultPath)
                .variables(plan.variables())
                .keyVariableExcluded(plan.keyVariableExcluded())
                .gitignoreAdded(gitignoreAdded)
                .auditEntry(audit(cwd, options, AuditOperation.PUSH, serialized))
                .build();
    }

    /**
     * Metadata of the current vault, or null when there is none or it does not parse
     */
    private VaultMetadata existingMetadata(Path vaultPath) throws IOException {
        String serialized = AtomicFiles.readIfExists(vaultPath);
        if (serialized == null) {
            return null;
        }
        VaultResult<VaultEnvelope> parsed = envelopeCodec.deserialize(serialized);
        if (parsed instanceof VaultResult.Err<VaultEnvelope> err) {
            log.warn("Existing vault {} is unreadable and will be replaced: {}", vaultPath, err.error().getMessage());
            return null;
        }
        return parsed.orElseThrow().getMetadata();
    }

    // pull

    private PullReport commitPull(Path cwd, KeySources sources, VaultOptions options, LoadedVault loaded,
                                  VaultKey key, byte[] plaintext) throws IOException {
        String keyVariable = sources.getKeyVariable();
        Map<String, String> vaultVars = EnvCodec.without(
                EnvCodec.parse(new String(plaintext, StandardCharsets.UTF_8)), keyVariable);
        Arrays.fill(plaintext, (byte) 0);

        Path envPath = cwd.resolve(options.getEnvFile());
        Map<String, String> existing = EnvCodec.parse(AtomicFiles.readIfExists(envPath));
        boolean keyPreserved = existing.containsKey(keyVariable);

        Map<String, String> result = EnvCodec.merge(existing, vaultVars);
        if (!keyPreserved && options.isPersistKeyOnPull()) {
            result.put(keyVariable, key.getToken());
        }
        AtomicFiles.write(envPath, EnvCodec.stringify(result), true);
        log.info("Pulled {} variables into {}", vaultVars.size(), envPath);

        return PullReport.builder()
                .envPath(envPath)
                .variables(vaultVars.size())
                .keyPreserved(keyPreserved)
                .updatedAt(loaded.envelope().getMetadata().getUpdatedAt())
                .auditEntry(audit(cwd, options, AuditOperation.PULL, loaded.serialized()))
                .build();
    }

    // status

    private StatusReport buildStatus(Path cwd, KeySources sources, VaultOptions options) throws IOException {
        KeySourceReport keySource = keyManager.describeSources(sources, cwd);
        Path vaultPath = cwd.resolve(options.getVaultFile());
        Path envPath = cwd.resolve(options.getEnvFile());
        Path ledger = cwd.resolve(options.auditFile());

        String serialized = AtomicFiles.readIfExists(vaultPath);
        VaultMetadata metadata = null;
        String formatProblem = null;
        if (serialized != null) {
            VaultResult<VaultEnvelope> parsed = envelopeCodec.deserialize(serialized);
            if (parsed instanceof VaultResult.Err<VaultEnvelope> err) {
                formatProblem = err.error().getMessage();
            } else {
                metadata = parsed.orElseThrow().getMetadata();
            }

            VaultResult<AuditLogEntry> appended = auditLedger.append(ledger, AuditOperation.STATUS,
                    options.getActor(), envelopeCodec.digest(serialized));
            if (appended instanceof VaultResult.Err<AuditLogEntry> err) {
                log.warn("Status check not recorded in {}: {}", ledger, err.error().getMessage());
            }
        }

        List<AuditLogEntry> recent = List.of();
        VaultResult<List<AuditLogEntry>> queried = auditLedger.query(ledger,
                AuditQuery.builder().limit(options.getRecentAuditEntries()).build());
        if (queried instanceof VaultResult.Err<List<AuditLogEntry>> err) {
            log.warn("Could not read recent audit entries from {}: {}", ledger, err.error().getMessage());
        } else {
            recent = queried.orElseThrow();
        }

        return StatusReport.builder()
                .keySource(keySource)
                .vaultPath(vaultPath)
                .vaultExists(serialized != null)
                .metadata(metadata)
                .formatProblem(formatProblem)
                .envPath(envPath)
                .envExists(Files.exists(envPath))
                .recentAudit(recent)
                .build();
    }

    // keygen

    private KeygenReport generateAndSave(Path cwd, KeySources sources, VaultOptions options) throws IOException {
        VaultKey key = keyManager.generateKey();
        Path savedTo = null;
        List<String> gitignoreAdded = List.of();

        if (options.isSaveGeneratedKey()) {
            Path envPath = cwd.resolve(options.getEnvFile());
            String updated = EnvCodec.upsertLine(AtomicFiles.readIfExists(envPath), sources.getKeyVariable(), key.getToken());
            AtomicFiles.write(envPath, updated, true);
            savedTo = envPath;
            log.info("Saved new vault key {} to {}", key.redacted(), envPath);

            if (options.isAutoGitignore()) {
                gitignoreAdded = ignoreEnvFiles(cwd, options.getEnvFile());
            }
        }

        String serialized = AtomicFiles.readIfExists(cwd.resolve(options.getVaultFile()));
        Path ledger = cwd.resolve(options.auditFile());
        VaultResult<AuditLogEntry> appended = auditLedger.append(ledger, AuditOperation.KEYGEN, options.getActor(),
                envelopeCodec.digest(serialized != null ? serialized : ""));

        // the key must reach the caller even when the ledger is broken
        AuditLogEntry auditEntry = null;
        if (appended instanceof VaultResult.Err<AuditLogEntry> err) {
            log.warn("Key generation not recorded in {}: {}", ledger, err.error().getMessage());
        } else {
            auditEntry = appended.orElseThrow();
        }

        return KeygenReport.builder()
                .key(key)
                .savedTo(savedTo)
                .gitignoreAdded(gitignoreAdded)
                .auditEntry(auditEntry)
                .build();
    }

    // sync

    private SyncPlan prepareSync(Path cwd, KeySources sources, VaultOptions options, Path vaultPath) throws IOException {
        VaultKey key = keyManager.discoverKey(sources, cwd).orElseThrow().getKey();
        Path envPath = cwd.resolve(options.getEnvFile());
        String localContent = AtomicFiles.readIfExists(envPath);
        LoadedVault vault = Files.exists(vaultPath) ? loadVault(vaultPath) : null;

        if (vault == null && localContent == null) {
            throw new VaultFileNotFoundException(envPath, "Neither a vault nor a local env file exists.");
        }
        return new SyncPlan(key, vault, EnvCodec.parse(localContent), Map.of(), envPath);
    }

    private SyncReport commitSync(Path cwd, KeySources sources, VaultOptions options, Path vaultPath,
                                  SyncPlan plan, VaultEnvelope envelope) throws IOException {
        String serialized = envelopeCodec.serialize(envelope);
        AtomicFiles.write(vaultPath, serialized, false);

        String keyVariable = sources.getKeyVariable();
        Map<String, String> localResult = new LinkedHashMap<>(plan.local());
        for (String name : plan.fromVault()) {
            localResult.put(name, plan.vaultVariables().get(name));
        }
        if (!localResult.containsKey(keyVariable) && options.isPersistKeyOnPull()) {
            localResult.put(keyVariable, plan.key().getToken());
        }
        AtomicFiles.write(plan.envPath(), EnvCodec.stringify(localResult), true);

        List<String> added = plan.added(keyVariable);
        List<String> updated = plan.updated(keyVariable);
        log.info("Synced {}: {} added to vault, {} updated, {} pulled from vault",
                vaultPath, added.size(), updated.size(), plan.fromVault().size());

        return SyncReport.builder()
                .added(added)
                .updated(updated)
                .fromVault(plan.fromVault())
                .variables(envelope.getMetadata().getVariables())
                .auditEntry(audit(cwd, options, AuditOperation.SYNC, serialized))
                .build();
    }

    // diff

    private static DiffReport compare(Map<String, String> vaultVars, Map<String, String> local) {
        List<String> onlyInVault = new ArrayList<>();
        List<String> inBoth = new ArrayList<>();
        List<String> different = new ArrayList<>();
        for (Map.Entry<String, String> entry : vaultVars.entrySet()) {
            if (!local.containsKey(entry.getKey())) {
                onlyInVault.add(entry.getKey());
                continue;
            }
            inBoth.add(entry.getKey());
            if (!Objects.equals(entry.getValue(), local.get(entry.getKey()))) {
                different.add(entry.getKey());
            }
        }
        List<String> onlyInLocal = local.keySet().stream()
                .filter(name -> !vaultVars.containsKey(name))
                .toList();

        return DiffReport.builder()
                .onlyInVault(onlyInVault)
                .onlyInLocal(onlyInLocal)
                .inBoth(inBoth)
                .different(different)
                .build();
    }

    // shared

    private LoadedVault loadVault(Path vaultPath) throws IOException {
        String serialized = AtomicFiles.readIfExists(vaultPath);
        if (serialized == null) {
            throw new VaultFileNotFoundException(vaultPath, "Run push first.");
        }
        return new LoadedVault(serialized, envelopeCodec.deserialize(serialized).orElseThrow());
    }

    /**
     * Vault variables without the key carrier; empty when there is no vault yet
     */
    private Mono<Map<String, String>> decryptVariables(LoadedVault vault, VaultKey key, KeySources sources,
                                                       VaultOptions options) {
        if (vault == null) {
            return Mono.just(Map.of());
        }
        return withTimeout(cryptoEngine.decrypt(vault.envelope(), key.getToken()), options)
                .map(plaintext -> {
                    Map<String, String> vars = EnvCodec.without(
                            EnvCodec.parse(new String(plaintext, StandardCharsets.UTF_8)), sources.getKeyVariable());
                    Arrays.fill(plaintext, (byte) 0);
                    return vars;
                });
    }

    private AuditLogEntry audit(Path cwd, VaultOptions options, AuditOperation operation, String serialized) {
        // an AUDIT error surfaces to the caller but the files written before it stay
        return auditLedger.append(cwd.resolve(options.auditFile()), operation, options.getActor(),
                envelopeCodec.digest(serialized)).orElseThrow();
    }

    private List<String> ignoreEnvFiles(Path cwd, String envFile) {
        try {
            List<String> added = GitignoreHelper.ensureIgnored(cwd, envFile);
            if (!added.isEmpty()) {
                log.info("Added {} to {}", added, cwd.resolve(".gitignore"));
            }
            return added;
        } catch (IOException e) {
            log.warn("Could not update .gitignore in {}: {}", cwd, e.getMessage());
            return List.of();
        }
    }

    private <T> Mono<T> withTimeout(Mono<T> crypto, VaultOptions options) {
        return crypto.timeout(options.getCryptoTimeout())
                .onErrorMap(TimeoutException.class, e -> new VaultException(VaultErrorKind.TIMEOUT,
                        "Vault crypto did not finish within " + options.getCryptoTimeout()));
    }

    private <T> Mono<T> io(Callable<T> task) {
        return Mono.fromCallable(task).subscribeOn(ioScheduler);
    }

    private <T> Mono<VaultResult<T>> toResult(String operation, Mono<T> work) {
        return work
                .map(value -> VaultResult.<T>ok(value))
                .onErrorResume(VaultException.class, e -> {
                    log.warn("Vault {} failed with {}: {}", operation, e.getKind(), e.getMessage());
                    return Mono.just(VaultResult.<T>fromException(e));
                })
                .onErrorResume(IOException.class, e -> {
                    log.error("Vault {} failed on file access", operation, e);
                    return Mono.just(VaultResult.<T>err(VaultErrorKind.IO, operation + " failed: " + e.getMessage()));
                })
                .onErrorResume(e -> {
                    log.error("Vault {} failed unexpectedly", operation, e);
                    return Mono.just(VaultResult.<T>err(VaultErrorKind.IO, operation + " failed: " + e.getMessage()));
                });
    }

    private record PushPlan(byte[] payload, VaultMetadata existingMetadata, int variables,
                            boolean keyVariableExcluded) {
    }

    private record LoadedVault(String serialized, VaultEnvelope envelope) {
    }

    /**
     * Local map keeps the key-carrier line; vault variables never contain it
     */
    private record SyncPlan(VaultKey key, LoadedVault vault, Map<String, String> local,
                            Map<String, String> vaultVariables, Path envPath) {

        SyncPlan withVaultVariables(Map<String, String> vaultVariables) {
            return new SyncPlan(key, vault, local, vaultVariables, envPath);
        }

        Map<String, String> localVariables(String keyVariable) {
            return EnvCodec.without(local, keyVariable);
        }

        byte[] payload(String keyVariable) {
            // local wins
            Map<String, String> merged = EnvCodec.merge(vaultVariables, localVariables(keyVariable));
            return EnvCodec.stringify(merged).getBytes(StandardCharsets.UTF_8);
        }

        VaultMetadata existingMetadata(VaultOptions options) {
            if (vault == null) {
                return VaultMetadata.builder().createdBy(options.getActor()).build();
            }
            return vault.envelope().getMetadata();
        }

        List<String> added(String keyVariable) {
            return localVariables(keyVariable).keySet().stream()
                    .filter(name -> !vaultVariables.containsKey(name))
                    .toList();
        }

        List<String> updated(String keyVariable) {
            return localVariables(keyVariable).entrySet().stream()
                    .filter(e -> vaultVariables.containsKey(e.getKey())
                            && !Objects.equals(vaultVariables.get(e.getKey()), e.getValue()))
                    .map(Map.Entry::getKey)
                    .toList();
        }

        List<String> fromVault() {
            return vaultVariables.keySet().stream()
                    .filter(name -> !local.containsKey(name))
                    .toList();
        }
    }
}
