package org.nevr.vault.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nevr.vault.cli.config.VaultProperties;
import org.nevr.vault.core.dto.AuditLogEntry;
import org.nevr.vault.core.dto.AuditQuery;
import org.nevr.vault.core.dto.AuditRotation;
import org.nevr.vault.core.dto.DiffReport;
import org.nevr.vault.core.dto.KeySourceReport;
import org.nevr.vault.core.dto.KeySources;
import org.nevr.vault.core.dto.KeygenReport;
import org.nevr.vault.core.dto.PullReport;
import org.nevr.vault.core.dto.PushReport;
import org.nevr.vault.core.dto.StatusReport;
import org.nevr.vault.core.dto.SyncReport;
import org.nevr.vault.core.dto.VaultMetadata;
import org.nevr.vault.core.dto.VaultOptions;
import org.nevr.vault.core.enums.AuditExportFormat;
import org.nevr.vault.core.enums.AuditOperation;
import org.nevr.vault.core.result.VaultError;
import org.nevr.vault.core.result.VaultResult;
import org.nevr.vault.core.service.VaultService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Command line front end for the vault.
 * Usage: nevr-vault --operation push [--dir .] [--key nevr_...] [--env .env] [--vault .nevr-env.vault]
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VaultCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final VaultService vaultService;
    private final VaultProperties properties;
    private final ObjectMapper vaultObjectMapper;

    private int exitCode = EXIT_OK;

    @Override
    public void run(String... args) {
        exitCode = execute(args, System.out, System.err, System.getenv());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Run one command against explicit streams and an environment snapshot
     *
     * @return process exit code
     */
    int execute(String[] args, PrintStream out, PrintStream err, Map<String, String> environment) {
        Map<String, String> options = parseArgs(args);
        String operation = options.get("operation");
        if (operation == null) {
            printUsage(err);
            return EXIT_USAGE;
        }

        Path cwd = Paths.get(options.getOrDefault("dir", ".")).toAbsolutePath().normalize();
        VaultOptions vaultOptions = vaultOptions(options);
        KeySources sources = KeySources.builder()
                .explicitKey(options.get("key"))
                .localFile(properties.getLocalFile())
                .sharedFile(vaultOptions.getEnvFile())
                .environment(Map.copyOf(environment))
                .keyVariable(properties.getKeyVariable())
                .build();
        log.debug("Running {} in {}", operation, cwd);

        try {
            switch (operation) {
                case "push":
                    return report(vaultService.push(cwd, sources, vaultOptions), out, err, this::describePush);
                case "pull":
                    return report(vaultService.pull(cwd, sources, vaultOptions), out, err, this::describePull);
                case "status":
                    return report(vaultService.status(cwd, sources, vaultOptions), out, err, this::describeStatus);
                case "keygen":
                    return report(vaultService.keygen(cwd, sources, vaultOptions), out, err, this::describeKeygen);
                case "sync":
                    return report(vaultService.sync(cwd, sources, vaultOptions), out, err, this::describeSync);
                case "diff":
                    return report(vaultService.diff(cwd, sources, vaultOptions), out, err, this::describeDiff);
                case "audit-verify":
                    return report(vaultService.verifyAudit(cwd, vaultOptions), out, err,
                            count -> "Audit chain intact: " + count + " entries verified");
                case "audit-rotate":
                    Instant cutoff = instantOption(options, "cutoff", Instant.now());
                    return report(vaultService.rotateAudit(cwd, vaultOptions, cutoff), out, err,
                            this::describeRotation);
                case "audit-export":
                    AuditExportFormat format = AuditExportFormat.valueOf(
                            options.getOrDefault("format", "json").toUpperCase(Locale.ROOT));
                    return report(vaultService.exportAudit(cwd, vaultOptions, format), out, err,
                            Function.identity());
                case "audit-query":
                    return report(vaultService.queryAudit(cwd, vaultOptions, auditQuery(options)), out, err,
                            this::toJson);
                case "audit-summary":
                    return report(vaultService.summarizeAudit(cwd, vaultOptions,
                                    instantOption(options, "from", null), instantOption(options, "to", null)),
                            out, err, this::toJson);
                default:
                    err.println("Unknown operation: " + operation);
                    printUsage(err);
                    return EXIT_USAGE;
            }
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (RuntimeException e) {
            log.error("Operation {} failed unexpectedly", operation, e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i += 2) {
            if (i + 1 < args.length && args[i].startsWith("--")) {
                options.put(args[i].substring(2), args[i + 1]);
            }
        }
        return options;
    }

    private VaultOptions vaultOptions(Map<String, String> options) {
        VaultOptions defaults = properties.toOptions();
        boolean noSave = Boolean.parseBoolean(options.getOrDefault("no-save", "false"));
        return defaults.toBuilder()
                .envFile(options.getOrDefault("env", defaults.getEnvFile()))
                .vaultFile(options.getOrDefault("vault", defaults.getVaultFile()))
                .actor(options.getOrDefault("actor", defaults.getActor()))
                .saveGeneratedKey(!noSave)
                .build();
    }

    private AuditQuery auditQuery(Map<String, String> options) {
        Set<AuditOperation> operations = null;
        String names = options.get("operations");
        if (names != null) {
            operations = EnumSet.noneOf(AuditOperation.class);
            for (String name : names.split(",")) {
                operations.add(AuditOperation.valueOf(name.trim().toUpperCase(Locale.ROOT)));
            }
        }
        String limit = options.get("limit");
        return AuditQuery.builder()
                .operations(operations)
                .actor(options.get("by"))
                .from(instantOption(options, "from", null))
                .to(instantOption(options, "to", null))
                .limit(limit != null ? Integer.valueOf(limit) : null)
                .build();
    }

    private static Instant instantOption(Map<String, String> options, String name, Instant fallback) {
        String value = options.get(name);
        if (value == null) {
            return fallback;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("--" + name + " must be an ISO-8601 instant: " + value, e);
        }
    }

    private <T> int report(VaultResult<T> result, PrintStream out, PrintStream err, Function<T, String> describe) {
        if (result instanceof VaultResult.Err<T> failure) {
            VaultError error = failure.error();
            String where = error.getSequence() != null ? " (sequence " + error.getSequence() + ")" : "";
            err.println("Error [" + error.getKind() + "]: " + error.getMessage() + where);
            return EXIT_FAILED;
        }
        out.println(describe.apply(result.orElseThrow()));
        return EXIT_OK;
    }

    private String describePush(PushReport report) {
        StringBuilder text = new StringBuilder("Pushed ").append(report.getVariables())
                .append(" variables to ").append(report.getVaultPath());
        if (report.isKeyVariableExcluded()) {
            text.append(" (").append(properties.getKeyVariable()).append(" left out)");
        }
        appendGitignore(text, report.getGitignoreAdded());
        return text.toString();
    }

    private String describePull(PullReport report) {
        return "Pulled " + report.getVariables() + " variables into " + report.getEnvPath()
                + " (vault updated " + report.getUpdatedAt() + ")";
    }

    private String describeStatus(StatusReport report) {
        StringBuilder text = new StringBuilder();
        KeySourceReport key = report.getKeySource();
        if (key.isFound()) {
            text.append("Key:   ").append(key.isValid() ? "found" : "invalid")
                    .append(" in ").append(key.getSource()).append('\n');
        } else {
            text.append("Key:   not found (checked ").append(String.join(", ", key.getCheckedSources())).append(")\n");
        }

        text.append("Vault: ").append(report.getVaultPath());
        if (!report.isVaultExists()) {
            text.append(" (missing)\n");
        } else if (report.getFormatProblem() != null) {
            text.append(" (unreadable: ").append(report.getFormatProblem()).append(")\n");
        } else {
            VaultMetadata metadata = report.getMetadata();
            text.append('\n')
                    .append("       ").append(metadata.getVariables()).append(" variables, updated ")
                    .append(metadata.getUpdatedAt());
            if (metadata.getCreatedBy() != null) {
                text.append(", created by ").append(metadata.getCreatedBy());
            }
            text.append('\n');
        }

        text.append("Env:   ").append(report.getEnvPath()).append(report.isEnvExists() ? "" : " (missing)");
        List<AuditLogEntry> recent = report.getRecentAudit();
        if (recent != null && !recent.isEmpty()) {
            text.append("\nRecent activity:");
            for (AuditLogEntry entry : recent) {
                text.append("\n  #").append(entry.getSequence()).append(' ').append(entry.getOperation())
                        .append(' ').append(entry.getTimestamp())
                        .append(entry.getActor() != null ? " by " + entry.getActor() : "");
            }
        }
        return text.toString();
    }

    // The generated key is the one value this tool prints in full
    private String describeKeygen(KeygenReport report) {
        StringBuilder text = new StringBuilder("Generated key: ").append(report.getKey().getToken());
        if (report.getSavedTo() != null) {
            text.append("\nSaved to ").append(report.getSavedTo());
        } else {
            text.append("\nNot saved. Share it through a secure channel.");
        }
        appendGitignore(text, report.getGitignoreAdded());
        return text.toString();
    }

    private String describeSync(SyncReport report) {
        return "Synced " + report.getVariables() + " variables"
                + "\n  added to vault:   " + names(report.getAdded())
                + "\n  updated in vault: " + names(report.getUpdated())
                + "\n  pulled from vault: " + names(report.getFromVault());
    }

    private String describeDiff(DiffReport report) {
        return "Only in vault: " + names(report.getOnlyInVault())
                + "\nOnly local:    " + names(report.getOnlyInLocal())
                + "\nDifferent:     " + names(report.getDifferent())
                + "\nIn both:       " + report.getInBoth().size();
    }

    private String describeRotation(AuditRotation rotation) {
        if (rotation.getArchivePath() == null) {
            return "Nothing to rotate";
        }
        return "Archived " + rotation.getArchived().size() + " entries to " + rotation.getArchivePath()
                + "; " + rotation.getActiveChain().size() + " entries remain active";
    }

    private String toJson(Object value) {
        try {
            return vaultObjectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render result as JSON", e);
        }
    }

    private static void appendGitignore(StringBuilder text, List<String> added) {
        if (added != null && !added.isEmpty()) {
            text.append("\nAdded to .gitignore: ").append(String.join(", ", added));
        }
    }

    private static String names(List<String> names) {
        return names == null || names.isEmpty() ? "-" : String.join(", ", names);
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage:");
        err.println("  nevr-vault --operation <keygen|push|pull|status|sync|diff|audit-verify|audit-rotate|"
                + "audit-export|audit-query|audit-summary>");
        err.println("             [--dir <path>] [--key <token>] [--env <file>] [--vault <file>] [--actor <name>]");
        err.println("             [--cutoff <ISO instant>] [--format <json|csv|plaintext>] [--no-save true]");
        err.println("             [--operations PUSH,PULL] [--by <actor>] [--limit <n>]");
        err.println("             [--from <ISO instant>] [--to <ISO instant>]");
    }
}
