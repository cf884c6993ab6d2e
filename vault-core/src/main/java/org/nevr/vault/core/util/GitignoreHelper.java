package org.nevr.vault.core.util;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps plaintext env files out of version control
 */
public final class GitignoreHelper {

    public static final String SECTION_MARKER = "# Environment files (added by nevr-vault)";

    static final List<String> ENV_PATTERNS = List.of(
            ".env",
            ".env.local",
            ".env.*.local",
            ".env.development",
            ".env.production",
            "!.env.example",
            "!.env.template");

    private GitignoreHelper() {
    }

    /**
     * Add the env patterns (and {@code envFile} if it is not covered) under a marker comment.
     * Runs at most once per .gitignore: when the marker is present nothing is added.
     *
     * @return the patterns that were written
     */
    public static List<String> ensureIgnored(Path root, String envFile) throws IOException {
        Path gitignore = root.resolve(".gitignore");
        String existing = AtomicFiles.readIfExists(gitignore);
        if (existing != null && existing.contains(SECTION_MARKER)) {
            return List.of();
        }

        Set<String> present = existing == null ? Set.of() : Arrays.stream(existing.split("\n"))
                .map(String::trim)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .collect(Collectors.toSet());

        Set<String> toAdd = new LinkedHashSet<>();
        for (String pattern : ENV_PATTERNS) {
            if (!present.contains(pattern)) {
                toAdd.add(pattern);
            }
        }
        if (envFile != null) {
            String envBasename = Path.of(envFile).getFileName().toString();
            if (!present.contains(envBasename) && !ENV_PATTERNS.contains(envBasename)) {
                toAdd.add(envBasename);
            }
        }

        // only negations left means every real pattern is already ignored
        if (toAdd.stream().allMatch(pattern -> pattern.startsWith("!"))) {
            return List.of();
        }

        String section = SECTION_MARKER + "\n" + String.join("\n", toAdd) + "\n";
        String updated;
        if (existing == null || existing.isEmpty()) {
            updated = section;
        } else {
            updated = existing + (existing.endsWith("\n") ? "\n" : "\n\n") + section;
        }
        AtomicFiles.write(gitignore, updated, false);
        return new ArrayList<>(toAdd);
    }
}
