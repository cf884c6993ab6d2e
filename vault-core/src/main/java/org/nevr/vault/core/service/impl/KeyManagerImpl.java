package org.nevr.vault.core.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.nevr.vault.core.dto.DiscoveredKey;
import org.nevr.vault.core.dto.KeySourceReport;
import org.nevr.vault.core.dto.KeySources;
import org.nevr.vault.core.dto.VaultKey;
import org.nevr.vault.core.enums.KeySourceType;
import org.nevr.vault.core.exception.KeyNotFoundException;
import org.nevr.vault.core.result.VaultResult;
import org.nevr.vault.core.service.KeyManager;
import org.nevr.vault.core.util.EnvCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Key generation, format validation and discovery.
 * Token format: {@code nevr_} + 43 URL-safe base64 characters without padding.
 */
@Slf4j
public class KeyManagerImpl implements KeyManager {

    private static final int KEY_BYTES = 32;
    private static final int ENCODED_LENGTH = 43;
    private static final Pattern KEY_BODY = Pattern.compile("[A-Za-z0-9_-]{" + ENCODED_LENGTH + "}");

    private final SecureRandom secureRandom;

    public KeyManagerImpl() {
        this(new SecureRandom());
    }

    public KeyManagerImpl(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    @Override
    public VaultKey generateKey() {
        byte[] raw = new byte[KEY_BYTES];
        secureRandom.nextBytes(raw);
        return new VaultKey(VaultKey.PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(raw));
    }

    @Override
    public boolean validateKey(String candidate) {
        if (candidate == null || !candidate.startsWith(VaultKey.PREFIX)) {
            return false;
        }
        String body = candidate.substring(VaultKey.PREFIX.length());
        if (!KEY_BODY.matcher(body).matches()) {
            return false;
        }
        try {
            return Base64.getUrlDecoder().decode(body).length == KEY_BYTES;
        } catch (IllegalArgumentException e) {
            log.debug("Key body is not valid base64url: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public VaultResult<DiscoveredKey> discoverKey(KeySources sources, Path cwd) {
        List<String> checked = new ArrayList<>();
        for (Candidate candidate : candidates(sources, cwd)) {
            checked.add(candidate.label());
            if (candidate.value() == null) {
                continue;
            }
            if (!validateKey(candidate.value())) {
                log.warn("Ignoring invalid {} in {}", sources.getKeyVariable(), candidate.label());
                continue;
            }
            log.debug("Using vault key from {}", candidate.label());
            return VaultResult.ok(new DiscoveredKey(new VaultKey(candidate.value()), candidate.type(), candidate.label()));
        }
        return VaultResult.fromException(new KeyNotFoundException(sources.getKeyVariable(), checked));
    }

    @Override
    public KeySourceReport describeSources(KeySources sources, Path cwd) {
        List<String> checked = new ArrayList<>();
        Candidate firstInvalid = null;
        for (Candidate candidate : candidates(sources, cwd)) {
            checked.add(candidate.label());
            if (candidate.value() == null) {
                continue;
            }
            if (validateKey(candidate.value())) {
                return report(candidate, true, checked);
            }
            if (firstInvalid == null) {
                firstInvalid = candidate;
            }
        }
        if (firstInvalid != null) {
            return report(firstInvalid, false, checked);
        }
        return KeySourceReport.builder()
                .found(false)
                .valid(false)
                .checkedSources(checked)
                .build();
    }

    private KeySourceReport report(Candidate candidate, boolean valid, List<String> checked) {
        return KeySourceReport.builder()
                .found(true)
                .valid(valid)
                .sourceType(candidate.type())
                .source(candidate.label())
                .checkedSources(List.copyOf(checked))
                .build();
    }

    /**
     * Sources in priority order
     */
    private List<Candidate> candidates(KeySources sources, Path cwd) {
        String variable = sources.getKeyVariable();
        List<Candidate> candidates = new ArrayList<>(4);
        candidates.add(new Candidate(KeySourceType.EXPLICIT, "explicit override", blankToNull(sources.getExplicitKey())));
        if (sources.getLocalFile() != null) {
            candidates.add(new Candidate(KeySourceType.LOCAL_FILE, sources.getLocalFile(),
                    readVariable(cwd.resolve(sources.getLocalFile()), variable)));
        }
        if (sources.getSharedFile() != null) {
            candidates.add(new Candidate(KeySourceType.SHARED_FILE, sources.getSharedFile(),
                    readVariable(cwd.resolve(sources.getSharedFile()), variable)));
        }
        String ambient = sources.getEnvironment() != null ? sources.getEnvironment().get(variable) : null;
        candidates.add(new Candidate(KeySourceType.ENVIRONMENT, "environment variable " + variable, blankToNull(ambient)));
        return candidates;
    }

    private String readVariable(Path file, String variable) {
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return blankToNull(EnvCodec.parse(Files.readString(file, StandardCharsets.UTF_8)).get(variable));
        } catch (IOException e) {
            log.warn("Could not read {} while looking for {}: {}", file, variable, e.getMessage());
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private record Candidate(KeySourceType type, String label, String value) {
    }
}
