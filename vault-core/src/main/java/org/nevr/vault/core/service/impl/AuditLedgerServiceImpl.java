package org.nevr.vault.core.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.nevr.vault.core.dto.AuditLogEntry;
import org.nevr.vault.core.dto.AuditQuery;
import org.nevr.vault.core.dto.AuditRotation;
import org.nevr.vault.core.dto.AuditSummary;
import org.nevr.vault.core.enums.AuditExportFormat;
import org.nevr.vault.core.enums.AuditOperation;
import org.nevr.vault.core.exception.AuditLedgerException;
import org.nevr.vault.core.result.VaultError;
import org.nevr.vault.core.result.VaultErrorKind;
import org.nevr.vault.core.result.VaultResult;
import org.nevr.vault.core.service.AuditLedgerService;
import org.nevr.vault.core.util.AtomicFiles;
import org.nevr.vault.core.util.Digests;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * NDJSON ledger, one {@link AuditLogEntry} per line.
 * Every change rewrites the whole file through a temp file and an atomic move, so a crash
 * leaves either the old chain or the new one. Appends and rotations on the same file are
 * serialized with a per-file lock.
 */
@Slf4j
public class AuditLedgerServiceImpl implements AuditLedgerService {

    private static final String UNKNOWN_ACTOR = "unknown";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<Path, ReentrantLock> fileLocks = new ConcurrentHashMap<>();

    public AuditLedgerServiceImpl(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    public AuditLedgerServiceImpl(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public VaultResult<AuditLogEntry> append(Path ledger, AuditOperation operation, String actor, String payloadDigest) {
        ReentrantLock lock = lockFor(ledger);
        lock.lock();
        try {
            List<AuditLogEntry> entries = read(ledger);
            AuditLogEntry last = entries.isEmpty() ? null : entries.get(entries.size() - 1);

            AuditLogEntry entry = AuditLogEntry.builder()
                    .sequence(last == null ? 1 : last.getSequence() + 1)
                    .timestamp(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                    .operation(operation)
                    .actor(actor)
                    .payloadDigest(payloadDigest)
                    .prevHash(last == null ? GENESIS_HASH : last.getHash())
                    .build();
            entry.setHash(computeHash(entry));

            entries.add(entry);
            writeAll(ledger, entries);
            log.debug("Audit entry {} {} appended to {}", entry.getSequence(), operation, ledger);
            return VaultResult.ok(entry);
        } catch (AuditLedgerException e) {
            log.error("Failed to append {} to audit ledger {}: {}", operation, ledger, e.getMessage());
            return VaultResult.fromException(e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public VaultResult<List<AuditLogEntry>> load(Path ledger) {
        try {
            return VaultResult.ok(read(ledger));
        } catch (AuditLedgerException e) {
            return VaultResult.fromException(e);
        }
    }

    @Override
    public VaultResult<Integer> verify(List<AuditLogEntry> entries, AuditLogEntry anchor) {
        for (int i = 0; i < entries.size(); i++) {
            AuditLogEntry entry = entries.get(i);
            AuditLogEntry previous = i == 0 ? anchor : entries.get(i - 1);

            if (previous == null) {
                if (entry.getSequence() != 1) {
                    return VaultResult.err(VaultError.chainBrokenAt(entry.getSequence(), String.format(
                            "Chain starts at entry %d; earlier entries or their archive are missing",
                            entry.getSequence())));
                }
                if (!GENESIS_HASH.equals(entry.getPrevHash())) {
                    return VaultResult.err(VaultError.chainBrokenAt(entry.getSequence(),
                            "First entry does not start from the genesis hash"));
                }
            } else {
                if (entry.getSequence() != previous.getSequence() + 1) {
                    return VaultResult.err(VaultError.chainBrokenAt(entry.getSequence(), String.format(
                            "Sequence gap: %d follows %d", entry.getSequence(), previous.getSequence())));
                }
                if (!previous.getHash().equals(entry.getPrevHash())) {
                    return VaultResult.err(VaultError.chainBrokenAt(entry.getSequence(),
                            "Chain broken: previous hash does not match entry " + previous.getSequence()));
                }
            }

            if (!computeHash(entry).equals(entry.getHash())) {
                return VaultResult.err(VaultError.chainBrokenAt(entry.getSequence(),
                        "Hash mismatch at entry " + entry.getSequence()));
            }
        }
        return VaultResult.ok(entries.size());
    }

    @Override
    public VaultResult<Integer> verifyAcrossArchive(List<AuditLogEntry> archived, List<AuditLogEntry> active) {
        AuditLogEntry lastArchived = archived.isEmpty() ? null : archived.get(archived.size() - 1);
        return verify(archived, null)
                .flatMap(archivedCount -> verify(active, lastArchived))
                .map(activeCount -> archived.size() + active.size());
    }

    @Override
    public VaultResult<Integer> verifyLedger(Path ledger, List<Path> archives) {
        try {
            List<AuditLogEntry> archived = new ArrayList<>();
            Set<String> archiveDigests = new HashSet<>();
            for (Path archive : archives) {
                String content = readText(archive);
                archiveDigests.add(Digests.sha256Hex(content));
                archived.addAll(parse(archive, content));
            }
            archived.sort(Comparator.comparingLong(AuditLogEntry::getSequence));
            List<AuditLogEntry> active = read(ledger);

            if (!archived.isEmpty() && active.isEmpty()) {
                long expected = archived.get(archived.size() - 1).getSequence() + 1;
                return VaultResult.err(VaultError.chainBrokenAt(expected,
                        "Audit archives exist but the active ledger " + ledger + " is empty or missing"));
            }

            return verifyAcrossArchive(archived, active)
                    .flatMap(count -> verifyRotations(archived, archiveDigests)
                            .flatMap(ignored -> verifyRotations(active, archiveDigests))
                            .map(ignored -> count));
        } catch (AuditLedgerException e) {
            return VaultResult.fromException(e);
        }
    }

    /**
     * Every ROTATE entry must match the digest of an archive file still present and unmodified
     */
    private VaultResult<Integer> verifyRotations(List<AuditLogEntry> entries, Set<String> archiveDigests) {
        int rotations = 0;
        for (AuditLogEntry entry : entries) {
            if (entry.getOperation() != AuditOperation.ROTATE) {
                continue;
            }
            if (!archiveDigests.contains(entry.getPayloadDigest())) {
                return VaultResult.err(VaultError.chainBrokenAt(entry.getSequence(),
                        "Archive recorded by rotation " + entry.getSequence() + " is missing or was modified"));
            }
            rotations++;
        }
        return VaultResult.ok(rotations);
    }

    @Override
    public VaultResult<AuditRotation> rotate(Path ledger, Instant cutoff, String actor) {
        ReentrantLock lock = lockFor(ledger);
        lock.lock();
        try {
            List<AuditLogEntry> entries = read(ledger);

            // entries are chronological, so the archive is a prefix
            int split = 0;
            while (split < entries.size() && entries.get(split).getTimestamp().isBefore(cutoff)) {
                split++;
            }
            if (split == 0) {
                log.info("No audit entries older than {} in {}", cutoff, ledger);
                return VaultResult.ok(AuditRotation.builder()
                        .archived(List.of())
                        .activeChain(entries)
                        .build());
            }

            List<AuditLogEntry> archived = List.copyOf(entries.subList(0, split));
            String archiveContent = toNdjson(archived);
            Path archivePath = archivePathFor(ledger);
            AtomicFiles.write(archivePath, archiveContent, false);
            if (!archivePath.toFile().setReadOnly()) {
                log.warn("Could not mark audit archive {} read-only", archivePath);
            }

            AuditLogEntry last = entries.get(entries.size() - 1);
            AuditLogEntry rotateEntry = AuditLogEntry.builder()
                    .sequence(last.getSequence() + 1)
                    .timestamp(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                    .operation(AuditOperation.ROTATE)
                    .actor(actor)
                    .payloadDigest(Digests.sha256Hex(archiveContent))
                    .prevHash(last.getHash())
                    .build();
            rotateEntry.setHash(computeHash(rotateEntry));

            List<AuditLogEntry> active = new ArrayList<>(entries.subList(split, entries.size()));
            active.add(rotateEntry);
            writeAll(ledger, active);

            log.info("Rotated {} audit entries from {} into {}", archived.size(), ledger, archivePath);
            return VaultResult.ok(AuditRotation.builder()
                    .archivePath(archivePath)
                    .archived(archived)
                    .activeChain(List.copyOf(active))
                    .build());
        } catch (IOException e) {
            log.error("Failed to rotate audit ledger {}", ledger, e);
            return VaultResult.fromException(new AuditLedgerException("Failed to rotate audit ledger " + ledger, e));
        } catch (AuditLedgerException e) {
            return VaultResult.fromException(e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public VaultResult<List<AuditLogEntry>> query(Path ledger, AuditQuery query) {
        if (query.getLimit() != null && query.getLimit() < 0) {
            return VaultResult.err(VaultErrorKind.AUDIT, "Audit query limit must not be negative: " + query.getLimit());
        }
        return load(ledger).map(entries -> {
            List<AuditLogEntry> matches = entries.stream()
                    .filter(e -> query.getOperations() == null || query.getOperations().contains(e.getOperation()))
                    .filter(e -> query.getActor() == null || (e.getActor() != null
                            && e.getActor().toLowerCase(Locale.ROOT).contains(query.getActor().toLowerCase(Locale.ROOT))))
                    .filter(e -> query.getFrom() == null || !e.getTimestamp().isBefore(query.getFrom()))
                    .filter(e -> query.getTo() == null || !e.getTimestamp().isAfter(query.getTo()))
                    .collect(Collectors.toList());

            if (query.getLimit() != null && matches.size() > query.getLimit()) {
                return List.copyOf(matches.subList(matches.size() - query.getLimit(), matches.size()));
            }
            return matches;
        });
    }

    @Override
    public VaultResult<AuditSummary> summarize(Path ledger, Instant from, Instant to) {
        AuditQuery period = AuditQuery.builder().from(from).to(to).build();
        return query(ledger, period).map(entries -> {
            Map<String, Integer> byOperation = new TreeMap<>();
            Map<String, Integer> byActor = new TreeMap<>();
            for (AuditLogEntry entry : entries) {
                byOperation.merge(entry.getOperation().name(), 1, Integer::sum);
                byActor.merge(entry.getActor() != null ? entry.getActor() : UNKNOWN_ACTOR, 1, Integer::sum);
            }
            return AuditSummary.builder()
                    .totalEntries(entries.size())
                    .byOperation(byOperation)
                    .byActor(byActor)
                    .firstEntry(entries.isEmpty() ? null : entries.get(0).getTimestamp())
                    .lastEntry(entries.isEmpty() ? null : entries.get(entries.size() - 1).getTimestamp())
                    .build();
        });
    }

    @Override
    public VaultResult<String> export(Path ledger, AuditExportFormat format) {
        return load(ledger).flatMap(entries -> {
            switch (format) {
                case JSON:
                    try {
                        return VaultResult.ok(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(entries));
                    } catch (JsonProcessingException e) {
                        return VaultResult.fromException(new AuditLedgerException("Failed to export audit ledger", e));
                    }
                case CSV:
                    return VaultResult.ok(toCsv(entries));
                case PLAINTEXT:
                default:
                    return VaultResult.ok(entries.stream()
                            .map(AuditLedgerServiceImpl::formatEntry)
                            .collect(Collectors.joining("\n")));
            }
        });
    }

    @Override
    public String computeHash(AuditLogEntry entry) {
        String content = String.join("\n",
                entry.getPrevHash() != null ? entry.getPrevHash() : "",
                Long.toString(entry.getSequence()),
                entry.getOperation() != null ? entry.getOperation().name() : "",
                entry.getTimestamp() != null ? entry.getTimestamp().toString() : "",
                entry.getPayloadDigest() != null ? entry.getPayloadDigest() : "");
        return Digests.sha256Hex(content);
    }

    /**
     * One line per entry: {@code [timestamp] OPERATION by actor | #sequence}
     */
    static String formatEntry(AuditLogEntry entry) {
        String actor = entry.getActor() != null ? entry.getActor() : UNKNOWN_ACTOR;
        return String.format("[%s] %-8s by %-20s | #%d", entry.getTimestamp(), entry.getOperation(), actor,
                entry.getSequence());
    }

    private String toCsv(List<AuditLogEntry> entries) {
        StringBuilder sb = new StringBuilder("sequence,timestamp,operation,actor,payloadDigest,hash");
        for (AuditLogEntry entry : entries) {
            sb.append('\n')
                    .append(entry.getSequence()).append(',')
                    .append(entry.getTimestamp()).append(',')
                    .append(entry.getOperation()).append(',')
                    .append(csvField(entry.getActor())).append(',')
                    .append(entry.getPayloadDigest() != null ? entry.getPayloadDigest() : "").append(',')
                    .append(entry.getHash());
        }
        return sb.toString();
    }

    private static String csvField(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private List<AuditLogEntry> read(Path ledger) {
        if (!Files.exists(ledger)) {
            return new ArrayList<>();
        }
        return parse(ledger, readText(ledger));
    }

    private String readText(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new AuditLedgerException("Failed to read audit ledger " + file, e);
        }
    }

    private List<AuditLogEntry> parse(Path source, String content) {
        String[] lines = content.split("\n");
        List<AuditLogEntry> entries = new ArrayList<>(lines.length);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, AuditLogEntry.class));
            } catch (JsonProcessingException e) {
                throw new AuditLedgerException(String.format("Audit ledger %s line %d is not a valid entry", source, i + 1), e);
            }
        }
        return entries;
    }

    private void writeAll(Path ledger, List<AuditLogEntry> entries) {
        try {
            AtomicFiles.write(ledger, toNdjson(entries), false);
        } catch (IOException e) {
            throw new AuditLedgerException("Failed to write audit ledger " + ledger, e);
        }
    }

    private String toNdjson(List<AuditLogEntry> entries) {
        StringBuilder sb = new StringBuilder();
        for (AuditLogEntry entry : entries) {
            try {
                sb.append(objectMapper.writeValueAsString(entry)).append('\n');
            } catch (JsonProcessingException e) {
                throw new AuditLedgerException("Failed to serialize audit entry " + entry.getSequence(), e);
            }
        }
        return sb.toString();
    }

    private Path archivePathFor(Path ledger) {
        String base = ledger.getFileName().toString() + "." + clock.millis();
        Path candidate = ledger.resolveSibling(base + ".archive");
        int suffix = 1;
        while (Files.exists(candidate)) {
            candidate = ledger.resolveSibling(base + "-" + suffix++ + ".archive");
        }
        return candidate;
    }

    private ReentrantLock lockFor(Path ledger) {
        return fileLocks.computeIfAbsent(ledger.toAbsolutePath().normalize(), p -> new ReentrantLock());
    }
}
