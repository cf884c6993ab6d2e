package org.nevr.vault.core.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

/**
 * Write-new-then-replace file updates. A reader sees the old or the new content, never a mix.
 */
@Slf4j
public final class AtomicFiles {

    private static final Set<PosixFilePermission> OWNER_ONLY = EnumSet.of(
            PosixFilePermission.OWNER_READ,
            PosixFilePermission.OWNER_WRITE);

    private AtomicFiles() {
    }

    public static void write(Path target, String content, boolean ownerOnly) throws IOException {
        write(target, content.getBytes(StandardCharsets.UTF_8), ownerOnly);
    }

    public static void write(Path target, byte[] content, boolean ownerOnly) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path parentDir = absolute.getParent();
        Files.createDirectories(parentDir);

        Path tempFile = Files.createTempFile(parentDir, absolute.getFileName().toString(), ".tmp");
        try {
            Files.write(tempFile, content);
            if (ownerOnly) {
                restrictToOwner(tempFile);
            }

            try {
                Files.move(tempFile, absolute,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported for {}, falling back to plain replace", absolute);
                Files.move(tempFile, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    public static String readIfExists(Path path) throws IOException {
        if (!Files.exists(path)) {
            return null;
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    private static void restrictToOwner(Path path) throws IOException {
        try {
            Files.setPosixFilePermissions(path, OWNER_ONLY);
        } catch (UnsupportedOperationException e) {
            // Windows doesn't support POSIX permissions
            log.debug("POSIX permissions not supported for {}", path);
        }
    }
}
