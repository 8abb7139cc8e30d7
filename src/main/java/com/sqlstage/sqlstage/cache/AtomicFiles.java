package com.sqlstage.sqlstage.cache;

import com.sqlstage.sqlstage.config.SqlStageConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Write-then-rename helpers for cache files. A destination is either absent, the previous complete file,
 * or the new complete file; never a partial write.
 */
public final class AtomicFiles {

    private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

    private AtomicFiles() {
    }

    /**
     * Streams {@code in} into a temporary sibling of {@code destination} and renames it into place once complete.
     * The temporary file is removed on failure.
     */
    public static Path write(InputStream in, Path destination) throws IOException {
        CacheLayout.ensureDirectory(destination.toAbsolutePath().getParent());
        Path temp = tempSibling(destination);
        try {
            try (OutputStream out = Files.newOutputStream(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                byte[] buffer = new byte[SqlStageConstants.COPY_BUFFER_SIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    out.write(buffer, 0, read);
                }
            }
            replace(temp, destination);
            return destination;
        } finally {
            deleteWithRetries(temp);
        }
    }

    public static Path copy(Path source, Path destination) throws IOException {
        try (InputStream in = Files.newInputStream(source)) {
            return write(in, destination);
        }
    }

    /**
     * Temporary name unique per process id and timestamp, so concurrent runs never share an in-flight file.
     */
    public static Path tempSibling(Path destination) {
        String name = destination.getFileName().toString()
                + SqlStageConstants.PART_SUFFIX
                + "." + ProcessHandle.current().pid()
                + "." + System.currentTimeMillis();
        return destination.resolveSibling(name);
    }

    public static void replace(Path temp, Path destination) throws IOException {
        try {
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Deletes {@code temp} if present, retrying a few times while the file is busy.
     */
    public static void deleteWithRetries(Path temp) {
        IOException last = null;
        for (int attempt = 1; attempt <= SqlStageConstants.TEMP_DELETE_ATTEMPTS; attempt++) {
            try {
                Files.deleteIfExists(temp);
                return;
            } catch (IOException ex) {
                last = ex;
            }
            try {
                Thread.sleep(SqlStageConstants.TEMP_DELETE_BACKOFF_MS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.warn("Could not remove temporary file {}", temp, last);
    }
}
