package com.sqlstage.sqlstage.archive;

import com.sqlstage.sqlstage.asset.AssetResolutionException;
import com.sqlstage.sqlstage.cache.CacheLayout;
import com.sqlstage.sqlstage.config.SqlStageConstants;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Extracts tar-gzip bundles into a cache directory once, guarded by a completion marker, and finds members in the
 * extracted tree.
 */
@Component
public class ArchiveStager {

    private static final Logger log = LoggerFactory.getLogger(ArchiveStager.class);

    /**
     * Returns {@code destDir} as-is when its completion marker exists and {@code force} is false. Otherwise wipes it,
     * extracts the whole archive and writes the marker last.
     */
    public Path extract(Path archivePath, Path destDir, boolean force) {
        CacheLayout.ensureDirectory(destDir);
        Path marker = destDir.resolve(SqlStageConstants.EXTRACTION_MARKER);
        if (Files.exists(marker) && !force) {
            log.info("Using cached extracted bundle: {}", destDir);
            return destDir;
        }

        clearDirectory(destDir);
        log.info("Extracting {} -> {}", archivePath.getFileName(), destDir);
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(archivePath));
             GzipCompressorInputStream gzip = new GzipCompressorInputStream(raw, true);
             TarArchiveInputStream tar = new TarArchiveInputStream(gzip)) {
            int files = 0;
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                Path target = safeTarget(destDir, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else if (entry.isFile()) {
                    Files.createDirectories(target.getParent());
                    Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
                    files++;
                } else {
                    log.debug("Skipping non-regular archive entry {}", entry.getName());
                }
            }
            Files.createFile(marker);
            log.info("Extracted {} files into {}", files, destDir);
            return destDir;
        } catch (IOException ex) {
            throw new ArchiveCorruptException(SqlStageConstants.MSG_ARCHIVE_CORRUPT.formatted(archivePath), ex);
        }
    }

    /**
     * Finds {@code name} directly under {@code root}, else anywhere below it. Several matches resolve to the first
     * in lexicographic order of their relative paths.
     */
    public Path locateMember(Path root, String name) {
        Path direct = root.resolve(name);
        if (Files.isRegularFile(direct)) {
            return direct;
        }

        List<Path> matches;
        try (Stream<Path> walk = Files.walk(root)) {
            matches = walk
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().equals(name))
                    .sorted(Comparator.comparing(path -> root.relativize(path).toString()))
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException ex) {
            throw new AssetResolutionException("Failed to search " + root + " for " + name, ex);
        }

        if (matches.isEmpty()) {
            throw new MemberNotFoundException(SqlStageConstants.MSG_MEMBER_NOT_FOUND.formatted(name, root));
        }
        if (matches.size() > 1) {
            log.warn("Multiple matches for {} under {}: {}. Using {}", name, root, matches.size(), matches.get(0));
        }
        return matches.get(0);
    }

    private Path safeTarget(Path destDir, String entryName) throws IOException {
        Path base = destDir.toAbsolutePath().normalize();
        Path target = base.resolve(entryName).normalize();
        if (!target.startsWith(base)) {
            throw new IOException(SqlStageConstants.MSG_ARCHIVE_ENTRY_ESCAPES.formatted(entryName));
        }
        return target;
    }

    /**
     * Extraction directories are disposable; anything that cannot be removed is logged and left behind.
     */
    private void clearDirectory(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(dir))
                    .forEach(this::deleteBestEffort);
        } catch (IOException ex) {
            log.warn("Could not list {} for cleanup", dir, ex);
        }
    }

    private void deleteBestEffort(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Could not delete {}", path, ex);
        }
    }
}
