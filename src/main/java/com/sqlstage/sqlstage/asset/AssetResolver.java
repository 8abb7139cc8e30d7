package com.sqlstage.sqlstage.asset;

import com.sqlstage.sqlstage.archive.ArchiveCorruptException;
import com.sqlstage.sqlstage.archive.ArchiveStager;
import com.sqlstage.sqlstage.archive.MemberNotFoundException;
import com.sqlstage.sqlstage.cache.AtomicFiles;
import com.sqlstage.sqlstage.cache.CacheLayout;
import com.sqlstage.sqlstage.config.SqlStageConstants;
import com.sqlstage.sqlstage.transfer.DownloadRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Maps a dataset name to its canonical staged SQL file, downloading and extracting whatever the source needs.
 */
@Service
public class AssetResolver {

    private static final Logger log = LoggerFactory.getLogger(AssetResolver.class);

    private final AssetCatalog catalog;
    private final CacheLayout cacheLayout;
    private final DownloadRouter downloadRouter;
    private final ArchiveStager archiveStager;

    public AssetResolver(AssetCatalog catalog, CacheLayout cacheLayout, DownloadRouter downloadRouter,
                         ArchiveStager archiveStager) {
        this.catalog = catalog;
        this.cacheLayout = cacheLayout;
        this.downloadRouter = downloadRouter;
        this.archiveStager = archiveStager;
    }

    /**
     * Returns the staged SQL path, or empty when no source is configured for the dataset.
     */
    public Optional<Path> resolve(String dataset, boolean force) {
        Optional<SourceDescriptor> source = catalog.source(dataset);
        if (source.isEmpty()) {
            log.warn("No SQL source configured for dataset '{}'. Skipping.", dataset);
            return Optional.empty();
        }
        return Optional.of(resolveSource(dataset, source.get(), force));
    }

    /**
     * Staged questions file of a dataset, when one has been staged.
     */
    public Optional<Path> questionsPath(String dataset) {
        Path path = cacheLayout.questionsLocation(dataset);
        return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    }

    private Path resolveSource(String dataset, SourceDescriptor source, boolean force) {
        if (source instanceof SourceDescriptor.DirectSql direct) {
            return downloadRouter.download(direct.url(), cacheLayout.stagedSqlFile(direct.stagedName()), force);
        }
        if (source instanceof SourceDescriptor.ZipMember zip) {
            return resolveZipMember(zip, force);
        }
        if (source instanceof SourceDescriptor.BundleMember member) {
            return resolveBundleMember(dataset, member, force);
        }
        throw new IllegalStateException("Unhandled source kind for dataset " + dataset + ": " + source);
    }

    private Path resolveZipMember(SourceDescriptor.ZipMember zip, boolean force) {
        Path archive = downloadRouter.download(zip.url(), cacheLayout.archiveFile(zip.archiveName()), force);
        Path staged = cacheLayout.stagedSqlFile(zip.stagedName());
        if (!force && Files.exists(staged)) {
            log.info("Using cached staged SQL: {}", staged);
            return staged;
        }

        log.info("Extracting '{}' from {}", zip.memberPath(), archive.getFileName());
        try (ZipFile zipFile = new ZipFile(archive.toFile())) {
            ZipEntry entry = zipFile.getEntry(zip.memberPath());
            if (entry == null || entry.isDirectory()) {
                List<String> preview = zipFile.stream()
                        .map(ZipEntry::getName)
                        .limit(SqlStageConstants.ZIP_ENTRY_PREVIEW_LIMIT)
                        .toList();
                throw new MemberNotFoundException(SqlStageConstants.MSG_ZIP_MEMBER_NOT_FOUND.formatted(
                        zip.memberPath(), archive.getFileName(), preview));
            }
            try (InputStream in = zipFile.getInputStream(entry)) {
                AtomicFiles.write(in, staged);
            }
        } catch (ZipException ex) {
            throw new ArchiveCorruptException(SqlStageConstants.MSG_ARCHIVE_CORRUPT.formatted(archive), ex);
        } catch (IOException ex) {
            throw new AssetResolutionException("Failed to stage " + zip.memberPath() + " into " + staged, ex);
        }
        log.info("Staged SQL: {}", staged);
        return staged;
    }

    private Path resolveBundleMember(String dataset, SourceDescriptor.BundleMember member, boolean force) {
        BundleDescriptor bundle = catalog.bundle(member.bundleId())
                .orElseThrow(() -> new UnknownBundleException(SqlStageConstants.MSG_UNKNOWN_BUNDLE.formatted(
                        member.bundleId(), catalog.bundles().keySet())));
        if (!bundle.isTarGzip()) {
            throw new UnsupportedBundleKindException(
                    SqlStageConstants.MSG_UNSUPPORTED_BUNDLE_KIND.formatted(bundle.kind(), bundle.id()));
        }

        Path archive = downloadRouter.download(bundle.url(), cacheLayout.archiveFile(bundle.archiveFilename()), force);
        Path extracted = archiveStager.extract(archive, cacheLayout.extractionDir(bundle.extractDir()), force);

        String sqlMember = bundle.sqlMembers().get(member.key());
        if (sqlMember == null) {
            throw new MemberNotFoundException(SqlStageConstants.MSG_MEMBER_NOT_FOUND.formatted(member.key(), bundle.id()));
        }
        Path staged = stageCopy(archiveStager.locateMember(extracted, sqlMember),
                cacheLayout.stagedSqlFile(member.stagedName()), force);

        stageQuestions(dataset, bundle, member.key(), extracted, force);
        return staged;
    }

    /**
     * Questions are not needed for the import, so any failure here is only logged.
     */
    private void stageQuestions(String dataset, BundleDescriptor bundle, String key, Path extracted, boolean force) {
        String questionsMember = bundle.questionsMembers().get(key);
        if (questionsMember == null) {
            return;
        }
        try {
            stageCopy(archiveStager.locateMember(extracted, questionsMember),
                    cacheLayout.stagedQuestionsFile(dataset), force);
        } catch (AssetResolutionException ex) {
            log.warn("Could not stage questions for dataset '{}': {}", dataset, ex.getMessage());
        }
    }

    private Path stageCopy(Path source, Path target, boolean force) {
        if (!force && Files.exists(target)) {
            log.info("Using cached staged file: {}", target);
            return target;
        }
        log.info("Staging {} -> {}", source.getFileName(), target);
        try {
            return AtomicFiles.copy(source, target);
        } catch (IOException ex) {
            throw new AssetResolutionException("Failed to stage " + source + " into " + target, ex);
        }
    }
}
