package com.sqlstage.sqlstage.asset;

import com.sqlstage.sqlstage.config.SqlStageConstants;
import com.sqlstage.sqlstage.config.SqlStageProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only registry of dataset sources and bundles, built once at startup.
 */
public class AssetCatalog {

    private final Map<String, SourceDescriptor> sources;
    private final Map<String, BundleDescriptor> bundles;

    public AssetCatalog(Map<String, SourceDescriptor> sources, Map<String, BundleDescriptor> bundles) {
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        this.bundles = Collections.unmodifiableMap(new LinkedHashMap<>(bundles));
        validateBundleKeys();
    }

    /**
     * Converts the raw property entries into typed descriptors, applying name defaults.
     */
    public static AssetCatalog fromProperties(SqlStageProperties properties) {
        Map<String, BundleDescriptor> bundles = new LinkedHashMap<>();
        properties.getBundles().forEach((id, raw) -> bundles.put(id, new BundleDescriptor(
                id,
                raw.getType(),
                required(raw.getUrl(), "bundles." + id + ".url"),
                orDefault(raw.getArchiveName(), id + SqlStageConstants.TGZ_EXT),
                orDefault(raw.getExtractDir(), id),
                raw.getSqlMembers(),
                raw.getQuestionsMembers()
        )));

        Map<String, SourceDescriptor> sources = new LinkedHashMap<>();
        properties.getSources().forEach((dataset, raw) -> sources.put(dataset, toDescriptor(dataset, raw)));
        return new AssetCatalog(sources, bundles);
    }

    public Optional<SourceDescriptor> source(String dataset) {
        return Optional.ofNullable(sources.get(dataset));
    }

    public Optional<BundleDescriptor> bundle(String bundleId) {
        return Optional.ofNullable(bundles.get(bundleId));
    }

    public Map<String, SourceDescriptor> sources() {
        return sources;
    }

    public Map<String, BundleDescriptor> bundles() {
        return bundles;
    }

    private static SourceDescriptor toDescriptor(String dataset, SqlStageProperties.Source raw) {
        String type = required(raw.getType(), "sources." + dataset + ".type").toLowerCase(Locale.ROOT);
        String stagedName = orDefault(raw.getStagedName(), dataset + SqlStageConstants.SQL_EXT);
        return switch (type) {
            case SqlStageConstants.SOURCE_TYPE_DIRECT_SQL -> new SourceDescriptor.DirectSql(
                    required(raw.getUrl(), "sources." + dataset + ".url"),
                    stagedName);
            case SqlStageConstants.SOURCE_TYPE_ZIP -> new SourceDescriptor.ZipMember(
                    required(raw.getUrl(), "sources." + dataset + ".url"),
                    orDefault(raw.getArchiveName(), dataset + SqlStageConstants.ZIP_EXT),
                    required(raw.getMember(), "sources." + dataset + ".member"),
                    stagedName);
            case SqlStageConstants.SOURCE_TYPE_BUNDLE -> new SourceDescriptor.BundleMember(
                    required(raw.getBundle(), "sources." + dataset + ".bundle"),
                    orDefault(raw.getKey(), dataset),
                    stagedName);
            default -> throw new IllegalStateException("Unknown source type '" + type + "' for dataset " + dataset);
        };
    }

    /**
     * A bundle member must name a key the bundle knows. Unregistered bundles are reported at resolution time.
     */
    private void validateBundleKeys() {
        sources.forEach((dataset, source) -> {
            if (source instanceof SourceDescriptor.BundleMember member) {
                BundleDescriptor bundle = bundles.get(member.bundleId());
                if (bundle != null && !bundle.sqlMembers().containsKey(member.key())) {
                    throw new IllegalStateException("Dataset '" + dataset + "' references key '" + member.key()
                            + "' missing from sql-members of bundle '" + member.bundleId() + "'");
                }
            }
        });
    }

    private static String required(String value, String propertyName) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required property sqlstage." + propertyName);
        }
        return value.trim();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
