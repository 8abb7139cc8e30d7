package com.sqlstage.sqlstage.asset;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * A downloadable archive holding SQL and question files for several datasets.
 */
public record BundleDescriptor(
        String id,
        String kind,
        String url,
        String archiveFilename,
        String extractDir,
        Map<String, String> sqlMembers,
        Map<String, String> questionsMembers
) {

    private static final Set<String> TAR_GZIP_KINDS = Set.of("tgz", "tar-gzip", "tar.gz");

    public BundleDescriptor {
        sqlMembers = sqlMembers == null ? Map.of() : Map.copyOf(sqlMembers);
        questionsMembers = questionsMembers == null ? Map.of() : Map.copyOf(questionsMembers);
    }

    public boolean isTarGzip() {
        return kind != null && TAR_GZIP_KINDS.contains(kind.toLowerCase(Locale.ROOT));
    }
}
