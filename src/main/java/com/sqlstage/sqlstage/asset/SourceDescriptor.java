package com.sqlstage.sqlstage.asset;

/**
 * Where the SQL of one dataset comes from. Exactly one variant per dataset.
 */
public sealed interface SourceDescriptor
        permits SourceDescriptor.DirectSql, SourceDescriptor.ZipMember, SourceDescriptor.BundleMember {

    /**
     * File name of the staged SQL under the staged-sql cache root.
     */
    String stagedName();

    /**
     * A plain {@code .sql} file served over HTTP(S).
     */
    record DirectSql(String url, String stagedName) implements SourceDescriptor {
    }

    /**
     * One member of a zip archive served over HTTP(S).
     */
    record ZipMember(String url, String archiveName, String memberPath, String stagedName) implements SourceDescriptor {
    }

    /**
     * One SQL member of a multi-dataset bundle, looked up by {@code key} in the bundle's member maps.
     */
    record BundleMember(String bundleId, String key, String stagedName) implements SourceDescriptor {
    }
}
