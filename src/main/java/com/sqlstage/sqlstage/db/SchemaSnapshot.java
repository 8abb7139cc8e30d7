package com.sqlstage.sqlstage.db;

import java.nio.file.Path;
import java.util.List;

/**
 * A structure-only dump on disk and the tables it defines.
 */
public record SchemaSnapshot(Path path, List<String> tableNames) {

    public SchemaSnapshot {
        tableNames = tableNames == null ? List.of() : List.copyOf(tableNames);
    }
}
