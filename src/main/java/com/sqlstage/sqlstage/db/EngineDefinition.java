package com.sqlstage.sqlstage.db;

import java.util.List;

/**
 * How to reach the command-line tools of one running engine, e.g. {@code docker exec -i text2sql-mysql mysql}.
 */
public record EngineDefinition(String name, List<String> commandPrefix, String client, String dumpClient, String user) {

    public EngineDefinition {
        commandPrefix = commandPrefix == null ? List.of() : List.copyOf(commandPrefix);
    }
}
