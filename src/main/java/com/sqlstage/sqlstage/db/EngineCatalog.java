package com.sqlstage.sqlstage.db;

import com.sqlstage.sqlstage.config.SqlStageConstants;
import com.sqlstage.sqlstage.config.SqlStageProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configured engines and their administrative credentials.
 */
public class EngineCatalog {

    private final Map<String, EngineDefinition> engines;
    private final Map<String, DbCredentials> credentials;

    public EngineCatalog(Map<String, EngineDefinition> engines, Map<String, DbCredentials> credentials) {
        this.engines = Collections.unmodifiableMap(new LinkedHashMap<>(engines));
        this.credentials = Collections.unmodifiableMap(new LinkedHashMap<>(credentials));
    }

    public static EngineCatalog fromProperties(SqlStageProperties properties) {
        Map<String, EngineDefinition> engines = new LinkedHashMap<>();
        Map<String, DbCredentials> credentials = new LinkedHashMap<>();
        properties.getEngines().forEach((name, raw) -> {
            if (raw.getDumpClient() == null || raw.getDumpClient().isBlank()) {
                throw new IllegalStateException("Missing required property sqlstage.engines." + name + ".dump-client");
            }
            String client = raw.getClient() == null || raw.getClient().isBlank() ? name : raw.getClient().trim();
            String user = raw.getUser() == null || raw.getUser().isBlank()
                    ? SqlStageConstants.DEFAULT_DB_USER : raw.getUser().trim();
            engines.put(name, new EngineDefinition(name, raw.getCommandPrefix(), client, raw.getDumpClient().trim(), user));
            credentials.put(name, new DbCredentials(raw.getRootPassword()));
        });
        return new EngineCatalog(engines, credentials);
    }

    /**
     * @throws IllegalArgumentException when the engine is not configured
     */
    public EngineDefinition engine(String name) {
        EngineDefinition engine = engines.get(name);
        if (engine == null) {
            throw new IllegalArgumentException(SqlStageConstants.MSG_UNKNOWN_ENGINE.formatted(name, engines.keySet()));
        }
        return engine;
    }

    public DbCredentials credentials(String name) {
        engine(name);
        return credentials.get(name);
    }

    public List<String> names() {
        return List.copyOf(engines.keySet());
    }
}
