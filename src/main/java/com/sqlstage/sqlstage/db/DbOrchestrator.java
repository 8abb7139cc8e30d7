package com.sqlstage.sqlstage.db;

import com.sqlstage.sqlstage.cache.AtomicFiles;
import com.sqlstage.sqlstage.cache.CacheLayout;
import com.sqlstage.sqlstage.config.SqlStageConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Drives the command-line tools of an already running engine: create or reset a database, import a SQL file into
 * it and dump its structure.
 */
@Service
public class DbOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DbOrchestrator.class);

    private static final Pattern VALID_DB_NAME = Pattern.compile(SqlStageConstants.VALID_DB_NAME_REGEX);
    private static final Pattern CREATE_TABLE = Pattern.compile(
            "CREATE\\s+TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?[`\"]?([A-Za-z0-9_$]+)[`\"]?",
            Pattern.CASE_INSENSITIVE);

    private final CommandRunner commandRunner;
    private final CacheLayout cacheLayout;

    public DbOrchestrator(CommandRunner commandRunner, CacheLayout cacheLayout) {
        this.commandRunner = commandRunner;
        this.cacheLayout = cacheLayout;
    }

    /**
     * Creates the database if missing, dropping it first when {@code reset} is set. Both statements go out as one
     * administrative command.
     */
    public void ensureDatabase(EngineDefinition engine, DbCredentials credentials, String database, boolean reset) {
        String name = requireValidName(database);
        StringBuilder statements = new StringBuilder();
        if (reset) {
            log.info("Dropping database '{}' on {} (if exists)", name, engine.name());
            statements.append("DROP DATABASE IF EXISTS `").append(name).append("`; ");
        }
        log.info("Creating database '{}' on {} (if not exists)", name, engine.name());
        statements.append("CREATE DATABASE IF NOT EXISTS `").append(name).append("` CHARACTER SET ")
                .append(SqlStageConstants.DB_CHARSET).append(" COLLATE ").append(SqlStageConstants.DB_COLLATION)
                .append(';');

        List<String> command = command(engine, credentials, engine.client(), "-e", statements.toString());
        CommandResult result;
        try {
            result = execute(command, credentials, null, null);
        } catch (IOException ex) {
            throw new DbAdminException(SqlStageConstants.MSG_DB_ADMIN_FAILED.formatted(
                    engine.name(), -1, ex.getMessage()), ex);
        }
        if (!result.succeeded()) {
            throw new DbAdminException(SqlStageConstants.MSG_DB_ADMIN_FAILED.formatted(
                    engine.name(), result.exitCode(), result.diagnostics()));
        }
    }

    /**
     * Streams {@code sqlFile} into the engine client connected to {@code database}.
     */
    public void importSqlFile(EngineDefinition engine, DbCredentials credentials, String database, Path sqlFile) {
        String name = requireValidName(database);
        log.info("Importing {} into {}:{}", sqlFile.getFileName(), engine.name(), name);
        List<String> command = command(engine, credentials, engine.client(), name);
        CommandResult result;
        try {
            result = execute(command, credentials, sqlFile, null);
        } catch (IOException ex) {
            throw new ImportFailedException(SqlStageConstants.MSG_IMPORT_FAILED.formatted(
                    sqlFile.getFileName(), engine.name(), name, -1, ex.getMessage()), ex);
        }
        if (!result.succeeded()) {
            throw new ImportFailedException(SqlStageConstants.MSG_IMPORT_FAILED.formatted(
                    sqlFile.getFileName(), engine.name(), name, result.exitCode(), result.diagnostics()));
        }
        log.info("Import complete: {}:{}", engine.name(), name);
    }

    /**
     * Writes a structure-only dump (tables, routines, triggers, no rows) to {@code schemas/<engine>/<db>.schema.sql}.
     * Nothing is written when the dump fails.
     */
    public SchemaSnapshot dumpSchemaSnapshot(EngineDefinition engine, DbCredentials credentials, String database) {
        String name = requireValidName(database);
        Path target = cacheLayout.schemaFile(engine.name(), name);
        List<String> command = command(engine, credentials, engine.dumpClient(),
                "--no-data", "--routines", "--triggers", name);
        log.info("Writing schema snapshot: {}", target);

        Path temp = AtomicFiles.tempSibling(target);
        try {
            CommandResult result = execute(command, credentials, null, temp);
            if (!result.succeeded()) {
                throw new SchemaDumpException(SqlStageConstants.MSG_DUMP_FAILED.formatted(
                        engine.name(), name, result.exitCode(), result.diagnostics()));
            }
            // dumps are stored verbatim; undecodable bytes only affect the table listing
            List<String> tables = tableNames(new String(Files.readAllBytes(temp), StandardCharsets.UTF_8));
            AtomicFiles.replace(temp, target);
            return new SchemaSnapshot(target, tables);
        } catch (IOException ex) {
            throw new SchemaDumpException(SqlStageConstants.MSG_DUMP_FAILED.formatted(
                    engine.name(), name, -1, ex.getMessage()), ex);
        } finally {
            AtomicFiles.deleteWithRetries(temp);
        }
    }

    /**
     * Table names declared by {@code CREATE TABLE} statements, in order of appearance.
     */
    public static List<String> tableNames(String sql) {
        List<String> names = new ArrayList<>();
        Matcher matcher = CREATE_TABLE.matcher(sql);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private List<String> command(EngineDefinition engine, DbCredentials credentials, String tool, String... args) {
        List<String> command = new ArrayList<>(engine.commandPrefix());
        command.add(tool);
        command.add("-u" + engine.user());
        command.add(passwordArg(credentials));
        command.addAll(List.of(args));
        return command;
    }

    private CommandResult execute(List<String> command, DbCredentials credentials, Path stdin, Path stdout)
            throws IOException {
        if (log.isDebugEnabled()) {
            String secret = passwordArg(credentials);
            log.debug("Running: {}", command.stream()
                    .map(arg -> arg.equals(secret) ? "-p****" : arg)
                    .collect(Collectors.joining(" ")));
        }
        return commandRunner.run(command, stdin, stdout);
    }

    private static String passwordArg(DbCredentials credentials) {
        return "-p" + (credentials.rootPassword() == null ? "" : credentials.rootPassword());
    }

    public static String requireValidName(String database) {
        if (database == null || !VALID_DB_NAME.matcher(database).matches()) {
            throw new IllegalArgumentException(SqlStageConstants.MSG_INVALID_DB_NAME.formatted(database));
        }
        return database;
    }
}
