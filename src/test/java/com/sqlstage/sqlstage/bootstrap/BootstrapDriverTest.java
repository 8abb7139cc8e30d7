package com.sqlstage.sqlstage.bootstrap;

import com.sqlstage.sqlstage.asset.AssetResolver;
import com.sqlstage.sqlstage.bootstrap.BootstrapModels.BootstrapReport;
import com.sqlstage.sqlstage.bootstrap.BootstrapModels.BootstrapRequest;
import com.sqlstage.sqlstage.bootstrap.BootstrapModels.PairOutcome;
import com.sqlstage.sqlstage.config.SqlStageProperties;
import com.sqlstage.sqlstage.db.DbAdminException;
import com.sqlstage.sqlstage.db.DbCredentials;
import com.sqlstage.sqlstage.db.DbOrchestrator;
import com.sqlstage.sqlstage.db.EngineCatalog;
import com.sqlstage.sqlstage.db.EngineDefinition;
import com.sqlstage.sqlstage.db.ImportFailedException;
import com.sqlstage.sqlstage.db.SchemaDumpException;
import com.sqlstage.sqlstage.db.SchemaSnapshot;
import com.sqlstage.sqlstage.transfer.TransferException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BootstrapDriverTest {

    private static final EngineDefinition MYSQL = new EngineDefinition("mysql", List.of(), "mysql", "mysqldump", "root");
    private static final EngineDefinition MARIADB =
            new EngineDefinition("mariadb", List.of(), "mariadb", "mariadb-dump", "root");

    @Mock
    private AssetResolver assetResolver;

    @Mock
    private DbOrchestrator dbOrchestrator;

    private SqlStageProperties properties;
    private BootstrapDriver driver;

    @BeforeEach
    void setUp() {
        Map<String, EngineDefinition> engines = new LinkedHashMap<>();
        engines.put("mysql", MYSQL);
        engines.put("mariadb", MARIADB);
        Map<String, DbCredentials> credentials = new LinkedHashMap<>();
        credentials.put("mysql", new DbCredentials("root123"));
        credentials.put("mariadb", new DbCredentials("root123"));

        properties = new SqlStageProperties();
        properties.getBootstrap().setDatasets(List.of("imdb", "yelp"));
        driver = new BootstrapDriver(assetResolver, dbOrchestrator, new EngineCatalog(engines, credentials), properties);
    }

    @Test
    void shouldImportEveryPairEngineByEngine() {
        stageAll();
        when(dbOrchestrator.dumpSchemaSnapshot(any(), any(), anyString())).thenAnswer(invocation -> new SchemaSnapshot(
                Path.of("schemas", ((EngineDefinition) invocation.getArgument(0)).name(), invocation.getArgument(2) + ".schema.sql"),
                List.of("t1")));

        BootstrapReport report = driver.run(null);

        assertEquals(List.of("mysql:imdb", "mysql:yelp", "mariadb:imdb", "mariadb:yelp"), pairs(report));
        assertEquals(4, report.count(PairStatus.IMPORTED));
        PairOutcome first = report.outcomes().get(0);
        assertEquals(Path.of("staged-sql", "imdb.sql").toString(), first.stagedSql());
        assertEquals(List.of("t1"), first.snapshotTables());
        assertNull(first.message());

        InOrder order = inOrder(assetResolver, dbOrchestrator);
        order.verify(assetResolver).resolve("imdb", false);
        order.verify(dbOrchestrator).ensureDatabase(MYSQL, new DbCredentials("root123"), "imdb", false);
        order.verify(dbOrchestrator).importSqlFile(eq(MYSQL), any(), eq("imdb"), eq(Path.of("staged-sql", "imdb.sql")));
        order.verify(dbOrchestrator).dumpSchemaSnapshot(eq(MYSQL), any(), eq("imdb"));
    }

    @Test
    void shouldSkipRemainingDatasetsOfEngineAfterImportFailure() {
        stageAll();
        lenient().doThrow(new ImportFailedException("syntax error"))
                .when(dbOrchestrator).importSqlFile(eq(MYSQL), any(), eq("imdb"), any());

        BootstrapReport report = driver.run(new BootstrapRequest(null, null, null, null, true));

        assertEquals(List.of(PairStatus.IMPORT_FAILED, PairStatus.SKIPPED_AFTER_IMPORT_FAILURE,
                PairStatus.IMPORTED, PairStatus.IMPORTED), statuses(report));
        verify(dbOrchestrator, never()).importSqlFile(eq(MYSQL), any(), eq("yelp"), any());
        verify(dbOrchestrator).importSqlFile(eq(MARIADB), any(), eq("yelp"), any());
    }

    @Test
    void shouldContinueAfterResolutionFailure() {
        when(assetResolver.resolve("imdb", false)).thenThrow(new TransferException("HTTP 404 while fetching x", 404));
        when(assetResolver.resolve("yelp", false)).thenReturn(Optional.of(Path.of("staged-sql", "yelp.sql")));

        BootstrapReport report = driver.run(new BootstrapRequest(List.of("mysql"), null, null, null, true));

        assertEquals(List.of(PairStatus.RESOLUTION_FAILED, PairStatus.IMPORTED), statuses(report));
        assertTrue(report.outcomes().get(0).message().contains("404"));
        verify(dbOrchestrator, never()).ensureDatabase(any(), any(), eq("imdb"), anyBoolean());
    }

    @Test
    void shouldReportMissingSourceWithoutTouchingEngine() {
        BootstrapReport report = driver.run(new BootstrapRequest(List.of("mysql"), List.of("geography"), null, null, null));

        assertEquals(List.of(PairStatus.NO_SOURCE), statuses(report));
        verifyNoInteractions(dbOrchestrator);
    }

    @Test
    void shouldContinueAfterAdminFailure() {
        stageAll();
        lenient().doThrow(new DbAdminException("Access denied"))
                .when(dbOrchestrator).ensureDatabase(eq(MYSQL), any(), eq("imdb"), anyBoolean());

        BootstrapReport report = driver.run(new BootstrapRequest(List.of("mysql"), null, null, null, true));

        assertEquals(List.of(PairStatus.DB_ADMIN_FAILED, PairStatus.IMPORTED), statuses(report));
        verify(dbOrchestrator, never()).importSqlFile(any(), any(), eq("imdb"), any());
    }

    @Test
    void shouldKeepImportWhenSnapshotFails() {
        stageAll();
        when(dbOrchestrator.dumpSchemaSnapshot(any(), any(), anyString()))
                .thenThrow(new SchemaDumpException("mysqldump: Got error"));

        BootstrapReport report = driver.run(new BootstrapRequest(List.of("mysql"), List.of("imdb"), null, null, false));

        PairOutcome outcome = report.outcomes().get(0);
        assertEquals(PairStatus.IMPORTED, outcome.status());
        assertNull(outcome.schemaSnapshot());
        assertTrue(outcome.message().contains("mysqldump"));
    }

    @Test
    void shouldPassResetAndForceThrough() {
        when(assetResolver.resolve("imdb", true)).thenReturn(Optional.of(Path.of("staged-sql", "imdb.sql")));

        BootstrapReport report = driver.run(new BootstrapRequest(List.of("mariadb"), List.of("imdb"), true, true, true));

        assertTrue(report.reset());
        assertTrue(report.forceDownload());
        verify(dbOrchestrator).ensureDatabase(eq(MARIADB), any(), eq("imdb"), eq(true));
        verify(dbOrchestrator, never()).dumpSchemaSnapshot(any(), any(), anyString());
    }

    @Test
    void shouldUseConfiguredEnginesBeforeAllEngines() {
        properties.getBootstrap().setEngines(List.of("mariadb"));
        properties.getBootstrap().setSkipSchemaDump(true);
        stageAll();

        BootstrapReport report = driver.run(null);

        assertEquals(List.of("mariadb"), report.engines());
        assertEquals(List.of("mariadb:imdb", "mariadb:yelp"), pairs(report));
    }

    @Test
    void shouldRejectUnknownEngineBeforeAnyWork() {
        assertThrows(IllegalArgumentException.class,
                () -> driver.run(new BootstrapRequest(List.of("postgres"), null, null, null, null)));

        verifyNoInteractions(assetResolver, dbOrchestrator);
    }

    @Test
    void shouldRecordInvalidDatabaseNameForItsPairOnly() {
        stageAll();

        BootstrapReport report = driver.run(
                new BootstrapRequest(List.of("mysql"), List.of("geo-query", "imdb"), null, null, true));

        assertEquals(List.of(PairStatus.DB_ADMIN_FAILED, PairStatus.IMPORTED), statuses(report));
        assertTrue(report.outcomes().get(0).message().contains("geo-query"));
        verify(dbOrchestrator, never()).ensureDatabase(any(), any(), eq("geo-query"), anyBoolean());
        verify(dbOrchestrator).importSqlFile(eq(MYSQL), any(), eq("imdb"), any());
    }

    @Test
    void shouldReportUnknownInvalidNameAsMissingSource() {
        BootstrapReport report = driver.run(
                new BootstrapRequest(List.of("mysql"), List.of("bad name"), null, null, null));

        assertEquals(List.of(PairStatus.NO_SOURCE), statuses(report));
        verifyNoInteractions(dbOrchestrator);
    }

    private void stageAll() {
        when(assetResolver.resolve(anyString(), anyBoolean())).thenAnswer(invocation ->
                Optional.of(Path.of("staged-sql", invocation.getArgument(0) + ".sql")));
    }

    private static List<String> pairs(BootstrapReport report) {
        return report.outcomes().stream()
                .map(outcome -> outcome.engine() + ":" + outcome.dataset())
                .collect(Collectors.toList());
    }

    private static List<PairStatus> statuses(BootstrapReport report) {
        return report.outcomes().stream().map(PairOutcome::status).collect(Collectors.toList());
    }
}
