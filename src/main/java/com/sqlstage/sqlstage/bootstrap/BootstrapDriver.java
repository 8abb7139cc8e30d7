package com.sqlstage.sqlstage.bootstrap;

import com.sqlstage.sqlstage.asset.AssetResolutionException;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks every engine/dataset pair: resolve the SQL asset, create the database, import, snapshot.
 * <p>
 * A failed resolution or administrative command only affects its own pair; a resolved dataset whose name is not a
 * usable database name counts as a failed administrative command. A failed import stops the remaining datasets of
 * that engine. Cache failures abort the whole run.
 */
@Service
public class BootstrapDriver {

    private static final Logger log = LoggerFactory.getLogger(BootstrapDriver.class);

    private final AssetResolver assetResolver;
    private final DbOrchestrator dbOrchestrator;
    private final EngineCatalog engineCatalog;
    private final SqlStageProperties.Bootstrap defaults;

    public BootstrapDriver(AssetResolver assetResolver, DbOrchestrator dbOrchestrator, EngineCatalog engineCatalog,
                           SqlStageProperties properties) {
        this.assetResolver = assetResolver;
        this.dbOrchestrator = dbOrchestrator;
        this.engineCatalog = engineCatalog;
        this.defaults = properties.getBootstrap();
    }

    public synchronized BootstrapReport run(BootstrapRequest request) {
        BootstrapRequest effective = request == null ? new BootstrapRequest(null, null, null, null, null) : request;
        List<String> engines = pick(effective.engines(), defaults.getEngines(), engineCatalog.names());
        List<String> datasets = pick(effective.datasets(), defaults.getDatasets(), List.of());
        boolean reset = flag(effective.reset(), defaults.isReset());
        boolean force = flag(effective.forceDownload(), defaults.isForceDownload());
        boolean skipSchemaDump = flag(effective.skipSchemaDump(), defaults.isSkipSchemaDump());

        engines.forEach(engineCatalog::engine);

        log.info("Bootstrap run: engines={}, datasets={}, reset={}, forceDownload={}, skipSchemaDump={}",
                engines, datasets, reset, force, skipSchemaDump);

        List<PairOutcome> outcomes = new ArrayList<>();
        for (String engineName : engines) {
            EngineDefinition engine = engineCatalog.engine(engineName);
            DbCredentials credentials = engineCatalog.credentials(engineName);
            log.info("Engine: {}", engineName);

            boolean importFailed = false;
            for (String dataset : datasets) {
                if (importFailed) {
                    outcomes.add(PairOutcome.of(engineName, dataset, PairStatus.SKIPPED_AFTER_IMPORT_FAILURE,
                            "Not attempted after an import failure on " + engineName));
                    continue;
                }
                PairOutcome outcome = bootstrapPair(engine, credentials, dataset, reset, force, skipSchemaDump);
                outcomes.add(outcome);
                importFailed = outcome.status() == PairStatus.IMPORT_FAILED;
            }
        }

        BootstrapReport report = new BootstrapReport(engines, datasets, reset, force, outcomes);
        log.info("Bootstrap done. imported={}, noSource={}, failed={}",
                report.count(PairStatus.IMPORTED),
                report.count(PairStatus.NO_SOURCE),
                outcomes.size() - report.count(PairStatus.IMPORTED) - report.count(PairStatus.NO_SOURCE));
        return report;
    }

    private PairOutcome bootstrapPair(EngineDefinition engine, DbCredentials credentials, String dataset,
                                      boolean reset, boolean force, boolean skipSchemaDump) {
        log.info("--- Dataset: {} ({}) ---", dataset, engine.name());
        Optional<Path> staged;
        try {
            staged = assetResolver.resolve(dataset, force);
        } catch (AssetResolutionException ex) {
            log.error("Could not resolve SQL for dataset '{}': {}", dataset, ex.getMessage(), ex);
            return PairOutcome.of(engine.name(), dataset, PairStatus.RESOLUTION_FAILED, ex.getMessage());
        }
        if (staged.isEmpty()) {
            return PairOutcome.of(engine.name(), dataset, PairStatus.NO_SOURCE, "No SQL source configured");
        }
        Path sqlFile = staged.get();
        String questions = assetResolver.questionsPath(dataset).map(Path::toString).orElse(null);

        try {
            DbOrchestrator.requireValidName(dataset);
            dbOrchestrator.ensureDatabase(engine, credentials, dataset, reset);
        } catch (IllegalArgumentException | DbAdminException ex) {
            log.error("Could not prepare database {}:{}: {}", engine.name(), dataset, ex.getMessage());
            return new PairOutcome(engine.name(), dataset, PairStatus.DB_ADMIN_FAILED, sqlFile.toString(), questions,
                    null, List.of(), ex.getMessage());
        }

        try {
            dbOrchestrator.importSqlFile(engine, credentials, dataset, sqlFile);
        } catch (ImportFailedException ex) {
            log.error("Import failed for {}:{}; remaining datasets on this engine are skipped. "
                    + "Check the engine logs and SQL syntax compatibility. {}", engine.name(), dataset, ex.getMessage());
            return new PairOutcome(engine.name(), dataset, PairStatus.IMPORT_FAILED, sqlFile.toString(), questions,
                    null, List.of(), ex.getMessage());
        }

        if (skipSchemaDump) {
            return new PairOutcome(engine.name(), dataset, PairStatus.IMPORTED, sqlFile.toString(), questions,
                    null, List.of(), null);
        }
        try {
            SchemaSnapshot snapshot = dbOrchestrator.dumpSchemaSnapshot(engine, credentials, dataset);
            return new PairOutcome(engine.name(), dataset, PairStatus.IMPORTED, sqlFile.toString(), questions,
                    snapshot.path().toString(), snapshot.tableNames(), null);
        } catch (SchemaDumpException ex) {
            log.warn("Schema snapshot failed for {}:{}: {}", engine.name(), dataset, ex.getMessage());
            return new PairOutcome(engine.name(), dataset, PairStatus.IMPORTED, sqlFile.toString(), questions,
                    null, List.of(), ex.getMessage());
        }
    }

    private static List<String> pick(List<String> requested, List<String> configured, List<String> fallback) {
        if (requested != null && !requested.isEmpty()) {
            return List.copyOf(requested);
        }
        if (configured != null && !configured.isEmpty()) {
            return List.copyOf(configured);
        }
        return fallback;
    }

    private static boolean flag(Boolean requested, boolean configured) {
        return requested != null ? requested : configured;
    }
}
