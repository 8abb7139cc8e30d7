package com.sqlstage.sqlstage.bootstrap;

import java.util.List;

public final class BootstrapModels {

    private BootstrapModels() {
    }

    /**
     * Run options; any null field falls back to the configured default.
     */
    public record BootstrapRequest(
            List<String> engines,
            List<String> datasets,
            Boolean reset,
            Boolean forceDownload,
            Boolean skipSchemaDump
    ) {
    }

    public record PairOutcome(
            String engine,
            String dataset,
            PairStatus status,
            String stagedSql,
            String questions,
            String schemaSnapshot,
            List<String> snapshotTables,
            String message
    ) {

        public PairOutcome {
            snapshotTables = snapshotTables == null ? List.of() : List.copyOf(snapshotTables);
        }

        static PairOutcome of(String engine, String dataset, PairStatus status, String message) {
            return new PairOutcome(engine, dataset, status, null, null, null, List.of(), message);
        }
    }

    public record BootstrapReport(
            List<String> engines,
            List<String> datasets,
            boolean reset,
            boolean forceDownload,
            List<PairOutcome> outcomes
    ) {

        public BootstrapReport {
            outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        }

        public long count(PairStatus status) {
            return outcomes.stream().filter(outcome -> outcome.status() == status).count();
        }
    }

    public record SourceSummary(String dataset, String kind, String stagedName, String origin) {
    }
}
