package com.sqlstage.sqlstage.bootstrap;

import com.sqlstage.sqlstage.bootstrap.BootstrapModels.BootstrapReport;
import com.sqlstage.sqlstage.bootstrap.BootstrapModels.PairOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one bootstrap with the configured defaults at startup when {@code sqlstage.bootstrap.run-on-startup=true}.
 */
@Component
@ConditionalOnProperty(prefix = "sqlstage.bootstrap", name = "run-on-startup", havingValue = "true")
public class BootstrapRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BootstrapRunner.class);

    private final BootstrapDriver bootstrapDriver;

    public BootstrapRunner(BootstrapDriver bootstrapDriver) {
        this.bootstrapDriver = bootstrapDriver;
    }

    @Override
    public void run(ApplicationArguments args) {
        BootstrapReport report = bootstrapDriver.run(null);
        for (PairOutcome outcome : report.outcomes()) {
            log.info("{}:{} -> {}{}", outcome.engine(), outcome.dataset(), outcome.status(),
                    outcome.message() == null ? "" : " (" + outcome.message() + ")");
        }
        if (report.count(PairStatus.IMPORT_FAILED) > 0) {
            log.error("At least one import failed; see the log above");
        }
    }
}
