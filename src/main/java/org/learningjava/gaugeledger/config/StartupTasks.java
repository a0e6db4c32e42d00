package org.learningjava.gaugeledger.config;

import org.learningjava.gaugeledger.application.usecase.ImportRunsUseCase;
import org.learningjava.gaugeledger.application.usecase.ImportRunsUseCase.ImportReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class StartupTasks implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupTasks.class);

    private final ImportRunsUseCase importer;
    private final ImportProperties props;

    public StartupTasks(ImportRunsUseCase importer, ImportProperties props) {
        this.importer = importer;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!props.isOnStartup()) {
            log.debug("Startup import disabled (gaugeledger.import.on-startup=false)");
            return;
        }
        String dir = props.getResultsDir();
        if (dir == null || dir.isBlank()) {
            log.warn("Startup import enabled but gaugeledger.import.results-dir is empty");
            return;
        }

        log.info("=== Startup import from {} BEGIN ===", dir);
        try {
            ImportReport report = importer.importDirectory(Path.of(dir));
            report.errors().forEach(e -> log.warn("  {}: {}", e.file(), e.error()));
            log.info("=== Startup import END: {} imported, {} skipped, {} errors ===",
                    report.imported(), report.skipped(), report.errors().size());
        } catch (RuntimeException e) {
            log.error("Startup import from {} failed", dir, e);
        }
    }
}
