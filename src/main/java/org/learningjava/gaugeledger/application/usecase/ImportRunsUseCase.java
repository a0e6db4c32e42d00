package org.learningjava.gaugeledger.application.usecase;

import org.learningjava.gaugeledger.application.port.RunExportReaderPort;
import org.learningjava.gaugeledger.application.port.StatsStoragePort;
import org.learningjava.gaugeledger.application.port.StorageConflictException;
import org.learningjava.gaugeledger.domain.model.fingerprint.ConfigHashInput;
import org.learningjava.gaugeledger.domain.model.fingerprint.TaskManifestHash;
import org.learningjava.gaugeledger.domain.model.run.AttemptRecord;
import org.learningjava.gaugeledger.domain.model.run.ResultRecord;
import org.learningjava.gaugeledger.domain.model.run.RunExport;
import org.learningjava.gaugeledger.domain.model.run.RunRecord;
import org.learningjava.gaugeledger.domain.service.hashing.ConfigFingerprinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Loads historical result files into storage. Importing the same file twice stores it once: the
 * run id comes from the file name and an existing run is skipped.
 */
@Service
public class ImportRunsUseCase {

    private static final Logger log = LoggerFactory.getLogger(ImportRunsUseCase.class);

    private final StatsStoragePort storage;
    private final RunExportReaderPort reader;
    private final Clock clock;

    public ImportRunsUseCase(StatsStoragePort storage, RunExportReaderPort reader, Clock clock) {
        this.storage = storage;
        this.reader = reader;
        this.clock = clock;
    }

    public record ImportReport(int imported, int skipped, List<ImportError> errors) {
        public ImportReport {
            errors = List.copyOf(errors);
        }
    }

    public record ImportError(String file, String error) {
    }

    /** @return true when the file was stored, false when its run already existed */
    public boolean importFile(Path file) {
        String runId = reader.runIdFor(file);
        if (storage.hasRun(runId)) {
            log.debug("Run {} already imported, skipping {}", runId, file);
            return false;
        }

        RunExport export = reader.read(file, runId);
        RunRecord run = toRunRecord(export);
        try {
            storage.persistRunWithResults(run, export.results());
        } catch (StorageConflictException e) {
            log.info("Run {} from {} was stored concurrently, skipping", runId, file);
            return false;
        }
        log.info("Imported run {} ({} results) from {}", runId, export.results().size(), file.getFileName());
        return true;
    }

    /**
     * Imports every export file in {@code dir}, oldest first. A file that fails is reported and the
     * rest are still imported.
     */
    public ImportReport importDirectory(Path dir) {
        List<Path> files = reader.discoverExports(dir);
        if (files.isEmpty()) {
            log.warn("No export files found in {}", dir);
        }

        int imported = 0;
        int skipped = 0;
        List<ImportError> errors = new ArrayList<>();
        for (Path file : files) {
            try {
                if (importFile(file)) {
                    imported++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to import {}: {}", file, e.getMessage());
                errors.add(new ImportError(file.toString(), e.getMessage()));
            }
        }

        log.info("Import of {} finished: {} imported, {} skipped, {} errors", dir, imported, skipped, errors.size());
        return new ImportReport(imported, skipped, errors);
    }

    RunRecord toRunRecord(RunExport export) {
        List<ResultRecord> results = export.results();
        RunExport.Stats stats = export.stats();

        List<TaskManifestHash> tasks = results.stream()
                .map(ResultRecord::taskId)
                .distinct()
                .sorted()
                .map(id -> new TaskManifestHash(id, id))
                .toList();

        Map<String, Map<String, Object>> variants = new TreeMap<>();
        int attemptLimit = 0;
        for (ResultRecord r : results) {
            variants.putIfAbsent(r.variantId(), r.variantConfig());
            for (AttemptRecord a : r.attempts()) {
                attemptLimit = Math.max(attemptLimit, a.attemptNumber());
            }
        }

        String taskSetHash = ConfigFingerprinter.taskSetHash(tasks);
        String configHash = ConfigFingerprinter.configHash(new ConfigHashInput(
                tasks,
                variants.entrySet().stream()
                        .map(e -> new ConfigHashInput.VariantConfig(e.getKey(), e.getValue()))
                        .toList(),
                new ConfigHashInput.Execution(attemptLimit, null, null)));

        double passRate1;
        double passRate2;
        double reported1 = stats.passRate1() == null ? 0 : stats.passRate1();
        double reported2 = stats.passRate2() == null ? 0 : stats.passRate2();
        if (reported1 != 0 || reported2 != 0) {
            passRate1 = reported1;
            passRate2 = reported2;
        } else {
            int first = 0;
            int second = 0;
            for (ResultRecord r : results) {
                if (r.passedAttempt() == 1) first++;
                else if (r.passedAttempt() == 2) second++;
            }
            int total = Math.max(results.size(), 1);
            passRate1 = (double) first / total;
            passRate2 = (double) (first + second) / total;
        }

        Map<String, Object> originalStats = new LinkedHashMap<>();
        originalStats.put("perModel", stats.perModelKeys());
        originalStats.put("perTask", stats.perTaskKeys());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("imported", true);
        metadata.put("importedAt", clock.instant().toString());
        metadata.put("sourceFile", export.sourceFile() == null ? null : export.sourceFile().getFileName().toString());
        metadata.put("originalStats", originalStats);

        return new RunRecord(
                export.runId(),
                export.executedAt(),
                configHash,
                taskSetHash,
                tasks.size(),
                variants.size(),
                stats.totalCost(),
                stats.totalTokens(),
                stats.totalDurationMs(),
                passRate1,
                passRate2,
                stats.overallPassRate(),
                stats.averageScore(),
                metadata);
    }
}
