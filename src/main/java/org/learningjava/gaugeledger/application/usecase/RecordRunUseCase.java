package org.learningjava.gaugeledger.application.usecase;

import org.learningjava.gaugeledger.application.port.StatsStoragePort;
import org.learningjava.gaugeledger.domain.model.run.ResultRecord;
import org.learningjava.gaugeledger.domain.model.run.RunRecord;
import org.learningjava.gaugeledger.domain.service.run.RunAggregator;
import org.learningjava.gaugeledger.domain.service.run.RunAggregator.RunTotals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Service
public class RecordRunUseCase {

    private static final Logger log = LoggerFactory.getLogger(RecordRunUseCase.class);

    private final StatsStoragePort storage;
    private final Clock clock;

    public RecordRunUseCase(StatsStoragePort storage, Clock clock) {
        this.storage = storage;
        this.clock = clock;
    }

    /**
     * Records a finished run with all of its results in one unit of work.
     *
     * @param runId       unique id of the run
     * @param executedAt  when the run started; defaults to now
     * @param configHash  fingerprint of tasks, variants and execution settings
     * @param taskSetHash fingerprint of the task corpus
     * @param results     one entry per (task, variant)
     * @param metadata    free-form annotations, may be null
     * @return the stored run with its computed totals
     */
    public RunRecord record(String runId,
                            Instant executedAt,
                            String configHash,
                            String taskSetHash,
                            List<ResultRecord> results,
                            Map<String, Object> metadata) {
        RunTotals t = RunAggregator.summarize(results);
        RunRecord run = new RunRecord(
                runId,
                executedAt == null ? clock.instant() : executedAt,
                configHash,
                taskSetHash,
                t.totalTasks(),
                t.totalModels(),
                t.totalCost(),
                t.totalTokens(),
                t.totalDurationMs(),
                t.passRate1(),
                t.passRate2(),
                t.overallPassRate(),
                t.averageScore(),
                metadata);
        storage.persistRunWithResults(run, results);
        log.info("Recorded run {}: {} tasks x {} variants, pass rate {}", runId, t.totalTasks(), t.totalModels(),
                t.overallPassRate());
        return run;
    }
}
