package org.learningjava.gaugeledger.infrastructure.adapter.out.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.gaugeledger.application.port.StatsStoragePort;
import org.learningjava.gaugeledger.application.port.StorageConflictException;
import org.learningjava.gaugeledger.application.port.StorageNotOpenException;
import org.learningjava.gaugeledger.domain.model.analytics.CostBreakdown;
import org.learningjava.gaugeledger.domain.model.analytics.ModelComparison;
import org.learningjava.gaugeledger.domain.model.analytics.Regression;
import org.learningjava.gaugeledger.domain.model.analytics.TaskSetSummary;
import org.learningjava.gaugeledger.domain.model.analytics.TrendPoint;
import org.learningjava.gaugeledger.domain.model.analytics.VariantRunGroup;
import org.learningjava.gaugeledger.domain.model.query.CostQuery;
import org.learningjava.gaugeledger.domain.model.query.RegressionQuery;
import org.learningjava.gaugeledger.domain.model.query.ResultQuery;
import org.learningjava.gaugeledger.domain.model.query.RunQuery;
import org.learningjava.gaugeledger.domain.model.query.TrendQuery;
import org.learningjava.gaugeledger.domain.model.run.ResultRecord;
import org.learningjava.gaugeledger.domain.model.run.RunRecord;
import org.learningjava.gaugeledger.domain.service.analytics.ResultRow;
import org.learningjava.gaugeledger.domain.service.analytics.StatsAnalytics;
import org.learningjava.gaugeledger.infrastructure.adapter.out.JsonValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Volatile backend for tests and throwaway sessions. Data survives {@link #close()} and a later
 * {@link #open()} of the same instance, but not the instance itself.
 */
public class InMemoryStatsStorageAdapter implements StatsStoragePort {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStatsStorageAdapter.class);

    private final Map<String, RunRecord> runs = new LinkedHashMap<>();
    private final List<ResultRow> results = new ArrayList<>();
    private final ObjectMapper om;
    private long sequence;
    private boolean open;

    public InMemoryStatsStorageAdapter() {
        this(new ObjectMapper());
    }

    public InMemoryStatsStorageAdapter(ObjectMapper om) {
        this.om = om;
    }

    @Override
    public void open() {
        if (!open) {
            open = true;
            log.debug("In-memory stats storage opened");
        }
    }

    @Override
    public void close() {
        open = false;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void persistRun(RunRecord run) {
        requireOpen();
        Objects.requireNonNull(run, "run");
        if (runs.containsKey(run.runId())) {
            throw StorageConflictException.duplicateRun(run.runId());
        }
        runs.put(run.runId(), stored(run));
    }

    @Override
    public Optional<RunRecord> getRun(String runId) {
        requireOpen();
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<RunRecord> listRuns(RunQuery query) {
        requireOpen();
        Stream<RunRecord> s = runs.values().stream()
                .filter(r -> query.configHash() == null || query.configHash().equals(r.configHash()))
                .filter(r -> query.taskSetHash() == null || query.taskSetHash().equals(r.taskSetHash()))
                .filter(r -> query.since() == null || !r.executedAt().isBefore(query.since()))
                .filter(r -> query.until() == null || !r.executedAt().isAfter(query.until()))
                .sorted(StatsAnalytics.NEWEST_FIRST);
        return page(s, query.limit(), query.offset());
    }

    @Override
    public boolean hasRun(String runId) {
        requireOpen();
        return runs.containsKey(runId);
    }

    @Override
    public boolean deleteRun(String runId) {
        requireOpen();
        if (runs.remove(runId) == null) {
            return false;
        }
        results.removeIf(r -> r.runId().equals(runId));
        return true;
    }

    @Override
    public void persistResults(String runId, List<ResultRecord> batch) {
        requireOpen();
        if (!runs.containsKey(runId)) {
            throw new IllegalArgumentException("Unknown run: " + runId);
        }
        checkNoDuplicates(runId, batch);
        append(runId, stored(batch));
    }

    @Override
    public void persistRunWithResults(RunRecord run, List<ResultRecord> batch) {
        requireOpen();
        if (runs.containsKey(run.runId())) {
            throw StorageConflictException.duplicateRun(run.runId());
        }
        checkNoDuplicates(run.runId(), batch);
        RunRecord storedRun = stored(run);
        List<ResultRecord> storedBatch = stored(batch);
        runs.put(run.runId(), storedRun);
        append(run.runId(), storedBatch);
    }

    private void append(String runId, List<ResultRecord> batch) {
        for (ResultRecord r : batch) {
            results.add(new ResultRow(++sequence, runId, r));
        }
        log.debug("Stored {} results for run {}", batch.size(), runId);
    }

    // Same value types the SQLite backend reads back from its JSON columns.
    private RunRecord stored(RunRecord run) {
        return run.withMetadata(JsonValues.normalize(om, run.metadata()));
    }

    private List<ResultRecord> stored(List<ResultRecord> batch) {
        List<ResultRecord> copies = new ArrayList<>(batch.size());
        for (ResultRecord r : batch) {
            copies.add(r.withVariantConfig(JsonValues.normalize(om, r.variantConfig())));
        }
        return copies;
    }

    @Override
    public List<ResultRecord> getResults(ResultQuery query) {
        requireOpen();
        Stream<ResultRecord> s = results.stream()
                .filter(r -> query.runId() == null || query.runId().equals(r.runId()))
                .sorted(Comparator.comparingLong(ResultRow::sequence).reversed())
                .map(ResultRow::result)
                .filter(r -> query.taskId() == null || query.taskId().equals(r.taskId()))
                .filter(r -> query.variantId() == null || query.variantId().equals(r.variantId()))
                .filter(r -> query.provider() == null || query.provider().equals(r.provider()))
                .filter(r -> query.success() == null || query.success() == r.success());
        return page(s, query.limit(), query.offset());
    }

    @Override
    public List<String> getVariantIds() {
        requireOpen();
        return results.stream().map(r -> r.result().variantId()).distinct().sorted().toList();
    }

    @Override
    public List<String> getTaskIds() {
        requireOpen();
        return results.stream().map(r -> r.result().taskId()).distinct().sorted().toList();
    }

    @Override
    public List<TrendPoint> getModelTrend(String variantId, TrendQuery query) {
        requireOpen();
        return StatsAnalytics.trend(runs.values(), results, variantId, query);
    }

    @Override
    public ModelComparison compareModels(String variant1, String variant2) {
        requireOpen();
        return StatsAnalytics.compare(results, variant1, variant2);
    }

    @Override
    public List<Regression> detectRegressions(RegressionQuery query) {
        requireOpen();
        return StatsAnalytics.regressions(runs.values(), results, query);
    }

    @Override
    public List<CostBreakdown> getCostBreakdown(CostQuery query) {
        requireOpen();
        return StatsAnalytics.costBreakdown(runs.values(), results, query);
    }

    @Override
    public List<TaskSetSummary> getTaskSetSummaries() {
        requireOpen();
        return StatsAnalytics.taskSetSummaries(runs.values(), results);
    }

    @Override
    public List<VariantRunGroup> getRunsByVariantForTaskSet(String taskSetHash) {
        requireOpen();
        return StatsAnalytics.variantGroups(runs.values(), results, taskSetHash);
    }

    private void checkNoDuplicates(String runId, List<ResultRecord> batch) {
        Set<List<String>> seen = new HashSet<>();
        for (ResultRow row : results) {
            if (row.runId().equals(runId)) {
                seen.add(List.of(row.result().taskId(), row.result().variantId()));
            }
        }
        for (ResultRecord r : batch) {
            if (!seen.add(List.of(r.taskId(), r.variantId()))) {
                throw StorageConflictException.duplicateResult(runId, r.taskId(), r.variantId());
            }
        }
    }

    private void requireOpen() {
        if (!open) {
            throw new StorageNotOpenException("In-memory stats storage is not open");
        }
    }

    private static <T> List<T> page(Stream<T> s, Integer limit, Integer offset) {
        if (offset != null && offset > 0) {
            s = s.skip(offset);
        }
        if (limit != null && limit >= 0) {
            s = s.limit(limit);
        }
        return s.toList();
    }
}
