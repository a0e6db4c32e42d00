package org.learningjava.gaugeledger.application.port;

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

import java.util.List;
import java.util.Optional;

/**
 * Durable ledger of benchmark runs and their results, plus the analytic queries over it.
 * <p>
 * Every implementation has the same observable behaviour. Calling anything but the lifecycle
 * methods before {@link #open()} throws {@link StorageNotOpenException}; uniqueness violations throw
 * {@link StorageConflictException}; lookups of unknown ids return empty values. Handles are not
 * thread-safe: callers serialize access to one handle.
 */
public interface StatsStoragePort extends AutoCloseable {

    // Lifecycle

    /** Opens the backend and creates or migrates the schema. Calling it on an open handle does nothing. */
    void open();

    @Override
    void close();

    boolean isOpen();

    // Runs

    /** @throws StorageConflictException if a run with the same id exists */
    void persistRun(RunRecord run);

    Optional<RunRecord> getRun(String runId);

    /** Newest first. */
    List<RunRecord> listRuns(RunQuery query);

    boolean hasRun(String runId);

    /** Deletes the run with its results and attempts; false when there was nothing to delete. */
    boolean deleteRun(String runId);

    // Results

    /**
     * Stores all results of a run or none of them.
     *
     * @throws StorageConflictException if a (task, variant) pair repeats within the batch or is already stored
     * @throws IllegalArgumentException if the run does not exist
     */
    void persistResults(String runId, List<ResultRecord> results);

    /** Stores a run and its results as one unit of work. */
    void persistRunWithResults(RunRecord run, List<ResultRecord> results);

    /** Newest-created first. */
    List<ResultRecord> getResults(ResultQuery query);

    List<String> getVariantIds();

    List<String> getTaskIds();

    // Analytics

    /** One point per run that has results for the variant, newest first. */
    List<TrendPoint> getModelTrend(String variantId, TrendQuery query);

    ModelComparison compareModels(String variant1, String variant2);

    /** Most severe first. */
    List<Regression> detectRegressions(RegressionQuery query);

    /** Most expensive group first. */
    List<CostBreakdown> getCostBreakdown(CostQuery query);

    // Task sets

    /** Ordered by last run, newest first. */
    List<TaskSetSummary> getTaskSetSummaries();

    /** Ordered by variant id. */
    List<VariantRunGroup> getRunsByVariantForTaskSet(String taskSetHash);
}
