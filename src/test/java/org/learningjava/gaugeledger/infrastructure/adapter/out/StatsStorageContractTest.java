package org.learningjava.gaugeledger.infrastructure.adapter.out;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.gaugeledger.application.port.StatsStoragePort;
import org.learningjava.gaugeledger.application.port.StorageConflictException;
import org.learningjava.gaugeledger.application.port.StorageNotOpenException;
import org.learningjava.gaugeledger.domain.model.analytics.CostBreakdown;
import org.learningjava.gaugeledger.domain.model.analytics.CostGrouping;
import org.learningjava.gaugeledger.domain.model.analytics.ModelComparison;
import org.learningjava.gaugeledger.domain.model.analytics.Regression;
import org.learningjava.gaugeledger.domain.model.analytics.TaskComparisonDetail.Winner;
import org.learningjava.gaugeledger.domain.model.analytics.TaskSetSummary;
import org.learningjava.gaugeledger.domain.model.analytics.TrendPoint;
import org.learningjava.gaugeledger.domain.model.analytics.VariantRunGroup;
import org.learningjava.gaugeledger.domain.model.query.CostQuery;
import org.learningjava.gaugeledger.domain.model.query.RegressionQuery;
import org.learningjava.gaugeledger.domain.model.query.ResultQuery;
import org.learningjava.gaugeledger.domain.model.query.RunQuery;
import org.learningjava.gaugeledger.domain.model.query.TrendQuery;
import org.learningjava.gaugeledger.domain.model.run.AttemptRecord;
import org.learningjava.gaugeledger.domain.model.run.ResultRecord;
import org.learningjava.gaugeledger.domain.model.run.RunRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link StatsStoragePort} backend must share. Subclasses only say how to build a
 * fresh, unopened handle.
 */
public abstract class StatsStorageContractTest {

    protected static final Instant T0 = Instant.parse("2025-10-01T10:00:00Z");

    protected StatsStoragePort storage;

    protected abstract StatsStoragePort createStorage();

    @BeforeEach
    void openStorage() {
        storage = createStorage();
        storage.open();
    }

    @AfterEach
    void closeStorage() {
        storage.close();
    }

    // ---------- lifecycle ----------

    @Test
    void operationsBeforeOpen_throwNotOpen() {
        StatsStoragePort fresh = createStorage();
        assertFalse(fresh.isOpen());
        assertThrows(StorageNotOpenException.class, () -> fresh.getRun("r1"));
        assertThrows(StorageNotOpenException.class, () -> fresh.persistRun(run("r1", T0, "ts")));
        assertThrows(StorageNotOpenException.class, () -> fresh.listRuns(RunQuery.all()));
        assertThrows(StorageNotOpenException.class, fresh::getVariantIds);
        fresh.close();
    }

    @Test
    void openAndClose_areIdempotent() {
        storage.open();
        assertTrue(storage.isOpen());
        storage.close();
        storage.close();
        assertFalse(storage.isOpen());
        assertThrows(StorageNotOpenException.class, () -> storage.hasRun("r1"));
        storage.open();
        assertTrue(storage.isOpen());
    }

    // ---------- runs ----------

    @Test
    void persistRun_roundTrips() {
        RunRecord r = new RunRecord("r1", Instant.parse("2025-10-01T10:00:00.123Z"), "cfg-hash", "ts-hash",
                3, 2, 1.25, 12000, 90000, 0.5, 0.75, 0.875, 81.5,
                Map.of("imported", true, "sourceFile", "benchmark-results-1.json"));
        storage.persistRun(r);

        assertEquals(r, storage.getRun("r1").orElseThrow());
        assertTrue(storage.hasRun("r1"));
        assertFalse(storage.hasRun("r2"));
        assertTrue(storage.getRun("r2").isEmpty());
    }

    @Test
    void persistRun_rejectsDuplicate_andKeepsOriginal() {
        RunRecord original = run("r1", T0, "ts");
        storage.persistRun(original);

        RunRecord clash = new RunRecord("r1", T0.plusSeconds(60), "other", "other", 9, 9, 9, 9, 9, 1, 1, 1, 99, null);
        assertThrows(StorageConflictException.class, () -> storage.persistRun(clash));
        assertEquals(original, storage.getRun("r1").orElseThrow());
    }

    @Test
    void persistRun_metadataComesBackAsJsonValues() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("perModel", new ArrayList<>(List.of("sonnet", 7L)));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("taskCount", 3L);
        metadata.put("ratio", 0.5f);
        metadata.put("bigCount", 5_000_000_000L);
        metadata.put("originalStats", nested);
        storage.persistRun(run("r1", T0, "ts").withMetadata(metadata));

        Map<String, Object> stored = storage.getRun("r1").orElseThrow().metadata();
        assertEquals(Integer.valueOf(3), stored.get("taskCount"));
        assertEquals(Double.valueOf(0.5), stored.get("ratio"));
        assertEquals(Long.valueOf(5_000_000_000L), stored.get("bigCount"));
        assertEquals(Map.of("perModel", List.of("sonnet", 7)), stored.get("originalStats"));
    }

    @Test
    void persistRun_laterChangesToCallerMaps_doNotReachStoredRun() {
        List<Object> perModel = new ArrayList<>(List.of("sonnet"));
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("perModel", perModel);
        storage.persistRun(run("r1", T0, "ts").withMetadata(Map.of("originalStats", nested)));

        perModel.add("gpt-4o");
        nested.put("perTask", List.of("T1"));

        assertEquals(Map.of("originalStats", Map.of("perModel", List.of("sonnet"))),
                storage.getRun("r1").orElseThrow().metadata());
    }

    @Test
    void listRuns_newestFirst_withFiltersAndPaging() {
        storage.persistRun(run("r1", T0, "ts-a", "cfg-1"));
        storage.persistRun(run("r2", T0.plusSeconds(3600), "ts-a", "cfg-2"));
        storage.persistRun(run("r3", T0.plusSeconds(7200), "ts-b", "cfg-1"));
        storage.persistRun(run("r4", T0.plusSeconds(7200), "ts-b", "cfg-1"));

        assertEquals(List.of("r4", "r3", "r2", "r1"), ids(storage.listRuns(RunQuery.all())));
        assertEquals(List.of("r2", "r1"), ids(storage.listRuns(RunQuery.all().withTaskSetHash("ts-a"))));
        assertEquals(List.of("r4", "r3", "r1"), ids(storage.listRuns(RunQuery.all().withConfigHash("cfg-1"))));
        assertEquals(List.of("r2", "r1"),
                ids(storage.listRuns(RunQuery.all().between(T0, T0.plusSeconds(3600)))));
        assertEquals(List.of("r3", "r2"), ids(storage.listRuns(RunQuery.all().page(2, 1))));
        assertEquals(List.of("r2", "r1"), ids(storage.listRuns(RunQuery.all().page(null, 2))));
        assertEquals(List.of("r4"), ids(storage.listRuns(RunQuery.all().page(1, null))));
    }

    @Test
    void deleteRun_cascadesToResults() {
        storage.persistRunWithResults(run("r1", T0, "ts"), List.of(
                result("T1", "A", 80, true, 0.5).withAttempts(List.of(attempt(1, true)))));
        storage.persistRunWithResults(run("r2", T0.plusSeconds(1), "ts"), List.of(result("T1", "A", 70, true, 0.5)));

        assertTrue(storage.deleteRun("r1"));
        assertFalse(storage.deleteRun("r1"));
        assertTrue(storage.getRun("r1").isEmpty());
        assertTrue(storage.getResults(ResultQuery.forRun("r1")).isEmpty());
        assertEquals(1, storage.getResults(ResultQuery.all()).size());
    }

    // ---------- results ----------

    @Test
    void persistResults_roundTripsAttemptsAndConfig() {
        storage.persistRun(run("r1", T0, "ts"));
        ResultRecord full = new ResultRecord("CG-AL-E001", "anthropic/sonnet@temp=0.2", "sonnet", "anthropic",
                true, 92.5, 2, 3000, 2000, 1000, 0.0625, 45000,
                Map.of("temperature", 0.2, "maxTokens", 4000), "{\"taskId\":\"CG-AL-E001\"}",
                List.of(new AttemptRecord(1, false, 40.0, 1500, 0.03125, 20000, true, false, List.of("test failed")),
                        new AttemptRecord(2, true, 92.5, 1500, 0.03125, 25000, true, true, List.of())));
        ResultRecord bare = result("CG-AL-E002", "openai/gpt-4o", 0, false, 0.01);
        storage.persistResults("r1", List.of(full, bare));

        List<ResultRecord> stored = storage.getResults(ResultQuery.forRun("r1"));
        assertEquals(2, stored.size());
        assertEquals(bare, stored.get(0));
        assertEquals(full, stored.get(1));
    }

    @Test
    void persistRunWithResults_variantConfigComesBackAsJsonValues() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("maxTokens", 4000L);
        config.put("temperature", 0.25f);
        config.put("stop", List.of("END"));
        storage.persistRunWithResults(run("r1", T0, "ts"),
                List.of(result("T1", "A", 80, true, 0.5).withVariantConfig(config)));

        ResultRecord stored = storage.getResults(ResultQuery.forRun("r1")).get(0);
        assertEquals(Map.of("maxTokens", 4000, "temperature", 0.25, "stop", List.of("END")),
                stored.variantConfig());
    }

    @Test
    void persistResults_attemptWithUnknownStages_keepsNulls() {
        storage.persistRun(run("r1", T0, "ts"));
        AttemptRecord a = new AttemptRecord(1, false, 0, 10, 0.001, 5, null, null, List.of("timeout"));
        storage.persistResults("r1", List.of(result("T1", "A", 0, false, 0.001).withAttempts(List.of(a))));

        AttemptRecord back = storage.getResults(ResultQuery.all()).get(0).attempts().get(0);
        assertNull(back.compileSuccess());
        assertNull(back.testSuccess());
        assertEquals(List.of("timeout"), back.failureReasons());
    }

    @Test
    void persistResults_duplicateInBatch_commitsNothing() {
        storage.persistRun(run("r1", T0, "ts"));
        List<ResultRecord> batch = List.of(
                result("T1", "A", 80, true, 0.1),
                result("T2", "A", 80, true, 0.1),
                result("T1", "A", 60, true, 0.1));

        assertThrows(StorageConflictException.class, () -> storage.persistResults("r1", batch));
        assertTrue(storage.getResults(ResultQuery.forRun("r1")).isEmpty());
    }

    @Test
    void persistResults_duplicateAgainstStored_commitsNothing() {
        storage.persistRun(run("r1", T0, "ts"));
        storage.persistResults("r1", List.of(result("T1", "A", 80, true, 0.1)));

        assertThrows(StorageConflictException.class, () -> storage.persistResults("r1",
                List.of(result("T2", "A", 80, true, 0.1), result("T1", "A", 10, false, 0.1))));
        List<ResultRecord> stored = storage.getResults(ResultQuery.forRun("r1"));
        assertEquals(1, stored.size());
        assertEquals(80, stored.get(0).finalScore(), 1e-9);
    }

    @Test
    void persistResults_samePairInAnotherRun_isAllowed() {
        storage.persistRunWithResults(run("r1", T0, "ts"), List.of(result("T1", "A", 80, true, 0.1)));
        storage.persistRunWithResults(run("r2", T0.plusSeconds(1), "ts"), List.of(result("T1", "A", 85, true, 0.1)));
        assertEquals(2, storage.getResults(ResultQuery.all().withTaskId("T1")).size());
    }

    @Test
    void persistResults_unknownRun_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> storage.persistResults("nope", List.of(result("T1", "A", 80, true, 0.1))));
    }

    @Test
    void persistRunWithResults_conflictLeavesNothingBehind() {
        RunRecord r = run("r1", T0, "ts");
        assertThrows(StorageConflictException.class, () -> storage.persistRunWithResults(r,
                List.of(result("T1", "A", 1, true, 0.1), result("T1", "A", 2, true, 0.1))));
        assertFalse(storage.hasRun("r1"));
        assertTrue(storage.getResults(ResultQuery.all()).isEmpty());
    }

    @Test
    void getResults_filtersAndReturnsNewestCreatedFirst() {
        storage.persistRunWithResults(run("r1", T0, "ts"), List.of(
                result("T1", "A", 80, true, 0.1),
                result("T2", "A", 0, false, 0.1),
                result("T1", "B", 50, true, 0.1, "openai")));
        storage.persistRunWithResults(run("r2", T0.minusSeconds(60), "ts"), List.of(
                result("T1", "A", 90, true, 0.1)));

        List<ResultRecord> a = storage.getResults(ResultQuery.all().withVariantId("A"));
        assertEquals(List.of(90.0, 0.0, 80.0), a.stream().map(ResultRecord::finalScore).toList());
        assertEquals(1, storage.getResults(ResultQuery.all().withSuccess(false)).size());
        assertEquals(1, storage.getResults(ResultQuery.all().withProvider("openai")).size());
        assertEquals(2, storage.getResults(ResultQuery.forRun("r1").withTaskId("T1")).size());
        assertEquals(1, storage.getResults(ResultQuery.all().page(1, 1)).size());
        assertEquals(List.of("A", "B"), storage.getVariantIds());
        assertEquals(List.of("T1", "T2"), storage.getTaskIds());
    }

    // ---------- analytics ----------

    @Test
    void modelTrend_onePointPerRun_newestFirst() {
        storage.persistRunWithResults(run("r1", T0, "ts"), List.of(
                result("T1", "A", 80, true, 0.25),
                result("T2", "A", 40, false, 0.25),
                result("T1", "B", 10, false, 1.0)));
        storage.persistRunWithResults(run("r2", T0.plusSeconds(3600), "ts"), List.of(
                result("T1", "A", 100, true, 0.5)));
        storage.persistRunWithResults(run("r3", T0.plusSeconds(7200), "ts"), List.of(
                result("T1", "B", 20, false, 1.0)));

        List<TrendPoint> trend = storage.getModelTrend("A", TrendQuery.all());
        assertEquals(2, trend.size());
        TrendPoint newest = trend.get(0);
        assertEquals("r2", newest.runId());
        assertEquals(T0.plusSeconds(3600), newest.executedAt());
        TrendPoint older = trend.get(1);
        assertEquals(1, older.passed());
        assertEquals(2, older.total());
        assertEquals(60.0, older.avgScore(), 1e-9);
        assertEquals(0.5, older.cost(), 1e-9);

        assertEquals(List.of("r2"), storage.getModelTrend("A", new TrendQuery(null, T0.plusSeconds(1), null))
                .stream().map(TrendPoint::runId).toList());
        assertEquals(1, storage.getModelTrend("A", new TrendQuery(null, null, 1)).size());
        TrendPoint onlyT2 = storage.getModelTrend("A", new TrendQuery("T2", null, null)).get(0);
        assertEquals(0, onlyT2.passed());
        assertEquals(1, onlyT2.total());
        assertTrue(storage.getModelTrend("unknown", TrendQuery.all()).isEmpty());
    }

    @Test
    void compareModels_excludesTasksMissingOnOneSide_butCountsTheirCost() {
        storage.persistRunWithResults(run("r1", T0, "ts"), List.of(
                result("T1", "A", 90, true, 1.0),
                result("T2", "A", 85, true, 2.0),
                result("T3", "A", 70, true, 4.0),
                result("T1", "B", 80, true, 0.5),
                result("T3", "B", 95, true, 0.25)));

        ModelComparison c = storage.compareModels("A", "B");
        assertEquals(2, c.perTask().size());
        assertEquals("T1", c.perTask().get(0).taskId());
        assertEquals(Winner.VARIANT1, c.perTask().get(0).winner());
        assertEquals("T3", c.perTask().get(1).taskId());
        assertEquals(Winner.VARIANT2, c.perTask().get(1).winner());
        assertEquals(1, c.variant1Wins());
        assertEquals(1, c.variant2Wins());
        assertEquals(0, c.ties());
        assertEquals(80.0, c.variant1AvgScore(), 1e-9);
        assertEquals(87.5, c.variant2AvgScore(), 1e-9);
        assertEquals(7.0, c.variant1Cost(), 1e-9);
        assertEquals(0.75, c.variant2Cost(), 1e-9);
    }

    @Test
    void compareModels_usesLatestCreatedResult_andCountsTies() {
        storage.persistRunWithResults(run("r1", T0.plusSeconds(100), "ts"), List.of(
                result("T1", "A", 50, true, 0.1),
                result("T1", "B", 70, true, 0.1)));
        // created later, even though executedAt is earlier
        storage.persistRunWithResults(run("r2", T0, "ts"), List.of(
                result("T1", "A", 70, true, 0.1)));

        ModelComparison c = storage.compareModels("A", "B");
        assertEquals(1, c.perTask().size());
        assertEquals(70.0, c.perTask().get(0).variant1Score(), 1e-9);
        assertEquals(Winner.TIE, c.perTask().get(0).winner());
        assertEquals(1, c.ties());
    }

    @Test
    void compareModels_withNothingInCommon_hasZeroAverages() {
        storage.persistRunWithResults(run("r1", T0, "ts"), List.of(
                result("T1", "A", 50, true, 0.5),
                result("T2", "B", 70, true, 0.25)));

        ModelComparison c = storage.compareModels("A", "B");
        assertTrue(c.perTask().isEmpty());
        assertEquals(0.0, c.variant1AvgScore(), 1e-9);
        assertEquals(0.5, c.variant1Cost(), 1e-9);
        assertEquals(0.25, c.variant2Cost(), 1e-9);
    }

    @Test
    void detectRegressions_flagsDropBeyondThreshold() {
        storage.persistRunWithResults(run("old", T0, "ts"), List.of(
                result("T1", "A", 80, true, 0.1),
                result("T2", "A", 50, true, 0.1)));
        storage.persistRunWithResults(run("new", T0.plusSeconds(60), "ts"), List.of(
                result("T1", "A", 60, true, 0.1),
                result("T2", "A", 50, true, 0.1)));

        List<Regression> flagged = storage.detectRegressions(new RegressionQuery(0.2, 1, 1, null));
        assertEquals(1, flagged.size());
        Regression r = flagged.get(0);
        assertEquals("T1", r.taskId());
        assertEquals("A", r.variantId());
        assertEquals(80.0, r.baselineScore(), 1e-9);
        assertEquals(60.0, r.currentScore(), 1e-9);
        assertEquals(-25.0, r.changePct(), 1e-9);

        assertTrue(storage.detectRegressions(new RegressionQuery(0.3, 1, 1, null)).isEmpty());
    }

    @Test
    void detectRegressions_windowsAverageOverRuns_andSkipZeroBaseline() {
        // baseline: b1, b2; recent: n1, n2
        storage.persistRunWithResults(run("b1", T0, "ts"), List.of(
                result("T1", "A", 100, true, 0.1), result("T2", "A", 0, false, 0.1), result("T1", "B", 90, true, 0.1)));
        storage.persistRunWithResults(run("b2", T0.plusSeconds(10), "ts"), List.of(
                result("T1", "A", 80, true, 0.1), result("T2", "A", 0, false, 0.1), result("T1", "B", 90, true, 0.1)));
        storage.persistRunWithResults(run("n1", T0.plusSeconds(20), "ts"), List.of(
                result("T1", "A", 50, true, 0.1), result("T2", "A", 0, false, 0.1), result("T1", "B", 45, true, 0.1)));
        storage.persistRunWithResults(run("n2", T0.plusSeconds(30), "ts"), List.of(
                result("T1", "A", 40, true, 0.1), result("T2", "A", 0, false, 0.1), result("T1", "B", 45, true, 0.1)));

        List<Regression> all = storage.detectRegressions(new RegressionQuery(0.05, 2, 2, null));
        assertEquals(2, all.size());
        // B: 90 -> 45 (-50%), A: 90 -> 45 (-50%); ties broken by task then variant
        assertEquals("A", all.get(0).variantId());
        assertEquals(-50.0, all.get(0).changePct(), 1e-9);
        assertEquals("B", all.get(1).variantId());

        List<Regression> onlyB = storage.detectRegressions(new RegressionQuery(0.05, 2, 2, "B"));
        assertEquals(1, onlyB.size());
        assertEquals("B", onlyB.get(0).variantId());
    }

    @Test
    void detectRegressions_ordersMostSevereFirst() {
        storage.persistRunWithResults(run("old", T0, "ts"), List.of(
                result("T1", "A", 100, true, 0.1), result("T2", "A", 100, true, 0.1)));
        storage.persistRunWithResults(run("new", T0.plusSeconds(60), "ts"), List.of(
                result("T1", "A", 75, true, 0.1), result("T2", "A", 25, true, 0.1)));

        List<Regression> r = storage.detectRegressions(new RegressionQuery(0.1, 1, 1, null));
        assertEquals(List.of("T2", "T1"), r.stream().map(Regression::taskId).toList());
    }

    @Test
    void costBreakdown_groupsByModelTaskDayAndWeek() {
        // 2023-01-01 is a Sunday (week 00), 2024-01-01 a Monday (week 01)
        storage.persistRunWithResults(run("r1", Instant.parse("2023-01-01T12:00:00Z"), "ts"), List.of(
                result("T1", "A", 80, true, 1.0),
                result("T2", "A", 0, false, 3.0),
                result("T1", "B", 0, false, 0.5)));
        storage.persistRunWithResults(run("r2", Instant.parse("2024-01-01T08:00:00Z"), "ts"), List.of(
                result("T1", "A", 90, true, 2.0)));

        List<CostBreakdown> byModel = storage.getCostBreakdown(CostQuery.by(CostGrouping.MODEL));
        assertEquals(List.of("A", "B"), byModel.stream().map(CostBreakdown::groupKey).toList());
        CostBreakdown a = byModel.get(0);
        assertEquals(6.0, a.totalCost(), 1e-9);
        assertEquals(3, a.executionCount());
        assertEquals(2.0, a.avgCostPerExecution(), 1e-9);
        assertEquals(3.0, a.costPerSuccess(), 1e-9);
        assertEquals(300L, a.totalTokens());
        assertNull(byModel.get(1).costPerSuccess());

        assertEquals(List.of("T1", "T2"), keys(storage.getCostBreakdown(CostQuery.by(CostGrouping.TASK))));
        assertEquals(List.of("2023-01-01", "2024-01-01"), keys(storage.getCostBreakdown(CostQuery.by(CostGrouping.DAY))));
        assertEquals(List.of("2023-00", "2024-01"), keys(storage.getCostBreakdown(CostQuery.by(CostGrouping.WEEK))));

        List<CostBreakdown> recentA = storage.getCostBreakdown(
                new CostQuery(CostGrouping.MODEL, Instant.parse("2023-06-01T00:00:00Z"), "A"));
        assertEquals(1, recentA.size());
        assertEquals(2.0, recentA.get(0).totalCost(), 1e-9);
    }

    @Test
    void taskSetSummaries_groupRunsByFingerprint() {
        storage.persistRunWithResults(withRates(run("r1", T0, "ts-a"), 0.5, 60), List.of(
                result("T1", "A", 60, true, 0.1), result("T1", "B", 60, true, 0.1), result("T2", "B", 60, true, 0.1)));
        storage.persistRunWithResults(withRates(run("r2", T0.plusSeconds(100), "ts-a"), 1.0, 90), List.of(
                result("T1", "A", 90, true, 0.1)));
        storage.persistRunWithResults(withRates(run("r3", T0.plusSeconds(50), "ts-b"), 0.25, 30), List.of());

        List<TaskSetSummary> s = storage.getTaskSetSummaries();
        assertEquals(List.of("ts-a", "ts-b"), s.stream().map(TaskSetSummary::taskSetHash).toList());
        TaskSetSummary a = s.get(0);
        assertEquals(T0, a.firstRun());
        assertEquals(T0.plusSeconds(100), a.lastRun());
        assertEquals(2, a.runCount());
        assertEquals(2, a.variantCount());
        assertEquals(0.75, a.avgPassRate(), 1e-9);
        assertEquals(75.0, a.avgScore(), 1e-9);
        assertEquals(0, s.get(1).variantCount());
    }

    @Test
    void runsByVariant_listsRunsThatProducedEachVariant() {
        storage.persistRunWithResults(run("r1", T0, "ts-a"), List.of(
                result("T1", "A", 60, true, 0.1, "zeta"), result("T1", "B", 60, true, 0.1)));
        storage.persistRunWithResults(run("r2", T0.plusSeconds(100), "ts-a"), List.of(
                result("T1", "A", 90, true, 0.1, "alpha")));
        storage.persistRunWithResults(run("r3", T0.plusSeconds(200), "ts-b"), List.of(
                result("T1", "A", 90, true, 0.1)));

        List<VariantRunGroup> groups = storage.getRunsByVariantForTaskSet("ts-a");
        assertEquals(List.of("A", "B"), groups.stream().map(VariantRunGroup::variantId).toList());
        assertEquals(List.of("r2", "r1"), ids(groups.get(0).runs()));
        assertEquals("alpha", groups.get(0).provider());
        assertEquals(List.of("r1"), ids(groups.get(1).runs()));
        assertTrue(storage.getRunsByVariantForTaskSet("unknown").isEmpty());
    }

    // ---------- fixtures ----------

    protected static RunRecord run(String id, Instant at, String taskSetHash) {
        return run(id, at, taskSetHash, "cfg");
    }

    protected static RunRecord run(String id, Instant at, String taskSetHash, String configHash) {
        return new RunRecord(id, at, configHash, taskSetHash, 1, 1, 0.5, 1000, 60000, 0.5, 0.5, 0.5, 50.0, Map.of());
    }

    protected static RunRecord withRates(RunRecord r, double passRate, double score) {
        return new RunRecord(r.runId(), r.executedAt(), r.configHash(), r.taskSetHash(), r.totalTasks(),
                r.totalModels(), r.totalCost(), r.totalTokens(), r.totalDurationMs(), r.passRate1(), r.passRate2(),
                passRate, score, r.metadata());
    }

    protected static ResultRecord result(String task, String variant, double score, boolean success, double cost) {
        return result(task, variant, score, success, cost, "anthropic");
    }

    protected static ResultRecord result(String task, String variant, double score, boolean success, double cost,
                                         String provider) {
        return new ResultRecord(task, variant, "model-" + variant, provider, success, score, success ? 1 : 0,
                100, 60, 40, cost, 1000);
    }

    protected static AttemptRecord attempt(int n, boolean success) {
        return new AttemptRecord(n, success, success ? 100 : 0, 100, 0.01, 1000, true, success, List.of());
    }

    private static List<String> ids(List<RunRecord> runs) {
        return runs.stream().map(RunRecord::runId).toList();
    }

    private static List<String> keys(List<CostBreakdown> rows) {
        return rows.stream().map(CostBreakdown::groupKey).toList();
    }
}
