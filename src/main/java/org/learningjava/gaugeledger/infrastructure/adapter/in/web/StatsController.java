package org.learningjava.gaugeledger.infrastructure.adapter.in.web;

import org.learningjava.gaugeledger.application.port.StatsStoragePort;
import org.learningjava.gaugeledger.domain.model.analytics.CostBreakdown;
import org.learningjava.gaugeledger.domain.model.analytics.CostGrouping;
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
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/** Read side of the ledger as JSON. */
@RestController
@RequestMapping("/stats")
public class StatsController {

    private final StatsStoragePort storage;

    public StatsController(StatsStoragePort storage) {
        this.storage = storage;
    }

    @GetMapping("/runs")
    public List<RunRecord> runs(
            @RequestParam(required = false) String configHash,
            @RequestParam(required = false) String taskSetHash,
            @RequestParam(required = false) Instant since,
            @RequestParam(required = false) Instant until,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset
    ) {
        return storage.listRuns(new RunQuery(blankToNull(configHash), blankToNull(taskSetHash),
                since, until, limit, offset));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<RunRecord> run(@PathVariable String runId) {
        return storage.getRun(runId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/runs/{runId}")
    public ResponseEntity<Void> deleteRun(@PathVariable String runId) {
        return storage.deleteRun(runId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/results")
    public List<ResultRecord> results(
            @RequestParam(required = false) String runId,
            @RequestParam(required = false) String taskId,
            @RequestParam(required = false) String variantId,
            @RequestParam(required = false) String provider,
            @RequestParam(required = false) Boolean success,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset
    ) {
        return storage.getResults(new ResultQuery(blankToNull(runId), blankToNull(taskId), blankToNull(variantId),
                blankToNull(provider), success, limit, offset));
    }

    @GetMapping("/variants")
    public List<String> variants() {
        return storage.getVariantIds();
    }

    @GetMapping("/tasks")
    public List<String> tasks() {
        return storage.getTaskIds();
    }

    @GetMapping("/trend/{variantId}")
    public List<TrendPoint> trend(
            @PathVariable String variantId,
            @RequestParam(required = false) String taskId,
            @RequestParam(required = false) Instant since,
            @RequestParam(required = false) Integer limit
    ) {
        return storage.getModelTrend(variantId, new TrendQuery(blankToNull(taskId), since, limit));
    }

    @GetMapping("/compare")
    public ModelComparison compare(@RequestParam String variant1, @RequestParam String variant2) {
        return storage.compareModels(variant1, variant2);
    }

    @GetMapping("/regressions")
    public List<Regression> regressions(
            @RequestParam(defaultValue = "0.05") double threshold,
            @RequestParam(defaultValue = "" + RegressionQuery.DEFAULT_RECENT_WINDOW) int recentWindow,
            @RequestParam(defaultValue = "" + RegressionQuery.DEFAULT_BASELINE_WINDOW) int baselineWindow,
            @RequestParam(required = false) String variantId
    ) {
        return storage.detectRegressions(new RegressionQuery(threshold, recentWindow, baselineWindow,
                blankToNull(variantId)));
    }

    @GetMapping("/cost")
    public List<CostBreakdown> cost(
            @RequestParam(required = false) String groupBy,
            @RequestParam(required = false) Instant since,
            @RequestParam(required = false) String variantId
    ) {
        return storage.getCostBreakdown(new CostQuery(CostGrouping.parse(groupBy), since, blankToNull(variantId)));
    }

    @GetMapping("/task-sets")
    public List<TaskSetSummary> taskSets() {
        return storage.getTaskSetSummaries();
    }

    @GetMapping("/task-sets/{hash}/variants")
    public List<VariantRunGroup> taskSetVariants(@PathVariable String hash) {
        return storage.getRunsByVariantForTaskSet(hash);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
