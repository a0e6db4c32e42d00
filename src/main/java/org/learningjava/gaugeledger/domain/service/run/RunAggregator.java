package org.learningjava.gaugeledger.domain.service.run;

import org.learningjava.gaugeledger.domain.model.run.ResultRecord;

import java.util.List;
import java.util.Objects;

/** Computes the run-level totals stored on a {@code RunRecord} from its results. */
public final class RunAggregator {

    private RunAggregator() {
    }

    public record RunTotals(
            int totalTasks,
            int totalModels,
            double totalCost,
            long totalTokens,
            long totalDurationMs,
            double passRate1,
            double passRate2,
            double overallPassRate,
            double averageScore
    ) {
        public static final RunTotals EMPTY = new RunTotals(0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public static RunTotals summarize(List<ResultRecord> results) {
        Objects.requireNonNull(results, "results");
        if (results.isEmpty()) {
            return RunTotals.EMPTY;
        }
        int n = results.size();
        int firstTry = 0, withinTwo = 0, passed = 0;
        double cost = 0, score = 0;
        long tokens = 0, duration = 0;
        for (ResultRecord r : results) {
            if (r.passedAttempt() == 1) firstTry++;
            if (r.passedAttempt() == 1 || r.passedAttempt() == 2) withinTwo++;
            if (r.success()) passed++;
            cost += r.totalCost();
            score += r.finalScore();
            tokens += r.totalTokens();
            duration += r.totalDurationMs();
        }
        int tasks = (int) results.stream().map(ResultRecord::taskId).distinct().count();
        int models = (int) results.stream().map(ResultRecord::variantId).distinct().count();
        return new RunTotals(tasks, models, cost, tokens, duration,
                (double) firstTry / n, (double) withinTwo / n, (double) passed / n, score / n);
    }
}
