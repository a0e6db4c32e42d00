package org.learningjava.gaugeledger.domain.service.analytics;

import org.learningjava.gaugeledger.domain.model.analytics.CostBreakdown;
import org.learningjava.gaugeledger.domain.model.analytics.CostGrouping;
import org.learningjava.gaugeledger.domain.model.analytics.ModelComparison;
import org.learningjava.gaugeledger.domain.model.analytics.Regression;
import org.learningjava.gaugeledger.domain.model.analytics.TaskComparisonDetail;
import org.learningjava.gaugeledger.domain.model.analytics.TaskSetSummary;
import org.learningjava.gaugeledger.domain.model.analytics.TrendPoint;
import org.learningjava.gaugeledger.domain.model.analytics.VariantRunGroup;
import org.learningjava.gaugeledger.domain.model.query.CostQuery;
import org.learningjava.gaugeledger.domain.model.query.RegressionQuery;
import org.learningjava.gaugeledger.domain.model.query.TrendQuery;
import org.learningjava.gaugeledger.domain.model.run.ResultRecord;
import org.learningjava.gaugeledger.domain.model.run.RunRecord;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.WeekFields;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Analytic projections computed in process from plain run and result rows. Used by backends that
 * have no query engine of their own; the SQLite backend expresses the same rules in SQL.
 */
public final class StatsAnalytics {

    /** Newest first; equal timestamps fall back to run id, descending. */
    public static final Comparator<RunRecord> NEWEST_FIRST =
            Comparator.comparing(RunRecord::executedAt).thenComparing(RunRecord::runId).reversed();

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final WeekFields MONDAY_WEEKS = WeekFields.of(DayOfWeek.MONDAY, 7);

    private StatsAnalytics() {
    }

    public static List<TrendPoint> trend(Collection<RunRecord> runs, Collection<ResultRow> rows,
                                         String variantId, TrendQuery query) {
        Map<String, RunRecord> byId = index(runs);
        Map<String, List<ResultRecord>> perRun = new HashMap<>();
        for (ResultRow row : rows) {
            ResultRecord r = row.result();
            if (!r.variantId().equals(variantId)) continue;
            if (query.taskId() != null && !query.taskId().equals(r.taskId())) continue;
            RunRecord run = byId.get(row.runId());
            if (run == null) continue;
            if (query.since() != null && run.executedAt().isBefore(query.since())) continue;
            perRun.computeIfAbsent(row.runId(), k -> new ArrayList<>()).add(r);
        }

        List<TrendPoint> points = perRun.entrySet().stream()
                .sorted(Comparator.comparing((Map.Entry<String, List<ResultRecord>> e) -> byId.get(e.getKey()),
                        NEWEST_FIRST))
                .map(e -> {
                    List<ResultRecord> results = e.getValue();
                    int passed = (int) results.stream().filter(ResultRecord::success).count();
                    double avg = results.stream().mapToDouble(ResultRecord::finalScore).average().orElse(0);
                    double cost = results.stream().mapToDouble(ResultRecord::totalCost).sum();
                    return new TrendPoint(e.getKey(), byId.get(e.getKey()).executedAt(), passed, results.size(),
                            avg, cost);
                })
                .toList();
        return limit(points, query.limit());
    }

    public static ModelComparison compare(Collection<ResultRow> rows, String variant1, String variant2) {
        Map<String, ResultRow> latest1 = latestByTask(rows, variant1);
        Map<String, ResultRow> latest2 = latestByTask(rows, variant2);

        List<TaskComparisonDetail> perTask = new ArrayList<>();
        for (Map.Entry<String, ResultRow> e : latest1.entrySet()) {
            ResultRow other = latest2.get(e.getKey());
            if (other == null) continue;
            perTask.add(TaskComparisonDetail.of(e.getKey(),
                    e.getValue().result().finalScore(), other.result().finalScore()));
        }

        return ModelComparison.from(variant1, variant2, perTask,
                totalCost(rows, variant1), totalCost(rows, variant2));
    }

    public static List<Regression> regressions(Collection<RunRecord> runs, Collection<ResultRow> rows,
                                               RegressionQuery query) {
        List<RunRecord> ordered = runs.stream().sorted(NEWEST_FIRST).toList();
        Set<String> recentRuns = runIds(ordered, 0, query.recentWindow());
        Set<String> baselineRuns = runIds(ordered, query.recentWindow(), query.baselineWindow());

        Map<List<String>, double[]> recent = new HashMap<>();
        Map<List<String>, double[]> baseline = new HashMap<>();
        for (ResultRow row : rows) {
            ResultRecord r = row.result();
            if (query.variantId() != null && !query.variantId().equals(r.variantId())) continue;
            List<String> key = List.of(r.taskId(), r.variantId());
            if (recentRuns.contains(row.runId())) accumulate(recent, key, r.finalScore());
            if (baselineRuns.contains(row.runId())) accumulate(baseline, key, r.finalScore());
        }

        List<Regression> out = new ArrayList<>();
        for (Map.Entry<List<String>, double[]> e : recent.entrySet()) {
            double[] base = baseline.get(e.getKey());
            if (base == null) continue;
            double baselineScore = base[0] / base[1];
            double currentScore = e.getValue()[0] / e.getValue()[1];
            if (baselineScore <= 0) continue;
            double change = (currentScore - baselineScore) / baselineScore;
            if (change < -query.threshold()) {
                out.add(new Regression(e.getKey().get(0), e.getKey().get(1), baselineScore, currentScore,
                        change * 100));
            }
        }
        out.sort(Comparator.comparingDouble(Regression::changePct)
                .thenComparing(Regression::taskId)
                .thenComparing(Regression::variantId));
        return out;
    }

    public static List<CostBreakdown> costBreakdown(Collection<RunRecord> runs, Collection<ResultRow> rows,
                                                    CostQuery query) {
        Map<String, RunRecord> byId = index(runs);
        Map<String, List<ResultRecord>> groups = new HashMap<>();
        for (ResultRow row : rows) {
            ResultRecord r = row.result();
            RunRecord run = byId.get(row.runId());
            if (run == null) continue;
            if (query.since() != null && run.executedAt().isBefore(query.since())) continue;
            if (query.variantId() != null && !query.variantId().equals(r.variantId())) continue;
            String key = groupKey(query.groupBy(), r, run.executedAt());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
        }

        return groups.entrySet().stream()
                .map(e -> {
                    List<ResultRecord> results = e.getValue();
                    double cost = results.stream().mapToDouble(ResultRecord::totalCost).sum();
                    long tokens = results.stream().mapToLong(ResultRecord::totalTokens).sum();
                    long successes = results.stream().filter(ResultRecord::success).count();
                    return new CostBreakdown(e.getKey(), cost, tokens, results.size(),
                            cost / results.size(), successes > 0 ? cost / successes : null);
                })
                .sorted(Comparator.comparingDouble(CostBreakdown::totalCost).reversed()
                        .thenComparing(CostBreakdown::groupKey))
                .toList();
    }

    public static List<TaskSetSummary> taskSetSummaries(Collection<RunRecord> runs, Collection<ResultRow> rows) {
        Map<String, String> runToTaskSet = runs.stream()
                .collect(Collectors.toMap(RunRecord::runId, RunRecord::taskSetHash));
        Map<String, Set<String>> variants = new HashMap<>();
        for (ResultRow row : rows) {
            String hash = runToTaskSet.get(row.runId());
            if (hash != null) {
                variants.computeIfAbsent(hash, k -> new HashSet<>()).add(row.result().variantId());
            }
        }

        Map<String, List<RunRecord>> byHash = runs.stream()
                .collect(Collectors.groupingBy(RunRecord::taskSetHash, LinkedHashMap::new, Collectors.toList()));

        return byHash.entrySet().stream()
                .map(e -> {
                    List<RunRecord> group = e.getValue();
                    Instant first = group.stream().map(RunRecord::executedAt).min(Comparator.naturalOrder()).orElseThrow();
                    Instant last = group.stream().map(RunRecord::executedAt).max(Comparator.naturalOrder()).orElseThrow();
                    return new TaskSetSummary(e.getKey(), first, last, group.size(),
                            variants.getOrDefault(e.getKey(), Set.of()).size(),
                            group.stream().mapToDouble(RunRecord::overallPassRate).average().orElse(0),
                            group.stream().mapToDouble(RunRecord::averageScore).average().orElse(0));
                })
                .sorted(Comparator.comparing(TaskSetSummary::lastRun).reversed()
                        .thenComparing(TaskSetSummary::taskSetHash))
                .toList();
    }

    public static List<VariantRunGroup> variantGroups(Collection<RunRecord> runs, Collection<ResultRow> rows,
                                                      String taskSetHash) {
        Map<String, RunRecord> inSet = runs.stream()
                .filter(r -> r.taskSetHash().equals(taskSetHash))
                .collect(Collectors.toMap(RunRecord::runId, Function.identity()));

        Map<String, Set<String>> runsPerVariant = new TreeMap<>();
        Map<String, String> providers = new HashMap<>();
        for (ResultRow row : rows) {
            if (!inSet.containsKey(row.runId())) continue;
            ResultRecord r = row.result();
            runsPerVariant.computeIfAbsent(r.variantId(), k -> new HashSet<>()).add(row.runId());
            providers.merge(r.variantId(), r.provider(), (a, b) -> a.compareTo(b) <= 0 ? a : b);
        }

        List<VariantRunGroup> groups = new ArrayList<>();
        runsPerVariant.forEach((variantId, runIds) -> groups.add(new VariantRunGroup(variantId,
                providers.get(variantId),
                runIds.stream().map(inSet::get).sorted(NEWEST_FIRST).toList())));
        return groups;
    }

    /** Grouping key of a result for a cost breakdown. */
    public static String groupKey(CostGrouping grouping, ResultRecord result, Instant executedAt) {
        return switch (grouping) {
            case MODEL -> result.variantId();
            case TASK -> result.taskId();
            case DAY -> DAY.format(executedAt);
            case WEEK -> weekKey(executedAt);
        };
    }

    /** {@code yyyy-WW} with Monday-based weeks; days before the first Monday of the year are week 00. */
    public static String weekKey(Instant instant) {
        ZonedDateTime t = instant.atZone(ZoneOffset.UTC);
        return String.format("%04d-%02d", t.getYear(), t.get(MONDAY_WEEKS.weekOfYear()));
    }

    private static Map<String, RunRecord> index(Collection<RunRecord> runs) {
        return runs.stream().collect(Collectors.toMap(RunRecord::runId, Function.identity()));
    }

    private static Map<String, ResultRow> latestByTask(Collection<ResultRow> rows, String variantId) {
        Map<String, ResultRow> latest = new TreeMap<>();
        for (ResultRow row : rows) {
            if (!row.result().variantId().equals(variantId)) continue;
            latest.merge(row.result().taskId(), row, (a, b) -> a.sequence() >= b.sequence() ? a : b);
        }
        return latest;
    }

    private static double totalCost(Collection<ResultRow> rows, String variantId) {
        return rows.stream()
                .filter(r -> r.result().variantId().equals(variantId))
                .mapToDouble(r -> r.result().totalCost())
                .sum();
    }

    private static Set<String> runIds(List<RunRecord> ordered, int from, int count) {
        Set<String> ids = new HashSet<>();
        for (int i = from; i < Math.min(ordered.size(), from + count); i++) {
            ids.add(ordered.get(i).runId());
        }
        return ids;
    }

    private static void accumulate(Map<List<String>, double[]> sums, List<String> key, double score) {
        double[] acc = sums.computeIfAbsent(key, k -> new double[2]);
        acc[0] += score;
        acc[1]++;
    }

    private static <T> List<T> limit(List<T> items, Integer limit) {
        if (limit == null || limit < 0 || limit >= items.size()) {
            return items;
        }
        return items.subList(0, limit);
    }
}
