package org.learningjava.gaugeledger.domain.model.run;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A historical results file, parsed: the per-task results as they will be stored plus the
 * aggregate statistics the file carried.
 */
public record RunExport(
        String runId,
        Instant executedAt,
        Path sourceFile,
        List<ResultRecord> results,
        Stats stats
) {
    public RunExport {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(executedAt, "executedAt");
        results = List.copyOf(results);
        Objects.requireNonNull(stats, "stats");
    }

    /**
     * Aggregates as written by the exporting tool. {@code passRate1} and {@code passRate2} are null
     * when the file predates them.
     */
    public record Stats(
            long totalTokens,
            double totalCost,
            long totalDurationMs,
            double overallPassRate,
            double averageScore,
            Double passRate1,
            Double passRate2,
            List<String> perModelKeys,
            List<String> perTaskKeys
    ) {
        public Stats {
            perModelKeys = List.copyOf(perModelKeys);
            perTaskKeys = List.copyOf(perTaskKeys);
        }
    }
}
