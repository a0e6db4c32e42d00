package org.learningjava.gaugeledger.domain.model.run;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One benchmark invocation across a set of tasks and variants.
 *
 * @param runId           unique run identifier, usually the epoch-millis timestamp of the invocation
 * @param executedAt      when the run was executed (kept at millisecond precision)
 * @param configHash      fingerprint of the full experiment configuration
 * @param taskSetHash     fingerprint of the task corpus alone
 * @param passRate1       share of results that passed on the first attempt (0-1)
 * @param passRate2       share of results that passed by the second attempt (0-1)
 * @param overallPassRate share of results that passed at all (0-1)
 * @param averageScore    mean final score (0-100)
 * @param metadata        free-form JSON-like bag, never null
 */
public record RunRecord(
        String runId,
        Instant executedAt,
        String configHash,
        String taskSetHash,
        int totalTasks,
        int totalModels,
        double totalCost,
        long totalTokens,
        long totalDurationMs,
        double passRate1,
        double passRate2,
        double overallPassRate,
        double averageScore,
        Map<String, Object> metadata
) {
    public RunRecord {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(executedAt, "executedAt");
        Objects.requireNonNull(configHash, "configHash");
        Objects.requireNonNull(taskSetHash, "taskSetHash");
        executedAt = executedAt.truncatedTo(ChronoUnit.MILLIS);
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public RunRecord withMetadata(Map<String, Object> newMetadata) {
        return new RunRecord(runId, executedAt, configHash, taskSetHash, totalTasks, totalModels, totalCost,
                totalTokens, totalDurationMs, passRate1, passRate2, overallPassRate, averageScore, newMetadata);
    }
}
