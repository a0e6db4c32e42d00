package org.learningjava.gaugeledger.domain.model.run;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one task against one model variant within one run.
 * Unique per (runId, taskId, variantId); the owning run id is supplied by the storage call.
 */
public record ResultRecord(
        String taskId,
        String variantId,          // e.g. "anthropic/claude-opus-4-5@thinking=50000"
        String model,
        String provider,
        boolean success,
        double finalScore,         // 0-100
        int passedAttempt,         // 0 when never passed
        long totalTokens,
        long promptTokens,
        long completionTokens,
        double totalCost,
        long totalDurationMs,
        Map<String, Object> variantConfig,
        String resultJson,         // nullable, raw detail blob
        List<AttemptRecord> attempts
) {
    public ResultRecord {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(variantId, "variantId");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(provider, "provider");
        variantConfig = variantConfig == null || variantConfig.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variantConfig));
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public ResultRecord(String taskId, String variantId, String model, String provider,
                        boolean success, double finalScore, int passedAttempt,
                        long totalTokens, long promptTokens, long completionTokens,
                        double totalCost, long totalDurationMs) {
        this(taskId, variantId, model, provider, success, finalScore, passedAttempt,
                totalTokens, promptTokens, completionTokens, totalCost, totalDurationMs,
                Map.of(), null, List.of());
    }

    public ResultRecord withAttempts(List<AttemptRecord> newAttempts) {
        return new ResultRecord(taskId, variantId, model, provider, success, finalScore, passedAttempt,
                totalTokens, promptTokens, completionTokens, totalCost, totalDurationMs,
                variantConfig, resultJson, newAttempts);
    }

    public ResultRecord withVariantConfig(Map<String, Object> newVariantConfig) {
        return new ResultRecord(taskId, variantId, model, provider, success, finalScore, passedAttempt,
                totalTokens, promptTokens, completionTokens, totalCost, totalDurationMs,
                newVariantConfig, resultJson, attempts);
    }
}
