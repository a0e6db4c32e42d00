package org.learningjava.gaugeledger.domain.model.fingerprint;

import java.util.List;
import java.util.Map;

/**
 * Everything that defines an experiment: which tasks, which variants with which settings,
 * and how they were executed.
 */
public record ConfigHashInput(
        List<TaskManifestHash> tasks,
        List<VariantConfig> variants,
        Execution execution
) {
    public ConfigHashInput {
        tasks = List.copyOf(tasks);
        variants = List.copyOf(variants);
    }

    public record VariantConfig(String variantId, Map<String, Object> config) { }

    /**
     * @param defaultTemperature optional, left out of the hash when null
     * @param defaultMaxTokens   optional, left out of the hash when null
     */
    public record Execution(int attemptLimit, Double defaultTemperature, Integer defaultMaxTokens) { }
}
