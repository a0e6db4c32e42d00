package org.learningjava.gaugeledger.domain.service.hashing;

import org.learningjava.gaugeledger.domain.model.fingerprint.ConfigHashInput;
import org.learningjava.gaugeledger.domain.model.fingerprint.TaskManifestHash;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keys that group runs. The config hash covers tasks, variants and execution parameters and is kept
 * at full length; the task-set hash covers tasks only and is shortened for display.
 * Two runs can share a task-set hash while differing in config hash.
 */
public final class ConfigFingerprinter {

    private ConfigFingerprinter() {
    }

    public static String configHash(ConfigHashInput input) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("tasks", taskEntries(input.tasks()));
        normalized.put("variants", input.variants().stream()
                .sorted(Comparator.comparing(ConfigHashInput.VariantConfig::variantId))
                .map(v -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("id", v.variantId());
                    entry.put("config", v.config() == null ? Map.of() : v.config());
                    return entry;
                })
                .toList());

        Map<String, Object> execution = new LinkedHashMap<>();
        execution.put("attemptLimit", input.execution().attemptLimit());
        if (input.execution().defaultTemperature() != null) {
            execution.put("temperature", input.execution().defaultTemperature());
        }
        if (input.execution().defaultMaxTokens() != null) {
            execution.put("maxTokens", input.execution().defaultMaxTokens());
        }
        normalized.put("execution", execution);

        return ContentHasher.hashCanonical(normalized);
    }

    public static String taskSetHash(List<TaskManifestHash> tasks) {
        return ContentHasher.shortHashCanonical(taskEntries(tasks));
    }

    private static List<Map<String, Object>> taskEntries(List<TaskManifestHash> tasks) {
        return tasks.stream()
                .sorted(Comparator.comparing(TaskManifestHash::id))
                .map(t -> Map.<String, Object>of("id", t.id(), "hash", t.contentHash()))
                .toList();
    }
}
