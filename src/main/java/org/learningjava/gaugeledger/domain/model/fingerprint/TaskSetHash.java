package org.learningjava.gaugeledger.domain.model.fingerprint;

import java.time.Instant;
import java.util.List;

/**
 * Corpus-level fingerprint. Warnings are informational; callers decide whether any of them is fatal.
 *
 * @param descriptorHash hash of the shared project descriptor, or {@link #MISSING} when absent
 * @param tasks          per-task breakdown sorted by task id
 */
public record TaskSetHash(
        String hash,
        String descriptorHash,
        Instant computedAt,
        int taskCount,
        int totalFilesHashed,
        List<TaskContentHash> tasks,
        List<String> missingFiles,
        List<String> warnings
) {
    public static final String MISSING = "missing";

    public TaskSetHash {
        tasks = List.copyOf(tasks);
        missingFiles = List.copyOf(missingFiles);
        warnings = List.copyOf(warnings);
    }

    public boolean hasDescriptor() {
        return !MISSING.equals(descriptorHash);
    }
}
