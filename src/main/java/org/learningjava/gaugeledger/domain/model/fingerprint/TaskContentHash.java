package org.learningjava.gaugeledger.domain.model.fingerprint;

import java.util.List;

/**
 * Fingerprint of one task: its manifest plus every fixture file belonging to it.
 *
 * @param fixtureFiles fixture hashes sorted by path
 * @param combinedHash hash over {@code manifestHash} and {@code fixtureFiles}
 */
public record TaskContentHash(
        String taskId,
        Difficulty difficulty,
        String manifestPath,
        String manifestHash,
        List<HashedFile> fixtureFiles,
        String combinedHash
) {
    public TaskContentHash {
        fixtureFiles = List.copyOf(fixtureFiles);
    }
}
