package org.learningjava.gaugeledger.domain.model.analytics;

import java.time.Instant;

/** Aggregate view of every run sharing one task-set fingerprint. */
public record TaskSetSummary(
        String taskSetHash,
        Instant firstRun,
        Instant lastRun,
        int runCount,
        int variantCount,
        double avgPassRate,
        double avgScore
) { }
