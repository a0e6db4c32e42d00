package org.learningjava.gaugeledger.domain.model.analytics;

import java.time.Instant;

/** One run's aggregate for a single variant. */
public record TrendPoint(
        String runId,
        Instant executedAt,
        int passed,
        int total,
        double avgScore,
        double cost
) { }
