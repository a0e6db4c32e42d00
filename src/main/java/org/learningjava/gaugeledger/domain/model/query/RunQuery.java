package org.learningjava.gaugeledger.domain.model.query;

import java.time.Instant;

/**
 * Filter and paging options for listing runs. Every field is optional; {@code since} and
 * {@code until} are inclusive.
 */
public record RunQuery(
        String configHash,
        String taskSetHash,
        Instant since,
        Instant until,
        Integer limit,
        Integer offset
) {
    public static RunQuery all() {
        return new RunQuery(null, null, null, null, null, null);
    }

    public RunQuery withConfigHash(String hash) {
        return new RunQuery(hash, taskSetHash, since, until, limit, offset);
    }

    public RunQuery withTaskSetHash(String hash) {
        return new RunQuery(configHash, hash, since, until, limit, offset);
    }

    public RunQuery between(Instant from, Instant to) {
        return new RunQuery(configHash, taskSetHash, from, to, limit, offset);
    }

    public RunQuery page(Integer newLimit, Integer newOffset) {
        return new RunQuery(configHash, taskSetHash, since, until, newLimit, newOffset);
    }
}
