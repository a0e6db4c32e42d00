package org.learningjava.gaugeledger.domain.model.query;

import java.time.Instant;

public record TrendQuery(String taskId, Instant since, Integer limit) {
    public static TrendQuery all() {
        return new TrendQuery(null, null, null);
    }
}
