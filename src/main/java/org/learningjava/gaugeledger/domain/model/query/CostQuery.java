package org.learningjava.gaugeledger.domain.model.query;

import org.learningjava.gaugeledger.domain.model.analytics.CostGrouping;

import java.time.Instant;
import java.util.Objects;

public record CostQuery(CostGrouping groupBy, Instant since, String variantId) {
    public CostQuery {
        Objects.requireNonNull(groupBy, "groupBy");
    }

    public static CostQuery by(CostGrouping groupBy) {
        return new CostQuery(groupBy, null, null);
    }
}
