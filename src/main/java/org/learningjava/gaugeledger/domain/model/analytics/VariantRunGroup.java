package org.learningjava.gaugeledger.domain.model.analytics;

import org.learningjava.gaugeledger.domain.model.run.RunRecord;

import java.util.List;

/** Runs of one task set that produced at least one result for {@code variantId}, newest first. */
public record VariantRunGroup(
        String variantId,
        String provider,
        List<RunRecord> runs
) {
    public VariantRunGroup {
        runs = List.copyOf(runs);
    }
}
