package org.learningjava.gaugeledger.domain.model.analytics;

/**
 * A task/variant pair whose recent average score dropped against its baseline window.
 *
 * @param changePct relative change in percent, negative for a drop
 */
public record Regression(
        String taskId,
        String variantId,
        double baselineScore,
        double currentScore,
        double changePct
) { }
