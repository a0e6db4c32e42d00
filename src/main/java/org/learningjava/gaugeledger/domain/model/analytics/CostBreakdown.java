package org.learningjava.gaugeledger.domain.model.analytics;

/**
 * @param costPerSuccess null when the group has no successful execution
 */
public record CostBreakdown(
        String groupKey,
        double totalCost,
        long totalTokens,
        int executionCount,
        double avgCostPerExecution,
        Double costPerSuccess
) { }
