package org.learningjava.gaugeledger.domain.model.analytics;

import java.util.List;

/**
 * Head-to-head comparison of two variants over the latest result of every task both have run.
 * Costs cover all of each variant's stored results, including tasks the other side never ran.
 */
public record ModelComparison(
        String variant1,
        String variant2,
        int variant1Wins,
        int variant2Wins,
        int ties,
        double variant1AvgScore,
        double variant2AvgScore,
        double variant1Cost,
        double variant2Cost,
        List<TaskComparisonDetail> perTask
) {
    public ModelComparison {
        perTask = List.copyOf(perTask);
    }

    public static ModelComparison from(String variant1, String variant2,
                                       List<TaskComparisonDetail> perTask,
                                       double variant1Cost, double variant2Cost) {
        int v1Wins = 0, v2Wins = 0, ties = 0;
        double v1Total = 0, v2Total = 0;
        for (TaskComparisonDetail d : perTask) {
            v1Total += d.variant1Score();
            v2Total += d.variant2Score();
            switch (d.winner()) {
                case VARIANT1 -> v1Wins++;
                case VARIANT2 -> v2Wins++;
                case TIE -> ties++;
            }
        }
        int count = perTask.isEmpty() ? 1 : perTask.size();
        return new ModelComparison(variant1, variant2, v1Wins, v2Wins, ties,
                v1Total / count, v2Total / count, variant1Cost, variant2Cost, perTask);
    }
}
