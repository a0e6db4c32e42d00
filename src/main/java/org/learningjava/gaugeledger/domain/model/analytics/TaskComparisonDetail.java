package org.learningjava.gaugeledger.domain.model.analytics;

public record TaskComparisonDetail(
        String taskId,
        double variant1Score,
        double variant2Score,
        Winner winner
) {
    public enum Winner { VARIANT1, VARIANT2, TIE }

    public static TaskComparisonDetail of(String taskId, double score1, double score2) {
        Winner winner;
        if (score1 > score2) {
            winner = Winner.VARIANT1;
        } else if (score2 > score1) {
            winner = Winner.VARIANT2;
        } else {
            winner = Winner.TIE;
        }
        return new TaskComparisonDetail(taskId, score1, score2, winner);
    }
}
