package org.learningjava.gaugeledger.domain.model.query;

/**
 * @param threshold      relative drop that counts as a regression, e.g. 0.05 for 5%
 * @param recentWindow   number of most recent runs forming the "current" window
 * @param baselineWindow number of runs right before those forming the baseline
 * @param variantId      optional variant filter
 */
public record RegressionQuery(double threshold, int recentWindow, int baselineWindow, String variantId) {

    public static final int DEFAULT_RECENT_WINDOW = 3;
    public static final int DEFAULT_BASELINE_WINDOW = 7;

    public RegressionQuery {
        if (!(threshold >= 0)) {
            throw new IllegalArgumentException("threshold must be a number >= 0");
        }
        if (recentWindow <= 0 || baselineWindow <= 0) {
            throw new IllegalArgumentException("windows must be positive");
        }
    }
}
