package org.learningjava.gaugeledger.domain.model.analytics;

import java.util.Locale;

public enum CostGrouping {
    MODEL, TASK, DAY, WEEK;

    public static CostGrouping parse(String value) {
        if (value == null || value.isBlank()) {
            return MODEL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown cost grouping: " + value
                    + " (expected model, task, day or week)", e);
        }
    }
}
