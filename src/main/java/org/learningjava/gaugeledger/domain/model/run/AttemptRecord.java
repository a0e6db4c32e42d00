package org.learningjava.gaugeledger.domain.model.run;

import java.util.List;

/**
 * One attempt inside a {@link ResultRecord}. Compile and test outcomes are null when the attempt
 * never reached that stage.
 */
public record AttemptRecord(
        int attemptNumber,
        boolean success,
        double score,
        long tokensUsed,
        double cost,
        long durationMs,
        Boolean compileSuccess,
        Boolean testSuccess,
        List<String> failureReasons
) {
    public AttemptRecord {
        failureReasons = failureReasons == null ? List.of() : List.copyOf(failureReasons);
    }
}
