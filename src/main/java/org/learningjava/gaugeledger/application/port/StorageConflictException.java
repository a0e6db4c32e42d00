package org.learningjava.gaugeledger.application.port;

import org.learningjava.gaugeledger.domain.error.LedgerException;

/**
 * A uniqueness rule was violated: a run id that already exists, or a (task, variant) pair that is
 * already recorded for the run. Nothing from the failing call was committed.
 */
public class StorageConflictException extends LedgerException {
    public StorageConflictException(String message) {
        super(message);
    }

    public StorageConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    public static StorageConflictException duplicateRun(String runId) {
        return new StorageConflictException("Run " + runId + " already exists");
    }

    public static StorageConflictException duplicateResult(String runId, String taskId, String variantId) {
        return new StorageConflictException("Result for task " + taskId + " / variant " + variantId
                + " already exists in run " + runId);
    }
}
