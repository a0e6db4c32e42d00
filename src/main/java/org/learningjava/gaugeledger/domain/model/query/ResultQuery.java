package org.learningjava.gaugeledger.domain.model.query;

/** Filter and paging options for reading results; every field is optional. */
public record ResultQuery(
        String runId,
        String taskId,
        String variantId,
        String provider,
        Boolean success,
        Integer limit,
        Integer offset
) {
    public static ResultQuery all() {
        return new ResultQuery(null, null, null, null, null, null, null);
    }

    public static ResultQuery forRun(String runId) {
        return all().withRunId(runId);
    }

    public ResultQuery withRunId(String value) {
        return new ResultQuery(value, taskId, variantId, provider, success, limit, offset);
    }

    public ResultQuery withTaskId(String value) {
        return new ResultQuery(runId, value, variantId, provider, success, limit, offset);
    }

    public ResultQuery withVariantId(String value) {
        return new ResultQuery(runId, taskId, value, provider, success, limit, offset);
    }

    public ResultQuery withProvider(String value) {
        return new ResultQuery(runId, taskId, variantId, value, success, limit, offset);
    }

    public ResultQuery withSuccess(Boolean value) {
        return new ResultQuery(runId, taskId, variantId, provider, value, limit, offset);
    }

    public ResultQuery page(Integer newLimit, Integer newOffset) {
        return new ResultQuery(runId, taskId, variantId, provider, success, newLimit, newOffset);
    }
}
