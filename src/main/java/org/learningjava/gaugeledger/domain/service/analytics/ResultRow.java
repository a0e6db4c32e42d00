package org.learningjava.gaugeledger.domain.service.analytics;

import org.learningjava.gaugeledger.domain.model.run.ResultRecord;

/**
 * A stored result together with its owning run and its insertion sequence. A higher
 * {@code sequence} means the row was created later.
 */
public record ResultRow(long sequence, String runId, ResultRecord result) {
}
