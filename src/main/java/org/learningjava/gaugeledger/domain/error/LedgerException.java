package org.learningjava.gaugeledger.domain.error;

/** Base type for every failure raised by the ledger itself. */
public class LedgerException extends RuntimeException {
    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
