package org.learningjava.gaugeledger.domain.error;

/** A run export file exists but does not have the expected shape. */
public class MalformedExportException extends LedgerException {
    public MalformedExportException(String message) {
        super(message);
    }

    public MalformedExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
