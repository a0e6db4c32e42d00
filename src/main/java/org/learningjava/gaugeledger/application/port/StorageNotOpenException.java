package org.learningjava.gaugeledger.application.port;

import org.learningjava.gaugeledger.domain.error.LedgerException;

/** An operation was attempted on a storage handle that has not been opened (or was closed). */
public class StorageNotOpenException extends LedgerException {
    public StorageNotOpenException(String message) {
        super(message);
    }
}
