package org.learningjava.gaugeledger.application.port;

import org.learningjava.gaugeledger.domain.error.LedgerException;

/** The storage engine itself failed (I/O, SQL, corrupt data). */
public class StorageException extends LedgerException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
