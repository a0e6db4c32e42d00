package org.learningjava.gaugeledger.domain.error;

/** A task id or difficulty cannot be derived from a manifest path. */
public class MalformedTaskPathException extends LedgerException {
    private final String path;

    public MalformedTaskPathException(String message, String path) {
        super(message + ": " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
