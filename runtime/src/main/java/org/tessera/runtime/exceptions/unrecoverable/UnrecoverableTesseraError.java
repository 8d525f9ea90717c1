package org.tessera.runtime.exceptions.unrecoverable;

/**
 * An error the runtime cannot recover from; it is never caught by retry logic.
 */
public class UnrecoverableTesseraError extends Error {

    public UnrecoverableTesseraError(String message) {
        super(message);
    }

    public UnrecoverableTesseraError(String message, Throwable cause) {
        super(message, cause);
    }

    public UnrecoverableTesseraError(Throwable cause) {
        super(cause);
    }
}
