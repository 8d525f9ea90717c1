package org.tessera.runtime.exceptions.unrecoverable;

/**
 * Thrown when a thread is interrupted in a place that cannot handle interruption.
 * The interrupt flag is restored before the error is raised.
 */
public class UnrecoverableTesseraInterruptedError extends UnrecoverableTesseraError {

    public UnrecoverableTesseraInterruptedError(InterruptedException cause) {
        super(cause);
        Thread.currentThread().interrupt();
    }

    public UnrecoverableTesseraInterruptedError(String message, InterruptedException cause) {
        super(message, cause);
        Thread.currentThread().interrupt();
    }
}
