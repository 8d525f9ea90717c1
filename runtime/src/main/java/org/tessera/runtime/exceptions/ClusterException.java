package org.tessera.runtime.exceptions;

import lombok.Getter;
import lombok.Setter;

/**
 * Base class of all errors raised by the cluster runtime. Every error carries a
 * {@link ResultCode} so callers can decide whether an operation is worth retrying.
 */
public class ClusterException extends RuntimeException {

    @Getter
    private final int resultCode;

    /** The scan/query round in which this error was observed, 0 if not applicable. */
    @Getter
    @Setter
    private volatile int iteration;

    public ClusterException(int resultCode) {
        super(ResultCode.getResultString(resultCode));
        this.resultCode = resultCode;
    }

    public ClusterException(int resultCode, String message) {
        super(message);
        this.resultCode = resultCode;
    }

    public ClusterException(int resultCode, String message, Throwable cause) {
        super(message, cause);
        this.resultCode = resultCode;
    }

    public ClusterException(int resultCode, Throwable cause) {
        super(ResultCode.getResultString(resultCode), cause);
        this.resultCode = resultCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[code=" + resultCode + "]: " + getMessage();
    }
}
