package org.tessera.runtime.exceptions;

/**
 * A scan or query was cancelled before it could complete.
 */
public class OperationTerminatedException extends ClusterException {

    public OperationTerminatedException(int resultCode) {
        super(resultCode);
    }

    public OperationTerminatedException(int resultCode, Throwable cause) {
        super(resultCode, cause);
    }
}
