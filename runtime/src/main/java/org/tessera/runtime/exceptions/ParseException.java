package org.tessera.runtime.exceptions;

/**
 * An info response could not be understood.
 */
public class ParseException extends ClusterException {

    public ParseException(String message) {
        super(ResultCode.PARSE_ERROR, message);
    }

    public ParseException(String message, Throwable cause) {
        super(ResultCode.PARSE_ERROR, message, cause);
    }
}
