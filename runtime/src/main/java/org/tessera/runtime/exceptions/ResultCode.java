package org.tessera.runtime.exceptions;

/**
 * Result codes carried by {@link ClusterException}s. Negative codes are generated on the
 * client, positive codes are reported by the server.
 */
public final class ResultCode {

    /** Server did not respond to a request. */
    public static final int NO_RESPONSE = -13;

    /** Node has exceeded its error rate limit for the current window. */
    public static final int MAX_ERROR_RATE = -12;

    /** Maximum number of retries were exceeded. */
    public static final int MAX_RETRIES_EXCEEDED = -11;

    /** Server is not accepting requests. */
    public static final int SERVER_NOT_AVAILABLE = -8;

    /** Connection pool of a node is exhausted. */
    public static final int NO_MORE_CONNECTIONS = -7;

    /** Query was terminated by the caller. */
    public static final int QUERY_TERMINATED = -5;

    /** Scan was terminated by the caller. */
    public static final int SCAN_TERMINATED = -4;

    /** Chosen node is not currently active. */
    public static final int INVALID_NODE_ERROR = -3;

    /** Client parse error. */
    public static final int PARSE_ERROR = -2;

    /** Generic client error. */
    public static final int CLIENT_ERROR = -1;

    public static final int OK = 0;

    /** Unknown server failure. */
    public static final int SERVER_ERROR = 1;

    /** Bad parameter(s) were passed in the request. */
    public static final int PARAMETER_ERROR = 4;

    /** Client or server has timed out. */
    public static final int TIMEOUT = 9;

    /** Partition is unavailable, usually because of a migration. */
    public static final int PARTITION_UNAVAILABLE = 11;

    /** Scan was aborted by the server. */
    public static final int SCAN_ABORT = 15;

    /** Namespace is not known to the cluster. */
    public static final int INVALID_NAMESPACE = 20;

    /** Operation is not allowed in the current state. */
    public static final int FAIL_FORBIDDEN = 22;

    /** User must be authenticated before performing this operation. */
    public static final int NOT_AUTHENTICATED = 80;

    /** Secondary index does not exist. */
    public static final int INDEX_NOTFOUND = 201;

    /** Secondary index is not yet readable. */
    public static final int INDEX_NOTREADABLE = 203;

    /** Query was aborted by the server. */
    public static final int QUERY_ABORTED = 210;

    private ResultCode() {
        // Prevent initializing a utility class
    }

    /**
     * Return a short description of a result code.
     */
    public static String getResultString(int resultCode) {
        switch (resultCode) {
            case NO_RESPONSE:
                return "No response received from server";
            case MAX_ERROR_RATE:
                return "Max error rate exceeded";
            case MAX_RETRIES_EXCEEDED:
                return "Max retries exceeded";
            case SERVER_NOT_AVAILABLE:
                return "Server not available";
            case NO_MORE_CONNECTIONS:
                return "No more available connections";
            case QUERY_TERMINATED:
                return "Query terminated";
            case SCAN_TERMINATED:
                return "Scan terminated";
            case INVALID_NODE_ERROR:
                return "Invalid node";
            case PARSE_ERROR:
                return "Parse error";
            case CLIENT_ERROR:
                return "Client error";
            case OK:
                return "ok";
            case SERVER_ERROR:
                return "Server error";
            case PARAMETER_ERROR:
                return "Parameter error";
            case TIMEOUT:
                return "Timeout";
            case PARTITION_UNAVAILABLE:
                return "Partition not available";
            case SCAN_ABORT:
                return "Scan aborted";
            case INVALID_NAMESPACE:
                return "Namespace not found";
            case FAIL_FORBIDDEN:
                return "Operation not allowed at this time";
            case NOT_AUTHENTICATED:
                return "Not authenticated";
            case INDEX_NOTFOUND:
                return "Index not found";
            case INDEX_NOTREADABLE:
                return "Index not readable";
            case QUERY_ABORTED:
                return "Query aborted";
            default:
                return "Error " + resultCode;
        }
    }
}
