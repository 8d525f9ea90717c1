package org.tessera.runtime.clients;

import org.tessera.runtime.exceptions.ClusterException;
import org.tessera.runtime.exceptions.ParseException;
import org.tessera.runtime.exceptions.ResultCode;

import java.util.Map;

/**
 * Info command names and helpers to pull typed values out of info responses.
 */
public final class Info {

    public static final String NODE = "node";
    public static final String FEATURES = "features";
    public static final String CLUSTER_NAME = "cluster-name";
    public static final String PEERS_GENERATION = "peers-generation";
    public static final String PARTITION_GENERATION = "partition-generation";
    public static final String REPLICAS = "replicas";
    public static final String REPLICAS_ALL = "replicas-all";
    public static final String SERVICES = "services";
    public static final String SERVICES_ALTERNATE = "services-alternate";

    private static final String ERROR_PREFIX = "ERROR";

    private Info() {
        // Prevent initializing a utility class
    }

    /**
     * Peers command matching the cluster transport.
     */
    public static String peersCommand(boolean tls, boolean useServicesAlternate) {
        if (tls) {
            return useServicesAlternate ? "peers-tls-alt" : "peers-tls-std";
        }
        return useServicesAlternate ? "peers-clear-alt" : "peers-clear-std";
    }

    /**
     * Issue a single command and return its value.
     */
    public static String request(Connection connection, String command) {
        return getString(connection.info(command), command);
    }

    /**
     * Get a value from a response, failing if the server omitted it or reported an error.
     */
    public static String getString(Map<String, String> response, String command) {
        String value = response.get(command);
        if (value == null) {
            throw new ParseException("Info response missing " + command);
        }
        if (value.startsWith(ERROR_PREFIX)) {
            throw new ClusterException(ResultCode.SERVER_ERROR, command + " failed: " + value);
        }
        return value.trim();
    }

    public static int getInt(Map<String, String> response, String command) {
        String value = getString(response, command);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException nfe) {
            throw new ParseException("Invalid " + command + " value: " + value, nfe);
        }
    }

    public static long getLong(Map<String, String> response, String command) {
        String value = getString(response, command);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException nfe) {
            throw new ParseException("Invalid " + command + " value: " + value, nfe);
        }
    }

    /**
     * Truncate a long response for error messages.
     */
    public static String truncate(String response) {
        return response.length() > 200 ? response.substring(0, 200) : response;
    }
}
