package org.tessera.util;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import javax.annotation.Nullable;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link Host}s represent network endpoints of cluster servers.
 *
 * <p>A host is identified by its name and port only. The tls name is carried along so that
 * connections know which certificate identity to expect, but it never takes part in equality.
 */
@EqualsAndHashCode(exclude = "tlsName")
public class Host implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Host name or IP address of the server.
     */
    @Getter
    @NonNull
    private final String name;

    /**
     * Expected TLS certificate name. Can be null when TLS is not used.
     */
    @Getter
    @Nullable
    private final String tlsName;

    /**
     * Port number of the server.
     */
    @Getter
    private final int port;

    @Builder(toBuilder = true)
    public Host(@NonNull String name, @Nullable String tlsName, int port) {
        this.name = name;
        this.tlsName = tlsName;
        this.port = port;
    }

    public Host(@NonNull String name, int port) {
        this(name, null, port);
    }

    /**
     * Parse a list of hosts in the form {@code hostname1[:tlsname1][:port1],...}.
     * IPv6 addresses must be enclosed in square brackets.
     *
     * @param toParse     The string to parse.
     * @param defaultPort Port used when a host does not specify one.
     * @return The hosts in the order they appear.
     */
    public static List<Host> parseHosts(String toParse, int defaultPort) {
        List<Host> hosts = new ArrayList<>();
        for (String token : toParse.split(",")) {
            String entry = token.trim();
            if (entry.isEmpty()) {
                continue;
            }
            hosts.add(parseHost(entry, defaultPort));
        }

        if (hosts.isEmpty()) {
            throw new IllegalArgumentException("No hosts found in \"" + toParse + "\"");
        }
        return hosts;
    }

    /**
     * Parse a single host entry, {@code hostname[:tlsname][:port]}.
     */
    public static Host parseHost(String entry, int defaultPort) {
        String name;
        String rest;

        if (entry.startsWith("[")) {
            int end = entry.indexOf(']');
            if (end < 0) {
                throw new IllegalArgumentException("Unterminated IPv6 address: " + entry);
            }
            name = entry.substring(1, end);
            rest = entry.substring(end + 1);
            if (!rest.isEmpty()) {
                if (rest.charAt(0) != ':') {
                    throw new IllegalArgumentException("Invalid host: " + entry);
                }
                rest = rest.substring(1);
            }
        } else {
            int colon = entry.indexOf(':');
            if (colon < 0) {
                name = entry;
                rest = "";
            } else {
                name = entry.substring(0, colon);
                rest = entry.substring(colon + 1);
            }
        }

        if (name.isEmpty()) {
            throw new IllegalArgumentException("Empty host name: " + entry);
        }

        if (rest.isEmpty()) {
            return new Host(name, defaultPort);
        }

        String[] parts = rest.split(":");
        if (parts.length == 1) {
            return new Host(name, parsePort(parts[0], entry));
        }
        if (parts.length == 2) {
            return new Host(name, parts[0], parsePort(parts[1], entry));
        }
        throw new IllegalArgumentException("Invalid host: " + entry);
    }

    /**
     * Parse a legacy service list in the form {@code host1:port1;host2:port2}.
     */
    public static List<Host> parseServiceHosts(String toParse) {
        List<Host> hosts = new ArrayList<>();
        if (toParse == null) {
            return hosts;
        }

        for (String token : toParse.split(";")) {
            String entry = token.trim();
            if (entry.isEmpty()) {
                continue;
            }
            int colon = entry.lastIndexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("Invalid service host: " + entry);
            }
            String name = entry.substring(0, colon);
            if (name.startsWith("[") && name.endsWith("]")) {
                name = name.substring(1, name.length() - 1);
            }
            hosts.add(new Host(name, parsePort(entry.substring(colon + 1), entry)));
        }
        return hosts;
    }

    private static int parsePort(String port, String entry) {
        try {
            int value = Integer.parseInt(port.trim());
            if (value <= 0 || value > 0xFFFF) {
                throw new IllegalArgumentException("Invalid port " + port + " in " + entry);
            }
            return value;
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException("Invalid port " + port + " in " + entry, nfe);
        }
    }

    public String toEndpointUrl() {
        return (name.indexOf(':') >= 0 ? "[" + name + "]" : name) + ":" + port;
    }

    @Override
    public String toString() {
        return name + " " + port;
    }
}
