package org.tessera.runtime.cluster;

import lombok.Getter;
import org.tessera.runtime.clients.Info;
import org.tessera.runtime.exceptions.ParseException;
import org.tessera.util.Host;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Parses a peers response:
 * {@code generation,defaultPort,[[name,tlsName,[host:port,...]],...]}.
 *
 * <p>IPv6 hosts are enclosed in square brackets. Hosts without a port use the default port.
 */
public class PeerParser {

    private final String response;
    private final Map<String, String> ipMap;
    private int offset;

    @Getter
    private long generation;

    @Getter
    private int defaultPort;

    @Getter
    private final List<Peer> peers = new ArrayList<>();

    private PeerParser(String response, Map<String, String> ipMap) {
        this.response = response;
        this.ipMap = ipMap;
    }

    /**
     * Parse a peers response.
     *
     * @param response The value of the peers info command.
     * @param ipMap    Address translations applied to every parsed host.
     */
    public static PeerParser parse(String response, Map<String, String> ipMap) {
        if (response == null || response.isEmpty()) {
            throw new ParseException("Peers response is empty");
        }

        PeerParser parser = new PeerParser(response.trim(), ipMap == null ? Collections.emptyMap() : ipMap);
        parser.parse();
        return parser;
    }

    private void parse() {
        generation = parseLong(',');
        expect(',');
        defaultPort = (int) parseLong(',');
        expect(',');
        expect('[');

        if (peek() == ']') {
            return;
        }

        while (true) {
            peers.add(parsePeer());

            if (offset < response.length() && response.charAt(offset) == ',') {
                offset++;
            } else {
                break;
            }
        }
        expect(']');
    }

    private Peer parsePeer() {
        expect('[');
        String nodeName = parseString(',');
        expect(',');
        String tlsName = parseString(',');
        expect(',');
        List<Host> hosts = parseHosts(tlsName.isEmpty() ? null : tlsName);
        expect(']');
        return new Peer(nodeName, tlsName.isEmpty() ? null : tlsName, hosts);
    }

    private List<Host> parseHosts(String tlsName) {
        List<Host> hosts = new ArrayList<>(4);
        expect('[');

        if (peek() == ']') {
            offset++;
            return hosts;
        }

        while (true) {
            hosts.add(parseHost(tlsName));

            char c = peek();
            offset++;
            if (c == ']') {
                return hosts;
            }
            if (c != ',') {
                throw new ParseException("Unterminated host list in peers response: " + Info.truncate(response));
            }
        }
    }

    private Host parseHost(String tlsName) {
        String host;

        if (peek() == '[') {
            // IPv6 addresses can start with bracket.
            offset++;
            host = parseString(']');
            expect(']');
        } else {
            host = parseString(':', ',', ']');
        }

        String mapped = ipMap.get(host);
        if (mapped != null) {
            host = mapped;
        }

        char c = peek();
        if (c == ':') {
            offset++;
            int port = (int) parseLong(',', ']');
            return new Host(host, tlsName, port);
        }
        if (c == ',' || c == ']') {
            return new Host(host, tlsName, defaultPort);
        }
        throw new ParseException("Unterminated host in peers response: " + Info.truncate(response));
    }

    private String parseString(char... stops) {
        int begin = offset;
        while (offset < response.length()) {
            char c = response.charAt(offset);
            for (char stop : stops) {
                if (c == stop) {
                    return response.substring(begin, offset);
                }
            }
            offset++;
        }
        throw new ParseException("Unexpected end of peers response: " + Info.truncate(response));
    }

    private long parseLong(char... stops) {
        String value = parseString(stops).trim();
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException nfe) {
            throw new ParseException("Invalid number '" + value + "' in peers response: "
                    + Info.truncate(response), nfe);
        }
    }

    private char peek() {
        if (offset >= response.length()) {
            throw new ParseException("Unexpected end of peers response: " + Info.truncate(response));
        }
        return response.charAt(offset);
    }

    private void expect(char expected) {
        if (peek() != expected) {
            throw new ParseException("Expected '" + expected + "' at offset " + offset
                    + " in peers response: " + Info.truncate(response));
        }
        offset++;
    }
}
