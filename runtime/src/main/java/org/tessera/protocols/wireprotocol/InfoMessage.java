package org.tessera.protocols.wireprotocol;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An info protocol frame.
 *
 * <p>On the wire a frame is an 8 byte header followed by the payload. The header holds the
 * protocol version in its first byte, the message type in the second byte and the payload length
 * in the remaining 48 bits, all big endian. Requests are newline separated command names,
 * responses are newline separated {@code name\tvalue} lines.
 */
@AllArgsConstructor
@ToString(exclude = "payload")
public class InfoMessage {

    public static final int HEADER_SIZE = 8;
    public static final int PROTOCOL_VERSION = 2;
    public static final int INFO_TYPE = 1;
    public static final long MAX_PAYLOAD_SIZE = 0xFFFFFFFFFFFFL;

    @Getter
    private final int version;

    @Getter
    private final int type;

    @Getter
    private final byte[] payload;

    /**
     * Build an info request for the given commands.
     */
    public static InfoMessage request(List<String> commands) {
        StringBuilder sb = new StringBuilder(commands.size() * 16);
        for (String command : commands) {
            sb.append(command).append('\n');
        }
        return new InfoMessage(PROTOCOL_VERSION, INFO_TYPE, sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    public String getText() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    /**
     * Split a response payload into a map of command name to value, in response order.
     * A line without a tab maps its name to the empty string.
     */
    public Map<String, String> parseResponse() {
        String text = getText();
        if (text.isEmpty()) {
            return Collections.emptyMap();
        }

        Map<String, String> responses = new LinkedHashMap<>();
        for (String line : text.split("\n")) {
            if (line.isEmpty()) {
                continue;
            }
            int tab = line.indexOf('\t');
            if (tab < 0) {
                responses.put(line.trim(), "");
            } else {
                responses.put(line.substring(0, tab).trim(), line.substring(tab + 1));
            }
        }
        return responses;
    }
}
