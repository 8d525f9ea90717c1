package org.tessera.runtime.view;

import lombok.extern.slf4j.Slf4j;
import org.tessera.runtime.clients.Info;
import org.tessera.runtime.cluster.Node;
import org.tessera.runtime.exceptions.ParseException;

import java.util.Base64;

/**
 * Decodes a node's replicas response into a {@link PartitionMapBuilder}.
 *
 * <p>Format, one entry per namespace:
 * <pre>
 * replicas:     ns:regime,replicaCount,bitmap0,bitmap1,...;
 * replicas-all: ns:replicaCount,bitmap0,bitmap1,...;
 * </pre>
 * Each bitmap is the base64 encoding of {@link Node#PARTITIONS} bits, most significant bit
 * first; a set bit means the node owns that partition at that replica level.
 */
@Slf4j
public final class PartitionParser {

    private static final int MAX_NAMESPACE_LENGTH = 31;

    private final Node node;
    private final String response;
    private final boolean hasRegime;
    private final PartitionMapBuilder partitionMap;
    private boolean regimeError;

    private PartitionParser(Node node, String response, boolean hasRegime, PartitionMapBuilder partitionMap) {
        this.node = node;
        this.response = response;
        this.hasRegime = hasRegime;
        this.partitionMap = partitionMap;
    }

    /**
     * Parse the response of a node.
     *
     * @param node         The node that sent the response.
     * @param response     Value of the {@code replicas} or {@code replicas-all} command.
     * @param hasRegime    True for {@code replicas}, which carries a regime per namespace.
     * @param partitionMap The map receiving ownership updates.
     */
    public static void parse(Node node, String response, boolean hasRegime, PartitionMapBuilder partitionMap) {
        new PartitionParser(node, response, hasRegime, partitionMap).parse();
    }

    private void parse() {
        for (String entry : response.split(";")) {
            String trimmed = entry.trim();
            if (!trimmed.isEmpty()) {
                parseNamespace(trimmed);
            }
        }
    }

    private void parseNamespace(String entry) {
        int colon = entry.indexOf(':');
        if (colon < 0) {
            throw new ParseException("Invalid partition entry: " + Info.truncate(response));
        }

        String namespace = entry.substring(0, colon).trim();
        if (namespace.isEmpty() || namespace.length() > MAX_NAMESPACE_LENGTH) {
            throw new ParseException("Invalid partition namespace " + namespace
                    + ". Response=" + Info.truncate(response));
        }

        String[] fields = entry.substring(colon + 1).split(",", -1);
        int index = 0;
        int regime = 0;

        if (hasRegime) {
            regime = parseInt(fields, index++, namespace);
        }

        int replicaCount = parseInt(fields, index++, namespace);
        if (replicaCount <= 0 || fields.length - index != replicaCount) {
            throw new ParseException("Invalid replica count " + replicaCount + " for namespace "
                    + namespace + ". Response=" + Info.truncate(response));
        }

        Partitions partitions = partitionMap.prepare(namespace, replicaCount, regime != 0);

        for (int replica = 0; replica < replicaCount; replica++) {
            String bitmap = fields[index + replica].trim();
            if (bitmap.isEmpty()) {
                throw new ParseException("Empty partition id for namespace " + namespace
                        + ". Response=" + Info.truncate(response));
            }
            partitions = decodeBitmap(namespace, partitions, replica, regime, bitmap);
        }
    }

    private Partitions decodeBitmap(String namespace, Partitions partitions, int replica, int regime,
                                    String bitmap) {
        byte[] bits;
        try {
            bits = Base64.getDecoder().decode(bitmap);
        } catch (IllegalArgumentException iae) {
            throw new ParseException("Invalid partition bitmap for namespace " + namespace, iae);
        }

        int partitionCount = partitions.getPartitionCount();
        if (bits.length * 8 < partitionCount) {
            throw new ParseException("Partition bitmap for namespace " + namespace + " is too short: "
                    + bits.length + " bytes");
        }

        for (int i = 0; i < partitionCount; i++) {
            if ((bits[i >> 3] & (0x80 >> (i & 7))) == 0) {
                continue;
            }

            // Node owns this partition.
            int regimeOld = partitions.getRegime(i);

            if (regime < regimeOld) {
                if (!regimeError) {
                    log.info("decodeBitmap[{}]: regime({}) < old regime({})", node, regime, regimeOld);
                    regimeError = true;
                }
                continue;
            }

            Node nodeOld = partitions.getNode(replica, i);
            if (nodeOld == node && regime == regimeOld) {
                continue;
            }

            if (nodeOld != null && nodeOld != node) {
                // Force previously mapped node to refresh its partition map on next cluster tend.
                nodeOld.invalidatePartitionGeneration();
            }
            partitions = partitionMap.assign(namespace, replica, i, node, regime);
        }
        return partitions;
    }

    private int parseInt(String[] fields, int index, String namespace) {
        if (index >= fields.length) {
            throw new ParseException("Truncated partition entry for namespace " + namespace
                    + ". Response=" + Info.truncate(response));
        }
        try {
            return Integer.parseInt(fields[index].trim());
        } catch (NumberFormatException nfe) {
            throw new ParseException("Invalid number '" + fields[index] + "' for namespace " + namespace, nfe);
        }
    }
}
