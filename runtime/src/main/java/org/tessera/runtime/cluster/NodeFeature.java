package org.tessera.runtime.cluster;

import java.util.EnumSet;
import java.util.Set;

/**
 * Capabilities a node advertises through the {@code features} info command.
 *
 * <p>A feature is only used by the client when every node of the cluster supports it.
 */
public enum NodeFeature {
    GEO("geo"),
    DOUBLE("float"),
    BATCH_INDEX("batch-index"),
    REPLICAS("replicas"),
    REPLICAS_ALL("replicas-all"),
    PEERS("peers"),
    PARTITION_SCAN("pscans"),
    PARTITION_QUERY("pquery");

    private final String token;

    NodeFeature(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * Parse a {@code ;} separated feature list. Unknown tokens are ignored.
     */
    public static Set<NodeFeature> parse(String features) {
        EnumSet<NodeFeature> result = EnumSet.noneOf(NodeFeature.class);
        if (features == null || features.isEmpty()) {
            return result;
        }

        for (String token : features.split(";")) {
            String trimmed = token.trim();
            for (NodeFeature feature : values()) {
                if (feature.token.equals(trimmed)) {
                    result.add(feature);
                    break;
                }
            }
        }
        return result;
    }
}
