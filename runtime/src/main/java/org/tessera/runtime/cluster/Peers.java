package org.tessera.runtime.cluster;

import lombok.Getter;
import lombok.Setter;
import org.tessera.runtime.exceptions.ConnectionException;
import org.tessera.util.Host;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Scratch state of one tend cycle: nodes discovered through peers, hosts that failed
 * validation, and whether any node reported a peers generation change.
 *
 * <p>Only ever touched by the tend thread.
 */
public class Peers {

    /** Nodes discovered during this cycle, keyed by node name. */
    @Getter
    private final Map<String, Node> nodes;

    /** Peer hosts that failed validation. */
    private final Set<Host> invalidHosts;

    /** Seeds that failed validation. They are skipped as peers but do not fail cluster init. */
    private final Set<Host> failedSeeds;

    /** Whether any node's peers generation changed, or any node failed to refresh. */
    @Getter
    @Setter
    private boolean genChanged;

    /** Whether peers are discovered through the peers protocol rather than service lists. */
    @Getter
    @Setter
    private boolean usePeers = true;

    /** Nodes that successfully refreshed during the current phase of the cycle. */
    @Getter
    @Setter
    private int refreshCount;

    public Peers(int capacity) {
        this.nodes = new LinkedHashMap<>(capacity);
        this.invalidHosts = new HashSet<>(8);
        this.failedSeeds = new HashSet<>(8);
    }

    public void incrementRefreshCount() {
        refreshCount++;
    }

    public boolean hasFailed(Host host) {
        return invalidHosts.contains(host) || failedSeeds.contains(host);
    }

    public void fail(Host host) {
        invalidHosts.add(host);
    }

    public void failSeed(Host host) {
        failedSeeds.add(host);
    }

    /**
     * Peer hosts that failed validation during this cycle. Failed seeds are not counted.
     */
    public int getInvalidCount() {
        return invalidHosts.size();
    }

    /**
     * Raise the error reported when a seed connected but some of its peers did not.
     */
    public void clusterInitError() {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Peers not reachable: ");

        boolean comma = false;
        for (Host host : invalidHosts) {
            if (comma) {
                sb.append(", ");
            } else {
                comma = true;
            }
            sb.append(host);
        }
        throw new ConnectionException(sb.toString());
    }
}
