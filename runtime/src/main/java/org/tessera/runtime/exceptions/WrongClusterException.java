package org.tessera.runtime.exceptions;

import lombok.Getter;

import javax.annotation.Nullable;

/**
 * A node reported a cluster name other than the one the client was configured with.
 */
public class WrongClusterException extends ClusterException {

    /** The cluster we expected to connect to. */
    @Getter
    final String expectedCluster;

    /** The cluster we actually ended up connecting to. */
    @Getter
    final String actualCluster;

    /** Create a new {@link WrongClusterException}.
     *
     * @param node              Name of the node which answered.
     * @param expectedCluster   The cluster we expected to connect to.
     * @param actualCluster     The cluster we actually ended up connecting to.
     */
    public WrongClusterException(String node, @Nullable String expectedCluster,
                                 @Nullable String actualCluster) {
        super(ResultCode.INVALID_NODE_ERROR, "Node " + node + " expected cluster name '"
                + expectedCluster + "' received '" + actualCluster + "'");
        this.expectedCluster = expectedCluster;
        this.actualCluster = actualCluster;
    }
}
