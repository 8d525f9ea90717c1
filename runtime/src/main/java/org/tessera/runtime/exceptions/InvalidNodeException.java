package org.tessera.runtime.exceptions;

/**
 * Routing could not find an eligible node.
 */
public class InvalidNodeException extends ClusterException {

    public InvalidNodeException(String message) {
        super(ResultCode.INVALID_NODE_ERROR, message);
    }

    public InvalidNodeException(int clusterSize, String partition) {
        super(ResultCode.INVALID_NODE_ERROR, clusterSize == 0
                ? "Cluster is empty"
                : "Node not found for partition " + partition + " in partition table");
    }

    public InvalidNodeException(int partitionId) {
        super(ResultCode.INVALID_NODE_ERROR,
                "Node not found for partition " + partitionId + " in partition table");
    }
}
