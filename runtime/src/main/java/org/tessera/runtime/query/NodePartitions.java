package org.tessera.runtime.query;

import lombok.Getter;
import org.tessera.runtime.cluster.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions of one round assigned to one node.
 */
@Getter
public final class NodePartitions {

    private final Node node;

    /** Partitions read from the start. */
    private final List<PartitionStatus> partsFull;

    /** Partitions resumed after a digest. */
    private final List<PartitionStatus> partsPartial;

    volatile long recordCount;

    /** Records this node may return in the round, 0 for no limit. */
    long recordMax;

    volatile int partsUnavailable;

    NodePartitions(Node node, int capacity) {
        this.node = node;
        this.partsFull = new ArrayList<>(capacity);
        this.partsPartial = new ArrayList<>(capacity);
    }

    void addPartition(PartitionStatus part) {
        if (part.getDigest() == null) {
            partsFull.add(part);
        } else {
            partsPartial.add(part);
        }
    }

    @Override
    public String toString() {
        return "NodePartitions{node=" + node + ", full=" + partsFull.size() + ", partial=" + partsPartial.size()
                + ", records=" + recordCount + "/" + recordMax + ", unavailable=" + partsUnavailable + "}";
    }
}
