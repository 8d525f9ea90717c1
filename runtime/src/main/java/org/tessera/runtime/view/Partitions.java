package org.tessera.runtime.view;

import org.tessera.runtime.cluster.Node;

import java.util.Arrays;

/**
 * Partition ownership of one namespace: {@code replicas[replicaIndex][partitionId]}, where
 * replica 0 holds the masters.
 *
 * <p>A published instance is never modified. The tend thread copies it into a
 * {@link PartitionMapBuilder} before applying changes.
 */
public final class Partitions {

    private final Node[][] replicas;

    private final int[] regimes;

    private final boolean cpMode;

    public Partitions(int partitionCount, int replicaCount, boolean cpMode) {
        this.replicas = new Node[replicaCount][partitionCount];
        this.regimes = new int[partitionCount];
        this.cpMode = cpMode;
    }

    /**
     * Copy with a different replica count or consistency mode. Replica levels beyond the new
     * count are dropped, new levels start empty.
     */
    Partitions(Partitions other, int replicaCount, boolean cpMode) {
        int partitionCount = other.getPartitionCount();
        this.replicas = new Node[replicaCount][];
        for (int i = 0; i < replicaCount; i++) {
            this.replicas[i] = i < other.replicas.length
                    ? Arrays.copyOf(other.replicas[i], partitionCount)
                    : new Node[partitionCount];
        }
        this.regimes = Arrays.copyOf(other.regimes, other.regimes.length);
        this.cpMode = cpMode;
    }

    /**
     * Deep copy, for modification.
     */
    Partitions copy() {
        return new Partitions(this, replicas.length, cpMode);
    }

    public int getReplicaCount() {
        return replicas.length;
    }

    public int getPartitionCount() {
        return regimes.length;
    }

    /**
     * Whether the namespace runs in strong consistency mode, which forbids reading from
     * arbitrary nodes.
     */
    public boolean isCpMode() {
        return cpMode;
    }

    public Node getNode(int replicaIndex, int partitionId) {
        return replicas[replicaIndex][partitionId];
    }

    public Node getMaster(int partitionId) {
        return replicas[0][partitionId];
    }

    public int getRegime(int partitionId) {
        return regimes[partitionId];
    }

    void set(int replicaIndex, int partitionId, Node node, int regime) {
        replicas[replicaIndex][partitionId] = node;
        regimes[partitionId] = regime;
    }

    /**
     * Whether a node owns any replica of any partition.
     */
    public boolean contains(Node node) {
        for (Node[] level : replicas) {
            for (Node owner : level) {
                if (owner == node) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Count partitions without a master.
     */
    public int countUnassigned() {
        int count = 0;
        for (Node owner : replicas[0]) {
            if (owner == null) {
                count++;
            }
        }
        return count;
    }
}
