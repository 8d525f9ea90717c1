package org.tessera.runtime.view;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.tessera.runtime.cluster.Cluster;
import org.tessera.runtime.cluster.ClusterView;
import org.tessera.runtime.cluster.Node;
import org.tessera.runtime.exceptions.InvalidNamespaceException;
import org.tessera.runtime.exceptions.InvalidNodeException;

/**
 * Routes one operation on one partition to a node.
 *
 * <p>The partition map of the namespace is captured when the partition is created, so a
 * command keeps routing against the same map even while the tend thread publishes new ones.
 * Lookups never block: they resolve against the captured map or throw.
 */
@EqualsAndHashCode(of = {"namespace", "partitionId"})
public final class Partition {

    @Getter
    private final String namespace;

    @Getter
    private final int partitionId;

    @Getter
    private final Replica replica;

    private final Partitions partitions;

    private int sequence;

    private Partition(String namespace, int partitionId, Replica replica, Partitions partitions) {
        this.namespace = namespace;
        this.partitionId = partitionId;
        this.replica = replica;
        this.partitions = partitions;
    }

    /**
     * Partition for a record digest.
     */
    public static Partition of(Cluster cluster, String namespace, byte[] digest, Replica replica) {
        return of(cluster.getView(), namespace, getPartitionId(digest), replica);
    }

    /**
     * Partition by id, against a captured view.
     */
    public static Partition of(ClusterView view, String namespace, int partitionId, Replica replica) {
        if (partitionId < 0 || partitionId >= Node.PARTITIONS) {
            throw new IllegalArgumentException("Invalid partition id " + partitionId);
        }

        Partitions partitions = view.getPartitionMap().get(namespace);
        if (partitions == null) {
            throw new InvalidNamespaceException(namespace, view.getPartitionMap().size());
        }
        return new Partition(namespace, partitionId, replica, partitions);
    }

    /**
     * Partition id of a record digest: the first four bytes read as a little endian unsigned
     * integer, modulo the partition count.
     */
    public static int getPartitionId(byte[] digest) {
        long value = (digest[0] & 0xFFL)
                | (digest[1] & 0xFFL) << 8
                | (digest[2] & 0xFFL) << 16
                | (digest[3] & 0xFFL) << 24;
        return (int) (value % Node.PARTITIONS);
    }

    /**
     * Node to read from according to the replica policy.
     */
    public Node getNodeRead(Cluster cluster) {
        switch (replica) {
            case MASTER:
                return getMasterNode(cluster);
            case MASTER_PROLES:
                return getMasterProlesNode(cluster);
            case RANDOM:
                return cluster.getRandomNode();
            case SEQUENCE:
            default:
                return getSequenceNode(cluster);
        }
    }

    /**
     * Node to write to. Writes always go to the master, except under {@link Replica#SEQUENCE}
     * where a retry may move on to the next replica.
     */
    public Node getNodeWrite(Cluster cluster) {
        if (replica == Replica.SEQUENCE) {
            return getSequenceNode(cluster);
        }
        return getMasterNode(cluster);
    }

    /**
     * Move on to the next replica for {@link Replica#SEQUENCE} routing.
     */
    public void prepareRetry() {
        sequence++;
    }

    /**
     * The master if active.
     *
     * @throws InvalidNodeException if the master is unknown or inactive.
     */
    public Node getMasterNode(Cluster cluster) {
        Node node = partitions.getMaster(partitionId);
        if (node != null && node.isActive()) {
            return node;
        }
        throw new InvalidNodeException(cluster.getNodes().size(), toString());
    }

    /**
     * The first active replica, starting from a level that rotates across calls. When no
     * replica is active, cp namespaces fail and ap namespaces fall back to any active node.
     */
    public Node getMasterProlesNode(Cluster cluster) {
        int replicaCount = partitions.getReplicaCount();
        int start = cluster.nextReplicaIndex();

        for (int i = 0; i < replicaCount; i++) {
            int index = Math.floorMod(start + i, replicaCount);
            Node node = partitions.getNode(index, partitionId);
            if (node != null && node.isActive()) {
                return node;
            }
        }

        if (partitions.isCpMode()) {
            throw new InvalidNodeException(cluster.getNodes().size(), toString());
        }
        return cluster.getRandomNode();
    }

    /**
     * The first active replica starting at the current sequence.
     */
    public Node getSequenceNode(Cluster cluster) {
        int replicaCount = partitions.getReplicaCount();

        for (int i = 0; i < replicaCount; i++) {
            int index = Math.floorMod(sequence, replicaCount);
            Node node = partitions.getNode(index, partitionId);
            if (node != null && node.isActive()) {
                return node;
            }
            sequence++;
        }
        throw new InvalidNodeException(cluster.getNodes().size(), toString());
    }

    @Override
    public String toString() {
        return namespace + ':' + partitionId;
    }
}
