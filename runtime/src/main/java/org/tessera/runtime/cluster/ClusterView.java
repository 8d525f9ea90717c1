package org.tessera.runtime.cluster;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Getter;
import lombok.ToString;
import org.tessera.runtime.view.Partitions;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * An immutable snapshot of the cluster: its nodes and its partition map.
 *
 * <p>The tend thread publishes a new view whenever the node list or the partition map
 * changes. Readers capture a view once and work against it, so they never see a node list and
 * a partition map from different moments. A cycle which changes nothing publishes nothing.
 */
@ToString(of = {"generation", "nodes"})
public final class ClusterView {

    /** The view of a cluster which has not been seeded yet. */
    public static final ClusterView EMPTY = new ClusterView(0, ImmutableList.of(), ImmutableMap.of());

    @Getter
    private final long generation;

    @Getter
    private final ImmutableList<Node> nodes;

    private final ImmutableMap<String, Node> nodesByName;

    @Getter
    private final ImmutableMap<String, Partitions> partitionMap;

    /** Features supported by every node of the view. */
    @Getter
    private final Set<NodeFeature> features;

    private ClusterView(long generation, ImmutableList<Node> nodes, ImmutableMap<String, Partitions> partitionMap) {
        this.generation = generation;
        this.nodes = nodes;
        this.partitionMap = partitionMap;

        ImmutableMap.Builder<String, Node> byName = ImmutableMap.builder();
        EnumSet<NodeFeature> common = nodes.isEmpty()
                ? EnumSet.noneOf(NodeFeature.class) : EnumSet.allOf(NodeFeature.class);
        for (Node node : nodes) {
            byName.put(node.getName(), node);
            common.retainAll(node.getFeatures());
        }
        this.nodesByName = byName.build();
        this.features = Collections.unmodifiableSet(common);
    }

    /**
     * A view with the same partition map and a new node list.
     */
    ClusterView withNodes(ImmutableList<Node> newNodes) {
        return new ClusterView(generation + 1, newNodes, partitionMap);
    }

    /**
     * A view with the same nodes and a new partition map.
     */
    ClusterView withPartitionMap(ImmutableMap<String, Partitions> newPartitionMap) {
        return new ClusterView(generation + 1, nodes, newPartitionMap);
    }

    public Node getNode(String name) {
        return nodesByName.get(name);
    }

    public boolean hasFeature(NodeFeature feature) {
        return features.contains(feature);
    }

    /**
     * Whether a node owns any replica of any partition in this view.
     */
    public boolean ownsPartitions(Node node) {
        for (Partitions partitions : partitionMap.values()) {
            if (partitions.contains(node)) {
                return true;
            }
        }
        return false;
    }
}
