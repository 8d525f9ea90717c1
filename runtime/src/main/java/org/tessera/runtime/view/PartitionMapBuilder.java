package org.tessera.runtime.view;

import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.tessera.runtime.cluster.Node;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Scratch copy of the partition map used during one tend cycle.
 *
 * <p>Nothing is copied until the first real change: a namespace's {@link Partitions} is
 * duplicated the first time one of its cells changes. When nothing changed,
 * {@link #build()} returns the very map the builder started from.
 */
@Slf4j
public final class PartitionMapBuilder {

    private final ImmutableMap<String, Partitions> base;

    private Map<String, Partitions> map;

    private final Set<String> writable = new HashSet<>();

    public PartitionMapBuilder(ImmutableMap<String, Partitions> base) {
        this.base = base;
        this.map = base;
    }

    public Partitions get(String namespace) {
        return map.get(namespace);
    }

    /**
     * Make sure a namespace exists with the given replica count and consistency mode.
     *
     * @return The namespace's current partitions.
     */
    Partitions prepare(String namespace, int replicaCount, boolean cpMode) {
        Partitions partitions = map.get(namespace);

        if (partitions == null) {
            partitions = new Partitions(Node.PARTITIONS, replicaCount, cpMode);
            copyMap();
            map.put(namespace, partitions);
            writable.add(namespace);
        } else if (partitions.getReplicaCount() != replicaCount || partitions.isCpMode() != cpMode) {
            log.info("prepare: Namespace {} changed from replicas={} cp={} to replicas={} cp={}",
                    namespace, partitions.getReplicaCount(), partitions.isCpMode(), replicaCount, cpMode);
            partitions = new Partitions(partitions, replicaCount, cpMode);
            copyMap();
            map.put(namespace, partitions);
            writable.add(namespace);
        }
        return partitions;
    }

    /**
     * Record a partition owner.
     *
     * @return The namespace's partitions after the change.
     */
    Partitions assign(String namespace, int replicaIndex, int partitionId, Node node, int regime) {
        Partitions partitions = map.get(namespace);

        if (!writable.contains(namespace)) {
            partitions = partitions.copy();
            copyMap();
            map.put(namespace, partitions);
            writable.add(namespace);
        }
        partitions.set(replicaIndex, partitionId, node, regime);
        return partitions;
    }

    private void copyMap() {
        if (map == base) {
            map = new LinkedHashMap<>(base);
        }
    }

    public boolean isChanged() {
        return map != base;
    }

    /**
     * The map to publish: the previous map when nothing changed.
     */
    public ImmutableMap<String, Partitions> build() {
        return isChanged() ? ImmutableMap.copyOf(map) : base;
    }
}
