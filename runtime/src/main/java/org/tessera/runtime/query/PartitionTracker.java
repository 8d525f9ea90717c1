package org.tessera.runtime.query;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.tessera.runtime.cluster.Cluster;
import org.tessera.runtime.cluster.Node;
import org.tessera.runtime.exceptions.ClusterException;
import org.tessera.runtime.exceptions.ClusterTimeoutException;
import org.tessera.runtime.exceptions.InvalidNamespaceException;
import org.tessera.runtime.exceptions.InvalidNodeException;
import org.tessera.runtime.exceptions.ResultCode;
import org.tessera.runtime.exceptions.RetryExhaustedException;
import org.tessera.runtime.view.Partition;
import org.tessera.runtime.view.Partitions;
import org.tessera.runtime.view.Replica;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Splits a scan or query into per node units of work, round after round, until every
 * partition of the requested range has been read.
 *
 * <p>Progress is kept per partition id and last delivered digest, never per node, so a
 * partition that migrates between rounds is resumed on its new master without delivering
 * the same records twice.
 */
@Slf4j
public final class PartitionTracker {

    private final PartitionStatus[] partitions;

    private final int partitionsCapacity;

    private final int partitionBegin;

    private final int nodeCapacity;

    @Nullable
    private final Node nodeFilter;

    @Nullable
    private final PartitionFilter partitionFilter;

    private List<NodePartitions> nodePartitionsList = ImmutableList.of();

    private final List<ClusterException> exceptions = new ArrayList<>();

    private long maxRecords;

    @Getter
    private long socketTimeoutMs;

    @Getter
    private long totalTimeoutMs;

    private final long sleepBetweenRetriesMs;

    private final Replica replica;

    private long deadlineNanos;

    /** Round currently being executed, starting at 1. */
    @Getter
    private int iteration = 1;

    /**
     * Track every partition of the cluster.
     */
    public PartitionTracker(ScanPolicy policy, List<Node> nodes) {
        this.partitionBegin = 0;
        this.nodeCapacity = Math.max(1, nodes.size());
        this.nodeFilter = null;
        this.partitionFilter = null;

        // Initial partition capacity for each node as average + 25%.
        int ppn = Node.PARTITIONS / nodeCapacity;
        ppn += ppn >>> 2;
        this.partitionsCapacity = ppn;
        this.partitions = initPartitions(Node.PARTITIONS, null);
        this.sleepBetweenRetriesMs = policy.getSleepBetweenRetries().toMillis();
        this.replica = policy.getReplica();
        setMaxRecords(policy.getMaxRecords());
        initTimeout(policy);
    }

    /**
     * Track the partitions a single node is master of.
     */
    public PartitionTracker(ScanPolicy policy, Node nodeFilter) {
        this.partitionBegin = 0;
        this.nodeCapacity = 1;
        this.nodeFilter = nodeFilter;
        this.partitionFilter = null;
        this.partitionsCapacity = Node.PARTITIONS;
        this.partitions = initPartitions(Node.PARTITIONS, null);
        this.sleepBetweenRetriesMs = policy.getSleepBetweenRetries().toMillis();
        this.replica = policy.getReplica();
        setMaxRecords(policy.getMaxRecords());
        initTimeout(policy);
    }

    /**
     * Track the partitions of a filter, resuming from the filter's cursor if it was used
     * before.
     */
    public PartitionTracker(ScanPolicy policy, List<Node> nodes, PartitionFilter filter) {
        // The partition count is fixed, so the range is checked here rather than in the filter.
        if (filter.getBegin() < 0 || filter.getBegin() >= Node.PARTITIONS) {
            throw new ClusterException(ResultCode.PARAMETER_ERROR, "Invalid partition begin " + filter.getBegin()
                    + ". Valid range: 0-" + (Node.PARTITIONS - 1));
        }

        if (filter.getCount() <= 0) {
            throw new ClusterException(ResultCode.PARAMETER_ERROR, "Invalid partition count " + filter.getCount());
        }

        if (filter.getBegin() + filter.getCount() > Node.PARTITIONS) {
            throw new ClusterException(ResultCode.PARAMETER_ERROR, "Invalid partition range ("
                    + filter.getBegin() + "," + filter.getCount() + ")");
        }

        setMaxRecords(policy.getMaxRecords());
        this.partitionBegin = filter.getBegin();
        this.nodeCapacity = Math.max(1, nodes.size());
        this.nodeFilter = null;
        this.partitionsCapacity = filter.getCount();

        if (filter.getPartitions() == null) {
            filter.setPartitions(initPartitions(filter.getCount(), filter.getDigest()));
            filter.setRetry(true);
        } else if (maxRecords == 0) {
            // Retry all partitions when maxRecords not specified.
            filter.setRetry(true);
        }

        this.partitions = filter.getPartitions();
        this.partitionFilter = filter;
        this.sleepBetweenRetriesMs = policy.getSleepBetweenRetries().toMillis();
        this.replica = policy.getReplica();
        initTimeout(policy);
    }

    private void setMaxRecords(long maxRecords) {
        if (maxRecords < 0) {
            throw new ClusterException(ResultCode.PARAMETER_ERROR, "Invalid maxRecords: " + maxRecords);
        }
        this.maxRecords = maxRecords;
    }

    private PartitionStatus[] initPartitions(int partitionCount, @Nullable byte[] digest) {
        PartitionStatus[] partsAll = new PartitionStatus[partitionCount];

        for (int i = 0; i < partitionCount; i++) {
            partsAll[i] = new PartitionStatus(partitionBegin + i);
        }

        if (digest != null) {
            partsAll[0].setDigest(digest);
        }
        return partsAll;
    }

    private void initTimeout(ScanPolicy policy) {
        socketTimeoutMs = policy.getSocketTimeout().toMillis();
        totalTimeoutMs = policy.getTotalTimeout().toMillis();

        if (totalTimeoutMs > 0) {
            deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(totalTimeoutMs);

            if (socketTimeoutMs == 0 || socketTimeoutMs > totalTimeoutMs) {
                socketTimeoutMs = totalTimeoutMs;
            }
        }
    }

    /**
     * Group the partitions of this round by their current master.
     *
     * @throws InvalidNamespaceException if the namespace is not in the partition map.
     * @throws InvalidNodeException      if a partition has no master, or nothing was assigned.
     */
    public List<NodePartitions> assignPartitionsToNodes(Cluster cluster, String namespace) {
        List<NodePartitions> list = new ArrayList<>(nodeCapacity);

        Map<String, Partitions> map = cluster.getView().getPartitionMap();
        Partitions parts = map.get(namespace);

        if (parts == null) {
            throw new InvalidNamespaceException(namespace, map.size());
        }

        boolean retry = (partitionFilter == null || partitionFilter.isRetry()) && iteration == 1;

        for (PartitionStatus part : partitions) {
            if (retry || part.isRetry()) {
                Node node = getNodeRead(parts, part);
                part.setNode(node);
                part.setRetry(false);

                // Compare by name: the map may be in transition between two instances of the same node.
                if (nodeFilter != null && !nodeFilter.getName().equals(node.getName())) {
                    continue;
                }

                NodePartitions np = findNode(list, node);

                if (np == null) {
                    // A map in transition can yield several units for one node name.
                    np = new NodePartitions(node, partitionsCapacity);
                    list.add(np);
                }
                np.addPartition(part);
            }
        }

        int nodeSize = list.size();

        if (nodeSize == 0) {
            throw new InvalidNodeException("No nodes were assigned");
        }

        // A scan may end early, so a reused filter retries everything unless the scan
        // completes normally with maxRecords set.
        if (partitionFilter != null) {
            partitionFilter.setRetry(true);
        }

        if (maxRecords > 0) {
            if (maxRecords < nodeSize) {
                // Only include nodes that have at least 1 record requested.
                nodeSize = (int) maxRecords;
                list = new ArrayList<>(list.subList(0, nodeSize));
            }

            long max = maxRecords / nodeSize;
            int rem = (int) (maxRecords - (max * nodeSize));

            for (int i = 0; i < nodeSize; i++) {
                list.get(i).recordMax = i < rem ? max + 1 : max;
            }
        }

        log.debug("assignPartitionsToNodes[{}]: Round {} assigned {} units", namespace, iteration, list.size());
        nodePartitionsList = list;
        return list;
    }

    /**
     * The replica to read a partition from in this round.
     *
     * @throws InvalidNodeException if the partition has no master.
     */
    private Node getNodeRead(Partitions parts, PartitionStatus ps) {
        if (replica != Replica.MASTER) {
            int max = parts.getReplicaCount();

            for (int i = 0; i < max; i++) {
                Node node = parts.getNode(ps.getSequence() % max, ps.getId());

                if (node != null && node.isActive()) {
                    return node;
                }
                ps.setSequence(ps.getSequence() + 1);
            }
        }

        Node master = parts.getMaster(ps.getId());

        if (master == null) {
            throw new InvalidNodeException(ps.getId());
        }
        // An inactive master fails its unit, which is then retried.
        return master;
    }

    private static NodePartitions findNode(List<NodePartitions> list, Node node) {
        for (NodePartitions np : list) {
            if (np.getNode() == node) {
                return np;
            }
        }
        return null;
    }

    /**
     * Whether a unit may deliver one more record within its share of maxRecords.
     */
    public boolean allowRecord(NodePartitions np) {
        return np.recordMax == 0 || np.recordCount < np.recordMax;
    }

    /**
     * The server could not finish a partition in this round. The partition is read again in the
     * next round, from its cursor, on the next replica unless the policy reads masters only.
     */
    public void partitionUnavailable(NodePartitions np, int partitionId) {
        PartitionStatus ps = partitions[partitionId - partitionBegin];
        ps.setRetry(true);
        ps.setSequence(ps.getSequence() + 1);
        np.partsUnavailable++;
    }

    /**
     * Record the digest of a delivered scan record.
     */
    public void setDigest(NodePartitions np, byte[] digest) {
        int partitionId = Partition.getPartitionId(digest);
        partitions[partitionId - partitionBegin].setDigest(digest);
        np.recordCount++;
    }

    /**
     * Record the digest and index value of a delivered query record.
     */
    public void setLast(NodePartitions np, byte[] digest, long bval) {
        int partitionId = Partition.getPartitionId(digest);
        PartitionStatus ps = partitions[partitionId - partitionBegin];
        ps.setDigest(digest);
        ps.setBval(bval);
        np.recordCount++;
    }

    /**
     * Decide whether the end of the current round ends the operation.
     *
     * @param partitionsSupported Whether nodes return up to their record limit per round.
     * @return True if complete, false if another round is needed.
     * @throws RetryExhaustedException  if rounds are exhausted.
     * @throws ClusterTimeoutException if the total timeout expired.
     */
    public boolean isComplete(boolean partitionsSupported, ScanPolicy policy) {
        long recordCount = 0;
        int partsUnavailable = 0;

        for (NodePartitions np : nodePartitionsList) {
            recordCount += np.recordCount;
            partsUnavailable += np.partsUnavailable;
            log.trace("isComplete: {}", np);
        }

        if (partsUnavailable == 0) {
            if (maxRecords == 0) {
                if (partitionFilter != null) {
                    partitionFilter.setDone(true);
                }
            } else if (iteration > 1) {
                if (partitionFilter != null) {
                    // Only the failed node's partitions were read in later rounds, the rest
                    // must be read again if the filter is reused.
                    partitionFilter.setRetry(true);
                    partitionFilter.setDone(false);
                }
            } else if (partitionsSupported) {
                // A node that reached its limit may still have records.
                boolean done = true;

                for (NodePartitions np : nodePartitionsList) {
                    if (np.recordCount >= np.recordMax) {
                        markRetry(np);
                        done = false;
                    }
                }

                if (partitionFilter != null) {
                    // Only specific node partitions are retried.
                    partitionFilter.setRetry(false);
                    partitionFilter.setDone(done);
                }
            } else {
                // Older nodes may return less than their limit and still have records, a node is
                // done only when it returned nothing.
                for (NodePartitions np : nodePartitionsList) {
                    if (np.recordCount > 0) {
                        markRetry(np);
                    }
                }

                if (partitionFilter != null) {
                    partitionFilter.setRetry(false);
                    partitionFilter.setDone(recordCount == 0);
                }
            }
            return true;
        }

        if (maxRecords > 0 && recordCount >= maxRecords) {
            return true;
        }

        // Check if limits have been reached.
        if (iteration > policy.getMaxRetries()) {
            throw new RetryExhaustedException(policy.getMaxRetries(), iteration, getExceptions());
        }

        if (totalTimeoutMs > 0) {
            long remaining = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()) - sleepBetweenRetriesMs;

            if (remaining <= 0) {
                throw new ClusterTimeoutException(policy.getTotalTimeout().toMillis(), iteration);
            }

            if (remaining < totalTimeoutMs) {
                totalTimeoutMs = remaining;

                if (socketTimeoutMs > totalTimeoutMs) {
                    socketTimeoutMs = totalTimeoutMs;
                }
            }
        }

        // Prepare for next iteration.
        if (maxRecords > 0) {
            maxRecords -= recordCount;
        }
        iteration++;
        return false;
    }

    /**
     * Decide whether a unit's error is retried in the next round. Retried errors mark every
     * partition of the unit unavailable.
     */
    public boolean shouldRetry(NodePartitions np, ClusterException e) {
        e.setIteration(iteration);

        switch (e.getResultCode()) {
            case ResultCode.SERVER_NOT_AVAILABLE:
            case ResultCode.TIMEOUT:
            case ResultCode.INDEX_NOTFOUND:
            case ResultCode.INDEX_NOTREADABLE:
                // Called concurrently by the units of a round.
                synchronized (exceptions) {
                    exceptions.add(e);
                }
                markRetrySequence(np);
                np.partsUnavailable = np.getPartsFull().size() + np.getPartsPartial().size();
                return true;

            default:
                return false;
        }
    }

    private static void markRetrySequence(NodePartitions np) {
        for (PartitionStatus ps : np.getPartsFull()) {
            ps.setRetry(true);
            ps.setSequence(ps.getSequence() + 1);
        }

        for (PartitionStatus ps : np.getPartsPartial()) {
            ps.setRetry(true);
            ps.setSequence(ps.getSequence() + 1);
        }
    }

    private static void markRetry(NodePartitions np) {
        for (PartitionStatus ps : np.getPartsFull()) {
            ps.setRetry(true);
        }

        for (PartitionStatus ps : np.getPartsPartial()) {
            ps.setRetry(true);
        }
    }

    /**
     * Mark every partition for retry after a fatal error, so a reused filter reads them all.
     */
    public void partitionError() {
        if (partitionFilter != null) {
            partitionFilter.setRetry(true);
        }
    }

    /**
     * Retried errors observed so far.
     */
    public List<ClusterException> getExceptions() {
        synchronized (exceptions) {
            return ImmutableList.copyOf(exceptions);
        }
    }
}
