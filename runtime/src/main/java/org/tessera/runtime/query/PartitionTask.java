package org.tessera.runtime.query;

import lombok.Getter;
import org.tessera.runtime.cluster.Node;

/**
 * One unit of a round: the partitions a node is asked for, plus the hooks a
 * {@link PartitionCommand} reports progress through.
 */
public final class PartitionTask<T> {

    @Getter
    private final NodePartitions nodePartitions;

    private final PartitionTracker tracker;

    private final RecordSink<T> sink;

    private final CancellationToken token;

    private final OperationType type;

    PartitionTask(NodePartitions nodePartitions, PartitionTracker tracker, RecordSink<T> sink,
                  CancellationToken token, OperationType type) {
        this.nodePartitions = nodePartitions;
        this.tracker = tracker;
        this.sink = sink;
        this.token = token;
        this.type = type;
    }

    public Node getNode() {
        return nodePartitions.getNode();
    }

    /** Time limit of one node request in this round, 0 for none. */
    public long getSocketTimeoutMs() {
        return tracker.getSocketTimeoutMs();
    }

    /** Records the node may return in this round, 0 for no limit. */
    public long getRecordMax() {
        return nodePartitions.getRecordMax();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    /**
     * @throws org.tessera.runtime.exceptions.OperationTerminatedException if the operation was
     *                                                                     cancelled.
     */
    public void checkCancelled() {
        token.throwIfCancelled(type.getTerminatedCode());
    }

    /**
     * Deliver a scan record.
     *
     * @return False if the unit's record limit is reached and the record was dropped.
     */
    public boolean deliver(byte[] digest, T value) {
        checkCancelled();
        if (!tracker.allowRecord(nodePartitions)) {
            return false;
        }
        accept(new ScanRecord<>(digest, value));
        tracker.setDigest(nodePartitions, digest);
        return true;
    }

    /**
     * Deliver a query record along with its secondary index value.
     *
     * @return False if the unit's record limit is reached and the record was dropped.
     */
    public boolean deliver(byte[] digest, long bval, T value) {
        checkCancelled();
        if (!tracker.allowRecord(nodePartitions)) {
            return false;
        }
        accept(new ScanRecord<>(digest, value));
        tracker.setLast(nodePartitions, digest, bval);
        return true;
    }

    private void accept(ScanRecord<T> record) {
        if (!sink.onRecord(record)) {
            token.cancel();
            checkCancelled();
        }
    }

    /**
     * The node could not complete a partition in this round.
     */
    public void partitionUnavailable(int partitionId) {
        tracker.partitionUnavailable(nodePartitions, partitionId);
    }
}
