package org.tessera.runtime.query;

/**
 * Reads the partitions of one unit from its node. Implementations send the request over a
 * connection borrowed from {@link PartitionTask#getNode()} and hand every record to
 * {@link PartitionTask#deliver(byte[], Object)} or {@link PartitionTask#deliver(byte[], long, Object)}.
 *
 * <p>Errors are raised as {@link org.tessera.runtime.exceptions.ClusterException}; the
 * executor decides whether they end the operation or are retried in the next round.
 *
 * @param <T> Type of the decoded record body.
 */
@FunctionalInterface
public interface PartitionCommand<T> {

    void execute(PartitionTask<T> task);
}
