package org.tessera.runtime.query;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.tessera.runtime.cluster.Node;
import org.tessera.runtime.view.Partition;

import javax.annotation.Nullable;
import java.io.Serializable;

/**
 * Range of partitions read by a scan or query. The filter doubles as a cursor: once used, it
 * holds the progress of every partition, so passing it to a later scan resumes after the last
 * record delivered instead of starting over.
 *
 * <p>Set {@link #setPartitions(PartitionStatus[])} to null to reset the cursor.
 */
@Getter
public final class PartitionFilter implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int begin;

    private final int count;

    @Nullable
    private final byte[] digest;

    /** Per partition cursor, created by the first tracker that uses this filter. */
    @Setter
    @Nullable
    private PartitionStatus[] partitions;

    /** Whether paginated reads with this filter have returned every record. */
    @Setter(AccessLevel.PACKAGE)
    private boolean done;

    @Setter(AccessLevel.PACKAGE)
    @Getter(AccessLevel.PACKAGE)
    private boolean retry;

    private PartitionFilter(int begin, int count, @Nullable byte[] digest) {
        this.begin = begin;
        this.count = count;
        this.digest = digest;
    }

    /**
     * Every partition.
     */
    public static PartitionFilter all() {
        return new PartitionFilter(0, Node.PARTITIONS, null);
    }

    /**
     * A single partition.
     */
    public static PartitionFilter id(int partitionId) {
        return new PartitionFilter(partitionId, 1, null);
    }

    /**
     * Records after a digest, within the partition holding that digest. Digest order is not
     * the order of user keys.
     */
    public static PartitionFilter after(byte[] digest) {
        return new PartitionFilter(Partition.getPartitionId(digest), 1, digest);
    }

    /**
     * Partitions {@code begin} to {@code begin + count - 1}.
     */
    public static PartitionFilter range(int begin, int count) {
        return new PartitionFilter(begin, count, null);
    }

    @Override
    public String toString() {
        return "PartitionFilter{begin=" + begin + ", count=" + count + ", done=" + done + "}";
    }
}
