package org.tessera.runtime.query;

import lombok.Getter;
import lombok.Setter;
import org.tessera.runtime.cluster.Node;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Cursor of one partition in a scan or query: the last record delivered and whether the
 * partition still has work pending.
 */
@Getter
@Setter
public final class PartitionStatus implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int id;

    /** Digest of the last record delivered, null if nothing was delivered yet. */
    private byte[] digest;

    /** Secondary index value of the last record delivered by a query. */
    private long bval;

    private boolean retry;

    /** Node the partition was last assigned to. */
    private transient Node node;

    /** Replica level to try next, advanced when the partition is retried after a failure. */
    private transient int sequence;

    public PartitionStatus(int id) {
        this.id = id;
        this.retry = true;
    }

    @Override
    public String toString() {
        return "PartitionStatus{id=" + id + ", retry=" + retry + ", sequence=" + sequence
                + ", digest=" + (digest == null ? "null" : Arrays.toString(digest)) + ", bval=" + bval + "}";
    }
}
