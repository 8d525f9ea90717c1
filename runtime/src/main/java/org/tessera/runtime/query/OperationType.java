package org.tessera.runtime.query;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.tessera.runtime.cluster.NodeFeature;
import org.tessera.runtime.exceptions.ResultCode;

/**
 * Kind of partition operation. Decides the node feature that tells whether nodes honor a
 * per node record limit, and the result code reported when the operation is stopped.
 */
@AllArgsConstructor
@Getter
public enum OperationType {
    SCAN(NodeFeature.PARTITION_SCAN, ResultCode.SCAN_TERMINATED),
    QUERY(NodeFeature.PARTITION_QUERY, ResultCode.QUERY_TERMINATED);

    private final NodeFeature partitionFeature;

    private final int terminatedCode;
}
