package org.tessera.runtime.cluster;

import lombok.Value;

import java.util.List;

/**
 * Point in time statistics of a cluster.
 */
@Value
public class ClusterStats {

    List<NodeStats> nodes;

    /** Hosts which failed validation during the last tend cycle. */
    int invalidNodeCount;

    /** Tend cycles completed since the cluster connected. */
    long tendCount;

    /** Generation of the published cluster view. */
    long viewGeneration;
}
