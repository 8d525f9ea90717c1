package org.tessera.runtime.cluster;

import lombok.Value;
import org.tessera.util.Host;

/**
 * Point in time statistics of one node.
 */
@Value
public class NodeStats {
    String name;
    Host host;
    boolean active;
    int failures;
    int partitionGeneration;
    int connectionsInUse;
    int connectionsInPool;
    int connectionsOpened;
    int connectionsClosed;
    int errorCount;
}
