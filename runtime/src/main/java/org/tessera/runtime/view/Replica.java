package org.tessera.runtime.view;

/**
 * How a command chooses among the replicas of a partition.
 */
public enum Replica {
    /** Always the master. */
    MASTER,

    /** Rotate across master and proles, for spreading reads. */
    MASTER_PROLES,

    /** Master first, then proles in order as the command is retried. */
    SEQUENCE,

    /** Any node of the cluster, partition ownership is ignored. */
    RANDOM
}
