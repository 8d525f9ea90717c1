package org.tessera.runtime.exceptions;

import lombok.Getter;

/**
 * An operation ran out of its total time budget.
 */
public class ClusterTimeoutException extends ClusterException {

    @Getter
    private final long totalTimeoutMs;

    public ClusterTimeoutException(long totalTimeoutMs, int iteration) {
        super(ResultCode.TIMEOUT, "Client timeout: total=" + totalTimeoutMs + "ms iterations=" + iteration);
        this.totalTimeoutMs = totalTimeoutMs;
        setIteration(iteration);
    }
}
