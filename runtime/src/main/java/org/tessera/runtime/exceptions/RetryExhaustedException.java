package org.tessera.runtime.exceptions;

import com.google.common.collect.ImmutableList;
import lombok.Getter;

import java.util.List;

/**
 * Thrown when an operation has been retried as many times as it is allowed to.
 */
public class RetryExhaustedException extends ClusterException {

    /** Errors that caused the individual retries. */
    @Getter
    private final List<ClusterException> subExceptions;

    public RetryExhaustedException(int maxRetries, int iteration, List<ClusterException> subExceptions) {
        super(ResultCode.MAX_RETRIES_EXCEEDED, buildMessage(maxRetries, subExceptions));
        this.subExceptions = ImmutableList.copyOf(subExceptions);
        setIteration(iteration);
    }

    private static String buildMessage(int maxRetries, List<ClusterException> subExceptions) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Max retries exceeded: ").append(maxRetries);

        if (!subExceptions.isEmpty()) {
            sb.append(System.lineSeparator()).append("sub-exceptions:");
            for (ClusterException e : subExceptions) {
                sb.append(System.lineSeparator()).append(e.getMessage());
            }
        }
        return sb.toString();
    }
}
