package org.tessera.runtime.query;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.ToString;
import org.tessera.runtime.view.Replica;

import java.time.Duration;

/**
 * Retry, timeout and paging limits of a partition scan or query.
 */
@Builder(toBuilder = true)
@Getter
@ToString
public class ScanPolicy {

    /**
     * Replica a partition is read from. {@link Replica#MASTER} always reads the master, every
     * other policy starts at the master and moves to the next replica when a partition is
     * retried.
     */
    @Default
    private final Replica replica = Replica.SEQUENCE;

    /** Rounds retried after the first one before giving up. */
    @Default
    private final int maxRetries = 5;

    @Default
    private final Duration sleepBetweenRetries = Duration.ZERO;

    /** Limit of a single node request. {@link Duration#ZERO} for none. */
    @Default
    private final Duration socketTimeout = Duration.ofSeconds(30);

    /** Limit of the whole operation across rounds. {@link Duration#ZERO} for none. */
    @Default
    private final Duration totalTimeout = Duration.ZERO;

    /** Records to return in one page, 0 for all. */
    @Default
    private final long maxRecords = 0;

    /** Nodes read in parallel, 0 for all of them. */
    @Default
    private final int maxConcurrentNodes = 0;

    /** Capacity of the queue behind a {@link RecordSet}. */
    @Default
    private final int recordQueueSize = 5000;

    public static ScanPolicy defaults() {
        return ScanPolicy.builder().build();
    }
}
