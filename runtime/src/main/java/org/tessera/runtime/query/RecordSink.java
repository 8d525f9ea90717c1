package org.tessera.runtime.query;

/**
 * Where the records of a partition operation go. Called concurrently by the units of a round.
 *
 * @param <T> Type of the decoded record body.
 */
@FunctionalInterface
public interface RecordSink<T> {

    /**
     * Accept one record.
     *
     * @return False to stop the operation.
     */
    boolean onRecord(ScanRecord<T> record);

    /**
     * Every round completed.
     */
    default void onSuccess() {
    }

    /**
     * The operation failed or was stopped, no more records follow.
     */
    default void onFailure(RuntimeException cause) {
    }
}
