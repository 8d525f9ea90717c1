package org.tessera.runtime.query;

import lombok.extern.slf4j.Slf4j;
import org.tessera.runtime.exceptions.ClusterException;
import org.tessera.runtime.exceptions.ResultCode;
import org.tessera.runtime.exceptions.unrecoverable.UnrecoverableTesseraInterruptedError;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A {@link RecordSink} the application pulls from. Units push records into a bounded queue and
 * block while it is full; a single consumer thread reads them with {@link #next()}.
 *
 * <pre>
 * try (RecordSet&lt;Bins&gt; rs = new RecordSet&lt;&gt;(policy.getRecordQueueSize(), token)) {
 *     executor.executeAsync(pool);
 *     while (rs.next()) {
 *         process(rs.getRecord());
 *     }
 * }
 * </pre>
 */
@Slf4j
public final class RecordSet<T> implements RecordSink<T>, AutoCloseable {

    private static final ScanRecord<?> END = new ScanRecord<>(new byte[0], null);

    /** Producers re-check cancellation at this interval while the queue is full. */
    private static final long PUT_POLL_MS = 100;

    private final BlockingQueue<ScanRecord<?>> queue;

    private final CancellationToken token;

    private volatile boolean valid = true;

    private volatile RuntimeException failure;

    private ScanRecord<T> record;

    public RecordSet(int capacity, CancellationToken token) {
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.token = token;
    }

    /**
     * Advance to the next record, blocking until one arrives.
     *
     * @return False once every record was read.
     * @throws ClusterException if the operation failed.
     */
    @SuppressWarnings("unchecked")
    public boolean next() {
        if (!valid) {
            checkForFailure();
            return false;
        }

        ScanRecord<?> next;
        try {
            next = queue.take();
        } catch (InterruptedException ie) {
            token.cancel();
            throw new UnrecoverableTesseraInterruptedError("Interrupted while waiting for records", ie);
        }

        if (next == END) {
            valid = false;
            checkForFailure();
            return false;
        }

        record = (ScanRecord<T>) next;
        return true;
    }

    public ScanRecord<T> getRecord() {
        return record;
    }

    private void checkForFailure() {
        RuntimeException cause = failure;
        if (cause != null) {
            throw new ClusterException(cause instanceof ClusterException
                    ? ((ClusterException) cause).getResultCode() : ResultCode.CLIENT_ERROR,
                    "Scan failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public boolean onRecord(ScanRecord<T> scanRecord) {
        try {
            while (valid) {
                if (queue.offer(scanRecord, PUT_POLL_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
                if (token.isCancelled()) {
                    return false;
                }
            }
            return false;
        } catch (InterruptedException ie) {
            throw new UnrecoverableTesseraInterruptedError("Interrupted while queueing a record", ie);
        }
    }

    @Override
    public void onSuccess() {
        putEnd();
    }

    @Override
    public void onFailure(RuntimeException cause) {
        if (valid) {
            failure = cause;
            // Records still queued are dropped, the consumer sees the failure next.
            valid = false;
            queue.clear();
        }
        putEnd();
    }

    private void putEnd() {
        try {
            while (!queue.offer(END, PUT_POLL_MS, TimeUnit.MILLISECONDS)) {
                if (!valid) {
                    queue.clear();
                }
            }
        } catch (InterruptedException ie) {
            throw new UnrecoverableTesseraInterruptedError("Interrupted while ending a record set", ie);
        }
    }

    /**
     * Stop reading. Units still running are cancelled.
     */
    @Override
    public void close() {
        if (valid) {
            valid = false;
            log.debug("close: Record set closed before the end, cancelling");
            token.cancel();
            queue.clear();
        }
    }
}
