package org.tessera.runtime.query;

import org.tessera.runtime.exceptions.OperationTerminatedException;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation shared by every unit of one partition operation. Cancelling is
 * permanent.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * @param resultCode Code of the {@link OperationTerminatedException} to raise.
     */
    public void throwIfCancelled(int resultCode) {
        if (isCancelled()) {
            throw new OperationTerminatedException(resultCode);
        }
    }

    /**
     * Sleep until the token is cancelled or the timeout elapses.
     *
     * @return True if the token was cancelled.
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return cancelled.await(timeout, unit);
    }
}
