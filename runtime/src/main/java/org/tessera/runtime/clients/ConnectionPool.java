package org.tessera.runtime.clients;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.tessera.runtime.exceptions.ConnectionException;
import org.tessera.runtime.exceptions.ResultCode;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * The connections a node lends to application threads.
 *
 * <p>Connections are spread over one or more bounded LIFO sub-pools. Borrowing pops the most
 * recently used connection, so idle connections collect at the tail where they are trimmed.
 * Connections opened by a sub-pool are always returned to it.
 */
@Slf4j
public class ConnectionPool {

    private final String nodeName;

    private final SubPool[] pools;

    private final Supplier<Connection> connector;

    private final long maxSocketIdleNanos;

    private final AtomicInteger poolIndex = new AtomicInteger();

    @Getter
    private final AtomicInteger connectionsOpened = new AtomicInteger();

    @Getter
    private final AtomicInteger connectionsClosed = new AtomicInteger();

    /**
     * @param nodeName        Owner, for error messages.
     * @param poolCount       Number of sub-pools.
     * @param minConnections  Connections to keep open across all sub-pools.
     * @param maxConnections  Upper bound of connections across all sub-pools.
     * @param maxSocketIdleNanos Idle time after which a pooled connection is discarded, 0 to never discard.
     * @param connector       Opens a new connection to the node.
     */
    public ConnectionPool(String nodeName, int poolCount, int minConnections, int maxConnections,
                          long maxSocketIdleNanos, Supplier<Connection> connector) {
        Preconditions.checkArgument(poolCount > 0, "poolCount must be positive");
        Preconditions.checkArgument(maxConnections >= poolCount,
                "maxConnections %s must be at least poolCount %s", maxConnections, poolCount);
        Preconditions.checkArgument(minConnections <= maxConnections,
                "minConnections %s exceeds maxConnections %s", minConnections, maxConnections);

        this.nodeName = nodeName;
        this.connector = connector;
        this.maxSocketIdleNanos = maxSocketIdleNanos;
        this.pools = new SubPool[poolCount];

        int max = maxConnections / poolCount;
        int maxRem = maxConnections - max * poolCount;
        int min = minConnections / poolCount;
        int minRem = minConnections - min * poolCount;

        for (int i = 0; i < poolCount; i++) {
            int capacity = i < maxRem ? max + 1 : max;
            int minSize = i < minRem ? min + 1 : min;
            pools[i] = new SubPool(minSize, capacity);
        }
    }

    /**
     * Borrow a connection, opening a new one when no pooled connection is usable.
     *
     * @throws ConnectionException with {@link ResultCode#NO_MORE_CONNECTIONS} if every sub-pool
     *                             is at capacity.
     */
    public PooledConnection borrow() {
        int max = pools.length;
        int initial = max == 1 ? 0 : Math.floorMod(poolIndex.getAndIncrement(), max);

        for (int i = 0; i < max; i++) {
            SubPool pool = pools[(initial + i) % max];
            Connection conn;

            while ((conn = pool.connections.pollFirst()) != null) {
                if (isUsable(conn)) {
                    return new PooledConnection(conn, pool);
                }
                closeConnection(conn, pool);
            }

            if (pool.total.incrementAndGet() <= pool.capacity) {
                try {
                    conn = connector.get();
                } catch (RuntimeException e) {
                    pool.total.decrementAndGet();
                    throw e;
                }
                connectionsOpened.incrementAndGet();
                return new PooledConnection(conn, pool);
            }
            pool.total.decrementAndGet();
        }

        throw new ConnectionException(ResultCode.NO_MORE_CONNECTIONS,
                "Node " + nodeName + " max connections would be exceeded");
    }

    /**
     * Return a borrowed connection.
     *
     * @param connection The connection.
     * @param reuse      False when the owning node is no longer active, in which case the
     *                   connection is closed instead of pooled.
     */
    public void release(PooledConnection connection, boolean reuse) {
        SubPool pool = connection.pool;
        Connection conn = connection.delegate;

        if (!reuse || !conn.isOpen() || !pool.connections.offerFirst(conn)) {
            closeConnection(conn, pool);
        }
    }

    /**
     * Discard a borrowed connection that is in an unknown state.
     */
    public void discard(PooledConnection connection) {
        closeConnection(connection.delegate, connection.pool);
    }

    /**
     * Trim idle connections and open connections until every sub-pool holds its minimum.
     * Called periodically from the tend thread.
     */
    public void balance() {
        for (SubPool pool : pools) {
            int excess = pool.total.get() - pool.minSize;

            if (excess > 0) {
                closeIdle(pool, excess);
            } else if (excess < 0) {
                createMinimum(pool, -excess);
            }
        }
    }

    private void closeIdle(SubPool pool, int count) {
        Connection conn;
        while (count > 0 && (conn = pool.connections.pollLast()) != null) {
            if (isUsable(conn)) {
                if (!pool.connections.offerLast(conn)) {
                    closeConnection(conn, pool);
                }
                return;
            }
            closeConnection(conn, pool);
            count--;
        }
    }

    private void createMinimum(SubPool pool, int count) {
        while (count > 0 && pool.total.incrementAndGet() <= pool.capacity) {
            Connection conn;
            try {
                conn = connector.get();
            } catch (RuntimeException e) {
                pool.total.decrementAndGet();
                log.debug("balance[{}]: Failed to create minimum connection", nodeName, e);
                return;
            }
            connectionsOpened.incrementAndGet();

            if (!pool.connections.offerLast(conn)) {
                closeConnection(conn, pool);
                return;
            }
            count--;
        }
        // Undo the increment which went over capacity, if any.
        if (count > 0) {
            pool.total.decrementAndGet();
        }
    }

    private boolean isUsable(Connection conn) {
        if (!conn.isOpen()) {
            return false;
        }
        return maxSocketIdleNanos <= 0 || System.nanoTime() - conn.getLastUsed() <= maxSocketIdleNanos;
    }

    private void closeConnection(Connection conn, SubPool pool) {
        pool.total.decrementAndGet();
        connectionsClosed.incrementAndGet();
        conn.close();
    }

    /**
     * Close every pooled connection. Connections still borrowed are closed when released.
     */
    public void close() {
        for (SubPool pool : pools) {
            Connection conn;
            while ((conn = pool.connections.pollFirst()) != null) {
                closeConnection(conn, pool);
            }
        }
    }

    /**
     * Connections currently idle in the pools.
     */
    public int getInPool() {
        int sum = 0;
        for (SubPool pool : pools) {
            sum += pool.connections.size();
        }
        return sum;
    }

    /**
     * Connections currently borrowed.
     */
    public int getInUse() {
        int sum = 0;
        for (SubPool pool : pools) {
            sum += pool.total.get() - pool.connections.size();
        }
        return Math.max(sum, 0);
    }

    @VisibleForTesting
    int getTotal() {
        int sum = 0;
        for (SubPool pool : pools) {
            sum += pool.total.get();
        }
        return sum;
    }

    private static final class SubPool {
        private final LinkedBlockingDeque<Connection> connections;
        private final AtomicInteger total = new AtomicInteger();
        private final int minSize;
        private final int capacity;

        private SubPool(int minSize, int capacity) {
            this.connections = new LinkedBlockingDeque<>(capacity);
            this.minSize = minSize;
            this.capacity = capacity;
        }
    }

    /**
     * A connection lent out by a {@link ConnectionPool}, remembering the sub-pool it belongs to.
     */
    public static final class PooledConnection implements Connection {

        private final Connection delegate;
        private final SubPool pool;

        private PooledConnection(Connection delegate, SubPool pool) {
            this.delegate = delegate;
            this.pool = pool;
        }

        @Override
        public InetSocketAddress getAddress() {
            return delegate.getAddress();
        }

        @Override
        public Map<String, String> info(String... commands) {
            return delegate.info(commands);
        }

        @Override
        public boolean isOpen() {
            return delegate.isOpen();
        }

        @Override
        public long getLastUsed() {
            return delegate.getLastUsed();
        }

        /**
         * Closes the socket. The connection must still be handed back to the pool so its
         * slot is released.
         */
        @Override
        public void close() {
            delegate.close();
        }

        @Override
        public String toString() {
            return "Pooled" + delegate;
        }
    }
}
