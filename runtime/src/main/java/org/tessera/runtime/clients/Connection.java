package org.tessera.runtime.clients;

import org.tessera.runtime.exceptions.ConnectionException;

import java.net.InetSocketAddress;
import java.util.Map;

/**
 * A synchronous connection to one server address.
 *
 * <p>Connections are not thread safe: a connection is used by one thread at a time, either the
 * tend thread or whichever thread borrowed it from a node's pool.
 */
public interface Connection extends AutoCloseable {

    /**
     * Address this connection is attached to.
     */
    InetSocketAddress getAddress();

    /**
     * Issue an info request and wait for its response.
     *
     * @param commands The info commands to request.
     * @return Response values keyed by command name, in response order.
     * @throws ConnectionException if the request could not be completed.
     */
    Map<String, String> info(String... commands);

    /**
     * Whether the underlying socket is still usable.
     */
    boolean isOpen();

    /**
     * {@link System#nanoTime()} of the last completed request.
     */
    long getLastUsed();

    /**
     * Close the underlying socket. Closing an already closed connection is a no-op.
     */
    @Override
    void close();
}
