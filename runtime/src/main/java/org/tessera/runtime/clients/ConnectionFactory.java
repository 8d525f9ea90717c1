package org.tessera.runtime.clients;

import org.tessera.runtime.exceptions.ConnectionException;

import javax.annotation.Nullable;
import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Opens {@link Connection}s. A factory is owned by exactly one cluster and shut down with it.
 */
public interface ConnectionFactory {

    /**
     * Open a connection.
     *
     * @param address Resolved address to connect to.
     * @param tlsName Expected certificate name, ignored when TLS is not enabled.
     * @param timeout Bound for both the connect and each subsequent request.
     * @return An open connection.
     * @throws ConnectionException if the connection cannot be established.
     */
    Connection connect(InetSocketAddress address, @Nullable String tlsName, Duration timeout);

    /**
     * Release resources held by the factory (event loops, ...).
     */
    default void shutdown() {
    }
}
