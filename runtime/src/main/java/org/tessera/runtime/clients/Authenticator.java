package org.tessera.runtime.clients;

import org.tessera.util.Host;

/**
 * Authenticates freshly opened connections when the cluster requires credentials.
 */
@FunctionalInterface
public interface Authenticator {

    /**
     * Authenticate a connection.
     *
     * @param connection The connection, already open.
     * @param host       The host it was opened for.
     * @throws org.tessera.runtime.exceptions.ClusterException if the server rejects the credentials.
     */
    void authenticate(Connection connection, Host host);
}
