package org.tessera.runtime.cluster;

import com.google.common.collect.ImmutableSet;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.tessera.runtime.clients.Authenticator;
import org.tessera.runtime.clients.Connection;
import org.tessera.runtime.clients.ConnectionFactory;
import org.tessera.runtime.clients.Info;
import org.tessera.runtime.exceptions.ConnectionException;
import org.tessera.runtime.exceptions.InvalidNodeException;
import org.tessera.runtime.exceptions.WrongClusterException;
import org.tessera.util.Host;

import javax.annotation.Nullable;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.Map;
import java.util.Set;

/**
 * Connects to a candidate host and checks that it is a usable member of the expected cluster.
 */
@Slf4j
public class NodeValidator {

    private static final String[] VALIDATE_COMMANDS = {
            Info.NODE, Info.PARTITION_GENERATION, Info.FEATURES};

    private static final String[] VALIDATE_CLUSTER_COMMANDS = {
            Info.NODE, Info.PARTITION_GENERATION, Info.FEATURES, Info.CLUSTER_NAME};

    private final ClusterParameters parameters;

    private final ConnectionFactory connectionFactory;

    public NodeValidator(ClusterParameters parameters, ConnectionFactory connectionFactory) {
        this.parameters = parameters;
        this.connectionFactory = connectionFactory;
    }

    /**
     * Validate a host, trying every address it resolves to until one succeeds.
     *
     * @param host The host to validate.
     * @return The validated identity, holding an open connection the caller now owns.
     * @throws org.tessera.runtime.exceptions.ClusterException the error of the last address
     *         tried, when no address validates.
     */
    public ValidatedNode validate(Host host) {
        InetAddress[] addresses;
        try {
            addresses = parameters.getAddressResolver().resolve(host.getName());
        } catch (UnknownHostException e) {
            throw new ConnectionException(host, "Invalid host", e);
        }

        if (addresses == null || addresses.length == 0) {
            throw new ConnectionException(host, "Host resolved to no addresses");
        }

        Host expected = withTlsName(host);
        RuntimeException error = null;

        for (InetAddress address : addresses) {
            try {
                return validateAddress(expected, new InetSocketAddress(address, host.getPort()), addresses);
            } catch (RuntimeException e) {
                log.debug("validate[{}]: Address {} failed: {}", host, address, e.getMessage());
                error = e;
            }
        }
        throw error;
    }

    private ValidatedNode validateAddress(Host host, InetSocketAddress address, InetAddress[] addresses) {
        Connection connection = connectionFactory.connect(address, host.getTlsName(),
                parameters.getConnectionTimeout());

        try {
            Authenticator authenticator = parameters.getAuthenticator();
            if (authenticator != null) {
                authenticator.authenticate(connection, host);
            }

            String clusterName = parameters.getClusterName();
            boolean checkCluster = clusterName != null && !clusterName.isEmpty();
            Map<String, String> map = connection.info(checkCluster ? VALIDATE_CLUSTER_COMMANDS : VALIDATE_COMMANDS);

            String name = Info.getString(map, Info.NODE);
            int partitionGeneration = Info.getInt(map, Info.PARTITION_GENERATION);

            if (partitionGeneration == -1) {
                throw new InvalidNodeException("Node " + name + ' ' + host + " is not yet fully initialized");
            }

            if (checkCluster) {
                String actual = map.get(Info.CLUSTER_NAME);
                if (!clusterName.equals(actual == null ? null : actual.trim())) {
                    log.warn("validate[{}]: Node {} belongs to cluster '{}', expected '{}'",
                            host, name, actual, clusterName);
                    throw new WrongClusterException(name, clusterName, actual);
                }
            }

            Set<NodeFeature> features = NodeFeature.parse(map.get(Info.FEATURES));

            ImmutableSet.Builder<Host> aliases = ImmutableSet.builder();
            aliases.add(host);
            for (InetAddress a : addresses) {
                aliases.add(new Host(a.getHostAddress(), host.getTlsName(), host.getPort()));
            }

            return new ValidatedNode(name, host, address, connection, features, aliases.build());
        } catch (RuntimeException e) {
            connection.close();
            throw e;
        }
    }

    /**
     * Fill in the TLS name a host's certificate is expected to carry. Without TLS the host
     * is returned unchanged.
     */
    Host withTlsName(Host host) {
        if (!parameters.isTlsEnabled() || (host.getTlsName() != null && !host.getTlsName().isEmpty())) {
            return host;
        }
        String clusterName = parameters.getClusterName();
        String tlsName = clusterName != null && !clusterName.isEmpty() ? clusterName : host.getName();
        return host.toBuilder().tlsName(tlsName).build();
    }

    /**
     * Result of a successful validation.
     */
    @AllArgsConstructor
    @Getter
    public static class ValidatedNode {

        private final String name;

        /** Host the node answered on, with its expected TLS name. */
        private final Host host;

        private final InetSocketAddress address;

        /** Open connection, reused as the node's tend connection. */
        @Nullable
        private final Connection connection;

        private final Set<NodeFeature> features;

        private final Set<Host> aliases;
    }
}
