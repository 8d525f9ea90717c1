package org.tessera.runtime.cluster;

import com.google.common.base.Preconditions;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.handler.ssl.SslContext;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import org.tessera.runtime.clients.AddressResolver;
import org.tessera.runtime.clients.Authenticator;
import org.tessera.runtime.clients.ConnectionFactory;
import org.tessera.util.Host;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration of a {@link Cluster}.
 *
 * <p>Build with {@code ClusterParameters.builder().hosts("10.0.0.1:3000,10.0.0.2").build()}.
 */
@Builder
@Getter
@ToString(exclude = {"sslContext", "authenticator", "connectionFactory", "addressResolver", "meterRegistry"})
public class ClusterParameters {

    /** Port used for seeds that do not specify one. */
    public static final int DEFAULT_PORT = 3000;

    /**
     * Hosts used to discover the cluster. Only one needs to be reachable.
     */
    @Singular
    private final List<Host> seeds;

    /**
     * Expected cluster name. When set, nodes reporting another name are rejected, and the name
     * is the default TLS identity of seeds.
     */
    @Nullable
    private final String clusterName;

    /**
     * Interval between tend cycles.
     */
    @Default
    private final Duration tendInterval = Duration.ofSeconds(1);

    /**
     * Bound on connect and on each info request.
     */
    @Default
    private final Duration connectionTimeout = Duration.ofSeconds(1);

    /**
     * Throw from {@link Cluster#connect()} if the cluster cannot be reached and stabilized.
     */
    @Default
    private final boolean failIfNotConnected = true;

    /**
     * Consecutive failed refreshes after which a node is removed.
     */
    @Default
    private final int maxNodeFailures = 5;

    /**
     * Tend cycles run at startup while waiting for the node count to settle.
     */
    @Default
    private final int maxStabilizeCycles = 3;

    /**
     * Connections each node keeps open while idle.
     */
    @Default
    private final int minConnsPerNode = 0;

    /**
     * Upper bound of connections to each node.
     */
    @Default
    private final int maxConnsPerNode = 100;

    /**
     * Sub-pools per node. More than one reduces contention on very busy clients.
     */
    @Default
    private final int connPoolsPerNode = 1;

    /**
     * Pooled connections idle longer than this are closed, zero disables trimming.
     */
    @Default
    private final Duration maxSocketIdle = Duration.ofSeconds(55);

    /**
     * Connection errors tolerated per node within {@link #errorRateWindow} tend cycles,
     * zero disables the limit.
     */
    @Default
    private final int maxErrorRate = 0;

    /**
     * Tend cycles after which node error counts are reset.
     */
    @Default
    private final int errorRateWindow = 1;

    /**
     * Discover peers through the alternate service addresses.
     */
    @Default
    private final boolean useServicesAlternate = false;

    /**
     * Translation of addresses reported by the server into addresses reachable by the client.
     */
    @Singular("ipMapping")
    private final Map<String, String> ipMap;

    /**
     * TLS context, null for clear text connections.
     */
    @Nullable
    private final SslContext sslContext;

    /**
     * Authenticates new connections, null when the cluster does not require credentials.
     */
    @Nullable
    private final Authenticator authenticator;

    /**
     * Connection factory, null to use Netty.
     */
    @Nullable
    private final ConnectionFactory connectionFactory;

    @Default
    private final AddressResolver addressResolver = AddressResolver.SYSTEM;

    /**
     * Netty event loop threads, zero for the Netty default.
     */
    @Default
    private final int nettyEventLoopThreads = 0;

    /**
     * Registry for tend metrics, null to disable metrics.
     */
    @Nullable
    private final MeterRegistry meterRegistry;

    public boolean isTlsEnabled() {
        return sslContext != null;
    }

    /**
     * Check the parameters for consistency.
     *
     * @throws IllegalArgumentException describing the first invalid parameter.
     */
    public void validate() {
        Preconditions.checkArgument(!seeds.isEmpty(), "At least one seed host is required");
        Preconditions.checkArgument(!tendInterval.isNegative() && !tendInterval.isZero(),
                "tendInterval must be positive");
        Preconditions.checkArgument(connectionTimeout.toMillis() > 0, "connectionTimeout must be positive");
        Preconditions.checkArgument(maxNodeFailures > 0, "maxNodeFailures must be positive");
        Preconditions.checkArgument(maxStabilizeCycles > 0, "maxStabilizeCycles must be positive");
        Preconditions.checkArgument(connPoolsPerNode > 0, "connPoolsPerNode must be positive");
        Preconditions.checkArgument(maxConnsPerNode >= connPoolsPerNode,
                "maxConnsPerNode %s must be at least connPoolsPerNode %s", maxConnsPerNode, connPoolsPerNode);
        Preconditions.checkArgument(minConnsPerNode >= 0 && minConnsPerNode <= maxConnsPerNode,
                "minConnsPerNode %s must be between 0 and maxConnsPerNode %s", minConnsPerNode, maxConnsPerNode);
        Preconditions.checkArgument(maxErrorRate >= 0, "maxErrorRate must not be negative");
        Preconditions.checkArgument(errorRateWindow > 0, "errorRateWindow must be positive");
    }

    public static class ClusterParametersBuilder {

        /**
         * Add seeds from a connection string, {@code host1[:tls1][:port1],host2...}.
         */
        public ClusterParametersBuilder hosts(String connectionString) {
            for (Host host : Host.parseHosts(connectionString, DEFAULT_PORT)) {
                seed(host);
            }
            return this;
        }
    }
}
