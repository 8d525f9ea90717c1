package org.tessera.runtime.cluster;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.tessera.runtime.clients.Authenticator;
import org.tessera.runtime.clients.Connection;
import org.tessera.runtime.clients.ConnectionPool;
import org.tessera.runtime.clients.ConnectionPool.PooledConnection;
import org.tessera.runtime.clients.Info;
import org.tessera.runtime.exceptions.ClusterException;
import org.tessera.runtime.exceptions.ConnectionException;
import org.tessera.runtime.exceptions.ResultCode;
import org.tessera.runtime.view.PartitionMapBuilder;
import org.tessera.runtime.view.PartitionParser;
import org.tessera.util.Host;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A server of the cluster.
 *
 * <p>Identity and capabilities are fixed when the node is validated. Everything else is tend
 * state: only {@link #isActive()} and the connection pool are meant for application threads.
 * A node that is removed from the cluster is closed and never comes back; reconnecting to the
 * same server produces a new node.
 */
@Slf4j
public class Node {

    /** Number of partitions of every namespace. */
    public static final int PARTITIONS = 4096;

    private static final String[] INFO_PERIODIC = {
            Info.NODE, Info.PEERS_GENERATION, Info.PARTITION_GENERATION};

    private static final String[] INFO_PERIODIC_SERVICES = {
            Info.NODE, Info.PARTITION_GENERATION};

    private final Cluster cluster;

    @Getter
    private final String name;

    /** Host the node was validated on. */
    @Getter
    private final Host host;

    @Getter
    private final InetSocketAddress address;

    @Getter
    private final Set<NodeFeature> features;

    private volatile ImmutableSet<Host> aliases;

    private final ConnectionPool connectionPool;

    private Connection tendConnection;

    private volatile boolean active = true;

    /** Consecutive failed refreshes. */
    @Getter
    private volatile int failures;

    /** Peer lists referencing this node during the current tend cycle. */
    @Getter
    private int referenceCount;

    /** Number of peers this node reported on its last peers refresh. */
    @Getter
    private int peersCount;

    @Getter
    private long peersGeneration = -1;

    @Getter
    private volatile int partitionGeneration = -1;

    /** Set when the node's partition generation moved during the current tend cycle. */
    @Getter
    private boolean partitionChanged;

    private final AtomicInteger errorCount = new AtomicInteger();

    Node(Cluster cluster, NodeValidator.ValidatedNode nv) {
        ClusterParameters parameters = cluster.getParameters();

        this.cluster = cluster;
        this.name = nv.getName();
        this.host = nv.getHost();
        this.address = nv.getAddress();
        this.features = nv.getFeatures();
        this.aliases = ImmutableSet.copyOf(nv.getAliases());
        this.tendConnection = nv.getConnection();
        this.connectionPool = new ConnectionPool(name, parameters.getConnPoolsPerNode(),
                parameters.getMinConnsPerNode(), parameters.getMaxConnsPerNode(),
                parameters.getMaxSocketIdle().toNanos(), this::createConnection);
    }

    /**
     * Open a new connection to this node, authenticated when credentials are configured.
     */
    Connection createConnection() {
        Connection conn = cluster.getConnectionFactory().connect(address, host.getTlsName(),
                cluster.getParameters().getConnectionTimeout());

        Authenticator authenticator = cluster.getParameters().getAuthenticator();
        if (authenticator != null) {
            try {
                authenticator.authenticate(conn, host);
            } catch (RuntimeException e) {
                conn.close();
                throw e;
            }
        }
        return conn;
    }

    /**
     * Clear the per cycle counters before a tend cycle.
     */
    void resetTendState() {
        referenceCount = 0;
        partitionChanged = false;
    }

    void incrementReferenceCount() {
        referenceCount++;
    }

    /**
     * Request the node's identity and generations, and record what changed.
     *
     * <p>A failure bumps {@link #getFailures()} and leaves the node's previous partition and
     * peer state untouched.
     */
    void refresh(Peers peers) {
        if (!active) {
            return;
        }

        try {
            if (tendConnection == null || !tendConnection.isOpen()) {
                tendConnection = createConnection();
            }

            Map<String, String> infoMap = tendConnection.info(
                    peers.isUsePeers() ? INFO_PERIODIC : INFO_PERIODIC_SERVICES);

            verifyNodeName(infoMap);

            if (peers.isUsePeers()) {
                verifyPeersGeneration(infoMap, peers);
            } else {
                // Service lists carry no generation, they are read every cycle.
                peers.setGenChanged(true);
            }

            verifyPartitionGeneration(infoMap);
            peers.incrementRefreshCount();

            // Reload peers and partitions if there were failures on previous tend.
            if (failures > 0) {
                peers.setGenChanged(true);
                partitionChanged = true;
            }
            failures = 0;
        } catch (RuntimeException e) {
            peers.setGenChanged(true);
            refreshFailed(e);
        }
    }

    private void verifyNodeName(Map<String, String> infoMap) {
        String infoName = Info.getString(infoMap, Info.NODE);

        if (!name.equals(infoName)) {
            // Set node to inactive immediately.
            active = false;
            throw new ClusterException(ResultCode.INVALID_NODE_ERROR,
                    "Node name has changed. Old=" + name + " New=" + infoName);
        }
    }

    private void verifyPeersGeneration(Map<String, String> infoMap, Peers peers) {
        long generation = Info.getLong(infoMap, Info.PEERS_GENERATION);

        if (peersGeneration != generation) {
            peers.setGenChanged(true);

            if (peersGeneration > generation) {
                log.info("verifyPeersGeneration[{}]: Quick node restart detected, old generation {} new {}",
                        this, peersGeneration, generation);
            }
        }
    }

    private void verifyPartitionGeneration(Map<String, String> infoMap) {
        int generation = Info.getInt(infoMap, Info.PARTITION_GENERATION);

        if (partitionGeneration != generation) {
            partitionChanged = true;
        }
    }

    /**
     * Discover the nodes this node knows about. Existing nodes are referenced, new ones are
     * validated and collected in {@link Peers#getNodes()}.
     */
    void refreshPeers(Peers peers) {
        // Do not refresh peers when node connection has already failed during this cycle.
        if (failures > 0 || !active) {
            return;
        }

        try {
            if (peers.isUsePeers()) {
                refreshPeerList(peers);
            } else {
                refreshServices(peers);
            }
            peers.incrementRefreshCount();
        } catch (RuntimeException e) {
            refreshFailed(e);
        }
    }

    private void refreshPeerList(Peers peers) {
        ClusterParameters parameters = cluster.getParameters();
        String command = Info.peersCommand(parameters.isTlsEnabled(), parameters.isUseServicesAlternate());

        log.debug("refreshPeers[{}]: Update peers", this);

        PeerParser parser = PeerParser.parse(Info.request(tendConnection, command), parameters.getIpMap());
        List<Peer> peerList = parser.getPeers();
        peersCount = peerList.size();

        boolean peersValidated = true;

        for (Peer peer : peerList) {
            if (findPeerNode(peers, peer.getNodeName()) != null) {
                // Node already exists. Do not even try to connect to hosts.
                continue;
            }

            boolean nodeValidated = false;

            // Find first host that connects.
            for (Host peerHost : peer.getHosts()) {
                if (peers.hasFailed(peerHost)) {
                    continue;
                }

                if (addPeerNode(peers, peerHost, peer.getNodeName())) {
                    nodeValidated = true;
                    break;
                }
            }

            if (!nodeValidated) {
                peersValidated = false;
            }
        }

        // Only set new peers generation if all referenced peers are added to the cluster.
        if (peersValidated) {
            peersGeneration = parser.getGeneration();
        }
    }

    private void refreshServices(Peers peers) {
        ClusterParameters parameters = cluster.getParameters();
        String command = parameters.isUseServicesAlternate() ? Info.SERVICES_ALTERNATE : Info.SERVICES;
        Map<String, String> ipMap = parameters.getIpMap();

        List<Host> services = Host.parseServiceHosts(Info.request(tendConnection, command));
        peersCount = services.size();

        for (Host service : services) {
            String mapped = ipMap.get(service.getName());
            Host serviceHost = mapped == null ? service : new Host(mapped, service.getPort());

            Node known = cluster.findAlias(serviceHost);
            if (known == null) {
                known = findByAlias(peers, serviceHost);
            }
            if (known != null) {
                known.incrementReferenceCount();
                continue;
            }

            if (!peers.hasFailed(serviceHost)) {
                addPeerNode(peers, serviceHost, null);
            }
        }
    }

    private static Node findByAlias(Peers peers, Host alias) {
        for (Node node : peers.getNodes().values()) {
            if (node.aliases.contains(alias)) {
                return node;
            }
        }
        return null;
    }

    /**
     * Validate a host and add it to the cycle's discovered nodes.
     *
     * @return True if the host belongs to a node the cluster now knows about.
     */
    private boolean addPeerNode(Peers peers, Host peerHost, String expectedName) {
        try {
            NodeValidator.ValidatedNode nv = cluster.getValidator().validate(peerHost);

            if (expectedName != null && !expectedName.equals(nv.getName())) {
                // Must look for new node name in the unlikely event that node names do not agree.
                log.warn("refreshPeers[{}]: Peer node {} is different than actual node {} for host {}",
                        this, expectedName, nv.getName(), peerHost);
            }

            if (expectedName == null || !expectedName.equals(nv.getName())) {
                Node existing = findPeerNode(peers, nv.getName());
                if (existing != null) {
                    // Node already exists, keep the address as an alias.
                    nv.getConnection().close();
                    cluster.addAlias(existing, peerHost);
                    return true;
                }
            }

            Node node = cluster.createNode(nv);
            peers.getNodes().put(nv.getName(), node);
            return true;
        } catch (RuntimeException e) {
            peers.fail(peerHost);
            log.warn("refreshPeers[{}]: Add node {} failed: {}", this, peerHost, e.getMessage());
            return false;
        }
    }

    private Node findPeerNode(Peers peers, String nodeName) {
        // Check global node map for existing cluster, then the nodes found during this cycle.
        Node node = cluster.findNode(nodeName);
        if (node == null) {
            node = peers.getNodes().get(nodeName);
        }
        if (node != null) {
            node.incrementReferenceCount();
        }
        return node;
    }

    /**
     * Read this node's partition ownership into the cycle's partition map.
     */
    void refreshPartitions(Peers peers, PartitionMapBuilder partitionMap) {
        // Do not refresh partitions when node connection has already failed during this cycle.
        // Also, avoid "split cluster" case where this node thinks it's a 1-node cluster.
        // Unchecked, such a node can dominate the partition map and cause all other
        // nodes to be dropped.
        if (failures > 0 || !active || (peersCount == 0 && peers.getRefreshCount() > 1)) {
            return;
        }

        try {
            log.debug("refreshPartitions[{}]: Update partition map", this);

            String command = features.contains(NodeFeature.REPLICAS) ? Info.REPLICAS : Info.REPLICAS_ALL;
            Map<String, String> infoMap = tendConnection.info(Info.PARTITION_GENERATION, command);

            int generation = Info.getInt(infoMap, Info.PARTITION_GENERATION);
            PartitionParser.parse(this, Info.getString(infoMap, command),
                    Info.REPLICAS.equals(command), partitionMap);
            partitionGeneration = generation;
        } catch (RuntimeException e) {
            refreshFailed(e);
        }
    }

    /**
     * Force a partition refresh on the next tend cycle. Called when another node has taken
     * over one of this node's partitions.
     */
    public void invalidatePartitionGeneration() {
        partitionGeneration = -1;
    }

    private void refreshFailed(RuntimeException e) {
        failures++;

        if (tendConnection != null && tendConnection.isOpen()) {
            incrementErrorCount();
            tendConnection.close();
        }

        // Only log message if cluster is still active.
        if (cluster.isTendValid()) {
            log.warn("refresh[{}]: Node refresh failed: {}", this, e.getMessage());
        }
    }

    /**
     * Borrow a connection for an operation on this node.
     *
     * @throws ClusterException with {@link ResultCode#MAX_ERROR_RATE} if the node's error rate
     *                          limit is exceeded, or a {@link ConnectionException}.
     */
    public PooledConnection getConnection() {
        if (!errorCountWithinLimit()) {
            throw new ClusterException(ResultCode.MAX_ERROR_RATE, "Max error rate exceeded: " + this);
        }

        try {
            return connectionPool.borrow();
        } catch (ConnectionException e) {
            if (e.getResultCode() != ResultCode.NO_MORE_CONNECTIONS) {
                incrementErrorCount();
            }
            throw e;
        }
    }

    /**
     * Return a healthy connection. Connections returned after the node was removed are closed.
     */
    public void putConnection(PooledConnection connection) {
        connectionPool.release(connection, active);
    }

    /**
     * Close a connection whose state is unknown, typically after an I/O error.
     */
    public void closeConnection(PooledConnection connection) {
        incrementErrorCount();
        connectionPool.discard(connection);
    }

    void balanceConnections() {
        connectionPool.balance();
    }

    public void incrementErrorCount() {
        if (cluster.getParameters().getMaxErrorRate() > 0) {
            errorCount.incrementAndGet();
        }
    }

    void resetErrorCount() {
        errorCount.set(0);
    }

    public boolean errorCountWithinLimit() {
        int maxErrorRate = cluster.getParameters().getMaxErrorRate();
        return maxErrorRate <= 0 || errorCount.get() <= maxErrorRate;
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean isActive() {
        return active;
    }

    public boolean hasFeature(NodeFeature feature) {
        return features.contains(feature);
    }

    public Set<Host> getAliases() {
        return aliases;
    }

    void addAlias(Host alias) {
        aliases = ImmutableSet.<Host>builder().addAll(aliases).add(alias).build();
    }

    @VisibleForTesting
    ConnectionPool getConnectionPool() {
        return connectionPool;
    }

    NodeStats getStats() {
        return new NodeStats(name, host, active, failures, partitionGeneration,
                connectionPool.getInUse(), connectionPool.getInPool(),
                connectionPool.getConnectionsOpened().get(), connectionPool.getConnectionsClosed().get(),
                errorCount.get());
    }

    /**
     * Mark the node inactive and close every connection it owns.
     */
    public void close() {
        active = false;

        if (tendConnection != null) {
            tendConnection.close();
        }
        connectionPool.close();
    }

    @Override
    public String toString() {
        return name + ' ' + host;
    }
}
