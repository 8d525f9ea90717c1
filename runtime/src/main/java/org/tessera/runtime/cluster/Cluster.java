package org.tessera.runtime.cluster;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.tessera.runtime.clients.ConnectionFactory;
import org.tessera.runtime.clients.NettyConnectionFactory;
import org.tessera.runtime.exceptions.ConnectionException;
import org.tessera.runtime.exceptions.InvalidNodeException;
import org.tessera.runtime.view.Partition;
import org.tessera.runtime.view.PartitionMapBuilder;
import org.tessera.runtime.view.Partitions;
import org.tessera.runtime.view.Replica;
import org.tessera.util.Host;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A client's view of a cluster, kept current by a background tend thread.
 *
 * <p>The tend thread is the only writer of cluster state. Every change is published as a new
 * {@link ClusterView} through a single reference swap; application threads capture the view
 * once per lookup and never block on the tend thread.
 *
 * <pre>
 * Cluster cluster = Cluster.fromParameters(ClusterParameters.builder()
 *         .hosts("10.0.0.1:3000,10.0.0.2:3000")
 *         .build())
 *     .connect();
 * Node node = cluster.getMasterNode("test", partitionId);
 * </pre>
 */
@Slf4j
public class Cluster implements AutoCloseable {

    /** Connections are balanced every this many tend cycles. */
    static final int BALANCE_CONNECTIONS_CYCLES = 30;

    @Getter
    private final ClusterParameters parameters;

    @Getter
    private final ConnectionFactory connectionFactory;

    @Getter
    private final NodeValidator validator;

    private final AtomicReference<ClusterView> view = new AtomicReference<>(ClusterView.EMPTY);

    /** Hosts used to seed the cluster. Grows with discovered nodes after startup. */
    private volatile ImmutableList<Host> seeds;

    /** Known addresses of current nodes. Tend thread only. */
    private final Map<Host, Node> aliases = new HashMap<>();

    private final AtomicInteger nodeIndex = new AtomicInteger();

    private final AtomicInteger replicaIndex = new AtomicInteger();

    private final ExecutorService tendExecutor;

    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    private volatile boolean tendValid;

    private volatile boolean shutdown;

    private volatile long tendCount;

    private volatile int invalidNodeCount;

    /** Force a peers refresh on the next cycle. Tend thread only. */
    private boolean recheckPeers;

    private final Optional<Timer> tendTimer;

    private final Optional<Counter> nodesAdded;

    private final Optional<Counter> nodesRemoved;

    /**
     * Create a cluster from parameters. The cluster does nothing until {@link #connect()}.
     */
    public static Cluster fromParameters(@Nonnull ClusterParameters parameters) {
        return new Cluster(parameters);
    }

    private Cluster(ClusterParameters parameters) {
        parameters.validate();

        this.parameters = parameters;
        this.seeds = ImmutableList.copyOf(parameters.getSeeds());
        this.connectionFactory = parameters.getConnectionFactory() != null
                ? parameters.getConnectionFactory()
                : new NettyConnectionFactory(parameters.getNettyEventLoopThreads(), parameters.getSslContext());
        this.validator = new NodeValidator(parameters, connectionFactory);

        this.tendExecutor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("tend-" + (parameters.getClusterName() == null ? "cluster" : parameters.getClusterName())
                        + "-%d")
                .build());

        MeterRegistry registry = parameters.getMeterRegistry();
        if (registry != null) {
            this.tendTimer = Optional.of(Timer.builder("tessera.cluster.tend").register(registry));
            this.nodesAdded = Optional.of(Counter.builder("tessera.cluster.nodes.added").register(registry));
            this.nodesRemoved = Optional.of(Counter.builder("tessera.cluster.nodes.removed").register(registry));
            Gauge.builder("tessera.cluster.nodes", view, v -> v.get().getNodes().size()).register(registry);
        } else {
            this.tendTimer = Optional.empty();
            this.nodesAdded = Optional.empty();
            this.nodesRemoved = Optional.empty();
        }
    }

    /**
     * Seed the cluster, wait until its node list settles, and start tending in the background.
     *
     * @return This cluster, to support chaining.
     * @throws ConnectionException if the cluster cannot be reached and
     *                             {@link ClusterParameters#isFailIfNotConnected()} is set.
     */
    public Cluster connect() {
        if (tendValid || shutdown) {
            throw new IllegalStateException("Cluster was already connected");
        }

        log.info("connect: Seeding cluster from {}", seeds);
        tendValid = true;

        try {
            waitTillStabilized();
        } catch (RuntimeException e) {
            close();
            throw e;
        }

        addSeeds();
        tendExecutor.submit(this::run);
        return this;
    }

    /**
     * Tend until the node count is unchanged between two consecutive cycles, or until the
     * configured number of cycles is used up.
     */
    private void waitTillStabilized() {
        boolean failIfNotConnected = parameters.isFailIfNotConnected();
        int count = -1;
        boolean stable = false;

        for (int i = 0; i < parameters.getMaxStabilizeCycles(); i++) {
            tend(failIfNotConnected, true);

            int size = view.get().getNodes().size();
            if (size == count) {
                stable = true;
                break;
            }
            count = size;
        }

        if (view.get().getNodes().isEmpty()) {
            String message = "Cluster seed(s) failed";
            if (failIfNotConnected) {
                throw new ConnectionException(message);
            }
            log.warn("connect: {}", message);
        } else if (!stable) {
            String message = "Cluster not stabilized after " + parameters.getMaxStabilizeCycles()
                    + " tend cycles, node count " + view.get().getNodes().size();
            if (failIfNotConnected) {
                throw new ConnectionException(message);
            }
            log.warn("connect: {}", message);
        } else {
            log.info("connect: Cluster stabilized with {} nodes", count);
        }
    }

    /**
     * Add hosts of discovered nodes to the seed list, so the cluster can be reseeded even if
     * every configured seed is gone.
     */
    private void addSeeds() {
        List<Host> newSeeds = new ArrayList<>(seeds);
        for (Node node : view.get().getNodes()) {
            if (!newSeeds.contains(node.getHost())) {
                newSeeds.add(node.getHost());
            }
        }

        if (newSeeds.size() > seeds.size()) {
            log.debug("addSeeds: Seeds are now {}", newSeeds);
            seeds = ImmutableList.copyOf(newSeeds);
        }
    }

    /**
     * Tend loop, run on the tend thread until the cluster is closed. {@link #connect()} has
     * just tended, so the loop sleeps first.
     */
    private void run() {
        while (tendValid) {
            try {
                if (shutdownLatch.await(parameters.getTendInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException ie) {
                log.warn("run: Tend thread interrupted, stopping");
                Thread.currentThread().interrupt();
                break;
            }

            try {
                tend(false, false);
            } catch (Exception e) {
                if (tendValid) {
                    log.warn("run: Cluster tend failed", e);
                }
            }
        }
        log.debug("run: Tend thread exiting");
    }

    /**
     * Run one tend cycle.
     *
     * @param failIfNotConnected Raise seeding failures instead of logging them.
     * @param isInit             The cycle is part of {@link #connect()}.
     */
    @VisibleForTesting
    void tend(boolean failIfNotConnected, boolean isInit) {
        if (tendTimer.isPresent()) {
            tendTimer.get().record(() -> tendCycle(failIfNotConnected, isInit));
        } else {
            tendCycle(failIfNotConnected, isInit);
        }
    }

    private void tendCycle(boolean failIfNotConnected, boolean isInit) {
        ImmutableList<Node> nodes = view.get().getNodes();

        // Initialize tend iteration node statistics.
        Peers peers = new Peers(nodes.size() + 16);

        for (Node node : nodes) {
            node.resetTendState();
        }

        boolean peersRefreshed = false;
        int refreshCount = 0;

        // If active nodes don't exist, seed cluster.
        if (nodes.isEmpty()) {
            seedNode(peers, failIfNotConnected);

            // Abort cluster init if the seed was found but some of its peers are unreachable.
            if (isInit && failIfNotConnected && view.get().getNodes().size() == 1 && peers.getInvalidCount() > 0) {
                peers.clusterInitError();
            }
        } else {
            peers.setUsePeers(supportsPeers(nodes));

            if (recheckPeers) {
                // The partition map moved since peers were last read, vestigial nodes may remain.
                peers.setGenChanged(true);
                recheckPeers = false;
            }

            // Refresh all known nodes.
            for (Node node : nodes) {
                node.refresh(peers);
            }

            // Refresh peers when necessary.
            if (peers.isGenChanged()) {
                // Refresh peers for all nodes that responded the first time even if only one node's peers changed.
                peers.setRefreshCount(0);

                for (Node node : nodes) {
                    node.refreshPeers(peers);
                }

                peersRefreshed = true;
                refreshCount = peers.getRefreshCount();

                List<Node> removeList = findUnreachableNodes(refreshCount);
                if (!removeList.isEmpty()) {
                    removeNodes(removeList);
                }
            }

            // Add peer nodes to cluster.
            if (!peers.getNodes().isEmpty()) {
                addNodes(peers.getNodes().values());
                refreshPeers(peers);
            }
        }

        invalidNodeCount = peers.getInvalidCount();

        // Refresh partition maps into one scratch map, published once.
        ClusterView current = view.get();
        PartitionMapBuilder partitionMap = new PartitionMapBuilder(current.getPartitionMap());

        for (Node node : current.getNodes()) {
            if (node.isPartitionChanged()) {
                node.refreshPartitions(peers, partitionMap);
            }
        }

        if (partitionMap.isChanged()) {
            publishPartitionMap(partitionMap.build());
        }

        // Ownership is only known once partitions are refreshed, so unmapped nodes go last.
        if (peersRefreshed) {
            List<Node> removeList = findVestigialNodes(nodes, refreshCount);
            if (!removeList.isEmpty()) {
                removeNodes(removeList);
            }
        } else if (partitionMap.isChanged() && !nodes.isEmpty()) {
            recheckPeers = true;
        }

        tendCount++;

        if (tendCount % BALANCE_CONNECTIONS_CYCLES == 0) {
            for (Node node : view.get().getNodes()) {
                node.balanceConnections();
            }
        }

        // Reset connection error window for all nodes every errorRateWindow tend iterations.
        if (parameters.getMaxErrorRate() > 0 && tendCount % parameters.getErrorRateWindow() == 0) {
            for (Node node : view.get().getNodes()) {
                node.resetErrorCount();
            }
        }
    }

    private static boolean supportsPeers(List<Node> nodes) {
        for (Node node : nodes) {
            if (!node.hasFeature(NodeFeature.PEERS)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Try seeds in order until one validates, then add it and the peers it knows.
     */
    private boolean seedNode(Peers peers, boolean failIfNotConnected) {
        ImmutableList<Host> seedList = seeds;
        Map<Host, RuntimeException> exceptions = new LinkedHashMap<>();

        for (Host seed : seedList) {
            try {
                NodeValidator.ValidatedNode nv = validator.validate(seed);
                Node node = createNode(nv);
                addSeedAndPeers(node, peers);
                return true;
            } catch (RuntimeException e) {
                peers.failSeed(seed);

                if (failIfNotConnected) {
                    exceptions.put(seed, e);
                } else {
                    log.warn("seedNode: Seed {} failed: {}", seed, e.getMessage());
                }
            }
        }

        if (failIfNotConnected) {
            StringBuilder sb = new StringBuilder(500);
            sb.append("Failed to connect to host(s): ");

            for (Map.Entry<Host, RuntimeException> entry : exceptions.entrySet()) {
                sb.append(System.lineSeparator());
                sb.append(entry.getKey()).append(' ').append(entry.getValue().getMessage());
            }
            throw new ConnectionException(sb.toString());
        }
        return false;
    }

    private void addSeedAndPeers(Node seed, Peers peers) {
        seed.balanceConnections();
        aliases.clear();
        addNodes(ImmutableList.of(seed));

        peers.setUsePeers(seed.hasFeature(NodeFeature.PEERS));
        seed.refreshPeers(peers);

        if (!peers.getNodes().isEmpty()) {
            addNodes(peers.getNodes().values());
            refreshPeers(peers);
        }
    }

    /**
     * Refresh peers of newly added nodes until no more new nodes show up.
     */
    private void refreshPeers(Peers peers) {
        while (true) {
            List<Node> newNodes = new ArrayList<>(peers.getNodes().values());
            peers.getNodes().clear();

            // Refresh peers of peers in order retrieve the node's peersCount
            // which is used in refreshPartitions(). This call might add even more peers.
            for (Node node : newNodes) {
                node.refreshPeers(peers);
            }

            if (peers.getNodes().isEmpty()) {
                break;
            }
            addNodes(peers.getNodes().values());
        }
    }

    /**
     * Nodes to remove at the end of a peers refresh because they are gone or not answering.
     *
     * @param refreshCount Number of nodes that refreshed their peers successfully.
     */
    private List<Node> findUnreachableNodes(int refreshCount) {
        ImmutableList<Node> nodes = view.get().getNodes();
        List<Node> removeList = new ArrayList<>();

        for (Node node : nodes) {
            if (!node.isActive()) {
                // Inactive nodes must be removed.
                removeList.add(node);
                continue;
            }

            if (node.getFailures() >= parameters.getMaxNodeFailures()) {
                // The node has not answered for too long.
                removeList.add(node);
                continue;
            }

            if (nodes.size() > 1 && refreshCount >= 1 && node.getReferenceCount() == 0 && node.getFailures() > 0) {
                // Not referenced by other nodes and not responding.
                removeList.add(node);
            }
        }
        return removeList;
    }

    /**
     * Nodes that answer but that no peer references and that own no partition in the map
     * published by this cycle. Nodes added during the cycle have not read their partitions yet
     * and are never vestigial.
     *
     * @param cycleNodes   Nodes of the cluster when the cycle started.
     * @param refreshCount Number of nodes that refreshed their peers successfully.
     */
    private List<Node> findVestigialNodes(List<Node> cycleNodes, int refreshCount) {
        ClusterView current = view.get();
        List<Node> removeList = new ArrayList<>();

        if (current.getNodes().size() <= 1 || refreshCount < 1) {
            return removeList;
        }

        for (Node node : cycleNodes) {
            if (current.getNode(node.getName()) == node && node.isActive() && node.getFailures() == 0
                    && node.getReferenceCount() == 0 && !current.ownsPartitions(node)) {
                removeList.add(node);
            }
        }
        return removeList;
    }

    private void removeNodes(List<Node> nodesToRemove) {
        for (Node node : nodesToRemove) {
            for (Host alias : node.getAliases()) {
                aliases.remove(alias);
            }
            node.close();
        }

        List<Node> remaining = new ArrayList<>(view.get().getNodes());
        for (Node node : nodesToRemove) {
            remaining.remove(node);
            log.info("removeNodes: Remove node {}", node);
        }

        nodesRemoved.ifPresent(c -> c.increment(nodesToRemove.size()));
        publishNodes(ImmutableList.copyOf(remaining));
    }

    private void addNodes(Collection<Node> nodesToAdd) {
        ImmutableList.Builder<Node> builder = ImmutableList.builder();
        ClusterView current = view.get();
        builder.addAll(current.getNodes());

        int added = 0;
        for (Node node : nodesToAdd) {
            if (current.getNode(node.getName()) != null) {
                log.warn("addNodes: Node {} already exists, closing duplicate", node);
                node.close();
                continue;
            }

            log.info("addNodes: Add node {}", node);
            for (Host alias : node.getAliases()) {
                aliases.put(alias, node);
            }
            builder.add(node);
            added++;
        }

        if (added > 0) {
            final int count = added;
            nodesAdded.ifPresent(c -> c.increment(count));
            publishNodes(builder.build());
        }
    }

    private void publishNodes(ImmutableList<Node> nodes) {
        ClusterView next = view.get().withNodes(nodes);
        view.set(next);

        if (!tendValid) {
            // Closed while this cycle was running: nothing may outlive close().
            for (Node node : nodes) {
                node.close();
            }
        }
    }

    private void publishPartitionMap(ImmutableMap<String, Partitions> partitionMap) {
        view.set(view.get().withPartitionMap(partitionMap));
    }

    /**
     * Create a node from a validated host. Called by the tend thread.
     */
    Node createNode(NodeValidator.ValidatedNode nv) {
        Node node = new Node(this, nv);
        node.balanceConnections();
        return node;
    }

    /**
     * Node of the current view with the given name, null if none.
     */
    @Nullable
    Node findNode(String name) {
        return view.get().getNode(name);
    }

    @Nullable
    Node findAlias(Host alias) {
        return aliases.get(alias);
    }

    void addAlias(Node node, Host alias) {
        node.addAlias(alias);
        if (view.get().getNode(node.getName()) == node) {
            aliases.put(alias, node);
        }
    }

    boolean isTendValid() {
        return tendValid;
    }

    /**
     * The current snapshot of the cluster.
     */
    public ClusterView getView() {
        return view.get();
    }

    public ImmutableList<Node> getNodes() {
        return view.get().getNodes();
    }

    public ImmutableList<Host> getSeeds() {
        return seeds;
    }

    /**
     * The next active node in round robin order.
     *
     * @throws InvalidNodeException if no node is active.
     */
    public Node getRandomNode() {
        ImmutableList<Node> nodes = view.get().getNodes();
        int size = nodes.size();

        for (int i = 0; i < size; i++) {
            int index = Math.floorMod(nodeIndex.getAndIncrement(), size);
            Node node = nodes.get(index);

            if (node.isActive()) {
                return node;
            }
        }
        throw new InvalidNodeException("Cluster is empty");
    }

    /**
     * A node by name.
     *
     * @throws InvalidNodeException if no active node has that name.
     */
    public Node getNode(String name) {
        Node node = view.get().getNode(name);
        if (node == null || !node.isActive()) {
            throw new InvalidNodeException("Invalid node name: " + name);
        }
        return node;
    }

    /**
     * Master of a partition.
     *
     * @throws InvalidNodeException if the master is unknown or inactive.
     */
    public Node getMasterNode(String namespace, int partitionId) {
        return Partition.of(view.get(), namespace, partitionId, Replica.MASTER).getMasterNode(this);
    }

    /**
     * An active replica of a partition, rotating across calls.
     */
    public Node getMasterProlesNode(String namespace, int partitionId) {
        return Partition.of(view.get(), namespace, partitionId, Replica.MASTER_PROLES).getMasterProlesNode(this);
    }

    public int nextReplicaIndex() {
        return replicaIndex.getAndIncrement();
    }

    /**
     * Partitions of a namespace in the current view, null if the namespace is unknown.
     */
    @Nullable
    public Partitions getPartitions(String namespace) {
        return view.get().getPartitionMap().get(namespace);
    }

    /**
     * Whether every node of the cluster supports a feature.
     */
    public boolean hasFeature(NodeFeature feature) {
        return view.get().hasFeature(feature);
    }

    /**
     * Whether at least one node is active and answering.
     */
    public boolean isConnected() {
        for (Node node : view.get().getNodes()) {
            if (node.isActive() && node.getFailures() < parameters.getMaxNodeFailures()) {
                return true;
            }
        }
        return false;
    }

    public boolean isClosed() {
        return shutdown;
    }

    public ClusterStats getStats() {
        ClusterView current = view.get();
        List<NodeStats> stats = new ArrayList<>(current.getNodes().size());
        for (Node node : current.getNodes()) {
            stats.add(node.getStats());
        }
        return new ClusterStats(stats, invalidNodeCount, tendCount, current.getGeneration());
    }

    /**
     * Stop tending and close every node. Borrowed connections are closed when returned.
     */
    @Override
    public void close() {
        if (shutdown) {
            return;
        }

        log.debug("close: Closing cluster {}", parameters.getClusterName());
        shutdown = true;
        tendValid = false;
        shutdownLatch.countDown();
        tendExecutor.shutdown();

        try {
            long wait = parameters.getTendInterval().toMillis() + parameters.getConnectionTimeout().toMillis() * 2;
            if (!tendExecutor.awaitTermination(wait, TimeUnit.MILLISECONDS)) {
                log.warn("close: Tend thread did not stop within {}ms", wait);
            }
        } catch (InterruptedException ie) {
            log.warn("close: Interrupted while waiting for tend thread");
            Thread.currentThread().interrupt();
        }

        for (Node node : view.get().getNodes()) {
            node.close();
        }
        connectionFactory.shutdown();
    }
}
