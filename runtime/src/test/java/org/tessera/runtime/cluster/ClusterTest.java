package org.tessera.runtime.cluster;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.tessera.runtime.exceptions.ConnectionException;
import org.tessera.runtime.exceptions.InvalidNamespaceException;
import org.tessera.runtime.exceptions.InvalidNodeException;
import org.tessera.runtime.exceptions.WrongClusterException;
import org.tessera.runtime.view.Partitions;
import org.tessera.util.Host;

import java.net.InetAddress;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ClusterTest {

    private static final String NAMESPACE = "test";

    private SimulatedCluster sim;

    private Cluster cluster;

    @Before
    public void setUp() {
        sim = new SimulatedCluster();
    }

    @After
    public void tearDown() {
        if (cluster != null) {
            cluster.close();
        }
    }

    private static Set<String> names(Cluster cluster) {
        Set<String> names = new HashSet<>();
        for (Node node : cluster.getNodes()) {
            names.add(node.getName());
        }
        return names;
    }

    @Test
    public void discoversPeersFromSingleSeed() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        sim.addServer("B", "10.0.0.2");
        sim.addServer("C", "10.0.0.3");
        sim.peerAll();
        sim.spreadPartitions(NAMESPACE, 2, false);

        cluster = Cluster.fromParameters(sim.parameters(a).build()).connect();

        assertThat(names(cluster)).containsExactlyInAnyOrder("A", "B", "C");
        assertThat(cluster.isConnected()).isTrue();

        Partitions partitions = cluster.getPartitions(NAMESPACE);
        assertThat(partitions.getReplicaCount()).isEqualTo(2);
        assertThat(partitions.countUnassigned()).isZero();

        // Discovered nodes become seeds.
        assertThat(cluster.getSeeds()).containsExactlyInAnyOrder(
                new Host("10.0.0.1", 3000), new Host("10.0.0.2", 3000), new Host("10.0.0.3", 3000));
    }

    @Test
    public void unreachableSeedIsSkipped() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        SimulatedServer b = sim.addServer("B", "10.0.0.2");
        SimulatedServer c = sim.addServer("C", "10.0.0.3");
        b.addPeer(c);
        c.addPeer(b);
        a.setReachable(false);

        cluster = Cluster.fromParameters(sim.parameters(a, b).build()).connect();

        assertThat(names(cluster)).containsExactlyInAnyOrder("B", "C");
    }

    @Test
    public void unreachableSeedFailsFastWhenRequired() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        a.setReachable(false);

        Cluster failing = Cluster.fromParameters(sim.parameters(a).failIfNotConnected(true).build());

        assertThatThrownBy(failing::connect)
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("Failed to connect to host(s):")
                .hasMessageContaining("10.0.0.1 3000");
        assertThat(failing.isClosed()).isTrue();
    }

    @Test
    public void unreachableSeedIsToleratedWhenNotFailFast() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        a.setReachable(false);

        cluster = Cluster.fromParameters(sim.parameters(a).build()).connect();

        assertThat(cluster.getNodes()).isEmpty();
        assertThat(cluster.isConnected()).isFalse();
        assertThatThrownBy(cluster::getRandomNode).isInstanceOf(InvalidNodeException.class)
                .hasMessage("Cluster is empty");

        // The seed comes back and the next cycle picks it up.
        a.setReachable(true);
        SimulatedCluster.tend(cluster);
        assertThat(names(cluster)).containsExactly("A");
    }

    @Test
    public void unreachablePeerFailsInitWhenRequired() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        SimulatedServer b = sim.addServer("B", "10.0.0.2");
        sim.peerAll();
        b.setReachable(false);

        Cluster failing = Cluster.fromParameters(sim.parameters(a).failIfNotConnected(true).build());

        assertThatThrownBy(failing::connect)
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("Peers not reachable");
    }

    @Test
    public void unreachableSeedDoesNotFailInitWhenAnotherSeedAnswers() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        SimulatedServer b = sim.addServer("B", "10.0.0.2");
        sim.peerAll();
        sim.spreadPartitions(NAMESPACE, 1, false);
        a.setReachable(false);

        cluster = Cluster.fromParameters(sim.parameters(a, b).failIfNotConnected(true).build()).connect();

        assertThat(names(cluster)).containsExactly("B");
        assertThat(cluster.isConnected()).isTrue();
    }

    @Test
    public void decommissionedNodeIsRemoved() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        SimulatedServer b = sim.addServer("B", "10.0.0.2");
        SimulatedServer c = sim.addServer("C", "10.0.0.3");
        sim.peerAll();
        sim.spreadPartitions(NAMESPACE, 1, false);

        cluster = Cluster.fromParameters(sim.parameters(a).build()).connect();
        Node nodeC = cluster.getView().getNode("C");

        // The other nodes drop C but C still owns partitions, so it stays.
        a.removePeer(c);
        b.removePeer(c);
        SimulatedCluster.tend(cluster);
        assertThat(names(cluster)).containsExactlyInAnyOrder("A", "B", "C");

        // C hands every partition over while it keeps answering.
        for (int pid = 2; pid < Node.PARTITIONS; pid += 3) {
            sim.movePartition(NAMESPACE, 1, false, 0, pid, c, pid % 2 == 0 ? a : b);
        }
        SimulatedCluster.tend(cluster);
        SimulatedCluster.tend(cluster);

        assertThat(names(cluster)).containsExactlyInAnyOrder("A", "B");
        assertThat(nodeC.isActive()).isFalse();
        assertThat(c.getOpenConnections().get()).isZero();
        assertThat(cluster.getPartitions(NAMESPACE).countUnassigned()).isZero();
    }

    @Test
    public void nodeDroppedByPeersAfterHandoverIsRemoved() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        SimulatedServer b = sim.addServer("B", "10.0.0.2");
        SimulatedServer c = sim.addServer("C", "10.0.0.3");
        sim.peerAll();
        sim.spreadPartitions(NAMESPACE, 1, false);

        cluster = Cluster.fromParameters(sim.parameters(a).build()).connect();

        for (int pid = 2; pid < Node.PARTITIONS; pid += 3) {
            sim.movePartition(NAMESPACE, 1, false, 0, pid, c, a);
        }
        a.removePeer(c);
        b.removePeer(c);
        SimulatedCluster.tend(cluster);

        assertThat(names(cluster)).containsExactlyInAnyOrder("A", "B");
    }

    @Test
    public void failingNodeIsRemovedAfterMaxFailures() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        sim.addServer("B", "10.0.0.2");
        SimulatedServer c = sim.addServer("C", "10.0.0.3");
        sim.peerAll();
        sim.spreadPartitions(NAMESPACE, 1, false);

        cluster = Cluster.fromParameters(sim.parameters(a).build()).connect();
        Node nodeC = cluster.getView().getNode("C");
        assertThat(nodeC).isNotNull();

        c.setReachable(false);

        for (int i = 1; i < 5; i++) {
            SimulatedCluster.tend(cluster);
            assertThat(names(cluster)).contains("C");
            assertThat(nodeC.getFailures()).isEqualTo(i);
        }

        SimulatedCluster.tend(cluster);

        assertThat(names(cluster)).containsExactlyInAnyOrder("A", "B");
        assertThat(nodeC.isActive()).isFalse();
        assertThat(c.getOpenConnections().get()).isZero();

        for (int i = 0; i < 100; i++) {
            assertThat(cluster.getRandomNode().getName()).isNotEqualTo("C");
        }
    }

    @Test
    public void failureThresholdIsConfigurable() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        SimulatedServer b = sim.addServer("B", "10.0.0.2");
        sim.peerAll();
        sim.spreadPartitions(NAMESPACE, 1, false);

        cluster = Cluster.fromParameters(sim.parameters(a).maxNodeFailures(2).build()).connect();
        b.setReachable(false);

        SimulatedCluster.tend(cluster);
        assertThat(names(cluster)).contains("B");
        SimulatedCluster.tend(cluster);
        assertThat(names(cluster)).containsExactly("A");
    }

    @Test
    public void failedNodeRecoversBeforeThreshold() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        SimulatedServer b = sim.addServer("B", "10.0.0.2");
        sim.peerAll();
        sim.spreadPartitions(NAMESPACE, 1, false);

        cluster = Cluster.fromParameters(sim.parameters(a).build()).connect();
        Node nodeB = cluster.getView().getNode("B");

        b.setReachable(false);
        SimulatedCluster.tend(cluster);
        SimulatedCluster.tend(cluster);
        assertThat(nodeB.getFailures()).isEqualTo(2);

        b.setReachable(true);
        SimulatedCluster.tend(cluster);

        assertThat(nodeB.getFailures()).isZero();
        assertThat(cluster.getView().getNode("B")).isSameAs(nodeB);
    }

    @Test
    public void rebalancePublishesNewMaster() {
        SimulatedServer x = sim.addServer("X", "10.0.0.1");
        SimulatedServer y = sim.addServer("Y", "10.0.0.2");
        sim.peerAll();
        sim.spreadPartitions(NAMESPACE, 1, false);

        cluster = Cluster.fromParameters(sim.parameters(x).build()).connect();
        // Round robin spread puts even partitions on the first server.
        assertThat(cluster.getMasterNode(NAMESPACE, 42).getName()).isEqualTo("X");
        ClusterView before = cluster.getView();

        sim.movePartition(NAMESPACE, 1, false, 0, 42, x, y);
        SimulatedCluster.tend(cluster);

        assertThat(cluster.getMasterNode(NAMESPACE, 42).getName()).isEqualTo("Y");
        assertThat(cluster.getView().getGeneration()).isGreaterThan(before.getGeneration());
        // The previous snapshot is untouched.
        assertThat(before.getPartitionMap().get(NAMESPACE).getMaster(42).getName()).isEqualTo("X");
    }

    @Test
    public void tendWithoutChangeRepublishesNothing() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        sim.addServer("B", "10.0.0.2");
        sim.addServer("C", "10.0.0.3");
        sim.peerAll();
        sim.spreadPartitions(NAMESPACE, 2, false);

        cluster = Cluster.fromParameters(sim.parameters(a).build()).connect();
        ClusterView view = cluster.getView();

        SimulatedCluster.tend(cluster);
        SimulatedCluster.tend(cluster);

        assertThat(cluster.getView()).isSameAs(view);
        assertThat(cluster.getView().getNodes()).isSameAs(view.getNodes());
        assertThat(cluster.getView().getPartitionMap()).isSameAs(view.getPartitionMap());
    }

    @Test
    public void nodeNamesStayUniqueAcrossAliases() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        SimulatedServer b = sim.addServer("B", "10.0.0.2");
        sim.addAddress(a, "10.0.0.11");
        a.setFeatures("replicas");
        b.setFeatures("replicas");
        sim.peerAll();
        // B knows A by its second address only.
        b.advertise(a, "10.0.0.11");
        sim.spreadPartitions(NAMESPACE, 1, false);

        cluster = Cluster.fromParameters(sim.parameters(a, b).build()).connect();
        SimulatedCluster.tend(cluster);

        assertThat(cluster.getNodes()).hasSize(2);
        assertThat(names(cluster)).containsExactlyInAnyOrder("A", "B");
        assertThat(cluster.getView().getNode("A").getAliases()).contains(new Host("10.0.0.11", 3000));
    }

    @Test
    public void wrongClusterNameIsRejected() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        a.setClusterName("other");

        NodeValidator validator = new NodeValidator(
                sim.parameters(a).clusterName("mine").build(), sim);

        assertThatThrownBy(() -> validator.validate(a.getHost()))
                .isInstanceOf(WrongClusterException.class);
        assertThat(a.getOpenConnections().get()).isZero();
    }

    @Test
    public void validationReportsTheLastAddressTried() throws Exception {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        SimulatedServer b = sim.addServer("B", "10.0.0.2");
        a.setClusterName("other");
        b.setReachable(false);
        InetAddress[] addresses = {InetAddress.getByName("10.0.0.1"), InetAddress.getByName("10.0.0.2")};

        NodeValidator validator = new NodeValidator(sim.parameters(a)
                .clusterName("mine")
                .addressResolver(name -> addresses)
                .build(), sim);

        assertThatThrownBy(() -> validator.validate(new Host("db.local", 3000)))
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("10.0.0.2");
        assertThat(a.getOpenConnections().get()).isZero();
    }

    @Test
    public void validationFallsThroughToAnAddressThatAnswers() throws Exception {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        SimulatedServer b = sim.addServer("B", "10.0.0.2");
        a.setReachable(false);
        InetAddress[] addresses = {InetAddress.getByName("10.0.0.1"), InetAddress.getByName("10.0.0.2")};

        NodeValidator validator = new NodeValidator(sim.parameters(a)
                .addressResolver(name -> addresses)
                .build(), sim);

        NodeValidator.ValidatedNode validated = validator.validate(new Host("db.local", 3000));

        assertThat(validated.getName()).isEqualTo("B");
        assertThat(validated.getAliases()).contains(new Host("10.0.0.1", 3000), new Host("10.0.0.2", 3000));
        validated.getConnection().close();
        assertThat(b.getOpenConnections().get()).isZero();
    }

    @Test
    public void uninitializedNodeIsRejected() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        a.setPartitionGeneration(-1);

        NodeValidator validator = new NodeValidator(sim.parameters(a).build(), sim);

        assertThatThrownBy(() -> validator.validate(a.getHost()))
                .isInstanceOf(InvalidNodeException.class)
                .hasMessageContaining("not yet fully initialized");
    }

    @Test
    public void masterProlesSkipsInactiveMasterInCpMode() {
        cluster = connectWithFixedOwners(true);
        cluster.getView().getNode("X").close();

        for (int i = 0; i < 100; i++) {
            assertThat(cluster.getMasterProlesNode(NAMESPACE, 7).getName()).isEqualTo("Y");
        }
        assertThatThrownBy(() -> cluster.getMasterNode(NAMESPACE, 7))
                .isInstanceOf(InvalidNodeException.class);
    }

    @Test
    public void cpModeWithoutActiveReplicaFails() {
        cluster = connectWithFixedOwners(true);
        cluster.getView().getNode("X").close();
        cluster.getView().getNode("Y").close();

        assertThatThrownBy(() -> cluster.getMasterProlesNode(NAMESPACE, 7))
                .isInstanceOf(InvalidNodeException.class);
    }

    @Test
    public void apModeWithoutActiveReplicaFallsBackToAnyNode() {
        cluster = connectWithFixedOwners(false);
        cluster.getView().getNode("X").close();
        cluster.getView().getNode("Y").close();

        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < 100; i++) {
            counts.merge(cluster.getMasterProlesNode(NAMESPACE, 7).getName(), 1, Integer::sum);
        }

        assertThat(counts.keySet()).containsExactlyInAnyOrder("Z", "W");
        assertThat(counts.get("Z")).isBetween(40, 60);
    }

    @Test
    public void unknownNamespaceAndNodeAreReported() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        sim.spreadPartitions(NAMESPACE, 1, false);
        cluster = Cluster.fromParameters(sim.parameters(a).build()).connect();

        assertThatThrownBy(() -> cluster.getMasterNode("missing", 1))
                .isInstanceOf(InvalidNamespaceException.class);
        assertThatThrownBy(() -> cluster.getNode("nope"))
                .isInstanceOf(InvalidNodeException.class)
                .hasMessageContaining("Invalid node name");
        assertThat(cluster.getNode("A").getName()).isEqualTo("A");
        assertThat(cluster.getPartitions("missing")).isNull();
    }

    @Test
    public void statsReportNodes() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        sim.addServer("B", "10.0.0.2");
        sim.peerAll();
        sim.spreadPartitions(NAMESPACE, 1, false);
        cluster = Cluster.fromParameters(sim.parameters(a).build()).connect();

        ClusterStats stats = cluster.getStats();

        assertThat(stats.getNodes()).extracting(NodeStats::getName).containsExactlyInAnyOrder("A", "B");
        assertThat(stats.getTendCount()).isPositive();
        assertThat(stats.getViewGeneration()).isEqualTo(cluster.getView().getGeneration());
    }

    @Test
    public void metersTrackMembership() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        sim.addServer("B", "10.0.0.2");
        SimulatedServer c = sim.addServer("C", "10.0.0.3");
        sim.peerAll();
        sim.spreadPartitions(NAMESPACE, 1, false);

        cluster = Cluster.fromParameters(sim.parameters(a)
                .meterRegistry(registry)
                .maxNodeFailures(1)
                .build()).connect();

        assertThat(registry.get("tessera.cluster.nodes.added").counter().count()).isEqualTo(3.0);
        assertThat(registry.get("tessera.cluster.nodes").gauge().value()).isEqualTo(3.0);

        c.setReachable(false);
        SimulatedCluster.tend(cluster);

        assertThat(registry.get("tessera.cluster.nodes.removed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("tessera.cluster.nodes").gauge().value()).isEqualTo(2.0);
    }

    @Test
    public void closeClosesEveryNode() {
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        SimulatedServer b = sim.addServer("B", "10.0.0.2");
        sim.peerAll();
        cluster = Cluster.fromParameters(sim.parameters(a).build()).connect();

        cluster.close();

        assertThat(cluster.isClosed()).isTrue();
        for (Node node : cluster.getNodes()) {
            assertThat(node.isActive()).isFalse();
        }
        assertThat(a.getOpenConnections().get()).isZero();
        assertThat(b.getOpenConnections().get()).isZero();
    }

    /**
     * Four nodes where partition 7 has master X and replica Y.
     */
    private Cluster connectWithFixedOwners(boolean cpMode) {
        SimulatedServer x = sim.addServer("X", "10.0.0.1");
        SimulatedServer y = sim.addServer("Y", "10.0.0.2");
        sim.addServer("Z", "10.0.0.3");
        sim.addServer("W", "10.0.0.4");
        sim.peerAll();
        sim.spreadPartitions(NAMESPACE, 2, cpMode);
        for (SimulatedServer server : sim.getServers()) {
            server.own(NAMESPACE, 2, cpMode, 0, 7, server == x);
            server.own(NAMESPACE, 2, cpMode, 1, 7, server == y);
        }

        Cluster connected = Cluster.fromParameters(sim.parameters(x).build()).connect();
        assertThat(connected.getPartitions(NAMESPACE).isCpMode()).isEqualTo(cpMode);
        assertThat(connected.getMasterNode(NAMESPACE, 7).getName()).isEqualTo("X");
        return connected;
    }
}
