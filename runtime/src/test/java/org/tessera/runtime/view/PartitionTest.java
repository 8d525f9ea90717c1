package org.tessera.runtime.view;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.tessera.runtime.cluster.Cluster;
import org.tessera.runtime.cluster.Node;
import org.tessera.runtime.cluster.SimulatedCluster;
import org.tessera.runtime.cluster.SimulatedServer;
import org.tessera.runtime.exceptions.InvalidNodeException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PartitionTest {

    private static final String NAMESPACE = "test";

    private Cluster cluster;

    @Before
    public void setUp() {
        SimulatedCluster sim = new SimulatedCluster();
        SimulatedServer a = sim.addServer("A", "10.0.0.1");
        sim.addServer("B", "10.0.0.2");
        sim.peerAll();
        sim.spreadPartitions(NAMESPACE, 2, false);
        cluster = Cluster.fromParameters(sim.parameters(a).build()).connect();
    }

    @After
    public void tearDown() {
        cluster.close();
    }

    private static byte[] digestFor(int partitionId) {
        byte[] digest = new byte[20];
        digest[0] = (byte) partitionId;
        digest[1] = (byte) (partitionId >> 8);
        digest[10] = 0x5A;
        return digest;
    }

    @Test
    public void partitionIdIsLittleEndianModuloPartitions() {
        assertThat(Partition.getPartitionId(new byte[] {0x2A, 0, 0, 0})).isEqualTo(42);
        assertThat(Partition.getPartitionId(new byte[] {0, 0x10, 0, 0})).isZero();
        assertThat(Partition.getPartitionId(new byte[] {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF}))
                .isEqualTo(Node.PARTITIONS - 1);
        assertThat(Partition.getPartitionId(digestFor(4001))).isEqualTo(4001);
    }

    @Test
    public void masterPolicyReadsAndWritesMaster() {
        // Round robin spread: partition 2 is mastered by the first server, replicated on the second.
        Partition partition = Partition.of(cluster, NAMESPACE, digestFor(2), Replica.MASTER);

        assertThat(partition.getPartitionId()).isEqualTo(2);
        assertThat(partition.getNodeRead(cluster).getName()).isEqualTo("A");
        assertThat(partition.getNodeWrite(cluster).getName()).isEqualTo("A");
    }

    @Test
    public void sequencePolicyMovesToNextReplicaOnRetry() {
        Partition partition = Partition.of(cluster, NAMESPACE, digestFor(2), Replica.SEQUENCE);

        assertThat(partition.getNodeRead(cluster).getName()).isEqualTo("A");
        partition.prepareRetry();
        assertThat(partition.getNodeRead(cluster).getName()).isEqualTo("B");
        partition.prepareRetry();
        assertThat(partition.getNodeRead(cluster).getName()).isEqualTo("A");
    }

    @Test
    public void sequencePolicySkipsInactiveMaster() {
        Partition partition = Partition.of(cluster, NAMESPACE, digestFor(2), Replica.SEQUENCE);
        cluster.getView().getNode("A").close();

        assertThat(partition.getNodeRead(cluster).getName()).isEqualTo("B");
        assertThat(partition.getNodeWrite(cluster).getName()).isEqualTo("B");
        assertThatThrownBy(() -> Partition.of(cluster, NAMESPACE, digestFor(2), Replica.MASTER)
                .getNodeWrite(cluster))
                .isInstanceOf(InvalidNodeException.class);
    }

    @Test
    public void noActiveReplicaIsReported() {
        cluster.getView().getNode("A").close();
        cluster.getView().getNode("B").close();

        Partition partition = Partition.of(cluster, NAMESPACE, digestFor(2), Replica.SEQUENCE);

        assertThatThrownBy(() -> partition.getNodeRead(cluster))
                .isInstanceOf(InvalidNodeException.class)
                .hasMessageContaining("test:2");
        assertThatThrownBy(() -> cluster.getRandomNode())
                .isInstanceOf(InvalidNodeException.class);
    }

    @Test
    public void invalidPartitionIdIsRejected() {
        assertThatThrownBy(() -> Partition.of(cluster.getView(), NAMESPACE, Node.PARTITIONS, Replica.MASTER))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
