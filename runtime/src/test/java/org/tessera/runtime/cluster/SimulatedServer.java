package org.tessera.runtime.cluster;

import lombok.Getter;
import lombok.Setter;
import org.tessera.runtime.clients.Info;
import org.tessera.util.Host;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An in-memory server answering info commands the way a cluster node does.
 */
public class SimulatedServer {

    public static final int PORT = 3000;

    @Getter
    private final String name;

    @Getter
    private final List<String> addresses = new CopyOnWriteArrayList<>();

    @Getter
    @Setter
    private volatile boolean reachable = true;

    @Setter
    private volatile String features = "peers;replicas;pscans;pquery;float";

    @Setter
    private volatile String clusterName;

    private final AtomicLong peersGeneration = new AtomicLong(1);

    private final AtomicInteger partitionGeneration = new AtomicInteger(1);

    private final List<SimulatedServer> peers = new CopyOnWriteArrayList<>();

    /** Addresses this server advertises for each peer in its service list, by peer name. */
    private final Map<String, String> serviceAddresses = new LinkedHashMap<>();

    private final Map<String, Ownership> namespaces = new LinkedHashMap<>();

    @Getter
    private final AtomicInteger openConnections = new AtomicInteger();

    SimulatedServer(String name, String address) {
        this.name = name;
        this.addresses.add(address);
    }

    public Host getHost() {
        return new Host(addresses.get(0), PORT);
    }

    public synchronized void addPeer(SimulatedServer peer) {
        if (peer != this && !peers.contains(peer)) {
            peers.add(peer);
            peersGeneration.incrementAndGet();
        }
    }

    public synchronized void removePeer(SimulatedServer peer) {
        if (peers.remove(peer)) {
            peersGeneration.incrementAndGet();
        }
    }

    /**
     * Advertise a peer under a specific address in the services list.
     */
    public synchronized void advertise(SimulatedServer peer, String address) {
        serviceAddresses.put(peer.getName(), address);
    }

    /**
     * Set or clear ownership of a partition replica, without bumping the partition generation.
     */
    public synchronized void own(String namespace, int replicaCount, boolean cpMode, int replica,
                                 int partitionId, boolean owned) {
        Ownership ownership = namespaces.computeIfAbsent(namespace, ns -> new Ownership(replicaCount, cpMode));
        ownership.bits[replica][partitionId] = owned;
    }

    public void bumpPartitionGeneration() {
        partitionGeneration.incrementAndGet();
    }

    public void setPartitionGeneration(int generation) {
        partitionGeneration.set(generation);
    }

    synchronized String answer(String command) {
        switch (command) {
            case Info.NODE:
                return name;
            case Info.FEATURES:
                return features;
            case Info.CLUSTER_NAME:
                return clusterName == null ? "null" : clusterName;
            case Info.PEERS_GENERATION:
                return Long.toString(peersGeneration.get());
            case Info.PARTITION_GENERATION:
                return Integer.toString(partitionGeneration.get());
            case "peers-clear-std":
            case "peers-clear-alt":
                return peersResponse();
            case Info.SERVICES:
            case Info.SERVICES_ALTERNATE:
                return servicesResponse();
            case Info.REPLICAS:
                return replicasResponse(true);
            case Info.REPLICAS_ALL:
                return replicasResponse(false);
            default:
                return "ERROR::unknown command " + command;
        }
    }

    private String peersResponse() {
        StringBuilder sb = new StringBuilder();
        sb.append(peersGeneration.get()).append(',').append(PORT).append(",[");

        for (int i = 0; i < peers.size(); i++) {
            SimulatedServer peer = peers.get(i);
            if (i > 0) {
                sb.append(',');
            }
            sb.append('[').append(peer.getName()).append(",,[");
            List<String> peerAddresses = peer.getAddresses();
            for (int j = 0; j < peerAddresses.size(); j++) {
                if (j > 0) {
                    sb.append(',');
                }
                sb.append(peerAddresses.get(j)).append(':').append(PORT);
            }
            sb.append("]]");
        }
        return sb.append(']').toString();
    }

    private String servicesResponse() {
        List<String> entries = new ArrayList<>();
        for (SimulatedServer peer : peers) {
            String address = serviceAddresses.getOrDefault(peer.getName(), peer.getAddresses().get(0));
            entries.add(address + ':' + PORT);
        }
        return String.join(";", entries);
    }

    private String replicasResponse(boolean withRegime) {
        StringBuilder sb = new StringBuilder();

        for (Map.Entry<String, Ownership> entry : namespaces.entrySet()) {
            Ownership ownership = entry.getValue();
            if (sb.length() > 0) {
                sb.append(';');
            }
            sb.append(entry.getKey()).append(':');
            if (withRegime) {
                sb.append(ownership.cpMode ? 1 : 0).append(',');
            }
            sb.append(ownership.bits.length);

            for (boolean[] level : ownership.bits) {
                byte[] bitmap = new byte[Node.PARTITIONS / 8];
                for (int pid = 0; pid < Node.PARTITIONS; pid++) {
                    if (level[pid]) {
                        bitmap[pid >> 3] |= (byte) (0x80 >> (pid & 7));
                    }
                }
                sb.append(',').append(Base64.getEncoder().encodeToString(bitmap));
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return name + addresses;
    }

    private static final class Ownership {
        private final boolean[][] bits;
        private final boolean cpMode;

        private Ownership(int replicaCount, boolean cpMode) {
            this.bits = new boolean[replicaCount][Node.PARTITIONS];
            this.cpMode = cpMode;
        }
    }
}
