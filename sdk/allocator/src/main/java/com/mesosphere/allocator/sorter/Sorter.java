package com.mesosphere.allocator.sorter;

import com.mesosphere.allocator.offer.ResourceQuantities;
import com.mesosphere.allocator.offer.ResourceSet;
import org.apache.mesos.Protos;

import java.util.List;
import java.util.Map;

/**
 * Orders a set of clients (roles, or the frameworks within a role) by how much of the cluster they have been
 * allocated. The allocator visits clients in the returned order, so that the client at the head of {@link #sort()}
 * is the next to receive resources.
 *
 * <p>Client names containing {@code /} form a tree in hierarchical sorters, where allocations to {@code eng/web}
 * also count towards {@code eng}.
 */
public interface Sorter {

    /**
     * Adds a client, initially active and without allocations.
     *
     * @throws IllegalArgumentException if the client is already present
     */
    void add(String client);

    /**
     * Removes a client along with any allocations still recorded for it.
     *
     * @throws IllegalArgumentException if the client is not present
     */
    void remove(String client);

    /**
     * Includes the client in {@link #sort()} results. Clients are active when added.
     */
    void activate(String client);

    /**
     * Excludes the client from {@link #sort()} results while keeping its allocations.
     */
    void deactivate(String client);

    /**
     * Sets the weight of a client, or of an inner node of the tree. The weight may be set before the path is added.
     */
    void updateWeight(String path, double weight);

    /**
     * Records resources as allocated to the client on the agent.
     */
    void allocated(String client, Protos.SlaveID agentId, ResourceSet resources);

    /**
     * Replaces part of a client's allocation on an agent, e.g. after resources were reserved.
     *
     * @throws IllegalArgumentException if the old resources are not allocated to the client
     */
    void update(String client, Protos.SlaveID agentId, ResourceSet oldAllocation, ResourceSet newAllocation);

    /**
     * Removes resources from the client's allocation on the agent.
     *
     * @throws IllegalArgumentException if the resources are not allocated to the client
     */
    void unallocated(String client, Protos.SlaveID agentId, ResourceSet resources);

    /**
     * Returns the client's own allocation, by agent.
     */
    Map<Protos.SlaveID, ResourceSet> allocation(String client);

    /**
     * Returns the summed scalar allocation of a path and all of its descendants.
     */
    ResourceQuantities allocationScalarQuantities(String path);

    /**
     * Adds an agent's capacity to the total which shares are computed against.
     */
    void addSlave(Protos.SlaveID agentId, ResourceQuantities total);

    void removeSlave(Protos.SlaveID agentId);

    ResourceQuantities totalScalarQuantities();

    /**
     * Returns the active clients in visiting order.
     */
    List<String> sort();

    boolean contains(String client);

    /**
     * Returns the number of clients, active or not.
     */
    int count();
}
