package com.mesosphere.allocator.sorter;

import com.mesosphere.allocator.offer.Constants;
import com.mesosphere.allocator.offer.LoggingUtils;
import com.mesosphere.allocator.offer.ResourceQuantities;
import com.mesosphere.allocator.offer.ResourceSet;
import org.apache.mesos.Protos;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bookkeeping shared by sorters: the tree of clients, their allocations, their weights and the cluster total.
 * Subclasses only decide how siblings are ordered, see {@link #orderSiblings(List)}.
 *
 * <p>Nodes are stored in a flat map keyed by path, each knowing only its parent's path. A client which also has
 * children (e.g. {@code eng} alongside {@code eng/web}) competes with its children through a virtual leaf which holds
 * the client's own allocation, while its node's subtree totals stay visible to its siblings.
 */
abstract class AbstractTreeSorter implements Sorter {

    private static final String ROOT = "";

    /**
     * A node of the tree: a client, an inner node, or both.
     */
    protected static final class Node {
        private final String path;
        private final String parentPath;
        private final long sequence;
        private final List<String> children = new ArrayList<>();
        private final Map<Protos.SlaveID, ResourceSet> allocation = new LinkedHashMap<>();

        private boolean client;
        private boolean active;
        private ResourceQuantities ownQuantities = ResourceQuantities.empty();
        private ResourceQuantities subtreeQuantities = ResourceQuantities.empty();

        // Share caches, valid while the generation matches the sorter's and the node is not stale.
        private boolean stale = true;
        private long cachedGeneration = -1;
        private double cachedOwnShare;
        private double cachedSubtreeShare;

        private Node(String path, String parentPath, long sequence) {
            this.path = path;
            this.parentPath = parentPath;
            this.sequence = sequence;
        }
    }

    /**
     * An entry competing among its siblings: either a child subtree, or the virtual leaf of a client which also has
     * children.
     */
    protected final class Candidate {
        private final Node node;
        private final boolean virtualLeaf;

        private Candidate(Node node, boolean virtualLeaf) {
            this.node = node;
            this.virtualLeaf = virtualLeaf;
        }

        public String getPath() {
            return node.path;
        }

        public long getSequence() {
            return node.sequence;
        }

        public double getWeight() {
            return weightOf(node.path);
        }

        /**
         * Returns the allocation this candidate competes with: the client's own for a virtual leaf, otherwise the
         * whole subtree.
         */
        public ResourceQuantities getQuantities() {
            return virtualLeaf ? node.ownQuantities : node.subtreeQuantities;
        }

        /**
         * Returns the cached share for this candidate, computing it with the provided function if the cache is stale.
         */
        double cachedShare(ShareFunction function) {
            if (node.stale || node.cachedGeneration != generation) {
                node.cachedOwnShare = function.share(node.ownQuantities, getWeight());
                node.cachedSubtreeShare = function.share(node.subtreeQuantities, getWeight());
                node.cachedGeneration = generation;
                node.stale = false;
            }
            return virtualLeaf ? node.cachedOwnShare : node.cachedSubtreeShare;
        }
    }

    /**
     * Computes the share of an allocation with a given weight.
     */
    interface ShareFunction {
        double share(ResourceQuantities allocation, double weight);
    }

    protected final Logger logger;

    private final boolean hierarchical;
    private final Map<String, Node> nodes = new HashMap<>();
    private final Map<String, Double> weights = new HashMap<>();
    private final Map<Protos.SlaveID, ResourceQuantities> agentTotals = new LinkedHashMap<>();
    private ResourceQuantities total = ResourceQuantities.empty();
    private long nextSequence = 0;
    private long generation = 0;
    private int clientCount = 0;

    /**
     * @param name label for log messages, e.g. the role which frameworks are being sorted in
     * @param hierarchical whether client names containing {@code /} form a tree, otherwise they are opaque
     */
    protected AbstractTreeSorter(String name, boolean hierarchical) {
        this.logger = LoggingUtils.getLogger(getClass(), name);
        this.hierarchical = hierarchical;
        nodes.put(ROOT, new Node(ROOT, null, nextSequence++));
    }

    /**
     * Orders candidates which share a parent. The first candidate is visited first.
     */
    protected abstract void orderSiblings(List<Candidate> siblings);

    @Override
    public void add(String client) {
        Node node = nodes.get(client);
        if (node != null && node.client) {
            throw new IllegalArgumentException(String.format("Sorter already contains client '%s'", client));
        }
        if (node == null) {
            node = createNode(client);
        }
        node.client = true;
        node.active = true;
        ++clientCount;
        logger.debug("Added client {}", client);
    }

    @Override
    public void remove(String client) {
        Node node = getClient(client);
        for (ResourceSet resources : new ArrayList<>(node.allocation.values())) {
            propagate(node, resources.quantities(), false);
        }
        node.allocation.clear();
        node.client = false;
        node.active = false;
        --clientCount;
        prune(node);
        logger.debug("Removed client {}", client);
    }

    @Override
    public void activate(String client) {
        getClient(client).active = true;
    }

    @Override
    public void deactivate(String client) {
        getClient(client).active = false;
    }

    @Override
    public void updateWeight(String path, double weight) {
        weights.put(path, weight);
        ++generation;
    }

    @Override
    public void allocated(String client, Protos.SlaveID agentId, ResourceSet resources) {
        Node node = getClient(client);
        if (resources.isEmpty()) {
            return;
        }
        ResourceSet current = node.allocation.getOrDefault(agentId, ResourceSet.empty());
        node.allocation.put(agentId, current.plus(resources));
        propagate(node, resources.quantities(), true);
    }

    @Override
    public void update(String client, Protos.SlaveID agentId, ResourceSet oldAllocation, ResourceSet newAllocation) {
        Node node = getClient(client);
        ResourceSet current = node.allocation.getOrDefault(agentId, ResourceSet.empty());
        // Validates before anything is changed.
        ResourceSet updated = current.minus(oldAllocation).plus(newAllocation);
        putAllocation(node, agentId, updated);
        propagate(node, oldAllocation.quantities(), false);
        propagate(node, newAllocation.quantities(), true);
    }

    @Override
    public void unallocated(String client, Protos.SlaveID agentId, ResourceSet resources) {
        Node node = getClient(client);
        ResourceSet current = node.allocation.getOrDefault(agentId, ResourceSet.empty());
        ResourceSet remaining = current.minus(resources);
        putAllocation(node, agentId, remaining);
        propagate(node, resources.quantities(), false);
    }

    @Override
    public Map<Protos.SlaveID, ResourceSet> allocation(String client) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(getClient(client).allocation));
    }

    @Override
    public ResourceQuantities allocationScalarQuantities(String path) {
        Node node = nodes.get(path);
        return node == null ? ResourceQuantities.empty() : node.subtreeQuantities;
    }

    @Override
    public void addSlave(Protos.SlaveID agentId, ResourceQuantities agentTotal) {
        ResourceQuantities previous = agentTotals.put(agentId, agentTotal);
        if (previous != null) {
            total = total.minusClampedAtZero(previous);
        }
        total = total.plus(agentTotal);
        ++generation;
    }

    @Override
    public void removeSlave(Protos.SlaveID agentId) {
        ResourceQuantities previous = agentTotals.remove(agentId);
        if (previous != null) {
            total = total.minusClampedAtZero(previous);
            ++generation;
        }
    }

    @Override
    public ResourceQuantities totalScalarQuantities() {
        return total;
    }

    @Override
    public List<String> sort() {
        List<String> order = new ArrayList<>(clientCount);
        visit(nodes.get(ROOT), order);
        return order;
    }

    @Override
    public boolean contains(String client) {
        Node node = nodes.get(client);
        return node != null && node.client;
    }

    @Override
    public int count() {
        return clientCount;
    }

    protected double weightOf(String path) {
        return weights.getOrDefault(path, 1.0);
    }

    private void visit(Node node, List<String> order) {
        List<Candidate> siblings = new ArrayList<>(node.children.size() + 1);
        if (node.client && node.active) {
            siblings.add(new Candidate(node, true));
        }
        for (String childPath : node.children) {
            Node child = nodes.get(childPath);
            if (hasActiveClient(child)) {
                siblings.add(new Candidate(child, false));
            }
        }
        orderSiblings(siblings);
        for (Candidate candidate : siblings) {
            if (candidate.virtualLeaf) {
                order.add(candidate.node.path);
            } else {
                visit(candidate.node, order);
            }
        }
    }

    private boolean hasActiveClient(Node node) {
        if (node.client && node.active) {
            return true;
        }
        for (String childPath : node.children) {
            if (hasActiveClient(nodes.get(childPath))) {
                return true;
            }
        }
        return false;
    }

    private Node getClient(String client) {
        Node node = nodes.get(client);
        if (node == null || !node.client) {
            throw new IllegalArgumentException(String.format("Sorter does not contain client '%s'", client));
        }
        return node;
    }

    private Node createNode(String path) {
        String parentPath = ROOT;
        int delim = hierarchical ? path.lastIndexOf(Constants.ROLE_PATH_DELIM) : -1;
        if (delim > 0) {
            parentPath = path.substring(0, delim);
            if (!nodes.containsKey(parentPath)) {
                createNode(parentPath);
            }
        }
        Node node = new Node(path, parentPath, nextSequence++);
        nodes.put(path, node);
        nodes.get(parentPath).children.add(path);
        return node;
    }

    private void prune(Node node) {
        Node current = node;
        while (current != null && !ROOT.equals(current.path) && !current.client && current.children.isEmpty()) {
            nodes.remove(current.path);
            Node parent = nodes.get(current.parentPath);
            parent.children.remove(current.path);
            current = parent;
        }
    }

    private static void putAllocation(Node node, Protos.SlaveID agentId, ResourceSet resources) {
        if (resources.isEmpty()) {
            node.allocation.remove(agentId);
        } else {
            node.allocation.put(agentId, resources);
        }
    }

    /**
     * Adds or subtracts quantities on the node's own totals and on the subtree totals of the node and its ancestors,
     * invalidating their cached shares.
     */
    private void propagate(Node node, ResourceQuantities quantities, boolean add) {
        node.ownQuantities = add
                ? node.ownQuantities.plus(quantities)
                : node.ownQuantities.minusClampedAtZero(quantities);
        Node current = node;
        while (current != null) {
            current.subtreeQuantities = add
                    ? current.subtreeQuantities.plus(quantities)
                    : current.subtreeQuantities.minusClampedAtZero(quantities);
            current.stale = true;
            current = current.parentPath == null ? null : nodes.get(current.parentPath);
        }
    }
}
