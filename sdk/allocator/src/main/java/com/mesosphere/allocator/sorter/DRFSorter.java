package com.mesosphere.allocator.sorter;

import com.google.common.collect.ImmutableSet;
import com.mesosphere.allocator.offer.ResourceQuantities;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Weighted Dominant Resource Fairness: clients are ordered by their dominant share, the largest fraction of the
 * cluster total they hold along any resource, divided by their weight. Equal shares are ordered by which client (or
 * tree node) was added first.
 *
 * <p>Shares are cached per node. A node's cache is invalidated when its subtree's allocation changes, and every cache
 * is invalidated when the cluster total or a weight changes.
 */
public class DRFSorter extends AbstractTreeSorter {

    private final Set<String> fairnessExcludedResourceNames;
    private final ShareFunction shareFunction = this::dominantShare;

    public DRFSorter(String name, boolean hierarchical, Collection<String> fairnessExcludedResourceNames) {
        super(name, hierarchical);
        this.fairnessExcludedResourceNames = ImmutableSet.copyOf(fairnessExcludedResourceNames);
    }

    /**
     * Returns the dominant share of the provided allocation against the current cluster total, divided by weight.
     * Excluded resource names and names with no capacity in the cluster are ignored.
     */
    double dominantShare(ResourceQuantities allocation, double weight) {
        ResourceQuantities total = totalScalarQuantities();
        double share = 0;
        for (String name : allocation.names()) {
            if (fairnessExcludedResourceNames.contains(name)) {
                continue;
            }
            double capacity = total.get(name);
            if (capacity > 0) {
                share = Math.max(share, allocation.get(name) / capacity);
            }
        }
        return weight > 0 ? share / weight : Double.MAX_VALUE;
    }

    /**
     * Returns the dominant share of a client or inner node, including its descendants.
     */
    public double getShare(String path) {
        return dominantShare(allocationScalarQuantities(path), weightOf(path));
    }

    @Override
    protected void orderSiblings(List<Candidate> siblings) {
        siblings.sort(Comparator
                .comparingDouble((Candidate c) -> c.cachedShare(shareFunction))
                .thenComparingLong(Candidate::getSequence));
    }
}
