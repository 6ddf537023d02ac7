package com.mesosphere.allocator.testutils;

import com.mesosphere.allocator.allocation.InverseOfferCallback;
import com.mesosphere.allocator.allocation.OfferCallback;
import com.mesosphere.allocator.allocation.UnavailableResources;
import com.mesosphere.allocator.offer.ResourceSet;
import org.apache.mesos.Protos;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records the offers and inverse offers which the allocator sends, in the order they were sent.
 */
public class OfferRecorder implements OfferCallback, InverseOfferCallback {

    /**
     * A single offer callback invocation.
     */
    public static class Offer {
        private final Protos.FrameworkID frameworkId;
        private final Map<String, Map<Protos.SlaveID, ResourceSet>> resources;

        private Offer(Protos.FrameworkID frameworkId, Map<String, Map<Protos.SlaveID, ResourceSet>> resources) {
            this.frameworkId = frameworkId;
            this.resources = resources;
        }

        public Protos.FrameworkID getFrameworkId() {
            return frameworkId;
        }

        public Map<String, Map<Protos.SlaveID, ResourceSet>> getResources() {
            return resources;
        }

        /**
         * Returns everything in this offer, across roles and agents.
         */
        public ResourceSet getTotal() {
            ResourceSet total = ResourceSet.empty();
            for (Map<Protos.SlaveID, ResourceSet> byAgent : resources.values()) {
                for (ResourceSet agentResources : byAgent.values()) {
                    total = total.plus(agentResources);
                }
            }
            return total;
        }
    }

    private final List<Offer> offers = new ArrayList<>();
    private final Map<Protos.FrameworkID, Map<Protos.SlaveID, UnavailableResources>> inverseOffers =
            new LinkedHashMap<>();

    @Override
    public synchronized void offer(
            Protos.FrameworkID frameworkId, Map<String, Map<Protos.SlaveID, ResourceSet>> resources) {
        offers.add(new Offer(frameworkId, resources));
    }

    @Override
    public synchronized void inverseOffer(
            Protos.FrameworkID frameworkId, Map<Protos.SlaveID, UnavailableResources> unavailableResources) {
        inverseOffers.computeIfAbsent(frameworkId, id -> new LinkedHashMap<>()).putAll(unavailableResources);
    }

    public synchronized List<Offer> getOffers() {
        return new ArrayList<>(offers);
    }

    /**
     * Returns everything offered to the framework since the recorder was last cleared.
     */
    public synchronized ResourceSet getOffered(Protos.FrameworkID frameworkId) {
        ResourceSet total = ResourceSet.empty();
        for (Offer offer : offers) {
            if (offer.getFrameworkId().equals(frameworkId)) {
                total = total.plus(offer.getTotal());
            }
        }
        return total;
    }

    public synchronized Map<Protos.SlaveID, UnavailableResources> getInverseOffers(Protos.FrameworkID frameworkId) {
        Map<Protos.SlaveID, UnavailableResources> sent = inverseOffers.get(frameworkId);
        return sent == null ? Collections.emptyMap() : new LinkedHashMap<>(sent);
    }

    public synchronized void clear() {
        offers.clear();
        inverseOffers.clear();
    }
}
