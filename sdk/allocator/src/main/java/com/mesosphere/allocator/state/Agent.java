package com.mesosphere.allocator.state;

import com.google.common.collect.ImmutableSet;
import com.mesosphere.allocator.offer.Constants;
import com.mesosphere.allocator.offer.ResourceSet;
import org.apache.mesos.Protos;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The allocator's view of a single agent: its total capacity (reservations included), and what each framework has
 * been offered or is using there. Offered and used resources are tagged with the role they were allocated to.
 *
 * <p>Instances are owned and mutated by {@link ClusterStateTracker}. Other components only hold the agent's id.
 */
public class Agent {

    private final Protos.SlaveID id;
    private final Map<Protos.FrameworkID, ResourceSet> offered = new LinkedHashMap<>();
    private final Map<Protos.FrameworkID, ResourceSet> used = new LinkedHashMap<>();
    private final Set<Protos.FrameworkID> outstandingInverseOffers = new LinkedHashSet<>();
    private final Map<Protos.FrameworkID, InverseOfferStatus> inverseOfferStatuses = new LinkedHashMap<>();

    private Protos.SlaveInfo info;
    private ResourceSet total;
    private Set<Protos.SlaveInfo.Capability.Type> capabilities;
    private boolean activated = true;
    private Optional<Protos.Unavailability> unavailability = Optional.empty();

    Agent(
            Protos.SlaveID id,
            Protos.SlaveInfo info,
            ResourceSet total,
            Collection<Protos.SlaveInfo.Capability.Type> capabilities) {
        this.id = id;
        this.info = info;
        this.total = total;
        this.capabilities = ImmutableSet.copyOf(capabilities);
    }

    public Protos.SlaveID getId() {
        return id;
    }

    public Protos.SlaveInfo getInfo() {
        return info;
    }

    public String getHostname() {
        return info.getHostname();
    }

    /**
     * Returns the agent's total capacity, including any reservations. Never carries allocation tags.
     */
    public ResourceSet getTotal() {
        return total;
    }

    public Set<Protos.SlaveInfo.Capability.Type> getCapabilities() {
        return capabilities;
    }

    public boolean hasCapability(Protos.SlaveInfo.Capability.Type capability) {
        return capabilities.contains(capability);
    }

    public boolean isActivated() {
        return activated;
    }

    public Optional<Protos.Unavailability> getUnavailability() {
        return unavailability;
    }

    public boolean hasGpus() {
        return total.getScalar(Constants.GPUS_RESOURCE_TYPE) > 0;
    }

    public ResourceSet getOffered(Protos.FrameworkID frameworkId) {
        return offered.getOrDefault(frameworkId, ResourceSet.empty());
    }

    public ResourceSet getUsed(Protos.FrameworkID frameworkId) {
        return used.getOrDefault(frameworkId, ResourceSet.empty());
    }

    /**
     * Returns everything the framework holds on this agent, offered or used.
     */
    public ResourceSet getAllocated(Protos.FrameworkID frameworkId) {
        return getOffered(frameworkId).plus(getUsed(frameworkId));
    }

    public Map<Protos.FrameworkID, ResourceSet> getOffered() {
        return Collections.unmodifiableMap(offered);
    }

    public Map<Protos.FrameworkID, ResourceSet> getUsed() {
        return Collections.unmodifiableMap(used);
    }

    /**
     * Returns the ids of all frameworks which hold offered or used resources here.
     */
    public Set<Protos.FrameworkID> getFrameworks() {
        Set<Protos.FrameworkID> frameworks = new LinkedHashSet<>(used.keySet());
        frameworks.addAll(offered.keySet());
        return frameworks;
    }

    /**
     * Returns the sum of everything offered or used on this agent, still tagged by allocation role.
     */
    public ResourceSet getAllocated() {
        ResourceSet allocated = ResourceSet.empty();
        for (ResourceSet resources : offered.values()) {
            allocated = allocated.plus(resources);
        }
        for (ResourceSet resources : used.values()) {
            allocated = allocated.plus(resources);
        }
        return allocated;
    }

    /**
     * Returns the capacity which is neither offered nor used, untagged.
     */
    public ResourceSet getAvailable() {
        return total.minus(getAllocated().unallocated());
    }

    public Set<Protos.FrameworkID> getOutstandingInverseOffers() {
        return Collections.unmodifiableSet(outstandingInverseOffers);
    }

    public Map<Protos.FrameworkID, InverseOfferStatus> getInverseOfferStatuses() {
        return Collections.unmodifiableMap(inverseOfferStatuses);
    }

    void setInfo(Protos.SlaveInfo info) {
        this.info = info;
    }

    void setTotal(ResourceSet total) {
        this.total = total;
    }

    void setCapabilities(Collection<Protos.SlaveInfo.Capability.Type> capabilities) {
        this.capabilities = ImmutableSet.copyOf(capabilities);
    }

    void setActivated(boolean activated) {
        this.activated = activated;
    }

    void setUnavailability(Optional<Protos.Unavailability> unavailability) {
        this.unavailability = unavailability;
        outstandingInverseOffers.clear();
        inverseOfferStatuses.clear();
    }

    void setOffered(Protos.FrameworkID frameworkId, ResourceSet resources) {
        put(offered, frameworkId, resources);
    }

    void setUsed(Protos.FrameworkID frameworkId, ResourceSet resources) {
        put(used, frameworkId, resources);
    }

    void addOutstandingInverseOffer(Protos.FrameworkID frameworkId) {
        outstandingInverseOffers.add(frameworkId);
    }

    void removeOutstandingInverseOffer(Protos.FrameworkID frameworkId) {
        outstandingInverseOffers.remove(frameworkId);
    }

    void setInverseOfferStatus(Protos.FrameworkID frameworkId, InverseOfferStatus status) {
        inverseOfferStatuses.put(frameworkId, status);
    }

    /**
     * Drops everything the framework holds or has been asked about on this agent.
     */
    void removeFramework(Protos.FrameworkID frameworkId) {
        offered.remove(frameworkId);
        used.remove(frameworkId);
        outstandingInverseOffers.remove(frameworkId);
        inverseOfferStatuses.remove(frameworkId);
    }

    private static void put(
            Map<Protos.FrameworkID, ResourceSet> map, Protos.FrameworkID frameworkId, ResourceSet resources) {
        if (resources.isEmpty()) {
            map.remove(frameworkId);
        } else {
            map.put(frameworkId, resources);
        }
    }

    @Override
    public String toString() {
        return String.format("Agent[%s (%s), total=%s, activated=%s]",
                id.getValue(), info.getHostname(), total, activated);
    }
}
