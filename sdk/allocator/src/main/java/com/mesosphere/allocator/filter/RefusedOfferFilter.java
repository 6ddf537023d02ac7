package com.mesosphere.allocator.filter;

import com.mesosphere.allocator.offer.ResourceSet;
import org.apache.mesos.Protos;

import java.time.Instant;
import java.util.Optional;

/**
 * Stops resources from being re-offered to a framework after it declined them. Each scope which is absent matches
 * anything: an absent agent matches every agent, an absent role every role, and absent resources any resources.
 */
public class RefusedOfferFilter implements OfferFilter {

    private final Protos.FrameworkID frameworkId;
    private final Optional<Protos.SlaveID> agentId;
    private final Optional<String> role;
    private final Optional<ResourceSet> resources;
    private final Instant expiry;

    public RefusedOfferFilter(
            Protos.FrameworkID frameworkId,
            Optional<Protos.SlaveID> agentId,
            Optional<String> role,
            Optional<ResourceSet> resources,
            Instant expiry) {
        this.frameworkId = frameworkId;
        this.agentId = agentId;
        this.role = role;
        this.resources = resources.map(ResourceSet::unallocated);
        this.expiry = expiry;
    }

    @Override
    public Protos.FrameworkID getFrameworkId() {
        return frameworkId;
    }

    public Optional<Protos.SlaveID> getAgentId() {
        return agentId;
    }

    public Optional<String> getRole() {
        return role;
    }

    public Optional<ResourceSet> getResources() {
        return resources;
    }

    @Override
    public Instant getExpiry() {
        return expiry;
    }

    /**
     * Returns whether offering the provided resources from the agent to the role falls within this filter, i.e. the
     * resources are wholly contained in the filtered resources.
     */
    public boolean filters(Protos.SlaveID agentId, String role, ResourceSet resources) {
        if (this.agentId.isPresent() && !this.agentId.get().equals(agentId)) {
            return false;
        }
        if (this.role.isPresent() && !this.role.get().equals(role)) {
            return false;
        }
        return !this.resources.isPresent() || this.resources.get().contains(resources.unallocated());
    }

    @Override
    public String toString() {
        return String.format("RefusedOfferFilter[framework=%s, agent=%s, role=%s, resources=%s, expiry=%s]",
                frameworkId.getValue(),
                agentId.map(Protos.SlaveID::getValue).orElse("any"),
                role.orElse("any"),
                resources.map(ResourceSet::toString).orElse("any"),
                expiry);
    }
}
