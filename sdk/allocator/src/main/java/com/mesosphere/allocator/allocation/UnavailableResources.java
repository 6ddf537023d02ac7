package com.mesosphere.allocator.allocation;

import com.mesosphere.allocator.offer.ResourceSet;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.mesos.Protos;

/**
 * Resources which a framework holds on an agent, along with the window in which the agent will be unavailable.
 */
public class UnavailableResources {

    private final ResourceSet resources;
    private final Protos.Unavailability unavailability;

    public UnavailableResources(ResourceSet resources, Protos.Unavailability unavailability) {
        this.resources = resources;
        this.unavailability = unavailability;
    }

    public ResourceSet getResources() {
        return resources;
    }

    public Protos.Unavailability getUnavailability() {
        return unavailability;
    }

    @Override
    public boolean equals(Object o) {
        return EqualsBuilder.reflectionEquals(this, o);
    }

    @Override
    public int hashCode() {
        return HashCodeBuilder.reflectionHashCode(this);
    }

    @Override
    public String toString() {
        return String.format("UnavailableResources[%s, start=%dns]", resources,
                unavailability.getStart().getNanoseconds());
    }
}
