package com.mesosphere.allocator.filter;

import org.apache.mesos.Protos;

import java.time.Instant;

/**
 * Stops inverse offers for an agent from being sent to a framework after it declined one.
 */
public class InverseOfferFilter implements OfferFilter {

    private final Protos.FrameworkID frameworkId;
    private final Protos.SlaveID agentId;
    private final Instant expiry;

    public InverseOfferFilter(Protos.FrameworkID frameworkId, Protos.SlaveID agentId, Instant expiry) {
        this.frameworkId = frameworkId;
        this.agentId = agentId;
        this.expiry = expiry;
    }

    @Override
    public Protos.FrameworkID getFrameworkId() {
        return frameworkId;
    }

    public Protos.SlaveID getAgentId() {
        return agentId;
    }

    @Override
    public Instant getExpiry() {
        return expiry;
    }

    @Override
    public String toString() {
        return String.format("InverseOfferFilter[framework=%s, agent=%s, expiry=%s]",
                frameworkId.getValue(), agentId.getValue(), expiry);
    }
}
