package com.mesosphere.allocator.state;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.mesos.Protos;

import java.time.Instant;

/**
 * A framework's latest response to an inverse offer for an agent which is scheduled for maintenance.
 */
public class InverseOfferStatus {

    /**
     * The framework's answer to the inverse offer.
     */
    public enum Status {
        /** Resources on the agent will not be used beyond the unavailability window. */
        ACCEPT,
        /** The framework intends to keep using resources during the unavailability window. */
        DECLINE,
        /** The framework has not answered yet. */
        UNKNOWN
    }

    private final Status status;
    private final Protos.FrameworkID frameworkId;
    private final Instant timestamp;

    public InverseOfferStatus(Status status, Protos.FrameworkID frameworkId, Instant timestamp) {
        this.status = status;
        this.frameworkId = frameworkId;
        this.timestamp = timestamp;
    }

    public Status getStatus() {
        return status;
    }

    public Protos.FrameworkID getFrameworkId() {
        return frameworkId;
    }

    public Instant getTimestamp() {
        return timestamp;
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
        return String.format("InverseOfferStatus[%s, framework=%s, at=%s]", status, frameworkId.getValue(), timestamp);
    }
}
