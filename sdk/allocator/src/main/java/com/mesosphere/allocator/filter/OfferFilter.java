package com.mesosphere.allocator.filter;

import org.apache.mesos.Protos;

import java.time.Instant;

/**
 * A temporary exclusion installed on behalf of a framework, which stops applying at its expiry.
 */
public interface OfferFilter {

    Protos.FrameworkID getFrameworkId();

    Instant getExpiry();

    /**
     * Returns whether the filter no longer applies at the provided time.
     */
    default boolean isExpired(Instant now) {
        return !now.isBefore(getExpiry());
    }
}
