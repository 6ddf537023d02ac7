package com.mesosphere.allocator.allocation;

import org.apache.mesos.Protos;

import java.util.Map;

/**
 * Receives requests for a framework to release its resources on agents which are scheduled for maintenance.
 * Invoked on the allocator's worker thread.
 */
@FunctionalInterface
public interface InverseOfferCallback {

    void inverseOffer(Protos.FrameworkID frameworkId, Map<Protos.SlaveID, UnavailableResources> unavailableResources);
}
