package com.mesosphere.allocator.allocation;

import com.mesosphere.allocator.offer.ResourceSet;
import org.apache.mesos.Protos;

import java.util.Map;

/**
 * Receives the offers computed by an allocation pass. Invoked on the allocator's worker thread, at most once per
 * framework per pass, and never with an empty mapping. Implementations should hand the offers off and return
 * promptly.
 */
@FunctionalInterface
public interface OfferCallback {

    /**
     * @param resources the offered resources by role and agent, tagged with the role they are offered to
     */
    void offer(Protos.FrameworkID frameworkId, Map<String, Map<Protos.SlaveID, ResourceSet>> resources);
}
