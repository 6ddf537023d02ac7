package com.mesosphere.allocator.filter;

import com.mesosphere.allocator.offer.LoggingUtils;
import com.mesosphere.allocator.offer.ResourceSet;
import org.apache.mesos.Protos;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the active offer filters and inverse offer filters of every framework.
 *
 * <p>Expired filters are dropped lazily when they are checked, and eagerly by {@link #expireOlderThan(Instant)} at
 * the start of each allocation pass.
 */
public class OfferFilterRegistry {

    private static final Logger LOGGER = LoggingUtils.getLogger(OfferFilterRegistry.class);

    private final Map<Protos.FrameworkID, List<RefusedOfferFilter>> offerFilters = new LinkedHashMap<>();
    private final Map<Protos.FrameworkID, List<InverseOfferFilter>> inverseOfferFilters = new LinkedHashMap<>();
    private final Clock clock;

    public OfferFilterRegistry(Clock clock) {
        this.clock = clock;
    }

    public RefusedOfferFilter addFilter(
            Protos.FrameworkID frameworkId,
            Optional<Protos.SlaveID> agentId,
            Optional<String> role,
            Optional<ResourceSet> resources,
            Instant expiry) {
        RefusedOfferFilter filter = new RefusedOfferFilter(frameworkId, agentId, role, resources, expiry);
        offerFilters.computeIfAbsent(frameworkId, id -> new ArrayList<>()).add(filter);
        LOGGER.debug("Added {}", filter);
        return filter;
    }

    /**
     * Returns whether offering the resources from the agent to the framework under the role is currently filtered.
     */
    public boolean isFiltered(
            Protos.FrameworkID frameworkId, Protos.SlaveID agentId, String role, ResourceSet resources) {
        List<RefusedOfferFilter> filters = offerFilters.get(frameworkId);
        if (filters == null) {
            return false;
        }
        Instant now = clock.instant();
        boolean filtered = false;
        for (Iterator<RefusedOfferFilter> iter = filters.iterator(); iter.hasNext(); ) {
            RefusedOfferFilter filter = iter.next();
            if (filter.isExpired(now)) {
                iter.remove();
            } else if (filter.filters(agentId, role, resources)) {
                filtered = true;
            }
        }
        if (filters.isEmpty()) {
            offerFilters.remove(frameworkId);
        }
        return filtered;
    }

    public InverseOfferFilter addInverseFilter(
            Protos.FrameworkID frameworkId, Protos.SlaveID agentId, Instant expiry) {
        InverseOfferFilter filter = new InverseOfferFilter(frameworkId, agentId, expiry);
        inverseOfferFilters.computeIfAbsent(frameworkId, id -> new ArrayList<>()).add(filter);
        LOGGER.debug("Added {}", filter);
        return filter;
    }

    public boolean isInverseFiltered(Protos.FrameworkID frameworkId, Protos.SlaveID agentId) {
        List<InverseOfferFilter> filters = inverseOfferFilters.get(frameworkId);
        if (filters == null) {
            return false;
        }
        Instant now = clock.instant();
        filters.removeIf(filter -> filter.isExpired(now));
        if (filters.isEmpty()) {
            inverseOfferFilters.remove(frameworkId);
            return false;
        }
        return filters.stream().anyMatch(filter -> filter.getAgentId().equals(agentId));
    }

    /**
     * Drops every filter which has expired at the provided time.
     *
     * @return the number of filters dropped
     */
    public int expireOlderThan(Instant now) {
        int expired = expire(offerFilters, now) + expire(inverseOfferFilters, now);
        if (expired > 0) {
            LOGGER.debug("Expired {} filter{}", expired, LoggingUtils.plural(expired));
        }
        return expired;
    }

    /**
     * Drops all filters of a framework, e.g. when it's removed.
     */
    public void removeFramework(Protos.FrameworkID frameworkId) {
        offerFilters.remove(frameworkId);
        inverseOfferFilters.remove(frameworkId);
    }

    /**
     * Drops all filters which are scoped to the provided agent.
     */
    public void removeAgent(Protos.SlaveID agentId) {
        for (List<RefusedOfferFilter> filters : offerFilters.values()) {
            filters.removeIf(filter -> filter.getAgentId().isPresent() && filter.getAgentId().get().equals(agentId));
        }
        offerFilters.values().removeIf(List::isEmpty);
        for (List<InverseOfferFilter> filters : inverseOfferFilters.values()) {
            filters.removeIf(filter -> filter.getAgentId().equals(agentId));
        }
        inverseOfferFilters.values().removeIf(List::isEmpty);
    }

    /**
     * Drops the framework's offer filters for the provided roles, along with those which apply to every role. With
     * no roles provided, all of the framework's offer filters are dropped.
     *
     * @return the number of filters dropped
     */
    public int clear(Protos.FrameworkID frameworkId, Collection<String> roles) {
        List<RefusedOfferFilter> filters = offerFilters.get(frameworkId);
        if (filters == null) {
            return 0;
        }
        int before = filters.size();
        if (roles.isEmpty()) {
            filters.clear();
        } else {
            filters.removeIf(filter -> !filter.getRole().isPresent() || roles.contains(filter.getRole().get()));
        }
        int cleared = before - filters.size();
        if (filters.isEmpty()) {
            offerFilters.remove(frameworkId);
        }
        return cleared;
    }

    /**
     * Returns the number of offer filters held, including any which have expired but were not dropped yet.
     */
    public int count() {
        int count = 0;
        for (List<RefusedOfferFilter> filters : offerFilters.values()) {
            count += filters.size();
        }
        return count;
    }

    public int inverseCount() {
        int count = 0;
        for (List<InverseOfferFilter> filters : inverseOfferFilters.values()) {
            count += filters.size();
        }
        return count;
    }

    private static <T extends OfferFilter> int expire(Map<Protos.FrameworkID, List<T>> filtersById, Instant now) {
        int expired = 0;
        for (Iterator<List<T>> iter = filtersById.values().iterator(); iter.hasNext(); ) {
            List<T> filters = iter.next();
            int before = filters.size();
            filters.removeIf(filter -> filter.isExpired(now));
            expired += before - filters.size();
            if (filters.isEmpty()) {
                iter.remove();
            }
        }
        return expired;
    }
}
