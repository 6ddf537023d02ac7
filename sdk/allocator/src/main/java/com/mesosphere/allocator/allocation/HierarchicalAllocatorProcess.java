package com.mesosphere.allocator.allocation;

import com.codahale.metrics.Timer;
import com.mesosphere.allocator.config.AllocatorConfig;
import com.mesosphere.allocator.filter.OfferFilterRegistry;
import com.mesosphere.allocator.offer.Constants;
import com.mesosphere.allocator.offer.LoggingUtils;
import com.mesosphere.allocator.offer.ResourceQuantities;
import com.mesosphere.allocator.offer.ResourceSet;
import com.mesosphere.allocator.quota.Quota;
import com.mesosphere.allocator.quota.QuotaLedger;
import com.mesosphere.allocator.roles.RoleRegistry;
import com.mesosphere.allocator.sorter.Sorter;
import com.mesosphere.allocator.sorter.SorterFactory;
import com.mesosphere.allocator.state.Agent;
import com.mesosphere.allocator.state.ClusterStateTracker;
import com.mesosphere.allocator.state.Framework;
import com.mesosphere.allocator.state.InverseOfferStatus;
import org.apache.mesos.Protos;
import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * The allocation engine: owns the cluster state, the role registry, the quota ledger, the offer filters and the
 * sorters, applies every allocator operation to them, and runs allocation passes.
 *
 * <p>Not thread-safe. All calls are expected from a single thread, see {@link HierarchicalAllocator} which feeds this
 * class from its worker. Operations which reference an unknown agent or framework, or which would break an invariant,
 * throw an {@link AllocatorException} and leave the state unchanged.
 *
 * <p>Each pass first satisfies quota guarantees, and then distributes the remaining free capacity by weighted DRF.
 * Offered resources are recorded as allocated the moment they are offered.
 */
public class HierarchicalAllocatorProcess {

    private static final Logger LOGGER = LoggingUtils.getLogger(HierarchicalAllocatorProcess.class);

    private final AllocatorConfig config;
    private final OfferCallback offerCallback;
    private final InverseOfferCallback inverseOfferCallback;
    private final Runnable allocationRequester;

    private final ClusterStateTracker tracker = new ClusterStateTracker();
    private final RoleRegistry roles;
    private final QuotaLedger quotas;
    private final OfferFilterRegistry filters;
    private final Sorter roleSorter;
    private final Map<String, Sorter> frameworkSorters = new LinkedHashMap<>();

    private final Set<Protos.SlaveID> candidateAgents = new LinkedHashSet<>();
    private boolean allocationPending = false;
    private boolean paused = false;
    private Optional<Set<String>> whitelist = Optional.empty();

    /**
     * @param allocationRequester invoked when a pass should be scheduled, at most once until {@link #allocate()} runs
     */
    public HierarchicalAllocatorProcess(
            AllocatorConfig config,
            OfferCallback offerCallback,
            InverseOfferCallback inverseOfferCallback,
            Runnable allocationRequester) {
        this.config = config;
        this.offerCallback = offerCallback;
        this.inverseOfferCallback = inverseOfferCallback;
        this.allocationRequester = allocationRequester;
        this.roles = new RoleRegistry(config.getDefaultRoleWeight());
        this.quotas = new QuotaLedger(roles);
        this.filters = new OfferFilterRegistry(config.getClock());
        this.roleSorter = SorterFactory.create(config.getRoleSorter(), "roles", true, config);
        LOGGER.info("Initialized allocator: {}", config);
    }

    // Agents

    public void addSlave(
            Protos.SlaveID agentId,
            Protos.SlaveInfo agentInfo,
            Collection<Protos.SlaveInfo.Capability.Type> capabilities,
            Optional<Protos.Unavailability> unavailability,
            ResourceSet total,
            Map<Protos.FrameworkID, ResourceSet> used) throws AllocatorException {
        tracker.addAgent(agentId, agentInfo, capabilities, unavailability, total, used);
        quotas.setAgentReservations(agentId, total.reserved());
        ResourceQuantities quantities = total.quantities();
        roleSorter.addSlave(agentId, quantities);
        for (Sorter sorter : frameworkSorters.values()) {
            sorter.addSlave(agentId, quantities);
        }
        for (Map.Entry<Protos.FrameworkID, ResourceSet> entry : used.entrySet()) {
            trackAllocated(entry.getKey(), agentId, entry.getValue());
        }
        requestAllocation(Collections.singleton(agentId));
    }

    public void removeSlave(Protos.SlaveID agentId) throws AllocatorException {
        Agent agent = tracker.removeAgent(agentId);
        for (Protos.FrameworkID frameworkId : agent.getFrameworks()) {
            untrackAllocated(frameworkId, agentId, agent.getAllocated(frameworkId));
        }
        roleSorter.removeSlave(agentId);
        for (Sorter sorter : frameworkSorters.values()) {
            sorter.removeSlave(agentId);
        }
        quotas.removeAgent(agentId);
        filters.removeAgent(agentId);
        candidateAgents.remove(agentId);
    }

    public void updateSlave(
            Protos.SlaveID agentId,
            Protos.SlaveInfo agentInfo,
            Optional<ResourceSet> total,
            Optional<Collection<Protos.SlaveInfo.Capability.Type>> capabilities) throws AllocatorException {
        boolean grew = tracker.updateAgent(agentId, Optional.of(agentInfo), capabilities, total);
        if (total.isPresent()) {
            quotas.setAgentReservations(agentId, total.get().reserved());
            ResourceQuantities quantities = total.get().quantities();
            roleSorter.addSlave(agentId, quantities);
            for (Sorter sorter : frameworkSorters.values()) {
                sorter.addSlave(agentId, quantities);
            }
        }
        if (grew || capabilities.isPresent()) {
            requestAllocation(Collections.singleton(agentId));
        }
    }

    public void activateSlave(Protos.SlaveID agentId) throws AllocatorException {
        tracker.activateAgent(agentId);
        requestAllocation(Collections.singleton(agentId));
    }

    public void deactivateSlave(Protos.SlaveID agentId) throws AllocatorException {
        tracker.deactivateAgent(agentId);
    }

    public void updateWhitelist(Optional<Set<String>> hostnames) {
        whitelist = hostnames.isPresent()
                ? Optional.<Set<String>>of(new HashSet<>(hostnames.get()))
                : Optional.empty();
        if (whitelist.isPresent()) {
            LOGGER.info("Updated agent whitelist: {}", whitelist.get());
            for (Agent agent : tracker.getAgents()) {
                if (!whitelist.get().contains(agent.getHostname())) {
                    LOGGER.warn("Agent {} ({}) is not in the whitelist",
                            agent.getId().getValue(), agent.getHostname());
                }
            }
        } else {
            LOGGER.info("Advertising offers for all agents");
        }
        requestAllocationForAll();
    }

    // Frameworks

    public void addFramework(
            Protos.FrameworkID frameworkId,
            Protos.FrameworkInfo frameworkInfo,
            boolean active,
            Set<String> suppressedRoles) throws AllocatorException {
        Framework framework = tracker.addFramework(frameworkId, frameworkInfo, suppressedRoles, active);
        for (String role : framework.getRoles()) {
            trackFrameworkUnderRole(frameworkId, role);
        }
        // Resources which agents reported as used before the framework was known are counted in the role sorter
        // already, only the framework sorters are missing them.
        for (Protos.SlaveID agentId : framework.getAgents()) {
            Agent agent = tracker.getAgent(agentId).get();
            for (Map.Entry<String, ResourceSet> entry : agent.getAllocated(frameworkId).allocations().entrySet()) {
                Sorter sorter = frameworkSorterFor(entry.getKey());
                if (!sorter.contains(frameworkId.getValue())) {
                    sorter.add(frameworkId.getValue());
                }
                sorter.allocated(frameworkId.getValue(), agentId, entry.getValue());
            }
        }
        syncFrameworkActivation(framework);
        requestAllocationForAll();
    }

    public void removeFramework(Protos.FrameworkID frameworkId) throws AllocatorException {
        Framework framework = getFrameworkOrThrow(frameworkId);
        Map<Protos.SlaveID, ResourceSet> released = tracker.removeFramework(frameworkId);
        for (Map.Entry<Protos.SlaveID, ResourceSet> entry : released.entrySet()) {
            untrackAllocated(frameworkId, entry.getKey(), entry.getValue());
        }
        for (String role : framework.getRoles()) {
            untrackFrameworkUnderRole(frameworkId, role);
        }
        filters.removeFramework(frameworkId);
    }

    public void activateFramework(Protos.FrameworkID frameworkId) throws AllocatorException {
        tracker.activateFramework(frameworkId);
        syncFrameworkActivation(getFrameworkOrThrow(frameworkId));
        requestAllocationForAll();
    }

    /**
     * Stops offers to the framework. Its filters are dropped, as they would be stale by the time it's reactivated.
     */
    public void deactivateFramework(Protos.FrameworkID frameworkId) throws AllocatorException {
        tracker.deactivateFramework(frameworkId);
        syncFrameworkActivation(getFrameworkOrThrow(frameworkId));
        filters.removeFramework(frameworkId);
    }

    public void updateFramework(
            Protos.FrameworkID frameworkId,
            Protos.FrameworkInfo frameworkInfo,
            Set<String> suppressedRoles) throws AllocatorException {
        Set<String> previouslySuppressed = getFrameworkOrThrow(frameworkId).getSuppressedRoles();
        Set<String> previousRoles = tracker.updateFramework(frameworkId, frameworkInfo, suppressedRoles);
        Framework framework = getFrameworkOrThrow(frameworkId);

        boolean offerable = false;
        for (String role : framework.getRoles()) {
            if (!previousRoles.contains(role)) {
                trackFrameworkUnderRole(frameworkId, role);
                offerable = true;
            } else if (previouslySuppressed.contains(role) && !framework.isSuppressed(role)) {
                offerable = true;
            }
        }
        for (String role : previousRoles) {
            if (!framework.getRoles().contains(role)) {
                untrackFrameworkUnderRole(frameworkId, role);
            }
        }
        syncFrameworkActivation(framework);
        if (offerable) {
            requestAllocationForAll();
        }
    }

    public void requestResources(Protos.FrameworkID frameworkId, List<Protos.Request> requests) {
        LOGGER.info("Received {} resource request{} from framework {}",
                requests.size(), LoggingUtils.plural(requests.size()), frameworkId.getValue());
    }

    // Resources

    public void transformAllocation(
            Protos.FrameworkID frameworkId,
            Protos.SlaveID agentId,
            List<Protos.Offer.Operation> operations) throws AllocatorException {
        Agent agent = getAgentOrThrow(agentId);
        ResourceSet totalBefore = agent.getTotal();
        Map<String, ResourceSet> before = agent.getAllocated(frameworkId).allocations();

        tracker.transform(frameworkId, agentId, operations);

        Map<String, ResourceSet> after = agent.getAllocated(frameworkId).allocations();
        Set<String> changedRoles = new LinkedHashSet<>(before.keySet());
        changedRoles.addAll(after.keySet());
        for (String role : changedRoles) {
            ResourceSet oldAllocation = before.getOrDefault(role, ResourceSet.empty());
            ResourceSet newAllocation = after.getOrDefault(role, ResourceSet.empty());
            if (oldAllocation.equals(newAllocation) && oldAllocation.keys().equals(newAllocation.keys())) {
                continue;
            }
            trackRole(role);
            roleSorter.update(role, agentId, oldAllocation, newAllocation);
            Sorter sorter = frameworkSorterFor(role);
            if (!sorter.contains(frameworkId.getValue())) {
                sorter.add(frameworkId.getValue());
            }
            sorter.update(frameworkId.getValue(), agentId, oldAllocation, newAllocation);
        }
        if (!totalBefore.keys().equals(agent.getTotal().keys())) {
            quotas.setAgentReservations(agentId, agent.getTotal().reserved());
        }
    }

    public void recoverResources(
            Protos.FrameworkID frameworkId,
            Protos.SlaveID agentId,
            ResourceSet resources,
            Optional<Protos.Filters> refuseFilters) throws AllocatorException {
        if (resources.isEmpty()) {
            return;
        }
        ResourceSet recovered = tracker.recoverResources(frameworkId, agentId, resources);
        untrackAllocated(frameworkId, agentId, recovered);

        Duration refusal = getRefuseDuration(refuseFilters);
        if (!refusal.isZero() && tracker.getFramework(frameworkId).isPresent()) {
            Instant expiry = config.getClock().instant().plus(refusal);
            for (Map.Entry<String, ResourceSet> entry : recovered.allocations().entrySet()) {
                filters.addFilter(frameworkId, Optional.of(agentId), Optional.of(entry.getKey()),
                        Optional.of(entry.getValue()), expiry);
            }
            LOGGER.debug("Framework {} refused {} on agent {} for {}",
                    frameworkId.getValue(), recovered, agentId.getValue(), refusal);
        }
        requestAllocation(Collections.singleton(agentId));
    }

    public void suppressOffers(Protos.FrameworkID frameworkId, Set<String> suppressRoles) throws AllocatorException {
        Set<String> suppressed = tracker.suppressRoles(frameworkId, suppressRoles);
        syncFrameworkActivation(getFrameworkOrThrow(frameworkId));
        LOGGER.info("Suppressed offers for framework {} in roles {}", frameworkId.getValue(), suppressed);
    }

    public void reviveOffers(Protos.FrameworkID frameworkId, Set<String> reviveRoles) throws AllocatorException {
        Set<String> revived = tracker.reviveRoles(frameworkId, reviveRoles);
        int cleared = filters.clear(frameworkId, reviveRoles);
        syncFrameworkActivation(getFrameworkOrThrow(frameworkId));
        LOGGER.info("Revived offers for framework {} in roles {}, dropped {} filter{}",
                frameworkId.getValue(), revived, cleared, LoggingUtils.plural(cleared));
        requestAllocationForAll();
    }

    // Roles

    public void setQuota(String role, Quota quota) throws AllocatorException {
        quotas.setQuota(role, quota, tracker.getClusterTotal());
        quotas.updateConsumption(role, tracker.getConsumedQuota(role));
        requestAllocationForAll();
    }

    public void removeQuota(String role) {
        quotas.removeQuota(role);
        requestAllocationForAll();
    }

    public void updateWeights(List<Protos.WeightInfo> weightInfos) throws AllocatorException {
        for (Protos.WeightInfo weightInfo : weightInfos) {
            RoleRegistry.validateName(weightInfo.getRole());
            if (!(weightInfo.getWeight() > 0)) {
                throw AllocatorException.validation("Weight for role '%s' must be positive: %s",
                        weightInfo.getRole(), weightInfo.getWeight());
            }
        }
        for (Protos.WeightInfo weightInfo : weightInfos) {
            roles.setWeight(weightInfo.getRole(), Optional.of(weightInfo.getWeight()));
            roleSorter.updateWeight(weightInfo.getRole(), weightInfo.getWeight());
            LOGGER.info("Updated weight of role '{}' to {}", weightInfo.getRole(), weightInfo.getWeight());
        }
        requestAllocationForAll();
    }

    public void addReservation(Protos.SlaveID agentId, String role, ResourceSet resources)
            throws AllocatorException {
        tracker.addReservation(agentId, role, resources);
        quotas.setAgentReservations(agentId, getAgentOrThrow(agentId).getTotal().reserved());
        requestAllocation(Collections.singleton(agentId));
    }

    // Maintenance

    public void updateUnavailability(Protos.SlaveID agentId, Optional<Protos.Unavailability> unavailability)
            throws AllocatorException {
        tracker.updateUnavailability(agentId, unavailability);
        requestAllocation(Collections.singleton(agentId));
    }

    public void updateInverseOffer(
            Protos.SlaveID agentId,
            Protos.FrameworkID frameworkId,
            Optional<UnavailableResources> unavailableResources,
            Optional<InverseOfferStatus> status,
            Optional<Protos.Filters> refuseFilters) throws AllocatorException {
        tracker.updateInverseOffer(agentId, frameworkId, status);
        if (refuseFilters.isPresent()) {
            Duration refusal = getRefuseDuration(refuseFilters);
            if (!refusal.isZero()) {
                filters.addInverseFilter(frameworkId, agentId, config.getClock().instant().plus(refusal));
            }
        }
    }

    public Map<Protos.SlaveID, Map<Protos.FrameworkID, InverseOfferStatus>> getInverseOfferStatuses() {
        return tracker.getInverseOfferStatuses();
    }

    // Lifecycle

    public void pause() {
        if (!paused) {
            LOGGER.info("Allocation paused");
            paused = true;
        }
    }

    public void resume() {
        if (paused) {
            LOGGER.info("Allocation resumed");
            paused = false;
        }
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isAllocationPending() {
        return allocationPending;
    }

    /**
     * Adds every agent to the candidates of the next pass, as the periodic trigger does.
     */
    public void requestAllocationForAll() {
        List<Protos.SlaveID> agentIds = new ArrayList<>();
        for (Agent agent : tracker.getAgents()) {
            agentIds.add(agent.getId());
        }
        requestAllocation(agentIds);
    }

    /**
     * Runs the pending pass over the candidate agents collected since the previous pass. While paused, the pass is
     * skipped and the candidates are kept for the next one.
     */
    public void allocate() {
        allocationPending = false;
        if (paused) {
            Metrics.incrementSkippedPaused();
            LOGGER.debug("Skipping allocation: allocator is paused");
            return;
        }
        Set<Protos.SlaveID> agentIds = new LinkedHashSet<>(candidateAgents);
        candidateAgents.clear();
        allocate(agentIds);
    }

    /**
     * Exposes the bookkeeping for invariant checks.
     */
    public ClusterStateTracker getTracker() {
        return tracker;
    }

    public RoleRegistry getRoles() {
        return roles;
    }

    public QuotaLedger getQuotas() {
        return quotas;
    }

    public OfferFilterRegistry getFilters() {
        return filters;
    }

    public Sorter getRoleSorter() {
        return roleSorter;
    }

    public Optional<Sorter> getFrameworkSorter(String role) {
        return Optional.ofNullable(frameworkSorters.get(role));
    }

    // Allocation pass

    private void allocate(Set<Protos.SlaveID> agentIds) {
        Timer.Context timer = Metrics.getAllocationRunTimer();
        try {
            filters.expireOlderThan(config.getClock().instant());
            refreshDirtyRoles();

            List<Agent> agents = new ArrayList<>();
            for (Agent agent : tracker.getAgents()) {
                if (agentIds.contains(agent.getId()) && agent.isActivated() && isWhitelisted(agent)) {
                    agents.add(agent);
                }
            }

            Pass pass = new Pass();
            for (Agent agent : agents) {
                allocateQuota(pass, agent);
            }
            for (Agent agent : agents) {
                allocateFreePool(pass, agent);
            }
            deliver(pass);
            sendInverseOffers(agents);
            Metrics.incrementAllocationRuns();
        } finally {
            timer.stop();
        }
    }

    /**
     * The offers computed by one pass, along with the unreserved free capacity remaining in the cluster.
     */
    private class Pass {
        private final Map<Protos.FrameworkID, Map<String, Map<Protos.SlaveID, ResourceSet>>> offers =
                new LinkedHashMap<>();
        private ResourceQuantities unallocatedUnreserved = ResourceQuantities.empty();
        private int count = 0;

        private Pass() {
            for (Agent agent : tracker.getAgents()) {
                unallocatedUnreserved = unallocatedUnreserved.plus(agent.getAvailable().unreserved().quantities());
            }
        }
    }

    /**
     * Offers each role with an unsatisfied quota guarantee up to its unsatisfied amount of the agent's unreserved
     * capacity, along with the capacity reserved for it.
     */
    private void allocateQuota(Pass pass, Agent agent) {
        for (String role : roleSorter.sort()) {
            Optional<String> quotaRole = getQuotaRole(role);
            if (!quotaRole.isPresent() || quotas.getUnsatisfiedGuarantee(quotaRole.get()).isEmpty()) {
                continue;
            }
            for (String frameworkName : frameworkSorterFor(role).sort()) {
                ResourceQuantities unsatisfied = quotas.getUnsatisfiedGuarantee(quotaRole.get());
                if (unsatisfied.isEmpty()) {
                    break;
                }
                Optional<Framework> framework = tracker.getFramework(toFrameworkId(frameworkName));
                if (!framework.isPresent() || !isEligible(framework.get(), role, agent)) {
                    continue;
                }
                ResourceSet available = agent.getAvailable();
                ResourceSet resources = available.unreserved().shrinkTo(unsatisfied)
                        .plus(available.reserved().allocatableTo(role));
                tryOffer(pass, framework.get(), role, agent, resources);
            }
        }
    }

    /**
     * Offers the agent's remaining capacity by role and framework order. Unreserved resources are held back so that
     * other roles can still reach their quota guarantees, and everything is capped by the role's quota limits.
     */
    private void allocateFreePool(Pass pass, Agent agent) {
        for (String role : roleSorter.sort()) {
            for (String frameworkName : frameworkSorterFor(role).sort()) {
                Optional<Framework> framework = tracker.getFramework(toFrameworkId(frameworkName));
                if (!framework.isPresent() || !isEligible(framework.get(), role, agent)) {
                    continue;
                }
                ResourceSet available = agent.getAvailable().allocatableTo(role);
                ResourceSet unreserved = available.unreserved();
                ResourceQuantities requiredHeadroom = quotas.getRequiredHeadroom(Optional.of(role));
                if (!requiredHeadroom.isEmpty()) {
                    Map<String, Double> spare = new TreeMap<>();
                    for (String name : requiredHeadroom.names()) {
                        double left = pass.unallocatedUnreserved.get(name) - requiredHeadroom.get(name);
                        spare.put(name, Math.max(0, left));
                    }
                    unreserved = unreserved.cap(spare);
                }
                ResourceSet resources = quotas.applyLimit(role, available.reserved().plus(unreserved));
                tryOffer(pass, framework.get(), role, agent, resources);
            }
        }
    }

    private void tryOffer(Pass pass, Framework framework, String role, Agent agent, ResourceSet resources) {
        if (!isAllocatable(resources)) {
            return;
        }
        if (filters.isFiltered(framework.getId(), agent.getId(), role, resources)) {
            LOGGER.debug("Not offering {} on agent {} to framework {} in role '{}': filtered",
                    resources, agent.getId().getValue(), framework.getId().getValue(), role);
            return;
        }

        ResourceSet tagged = resources.allocatedTo(role);
        try {
            tracker.applyOffer(framework.getId(), agent.getId(), tagged);
        } catch (AllocatorException e) {
            throw new IllegalStateException(String.format(
                    "Computed an invalid offer of %s on agent %s", tagged, agent.getId().getValue()), e);
        }
        trackAllocated(framework.getId(), agent.getId(), tagged);
        recordConsumption(role, resources);
        pass.unallocatedUnreserved =
                pass.unallocatedUnreserved.minusClampedAtZero(resources.unreserved().quantities());
        pass.offers.computeIfAbsent(framework.getId(), id -> new LinkedHashMap<>())
                .computeIfAbsent(role, r -> new LinkedHashMap<>())
                .merge(agent.getId(), tagged, ResourceSet::plus);
        ++pass.count;
        LOGGER.debug("Offering {} on agent {} to framework {} in role '{}'",
                resources, agent.getId().getValue(), framework.getId().getValue(), role);
    }

    private void deliver(Pass pass) {
        if (pass.count > 0) {
            LOGGER.info("Allocated {} resource set{} to {} framework{}",
                    pass.count, LoggingUtils.plural(pass.count),
                    pass.offers.size(), LoggingUtils.plural(pass.offers.size()));
        }
        Metrics.incrementOffers(pass.count);
        for (Map.Entry<Protos.FrameworkID, Map<String, Map<Protos.SlaveID, ResourceSet>>> entry
                : pass.offers.entrySet()) {
            try {
                offerCallback.offer(entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                Metrics.incrementCallbackFailures();
                LOGGER.warn(String.format("Failed to deliver offer to framework %s, recovering its resources",
                        entry.getKey().getValue()), e);
                recoverOffer(entry.getKey(), entry.getValue());
            }
        }
    }

    private void recoverOffer(Protos.FrameworkID frameworkId, Map<String, Map<Protos.SlaveID, ResourceSet>> offer) {
        for (Map<Protos.SlaveID, ResourceSet> byAgent : offer.values()) {
            for (Map.Entry<Protos.SlaveID, ResourceSet> entry : byAgent.entrySet()) {
                try {
                    ResourceSet recovered = tracker.recoverResources(frameworkId, entry.getKey(), entry.getValue());
                    untrackAllocated(frameworkId, entry.getKey(), recovered);
                } catch (AllocatorException e) {
                    LOGGER.warn("Unable to recover undelivered offer of {} on agent {}: {}",
                            entry.getValue(), entry.getKey().getValue(), e.getMessage());
                }
            }
        }
    }

    /**
     * Asks frameworks holding resources on agents which are scheduled for maintenance to release them. A framework
     * is asked once per maintenance window, unless it responded or filtered the agent.
     */
    private void sendInverseOffers(List<Agent> agents) {
        Map<Protos.FrameworkID, Map<Protos.SlaveID, UnavailableResources>> inverseOffers = new LinkedHashMap<>();
        for (Agent agent : agents) {
            if (!agent.getUnavailability().isPresent()) {
                continue;
            }
            for (Protos.FrameworkID frameworkId : agent.getFrameworks()) {
                if (!tracker.getFramework(frameworkId).isPresent()
                        || agent.getOutstandingInverseOffers().contains(frameworkId)
                        || filters.isInverseFiltered(frameworkId, agent.getId())) {
                    continue;
                }
                try {
                    tracker.addInverseOffer(agent.getId(), frameworkId);
                } catch (AllocatorException e) {
                    throw new IllegalStateException("Agent disappeared during allocation", e);
                }
                inverseOffers.computeIfAbsent(frameworkId, id -> new LinkedHashMap<>()).put(
                        agent.getId(),
                        new UnavailableResources(
                                agent.getAllocated(frameworkId).unallocated(), agent.getUnavailability().get()));
            }
        }
        for (Map.Entry<Protos.FrameworkID, Map<Protos.SlaveID, UnavailableResources>> entry
                : inverseOffers.entrySet()) {
            try {
                inverseOfferCallback.inverseOffer(entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                LOGGER.warn(String.format("Failed to deliver inverse offer to framework %s",
                        entry.getKey().getValue()), e);
            }
        }
    }

    // Eligibility and thresholds

    private boolean isEligible(Framework framework, String role, Agent agent) {
        if (!framework.isActive() || framework.isSuppressed(role) || !framework.getRoles().contains(role)) {
            return false;
        }
        if (framework.hasCapability(Protos.FrameworkInfo.Capability.Type.MULTI_ROLE)
                && !agent.hasCapability(Protos.SlaveInfo.Capability.Type.MULTI_ROLE)) {
            return false;
        }
        if (role.contains(Constants.ROLE_PATH_DELIM)
                && !agent.hasCapability(Protos.SlaveInfo.Capability.Type.HIERARCHICAL_ROLE)) {
            return false;
        }
        if (config.isFilterGpuResources()
                && agent.hasGpus()
                && !framework.hasCapability(Protos.FrameworkInfo.Capability.Type.GPU_RESOURCES)) {
            return false;
        }
        return true;
    }

    /**
     * Returns whether the resources are worth offering: they must hold at least one of the minimum allocatable
     * alternatives.
     */
    boolean isAllocatable(ResourceSet resources) {
        if (resources.isEmpty()) {
            return false;
        }
        if (config.getMinAllocatableResources().isEmpty()) {
            return true;
        }
        ResourceQuantities quantities = resources.quantities();
        for (ResourceQuantities alternative : config.getMinAllocatableResources()) {
            if (quantities.contains(alternative)) {
                return true;
            }
        }
        return false;
    }

    private boolean isWhitelisted(Agent agent) {
        return !whitelist.isPresent() || whitelist.get().contains(agent.getHostname());
    }

    // Quota

    /**
     * Returns the nearest role, starting with the role itself, which has a quota.
     */
    private Optional<String> getQuotaRole(String role) {
        if (quotas.hasQuota(role)) {
            return Optional.of(role);
        }
        for (String ancestor : RoleRegistry.ancestors(role)) {
            if (quotas.hasQuota(ancestor)) {
                return Optional.of(ancestor);
            }
        }
        return Optional.empty();
    }

    /**
     * Recomputes the consumption of every quota role whose subtree was touched since the previous pass.
     */
    private void refreshDirtyRoles() {
        Set<String> dirty = tracker.drainDirtyRoles();
        for (String quotaRole : quotas.getQuotas().keySet()) {
            for (String role : dirty) {
                if (ResourceSet.isSameOrAncestor(quotaRole, role)) {
                    quotas.updateConsumption(quotaRole, tracker.getConsumedQuota(quotaRole));
                    break;
                }
            }
        }
    }

    /**
     * Adds newly offered resources to the consumption of the quota roles they count against. Reservations of those
     * roles already count as consumed.
     */
    private void recordConsumption(String role, ResourceSet resources) {
        for (String quotaRole : quotas.getQuotas().keySet()) {
            if (ResourceSet.isSameOrAncestor(quotaRole, role)) {
                ResourceQuantities added = resources
                        .filter(key -> !key.isReserved()
                                || !ResourceSet.isSameOrAncestor(quotaRole, key.getReservationRole()))
                        .quantities();
                quotas.updateConsumption(quotaRole, quotas.getConsumption(quotaRole).plus(added));
            }
        }
    }

    // Sorter bookkeeping

    private void trackRole(String role) {
        if (!roleSorter.contains(role)) {
            roleSorter.add(role);
            roleSorter.updateWeight(role, roles.getWeight(role));
            for (String ancestor : RoleRegistry.ancestors(role)) {
                roleSorter.updateWeight(ancestor, roles.getWeight(ancestor));
            }
        }
        if (!frameworkSorters.containsKey(role)) {
            Sorter sorter = SorterFactory.create(config.getFrameworkSorter(), role, false, config);
            for (Agent agent : tracker.getAgents()) {
                sorter.addSlave(agent.getId(), agent.getTotal().quantities());
            }
            frameworkSorters.put(role, sorter);
        }
    }

    private void untrackRoleIfUnused(String role) {
        Sorter sorter = frameworkSorters.get(role);
        if (sorter != null && sorter.count() > 0) {
            return;
        }
        if (roleSorter.contains(role) && !roleSorter.allocation(role).isEmpty()) {
            return;
        }
        frameworkSorters.remove(role);
        if (roleSorter.contains(role)) {
            roleSorter.remove(role);
        }
    }

    private Sorter frameworkSorterFor(String role) {
        trackRole(role);
        return frameworkSorters.get(role);
    }

    private void trackFrameworkUnderRole(Protos.FrameworkID frameworkId, String role) {
        Sorter sorter = frameworkSorterFor(role);
        if (!sorter.contains(frameworkId.getValue())) {
            sorter.add(frameworkId.getValue());
        }
        roles.addFramework(role, frameworkId);
    }

    /**
     * Stops tracking the framework under a role it no longer subscribes to. The framework stays in the role's sorter
     * while it still holds resources allocated to the role.
     */
    private void untrackFrameworkUnderRole(Protos.FrameworkID frameworkId, String role) {
        roles.removeFramework(role, frameworkId);
        Sorter sorter = frameworkSorters.get(role);
        if (sorter != null && sorter.contains(frameworkId.getValue())
                && sorter.allocation(frameworkId.getValue()).isEmpty()) {
            sorter.remove(frameworkId.getValue());
        }
        untrackRoleIfUnused(role);
    }

    private void trackAllocated(Protos.FrameworkID frameworkId, Protos.SlaveID agentId, ResourceSet resources) {
        boolean known = tracker.getFramework(frameworkId).isPresent();
        for (Map.Entry<String, ResourceSet> entry : resources.allocations().entrySet()) {
            String role = entry.getKey();
            trackRole(role);
            roleSorter.allocated(role, agentId, entry.getValue());
            if (known) {
                Sorter sorter = frameworkSorters.get(role);
                if (!sorter.contains(frameworkId.getValue())) {
                    sorter.add(frameworkId.getValue());
                }
                sorter.allocated(frameworkId.getValue(), agentId, entry.getValue());
            }
        }
    }

    private void untrackAllocated(Protos.FrameworkID frameworkId, Protos.SlaveID agentId, ResourceSet resources) {
        Optional<Framework> framework = tracker.getFramework(frameworkId);
        for (Map.Entry<String, ResourceSet> entry : resources.allocations().entrySet()) {
            String role = entry.getKey();
            if (roleSorter.contains(role)) {
                roleSorter.unallocated(role, agentId, entry.getValue());
            }
            Sorter sorter = frameworkSorters.get(role);
            if (sorter != null && sorter.contains(frameworkId.getValue())) {
                sorter.unallocated(frameworkId.getValue(), agentId, entry.getValue());
                boolean subscribed = framework.isPresent() && framework.get().getRoles().contains(role);
                if (!subscribed && sorter.allocation(frameworkId.getValue()).isEmpty()) {
                    sorter.remove(frameworkId.getValue());
                }
            }
            untrackRoleIfUnused(role);
        }
    }

    /**
     * Activates the framework in the sorters of the roles it may currently receive offers for, and deactivates it in
     * the others.
     */
    private void syncFrameworkActivation(Framework framework) {
        for (Map.Entry<String, Sorter> entry : frameworkSorters.entrySet()) {
            String name = framework.getId().getValue();
            if (!entry.getValue().contains(name)) {
                continue;
            }
            String role = entry.getKey();
            if (framework.isActive() && framework.getRoles().contains(role) && !framework.isSuppressed(role)) {
                entry.getValue().activate(name);
            } else {
                entry.getValue().deactivate(name);
            }
        }
    }

    // Helpers

    private void requestAllocation(Collection<Protos.SlaveID> agentIds) {
        candidateAgents.addAll(agentIds);
        if (!allocationPending) {
            allocationPending = true;
            try {
                allocationRequester.run();
            } catch (RejectedExecutionException e) {
                // No pass runs once the allocator is stopped.
                allocationPending = false;
                LOGGER.info("Allocation pass not scheduled: {}", e.getMessage());
            }
        }
    }

    private Agent getAgentOrThrow(Protos.SlaveID agentId) throws AllocatorException {
        Optional<Agent> agent = tracker.getAgent(agentId);
        if (!agent.isPresent()) {
            throw AllocatorException.notFound("Agent %s is not tracked", agentId.getValue());
        }
        return agent.get();
    }

    private Framework getFrameworkOrThrow(Protos.FrameworkID frameworkId) throws AllocatorException {
        Optional<Framework> framework = tracker.getFramework(frameworkId);
        if (!framework.isPresent()) {
            throw AllocatorException.notFound("Framework %s is not tracked", frameworkId.getValue());
        }
        return framework.get();
    }

    private static Protos.FrameworkID toFrameworkId(String name) {
        return Protos.FrameworkID.newBuilder().setValue(name).build();
    }

    /**
     * Returns how long declined resources are filtered. Without filters the default refusal applies. Negative
     * durations fall back to the default, and durations beyond a year are capped.
     */
    private static Duration getRefuseDuration(Optional<Protos.Filters> refuseFilters) {
        if (!refuseFilters.isPresent() || !refuseFilters.get().hasRefuseSeconds()) {
            return Constants.DEFAULT_REFUSE_DURATION;
        }
        double seconds = refuseFilters.get().getRefuseSeconds();
        if (Double.isNaN(seconds) || seconds < 0) {
            LOGGER.warn("Using the default refuse duration of {} instead of invalid {}s",
                    Constants.DEFAULT_REFUSE_DURATION, seconds);
            return Constants.DEFAULT_REFUSE_DURATION;
        }
        if (seconds == 0) {
            return Duration.ZERO;
        }
        if (seconds > Constants.MAX_REFUSE_DURATION.getSeconds()) {
            return Constants.MAX_REFUSE_DURATION;
        }
        // Positive refusals shorter than a nanosecond still install a filter.
        return Duration.ofNanos(Math.max(1, (long) (seconds * TimeUnit.SECONDS.toNanos(1))));
    }
}
