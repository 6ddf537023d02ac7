package com.mesosphere.allocator.state;

import com.mesosphere.allocator.allocation.AllocatorException;
import com.mesosphere.allocator.offer.LoggingUtils;
import com.mesosphere.allocator.offer.ResourceKey;
import com.mesosphere.allocator.offer.ResourceQuantities;
import com.mesosphere.allocator.offer.ResourceSet;
import com.mesosphere.allocator.roles.RoleRegistry;
import org.apache.mesos.Protos;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Authoritative bookkeeping of agents, frameworks, and who holds which resources where.
 *
 * <p>Every mutator validates its input against the current state before changing anything, and throws an
 * {@link AllocatorException} if the change would break an invariant or references something unknown. A failed call
 * leaves the state untouched. Successful mutations mark the roles they touched as dirty, see
 * {@link #drainDirtyRoles()}.
 *
 * <p>Not thread-safe: all access is expected from the allocator's worker thread.
 */
public class ClusterStateTracker {

    private static final Logger LOGGER = LoggingUtils.getLogger(ClusterStateTracker.class);

    private final Map<Protos.SlaveID, Agent> agents = new LinkedHashMap<>();
    private final Map<Protos.FrameworkID, Framework> frameworks = new LinkedHashMap<>();
    private final Set<String> dirtyRoles = new LinkedHashSet<>();

    // Agents

    /**
     * Starts tracking an agent.
     *
     * @param total the agent's total capacity including reservations, without allocation tags
     * @param used resources already in use on the agent by framework, each tagged with its allocation role. The
     *     frameworks need not be registered yet
     * @throws AllocatorException {@code DUPLICATE} if the agent is already tracked, {@code VALIDATION} if the used
     *     resources are untagged or exceed the total
     */
    public void addAgent(
            Protos.SlaveID agentId,
            Protos.SlaveInfo info,
            Collection<Protos.SlaveInfo.Capability.Type> capabilities,
            Optional<Protos.Unavailability> unavailability,
            ResourceSet total,
            Map<Protos.FrameworkID, ResourceSet> used) throws AllocatorException {
        if (agents.containsKey(agentId)) {
            throw AllocatorException.duplicate("Agent %s is already tracked", agentId.getValue());
        }
        requireUntagged(total, "total of agent " + agentId.getValue());
        ResourceSet usedSum = ResourceSet.empty();
        for (Map.Entry<Protos.FrameworkID, ResourceSet> entry : used.entrySet()) {
            requireTagged(entry.getValue(), String.format(
                    "resources used by framework %s on agent %s", entry.getKey().getValue(), agentId.getValue()));
            usedSum = usedSum.plus(entry.getValue());
        }
        if (!total.contains(usedSum.unallocated())) {
            throw AllocatorException.validation(
                    "Used resources %s exceed the total %s of agent %s", usedSum, total, agentId.getValue());
        }

        Agent agent = new Agent(agentId, info, total, capabilities);
        agent.setUnavailability(unavailability);
        for (Map.Entry<Protos.FrameworkID, ResourceSet> entry : used.entrySet()) {
            agent.setUsed(entry.getKey(), entry.getValue());
            Framework framework = frameworks.get(entry.getKey());
            if (framework != null && !entry.getValue().isEmpty()) {
                framework.addAgent(agentId);
            }
            markDirty(entry.getValue());
        }
        agents.put(agentId, agent);
        markDirty(total);
        LOGGER.info("Added agent {} ({}) with {} ({} in use)", agentId.getValue(), info.getHostname(), total, usedSum);
    }

    /**
     * Stops tracking an agent. Everything offered or used there is released along with it.
     *
     * @return the removed agent, for the caller to release its allocations elsewhere
     * @throws AllocatorException {@code NOT_FOUND} if the agent is not tracked
     */
    public Agent removeAgent(Protos.SlaveID agentId) throws AllocatorException {
        Agent agent = getAgentOrThrow(agentId);
        agents.remove(agentId);
        for (Protos.FrameworkID frameworkId : agent.getFrameworks()) {
            Framework framework = frameworks.get(frameworkId);
            if (framework != null) {
                framework.removeAgent(agentId);
            }
        }
        markDirty(agent.getTotal());
        markDirty(agent.getAllocated());
        LOGGER.info("Removed agent {} ({})", agentId.getValue(), agent.getHostname());
        return agent;
    }

    /**
     * Updates an agent's info, capabilities and/or total. Absent values are left unchanged.
     *
     * @return whether the agent gained capacity which it didn't have before
     * @throws AllocatorException {@code NOT_FOUND} if the agent is not tracked, {@code VALIDATION} if the new total
     *     does not cover what is currently offered and used there
     */
    public boolean updateAgent(
            Protos.SlaveID agentId,
            Optional<Protos.SlaveInfo> info,
            Optional<Collection<Protos.SlaveInfo.Capability.Type>> capabilities,
            Optional<ResourceSet> total) throws AllocatorException {
        Agent agent = getAgentOrThrow(agentId);
        if (total.isPresent()) {
            requireUntagged(total.get(), "total of agent " + agentId.getValue());
            ResourceSet allocated = agent.getAllocated().unallocated();
            if (!total.get().contains(allocated)) {
                throw AllocatorException.validation(
                        "New total %s of agent %s does not cover its allocated resources %s",
                        total.get(), agentId.getValue(), allocated);
            }
        }

        boolean grew = false;
        if (info.isPresent()) {
            agent.setInfo(info.get());
        }
        if (capabilities.isPresent()) {
            agent.setCapabilities(capabilities.get());
        }
        if (total.isPresent()) {
            grew = !agent.getTotal().contains(total.get());
            markDirty(agent.getTotal());
            markDirty(total.get());
            agent.setTotal(total.get());
            LOGGER.info("Updated total of agent {} to {}", agentId.getValue(), total.get());
        }
        return grew;
    }

    public void activateAgent(Protos.SlaveID agentId) throws AllocatorException {
        getAgentOrThrow(agentId).setActivated(true);
        LOGGER.info("Activated agent {}", agentId.getValue());
    }

    public void deactivateAgent(Protos.SlaveID agentId) throws AllocatorException {
        getAgentOrThrow(agentId).setActivated(false);
        LOGGER.info("Deactivated agent {}", agentId.getValue());
    }

    /**
     * Sets or clears an agent's maintenance window. Any outstanding inverse offers and their statuses are dropped.
     */
    public void updateUnavailability(
            Protos.SlaveID agentId, Optional<Protos.Unavailability> unavailability) throws AllocatorException {
        getAgentOrThrow(agentId).setUnavailability(unavailability);
    }

    /**
     * Converts unreserved capacity which is not currently offered or used into a static reservation for a role.
     *
     * @throws AllocatorException {@code NOT_FOUND} if the agent is not tracked, {@code VALIDATION} if the role is
     *     invalid, the resources are already reserved or tagged, or the agent does not have them available
     */
    public void addReservation(Protos.SlaveID agentId, String role, ResourceSet resources) throws AllocatorException {
        RoleRegistry.validateName(role);
        Agent agent = getAgentOrThrow(agentId);
        requireUntagged(resources, "reservation for role " + role);
        if (!resources.reserved().isEmpty()) {
            throw AllocatorException.validation("Cannot reserve already reserved resources: %s", resources.reserved());
        }
        if (!agent.getAvailable().unreserved().contains(resources)) {
            throw AllocatorException.validation("Agent %s does not have %s available to reserve for role '%s'",
                    agentId.getValue(), resources, role);
        }
        agent.setTotal(agent.getTotal()
                .minus(resources)
                .plus(resources.reserve(ResourceKey.ReservationKind.STATIC, role)));
        dirtyRoles.add(role);
        LOGGER.info("Reserved {} on agent {} for role '{}'", resources, agentId.getValue(), role);
    }

    // Frameworks

    /**
     * Starts tracking a framework. Any resources which agents already reported as used by the framework are
     * attributed to it.
     *
     * @throws AllocatorException {@code DUPLICATE} if the framework is already tracked, {@code VALIDATION} if one of
     *     its roles is invalid or a suppressed role is not subscribed
     */
    public Framework addFramework(
            Protos.FrameworkID frameworkId,
            Protos.FrameworkInfo info,
            Collection<String> suppressedRoles,
            boolean active) throws AllocatorException {
        if (frameworks.containsKey(frameworkId)) {
            throw AllocatorException.duplicate("Framework %s is already tracked", frameworkId.getValue());
        }
        Set<String> roles = Framework.getRoles(info);
        validateRoles(frameworkId, roles, suppressedRoles);

        Framework framework = new Framework(frameworkId, info, suppressedRoles, active);
        for (Agent agent : agents.values()) {
            if (agent.getFrameworks().contains(frameworkId)) {
                framework.addAgent(agent.getId());
            }
        }
        frameworks.put(frameworkId, framework);
        dirtyRoles.addAll(roles);
        LOGGER.info("Added framework {} ({}) with roles {}", frameworkId.getValue(), info.getName(), roles);
        return framework;
    }

    /**
     * Stops tracking a framework, releasing everything it held.
     *
     * @return the released resources by agent, still tagged with their allocation roles
     * @throws AllocatorException {@code NOT_FOUND} if the framework is not tracked
     */
    public Map<Protos.SlaveID, ResourceSet> removeFramework(Protos.FrameworkID frameworkId) throws AllocatorException {
        Framework framework = getFrameworkOrThrow(frameworkId);
        Map<Protos.SlaveID, ResourceSet> released = new LinkedHashMap<>();
        for (Protos.SlaveID agentId : framework.getAgents()) {
            Agent agent = agents.get(agentId);
            if (agent == null) {
                continue;
            }
            ResourceSet allocated = agent.getAllocated(frameworkId);
            if (!allocated.isEmpty()) {
                released.put(agentId, allocated);
                markDirty(allocated);
            }
        }
        for (Agent agent : agents.values()) {
            agent.removeFramework(frameworkId);
        }
        frameworks.remove(frameworkId);
        dirtyRoles.addAll(framework.getRoles());
        LOGGER.info("Removed framework {} ({}), released resources on {} agent{}",
                frameworkId.getValue(), framework.getInfo().getName(),
                released.size(), LoggingUtils.plural(released.size()));
        return released;
    }

    /**
     * Replaces a framework's info, and with it its roles and capabilities, along with its suppressed roles.
     *
     * @return the roles the framework was subscribed to before the update
     * @throws AllocatorException {@code NOT_FOUND} if the framework is not tracked, {@code VALIDATION} if one of the
     *     roles is invalid or a suppressed role is not subscribed
     */
    public Set<String> updateFramework(
            Protos.FrameworkID frameworkId,
            Protos.FrameworkInfo info,
            Collection<String> suppressedRoles) throws AllocatorException {
        Framework framework = getFrameworkOrThrow(frameworkId);
        Set<String> roles = Framework.getRoles(info);
        validateRoles(frameworkId, roles, suppressedRoles);

        Set<String> previousRoles = framework.getRoles();
        framework.update(info, suppressedRoles);
        dirtyRoles.addAll(previousRoles);
        dirtyRoles.addAll(roles);
        if (!previousRoles.equals(roles)) {
            LOGGER.info("Framework {} roles changed from {} to {}", frameworkId.getValue(), previousRoles, roles);
        }
        return previousRoles;
    }

    public void activateFramework(Protos.FrameworkID frameworkId) throws AllocatorException {
        getFrameworkOrThrow(frameworkId).setActive(true);
        LOGGER.info("Activated framework {}", frameworkId.getValue());
    }

    public void deactivateFramework(Protos.FrameworkID frameworkId) throws AllocatorException {
        getFrameworkOrThrow(frameworkId).setActive(false);
        LOGGER.info("Deactivated framework {}", frameworkId.getValue());
    }

    /**
     * Stops offers to the provided roles of the framework, or to all of its roles if none are provided.
     *
     * @return the roles which are now suppressed
     */
    public Set<String> suppressRoles(Protos.FrameworkID frameworkId, Collection<String> roles)
            throws AllocatorException {
        Framework framework = getFrameworkOrThrow(frameworkId);
        Set<String> suppressed = new LinkedHashSet<>(framework.getSuppressedRoles());
        suppressed.addAll(roles.isEmpty() ? framework.getRoles() : roles);
        validateRoles(frameworkId, framework.getRoles(), suppressed);
        framework.setSuppressedRoles(suppressed);
        return framework.getSuppressedRoles();
    }

    /**
     * Resumes offers to the provided roles of the framework, or to all of its roles if none are provided.
     *
     * @return the roles which were revived
     */
    public Set<String> reviveRoles(Protos.FrameworkID frameworkId, Collection<String> roles)
            throws AllocatorException {
        Framework framework = getFrameworkOrThrow(frameworkId);
        Set<String> revived = new LinkedHashSet<>(roles.isEmpty() ? framework.getRoles() : roles);
        for (String role : revived) {
            if (!framework.getRoles().contains(role)) {
                throw AllocatorException.validation(
                        "Framework %s is not subscribed to role '%s'", frameworkId.getValue(), role);
            }
        }
        Set<String> suppressed = new LinkedHashSet<>(framework.getSuppressedRoles());
        suppressed.removeAll(revived);
        framework.setSuppressedRoles(suppressed);
        dirtyRoles.addAll(revived);
        return revived;
    }

    // Allocations

    /**
     * Records resources as offered to a framework.
     *
     * @param resources the offered resources, tagged with the role they are offered to
     * @throws AllocatorException {@code NOT_FOUND} if the agent or framework is not tracked, {@code VALIDATION} if
     *     the resources are untagged, tagged with a role the framework isn't subscribed to, or not available
     */
    public void applyOffer(Protos.FrameworkID frameworkId, Protos.SlaveID agentId, ResourceSet resources)
            throws AllocatorException {
        Agent agent = getAgentOrThrow(agentId);
        Framework framework = getFrameworkOrThrow(frameworkId);
        requireTagged(resources, "offer to framework " + frameworkId.getValue());
        for (String role : resources.allocations().keySet()) {
            if (!framework.getRoles().contains(role)) {
                throw AllocatorException.validation(
                        "Framework %s is not subscribed to role '%s'", frameworkId.getValue(), role);
            }
        }
        ResourceSet available = agent.getAvailable();
        if (!available.contains(resources.unallocated())) {
            throw AllocatorException.validation("Cannot offer %s on agent %s: only %s is available",
                    resources, agentId.getValue(), available);
        }

        agent.setOffered(frameworkId, agent.getOffered(frameworkId).plus(resources));
        framework.addAgent(agentId);
        markDirty(resources);
    }

    /**
     * Moves resources of a framework from offered to used.
     *
     * @throws AllocatorException {@code NOT_FOUND} if the agent or framework is not tracked, {@code VALIDATION} if
     *     the resources were not offered to the framework
     */
    public void launch(Protos.FrameworkID frameworkId, Protos.SlaveID agentId, ResourceSet resources)
            throws AllocatorException {
        Agent agent = getAgentOrThrow(agentId);
        Framework framework = getFrameworkOrThrow(frameworkId);
        ResourceSet tagged = tagForFramework(framework, resources);
        ResourceSet offered = agent.getOffered(frameworkId);
        if (!offered.contains(tagged)) {
            throw AllocatorException.validation("Cannot launch %s on agent %s: framework %s was only offered %s",
                    tagged, agentId.getValue(), frameworkId.getValue(), offered);
        }
        agent.setOffered(frameworkId, offered.minus(tagged));
        agent.setUsed(frameworkId, agent.getUsed(frameworkId).plus(tagged));
        markDirty(tagged);
    }

    /**
     * Returns resources held by a framework, offered first and then used, to the agent's free capacity. Untagged
     * resources are attributed to the framework's role if it has exactly one.
     *
     * @return the recovered resources, tagged with the roles they were allocated to
     * @throws AllocatorException {@code NOT_FOUND} if the agent is not tracked, or if the framework is neither
     *     tracked nor holding anything on the agent, {@code VALIDATION} if the resources are not all held by the
     *     framework on the agent
     */
    public ResourceSet recoverResources(Protos.FrameworkID frameworkId, Protos.SlaveID agentId, ResourceSet resources)
            throws AllocatorException {
        Agent agent = getAgentOrThrow(agentId);
        Framework framework = frameworks.get(frameworkId);
        ResourceSet held = agent.getAllocated(frameworkId);
        if (framework == null && held.isEmpty()) {
            throw AllocatorException.notFound("Framework %s holds nothing on agent %s",
                    frameworkId.getValue(), agentId.getValue());
        }
        ResourceSet tagged = framework == null ? resources : tagForFramework(framework, resources);
        requireTagged(tagged, "resources recovered from framework " + frameworkId.getValue());
        if (!held.contains(tagged)) {
            throw AllocatorException.validation("Cannot recover %s on agent %s: framework %s only holds %s",
                    tagged, agentId.getValue(), frameworkId.getValue(), held);
        }
        ResourceSet offered = agent.getOffered(frameworkId);
        ResourceSet fromOffered = offered.intersect(tagged);
        ResourceSet fromUsed = tagged.minus(fromOffered);
        ResourceSet used = agent.getUsed(frameworkId);
        if (!used.contains(fromUsed)) {
            throw AllocatorException.validation("Cannot recover %s on agent %s: framework %s only uses %s",
                    fromUsed, agentId.getValue(), frameworkId.getValue(), used);
        }

        agent.setOffered(frameworkId, offered.minus(fromOffered));
        agent.setUsed(frameworkId, used.minus(fromUsed));
        if (framework != null && agent.getAllocated(frameworkId).isEmpty()) {
            framework.removeAgent(agentId);
        }
        markDirty(tagged);
        return tagged;
    }

    /**
     * Applies operations to resources which were offered to a framework. {@code LAUNCH} and {@code LAUNCH_GROUP}
     * move resources from offered to used. {@code RESERVE} and {@code UNRESERVE} convert offered resources between
     * unreserved and dynamically reserved, changing the agent's total along with them. The operations are validated
     * in sequence, and nothing is applied unless all of them are valid.
     *
     * @throws AllocatorException {@code NOT_FOUND} if the agent or framework is not tracked, {@code VALIDATION} if
     *     an operation is unsupported or does not apply to the offered resources
     */
    public void transform(
            Protos.FrameworkID frameworkId,
            Protos.SlaveID agentId,
            List<Protos.Offer.Operation> operations) throws AllocatorException {
        Agent agent = getAgentOrThrow(agentId);
        Framework framework = getFrameworkOrThrow(frameworkId);

        ResourceSet offered = agent.getOffered(frameworkId);
        ResourceSet used = agent.getUsed(frameworkId);
        ResourceSet total = agent.getTotal();
        for (Protos.Offer.Operation operation : operations) {
            switch (operation.getType()) {
            case LAUNCH: {
                ResourceSet launched = tagForFramework(
                        framework, taskResources(operation.getLaunch().getTaskInfosList()));
                requireOffered(offered, launched, operation, agentId);
                offered = offered.minus(launched);
                used = used.plus(launched);
                break;
            }
            case LAUNCH_GROUP: {
                List<Protos.Resource> resources = new ArrayList<>(
                        operation.getLaunchGroup().getExecutor().getResourcesList());
                for (Protos.TaskInfo task : operation.getLaunchGroup().getTaskGroup().getTasksList()) {
                    resources.addAll(task.getResourcesList());
                }
                ResourceSet launched = tagForFramework(framework, ResourceSet.of(resources));
                requireOffered(offered, launched, operation, agentId);
                offered = offered.minus(launched);
                used = used.plus(launched);
                break;
            }
            case RESERVE: {
                ResourceSet target = tagForFramework(
                        framework, ResourceSet.of(operation.getReserve().getResourcesList()));
                if (!target.unreserved().isEmpty()) {
                    throw AllocatorException.validation("RESERVE operation contains unreserved resources: %s",
                            target.unreserved());
                }
                ResourceSet source = target.unreserve();
                requireOffered(offered, source, operation, agentId);
                offered = offered.minus(source).plus(target);
                total = total.minus(source.unallocated()).plus(target.unallocated());
                break;
            }
            case UNRESERVE: {
                ResourceSet source = tagForFramework(
                        framework, ResourceSet.of(operation.getUnreserve().getResourcesList()));
                for (ResourceKey key : source.keys()) {
                    if (key.getReservationKind() != ResourceKey.ReservationKind.DYNAMIC) {
                        throw AllocatorException.validation(
                                "UNRESERVE operation contains resources which are not dynamically reserved: %s",
                                key);
                    }
                }
                requireOffered(offered, source, operation, agentId);
                ResourceSet target = source.unreserve();
                offered = offered.minus(source).plus(target);
                total = total.minus(source.unallocated()).plus(target.unallocated());
                break;
            }
            default:
                throw AllocatorException.validation("Unsupported operation: %s", operation.getType());
            }
        }

        markDirty(agent.getTotal());
        markDirty(agent.getAllocated(frameworkId));
        agent.setTotal(total);
        agent.setOffered(frameworkId, offered);
        agent.setUsed(frameworkId, used);
        markDirty(total);
        markDirty(offered.plus(used));
        if (agent.getAllocated(frameworkId).isEmpty()) {
            framework.removeAgent(agentId);
        }
    }

    // Inverse offers

    public void addInverseOffer(Protos.SlaveID agentId, Protos.FrameworkID frameworkId) throws AllocatorException {
        getAgentOrThrow(agentId).addOutstandingInverseOffer(frameworkId);
    }

    /**
     * Records a framework's response to an inverse offer. The inverse offer is no longer outstanding afterwards.
     */
    public void updateInverseOffer(
            Protos.SlaveID agentId,
            Protos.FrameworkID frameworkId,
            Optional<InverseOfferStatus> status) throws AllocatorException {
        Agent agent = getAgentOrThrow(agentId);
        getFrameworkOrThrow(frameworkId);
        if (!agent.getUnavailability().isPresent()) {
            throw AllocatorException.validation("Agent %s is not scheduled for maintenance", agentId.getValue());
        }
        agent.removeOutstandingInverseOffer(frameworkId);
        if (status.isPresent()) {
            agent.setInverseOfferStatus(frameworkId, status.get());
        }
    }

    /**
     * Returns the latest inverse offer responses for every agent which is scheduled for maintenance.
     */
    public Map<Protos.SlaveID, Map<Protos.FrameworkID, InverseOfferStatus>> getInverseOfferStatuses() {
        Map<Protos.SlaveID, Map<Protos.FrameworkID, InverseOfferStatus>> statuses = new LinkedHashMap<>();
        for (Agent agent : agents.values()) {
            if (agent.getUnavailability().isPresent()) {
                statuses.put(agent.getId(), new LinkedHashMap<>(agent.getInverseOfferStatuses()));
            }
        }
        return statuses;
    }

    // Queries

    public Optional<Agent> getAgent(Protos.SlaveID agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    /**
     * Returns all agents in the order they were added.
     */
    public Collection<Agent> getAgents() {
        return Collections.unmodifiableCollection(agents.values());
    }

    public Optional<Framework> getFramework(Protos.FrameworkID frameworkId) {
        return Optional.ofNullable(frameworks.get(frameworkId));
    }

    public Collection<Framework> getFrameworks() {
        return Collections.unmodifiableCollection(frameworks.values());
    }

    /**
     * Returns the summed scalar capacity of all agents.
     */
    public ResourceQuantities getClusterTotal() {
        ResourceQuantities total = ResourceQuantities.empty();
        for (Agent agent : agents.values()) {
            total = total.plus(agent.getTotal().quantities());
        }
        return total;
    }

    /**
     * Returns what counts against the quota of a role: everything allocated to the role or its descendants, plus
     * their reservations which are not allocated.
     */
    public ResourceQuantities getConsumedQuota(String role) {
        ResourceQuantities consumed = ResourceQuantities.empty();
        for (Agent agent : agents.values()) {
            ResourceSet allocated = agent.getAllocated();
            consumed = consumed.plus(allocated
                    .filter(key -> ResourceSet.isSameOrAncestor(role, key.getAllocationRole().orElse("")))
                    .quantities());
            ResourceSet reserved = agent.getTotal()
                    .filter(key -> key.isReserved() && ResourceSet.isSameOrAncestor(role, key.getReservationRole()));
            if (!reserved.isEmpty()) {
                ResourceSet allocatedReserved = allocated.unallocated().intersect(reserved);
                consumed = consumed.plus(reserved.minus(allocatedReserved).quantities());
            }
        }
        return consumed;
    }

    /**
     * Returns the roles touched by mutations since the previous call, and resets the set.
     */
    public Set<String> drainDirtyRoles() {
        Set<String> drained = new LinkedHashSet<>(dirtyRoles);
        dirtyRoles.clear();
        return drained;
    }

    /**
     * Verifies that on every agent, the resources offered and used fit within the agent's total.
     *
     * @throws IllegalStateException describing the first violation found
     */
    public void checkInvariants() {
        for (Agent agent : agents.values()) {
            ResourceSet allocated = agent.getAllocated().unallocated();
            if (!agent.getTotal().contains(allocated)) {
                throw new IllegalStateException(String.format(
                        "Agent %s has %s offered or used, exceeding its total %s",
                        agent.getId().getValue(), allocated, agent.getTotal()));
            }
            for (Protos.FrameworkID frameworkId : agent.getFrameworks()) {
                Framework framework = frameworks.get(frameworkId);
                if (framework != null && !framework.getAgents().contains(agent.getId())) {
                    throw new IllegalStateException(String.format(
                            "Framework %s holds resources on agent %s which are missing from its index",
                            frameworkId.getValue(), agent.getId().getValue()));
                }
            }
        }
    }

    // Helpers

    private Agent getAgentOrThrow(Protos.SlaveID agentId) throws AllocatorException {
        Agent agent = agents.get(agentId);
        if (agent == null) {
            throw AllocatorException.notFound("Agent %s is not tracked", agentId.getValue());
        }
        return agent;
    }

    private Framework getFrameworkOrThrow(Protos.FrameworkID frameworkId) throws AllocatorException {
        Framework framework = frameworks.get(frameworkId);
        if (framework == null) {
            throw AllocatorException.notFound("Framework %s is not tracked", frameworkId.getValue());
        }
        return framework;
    }

    /**
     * Tags untagged resources with the framework's role, which is only possible if it has exactly one.
     */
    private static ResourceSet tagForFramework(Framework framework, ResourceSet resources) throws AllocatorException {
        ResourceSet untagged = resources.filter(key -> !key.getAllocationRole().isPresent());
        if (untagged.isEmpty()) {
            return resources;
        }
        if (framework.getRoles().size() != 1) {
            throw AllocatorException.validation(
                    "Resources %s of framework %s must be tagged with one of its roles %s",
                    untagged, framework.getId().getValue(), framework.getRoles());
        }
        String role = framework.getRoles().iterator().next();
        return resources.minus(untagged).plus(untagged.allocatedTo(role));
    }

    private static void requireTagged(ResourceSet resources, String description) throws AllocatorException {
        for (ResourceKey key : resources.keys()) {
            if (!key.getAllocationRole().isPresent()) {
                throw AllocatorException.validation("Missing allocation role on %s in %s", key, description);
            }
        }
    }

    private static void requireUntagged(ResourceSet resources, String description) throws AllocatorException {
        for (ResourceKey key : resources.keys()) {
            if (key.getAllocationRole().isPresent()) {
                throw AllocatorException.validation("Unexpected allocation role on %s in %s", key, description);
            }
        }
    }

    private static void requireOffered(
            ResourceSet offered,
            ResourceSet resources,
            Protos.Offer.Operation operation,
            Protos.SlaveID agentId) throws AllocatorException {
        if (!offered.contains(resources)) {
            throw AllocatorException.validation("%s operation on agent %s needs %s, but only %s was offered",
                    operation.getType(), agentId.getValue(), resources, offered);
        }
    }

    private static void validateRoles(
            Protos.FrameworkID frameworkId, Set<String> roles, Collection<String> suppressedRoles)
            throws AllocatorException {
        for (String role : roles) {
            RoleRegistry.validateName(role);
        }
        for (String role : suppressedRoles) {
            if (!roles.contains(role)) {
                throw AllocatorException.validation(
                        "Framework %s suppresses role '%s' which it is not subscribed to",
                        frameworkId.getValue(), role);
            }
        }
    }

    private static ResourceSet taskResources(List<Protos.TaskInfo> tasks) {
        List<Protos.Resource> resources = new ArrayList<>();
        for (Protos.TaskInfo task : tasks) {
            resources.addAll(task.getResourcesList());
            if (task.hasExecutor()) {
                resources.addAll(task.getExecutor().getResourcesList());
            }
        }
        return ResourceSet.of(resources);
    }

    private void markDirty(ResourceSet resources) {
        for (ResourceKey key : resources.keys()) {
            if (key.getAllocationRole().isPresent()) {
                dirtyRoles.add(key.getAllocationRole().get());
            }
            if (key.isReserved()) {
                dirtyRoles.add(key.getReservationRole());
            }
        }
    }
}
