package com.mesosphere.allocator.quota;

import com.mesosphere.allocator.allocation.AllocatorException;
import com.mesosphere.allocator.offer.LoggingUtils;
import com.mesosphere.allocator.offer.ResourceKey;
import com.mesosphere.allocator.offer.ResourceQuantities;
import com.mesosphere.allocator.offer.ResourceSet;
import com.mesosphere.allocator.offer.ValueUtils;
import com.mesosphere.allocator.roles.RoleRegistry;
import org.apache.mesos.Protos;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Tracks per-role quotas and per-agent reservations, and answers how far each role is from its guarantee and its
 * limit.
 *
 * <p>A role's consumption is what counts against its quota: everything allocated to the role or its descendants, plus
 * its reservations which are not currently allocated. Consumption is computed by the allocation engine and pushed
 * here via {@link #updateConsumption(String, ResourceQuantities)}.
 */
public class QuotaLedger {

    private static final Logger LOGGER = LoggingUtils.getLogger(QuotaLedger.class);

    private final Map<String, Quota> quotas = new LinkedHashMap<>();
    private final Map<String, ResourceQuantities> consumption = new LinkedHashMap<>();
    private final Map<String, Map<Protos.SlaveID, ResourceSet>> reservations = new LinkedHashMap<>();
    private final RoleRegistry roles;

    public QuotaLedger(RoleRegistry roles) {
        this.roles = roles;
    }

    /**
     * Sets the quota for a role, replacing any previous quota.
     *
     * @param clusterTotal the current total capacity of the cluster
     * @throws AllocatorException with reason {@code VALIDATION} if the limit is below the guarantee, or if the sum of
     *     all guarantees would exceed the cluster's total capacity along any dimension
     */
    public void setQuota(String role, Quota quota, ResourceQuantities clusterTotal) throws AllocatorException {
        RoleRegistry.validateName(role);
        if (quota.getLimit().isPresent() && !quota.getLimit().get().contains(quota.getGuarantee())) {
            throw AllocatorException.validation(
                    "Quota limit %s for role '%s' is below its guarantee %s",
                    quota.getLimit().get(), role, quota.getGuarantee());
        }

        Map<String, Quota> updated = new LinkedHashMap<>(quotas);
        updated.put(role, quota);
        ResourceQuantities guaranteed = sumGuarantees(updated);
        if (!clusterTotal.contains(guaranteed)) {
            throw AllocatorException.validation(
                    "Quota guarantees %s would exceed the cluster capacity %s after setting %s for role '%s'",
                    guaranteed, clusterTotal, quota.getGuarantee(), role);
        }

        quotas.put(role, quota);
        roles.setHasQuota(role, true);
        LOGGER.info("Set quota for role '{}': {}", role, quota);
    }

    /**
     * Removes the quota for a role, if any. Always succeeds.
     */
    public Optional<Quota> removeQuota(String role) {
        Quota removed = quotas.remove(role);
        consumption.remove(role);
        if (removed != null) {
            roles.setHasQuota(role, false);
            LOGGER.info("Removed quota for role '{}': {}", role, removed);
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Quota> getQuota(String role) {
        return Optional.ofNullable(quotas.get(role));
    }

    public Map<String, Quota> getQuotas() {
        return Collections.unmodifiableMap(quotas);
    }

    public boolean hasQuota(String role) {
        return quotas.containsKey(role);
    }

    public void updateConsumption(String role, ResourceQuantities consumed) {
        if (quotas.containsKey(role)) {
            consumption.put(role, consumed);
        }
    }

    public ResourceQuantities getConsumption(String role) {
        return consumption.getOrDefault(role, ResourceQuantities.empty());
    }

    /**
     * Returns {@code max(0, guarantee - consumed)} for the role, or nothing if it has no quota.
     */
    public ResourceQuantities getUnsatisfiedGuarantee(String role) {
        Quota quota = quotas.get(role);
        if (quota == null) {
            return ResourceQuantities.empty();
        }
        return quota.getGuarantee().minusClampedAtZero(getConsumption(role));
    }

    /**
     * Returns the unsatisfied guarantees across all roles with quota: the capacity which must be kept free for them.
     */
    public ResourceQuantities getRequiredHeadroom() {
        return getRequiredHeadroom(Optional.empty());
    }

    /**
     * Returns the capacity which must be kept free for the guarantees of other roles when allocating to
     * {@code allocationRole}. Quotas of that role and its ancestors are not counted, since allocating to the role
     * works towards them.
     *
     * <p>A nested quota role's guarantee is part of its ancestor's guarantee, so each quota role requires the larger
     * of its own unsatisfied guarantee and what its outermost nested quota roles require.
     */
    public ResourceQuantities getRequiredHeadroom(Optional<String> allocationRole) {
        ResourceQuantities required = ResourceQuantities.empty();
        for (String quotaRole : getOutermostQuotaRoles(Optional.empty())) {
            required = required.plus(getRequiredHeadroom(quotaRole, allocationRole));
        }
        return required;
    }

    /**
     * Returns how much more the role may consume before reaching the limit of its own quota or of any ancestor's
     * quota, by resource name. Only names listed in some limit appear, and an amount of zero means nothing more may
     * be allocated. An empty map means the role and its ancestors are unbounded.
     */
    public Map<String, Double> getLimitHeadroom(String role) {
        List<String> chain = new ArrayList<>();
        chain.add(role);
        chain.addAll(RoleRegistry.ancestors(role));

        Map<String, Double> headroom = new TreeMap<>();
        for (String name : chain) {
            Quota quota = quotas.get(name);
            if (quota == null || !quota.getLimit().isPresent()) {
                continue;
            }
            ResourceQuantities limit = quota.getLimit().get();
            ResourceQuantities consumed = getConsumption(name);
            for (String resource : limit.names()) {
                double left = Math.max(0, ValueUtils.round(limit.get(resource) - consumed.get(resource)));
                headroom.merge(resource, left, Math::min);
            }
        }
        return headroom;
    }

    /**
     * Shrinks the provided resources so that allocating them to the role keeps it, and its ancestors, within their
     * quota limits. Names without a limit are left untouched.
     */
    public ResourceSet applyLimit(String role, ResourceSet resources) {
        Map<String, Double> headroom = getLimitHeadroom(role);
        return headroom.isEmpty() ? resources : resources.cap(headroom);
    }

    /**
     * Records the reserved portion of an agent's total, replacing what was recorded for the agent before.
     */
    public void setAgentReservations(Protos.SlaveID agentId, ResourceSet reserved) {
        Set<String> touched = new TreeSet<>();
        for (Map.Entry<String, Map<Protos.SlaveID, ResourceSet>> entry : reservations.entrySet()) {
            if (entry.getValue().remove(agentId) != null) {
                touched.add(entry.getKey());
            }
        }
        for (ResourceKey key : reserved.keys()) {
            touched.add(key.getReservationRole());
        }
        for (String role : touched) {
            ResourceSet forRole = reserved.reservedTo(role);
            if (!forRole.isEmpty()) {
                reservations.computeIfAbsent(role, r -> new LinkedHashMap<>()).put(agentId, forRole);
            }
        }
        for (String role : touched) {
            Map<Protos.SlaveID, ResourceSet> byAgent = reservations.get(role);
            if (byAgent != null && byAgent.isEmpty()) {
                reservations.remove(role);
            }
            roles.setHasReservations(role, reservations.containsKey(role));
        }
    }

    public void removeAgent(Protos.SlaveID agentId) {
        setAgentReservations(agentId, ResourceSet.empty());
    }

    /**
     * Returns the reservations held by exactly the provided role, by agent.
     */
    public Map<Protos.SlaveID, ResourceSet> getReservations(String role) {
        Map<Protos.SlaveID, ResourceSet> byAgent = reservations.get(role);
        return byAgent == null ? Collections.emptyMap() : Collections.unmodifiableMap(byAgent);
    }

    public Set<String> getReservedRoles() {
        return Collections.unmodifiableSet(reservations.keySet());
    }

    private ResourceQuantities getRequiredHeadroom(String quotaRole, Optional<String> allocationRole) {
        ResourceQuantities nested = ResourceQuantities.empty();
        for (String child : getOutermostQuotaRoles(Optional.of(quotaRole))) {
            nested = nested.plus(getRequiredHeadroom(child, allocationRole));
        }
        if (allocationRole.isPresent() && ResourceSet.isSameOrAncestor(quotaRole, allocationRole.get())) {
            return nested;
        }
        return getUnsatisfiedGuarantee(quotaRole).max(nested);
    }

    /**
     * Returns the quota roles strictly below {@code under} (or anywhere, if absent) which have no quota role between
     * them and {@code under}.
     */
    private List<String> getOutermostQuotaRoles(Optional<String> under) {
        List<String> outermost = new ArrayList<>();
        for (String quotaRole : quotas.keySet()) {
            if (under.isPresent()
                    && (quotaRole.equals(under.get()) || !ResourceSet.isSameOrAncestor(under.get(), quotaRole))) {
                continue;
            }
            boolean nested = false;
            for (String ancestor : RoleRegistry.ancestors(quotaRole)) {
                if (under.isPresent() && ancestor.equals(under.get())) {
                    break;
                }
                if (quotas.containsKey(ancestor)) {
                    nested = true;
                    break;
                }
            }
            if (!nested) {
                outermost.add(quotaRole);
            }
        }
        return outermost;
    }

    private ResourceQuantities sumGuarantees(Map<String, Quota> candidates) {
        // Guarantees of nested roles are part of their ancestor's guarantee, so only the outermost ones are summed.
        ResourceQuantities sum = ResourceQuantities.empty();
        for (Map.Entry<String, Quota> entry : candidates.entrySet()) {
            boolean nested = false;
            for (String ancestor : RoleRegistry.ancestors(entry.getKey())) {
                if (candidates.containsKey(ancestor)) {
                    nested = true;
                    break;
                }
            }
            if (!nested) {
                sum = sum.plus(entry.getValue().getGuarantee());
            }
        }
        return sum;
    }
}
