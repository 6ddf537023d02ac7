package com.mesosphere.allocator.allocation;

import com.mesosphere.allocator.config.AllocatorConfig;
import com.mesosphere.allocator.offer.ResourceSet;
import com.mesosphere.allocator.quota.Quota;
import com.mesosphere.allocator.state.InverseOfferStatus;
import org.apache.mesos.Protos;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * The operations which the owning system (the master) invokes on the allocator.
 *
 * <p>Every operation is asynchronous: the returned future completes once the operation has been processed, after
 * every operation which was invoked before it. Rejected operations complete the future exceptionally with an
 * {@link AllocatorException}, except for references to unknown agents or frameworks, which are logged and ignored.
 */
public interface Allocator {

    /**
     * Must be invoked once, before any other operation.
     */
    void initialize(AllocatorConfig config, OfferCallback offerCallback, InverseOfferCallback inverseOfferCallback);

    // Agents

    /**
     * @param total the agent's total capacity, including reservations
     * @param used resources which frameworks are already using on the agent, tagged with their allocation roles
     */
    CompletableFuture<Void> addSlave(
            Protos.SlaveID agentId,
            Protos.SlaveInfo agentInfo,
            Collection<Protos.SlaveInfo.Capability.Type> capabilities,
            Optional<Protos.Unavailability> unavailability,
            ResourceSet total,
            Map<Protos.FrameworkID, ResourceSet> used);

    CompletableFuture<Void> removeSlave(Protos.SlaveID agentId);

    /**
     * Updates an agent's info, and optionally its total and capabilities.
     */
    CompletableFuture<Void> updateSlave(
            Protos.SlaveID agentId,
            Protos.SlaveInfo agentInfo,
            Optional<ResourceSet> total,
            Optional<Collection<Protos.SlaveInfo.Capability.Type>> capabilities);

    CompletableFuture<Void> activateSlave(Protos.SlaveID agentId);

    CompletableFuture<Void> deactivateSlave(Protos.SlaveID agentId);

    /**
     * Restricts offers to agents with the provided hostnames, or lifts the restriction if empty.
     */
    CompletableFuture<Void> updateWhitelist(Optional<Set<String>> hostnames);

    // Frameworks

    CompletableFuture<Void> addFramework(
            Protos.FrameworkID frameworkId,
            Protos.FrameworkInfo frameworkInfo,
            boolean active,
            Set<String> suppressedRoles);

    CompletableFuture<Void> removeFramework(Protos.FrameworkID frameworkId);

    CompletableFuture<Void> activateFramework(Protos.FrameworkID frameworkId);

    CompletableFuture<Void> deactivateFramework(Protos.FrameworkID frameworkId);

    CompletableFuture<Void> updateFramework(
            Protos.FrameworkID frameworkId,
            Protos.FrameworkInfo frameworkInfo,
            Set<String> suppressedRoles);

    /**
     * Logged only: requests do not influence allocation.
     */
    CompletableFuture<Void> requestResources(Protos.FrameworkID frameworkId, List<Protos.Request> requests);

    // Resources

    /**
     * Applies operations to resources which were offered to the framework on the agent.
     */
    CompletableFuture<Void> transformAllocation(
            Protos.FrameworkID frameworkId,
            Protos.SlaveID agentId,
            List<Protos.Offer.Operation> operations);

    /**
     * Returns resources held by a framework to the free pool, e.g. after the framework declined an offer or a task
     * finished. Unless {@code filters} sets {@code refuse_seconds} to zero, the resources won't be offered to the
     * framework again until the refusal expires.
     */
    CompletableFuture<Void> recoverResources(
            Protos.FrameworkID frameworkId,
            Protos.SlaveID agentId,
            ResourceSet resources,
            Optional<Protos.Filters> filters);

    /**
     * Stops offers to the provided roles of the framework, or to all of its roles if none are provided.
     */
    CompletableFuture<Void> suppressOffers(Protos.FrameworkID frameworkId, Set<String> roles);

    /**
     * Resumes offers to the provided roles of the framework, or to all of its roles if none are provided, and drops
     * the framework's filters for those roles.
     */
    CompletableFuture<Void> reviveOffers(Protos.FrameworkID frameworkId, Set<String> roles);

    // Roles

    CompletableFuture<Void> setQuota(String role, Quota quota);

    CompletableFuture<Void> removeQuota(String role);

    CompletableFuture<Void> updateWeights(List<Protos.WeightInfo> weightInfos);

    CompletableFuture<Void> addReservation(Protos.SlaveID agentId, String role, ResourceSet resources);

    // Maintenance

    CompletableFuture<Void> updateUnavailability(
            Protos.SlaveID agentId, Optional<Protos.Unavailability> unavailability);

    CompletableFuture<Void> updateInverseOffer(
            Protos.SlaveID agentId,
            Protos.FrameworkID frameworkId,
            Optional<UnavailableResources> unavailableResources,
            Optional<InverseOfferStatus> status,
            Optional<Protos.Filters> filters);

    CompletableFuture<Map<Protos.SlaveID, Map<Protos.FrameworkID, InverseOfferStatus>>>
            getInverseOfferStatuses();

    // Lifecycle

    CompletableFuture<Void> pause();

    CompletableFuture<Void> resume();
}
