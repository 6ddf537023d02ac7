package com.mesosphere.allocator.allocation;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mesosphere.allocator.config.AllocatorConfig;
import com.mesosphere.allocator.offer.LoggingUtils;
import com.mesosphere.allocator.offer.ResourceSet;
import com.mesosphere.allocator.quota.Quota;
import com.mesosphere.allocator.state.InverseOfferStatus;
import org.apache.mesos.Protos;
import org.slf4j.Logger;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * {@link Allocator} which serializes every operation onto a single worker thread. The worker exclusively owns a
 * {@link HierarchicalAllocatorProcess}, so operations are applied one at a time, in the order they were invoked,
 * without any locking.
 *
 * <p>Allocation passes are messages on the same queue. A separate timer thread periodically enqueues a trigger, and
 * operations which free up or add capacity request a pass as well. Requests are coalesced so that at most one pass is
 * waiting on the queue at any time.
 */
public class HierarchicalAllocator implements Allocator {

    private static final Logger LOGGER = LoggingUtils.getLogger(HierarchicalAllocator.class);

    /**
     * An operation to be run on the worker, which may reject its input.
     */
    @FunctionalInterface
    private interface Operation<T> {
        T run() throws AllocatorException;
    }

    // Executor for processing operations and allocation passes in FIFO order.
    private final ExecutorService worker = Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("allocator-worker-%d").setDaemon(true).build());
    // Only enqueues periodic allocation triggers onto the worker.
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("allocator-timer-%d").setDaemon(true).build());

    // Accessed only by the worker once initialized.
    private HierarchicalAllocatorProcess process;

    @Override
    public void initialize(
            AllocatorConfig config, OfferCallback offerCallback, InverseOfferCallback inverseOfferCallback) {
        CompletableFuture<Void> initialized = dispatch("initialize", () -> {
            if (process != null) {
                throw new IllegalStateException("Allocator is already initialized");
            }
            process = new HierarchicalAllocatorProcess(
                    config, offerCallback, inverseOfferCallback, this::enqueueAllocation);
            return null;
        });
        initialized.join();
        long intervalMs = config.getAllocationInterval().toMillis();
        timer.scheduleAtFixedRate(this::enqueuePeriodicAllocation, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    // Agents

    @Override
    public CompletableFuture<Void> addSlave(
            Protos.SlaveID agentId,
            Protos.SlaveInfo agentInfo,
            Collection<Protos.SlaveInfo.Capability.Type> capabilities,
            Optional<Protos.Unavailability> unavailability,
            ResourceSet total,
            Map<Protos.FrameworkID, ResourceSet> used) {
        return dispatchVoid("addSlave", () ->
                process.addSlave(agentId, agentInfo, capabilities, unavailability, total, used));
    }

    @Override
    public CompletableFuture<Void> removeSlave(Protos.SlaveID agentId) {
        return dispatchVoid("removeSlave", () -> process.removeSlave(agentId));
    }

    @Override
    public CompletableFuture<Void> updateSlave(
            Protos.SlaveID agentId,
            Protos.SlaveInfo agentInfo,
            Optional<ResourceSet> total,
            Optional<Collection<Protos.SlaveInfo.Capability.Type>> capabilities) {
        return dispatchVoid("updateSlave", () -> process.updateSlave(agentId, agentInfo, total, capabilities));
    }

    @Override
    public CompletableFuture<Void> activateSlave(Protos.SlaveID agentId) {
        return dispatchVoid("activateSlave", () -> process.activateSlave(agentId));
    }

    @Override
    public CompletableFuture<Void> deactivateSlave(Protos.SlaveID agentId) {
        return dispatchVoid("deactivateSlave", () -> process.deactivateSlave(agentId));
    }

    @Override
    public CompletableFuture<Void> updateWhitelist(Optional<Set<String>> hostnames) {
        return dispatchVoid("updateWhitelist", () -> process.updateWhitelist(hostnames));
    }

    // Frameworks

    @Override
    public CompletableFuture<Void> addFramework(
            Protos.FrameworkID frameworkId,
            Protos.FrameworkInfo frameworkInfo,
            boolean active,
            Set<String> suppressedRoles) {
        return dispatchVoid("addFramework", () ->
                process.addFramework(frameworkId, frameworkInfo, active, suppressedRoles));
    }

    @Override
    public CompletableFuture<Void> removeFramework(Protos.FrameworkID frameworkId) {
        return dispatchVoid("removeFramework", () -> process.removeFramework(frameworkId));
    }

    @Override
    public CompletableFuture<Void> activateFramework(Protos.FrameworkID frameworkId) {
        return dispatchVoid("activateFramework", () -> process.activateFramework(frameworkId));
    }

    @Override
    public CompletableFuture<Void> deactivateFramework(Protos.FrameworkID frameworkId) {
        return dispatchVoid("deactivateFramework", () -> process.deactivateFramework(frameworkId));
    }

    @Override
    public CompletableFuture<Void> updateFramework(
            Protos.FrameworkID frameworkId,
            Protos.FrameworkInfo frameworkInfo,
            Set<String> suppressedRoles) {
        return dispatchVoid("updateFramework", () ->
                process.updateFramework(frameworkId, frameworkInfo, suppressedRoles));
    }

    @Override
    public CompletableFuture<Void> requestResources(Protos.FrameworkID frameworkId, List<Protos.Request> requests) {
        return dispatchVoid("requestResources", () -> process.requestResources(frameworkId, requests));
    }

    // Resources

    @Override
    public CompletableFuture<Void> transformAllocation(
            Protos.FrameworkID frameworkId,
            Protos.SlaveID agentId,
            List<Protos.Offer.Operation> operations) {
        return dispatchVoid("transformAllocation", () ->
                process.transformAllocation(frameworkId, agentId, operations));
    }

    @Override
    public CompletableFuture<Void> recoverResources(
            Protos.FrameworkID frameworkId,
            Protos.SlaveID agentId,
            ResourceSet resources,
            Optional<Protos.Filters> filters) {
        return dispatchVoid("recoverResources", () ->
                process.recoverResources(frameworkId, agentId, resources, filters));
    }

    @Override
    public CompletableFuture<Void> suppressOffers(Protos.FrameworkID frameworkId, Set<String> roles) {
        return dispatchVoid("suppressOffers", () -> process.suppressOffers(frameworkId, roles));
    }

    @Override
    public CompletableFuture<Void> reviveOffers(Protos.FrameworkID frameworkId, Set<String> roles) {
        return dispatchVoid("reviveOffers", () -> process.reviveOffers(frameworkId, roles));
    }

    // Roles

    @Override
    public CompletableFuture<Void> setQuota(String role, Quota quota) {
        return dispatchVoid("setQuota", () -> process.setQuota(role, quota));
    }

    @Override
    public CompletableFuture<Void> removeQuota(String role) {
        return dispatchVoid("removeQuota", () -> process.removeQuota(role));
    }

    @Override
    public CompletableFuture<Void> updateWeights(List<Protos.WeightInfo> weightInfos) {
        return dispatchVoid("updateWeights", () -> process.updateWeights(weightInfos));
    }

    @Override
    public CompletableFuture<Void> addReservation(Protos.SlaveID agentId, String role, ResourceSet resources) {
        return dispatchVoid("addReservation", () -> process.addReservation(agentId, role, resources));
    }

    // Maintenance

    @Override
    public CompletableFuture<Void> updateUnavailability(
            Protos.SlaveID agentId, Optional<Protos.Unavailability> unavailability) {
        return dispatchVoid("updateUnavailability", () -> process.updateUnavailability(agentId, unavailability));
    }

    @Override
    public CompletableFuture<Void> updateInverseOffer(
            Protos.SlaveID agentId,
            Protos.FrameworkID frameworkId,
            Optional<UnavailableResources> unavailableResources,
            Optional<InverseOfferStatus> status,
            Optional<Protos.Filters> filters) {
        return dispatchVoid("updateInverseOffer", () ->
                process.updateInverseOffer(agentId, frameworkId, unavailableResources, status, filters));
    }

    @Override
    public CompletableFuture<Map<Protos.SlaveID, Map<Protos.FrameworkID, InverseOfferStatus>>>
            getInverseOfferStatuses() {
        return dispatch("getInverseOfferStatuses", () -> process.getInverseOfferStatuses());
    }

    // Lifecycle

    @Override
    public CompletableFuture<Void> pause() {
        return dispatchVoid("pause", () -> process.pause());
    }

    @Override
    public CompletableFuture<Void> resume() {
        return dispatchVoid("resume", () -> process.resume());
    }

    /**
     * Enqueues an allocation request for all agents, as the periodic timer does. The pass itself runs later on the
     * worker, coalesced with any other pending request.
     */
    public CompletableFuture<Void> triggerAllocation() {
        return dispatchVoid("triggerAllocation", () -> process.requestAllocationForAll());
    }

    /**
     * Returns a future which completes once every message enqueued before this call has been processed, including
     * any allocation pass which those messages requested.
     */
    public CompletableFuture<Void> settle() {
        CompletableFuture<Void> settled = new CompletableFuture<>();
        try {
            worker.execute(() -> settleStep(settled));
        } catch (RejectedExecutionException e) {
            settled.completeExceptionally(stopped("settle", e));
        }
        return settled;
    }

    /**
     * Stops the timer and the worker. Messages which are already enqueued are still processed, and operations
     * submitted afterwards complete exceptionally with {@link IllegalStateException}.
     */
    public void stop() {
        timer.shutdownNow();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
                LOGGER.warn("Allocator worker did not stop within 10s");
            }
        } catch (InterruptedException e) {
            LOGGER.warn("Interrupted while waiting for the allocator worker to stop", e);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs a read of the process's state on the worker, e.g. for tests to inspect the bookkeeping between messages.
     */
    public <T> CompletableFuture<T> inspect(Function<HierarchicalAllocatorProcess, T> reader) {
        return dispatch("inspect", () -> reader.apply(process));
    }

    private void settleStep(CompletableFuture<Void> settled) {
        if (process == null || !process.isAllocationPending()) {
            settled.complete(null);
            return;
        }
        try {
            // The pending pass is queued ahead of this step.
            worker.execute(() -> settleStep(settled));
        } catch (RejectedExecutionException e) {
            // Stopping: the queued pass still runs before the worker terminates.
            settled.complete(null);
        }
    }

    private void enqueuePeriodicAllocation() {
        try {
            worker.execute(this::periodicAllocation);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Skipping periodic allocation: allocator is stopped");
        }
    }

    private void periodicAllocation() {
        if (process == null || process.isPaused()) {
            return;
        }
        process.requestAllocationForAll();
    }

    /**
     * Called by the process on the worker when it wants a pass: the pass is queued behind everything already
     * enqueued. Once stopped, the worker rejects the pass and the process drops the request.
     */
    private void enqueueAllocation() {
        worker.execute(() -> {
            try {
                process.allocate();
            } catch (RuntimeException e) {
                LOGGER.error("Unexpected error during allocation pass", e);
            }
        });
    }

    private CompletableFuture<Void> dispatchVoid(String name, VoidOperation operation) {
        return dispatch(name, () -> {
            operation.run();
            return null;
        });
    }

    /**
     * Enqueues the operation on the worker. The returned future completes after the operation ran: normally if it
     * succeeded or referenced an unknown agent or framework, exceptionally if it was rejected or failed.
     */
    private <T> CompletableFuture<T> dispatch(String name, Operation<T> operation) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Runnable task = () -> {
            if (process == null && !"initialize".equals(name)) {
                result.completeExceptionally(new IllegalStateException(
                        String.format("Allocator must be initialized before %s", name)));
                return;
            }
            try {
                result.complete(operation.run());
            } catch (AllocatorException e) {
                if (e.getReason() == AllocatorError.Reason.NOT_FOUND) {
                    LOGGER.warn("Ignoring {}: {}", name, e.getMessage());
                    result.complete(null);
                } else {
                    LOGGER.info("Rejected {}: {}", name, e.getMessage());
                    result.completeExceptionally(e);
                }
            } catch (RuntimeException e) {
                LOGGER.error(String.format("Unexpected error while processing %s", name), e);
                result.completeExceptionally(e);
            }
        };
        try {
            worker.execute(task);
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(stopped(name, e));
        }
        return result;
    }

    private static IllegalStateException stopped(String name, RejectedExecutionException cause) {
        return new IllegalStateException(String.format("Allocator is stopped, cannot run %s", name), cause);
    }

    /**
     * An operation without a result, which may reject its input.
     */
    @FunctionalInterface
    private interface VoidOperation {
        void run() throws AllocatorException;
    }
}
