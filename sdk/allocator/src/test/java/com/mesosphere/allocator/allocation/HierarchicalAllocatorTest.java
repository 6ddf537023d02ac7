package com.mesosphere.allocator.allocation;

import com.mesosphere.allocator.config.AllocatorConfig;
import com.mesosphere.allocator.offer.ResourceQuantities;
import com.mesosphere.allocator.offer.ResourceSet;
import com.mesosphere.allocator.quota.Quota;
import com.mesosphere.allocator.testutils.ClusterTestUtils;
import com.mesosphere.allocator.testutils.OfferRecorder;
import com.mesosphere.allocator.testutils.TestConstants;
import org.apache.mesos.Protos;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class HierarchicalAllocatorTest {

    private static final long TIMEOUT_SECONDS = 10;
    private static final ResourceSet AGENT_TOTAL = ResourceSet.parse("cpus:4;mem:4096");

    private OfferRecorder recorder;
    private AllocatorConfig config;
    private HierarchicalAllocator allocator;

    @Before
    public void beforeEach() {
        recorder = new OfferRecorder();
        // Keep the periodic trigger out of the way, passes are driven by the operations themselves
        config = AllocatorConfig.newBuilder().allocationInterval(Duration.ofHours(1)).build();
        allocator = new HierarchicalAllocator();
    }

    @After
    public void afterEach() {
        allocator.stop();
    }

    @Test
    public void testOperationsBeforeInitializeFail() throws Exception {
        try {
            await(allocator.removeSlave(TestConstants.AGENT_ID_1));
            Assert.fail("Expected the uninitialized allocator to reject the operation");
        } catch (ExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test(expected = CompletionException.class)
    public void testInitializeTwiceFails() {
        allocator.initialize(config, recorder, recorder);
        allocator.initialize(config, recorder, recorder);
    }

    @Test
    public void testOffersAreSentOnceSettled() throws Exception {
        allocator.initialize(config, recorder, recorder);
        addAgent();
        await(allocator.addFramework(TestConstants.FRAMEWORK_ID_A,
                ClusterTestUtils.frameworkInfo("a", TestConstants.ROLE), true, Collections.emptySet()));
        await(allocator.settle());

        Assert.assertEquals(AGENT_TOTAL.allocatedTo(TestConstants.ROLE),
                recorder.getOffered(TestConstants.FRAMEWORK_ID_A));
        Assert.assertFalse(await(allocator.inspect(HierarchicalAllocatorProcess::isAllocationPending)));
    }

    @Test
    public void testOperationsApplyInOrder() throws Exception {
        allocator.initialize(config, recorder, recorder);
        allocator.addSlave(TestConstants.AGENT_ID_1, ClusterTestUtils.agentInfo(TestConstants.HOSTNAME_1),
                ClusterTestUtils.AGENT_CAPABILITIES, Optional.empty(), AGENT_TOTAL, Collections.emptyMap());
        allocator.removeSlave(TestConstants.AGENT_ID_1);
        allocator.addSlave(TestConstants.AGENT_ID_2, ClusterTestUtils.agentInfo(TestConstants.HOSTNAME_2),
                ClusterTestUtils.AGENT_CAPABILITIES, Optional.empty(), AGENT_TOTAL, Collections.emptyMap());

        Assert.assertFalse(await(allocator.inspect(
                process -> process.getTracker().getAgent(TestConstants.AGENT_ID_1).isPresent())));
        Assert.assertTrue(await(allocator.inspect(
                process -> process.getTracker().getAgent(TestConstants.AGENT_ID_2).isPresent())));
    }

    @Test
    public void testNotFoundCompletesNormally() throws Exception {
        allocator.initialize(config, recorder, recorder);
        Assert.assertNull(await(allocator.removeFramework(TestConstants.FRAMEWORK_ID_A)));
        Assert.assertNull(await(allocator.recoverResources(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_1,
                AGENT_TOTAL.allocatedTo(TestConstants.ROLE), Optional.empty())));
    }

    @Test
    public void testValidationFailureIsReported() throws Exception {
        allocator.initialize(config, recorder, recorder);
        addAgent();
        try {
            await(allocator.setQuota(TestConstants.ROLE, Quota.guarantee(ResourceQuantities.parse("cpus:8"))));
            Assert.fail("Expected a guarantee beyond the cluster's capacity to be rejected");
        } catch (ExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof AllocatorException);
            Assert.assertEquals(AllocatorError.Reason.VALIDATION, ((AllocatorException) e.getCause()).getReason());
        }

        // The worker keeps going after a rejection
        await(allocator.setQuota(TestConstants.ROLE, Quota.guarantee(ResourceQuantities.parse("cpus:2"))));
        Assert.assertTrue(await(allocator.inspect(process -> process.getQuotas().hasQuota(TestConstants.ROLE))));
    }

    @Test
    public void testPauseAndResume() throws Exception {
        allocator.initialize(config, recorder, recorder);
        await(allocator.pause());
        addAgent();
        await(allocator.addFramework(TestConstants.FRAMEWORK_ID_A,
                ClusterTestUtils.frameworkInfo("a", TestConstants.ROLE), true, Collections.emptySet()));
        await(allocator.settle());
        Assert.assertTrue(recorder.getOffers().isEmpty());

        await(allocator.resume());
        await(allocator.triggerAllocation());
        await(allocator.settle());
        Assert.assertEquals(AGENT_TOTAL.allocatedTo(TestConstants.ROLE),
                recorder.getOffered(TestConstants.FRAMEWORK_ID_A));
    }

    @Test
    public void testInverseOfferStatuses() throws Exception {
        allocator.initialize(config, recorder, recorder);
        Assert.assertTrue(await(allocator.getInverseOfferStatuses()).isEmpty());

        await(allocator.addSlave(TestConstants.AGENT_ID_1, ClusterTestUtils.agentInfo(TestConstants.HOSTNAME_1),
                ClusterTestUtils.AGENT_CAPABILITIES, Optional.of(ClusterTestUtils.unavailability(3600)),
                AGENT_TOTAL, Collections.emptyMap()));
        Assert.assertEquals(Collections.singleton(TestConstants.AGENT_ID_1),
                await(allocator.getInverseOfferStatuses()).keySet());
    }

    @Test
    public void testPeriodicAllocation() throws Exception {
        allocator.initialize(
                AllocatorConfig.newBuilder().allocationInterval(Duration.ofMillis(10)).build(), recorder, recorder);
        await(allocator.pause());
        addAgent();
        await(allocator.addFramework(TestConstants.FRAMEWORK_ID_A,
                ClusterTestUtils.frameworkInfo("a", TestConstants.ROLE), true, Collections.emptySet()));
        await(allocator.settle());
        Assert.assertTrue(recorder.getOffers().isEmpty());

        // Resuming doesn't start a pass, the timer does
        await(allocator.resume());
        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS);
        while (recorder.getOffers().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        Assert.assertEquals(AGENT_TOTAL.allocatedTo(TestConstants.ROLE),
                recorder.getOffered(TestConstants.FRAMEWORK_ID_A));
    }

    @Test
    public void testStopDrainsQueuedOperations() throws Exception {
        allocator.initialize(config, recorder, recorder);
        HierarchicalAllocatorProcess process = await(allocator.inspect(p -> p));
        CountDownLatch release = new CountDownLatch(1);
        Future<Boolean> blocked = allocator.inspect(p -> awaitQuietly(release));
        // Queued behind the blocked read, and requests a pass once it runs
        Future<Void> added = allocator.addSlave(TestConstants.AGENT_ID_1,
                ClusterTestUtils.agentInfo(TestConstants.HOSTNAME_1), ClusterTestUtils.AGENT_CAPABILITIES,
                Optional.empty(), AGENT_TOTAL, Collections.emptyMap());

        Thread stopper = new Thread(allocator::stop);
        stopper.start();
        CompletableFuture<Void> afterStop = allocator.settle();
        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS);
        while (!afterStop.isCompletedExceptionally() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
            afterStop = allocator.settle();
        }
        try {
            afterStop.join();
            Assert.fail("Expected the stopped allocator to reject new work");
        } catch (CompletionException e) {
            Assert.assertTrue(e.getCause() instanceof IllegalStateException);
        }

        release.countDown();
        stopper.join(TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS));
        Assert.assertTrue(await(blocked));
        Assert.assertNull(await(added));
        Assert.assertTrue(process.getTracker().getAgent(TestConstants.AGENT_ID_1).isPresent());
        Assert.assertFalse(process.isAllocationPending());

        try {
            await(allocator.removeSlave(TestConstants.AGENT_ID_1));
            Assert.fail("Expected the stopped allocator to reject the operation");
        } catch (ExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void addAgent() throws Exception {
        await(allocator.addSlave(TestConstants.AGENT_ID_1, ClusterTestUtils.agentInfo(TestConstants.HOSTNAME_1),
                ClusterTestUtils.AGENT_CAPABILITIES, Optional.empty(), AGENT_TOTAL, Collections.emptyMap()));
    }

    private static <T> T await(Future<T> future)
            throws InterruptedException, ExecutionException, TimeoutException {
        return future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }
}
