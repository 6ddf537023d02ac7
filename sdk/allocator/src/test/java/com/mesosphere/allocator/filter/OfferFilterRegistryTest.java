package com.mesosphere.allocator.filter;

import com.mesosphere.allocator.offer.ResourceSet;
import com.mesosphere.allocator.testutils.TestClock;
import com.mesosphere.allocator.testutils.TestConstants;
import org.apache.mesos.Protos;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;

public class OfferFilterRegistryTest {

    private TestClock clock;
    private OfferFilterRegistry registry;

    @Before
    public void beforeEach() {
        clock = new TestClock();
        registry = new OfferFilterRegistry(clock);
    }

    @Test
    public void testFilterMatchesContainedResources() {
        registry.addFilter(TestConstants.FRAMEWORK_ID_A, Optional.of(TestConstants.AGENT_ID_1),
                Optional.of(TestConstants.ROLE), Optional.of(ResourceSet.parse("cpus:2;mem:1024")), inSeconds(30));

        Assert.assertTrue(isFiltered(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_1, "cpus:1;mem:512"));
        // Tags on the candidate are ignored
        Assert.assertTrue(registry.isFiltered(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_1,
                TestConstants.ROLE, ResourceSet.parse("cpus:2").allocatedTo(TestConstants.ROLE)));
        // More than what was refused
        Assert.assertFalse(isFiltered(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_1, "cpus:3"));
        Assert.assertFalse(isFiltered(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_1, "cpus:1;disk:10"));
        // Different scope
        Assert.assertFalse(isFiltered(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_2, "cpus:1"));
        Assert.assertFalse(isFiltered(TestConstants.FRAMEWORK_ID_B, TestConstants.AGENT_ID_1, "cpus:1"));
        Assert.assertFalse(registry.isFiltered(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_1,
                TestConstants.OTHER_ROLE, ResourceSet.parse("cpus:1")));
    }

    @Test
    public void testUnscopedFilterMatchesEverything() {
        registry.addFilter(TestConstants.FRAMEWORK_ID_A,
                Optional.empty(), Optional.empty(), Optional.empty(), inSeconds(30));
        Assert.assertTrue(isFiltered(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_2, "cpus:100;gpus:1"));
    }

    @Test
    public void testFiltersExpire() {
        registry.addFilter(TestConstants.FRAMEWORK_ID_A, Optional.of(TestConstants.AGENT_ID_1),
                Optional.of(TestConstants.ROLE), Optional.of(ResourceSet.parse("cpus:2")), inSeconds(30));
        registry.addFilter(TestConstants.FRAMEWORK_ID_B, Optional.of(TestConstants.AGENT_ID_1),
                Optional.of(TestConstants.ROLE), Optional.of(ResourceSet.parse("cpus:2")), inSeconds(60));

        clock.advance(Duration.ofSeconds(29));
        Assert.assertTrue(isFiltered(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_1, "cpus:1"));
        Assert.assertEquals(0, registry.expireOlderThan(clock.instant()));

        clock.advance(Duration.ofSeconds(1));
        Assert.assertEquals(1, registry.expireOlderThan(clock.instant()));
        Assert.assertFalse(isFiltered(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_1, "cpus:1"));
        Assert.assertEquals(1, registry.count());

        // Lazily dropped when checked
        clock.advance(Duration.ofSeconds(30));
        Assert.assertFalse(isFiltered(TestConstants.FRAMEWORK_ID_B, TestConstants.AGENT_ID_1, "cpus:1"));
        Assert.assertEquals(0, registry.count());
    }

    @Test
    public void testClearByRole() {
        registry.addFilter(TestConstants.FRAMEWORK_ID_A, Optional.of(TestConstants.AGENT_ID_1),
                Optional.of(TestConstants.ROLE), Optional.empty(), inSeconds(30));
        registry.addFilter(TestConstants.FRAMEWORK_ID_A, Optional.of(TestConstants.AGENT_ID_1),
                Optional.of(TestConstants.OTHER_ROLE), Optional.empty(), inSeconds(30));
        registry.addFilter(TestConstants.FRAMEWORK_ID_A, Optional.of(TestConstants.AGENT_ID_1),
                Optional.empty(), Optional.empty(), inSeconds(30));

        Assert.assertEquals(2, registry.clear(TestConstants.FRAMEWORK_ID_A, Collections.singleton(TestConstants.ROLE)));
        Assert.assertEquals(1, registry.count());
        Assert.assertEquals(1, registry.clear(TestConstants.FRAMEWORK_ID_A, Collections.emptySet()));
        Assert.assertEquals(0, registry.clear(TestConstants.FRAMEWORK_ID_A, Collections.emptySet()));
    }

    @Test
    public void testRemoveAgentAndFramework() {
        registry.addFilter(TestConstants.FRAMEWORK_ID_A, Optional.of(TestConstants.AGENT_ID_1),
                Optional.empty(), Optional.empty(), inSeconds(30));
        registry.addFilter(TestConstants.FRAMEWORK_ID_A, Optional.empty(),
                Optional.empty(), Optional.empty(), inSeconds(30));
        registry.addInverseFilter(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_1, inSeconds(30));
        registry.addFilter(TestConstants.FRAMEWORK_ID_B, Optional.of(TestConstants.AGENT_ID_2),
                Optional.empty(), Optional.empty(), inSeconds(30));

        registry.removeAgent(TestConstants.AGENT_ID_1);
        Assert.assertEquals(2, registry.count());
        Assert.assertEquals(0, registry.inverseCount());

        registry.removeFramework(TestConstants.FRAMEWORK_ID_B);
        Assert.assertEquals(1, registry.count());
    }

    @Test
    public void testInverseFilters() {
        registry.addInverseFilter(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_1, inSeconds(10));
        Assert.assertTrue(registry.isInverseFiltered(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_1));
        Assert.assertFalse(registry.isInverseFiltered(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_2));
        Assert.assertFalse(registry.isInverseFiltered(TestConstants.FRAMEWORK_ID_B, TestConstants.AGENT_ID_1));

        clock.advance(Duration.ofSeconds(10));
        Assert.assertFalse(registry.isInverseFiltered(TestConstants.FRAMEWORK_ID_A, TestConstants.AGENT_ID_1));
        Assert.assertEquals(0, registry.inverseCount());
    }

    private boolean isFiltered(Protos.FrameworkID frameworkId, Protos.SlaveID agentId, String text) {
        return registry.isFiltered(frameworkId, agentId, TestConstants.ROLE, ResourceSet.parse(text));
    }

    private Instant inSeconds(long seconds) {
        return clock.instant().plusSeconds(seconds);
    }
}
