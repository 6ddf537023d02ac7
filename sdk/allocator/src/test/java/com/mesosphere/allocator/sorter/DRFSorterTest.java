package com.mesosphere.allocator.sorter;

import com.mesosphere.allocator.offer.ResourceQuantities;
import com.mesosphere.allocator.offer.ResourceSet;
import com.mesosphere.allocator.testutils.TestConstants;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class DRFSorterTest {

    private DRFSorter sorter;

    @Before
    public void beforeEach() {
        sorter = new DRFSorter("test", true, Collections.emptySet());
        sorter.addSlave(TestConstants.AGENT_ID_1, ResourceQuantities.parse("cpus:10;mem:100"));
    }

    @Test
    public void testEqualSharesInInsertionOrder() {
        sorter.add("b");
        sorter.add("a");
        sorter.add("c");
        Assert.assertEquals(Arrays.asList("b", "a", "c"), sorter.sort());
    }

    @Test
    public void testLowestShareFirst() {
        sorter.add("a");
        sorter.add("b");
        sorter.allocated("a", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:5"));
        sorter.allocated("b", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:1;mem:20"));

        Assert.assertEquals(0.5, sorter.getShare("a"), 0.0001);
        Assert.assertEquals(0.2, sorter.getShare("b"), 0.0001);
        Assert.assertEquals(Arrays.asList("b", "a"), sorter.sort());

        sorter.unallocated("a", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:4"));
        Assert.assertEquals(Arrays.asList("a", "b"), sorter.sort());
    }

    @Test
    public void testWeightedShares() {
        sorter.add("a");
        sorter.add("b");
        sorter.allocated("a", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:4"));
        sorter.allocated("b", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:3"));
        Assert.assertEquals(Arrays.asList("b", "a"), sorter.sort());

        sorter.updateWeight("a", 2.0);
        Assert.assertEquals(0.2, sorter.getShare("a"), 0.0001);
        Assert.assertEquals(Arrays.asList("a", "b"), sorter.sort());
    }

    @Test
    public void testExcludedResourceNames() {
        DRFSorter excluding = new DRFSorter("test", false, Collections.singleton("gpus"));
        excluding.addSlave(TestConstants.AGENT_ID_1, ResourceQuantities.parse("cpus:10;gpus:1"));
        excluding.add("a");
        excluding.add("b");
        excluding.allocated("a", TestConstants.AGENT_ID_1, ResourceSet.parse("gpus:1"));
        excluding.allocated("b", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:1"));

        Assert.assertEquals(0.0, excluding.getShare("a"), 0.0);
        Assert.assertEquals(Arrays.asList("a", "b"), excluding.sort());
    }

    @Test
    public void testSharesFollowClusterTotal() {
        sorter.add("a");
        sorter.add("b");
        sorter.allocated("a", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:4"));
        sorter.allocated("b", TestConstants.AGENT_ID_1, ResourceSet.parse("mem:50"));
        Assert.assertEquals(Arrays.asList("a", "b"), sorter.sort());

        sorter.addSlave(TestConstants.AGENT_ID_2, ResourceQuantities.parse("mem:100"));
        Assert.assertEquals(ResourceQuantities.parse("cpus:10;mem:200"), sorter.totalScalarQuantities());
        Assert.assertEquals(Arrays.asList("b", "a"), sorter.sort());

        sorter.removeSlave(TestConstants.AGENT_ID_2);
        Assert.assertEquals(Arrays.asList("a", "b"), sorter.sort());
    }

    @Test
    public void testAddSlaveReplacesPreviousTotal() {
        sorter.addSlave(TestConstants.AGENT_ID_1, ResourceQuantities.parse("cpus:20;mem:100"));
        Assert.assertEquals(ResourceQuantities.parse("cpus:20;mem:100"), sorter.totalScalarQuantities());
    }

    @Test
    public void testHierarchy() {
        sorter.add("eng/web");
        sorter.add("eng/api");
        sorter.add("ops");
        sorter.allocated("eng/web", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:3"));
        sorter.allocated("ops", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:2"));

        // eng holds 0.3 of the cluster as a whole, so ops goes first; within eng, api has nothing yet.
        Assert.assertEquals(Arrays.asList("ops", "eng/api", "eng/web"), sorter.sort());
        Assert.assertEquals(ResourceQuantities.parse("cpus:3"), sorter.allocationScalarQuantities("eng"));
        Assert.assertFalse(sorter.contains("eng"));
        Assert.assertEquals(3, sorter.count());
    }

    @Test
    public void testClientWithChildrenCompetesAsLeaf() {
        sorter.add("eng");
        sorter.add("eng/web");
        sorter.allocated("eng", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:1"));
        sorter.allocated("eng/web", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:2"));

        Assert.assertEquals(Arrays.asList("eng", "eng/web"), sorter.sort());
        Assert.assertEquals(ResourceQuantities.parse("cpus:3"), sorter.allocationScalarQuantities("eng"));

        sorter.remove("eng");
        Assert.assertEquals(ResourceQuantities.parse("cpus:2"), sorter.allocationScalarQuantities("eng"));
        Assert.assertEquals(Collections.singletonList("eng/web"), sorter.sort());
    }

    @Test
    public void testInnerNodesPrunedOnRemove() {
        sorter.add("eng/web");
        sorter.allocated("eng/web", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:3"));
        sorter.remove("eng/web");

        Assert.assertTrue(sorter.allocationScalarQuantities("eng").isEmpty());
        Assert.assertTrue(sorter.sort().isEmpty());
        Assert.assertEquals(0, sorter.count());

        // Re-adding works from scratch
        sorter.add("eng/web");
        Assert.assertTrue(sorter.allocation("eng/web").isEmpty());
    }

    @Test
    public void testNonHierarchicalNamesAreOpaque() {
        DRFSorter flat = new DRFSorter("test", false, Collections.emptySet());
        flat.add("eng/web");
        Assert.assertTrue(flat.contains("eng/web"));
        Assert.assertTrue(flat.allocationScalarQuantities("eng").isEmpty());
    }

    @Test
    public void testDeactivatedClientsNotSorted() {
        sorter.add("a");
        sorter.add("b");
        sorter.deactivate("a");
        Assert.assertEquals(Collections.singletonList("b"), sorter.sort());
        Assert.assertTrue(sorter.contains("a"));

        sorter.activate("a");
        Assert.assertEquals(Arrays.asList("a", "b"), sorter.sort());
    }

    @Test
    public void testUpdateReplacesAllocation() {
        sorter.add("a");
        sorter.allocated("a", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:4;mem:10"));
        sorter.update("a", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:4"), ResourceSet.parse("cpus(a):4"));

        Assert.assertEquals(
                ResourceSet.parse("cpus(a):4;mem:10"), sorter.allocation("a").get(TestConstants.AGENT_ID_1));
        Assert.assertEquals(ResourceQuantities.parse("cpus:4;mem:10"), sorter.allocationScalarQuantities("a"));
    }

    @Test
    public void testAllocationDroppedOnceEmpty() {
        sorter.add("a");
        sorter.allocated("a", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:1"));
        sorter.unallocated("a", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:1"));
        Assert.assertTrue(sorter.allocation("a").isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateAddRejected() {
        sorter.add("a");
        sorter.add("a");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownClientRejected() {
        sorter.allocated("missing", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:1"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnallocatingMoreThanAllocatedRejected() {
        sorter.add("a");
        sorter.allocated("a", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:1"));
        sorter.unallocated("a", TestConstants.AGENT_ID_1, ResourceSet.parse("cpus:2"));
    }
}
