package com.mesosphere.allocator.offer;

import com.google.common.collect.ImmutableMap;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

public class ResourceQuantitiesTest {

    @Test
    public void testZeroAmountsDropped() {
        ResourceQuantities quantities = ResourceQuantities.of(ImmutableMap.of("cpus", 0.0, "mem", 32.0));

        Assert.assertEquals(1, quantities.names().size());
        Assert.assertEquals(0.0, quantities.get("cpus"), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeAmountRejected() {
        ResourceQuantities.of("cpus", -1);
    }

    @Test
    public void testMinusClampedAtZero() {
        ResourceQuantities unsatisfied = ResourceQuantities.parse("cpus:2;mem:100")
                .minusClampedAtZero(ResourceQuantities.parse("cpus:3;mem:40;gpus:1"));

        Assert.assertEquals(ResourceQuantities.parse("mem:60"), unsatisfied);
    }

    @Test
    public void testContains() {
        ResourceQuantities total = ResourceQuantities.parse("cpus:4;mem:4096");

        Assert.assertTrue(total.contains(ResourceQuantities.parse("cpus:4")));
        Assert.assertFalse(total.contains(ResourceQuantities.parse("cpus:1;gpus:1")));
        Assert.assertTrue(total.contains(ResourceQuantities.empty()));
    }

    @Test
    public void testSumAndMin() {
        ResourceQuantities sum = ResourceQuantities.sum(Arrays.asList(
                ResourceQuantities.parse("cpus:1"), ResourceQuantities.parse("cpus:2;mem:5")));

        Assert.assertEquals(ResourceQuantities.parse("cpus:3;mem:5"), sum);
        Assert.assertEquals(ResourceQuantities.parse("cpus:1"), sum.min(ResourceQuantities.parse("cpus:1")));
    }

    @Test
    public void testMax() {
        ResourceQuantities left = ResourceQuantities.parse("cpus:3;mem:5");
        Assert.assertEquals(ResourceQuantities.parse("cpus:3;mem:8;disk:1"),
                left.max(ResourceQuantities.parse("cpus:1;mem:8;disk:1")));
        Assert.assertEquals(left, left.max(ResourceQuantities.empty()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseRejectsRanges() {
        ResourceQuantities.parse("ports:[1-2]");
    }

    @Test
    public void testToString() {
        Assert.assertEquals("cpus:1.0;mem:32.0", ResourceQuantities.parse("mem:32;cpus:1").toString());
    }
}
