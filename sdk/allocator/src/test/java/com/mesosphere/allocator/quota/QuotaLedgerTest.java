package com.mesosphere.allocator.quota;

import com.mesosphere.allocator.allocation.AllocatorError;
import com.mesosphere.allocator.allocation.AllocatorException;
import com.mesosphere.allocator.offer.ResourceQuantities;
import com.mesosphere.allocator.offer.ResourceSet;
import com.mesosphere.allocator.roles.RoleRegistry;
import com.mesosphere.allocator.testutils.TestConstants;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

public class QuotaLedgerTest {

    private static final ResourceQuantities CLUSTER = ResourceQuantities.parse("cpus:10;mem:10240");

    private RoleRegistry roles;
    private QuotaLedger ledger;

    @Before
    public void beforeEach() {
        roles = new RoleRegistry(1.0);
        ledger = new QuotaLedger(roles);
    }

    @Test
    public void testSetAndRemoveQuota() throws AllocatorException {
        Quota quota = Quota.guarantee(ResourceQuantities.parse("cpus:2"));
        ledger.setQuota(TestConstants.ROLE, quota, CLUSTER);

        Assert.assertEquals(Optional.of(quota), ledger.getQuota(TestConstants.ROLE));
        Assert.assertTrue(roles.get(TestConstants.ROLE).get().hasQuota());

        Assert.assertEquals(Optional.of(quota), ledger.removeQuota(TestConstants.ROLE));
        Assert.assertFalse(ledger.hasQuota(TestConstants.ROLE));
        Assert.assertFalse(roles.contains(TestConstants.ROLE));
        Assert.assertEquals(Optional.empty(), ledger.removeQuota(TestConstants.ROLE));
    }

    @Test
    public void testGuaranteesMustFitCluster() throws AllocatorException {
        ledger.setQuota(TestConstants.ROLE, Quota.guarantee(ResourceQuantities.parse("cpus:6")), CLUSTER);
        try {
            ledger.setQuota(TestConstants.OTHER_ROLE, Quota.guarantee(ResourceQuantities.parse("cpus:5")), CLUSTER);
            Assert.fail("Expected guarantees to exceed cluster");
        } catch (AllocatorException e) {
            Assert.assertEquals(AllocatorError.Reason.VALIDATION, e.getReason());
        }
        Assert.assertFalse(ledger.hasQuota(TestConstants.OTHER_ROLE));

        // Replacing an existing quota only counts the new guarantee
        ledger.setQuota(TestConstants.ROLE, Quota.guarantee(ResourceQuantities.parse("cpus:10")), CLUSTER);
    }

    @Test
    public void testNestedGuaranteesNotDoubleCounted() throws AllocatorException {
        ledger.setQuota(TestConstants.PARENT_ROLE, Quota.guarantee(ResourceQuantities.parse("cpus:8")), CLUSTER);
        ledger.setQuota(TestConstants.CHILD_ROLE, Quota.guarantee(ResourceQuantities.parse("cpus:8")), CLUSTER);
        Assert.assertTrue(ledger.hasQuota(TestConstants.CHILD_ROLE));
    }

    @Test
    public void testLimitBelowGuaranteeRejected() {
        Quota quota = new Quota(
                ResourceQuantities.parse("cpus:2"), Optional.of(ResourceQuantities.parse("cpus:1")));
        try {
            ledger.setQuota(TestConstants.ROLE, quota, CLUSTER);
            Assert.fail("Expected limit below guarantee to be rejected");
        } catch (AllocatorException e) {
            Assert.assertEquals(AllocatorError.Reason.VALIDATION, e.getReason());
        }
    }

    @Test
    public void testUnsatisfiedGuarantee() throws AllocatorException {
        ledger.setQuota(TestConstants.ROLE, Quota.guarantee(ResourceQuantities.parse("cpus:2;mem:1024")), CLUSTER);
        Assert.assertEquals(ResourceQuantities.parse("cpus:2;mem:1024"),
                ledger.getUnsatisfiedGuarantee(TestConstants.ROLE));

        ledger.updateConsumption(TestConstants.ROLE, ResourceQuantities.parse("cpus:3;mem:512"));
        Assert.assertEquals(ResourceQuantities.parse("mem:512"), ledger.getUnsatisfiedGuarantee(TestConstants.ROLE));
        Assert.assertEquals(ResourceQuantities.parse("mem:512"), ledger.getRequiredHeadroom());

        Assert.assertTrue(ledger.getUnsatisfiedGuarantee(TestConstants.OTHER_ROLE).isEmpty());
    }

    @Test
    public void testRequiredHeadroomCountsNestedGuaranteesOnce() throws AllocatorException {
        ledger.setQuota(TestConstants.PARENT_ROLE, Quota.guarantee(ResourceQuantities.parse("cpus:3")), CLUSTER);
        ledger.setQuota(TestConstants.CHILD_ROLE, Quota.guarantee(ResourceQuantities.parse("cpus:3")), CLUSTER);
        ledger.setQuota(TestConstants.ROLE, Quota.guarantee(ResourceQuantities.parse("cpus:2")), CLUSTER);
        Assert.assertEquals(ResourceQuantities.parse("cpus:5"), ledger.getRequiredHeadroom());

        ledger.updateConsumption(TestConstants.PARENT_ROLE, ResourceQuantities.parse("cpus:2"));
        ledger.updateConsumption(TestConstants.CHILD_ROLE, ResourceQuantities.parse("cpus:2"));
        Assert.assertEquals(ResourceQuantities.parse("cpus:3"), ledger.getRequiredHeadroom());

        // Allocating to a role never holds capacity back from its own guarantee or its ancestors'
        Assert.assertEquals(ResourceQuantities.parse("cpus:2"),
                ledger.getRequiredHeadroom(Optional.of(TestConstants.CHILD_ROLE)));
        Assert.assertEquals(ResourceQuantities.parse("cpus:3"),
                ledger.getRequiredHeadroom(Optional.of(TestConstants.PARENT_ROLE)));
        Assert.assertEquals(ResourceQuantities.parse("cpus:1"),
                ledger.getRequiredHeadroom(Optional.of(TestConstants.ROLE)));
    }

    @Test
    public void testNestedGuaranteesAboveAncestorAreHeldBack() throws AllocatorException {
        ledger.setQuota(TestConstants.PARENT_ROLE, Quota.guarantee(ResourceQuantities.parse("cpus:2")), CLUSTER);
        ledger.setQuota(TestConstants.CHILD_ROLE, Quota.guarantee(ResourceQuantities.parse("cpus:3")), CLUSTER);
        ledger.setQuota("eng/api", Quota.guarantee(ResourceQuantities.parse("cpus:1;mem:512")), CLUSTER);

        Assert.assertEquals(ResourceQuantities.parse("cpus:4;mem:512"), ledger.getRequiredHeadroom());
    }

    @Test
    public void testConsumptionOnlyTrackedForQuotaRoles() {
        ledger.updateConsumption(TestConstants.ROLE, ResourceQuantities.parse("cpus:3"));
        Assert.assertTrue(ledger.getConsumption(TestConstants.ROLE).isEmpty());
    }

    @Test
    public void testLimitHeadroomAcrossAncestors() throws AllocatorException {
        ledger.setQuota(TestConstants.PARENT_ROLE,
                new Quota(ResourceQuantities.empty(), Optional.of(ResourceQuantities.parse("cpus:4;mem:4096"))),
                CLUSTER);
        ledger.setQuota(TestConstants.CHILD_ROLE,
                new Quota(ResourceQuantities.empty(), Optional.of(ResourceQuantities.parse("cpus:3"))),
                CLUSTER);
        ledger.updateConsumption(TestConstants.PARENT_ROLE, ResourceQuantities.parse("cpus:2;mem:4096"));
        ledger.updateConsumption(TestConstants.CHILD_ROLE, ResourceQuantities.parse("cpus:0.5"));

        Map<String, Double> headroom = ledger.getLimitHeadroom(TestConstants.CHILD_ROLE);
        Assert.assertEquals(2.0, headroom.get("cpus"), 0.0);
        Assert.assertEquals(0.0, headroom.get("mem"), 0.0);

        ResourceSet limited = ledger.applyLimit(
                TestConstants.CHILD_ROLE, ResourceSet.parse("cpus:4;mem:1024;disk:100"));
        Assert.assertEquals(ResourceSet.parse("cpus:2;disk:100"), limited);

        Assert.assertTrue(ledger.getLimitHeadroom(TestConstants.OTHER_ROLE).isEmpty());
        ResourceSet unlimited = ResourceSet.parse("cpus:4");
        Assert.assertSame(unlimited, ledger.applyLimit(TestConstants.OTHER_ROLE, unlimited));
    }

    @Test
    public void testReservations() {
        ledger.setAgentReservations(TestConstants.AGENT_ID_1, ResourceSet.parse("cpus(test-role):1;mem(eng):128"));
        ledger.setAgentReservations(TestConstants.AGENT_ID_2, ResourceSet.parse("cpus(test-role):2"));

        Assert.assertEquals(2, ledger.getReservations(TestConstants.ROLE).size());
        Assert.assertTrue(roles.get(TestConstants.ROLE).get().hasReservations());
        Assert.assertTrue(roles.contains("eng"));

        ledger.setAgentReservations(TestConstants.AGENT_ID_1, ResourceSet.parse("cpus(test-role):1"));
        Assert.assertFalse(roles.contains("eng"));
        Assert.assertEquals(Collections.singleton(TestConstants.ROLE), ledger.getReservedRoles());

        ledger.removeAgent(TestConstants.AGENT_ID_1);
        ledger.removeAgent(TestConstants.AGENT_ID_2);
        Assert.assertTrue(ledger.getReservedRoles().isEmpty());
        Assert.assertFalse(roles.contains(TestConstants.ROLE));
    }
}
