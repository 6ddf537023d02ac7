package com.mesosphere.allocator.offer;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.mesos.Protos.Value.Range;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Tests for {@link RangeAlgorithms}.
 */
public class RangeAlgorithmsTest {

    @Test
    public void testMergingOverlappingRanges() {
        List<Range> mergedRanges = RangeAlgorithms.mergeRanges(
                Arrays.asList(getRange(1, 3)), Arrays.asList(getRange(2, 4)));

        assertEquals(1, mergedRanges.size());
        assertEquals(1, mergedRanges.get(0).getBegin());
        assertEquals(4, mergedRanges.get(0).getEnd());
    }

    @Test
    public void testMergingNonOverlappingRanges() {
        List<Range> mergedRanges = RangeAlgorithms.mergeRanges(
                Arrays.asList(getRange(1, 3)), Arrays.asList(getRange(5, 7)));

        assertEquals(2, mergedRanges.size());
        assertEquals(3, mergedRanges.get(0).getEnd());
        assertEquals(5, mergedRanges.get(1).getBegin());
    }

    @Test
    public void testMergingAdjacentRangesCoalesces() {
        List<Range> mergedRanges = RangeAlgorithms.mergeRanges(
                Arrays.asList(getRange(1, 3)), Arrays.asList(getRange(4, 6)));

        assertEquals(Arrays.asList(getRange(1, 6)), mergedRanges);
    }

    @Test
    public void testSubtractRanges() {
        List<Range> difference = RangeAlgorithms.subtractRanges(
                Arrays.asList(getRange(1, 10)), Arrays.asList(getRange(4, 6)));

        assertEquals(Arrays.asList(getRange(1, 3), getRange(7, 10)), difference);
    }

    @Test
    public void testSubtractEverything() {
        List<Range> difference = RangeAlgorithms.subtractRanges(
                Arrays.asList(getRange(1, 3)), Arrays.asList(getRange(0, 5)));

        assertTrue(difference.isEmpty());
    }

    @Test
    public void testIntersectRanges() {
        List<Range> intersection = RangeAlgorithms.intersectRanges(
                Arrays.asList(getRange(1, 5), getRange(10, 20)), Arrays.asList(getRange(4, 12)));

        assertEquals(Arrays.asList(getRange(4, 5), getRange(10, 12)), intersection);
    }

    @Test
    public void testRangesContain() {
        List<Range> container = Arrays.asList(getRange(31000, 32000));

        assertTrue(RangeAlgorithms.rangesContain(container, Arrays.asList(getRange(31000, 31010))));
        assertTrue(RangeAlgorithms.rangesContain(container, Collections.emptyList()));
        assertFalse(RangeAlgorithms.rangesContain(container, Arrays.asList(getRange(31990, 32001))));
    }

    @Test
    public void testRangesEqualIgnoresSplits() {
        assertTrue(RangeAlgorithms.rangesEqual(
                Arrays.asList(getRange(1, 3), getRange(4, 5)), Arrays.asList(getRange(1, 5))));
        assertFalse(RangeAlgorithms.rangesEqual(Arrays.asList(getRange(1, 3)), Arrays.asList(getRange(1, 4))));
    }

    @Test
    public void testCountValues() {
        assertEquals(4, RangeAlgorithms.countValues(Arrays.asList(getRange(1, 3), getRange(5, 5))));
        assertEquals(0, RangeAlgorithms.countValues(Collections.emptyList()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvertedRangeRejected() {
        RangeAlgorithms.countValues(Arrays.asList(getRange(5, 1)));
    }

    @Test
    public void testBoundsBeyondIntegerRange() {
        long base = 3000000000L;
        List<Range> container = Arrays.asList(getRange(base, base + 10));

        assertEquals(Arrays.asList(getRange(base + 1, base + 10)),
                RangeAlgorithms.subtractRanges(container, Arrays.asList(getRange(base, base))));
        assertFalse(RangeAlgorithms.rangesContain(
                Arrays.asList(getRange(0, 0)), Arrays.asList(getRange(4294967296L, 4294967296L))));
        assertEquals(11, RangeAlgorithms.countValues(container));
    }

    @Test
    public void testRangeEndingAtLongMax() {
        List<Range> upper = Arrays.asList(getRange(Long.MAX_VALUE - 1, Long.MAX_VALUE));

        assertEquals(upper, RangeAlgorithms.mergeRanges(upper, Collections.emptyList()));
        assertEquals(Arrays.asList(getRange(Long.MAX_VALUE, Long.MAX_VALUE)),
                RangeAlgorithms.subtractRanges(upper, Arrays.asList(getRange(0, Long.MAX_VALUE - 1))));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBoundsBeyondLongRangeRejected() {
        // uint64 values above Long.MAX_VALUE arrive as negative longs
        RangeAlgorithms.countValues(Arrays.asList(getRange(1, -1)));
    }

    private static Range getRange(long begin, long end) {
        return Range.newBuilder().setBegin(begin).setEnd(end).build();
    }
}
