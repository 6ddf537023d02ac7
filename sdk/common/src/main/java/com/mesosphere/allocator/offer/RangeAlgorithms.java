package com.mesosphere.allocator.offer;

import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;
import org.apache.mesos.Protos.Value.Range;

import java.util.ArrayList;
import java.util.List;

/**
 * Set arithmetic over Mesos range lists, e.g. the {@code ports} resource. Ranges are flattened into a canonical
 * {@link RangeSet} over longs, so overlapping or adjacent input ranges are always coalesced in the results.
 *
 * <p>Bounds are the full non-negative long range. Mesos encodes them as uint64, and values which do not fit a signed
 * long are rejected rather than wrapped.
 */
public final class RangeAlgorithms {

    private RangeAlgorithms() {
        // do not instantiate
    }

    /**
     * Combines and flattens the provided sets of ranges into a unified set.
     */
    public static List<Range> mergeRanges(List<Range> r1, List<Range> r2) {
        RangeSet<Long> merged = toRangeSet(r1);
        merged.addAll(toRangeSet(r2));
        return toRanges(merged);
    }

    /**
     * Removes the range intervals listed in {@code subtrahend} from {@code minuend}.
     */
    public static List<Range> subtractRanges(List<Range> minuend, List<Range> subtrahend) {
        RangeSet<Long> difference = toRangeSet(minuend);
        difference.removeAll(toRangeSet(subtrahend));
        return toRanges(difference);
    }

    /**
     * Returns the range intervals which are present in both of the provided lists.
     */
    public static List<Range> intersectRanges(List<Range> r1, List<Range> r2) {
        RangeSet<Long> intersection = toRangeSet(r1);
        intersection.removeAll(toRangeSet(r2).complement());
        return toRanges(intersection);
    }

    /**
     * Returns whether every value in {@code contained} is also present in {@code container}.
     */
    public static boolean rangesContain(List<Range> container, List<Range> contained) {
        return toRangeSet(container).enclosesAll(toRangeSet(contained));
    }

    /**
     * Returns whether the provided sets of ranges are equivalent when any overlaps are flattened.
     */
    public static boolean rangesEqual(List<Range> list1, List<Range> list2) {
        return toRangeSet(list1).equals(toRangeSet(list2));
    }

    /**
     * Returns the number of distinct values covered by the provided ranges, e.g. {@code [1-3, 5-5]} covers 4 values.
     */
    public static long countValues(List<Range> ranges) {
        long count = 0;
        for (Range range : toRanges(toRangeSet(ranges))) {
            count += range.getEnd() - range.getBegin() + 1;
        }
        return count;
    }

    private static RangeSet<Long> toRangeSet(List<Range> ranges) {
        RangeSet<Long> rangeSet = TreeRangeSet.create();
        for (Range range : ranges) {
            if (range.getBegin() < 0 || range.getEnd() < 0) {
                throw new IllegalArgumentException(String.format(
                        "Range bounds exceed %d: [%s-%s]", Long.MAX_VALUE,
                        Long.toUnsignedString(range.getBegin()), Long.toUnsignedString(range.getEnd())));
            }
            if (range.getBegin() > range.getEnd()) {
                throw new IllegalArgumentException(String.format(
                        "Invalid range with begin > end: [%d-%d]", range.getBegin(), range.getEnd()));
            }
            rangeSet.add(com.google.common.collect.Range.closed(range.getBegin(), range.getEnd())
                    .canonical(DiscreteDomain.longs()));
        }
        return rangeSet;
    }

    private static List<Range> toRanges(RangeSet<Long> rangeSet) {
        List<Range> ranges = new ArrayList<>();
        for (com.google.common.collect.Range<Long> range : rangeSet.asRanges()) {
            // Canonical ranges are closed below and open above, or unbounded above at Long.MAX_VALUE.
            com.google.common.collect.Range<Long> canonical = range.canonical(DiscreteDomain.longs());
            long end = canonical.hasUpperBound() ? canonical.upperEndpoint() - 1 : Long.MAX_VALUE;
            ranges.add(Range.newBuilder().setBegin(canonical.lowerEndpoint()).setEnd(end).build());
        }
        return ranges;
    }
}
