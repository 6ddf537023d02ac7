package com.mesosphere.allocator.offer;

import org.apache.mesos.Protos.Resource;
import org.apache.mesos.Protos.Value;
import org.apache.mesos.Protos.Value.Type;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Utilities for manipulating Value protobufs.
 *
 * <p>Scalars follow Mesos fixed point semantics: every result is rounded to {@link Constants#SCALAR_PRECISION_DIGITS}
 * decimal digits, so that e.g. {@code 0.1 + 0.2 == 0.3}.
 */
public class ValueUtils {

    private static final double SCALAR_FACTOR = Math.pow(10, Constants.SCALAR_PRECISION_DIGITS);

    private ValueUtils() {
        // do not instantiate
    }

    public static Value getValue(Resource resource) {
        Type type = resource.getType();
        Value.Builder builder = Value.newBuilder();
        builder.setType(type);

        switch (type) {
            case SCALAR:
                return builder.setScalar(scalar(resource.getScalar().getValue())).build();
            case RANGES:
                return builder.setRanges(resource.getRanges()).build();
            case SET:
                return builder.setSet(resource.getSet()).build();
            default:
                throw new IllegalArgumentException("Unsupported resource type: " + type);
        }
    }

    public static Value getZero(Type type) {
        switch (type) {
            case SCALAR:
                return Value.newBuilder().setType(type).setScalar(scalar(0)).build();
            case RANGES:
                return Value.newBuilder().setType(type).setRanges(Value.Ranges.getDefaultInstance()).build();
            case SET:
                return Value.newBuilder().setType(type).setSet(Value.Set.getDefaultInstance()).build();
            default:
                throw new IllegalArgumentException("Unsupported value type: " + type);
        }
    }

    public static Value add(Value val1, Value val2) {
        Type type = checkSameType(val1, val2);
        switch (type) {
            case SCALAR:
                return toValue(round(val1.getScalar().getValue() + val2.getScalar().getValue()));
            case RANGES:
                return Value.newBuilder().setType(type).setRanges(Value.Ranges.newBuilder().addAllRange(
                        RangeAlgorithms.mergeRanges(val1.getRanges().getRangeList(), val2.getRanges().getRangeList())))
                        .build();
            case SET:
                Set<String> items = new TreeSet<>(val1.getSet().getItemList());
                items.addAll(val2.getSet().getItemList());
                return toSetValue(items);
            default:
                throw new IllegalArgumentException("Unsupported value type: " + type);
        }
    }

    /**
     * Subtracts {@code val2} from {@code val1}. Callers must check {@link #contains(Value, Value)} first: this method
     * throws rather than returning a negative or partial result.
     *
     * @throws IllegalArgumentException if {@code val1} does not contain {@code val2}
     */
    public static Value subtract(Value val1, Value val2) {
        if (!contains(val1, val2)) {
            throw new IllegalArgumentException(String.format(
                    "Cannot subtract %s from %s: result would be negative", toString(val2), toString(val1)));
        }
        Type type = val1.getType();
        switch (type) {
            case SCALAR:
                return toValue(round(val1.getScalar().getValue() - val2.getScalar().getValue()));
            case RANGES:
                return Value.newBuilder().setType(type).setRanges(Value.Ranges.newBuilder().addAllRange(
                        RangeAlgorithms.subtractRanges(
                                val1.getRanges().getRangeList(), val2.getRanges().getRangeList())))
                        .build();
            case SET:
                Set<String> items = new TreeSet<>(val1.getSet().getItemList());
                items.removeAll(val2.getSet().getItemList());
                return toSetValue(items);
            default:
                throw new IllegalArgumentException("Unsupported value type: " + type);
        }
    }

    /**
     * Returns the portion of the two values which is present in both.
     */
    public static Value intersect(Value val1, Value val2) {
        Type type = checkSameType(val1, val2);
        switch (type) {
            case SCALAR:
                return toValue(Math.min(val1.getScalar().getValue(), val2.getScalar().getValue()));
            case RANGES:
                return Value.newBuilder().setType(type).setRanges(Value.Ranges.newBuilder().addAllRange(
                        RangeAlgorithms.intersectRanges(
                                val1.getRanges().getRangeList(), val2.getRanges().getRangeList())))
                        .build();
            case SET:
                Set<String> items = new TreeSet<>(val1.getSet().getItemList());
                items.retainAll(val2.getSet().getItemList());
                return toSetValue(items);
            default:
                throw new IllegalArgumentException("Unsupported value type: " + type);
        }
    }

    /**
     * Returns whether {@code container} includes all of {@code contained}: a larger or equal scalar, or a superset of
     * ranges or set items.
     */
    public static boolean contains(Value container, Value contained) {
        Type type = checkSameType(container, contained);
        switch (type) {
            case SCALAR:
                return round(container.getScalar().getValue()) >= round(contained.getScalar().getValue());
            case RANGES:
                return RangeAlgorithms.rangesContain(
                        container.getRanges().getRangeList(), contained.getRanges().getRangeList());
            case SET:
                return new LinkedHashSet<>(container.getSet().getItemList())
                        .containsAll(contained.getSet().getItemList());
            default:
                throw new IllegalArgumentException("Unsupported value type: " + type);
        }
    }

    public static boolean equal(Value val1, Value val2) {
        return contains(val1, val2) && contains(val2, val1);
    }

    /**
     * Returns whether the value holds nothing: a zero (or negative) scalar, no ranges, or no set items.
     */
    public static boolean isEmpty(Value value) {
        switch (value.getType()) {
            case SCALAR:
                return round(value.getScalar().getValue()) <= 0;
            case RANGES:
                return RangeAlgorithms.countValues(value.getRanges().getRangeList()) == 0;
            case SET:
                return value.getSet().getItemCount() == 0;
            default:
                throw new IllegalArgumentException("Unsupported value type: " + value.getType());
        }
    }

    /**
     * Returns a scalar value for the provided amount, rounded to the Mesos fixed point precision.
     */
    public static Value toValue(double scalar) {
        return Value.newBuilder().setType(Type.SCALAR).setScalar(scalar(scalar)).build();
    }

    public static double round(double value) {
        return Math.round(value * SCALAR_FACTOR) / SCALAR_FACTOR;
    }

    /**
     * Renders the value in the Mesos text format: {@code 4}, {@code [31000-32000]} or {@code {a,b}}.
     */
    public static String toString(Value value) {
        switch (value.getType()) {
            case SCALAR:
                double scalar = round(value.getScalar().getValue());
                return scalar == Math.rint(scalar) ? String.valueOf((long) scalar) : String.valueOf(scalar);
            case RANGES:
                StringBuilder ranges = new StringBuilder("[");
                for (int i = 0; i < value.getRanges().getRangeCount(); ++i) {
                    Value.Range range = value.getRanges().getRange(i);
                    if (i > 0) {
                        ranges.append(", ");
                    }
                    ranges.append(range.getBegin()).append('-').append(range.getEnd());
                }
                return ranges.append(']').toString();
            case SET:
                return "{" + String.join(",", value.getSet().getItemList()) + "}";
            default:
                return value.toString();
        }
    }

    private static Type checkSameType(Value val1, Value val2) {
        if (val1.getType() != val2.getType()) {
            throw new IllegalArgumentException(String.format(
                    "Mismatched value types: %s vs %s", val1.getType(), val2.getType()));
        }
        return val1.getType();
    }

    private static Value.Scalar scalar(double value) {
        return Value.Scalar.newBuilder().setValue(round(value)).build();
    }

    private static Value toSetValue(Set<String> items) {
        return Value.newBuilder().setType(Type.SET).setSet(Value.Set.newBuilder().addAllItem(items)).build();
    }
}
