package com.mesosphere.allocator.offer;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSortedMap;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * An immutable mapping of scalar resource names to amounts, without any reservation or allocation metadata. This is
 * the unit used for fair share computation, quota guarantees and limits, and minimum allocatable thresholds.
 *
 * <p>Only strictly positive amounts are stored, so a name which is absent has an amount of zero.
 */
public final class ResourceQuantities {

    private static final ResourceQuantities EMPTY = new ResourceQuantities(ImmutableSortedMap.of());

    private final ImmutableSortedMap<String, Double> quantities;

    private ResourceQuantities(Map<String, Double> quantities) {
        this.quantities = ImmutableSortedMap.copyOf(quantities);
    }

    public static ResourceQuantities empty() {
        return EMPTY;
    }

    public static ResourceQuantities of(String name, double amount) {
        return of(ImmutableSortedMap.of(name, amount));
    }

    /**
     * Returns quantities for the provided map. Negative amounts are rejected, zero amounts are dropped.
     *
     * @throws IllegalArgumentException if any amount is negative
     */
    public static ResourceQuantities of(Map<String, Double> amounts) {
        Map<String, Double> cleaned = new TreeMap<>();
        for (Map.Entry<String, Double> entry : amounts.entrySet()) {
            double amount = ValueUtils.round(entry.getValue());
            if (amount < 0) {
                throw new IllegalArgumentException(String.format(
                        "Negative quantity for %s: %s", entry.getKey(), entry.getValue()));
            }
            if (amount > 0) {
                cleaned.put(entry.getKey(), amount);
            }
        }
        return cleaned.isEmpty() ? EMPTY : new ResourceQuantities(cleaned);
    }

    /**
     * Parses quantities in the Mesos text format, e.g. {@code cpus:4;mem:4096}. Only scalar entries are permitted.
     *
     * @throws IllegalArgumentException if the text is malformed or contains non-scalar values
     */
    public static ResourceQuantities parse(String text) {
        ResourceSet resources = ResourceParser.parse(text);
        for (ResourceKey key : resources.keys()) {
            if (key.getType() != org.apache.mesos.Protos.Value.Type.SCALAR) {
                throw new IllegalArgumentException(String.format(
                        "Quantities must be scalar, got '%s' in: %s", key.getName(), text));
            }
        }
        return resources.quantities();
    }

    public static ResourceQuantities sum(Collection<ResourceQuantities> values) {
        ResourceQuantities total = EMPTY;
        for (ResourceQuantities value : values) {
            total = total.plus(value);
        }
        return total;
    }

    public double get(String name) {
        Double amount = quantities.get(name);
        return amount == null ? 0 : amount;
    }

    public Set<String> names() {
        return quantities.keySet();
    }

    public boolean isEmpty() {
        return quantities.isEmpty();
    }

    public Map<String, Double> toMap() {
        return quantities;
    }

    public ResourceQuantities plus(ResourceQuantities other) {
        if (other.isEmpty()) {
            return this;
        }
        Map<String, Double> result = new TreeMap<>(quantities);
        for (Map.Entry<String, Double> entry : other.quantities.entrySet()) {
            result.merge(entry.getKey(), entry.getValue(), Double::sum);
        }
        return of(result);
    }

    /**
     * Subtracts {@code other} from these quantities, treating any resulting deficit as zero. This is the
     * {@code max(0, a - b)} operation used for e.g. unsatisfied quota guarantees.
     */
    public ResourceQuantities minusClampedAtZero(ResourceQuantities other) {
        if (other.isEmpty()) {
            return this;
        }
        Map<String, Double> result = new TreeMap<>();
        for (Map.Entry<String, Double> entry : quantities.entrySet()) {
            result.put(entry.getKey(), Math.max(0, ValueUtils.round(entry.getValue() - other.get(entry.getKey()))));
        }
        return of(result);
    }

    /**
     * Returns whether every amount in {@code other} is less than or equal to the corresponding amount here.
     */
    public boolean contains(ResourceQuantities other) {
        for (Map.Entry<String, Double> entry : other.quantities.entrySet()) {
            if (get(entry.getKey()) < entry.getValue()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the smaller amount for each name, dropping names that are absent from either side.
     */
    public ResourceQuantities min(ResourceQuantities other) {
        Map<String, Double> result = new TreeMap<>();
        for (Map.Entry<String, Double> entry : quantities.entrySet()) {
            result.put(entry.getKey(), Math.min(entry.getValue(), other.get(entry.getKey())));
        }
        return of(result);
    }

    /**
     * Returns the larger amount for each name present on either side.
     */
    public ResourceQuantities max(ResourceQuantities other) {
        Map<String, Double> result = new TreeMap<>(quantities);
        for (Map.Entry<String, Double> entry : other.quantities.entrySet()) {
            result.merge(entry.getKey(), entry.getValue(), Math::max);
        }
        return of(result);
    }

    /**
     * Returns only the quantities whose names appear in {@code names}.
     */
    public ResourceQuantities filter(Set<String> names) {
        Map<String, Double> result = new TreeMap<>(quantities);
        result.keySet().retainAll(names);
        return of(result);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ResourceQuantities && quantities.equals(((ResourceQuantities) o).quantities);
    }

    @Override
    public int hashCode() {
        return quantities.hashCode();
    }

    @Override
    public String toString() {
        return quantities.isEmpty() ? "{}" : Joiner.on(';').withKeyValueSeparator(':').join(quantities);
    }
}
