package com.mesosphere.allocator.offer;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import org.apache.mesos.Protos.Resource;
import org.apache.mesos.Protos.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * An immutable aggregate of resources: scalars, ranges and sets, each tagged with its reservation and (optionally)
 * the role it was allocated to. Resources with the same {@link ResourceKey} are merged, so a set never holds two
 * entries for e.g. unreserved {@code cpus}.
 *
 * <p>All arithmetic is validated: {@link #minus(ResourceSet)} refuses to produce a negative remainder rather than
 * silently clamping it. Use {@link #contains(ResourceSet)} to check beforehand.
 */
public final class ResourceSet implements Iterable<Resource> {

    private static final ResourceSet EMPTY = new ResourceSet(ImmutableSortedMap.of());

    private final ImmutableSortedMap<ResourceKey, Value> entries;

    private ResourceSet(Map<ResourceKey, Value> entries) {
        this.entries = ImmutableSortedMap.copyOf(entries);
    }

    public static ResourceSet empty() {
        return EMPTY;
    }

    public static ResourceSet of(Resource... resources) {
        return of(Arrays.asList(resources));
    }

    public static ResourceSet of(Iterable<Resource> resources) {
        Map<ResourceKey, Value> entries = new TreeMap<>();
        for (Resource resource : resources) {
            merge(entries, keyOf(resource), ValueUtils.getValue(resource));
        }
        return create(entries);
    }

    /**
     * Parses resources in the Mesos text format, e.g. {@code cpus:4;mem(eng):1024;ports:[31000-32000]}.
     *
     * @see ResourceParser
     */
    public static ResourceSet parse(String text) {
        return ResourceParser.parse(text);
    }

    static ResourceSet create(Map<ResourceKey, Value> entries) {
        Map<ResourceKey, Value> nonEmpty = new TreeMap<>();
        for (Map.Entry<ResourceKey, Value> entry : entries.entrySet()) {
            if (!ValueUtils.isEmpty(entry.getValue())) {
                nonEmpty.put(entry.getKey(), entry.getValue());
            }
        }
        return nonEmpty.isEmpty() ? EMPTY : new ResourceSet(nonEmpty);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Set<ResourceKey> keys() {
        return entries.keySet();
    }

    public Value get(ResourceKey key) {
        return entries.get(key);
    }

    /**
     * Returns the distinct resource names present in this set.
     */
    public Set<String> names() {
        Set<String> names = new TreeSet<>();
        for (ResourceKey key : entries.keySet()) {
            names.add(key.getName());
        }
        return names;
    }

    public ResourceSet plus(ResourceSet other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Map<ResourceKey, Value> result = new TreeMap<>(entries);
        for (Map.Entry<ResourceKey, Value> entry : other.entries.entrySet()) {
            merge(result, entry.getKey(), entry.getValue());
        }
        return create(result);
    }

    /**
     * Returns these resources with {@code other} removed.
     *
     * @throws IllegalArgumentException if {@code other} is not contained in this set
     */
    public ResourceSet minus(ResourceSet other) {
        if (!contains(other)) {
            throw new IllegalArgumentException(String.format(
                    "Cannot subtract %s from %s: result would be negative", other, this));
        }
        Map<ResourceKey, Value> result = new TreeMap<>(entries);
        for (Map.Entry<ResourceKey, Value> entry : other.entries.entrySet()) {
            result.put(entry.getKey(), ValueUtils.subtract(result.get(entry.getKey()), entry.getValue()));
        }
        return create(result);
    }

    /**
     * Returns whether every resource in {@code other} is present here with the same key and at least the same
     * amount.
     */
    public boolean contains(ResourceSet other) {
        for (Map.Entry<ResourceKey, Value> entry : other.entries.entrySet()) {
            Value available = entries.get(entry.getKey());
            if (available == null || !ValueUtils.contains(available, entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the resources which are present in both sets, by key.
     */
    public ResourceSet intersect(ResourceSet other) {
        Map<ResourceKey, Value> result = new TreeMap<>();
        for (Map.Entry<ResourceKey, Value> entry : entries.entrySet()) {
            Value otherValue = other.entries.get(entry.getKey());
            if (otherValue != null) {
                result.put(entry.getKey(), ValueUtils.intersect(entry.getValue(), otherValue));
            }
        }
        return create(result);
    }

    public ResourceSet filter(Predicate<ResourceKey> predicate) {
        Map<ResourceKey, Value> result = new TreeMap<>();
        for (Map.Entry<ResourceKey, Value> entry : entries.entrySet()) {
            if (predicate.test(entry.getKey())) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result.size() == entries.size() ? this : create(result);
    }

    public ResourceSet filterNames(Set<String> names) {
        return filter(key -> names.contains(key.getName()));
    }

    public ResourceSet unreserved() {
        return filter(key -> !key.isReserved());
    }

    public ResourceSet reserved() {
        return filter(ResourceKey::isReserved);
    }

    /**
     * Returns the resources which are reserved for exactly the provided role.
     */
    public ResourceSet reservedTo(String role) {
        return filter(key -> key.isReserved() && key.getReservationRole().equals(role));
    }

    /**
     * Returns the resources which may be allocated to the provided role: unreserved resources, and resources
     * reserved for the role or for one of its ancestors in the role hierarchy.
     */
    public ResourceSet allocatableTo(String role) {
        return filter(key -> !key.isReserved() || isSameOrAncestor(key.getReservationRole(), role));
    }

    /**
     * Returns a copy of these resources which is tagged as allocated to the provided role.
     */
    public ResourceSet allocatedTo(String role) {
        Map<ResourceKey, Value> result = new TreeMap<>();
        for (Map.Entry<ResourceKey, Value> entry : entries.entrySet()) {
            merge(result, entry.getKey().withAllocationRole(role), entry.getValue());
        }
        return create(result);
    }

    /**
     * Returns a copy of these resources with any allocation role tags removed.
     */
    public ResourceSet unallocated() {
        Map<ResourceKey, Value> result = new TreeMap<>();
        for (Map.Entry<ResourceKey, Value> entry : entries.entrySet()) {
            merge(result, entry.getKey().withoutAllocationRole(), entry.getValue());
        }
        return create(result);
    }

    /**
     * Groups these resources by their allocation role. Resources without an allocation role are omitted.
     */
    public Map<String, ResourceSet> allocations() {
        Map<String, Map<ResourceKey, Value>> grouped = new TreeMap<>();
        for (Map.Entry<ResourceKey, Value> entry : entries.entrySet()) {
            if (entry.getKey().getAllocationRole().isPresent()) {
                grouped.computeIfAbsent(entry.getKey().getAllocationRole().get(), role -> new TreeMap<>())
                        .put(entry.getKey(), entry.getValue());
            }
        }
        Map<String, ResourceSet> result = new LinkedHashMap<>();
        for (Map.Entry<String, Map<ResourceKey, Value>> entry : grouped.entrySet()) {
            result.put(entry.getKey(), create(entry.getValue()));
        }
        return result;
    }

    /**
     * Returns a copy of these resources which is reserved for the provided role.
     */
    public ResourceSet reserve(ResourceKey.ReservationKind kind, String role) {
        Map<ResourceKey, Value> result = new TreeMap<>();
        for (Map.Entry<ResourceKey, Value> entry : entries.entrySet()) {
            merge(result, entry.getKey().withReservation(kind, role), entry.getValue());
        }
        return create(result);
    }

    /**
     * Returns a copy of these resources with all reservations removed.
     */
    public ResourceSet unreserve() {
        return reserve(ResourceKey.ReservationKind.UNRESERVED, Constants.ANY_ROLE);
    }

    /**
     * Returns the summed scalar amounts by name, ignoring reservations and allocation roles. Ranges and sets are not
     * included.
     */
    public ResourceQuantities quantities() {
        Map<String, Double> amounts = new TreeMap<>();
        for (Map.Entry<ResourceKey, Value> entry : entries.entrySet()) {
            if (entry.getKey().getType() == Value.Type.SCALAR) {
                amounts.merge(entry.getKey().getName(), entry.getValue().getScalar().getValue(), Double::sum);
            }
        }
        return ResourceQuantities.of(amounts);
    }

    public double getScalar(String name) {
        return quantities().get(name);
    }

    /**
     * Caps the scalar resources named in {@code limits} so that, summed across all reservations, no name exceeds its
     * limit. Entries are consumed in key order. Names which are not listed are left untouched.
     */
    public ResourceSet shrink(ResourceQuantities limits) {
        Map<String, Double> remaining = new TreeMap<>(limits.toMap());
        Map<ResourceKey, Value> result = new TreeMap<>();
        for (Map.Entry<ResourceKey, Value> entry : entries.entrySet()) {
            ResourceKey key = entry.getKey();
            if (key.getType() != Value.Type.SCALAR || !limits.names().contains(key.getName())) {
                result.put(key, entry.getValue());
                continue;
            }
            double left = remaining.getOrDefault(key.getName(), 0.0);
            double take = Math.min(left, entry.getValue().getScalar().getValue());
            if (take > 0) {
                result.put(key, ValueUtils.toValue(take));
                remaining.put(key.getName(), ValueUtils.round(left - take));
            }
        }
        return create(result);
    }

    /**
     * Caps the scalar resources named in {@code caps} at the given amounts, summed across reservations. Unlike
     * {@link #shrink(ResourceQuantities)}, a cap of zero is kept and removes the name entirely.
     */
    public ResourceSet cap(Map<String, Double> caps) {
        Map<String, Double> positive = new TreeMap<>();
        for (Map.Entry<String, Double> entry : caps.entrySet()) {
            if (entry.getValue() > 0) {
                positive.put(entry.getKey(), entry.getValue());
            }
        }
        ResourceSet allowed = filter(key ->
                key.getType() != Value.Type.SCALAR || !caps.containsKey(key.getName())
                        || positive.containsKey(key.getName()));
        return allowed.shrink(ResourceQuantities.of(positive));
    }

    /**
     * Caps every scalar resource to the provided names, dropping all names which are absent from {@code limits}.
     */
    public ResourceSet shrinkTo(ResourceQuantities limits) {
        return filterNames(limits.names()).shrink(limits);
    }

    public List<Resource> toProtos() {
        List<Resource> resources = new ArrayList<>();
        for (Map.Entry<ResourceKey, Value> entry : entries.entrySet()) {
            resources.add(toProto(entry.getKey(), entry.getValue()));
        }
        return ImmutableList.copyOf(resources);
    }

    @Override
    public Iterator<Resource> iterator() {
        return toProtos().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceSet)) {
            return false;
        }
        ResourceSet other = (ResourceSet) o;
        return contains(other) && other.contains(this);
    }

    @Override
    public int hashCode() {
        return entries.keySet().hashCode();
    }

    /**
     * Renders the resources in the Mesos text format accepted by {@link ResourceParser}, plus allocation tags.
     */
    @Override
    public String toString() {
        if (entries.isEmpty()) {
            return "{}";
        }
        List<String> items = new ArrayList<>();
        for (Map.Entry<ResourceKey, Value> entry : entries.entrySet()) {
            items.add(entry.getKey() + ":" + ValueUtils.toString(entry.getValue()));
        }
        return Joiner.on("; ").join(items);
    }

    /**
     * Returns whether {@code ancestor} equals {@code role} or is one of its parents, e.g. {@code eng} for
     * {@code eng/frontend}.
     */
    public static boolean isSameOrAncestor(String ancestor, String role) {
        return role.equals(ancestor) || role.startsWith(ancestor + Constants.ROLE_PATH_DELIM);
    }

    @SuppressWarnings("deprecation")
    static ResourceKey keyOf(Resource resource) {
        ResourceKey key;
        if (resource.getReservationsCount() > 0) {
            Resource.ReservationInfo reservation = resource.getReservations(resource.getReservationsCount() - 1);
            ResourceKey.ReservationKind kind = reservation.getType() == Resource.ReservationInfo.Type.DYNAMIC
                    ? ResourceKey.ReservationKind.DYNAMIC
                    : ResourceKey.ReservationKind.STATIC;
            key = ResourceKey.reserved(resource.getName(), resource.getType(), kind, reservation.getRole());
        } else if (resource.hasRole() && !Constants.ANY_ROLE.equals(resource.getRole())) {
            // Pre-refinement format: the role field holds the reservation, and a ReservationInfo marks it dynamic.
            ResourceKey.ReservationKind kind = resource.hasReservation()
                    ? ResourceKey.ReservationKind.DYNAMIC
                    : ResourceKey.ReservationKind.STATIC;
            key = ResourceKey.reserved(resource.getName(), resource.getType(), kind, resource.getRole());
        } else {
            key = ResourceKey.unreserved(resource.getName(), resource.getType());
        }
        if (resource.hasAllocationInfo() && resource.getAllocationInfo().hasRole()) {
            key = key.withAllocationRole(resource.getAllocationInfo().getRole());
        }
        return key;
    }

    static Resource toProto(ResourceKey key, Value value) {
        Resource.Builder builder = Resource.newBuilder()
                .setName(key.getName())
                .setType(key.getType());
        switch (key.getType()) {
            case SCALAR:
                builder.setScalar(value.getScalar());
                break;
            case RANGES:
                builder.setRanges(value.getRanges());
                break;
            case SET:
                builder.setSet(value.getSet());
                break;
            default:
                throw new IllegalArgumentException("Unsupported resource type: " + key.getType());
        }
        if (key.isReserved()) {
            builder.addReservations(Resource.ReservationInfo.newBuilder()
                    .setType(key.getReservationKind() == ResourceKey.ReservationKind.DYNAMIC
                            ? Resource.ReservationInfo.Type.DYNAMIC
                            : Resource.ReservationInfo.Type.STATIC)
                    .setRole(key.getReservationRole()));
        }
        if (key.getAllocationRole().isPresent()) {
            builder.setAllocationInfo(Resource.AllocationInfo.newBuilder().setRole(key.getAllocationRole().get()));
        }
        return builder.build();
    }

    private static void merge(Map<ResourceKey, Value> entries, ResourceKey key, Value value) {
        Value current = entries.get(key);
        entries.put(key, current == null ? value : ValueUtils.add(current, value));
    }
}
