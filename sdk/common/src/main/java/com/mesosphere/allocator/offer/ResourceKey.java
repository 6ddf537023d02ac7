package com.mesosphere.allocator.offer;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.mesos.Protos.Value;

import java.util.Comparator;
import java.util.Optional;

/**
 * Identifies one entry of a {@link ResourceSet}: resources with the same key are merged into a single value.
 */
public final class ResourceKey implements Comparable<ResourceKey> {

    /**
     * How a resource is reserved on its agent.
     */
    public enum ReservationKind {
        /** Usable by any role. */
        UNRESERVED,
        /** Reserved by the operator via agent configuration or {@code addReservation}. */
        STATIC,
        /** Reserved by a framework via a RESERVE operation. */
        DYNAMIC
    }

    private static final Comparator<ResourceKey> ORDER = Comparator
            .comparing(ResourceKey::getName)
            .thenComparing(ResourceKey::getType)
            .thenComparing(ResourceKey::getReservationKind)
            .thenComparing(ResourceKey::getReservationRole)
            .thenComparing(key -> key.allocationRole == null ? "" : key.allocationRole);

    private final String name;
    private final Value.Type type;
    private final ReservationKind reservationKind;
    private final String reservationRole;
    private final String allocationRole;

    private ResourceKey(
            String name,
            Value.Type type,
            ReservationKind reservationKind,
            String reservationRole,
            String allocationRole) {
        this.name = name;
        this.type = type;
        this.reservationKind = reservationKind;
        this.reservationRole = reservationRole;
        this.allocationRole = allocationRole;
    }

    public static ResourceKey unreserved(String name, Value.Type type) {
        return new ResourceKey(name, type, ReservationKind.UNRESERVED, Constants.ANY_ROLE, null);
    }

    public static ResourceKey reserved(String name, Value.Type type, ReservationKind kind, String role) {
        if (kind == ReservationKind.UNRESERVED || Constants.ANY_ROLE.equals(role)) {
            return unreserved(name, type);
        }
        return new ResourceKey(name, type, kind, role, null);
    }

    public String getName() {
        return name;
    }

    public Value.Type getType() {
        return type;
    }

    public ReservationKind getReservationKind() {
        return reservationKind;
    }

    /**
     * Returns the role which holds the reservation, or {@link Constants#ANY_ROLE} for unreserved resources.
     */
    public String getReservationRole() {
        return reservationRole;
    }

    public boolean isReserved() {
        return reservationKind != ReservationKind.UNRESERVED;
    }

    /**
     * Returns the role which the resource has been offered or allocated to, if any.
     */
    public Optional<String> getAllocationRole() {
        return Optional.ofNullable(allocationRole);
    }

    public ResourceKey withAllocationRole(String role) {
        return new ResourceKey(name, type, reservationKind, reservationRole, role);
    }

    public ResourceKey withoutAllocationRole() {
        return allocationRole == null ? this : new ResourceKey(name, type, reservationKind, reservationRole, null);
    }

    public ResourceKey withReservation(ReservationKind kind, String role) {
        ResourceKey key = reserved(name, type, kind, role);
        return allocationRole == null ? key : key.withAllocationRole(allocationRole);
    }

    @Override
    public int compareTo(ResourceKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceKey)) {
            return false;
        }
        ResourceKey other = (ResourceKey) o;
        return new EqualsBuilder()
                .append(name, other.name)
                .append(type, other.type)
                .append(reservationKind, other.reservationKind)
                .append(reservationRole, other.reservationRole)
                .append(allocationRole, other.allocationRole)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder()
                .append(name)
                .append(type)
                .append(reservationKind)
                .append(reservationRole)
                .append(allocationRole)
                .toHashCode();
    }

    /**
     * Renders the key in the Mesos text format, e.g. {@code cpus(eng)} or {@code mem(*)}, with the allocation role
     * appended when present: {@code cpus(*)[allocated: eng]}.
     */
    @Override
    public String toString() {
        String base = String.format("%s(%s)", name, reservationRole);
        if (reservationKind == ReservationKind.DYNAMIC) {
            base += "[dynamic]";
        }
        return allocationRole == null ? base : String.format("%s[allocated: %s]", base, allocationRole);
    }
}
