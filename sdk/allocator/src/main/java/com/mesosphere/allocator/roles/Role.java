package com.mesosphere.allocator.roles;

import com.mesosphere.allocator.offer.Constants;
import org.apache.mesos.Protos;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * A role known to the allocator, along with the things which keep it alive: subscribed frameworks, a quota, a
 * reservation or an explicitly configured weight. Roles form a tree through their names ({@code eng/web} is a child
 * of {@code eng}), but only the parent's name is stored here: ancestors are found by repeated lookup.
 */
public class Role {

    private final String name;
    private final Optional<String> parentName;
    private final Set<Protos.FrameworkID> frameworks = new LinkedHashSet<>();
    private Optional<Double> weight = Optional.empty();
    private boolean hasQuota;
    private boolean hasReservations;

    Role(String name) {
        this.name = name;
        int delim = name.lastIndexOf(Constants.ROLE_PATH_DELIM);
        this.parentName = delim < 0 ? Optional.empty() : Optional.of(name.substring(0, delim));
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the name of the parent role, e.g. {@code eng} for {@code eng/web}, or empty for a top level role.
     */
    public Optional<String> getParentName() {
        return parentName;
    }

    public Set<Protos.FrameworkID> getFrameworks() {
        return Collections.unmodifiableSet(frameworks);
    }

    public Optional<Double> getWeight() {
        return weight;
    }

    public boolean hasQuota() {
        return hasQuota;
    }

    public boolean hasReservations() {
        return hasReservations;
    }

    void addFramework(Protos.FrameworkID frameworkId) {
        frameworks.add(frameworkId);
    }

    void removeFramework(Protos.FrameworkID frameworkId) {
        frameworks.remove(frameworkId);
    }

    void setWeight(Optional<Double> weight) {
        this.weight = weight;
    }

    void setHasQuota(boolean hasQuota) {
        this.hasQuota = hasQuota;
    }

    void setHasReservations(boolean hasReservations) {
        this.hasReservations = hasReservations;
    }

    /**
     * Returns whether nothing references this role anymore, in which case it may be forgotten.
     */
    boolean isUnreferenced() {
        return frameworks.isEmpty() && !weight.isPresent() && !hasQuota && !hasReservations;
    }

    @Override
    public String toString() {
        return String.format("Role[%s, frameworks=%d, weight=%s, quota=%s, reservations=%s]",
                name, frameworks.size(), weight.map(String::valueOf).orElse("default"), hasQuota, hasReservations);
    }
}
