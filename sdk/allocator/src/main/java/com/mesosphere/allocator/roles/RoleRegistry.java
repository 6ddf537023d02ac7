package com.mesosphere.allocator.roles;

import com.google.common.base.CharMatcher;
import com.mesosphere.allocator.allocation.AllocatorException;
import com.mesosphere.allocator.offer.Constants;
import com.mesosphere.allocator.offer.LoggingUtils;
import org.apache.mesos.Protos;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flat registry of the roles currently referenced by frameworks, quotas, reservations or weights, keyed by name.
 * A role is created on its first reference and dropped once the last reference goes away.
 */
public class RoleRegistry {

    private static final Logger LOGGER = LoggingUtils.getLogger(RoleRegistry.class);

    private static final CharMatcher INVALID_ROLE_CHARS = CharMatcher.whitespace()
            .or(CharMatcher.anyOf("\\\"'`?*,[](){}:;&|$#!~^%@=+<>"))
            .or(CharMatcher.javaIsoControl());

    private final Map<String, Role> roles = new LinkedHashMap<>();
    private final double defaultWeight;

    public RoleRegistry(double defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    /**
     * Validates a role name following the Mesos naming rules: non-empty, no whitespace or special characters, no
     * leading {@code -}, and no path component which is empty, {@code .} or {@code ..}. The wildcard {@code *} is
     * only valid on its own.
     *
     * @throws AllocatorException with reason {@code VALIDATION} if the name is invalid
     */
    public static void validateName(String role) throws AllocatorException {
        if (Constants.ANY_ROLE.equals(role)) {
            return;
        }
        if (role == null || role.isEmpty()) {
            throw AllocatorException.validation("Role name must not be empty");
        }
        for (String component : role.split(Constants.ROLE_PATH_DELIM, -1)) {
            if (component.isEmpty() || component.equals(".") || component.equals("..")) {
                throw AllocatorException.validation("Role '%s' has an invalid path component '%s'", role, component);
            }
            if (component.startsWith("-")) {
                throw AllocatorException.validation("Role '%s' has a path component starting with '-'", role);
            }
            if (INVALID_ROLE_CHARS.matchesAnyOf(component)) {
                throw AllocatorException.validation("Role '%s' contains invalid characters", role);
            }
        }
    }

    public Optional<Role> get(String name) {
        return Optional.ofNullable(roles.get(name));
    }

    public boolean contains(String name) {
        return roles.containsKey(name);
    }

    public Collection<Role> getRoles() {
        return Collections.unmodifiableCollection(roles.values());
    }

    /**
     * Returns the names of the role's ancestors, nearest first. Ancestors need not be registered themselves.
     */
    public static List<String> ancestors(String role) {
        List<String> ancestors = new ArrayList<>();
        Optional<String> parent = new Role(role).getParentName();
        while (parent.isPresent()) {
            ancestors.add(parent.get());
            parent = new Role(parent.get()).getParentName();
        }
        return ancestors;
    }

    /**
     * Returns the weight configured for the role, or the default weight if none was set.
     */
    public double getWeight(String name) {
        Role role = roles.get(name);
        return role == null ? defaultWeight : role.getWeight().orElse(defaultWeight);
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }

    public void addFramework(String name, Protos.FrameworkID frameworkId) {
        getOrCreate(name).addFramework(frameworkId);
    }

    public void removeFramework(String name, Protos.FrameworkID frameworkId) {
        Role role = roles.get(name);
        if (role != null) {
            role.removeFramework(frameworkId);
            pruneIfUnreferenced(role);
        }
    }

    /**
     * Sets or (with an empty value) clears the explicit weight of the role.
     */
    public void setWeight(String name, Optional<Double> weight) {
        Role role = getOrCreate(name);
        role.setWeight(weight);
        pruneIfUnreferenced(role);
    }

    public void setHasQuota(String name, boolean hasQuota) {
        Role role = getOrCreate(name);
        role.setHasQuota(hasQuota);
        pruneIfUnreferenced(role);
    }

    public void setHasReservations(String name, boolean hasReservations) {
        Role role = getOrCreate(name);
        role.setHasReservations(hasReservations);
        pruneIfUnreferenced(role);
    }

    private Role getOrCreate(String name) {
        Role role = roles.get(name);
        if (role == null) {
            role = new Role(name);
            roles.put(name, role);
            LOGGER.debug("Tracking role {}", name);
        }
        return role;
    }

    private void pruneIfUnreferenced(Role role) {
        if (role.isUnreferenced()) {
            roles.remove(role.getName());
            LOGGER.debug("Dropped unreferenced role {}", role.getName());
        }
    }
}
