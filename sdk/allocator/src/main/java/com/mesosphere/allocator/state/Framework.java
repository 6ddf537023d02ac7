package com.mesosphere.allocator.state;

import com.google.common.collect.ImmutableSet;
import org.apache.mesos.Protos;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The allocator's view of a registered framework. Owned and mutated by {@link ClusterStateTracker}.
 */
public class Framework {

    private final Protos.FrameworkID id;
    private final Set<Protos.SlaveID> agents = new LinkedHashSet<>();

    private Protos.FrameworkInfo info;
    private Set<String> roles;
    private Set<Protos.FrameworkInfo.Capability.Type> capabilities;
    private Set<String> suppressedRoles;
    private boolean active;

    Framework(Protos.FrameworkID id, Protos.FrameworkInfo info, Collection<String> suppressedRoles, boolean active) {
        this.id = id;
        this.active = active;
        update(info, suppressedRoles);
    }

    /**
     * Returns the roles which the framework subscribes to: its {@code roles} list when it is {@code MULTI_ROLE}
     * capable, otherwise its legacy {@code role} field.
     */
    @SuppressWarnings("deprecation")
    public static Set<String> getRoles(Protos.FrameworkInfo info) {
        for (Protos.FrameworkInfo.Capability capability : info.getCapabilitiesList()) {
            if (capability.getType() == Protos.FrameworkInfo.Capability.Type.MULTI_ROLE) {
                return ImmutableSet.copyOf(info.getRolesList());
            }
        }
        return ImmutableSet.of(info.hasRole() ? info.getRole() : "*");
    }

    public Protos.FrameworkID getId() {
        return id;
    }

    public Protos.FrameworkInfo getInfo() {
        return info;
    }

    public Set<String> getRoles() {
        return roles;
    }

    public Set<Protos.FrameworkInfo.Capability.Type> getCapabilities() {
        return capabilities;
    }

    public boolean hasCapability(Protos.FrameworkInfo.Capability.Type capability) {
        return capabilities.contains(capability);
    }

    public Set<String> getSuppressedRoles() {
        return suppressedRoles;
    }

    public boolean isSuppressed(String role) {
        return suppressedRoles.contains(role);
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Returns the agents on which the framework holds offered or used resources.
     */
    public Set<Protos.SlaveID> getAgents() {
        return Collections.unmodifiableSet(agents);
    }

    void update(Protos.FrameworkInfo info, Collection<String> suppressedRoles) {
        this.info = info;
        this.roles = getRoles(info);
        Set<Protos.FrameworkInfo.Capability.Type> types = new LinkedHashSet<>();
        for (Protos.FrameworkInfo.Capability capability : info.getCapabilitiesList()) {
            types.add(capability.getType());
        }
        this.capabilities = ImmutableSet.copyOf(types);
        this.suppressedRoles = ImmutableSet.copyOf(suppressedRoles);
    }

    void setSuppressedRoles(Collection<String> suppressedRoles) {
        this.suppressedRoles = ImmutableSet.copyOf(suppressedRoles);
    }

    void setActive(boolean active) {
        this.active = active;
    }

    void addAgent(Protos.SlaveID agentId) {
        agents.add(agentId);
    }

    void removeAgent(Protos.SlaveID agentId) {
        agents.remove(agentId);
    }

    @Override
    public String toString() {
        return String.format("Framework[%s (%s), roles=%s, suppressed=%s, active=%s]",
                id.getValue(), info.getName(), roles, suppressedRoles, active);
    }
}
