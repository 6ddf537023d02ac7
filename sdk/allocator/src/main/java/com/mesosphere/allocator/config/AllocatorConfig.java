package com.mesosphere.allocator.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.mesosphere.allocator.offer.Constants;
import com.mesosphere.allocator.offer.ResourceQuantities;
import com.mesosphere.allocator.sorter.SorterFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Immutable settings for an allocator instance, fixed for its lifetime.
 */
public final class AllocatorConfig {

    /**
     * Milliseconds between periodic allocation passes.
     */
    static final String ALLOCATION_INTERVAL_MS_ENV = "ALLOCATION_INTERVAL_MS";

    /**
     * {@code |}-separated alternatives of resource quantities, e.g. {@code cpus:0.01|mem:32}. A resource set is worth
     * offering if it holds at least one of the alternatives.
     */
    static final String MIN_ALLOCATABLE_RESOURCES_ENV = "MIN_ALLOCATABLE_RESOURCES";

    /**
     * Weight of roles which have no explicitly configured weight.
     */
    static final String DEFAULT_ROLE_WEIGHT_ENV = "DEFAULT_ROLE_WEIGHT";

    /**
     * Comma-separated resource names which are ignored when computing dominant shares, e.g. {@code gpus}.
     */
    static final String FAIR_SHARE_EXCLUDED_RESOURCE_NAMES_ENV = "FAIR_SHARE_EXCLUDED_RESOURCE_NAMES";

    static final String ROLE_SORTER_ENV = "ROLE_SORTER";
    static final String FRAMEWORK_SORTER_ENV = "FRAMEWORK_SORTER";

    /**
     * Whether agents with gpus are only offered to frameworks which are able to use gpus.
     */
    static final String FILTER_GPU_RESOURCES_ENV = "FILTER_GPU_RESOURCES";

    /**
     * Seed for randomized sorters.
     */
    static final String SORTER_SEED_ENV = "SORTER_SEED";

    private final Duration allocationInterval;
    private final List<ResourceQuantities> minAllocatableResources;
    private final double defaultRoleWeight;
    private final Set<String> fairnessExcludedResourceNames;
    private final String roleSorter;
    private final String frameworkSorter;
    private final boolean filterGpuResources;
    private final long sorterSeed;
    private final Clock clock;

    private AllocatorConfig(Builder builder) {
        this.allocationInterval = builder.allocationInterval;
        this.minAllocatableResources = ImmutableList.copyOf(builder.minAllocatableResources);
        this.defaultRoleWeight = builder.defaultRoleWeight;
        this.fairnessExcludedResourceNames = ImmutableSet.copyOf(builder.fairnessExcludedResourceNames);
        this.roleSorter = builder.roleSorter;
        this.frameworkSorter = builder.frameworkSorter;
        this.filterGpuResources = builder.filterGpuResources;
        this.sorterSeed = builder.sorterSeed;
        this.clock = builder.clock;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Returns a config with default settings. Equivalent to {@code newBuilder().build()}.
     */
    public static AllocatorConfig defaults() {
        return newBuilder().build();
    }

    /**
     * Reads a config from the provided flags, falling back to defaults for anything which is unset.
     *
     * @throws EnvStore.ConfigException if a value cannot be parsed
     */
    public static AllocatorConfig fromEnv(EnvStore envStore) {
        Builder builder = newBuilder()
                .allocationInterval(envStore.getOptionalDurationMs(
                        ALLOCATION_INTERVAL_MS_ENV, Constants.DEFAULT_ALLOCATION_INTERVAL))
                .defaultRoleWeight(envStore.getOptionalDouble(DEFAULT_ROLE_WEIGHT_ENV, 1.0))
                .fairnessExcludedResourceNames(envStore.getOptionalStringList(
                        FAIR_SHARE_EXCLUDED_RESOURCE_NAMES_ENV, ImmutableList.of()))
                .roleSorter(envStore.getOptionalNonEmpty(ROLE_SORTER_ENV, Constants.DRF_SORTER))
                .frameworkSorter(envStore.getOptionalNonEmpty(FRAMEWORK_SORTER_ENV, Constants.DRF_SORTER))
                .filterGpuResources(envStore.getOptionalBoolean(FILTER_GPU_RESOURCES_ENV, true))
                .sorterSeed(envStore.getOptionalLong(SORTER_SEED_ENV, 0));

        if (envStore.isPresent(MIN_ALLOCATABLE_RESOURCES_ENV)) {
            List<ResourceQuantities> alternatives = new ArrayList<>();
            for (String text : envStore.getOptionalAlternatives(MIN_ALLOCATABLE_RESOURCES_ENV, ImmutableList.of())) {
                try {
                    alternatives.add(ResourceQuantities.parse(text));
                } catch (IllegalArgumentException e) {
                    throw EnvStore.ConfigException.invalidValue(String.format(
                            "Failed to parse configured environment variable '%s' as resource quantities: %s",
                            MIN_ALLOCATABLE_RESOURCES_ENV, text), e);
                }
            }
            builder.minAllocatableResources(alternatives);
        }
        return builder.build();
    }

    public Duration getAllocationInterval() {
        return allocationInterval;
    }

    /**
     * Returns the alternatives of which an offered resource set must hold at least one. An empty list means any
     * non-empty set may be offered.
     */
    public List<ResourceQuantities> getMinAllocatableResources() {
        return minAllocatableResources;
    }

    public double getDefaultRoleWeight() {
        return defaultRoleWeight;
    }

    public Set<String> getFairnessExcludedResourceNames() {
        return fairnessExcludedResourceNames;
    }

    public String getRoleSorter() {
        return roleSorter;
    }

    public String getFrameworkSorter() {
        return frameworkSorter;
    }

    public boolean isFilterGpuResources() {
        return filterGpuResources;
    }

    public long getSorterSeed() {
        return sorterSeed;
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public String toString() {
        return String.format("AllocatorConfig[interval=%s, minAllocatable=%s, defaultWeight=%s, excluded=%s, "
                        + "roleSorter=%s, frameworkSorter=%s, filterGpu=%s, seed=%d]",
                allocationInterval, minAllocatableResources, defaultRoleWeight, fairnessExcludedResourceNames,
                roleSorter, frameworkSorter, filterGpuResources, sorterSeed);
    }

    /**
     * Builder for {@link AllocatorConfig}. Invalid values are rejected by {@link #build()}.
     */
    public static final class Builder {
        private Duration allocationInterval = Constants.DEFAULT_ALLOCATION_INTERVAL;
        private Collection<ResourceQuantities> minAllocatableResources = Arrays.asList(
                ResourceQuantities.of(Constants.CPUS_RESOURCE_TYPE, Constants.MIN_CPUS),
                ResourceQuantities.of(Constants.MEMORY_RESOURCE_TYPE, Constants.MIN_MEM));
        private double defaultRoleWeight = 1.0;
        private Collection<String> fairnessExcludedResourceNames = ImmutableSet.of();
        private String roleSorter = Constants.DRF_SORTER;
        private String frameworkSorter = Constants.DRF_SORTER;
        private boolean filterGpuResources = true;
        private long sorterSeed = 0;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder allocationInterval(Duration allocationInterval) {
            this.allocationInterval = allocationInterval;
            return this;
        }

        public Builder minAllocatableResources(Collection<ResourceQuantities> minAllocatableResources) {
            this.minAllocatableResources = minAllocatableResources;
            return this;
        }

        public Builder defaultRoleWeight(double defaultRoleWeight) {
            this.defaultRoleWeight = defaultRoleWeight;
            return this;
        }

        public Builder fairnessExcludedResourceNames(Collection<String> fairnessExcludedResourceNames) {
            this.fairnessExcludedResourceNames = fairnessExcludedResourceNames;
            return this;
        }

        public Builder roleSorter(String roleSorter) {
            this.roleSorter = roleSorter;
            return this;
        }

        public Builder frameworkSorter(String frameworkSorter) {
            this.frameworkSorter = frameworkSorter;
            return this;
        }

        public Builder filterGpuResources(boolean filterGpuResources) {
            this.filterGpuResources = filterGpuResources;
            return this;
        }

        public Builder sorterSeed(long sorterSeed) {
            this.sorterSeed = sorterSeed;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public AllocatorConfig build() {
            if (allocationInterval == null || allocationInterval.isNegative() || allocationInterval.isZero()) {
                throw new IllegalStateException(String.format(
                        "Allocation interval must be positive: %s", allocationInterval));
            }
            if (!(defaultRoleWeight > 0)) {
                throw new IllegalStateException(String.format(
                        "Default role weight must be positive: %s", defaultRoleWeight));
            }
            if (!SorterFactory.isKnown(roleSorter) || !SorterFactory.isKnown(frameworkSorter)) {
                throw new IllegalStateException(String.format(
                        "Unknown sorter in roleSorter=%s, frameworkSorter=%s, expected one of: %s",
                        roleSorter, frameworkSorter, SorterFactory.getNames()));
            }
            if (clock == null) {
                throw new IllegalStateException("Clock must be provided");
            }
            return new AllocatorConfig(this);
        }
    }
}
