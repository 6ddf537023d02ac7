package com.mesosphere.allocator.sorter;

import com.google.common.collect.ImmutableMap;
import com.mesosphere.allocator.config.AllocatorConfig;
import com.mesosphere.allocator.offer.Constants;

import java.util.Map;
import java.util.Set;

/**
 * Registry of sorter implementations by the names used in configuration.
 */
public final class SorterFactory {

    /**
     * Creates a sorter instance.
     */
    @FunctionalInterface
    public interface Constructor {
        /**
         * @param name label for log messages
         * @param hierarchical whether client names containing {@code /} form a tree
         * @param config settings for fairness exclusions and random seeds
         */
        Sorter create(String name, boolean hierarchical, AllocatorConfig config);
    }

    private static final Map<String, Constructor> CONSTRUCTORS = ImmutableMap.of(
            Constants.DRF_SORTER,
            (name, hierarchical, config) ->
                    new DRFSorter(name, hierarchical, config.getFairnessExcludedResourceNames()),
            Constants.RANDOM_SORTER,
            (name, hierarchical, config) -> new RandomSorter(name, hierarchical, config.getSorterSeed()));

    private SorterFactory() {
        // do not instantiate
    }

    public static Set<String> getNames() {
        return CONSTRUCTORS.keySet();
    }

    public static boolean isKnown(String kind) {
        return CONSTRUCTORS.containsKey(kind);
    }

    /**
     * Creates a sorter of the named kind.
     *
     * @throws IllegalArgumentException if the kind is not known
     */
    public static Sorter create(String kind, String name, boolean hierarchical, AllocatorConfig config) {
        Constructor constructor = CONSTRUCTORS.get(kind);
        if (constructor == null) {
            throw new IllegalArgumentException(String.format(
                    "Unknown sorter '%s', expected one of: %s", kind, CONSTRUCTORS.keySet()));
        }
        return constructor.create(name, hierarchical, config);
    }
}
