package com.mesosphere.allocator.offer;

import java.time.Duration;

/**
 * This class encapsulates constants of relevance to the allocator.
 */
public class Constants {

    /** The name used for cpu resources. */
    public static final String CPUS_RESOURCE_TYPE = "cpus";
    /** The name used for memory resources, in megabytes. */
    public static final String MEMORY_RESOURCE_TYPE = "mem";
    /** The name used for storage/disk resources, in megabytes. */
    public static final String DISK_RESOURCE_TYPE = "disk";
    /** The name used for network port resources. */
    public static final String PORTS_RESOURCE_TYPE = "ports";
    /** The name used for gpu resources. */
    public static final String GPUS_RESOURCE_TYPE = "gpus";

    /** The "any role" wildcard resource role. Unreserved resources carry this role. */
    public static final String ANY_ROLE = "*";

    /** Separates the path components of a hierarchical role, e.g. {@code eng/frontend}. */
    public static final String ROLE_PATH_DELIM = "/";

    /** The smallest cpu quantity which is worth offering on its own. */
    public static final double MIN_CPUS = 0.01;
    /** The smallest memory quantity (in megabytes) which is worth offering on its own. */
    public static final double MIN_MEM = 32;

    /** Mesos scalars are fixed point values with three decimal digits. */
    public static final int SCALAR_PRECISION_DIGITS = 3;

    /** The default interval between periodic allocation passes. */
    public static final Duration DEFAULT_ALLOCATION_INTERVAL = Duration.ofSeconds(1);

    /** The refuse duration applied when a framework declines without specifying one. */
    public static final Duration DEFAULT_REFUSE_DURATION = Duration.ofSeconds(5);
    /** Refuse durations above this value are capped. */
    public static final Duration MAX_REFUSE_DURATION = Duration.ofDays(365);

    /** The name of the default sorter implementation. */
    public static final String DRF_SORTER = "drf";
    /** The name of the weighted random sorter implementation. */
    public static final String RANDOM_SORTER = "random";
}
