package com.mesosphere.allocator.offer;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility methods around construction of loggers.
 */
public final class LoggingUtils {

    private LoggingUtils() {
        // do not instantiate
    }

    /**
     * Creates a logger which is tagged with the provided class.
     *
     * @param clazz the class using this logger
     */
    public static Logger getLogger(Class<?> clazz) {
        return LoggerFactory.getLogger(clazz.getSimpleName());
    }

    /**
     * Creates a logger which is tagged with the provided class and the provided custom label, e.g. the name of the
     * sorter instance which is logging.
     */
    public static Logger getLogger(Class<?> clazz, String name) {
        if (StringUtils.isBlank(name)) {
            return getLogger(clazz);
        }
        return LoggerFactory.getLogger(String.format("(%s) %s", name, clazz.getSimpleName()));
    }

    /**
     * Returns {@code ""} for a count of one and {@code "s"} otherwise, for log messages like
     * "Sending 3 offers".
     */
    public static String plural(int count) {
        return count == 1 ? "" : "s";
    }
}
