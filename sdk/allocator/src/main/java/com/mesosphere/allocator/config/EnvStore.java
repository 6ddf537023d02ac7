package com.mesosphere.allocator.config;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility class for grabbing allocator settings from a mapping of flag values (typically the process env).
 */
public class EnvStore {
    /**
     * Exception which is thrown when failing to retrieve or parse a given flag value.
     */
    public static class ConfigException extends RuntimeException {

        /**
         * A machine-accessible error type.
         */
        public enum Type {
            UNKNOWN,
            NOT_FOUND,
            INVALID_VALUE
        }

        static ConfigException notFound(String message) {
            return new ConfigException(Type.NOT_FOUND, message);
        }

        static ConfigException invalidValue(String message, Throwable cause) {
            ConfigException e = new ConfigException(Type.INVALID_VALUE, message);
            if (cause != null) {
                e.initCause(cause);
            }
            return e;
        }

        private final Type type;

        private ConfigException(Type type, String message) {
            super(message);
            this.type = type;
        }

        public Type getType() {
            return type;
        }

        @Override
        public String getMessage() {
            return String.format("%s (errtype: %s)", super.getMessage(), type);
        }
    }

    private final Map<String, String> envMap;

    public static EnvStore fromEnv() {
        return new EnvStore(System.getenv());
    }

    public static EnvStore fromMap(Map<String, String> envMap) {
        return new EnvStore(envMap);
    }

    EnvStore(Map<String, String> envMap) {
        this.envMap = new HashMap<>(envMap);
    }

    public long getOptionalLong(String envKey, long defaultValue) {
        String value = getOptionalNonEmpty(envKey, String.valueOf(defaultValue));
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw ConfigException.invalidValue(String.format(
                    "Failed to parse configured environment variable '%s' as a long integer: %s", envKey, value), e);
        }
    }

    public double getOptionalDouble(String envKey, double defaultValue) {
        String value = getOptionalNonEmpty(envKey, String.valueOf(defaultValue));
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw ConfigException.invalidValue(String.format(
                    "Failed to parse configured environment variable '%s' as a double: %s", envKey, value), e);
        }
    }

    /**
     * Duration expressed as a number of milliseconds.
     */
    public Duration getOptionalDurationMs(String envKey, Duration defaultValue) {
        long millis = getOptionalLong(envKey, defaultValue.toMillis());
        if (millis < 0) {
            throw ConfigException.invalidValue(String.format(
                    "Configured environment variable '%s' must not be negative: %d", envKey, millis), null);
        }
        return Duration.ofMillis(millis);
    }

    public boolean getOptionalBoolean(String envKey, boolean defaultValue) {
        String value = getOptional(envKey, String.valueOf(defaultValue)).trim();
        if (value.isEmpty()) {
            // Treat empty or whitespace-only envvar as false
            return false;
        }
        switch (value.charAt(0)) {
        case 't':
        case 'T':
        case 'y':
        case 'Y':
            return true;
        case 'f':
        case 'F':
        case 'n':
        case 'N':
            return false;
        default:
            throw ConfigException.invalidValue(String.format(
                    "Failed to parse configured environment variable '%s' as a boolean: %s", envKey, value), null);
        }
    }

    /**
     * List of comma-separated strings. Any whitespace is cleaned up automatically.
     */
    public List<String> getOptionalStringList(String envKey, List<String> defaultValue) {
        return Splitter.on(',')
                .trimResults()
                .omitEmptyStrings()
                .splitToList(getOptional(envKey, Joiner.on(',').join(defaultValue)));
    }

    /**
     * List of {@code |}-separated alternatives, e.g. {@code cpus:0.01|mem:32}. Any whitespace is cleaned up
     * automatically.
     */
    public List<String> getOptionalAlternatives(String envKey, List<String> defaultValue) {
        return Splitter.on('|')
                .trimResults()
                .omitEmptyStrings()
                .splitToList(getOptional(envKey, Joiner.on('|').join(defaultValue)));
    }

    /**
     * Returns the requested value if set, or {@code defaultValue} if it's missing from the map entirely.
     */
    public String getOptional(String envKey, String defaultValue) {
        String value = envMap.get(envKey);
        return (value == null) ? defaultValue : value;
    }

    /**
     * Returns the requested value if set and non-empty, or {@code defaultValue} if it's missing from the map or is
     * empty or whitespace.
     */
    public String getOptionalNonEmpty(String envKey, String defaultValue) {
        String value = envMap.get(envKey);
        return (StringUtils.isBlank(value)) ? defaultValue : value;
    }

    /**
     * Returns the requested value if set, or throws an exception if it's missing from the map entirely.
     */
    public String getRequired(String envKey) {
        String value = envMap.get(envKey);
        if (value == null) {
            throw ConfigException.notFound(String.format("Missing required environment variable: %s", envKey));
        }
        return value;
    }

    public boolean isPresent(String envKey) {
        return envMap.containsKey(envKey);
    }
}
