package com.mesosphere.allocator.allocation;

import com.mesosphere.allocator.allocation.AllocatorError.Reason;

/**
 * Exception that indicates that an allocator operation was rejected before any state was modified.
 */
public class AllocatorException extends Exception {

    private final Reason reason;

    public AllocatorException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AllocatorException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static AllocatorException validation(String format, Object... args) {
        return new AllocatorException(Reason.VALIDATION, String.format(format, args));
    }

    public static AllocatorException notFound(String format, Object... args) {
        return new AllocatorException(Reason.NOT_FOUND, String.format(format, args));
    }

    public static AllocatorException duplicate(String format, Object... args) {
        return new AllocatorException(Reason.DUPLICATE, String.format(format, args));
    }

    /**
     * Returns the machine-parseable reason for this exception.
     */
    public Reason getReason() {
        return reason;
    }

    @Override
    public String getMessage() {
        return String.format("%s (reason: %s)", super.getMessage(), reason);
    }
}
