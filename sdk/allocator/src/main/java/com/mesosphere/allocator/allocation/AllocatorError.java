package com.mesosphere.allocator.allocation;

/**
 * Container for types related to {@link AllocatorException}s.
 */
public class AllocatorError {

    private AllocatorError() {
        // do not instantiate
    }

    /**
     * Machine-parseable indicator of the cause for a rejected allocator operation.
     */
    public enum Reason {

        /**
         * The operation would break a capacity invariant: resource arithmetic going negative, allocations exceeding
         * an agent's total, or quota guarantees exceeding the cluster's capacity. State was left unchanged.
         */
        VALIDATION,

        /**
         * The operation referenced an agent, framework or role which is not tracked. This is usually a benign race
         * with a removal which was processed first.
         */
        NOT_FOUND,

        /**
         * The operation attempted to add an id which is already tracked. The existing entry was preserved.
         */
        DUPLICATE
    }
}
