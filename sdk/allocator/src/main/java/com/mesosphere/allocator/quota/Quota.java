package com.mesosphere.allocator.quota;

import com.mesosphere.allocator.offer.ResourceQuantities;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.util.Optional;

/**
 * The quota configured for a role: a guarantee of resources the role is entitled to, and an optional limit on the
 * resources it may consume. Without a limit the role is unbounded.
 */
public final class Quota {

    private final ResourceQuantities guarantee;
    private final Optional<ResourceQuantities> limit;

    public Quota(ResourceQuantities guarantee, Optional<ResourceQuantities> limit) {
        this.guarantee = guarantee;
        this.limit = limit;
    }

    public static Quota guarantee(ResourceQuantities guarantee) {
        return new Quota(guarantee, Optional.empty());
    }

    public ResourceQuantities getGuarantee() {
        return guarantee;
    }

    public Optional<ResourceQuantities> getLimit() {
        return limit;
    }

    @Override
    public boolean equals(Object o) {
        return EqualsBuilder.reflectionEquals(this, o);
    }

    @Override
    public int hashCode() {
        return HashCodeBuilder.reflectionHashCode(this);
    }

    @Override
    public String toString() {
        return String.format("Quota[guarantee=%s, limit=%s]",
                guarantee, limit.map(ResourceQuantities::toString).orElse("unbounded"));
    }
}
