package com.flagship.billing_eligibility.grain;

import lombok.Value;

import java.time.Instant;

/**
 * Half-open validity window {@code [effectiveStart, effectiveEnd)} assigning a
 * FLOC to a scope package. A null end means the interval is still open.
 */
@Value
public class AssignmentInterval {
    String flocId;
    String scopePackageId;
    Instant effectiveStart;
    Instant effectiveEnd;

    public boolean isOpen() {
        return effectiveEnd == null;
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(effectiveStart)
                && (effectiveEnd == null || instant.isBefore(effectiveEnd));
    }

    /**
     * True when this interval and a later-starting one share any instant.
     */
    boolean overlapsNext(AssignmentInterval next) {
        return effectiveEnd == null || effectiveEnd.isAfter(next.getEffectiveStart());
    }
}
