package com.flagship.billing_eligibility.grain;

/**
 * How a spine row relates to the FLOC's assignment at the as-of time.
 */
public enum AssignmentStatus {

    /**
     * The interval containing as-of points at this package.
     */
    CURRENT,

    /**
     * The interval containing as-of points at another package (reassigned).
     */
    STALE,

    /**
     * No interval contains as-of. The line was awarded but its assignment
     * cannot be resolved; it stays in the spine.
     */
    UNRESOLVED
}
