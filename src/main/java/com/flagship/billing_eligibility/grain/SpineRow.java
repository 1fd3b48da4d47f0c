package com.flagship.billing_eligibility.grain;

import lombok.Value;

/**
 * One row of the canonical (package, line) spine with its resolved assignment.
 *
 * {@code assignedPackageId} is the package the FLOC belongs to at as-of,
 * or null when the assignment is unresolved.
 */
@Value
public class SpineRow {
    ScopeKey key;
    String vendor;
    AssignmentStatus assignmentStatus;
    String assignedPackageId;

    public boolean isCurrentAssignment() {
        return assignmentStatus == AssignmentStatus.CURRENT;
    }
}
