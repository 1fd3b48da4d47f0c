package com.flagship.billing_eligibility.rules;

/**
 * Named reasons a line is not eligible to invoice.
 *
 * Declaration order is the canonical order blocker codes are reported in.
 * New codes are appended; existing ones are never renamed.
 */
public enum BlockerCode {
    ASSIGNMENT_UNRESOLVED,
    ASSIGNMENT_STALE,
    MISSING_SURVEY,
    MISSING_IMAGES,
    INSUFFICIENT_IMAGES,
    MISSING_DELIVERIES,
    ALREADY_INVOICED
}
