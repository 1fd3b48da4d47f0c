package com.flagship.billing_eligibility.quality;

/**
 * Non-fatal data-quality conditions surfaced by a publish cycle.
 */
public enum WarningCode {
    /** A source delivered no rows for the cycle; every line reads "not received". */
    INGESTION_INCOMPLETE,
    /** Invoice lines whose key is absent from the spine. */
    ORPHAN_INVOICE_LINE,
    /** Evidence aggregates whose key is absent from the spine. */
    UNMATCHED_EVIDENCE
}
