package com.flagship.billing_eligibility.snapshot;

/**
 * State of the derived per-package summary of a published snapshot.
 */
public enum SummaryStatus {
    PENDING,
    COMPLETE,
    PENDING_REGENERATION
}
