package com.flagship.billing_eligibility.snapshot;

/**
 * Lifecycle of one publish cycle's snapshot.
 *
 * DRAFT -> COMMITTING -> PUBLISHED, or DRAFT/COMMITTING -> FAILED.
 * PUBLISHED and FAILED are terminal; a published snapshot is never edited.
 */
public enum SnapshotStatus {

    /**
     * Spine and reconciliation computed in memory. Nothing written.
     */
    DRAFT,

    /**
     * Lines are being appended inside the commit transaction.
     */
    COMMITTING,

    /**
     * Lines committed and the current pointer considered. Immutable.
     */
    PUBLISHED,

    /**
     * The cycle aborted. No lines are visible for this snapshot.
     */
    FAILED
}
