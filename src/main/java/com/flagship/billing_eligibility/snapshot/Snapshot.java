package com.flagship.billing_eligibility.snapshot;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot header domain object.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - Every transition returns a new instance
 * - Once PUBLISHED, only the summary status may still change
 */
@Value
public class Snapshot {
    UUID snapshotId;
    Instant asOfTs;
    String ruleVersion;
    String environment;
    SnapshotStatus status;
    SummaryStatus summaryStatus;
    String requestKey;
    int lineCount;
    String failureReason;
    Instant createdAt;
    Instant publishedAt;

    /**
     * Creates a header in DRAFT status.
     */
    public static Snapshot draft(UUID snapshotId, Instant asOfTs, String ruleVersion, String environment,
                                 String requestKey, int lineCount, Instant createdAt) {
        return new Snapshot(
            snapshotId,
            asOfTs,
            ruleVersion,
            environment,
            SnapshotStatus.DRAFT,
            SummaryStatus.PENDING,
            requestKey,
            lineCount,
            null,
            createdAt,
            null
        );
    }

    /**
     * DRAFT -> COMMITTING.
     */
    public Snapshot beginCommit() {
        requireStatus(SnapshotStatus.DRAFT, "begin commit of");
        return withStatus(SnapshotStatus.COMMITTING, null, null);
    }

    /**
     * COMMITTING -> PUBLISHED.
     */
    public Snapshot publish(Instant publishedAt) {
        requireStatus(SnapshotStatus.COMMITTING, "publish");
        return withStatus(SnapshotStatus.PUBLISHED, null, publishedAt);
    }

    /**
     * DRAFT or COMMITTING -> FAILED. A failed snapshot carries no lines and no request key.
     */
    public Snapshot fail(String reason) {
        if (isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot fail snapshot %s in %s status", snapshotId, status));
        }
        return new Snapshot(snapshotId, asOfTs, ruleVersion, environment, SnapshotStatus.FAILED,
                summaryStatus, null, 0, reason, createdAt, null);
    }

    /**
     * Records the outcome of summary generation. Only valid once published.
     */
    public Snapshot withSummaryStatus(SummaryStatus summaryStatus) {
        requireStatus(SnapshotStatus.PUBLISHED, "change summary status of");
        return new Snapshot(snapshotId, asOfTs, ruleVersion, environment, status,
                summaryStatus, requestKey, lineCount, failureReason, createdAt, publishedAt);
    }

    public boolean isTerminal() {
        return status == SnapshotStatus.PUBLISHED || status == SnapshotStatus.FAILED;
    }

    public boolean isPublished() {
        return status == SnapshotStatus.PUBLISHED;
    }

    public boolean canTransitionTo(SnapshotStatus target) {
        return switch (status) {
            case DRAFT -> target == SnapshotStatus.COMMITTING || target == SnapshotStatus.FAILED;
            case COMMITTING -> target == SnapshotStatus.PUBLISHED || target == SnapshotStatus.FAILED;
            case PUBLISHED, FAILED -> false;
        };
    }

    private void requireStatus(SnapshotStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException(
                String.format("Cannot %s snapshot %s in %s status. Snapshot must be %s.",
                    action, snapshotId, status, expected));
        }
    }

    private Snapshot withStatus(SnapshotStatus next, String reason, Instant published) {
        return new Snapshot(snapshotId, asOfTs, ruleVersion, environment, next,
                summaryStatus, requestKey, lineCount, reason, createdAt, published);
    }
}
