package com.flagship.billing_eligibility.snapshot;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for snapshot headers.
 *
 * No setters: the header only changes through {@link #updateFromDomain},
 * which refuses to alter a terminal snapshot beyond its summary status.
 * The database trigger on {@code snapshots} enforces the same rule.
 */
@Entity
@Table(
    name = "snapshots",
    indexes = {
        @Index(name = "idx_snapshots_as_of", columnList = "environment, as_of_ts"),
        @Index(name = "idx_snapshots_summary_status", columnList = "summary_status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SnapshotEntity {

    @Id
    @Column(name = "snapshot_id", nullable = false, updatable = false)
    private UUID snapshotId;

    @Column(name = "as_of_ts", nullable = false, updatable = false)
    private Instant asOfTs;

    @Column(name = "rule_version", nullable = false, updatable = false, length = 50)
    private String ruleVersion;

    @Column(name = "environment", nullable = false, updatable = false, length = 100)
    private String environment;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SnapshotStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "summary_status", nullable = false, length = 30)
    private SummaryStatus summaryStatus;

    @Column(name = "request_key", unique = true, length = 200)
    private String requestKey;

    @Column(name = "line_count", nullable = false)
    private int lineCount;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    static SnapshotEntity fromDomain(Snapshot snapshot) {
        return new SnapshotEntity(
            snapshot.getSnapshotId(),
            snapshot.getAsOfTs(),
            snapshot.getRuleVersion(),
            snapshot.getEnvironment(),
            snapshot.getStatus(),
            snapshot.getSummaryStatus(),
            snapshot.getRequestKey(),
            snapshot.getLineCount(),
            snapshot.getFailureReason(),
            snapshot.getCreatedAt(),
            snapshot.getPublishedAt()
        );
    }

    public Snapshot toDomain() {
        return new Snapshot(
            snapshotId,
            asOfTs,
            ruleVersion,
            environment,
            status,
            summaryStatus,
            requestKey,
            lineCount,
            failureReason,
            createdAt,
            publishedAt
        );
    }

    /**
     * Copies the mutable state of a domain snapshot onto this entity.
     *
     * @throws IllegalStateException if this entity is terminal and the update
     *         touches anything but the summary status
     */
    void updateFromDomain(Snapshot snapshot) {
        if (!snapshotId.equals(snapshot.getSnapshotId())) {
            throw new IllegalArgumentException(
                "Snapshot id mismatch: " + snapshotId + " vs " + snapshot.getSnapshotId());
        }
        boolean terminal = status == SnapshotStatus.PUBLISHED || status == SnapshotStatus.FAILED;
        if (terminal && (snapshot.getStatus() != status || snapshot.getLineCount() != lineCount)) {
            throw new IllegalStateException(
                "Snapshot " + snapshotId + " is " + status + " and cannot be modified");
        }
        this.status = snapshot.getStatus();
        this.summaryStatus = snapshot.getSummaryStatus();
        this.requestKey = snapshot.getRequestKey();
        this.lineCount = snapshot.getLineCount();
        this.failureReason = snapshot.getFailureReason();
        this.publishedAt = snapshot.getPublishedAt();
    }
}
