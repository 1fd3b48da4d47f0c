package com.flagship.billing_eligibility.snapshot;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Outbox payload announcing a committed snapshot to downstream readers.
 */
@Value
public class SnapshotPublishedEvent {

    public static final String AGGREGATE_TYPE = "Snapshot";
    public static final String EVENT_TYPE = "SnapshotPublished";

    UUID snapshotId;
    String environment;
    Instant asOfTs;
    String ruleVersion;
    int lineCount;
    long readyCount;
    boolean current;
    Instant publishedAt;
}
