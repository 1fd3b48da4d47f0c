package com.flagship.billing_eligibility.snapshot;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The environment's designated current snapshot.
 */
@Value
public class CurrentPointer {
    String environment;
    UUID snapshotId;
    Instant asOfTs;
    long version;
    Instant updatedAt;
}
