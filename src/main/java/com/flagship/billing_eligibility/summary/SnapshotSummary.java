package com.flagship.billing_eligibility.summary;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Per-package health counts of one snapshot.
 */
@Value
public class SnapshotSummary {
    UUID snapshotId;
    String scopePackageId;
    int totalCount;
    int readyCount;
    int blockedCount;
    int invoicedCount;
    int paidCount;
    BigDecimal readyRate;
    Instant asOfTs;
    String ruleVersion;
}
