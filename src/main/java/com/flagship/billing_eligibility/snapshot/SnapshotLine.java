package com.flagship.billing_eligibility.snapshot;

import com.flagship.billing_eligibility.grain.AssignmentStatus;
import com.flagship.billing_eligibility.pipeline.EligibilityLine;
import com.flagship.billing_eligibility.rules.BlockerCode;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One committed line of a snapshot. Write-once; corrections are new snapshots.
 */
@Value
public class SnapshotLine {
    UUID snapshotId;
    String scopePackageId;
    String flocId;
    AssignmentStatus assignmentStatus;
    boolean readyToInvoice;
    boolean invoiced;
    boolean paid;
    List<BlockerCode> blockerCodes;
    Instant asOfTs;
    String ruleVersion;

    public static SnapshotLine bind(UUID snapshotId, Instant asOfTs, String ruleVersion, EligibilityLine line) {
        return new SnapshotLine(
            snapshotId,
            line.getKey().getScopePackageId(),
            line.getKey().getFlocId(),
            line.getAssignmentStatus(),
            line.isReadyToInvoice(),
            line.isInvoiced(),
            line.isPaid(),
            line.getBlockerCodes(),
            asOfTs,
            ruleVersion
        );
    }
}
