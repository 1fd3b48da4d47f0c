package com.flagship.billing_eligibility.evidence;

import lombok.Value;

import java.time.Instant;

/**
 * Conformed evidence rollup. At most one row per
 * (scope_package_id, floc_id, evidence_type).
 */
@Value
public class EvidenceAggregate {
    String scopePackageId;
    String flocId;
    EvidenceType evidenceType;
    boolean received;
    Instant evidenceTs;
    int count;
}
