package com.flagship.billing_eligibility.evidence;

import lombok.Value;

/**
 * Evidence delivered for a key the spine does not contain.
 * Never joined; surfaced to operators.
 */
@Value
public class UnmatchedEvidence {
    String scopePackageId;
    String flocId;
    EvidenceType evidenceType;
    int count;
}
