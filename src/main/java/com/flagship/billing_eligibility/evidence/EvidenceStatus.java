package com.flagship.billing_eligibility.evidence;

import lombok.Value;

import java.time.Instant;

/**
 * Evidence state of one type for one spine row. Absence of an aggregate row
 * is the explicit {@link #NOT_RECEIVED} value, never null.
 */
@Value
public class EvidenceStatus {

    public static final EvidenceStatus NOT_RECEIVED = new EvidenceStatus(false, null, 0);

    boolean received;
    Instant evidenceTs;
    int count;
}
