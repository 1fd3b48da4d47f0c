package com.flagship.billing_eligibility.pipeline;

import com.flagship.billing_eligibility.grain.AssignmentStatus;
import com.flagship.billing_eligibility.grain.ScopeKey;
import com.flagship.billing_eligibility.rules.BlockerCode;
import lombok.Value;

import java.util.List;

/**
 * Computed eligibility of one (package, floc) before it is bound to a snapshot.
 */
@Value
public class EligibilityLine {
    ScopeKey key;
    AssignmentStatus assignmentStatus;
    boolean readyToInvoice;
    boolean invoiced;
    boolean paid;
    List<BlockerCode> blockerCodes;
}
