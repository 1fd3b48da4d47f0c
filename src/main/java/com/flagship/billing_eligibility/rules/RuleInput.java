package com.flagship.billing_eligibility.rules;

import com.flagship.billing_eligibility.billing.BillingStatus;
import com.flagship.billing_eligibility.evidence.EvidenceProfile;
import com.flagship.billing_eligibility.grain.AssignmentStatus;
import lombok.Value;

/**
 * Reconciled facts for one line, the complete input of a rule.
 */
@Value
public class RuleInput {
    EvidenceProfile evidence;
    AssignmentStatus assignment;
    BillingStatus billing;
}
