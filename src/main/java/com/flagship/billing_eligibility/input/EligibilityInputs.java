package com.flagship.billing_eligibility.input;

import com.flagship.billing_eligibility.billing.InvoiceLineFact;
import com.flagship.billing_eligibility.billing.InvoiceReversal;
import com.flagship.billing_eligibility.evidence.EvidenceAggregate;
import com.flagship.billing_eligibility.grain.AssignmentInterval;
import com.flagship.billing_eligibility.grain.PackageLine;
import com.flagship.billing_eligibility.grain.ScopePackage;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Read-only conformed relations a publish cycle reconciles.
 */
@Value
@Builder(toBuilder = true)
public class EligibilityInputs {
    @Singular("scopePackage")
    List<ScopePackage> packages;
    @Singular
    List<PackageLine> lines;
    @Singular
    List<AssignmentInterval> intervals;
    @Singular
    List<EvidenceAggregate> evidenceAggregates;
    @Singular
    List<InvoiceLineFact> invoices;
    @Singular
    List<InvoiceReversal> reversals;
}
