package com.flagship.billing_eligibility.pipeline;

import com.flagship.billing_eligibility.billing.OrphanInvoiceLine;
import com.flagship.billing_eligibility.evidence.UnmatchedEvidence;
import com.flagship.billing_eligibility.quality.CycleWarning;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Everything a cycle computes in the DRAFT phase. Held in memory only;
 * nothing here has been written anywhere.
 */
@Value
public class DraftSnapshot {
    Instant asOfTs;
    String ruleVersion;
    List<EligibilityLine> lines;
    List<CycleWarning> warnings;
    List<OrphanInvoiceLine> orphanInvoiceLines;
    List<UnmatchedEvidence> unmatchedEvidence;

    public long readyCount() {
        return lines.stream().filter(EligibilityLine::isReadyToInvoice).count();
    }
}
