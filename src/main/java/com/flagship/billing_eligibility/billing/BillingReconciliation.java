package com.flagship.billing_eligibility.billing;

import com.flagship.billing_eligibility.grain.ScopeKey;
import com.flagship.billing_eligibility.quality.CycleWarning;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class BillingReconciliation {
    Map<ScopeKey, BillingStatus> statuses;
    List<OrphanInvoiceLine> orphans;
    List<CycleWarning> warnings;

    public BillingStatus statusFor(ScopeKey key) {
        return statuses.getOrDefault(key, BillingStatus.NOT_INVOICED);
    }
}
