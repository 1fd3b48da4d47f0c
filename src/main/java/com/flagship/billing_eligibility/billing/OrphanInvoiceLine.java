package com.flagship.billing_eligibility.billing;

import lombok.Value;

import java.time.Instant;

/**
 * An invoice line whose (package, floc) is not on the spine. Excluded from the
 * billing join and reported to operators; it never blocks a publish.
 */
@Value
public class OrphanInvoiceLine {
    String invoiceId;
    String scopePackageId;
    String flocId;
    Instant invoicedTs;
}
