package com.flagship.billing_eligibility.billing;

import lombok.Value;

import java.time.Instant;

/**
 * One FLOC billed on a vendor invoice. {@code paidTs} is null until paid.
 */
@Value
public class InvoiceLineFact {
    String invoiceId;
    String scopePackageId;
    String flocId;
    Instant invoicedTs;
    Instant paidTs;
}
