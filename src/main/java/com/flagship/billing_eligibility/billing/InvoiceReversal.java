package com.flagship.billing_eligibility.billing;

import lombok.Value;

import java.time.Instant;

/**
 * Explicit cancellation of an invoice line. The only way an invoiced line
 * can read as not invoiced in a later snapshot.
 */
@Value
public class InvoiceReversal {
    String invoiceId;
    String scopePackageId;
    String flocId;
    Instant reversedTs;
    String reason;
}
