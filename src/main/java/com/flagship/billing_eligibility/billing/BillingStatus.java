package com.flagship.billing_eligibility.billing;

import lombok.Value;

/**
 * Invoiced and paid state of one spine row as of the cycle timestamp.
 */
@Value
public class BillingStatus {

    public static final BillingStatus NOT_INVOICED = new BillingStatus(false, false);

    boolean invoiced;
    boolean paid;
}
