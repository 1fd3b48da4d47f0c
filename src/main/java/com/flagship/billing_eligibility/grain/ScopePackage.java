package com.flagship.billing_eligibility.grain;

import lombok.Value;

/**
 * An awarded set of FLOCs a vendor is authorized to invoice.
 */
@Value
public class ScopePackage {
    String scopePackageId;
    String vendor;
    String status;
    int uploadVersion;
}
