package com.flagship.billing_eligibility.grain;

import lombok.Value;

/**
 * One FLOC awarded under one upload version of a scope package.
 * Re-uploads add new versions; earlier versions stay as history.
 */
@Value
public class PackageLine {
    String scopePackageId;
    String flocId;
    int uploadVersion;
}
