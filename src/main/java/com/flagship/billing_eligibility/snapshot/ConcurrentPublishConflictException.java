package com.flagship.billing_eligibility.snapshot;

import com.flagship.billing_eligibility.exception.EligibilityException;

/**
 * Another cycle holds the publish lease for the same environment and as-of.
 * The losing caller may retry once the holder finishes.
 */
public class ConcurrentPublishConflictException extends EligibilityException {

    private final String leaseKey;

    public ConcurrentPublishConflictException(String leaseKey) {
        super("A publish is already in flight for " + leaseKey);
        this.leaseKey = leaseKey;
    }

    public String getLeaseKey() {
        return leaseKey;
    }

    @Override
    public String getErrorCode() {
        return "CONCURRENT_PUBLISH_CONFLICT";
    }
}
