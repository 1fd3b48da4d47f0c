package com.flagship.billing_eligibility.snapshot;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PublishLease {
    String leaseKey;
    UUID holderId;
    Instant acquiredAt;
    Instant expiresAt;

    public static String keyFor(String environment, Instant asOfTs) {
        return environment + ":" + asOfTs;
    }
}
