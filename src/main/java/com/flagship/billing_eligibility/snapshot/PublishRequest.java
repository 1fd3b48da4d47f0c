package com.flagship.billing_eligibility.snapshot;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Arguments of one publish call.
 *
 * {@code ruleVersion} falls back to the configured default when null.
 * {@code requestKey} is optional; a key that already produced a published
 * snapshot returns that snapshot instead of minting a new one.
 */
@Value
@Builder
public class PublishRequest {
    Instant asOfTs;
    String ruleVersion;
    boolean dryRun;
    String requestKey;

    public static PublishRequest of(Instant asOfTs, String ruleVersion) {
        return PublishRequest.builder().asOfTs(asOfTs).ruleVersion(ruleVersion).build();
    }

    public static PublishRequest dryRun(Instant asOfTs, String ruleVersion) {
        return PublishRequest.builder().asOfTs(asOfTs).ruleVersion(ruleVersion).dryRun(true).build();
    }
}
