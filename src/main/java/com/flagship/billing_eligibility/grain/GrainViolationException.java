package com.flagship.billing_eligibility.grain;

import com.flagship.billing_eligibility.exception.EligibilityException;
import lombok.Getter;

/**
 * Raised when an input relation breaks its grain contract.
 *
 * Duplicate keys and overlapping assignment intervals mean data corruption
 * upstream. The publish cycle aborts; nothing is picked arbitrarily.
 */
@Getter
public class GrainViolationException extends EligibilityException {

    public enum Kind {
        DUPLICATE_LINE,
        DUPLICATE_EVIDENCE,
        OVERLAPPING_INTERVALS,
        INVALID_INTERVAL,
        BLANK_KEY,
        UNKNOWN_PACKAGE,
        UNKNOWN_VENDOR
    }

    private final Kind kind;

    public GrainViolationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    @Override
    public String getErrorCode() {
        return "GRAIN_VIOLATION";
    }
}
