package com.flagship.billing_eligibility.exception;

/**
 * Base type for failures raised by a publish cycle.
 *
 * Thrown failures abort the cycle before anything touches the snapshot
 * store. Data-quality findings that do not abort are recorded as warnings
 * instead of being thrown.
 */
public abstract class EligibilityException extends RuntimeException {

    protected EligibilityException(String message) {
        super(message);
    }

    protected EligibilityException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable name used in metrics tags and failure records.
     */
    public abstract String getErrorCode();
}
