package com.flagship.billing_eligibility.input;

import java.time.Instant;

/**
 * Supplies the conformed input relations as visible at an instant.
 *
 * Implementations only read; ingestion owns these relations.
 */
public interface EligibilityInputSource {

    EligibilityInputs load(Instant asOf);
}
