package com.flagship.billing_eligibility.rules;

/**
 * One immutable version of the eligibility logic.
 *
 * Implementations must be pure: no side effects, no hidden state, no clock.
 * Identical input always yields an identical outcome, which is what makes a
 * published snapshot reproducible. A change in logic ships as a new version.
 */
public interface EligibilityRule {

    /**
     * Version identifier recorded on every snapshot evaluated with this rule.
     */
    String version();

    RuleOutcome evaluate(RuleInput input);
}
