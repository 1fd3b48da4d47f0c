package com.flagship.billing_eligibility.rules;

import com.flagship.billing_eligibility.billing.BillingStatus;
import com.flagship.billing_eligibility.evidence.EvidenceProfile;
import com.flagship.billing_eligibility.grain.AssignmentStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Append-only mapping from rule version identifier to rule logic.
 *
 * Versions can be added, never replaced or removed, so a snapshot published
 * under a version can always be re-evaluated under the same logic.
 */
@Slf4j
public class RuleRegistry {

    private final Map<String, EligibilityRule> rules = new LinkedHashMap<>();

    public RuleRegistry(EligibilityRule... initial) {
        for (EligibilityRule rule : initial) {
            register(rule);
        }
    }

    /**
     * Registers a new rule version.
     *
     * @throws IllegalStateException if the version is already registered
     */
    public synchronized void register(EligibilityRule rule) {
        String version = rule.version();
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Rule version is required");
        }
        if (rules.containsKey(version)) {
            throw new IllegalStateException(
                    "Rule version " + version + " is already registered and cannot be replaced");
        }
        rules.put(version, rule);
        log.info("Registered eligibility rule version {}", version);
    }

    /**
     * @throws RuleVersionUnknownException if the version was never registered
     */
    public synchronized EligibilityRule resolve(String version) {
        EligibilityRule rule = rules.get(version);
        if (rule == null) {
            throw new RuleVersionUnknownException(version, versions());
        }
        return rule;
    }

    public synchronized boolean isRegistered(String version) {
        return rules.containsKey(version);
    }

    public synchronized Set<String> versions() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(rules.keySet()));
    }

    /**
     * Evaluates one line under the given version.
     */
    public RuleOutcome evaluate(String version, EvidenceProfile evidence,
                                AssignmentStatus assignment, BillingStatus billing) {
        return resolve(version).evaluate(new RuleInput(evidence, assignment, billing));
    }
}
