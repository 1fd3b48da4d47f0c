package com.flagship.billing_eligibility.rules;

import com.flagship.billing_eligibility.evidence.EvidenceType;

import java.util.EnumSet;

/**
 * Rule v1.
 *
 * ready = assignment is current AND survey received AND images received AND NOT invoiced
 *
 * Deliveries evidence and paid status are ignored by this version.
 */
public final class BaselineEligibilityRule implements EligibilityRule {

    public static final String VERSION = "v1";

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public RuleOutcome evaluate(RuleInput input) {
        EnumSet<BlockerCode> blockers = baselineBlockers(input);
        return RuleOutcome.of(blockers.isEmpty(), blockers);
    }

    static EnumSet<BlockerCode> baselineBlockers(RuleInput input) {
        EnumSet<BlockerCode> blockers = EnumSet.noneOf(BlockerCode.class);
        switch (input.getAssignment()) {
            case STALE -> blockers.add(BlockerCode.ASSIGNMENT_STALE);
            case UNRESOLVED -> blockers.add(BlockerCode.ASSIGNMENT_UNRESOLVED);
            case CURRENT -> {
            }
        }
        if (!input.getEvidence().isReceived(EvidenceType.SURVEY)) {
            blockers.add(BlockerCode.MISSING_SURVEY);
        }
        if (!input.getEvidence().isReceived(EvidenceType.IMAGES)) {
            blockers.add(BlockerCode.MISSING_IMAGES);
        }
        if (input.getBilling().isInvoiced()) {
            blockers.add(BlockerCode.ALREADY_INVOICED);
        }
        return blockers;
    }
}
