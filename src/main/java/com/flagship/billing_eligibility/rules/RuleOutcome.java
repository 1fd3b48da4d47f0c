package com.flagship.billing_eligibility.rules;

import lombok.Value;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;

/**
 * Eligibility verdict for one line. Blocker codes are in canonical order.
 */
@Value
public class RuleOutcome {
    boolean readyToInvoice;
    List<BlockerCode> blockerCodes;

    public static RuleOutcome ready() {
        return new RuleOutcome(true, List.of());
    }

    public static RuleOutcome of(boolean readyToInvoice, Collection<BlockerCode> blockers) {
        EnumSet<BlockerCode> ordered = blockers.isEmpty()
                ? EnumSet.noneOf(BlockerCode.class)
                : EnumSet.copyOf(blockers);
        return new RuleOutcome(readyToInvoice, List.copyOf(ordered));
    }
}
