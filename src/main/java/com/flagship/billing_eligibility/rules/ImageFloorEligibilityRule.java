package com.flagship.billing_eligibility.rules;

import com.flagship.billing_eligibility.evidence.EvidenceType;

import java.util.EnumSet;

/**
 * Rule v2: everything v1 requires, plus
 * - at least {@code minImages} images delivered, {@value #DEFAULT_MIN_IMAGES}
 *   unless the registry is built with another floor (INSUFFICIENT_IMAGES)
 * - deliveries evidence received (MISSING_DELIVERIES)
 *
 * A line with no images at all reports MISSING_IMAGES only.
 */
public final class ImageFloorEligibilityRule implements EligibilityRule {

    public static final String VERSION = "v2";
    public static final int DEFAULT_MIN_IMAGES = 8;

    private final int minImages;

    public ImageFloorEligibilityRule() {
        this(DEFAULT_MIN_IMAGES);
    }

    public ImageFloorEligibilityRule(int minImages) {
        if (minImages < 1) {
            throw new IllegalArgumentException("Image floor must be at least 1, got " + minImages);
        }
        this.minImages = minImages;
    }

    public int minImages() {
        return minImages;
    }

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public RuleOutcome evaluate(RuleInput input) {
        EnumSet<BlockerCode> blockers = BaselineEligibilityRule.baselineBlockers(input);
        if (input.getEvidence().isReceived(EvidenceType.IMAGES)
                && input.getEvidence().count(EvidenceType.IMAGES) < minImages) {
            blockers.add(BlockerCode.INSUFFICIENT_IMAGES);
        }
        if (!input.getEvidence().isReceived(EvidenceType.DELIVERIES)) {
            blockers.add(BlockerCode.MISSING_DELIVERIES);
        }
        return RuleOutcome.of(blockers.isEmpty(), blockers);
    }
}
