package com.flagship.billing_eligibility.rules;

import com.flagship.billing_eligibility.billing.BillingStatus;
import com.flagship.billing_eligibility.evidence.EvidenceProfile;
import com.flagship.billing_eligibility.evidence.EvidenceStatus;
import com.flagship.billing_eligibility.evidence.EvidenceType;
import com.flagship.billing_eligibility.grain.AssignmentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Rule tests.
 *
 * These tests verify that:
 * - ready_to_invoice is true exactly when no blocker applies
 * - Blockers come out in canonical order
 * - v2 adds the image floor and deliveries requirement on top of v1
 */
class EligibilityRuleTest {

    private static final Instant TS = Instant.parse("2024-02-01T00:00:00Z");

    private final EligibilityRule v1 = new BaselineEligibilityRule();
    private final EligibilityRule v2 = new ImageFloorEligibilityRule();

    private static EvidenceProfile evidence(boolean survey, int images, boolean deliveries) {
        Map<EvidenceType, EvidenceStatus> statuses = new EnumMap<>(EvidenceType.class);
        if (survey) {
            statuses.put(EvidenceType.SURVEY, new EvidenceStatus(true, TS, 1));
        }
        if (images > 0) {
            statuses.put(EvidenceType.IMAGES, new EvidenceStatus(true, TS, images));
        }
        if (deliveries) {
            statuses.put(EvidenceType.DELIVERIES, new EvidenceStatus(true, TS, 1));
        }
        return EvidenceProfile.of(statuses);
    }

    private static RuleInput input(EvidenceProfile evidence, AssignmentStatus assignment, boolean invoiced) {
        return new RuleInput(evidence, assignment, new BillingStatus(invoiced, false));
    }

    @Nested
    @DisplayName("v1 baseline")
    class Baseline {

        @Test
        @DisplayName("Current, survey and images present, not invoiced: ready")
        void ready() {
            RuleOutcome outcome = v1.evaluate(input(evidence(true, 1, false), AssignmentStatus.CURRENT, false));

            assertTrue(outcome.isReadyToInvoice());
            assertTrue(outcome.getBlockerCodes().isEmpty());
        }

        @Test
        @DisplayName("Missing survey blocks")
        void missingSurvey() {
            RuleOutcome outcome = v1.evaluate(input(evidence(false, 3, true), AssignmentStatus.CURRENT, false));

            assertFalse(outcome.isReadyToInvoice());
            assertEquals(List.of(BlockerCode.MISSING_SURVEY), outcome.getBlockerCodes());
        }

        @Test
        @DisplayName("Already invoiced blocks even with complete evidence")
        void alreadyInvoiced() {
            RuleOutcome outcome = v1.evaluate(input(evidence(true, 3, true), AssignmentStatus.CURRENT, true));

            assertEquals(List.of(BlockerCode.ALREADY_INVOICED), outcome.getBlockerCodes());
        }

        @Test
        @DisplayName("Stale and unresolved assignments block with their own codes")
        void assignmentBlockers() {
            assertEquals(List.of(BlockerCode.ASSIGNMENT_STALE),
                    v1.evaluate(input(evidence(true, 1, false), AssignmentStatus.STALE, false)).getBlockerCodes());
            assertEquals(List.of(BlockerCode.ASSIGNMENT_UNRESOLVED),
                    v1.evaluate(input(evidence(true, 1, false), AssignmentStatus.UNRESOLVED, false)).getBlockerCodes());
        }

        @Test
        @DisplayName("Deliveries are ignored by v1")
        void deliveriesIgnored() {
            assertTrue(v1.evaluate(input(evidence(true, 1, false), AssignmentStatus.CURRENT, false))
                    .isReadyToInvoice());
        }

        @Test
        @DisplayName("All blockers at once are listed in canonical order")
        void canonicalOrder() {
            RuleOutcome outcome = v1.evaluate(input(EvidenceProfile.empty(), AssignmentStatus.STALE, true));

            assertEquals(List.of(BlockerCode.ASSIGNMENT_STALE, BlockerCode.MISSING_SURVEY,
                    BlockerCode.MISSING_IMAGES, BlockerCode.ALREADY_INVOICED), outcome.getBlockerCodes());
        }
    }

    @Nested
    @DisplayName("v2 image floor")
    class ImageFloor {

        @Test
        @DisplayName("Fewer than the minimum images blocks with INSUFFICIENT_IMAGES")
        void insufficientImages() {
            RuleOutcome outcome = v2.evaluate(input(
                    evidence(true, ImageFloorEligibilityRule.DEFAULT_MIN_IMAGES - 1, true), AssignmentStatus.CURRENT, false));

            assertEquals(List.of(BlockerCode.INSUFFICIENT_IMAGES), outcome.getBlockerCodes());
        }

        @Test
        @DisplayName("Exactly the minimum images with deliveries is ready")
        void atFloor() {
            RuleOutcome outcome = v2.evaluate(input(
                    evidence(true, ImageFloorEligibilityRule.DEFAULT_MIN_IMAGES, true), AssignmentStatus.CURRENT, false));

            assertTrue(outcome.isReadyToInvoice());
        }

        @Test
        @DisplayName("No images reports MISSING_IMAGES, not INSUFFICIENT_IMAGES")
        void noImages() {
            RuleOutcome outcome = v2.evaluate(input(evidence(true, 0, true), AssignmentStatus.CURRENT, false));

            assertEquals(List.of(BlockerCode.MISSING_IMAGES), outcome.getBlockerCodes());
        }

        @Test
        @DisplayName("Registry-supplied floor replaces the default")
        void customFloor() {
            EligibilityRule strict = new ImageFloorEligibilityRule(12);
            RuleInput tenImages = input(evidence(true, 10, true), AssignmentStatus.CURRENT, false);

            assertTrue(v2.evaluate(tenImages).isReadyToInvoice());
            assertEquals(List.of(BlockerCode.INSUFFICIENT_IMAGES), strict.evaluate(tenImages).getBlockerCodes());
            assertTrue(strict.evaluate(input(evidence(true, 12, true), AssignmentStatus.CURRENT, false))
                    .isReadyToInvoice());
        }

        @Test
        @DisplayName("Image floor below 1 is rejected")
        void invalidFloor() {
            assertThrows(IllegalArgumentException.class, () -> new ImageFloorEligibilityRule(0));
        }

        @Test
        @DisplayName("A line ready under v1 can be blocked under v2")
        void stricterThanBaseline() {
            RuleInput in = input(evidence(true, 2, false), AssignmentStatus.CURRENT, false);

            assertTrue(v1.evaluate(in).isReadyToInvoice());
            assertEquals(List.of(BlockerCode.INSUFFICIENT_IMAGES, BlockerCode.MISSING_DELIVERIES),
                    v2.evaluate(in).getBlockerCodes());
        }
    }

    @Test
    @DisplayName("Adding evidence never adds a blocker")
    void evidenceIsMonotone() {
        for (EligibilityRule rule : List.of(v1, v2)) {
            for (AssignmentStatus assignment : AssignmentStatus.values()) {
                for (boolean invoiced : new boolean[]{false, true}) {
                    List<BlockerCode> less = rule.evaluate(input(evidence(false, 0, false), assignment, invoiced))
                            .getBlockerCodes();
                    List<BlockerCode> more = rule.evaluate(input(evidence(true, 10, true), assignment, invoiced))
                            .getBlockerCodes();
                    assertTrue(less.containsAll(more), rule.version() + " " + assignment + " " + invoiced);
                }
            }
        }
    }
}
