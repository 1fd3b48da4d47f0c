package com.flagship.billing_eligibility.evidence;

import com.flagship.billing_eligibility.grain.AssignmentStatus;
import com.flagship.billing_eligibility.grain.GrainViolationException;
import com.flagship.billing_eligibility.grain.ScopeKey;
import com.flagship.billing_eligibility.grain.SpineRow;
import com.flagship.billing_eligibility.quality.CycleWarning;
import com.flagship.billing_eligibility.quality.WarningCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceReconcilerTest {

    private static final Instant AS_OF = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant BEFORE = Instant.parse("2024-02-20T00:00:00Z");
    private static final Instant AFTER = Instant.parse("2024-03-02T00:00:00Z");

    private static final ScopeKey K1 = new ScopeKey("P1", "F1");
    private static final ScopeKey K2 = new ScopeKey("P1", "F2");

    private final EvidenceReconciler reconciler = new EvidenceReconciler();

    private static List<SpineRow> spine(ScopeKey... keys) {
        return Arrays.stream(keys)
                .map(k -> new SpineRow(k, "ACME", AssignmentStatus.CURRENT, k.getScopePackageId()))
                .toList();
    }

    private static EvidenceAggregate received(ScopeKey key, EvidenceType type, int count, Instant ts) {
        return new EvidenceAggregate(key.getScopePackageId(), key.getFlocId(), type, true, ts, count);
    }

    @Test
    @DisplayName("Every spine row gets a status for every evidence type")
    void everyRowGetsFullProfile() {
        EvidenceReconciliation result = reconciler.reconcile(
                spine(K1, K2),
                List.of(received(K1, EvidenceType.SURVEY, 1, BEFORE),
                        received(K1, EvidenceType.IMAGES, 12, BEFORE),
                        received(K2, EvidenceType.DELIVERIES, 3, BEFORE)),
                AS_OF);

        EvidenceProfile p1 = result.profileFor(K1);
        assertTrue(p1.isReceived(EvidenceType.SURVEY));
        assertTrue(p1.isReceived(EvidenceType.IMAGES));
        assertEquals(12, p1.count(EvidenceType.IMAGES));
        assertFalse(p1.isReceived(EvidenceType.DELIVERIES));
        assertEquals(EvidenceStatus.NOT_RECEIVED, p1.get(EvidenceType.DELIVERIES));

        EvidenceProfile p2 = result.profileFor(K2);
        assertFalse(p2.isReceived(EvidenceType.SURVEY));
        assertTrue(p2.isReceived(EvidenceType.DELIVERIES));
        assertEquals(2, result.getProfiles().size());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    @DisplayName("Evidence stamped after as-of is not yet visible")
    void futureEvidenceIsNotReceived() {
        EvidenceReconciliation result = reconciler.reconcile(
                spine(K1),
                List.of(received(K1, EvidenceType.SURVEY, 1, AFTER),
                        received(K1, EvidenceType.IMAGES, 9, AS_OF),
                        received(K1, EvidenceType.DELIVERIES, 1, BEFORE)),
                AS_OF);

        assertFalse(result.profileFor(K1).isReceived(EvidenceType.SURVEY));
        assertTrue(result.profileFor(K1).isReceived(EvidenceType.IMAGES), "as-of itself is inclusive");
    }

    @Test
    @DisplayName("An aggregate with received_flg false stays not received")
    void explicitNotReceived() {
        EvidenceReconciliation result = reconciler.reconcile(
                spine(K1),
                List.of(new EvidenceAggregate("P1", "F1", EvidenceType.SURVEY, false, BEFORE, 0),
                        received(K1, EvidenceType.IMAGES, 1, BEFORE),
                        received(K1, EvidenceType.DELIVERIES, 1, BEFORE)),
                AS_OF);

        assertFalse(result.profileFor(K1).isReceived(EvidenceType.SURVEY));
    }

    @Test
    @DisplayName("A type with no rows at all is recorded as ingestion incomplete")
    void emptySourceIsIngestionIncomplete() {
        EvidenceReconciliation result = reconciler.reconcile(
                spine(K1),
                List.of(received(K1, EvidenceType.SURVEY, 1, BEFORE)),
                AS_OF);

        List<String> incomplete = result.getWarnings().stream()
                .filter(w -> w.getCode() == WarningCode.INGESTION_INCOMPLETE)
                .map(CycleWarning::getSource)
                .toList();
        assertEquals(List.of("IMAGES", "DELIVERIES"), incomplete);
        assertFalse(result.profileFor(K1).isReceived(EvidenceType.IMAGES));
    }

    @Test
    @DisplayName("A type whose only rows are stamped after as-of is ingestion incomplete")
    void onlyLateRowsIsIngestionIncomplete() {
        EvidenceReconciliation result = reconciler.reconcile(
                spine(K1, K2),
                List.of(received(K1, EvidenceType.SURVEY, 1, BEFORE),
                        received(K1, EvidenceType.IMAGES, 10, AFTER),
                        received(K2, EvidenceType.IMAGES, 9, AFTER),
                        received(K1, EvidenceType.DELIVERIES, 2, null)),
                AS_OF);

        List<String> incomplete = result.getWarnings().stream()
                .filter(w -> w.getCode() == WarningCode.INGESTION_INCOMPLETE)
                .map(CycleWarning::getSource)
                .toList();
        assertEquals(List.of("IMAGES"), incomplete);
        assertFalse(result.profileFor(K1).isReceived(EvidenceType.IMAGES));
        assertTrue(result.profileFor(K1).isReceived(EvidenceType.DELIVERIES));
    }

    @Test
    @DisplayName("Evidence for keys outside the spine is reported, not joined")
    void unmatchedEvidence() {
        EvidenceReconciliation result = reconciler.reconcile(
                spine(K1),
                List.of(received(K1, EvidenceType.SURVEY, 1, BEFORE),
                        received(new ScopeKey("P9", "F1"), EvidenceType.IMAGES, 4, BEFORE),
                        received(K2, EvidenceType.SURVEY, 1, BEFORE)),
                AS_OF);

        assertEquals(1, result.getProfiles().size());
        assertEquals(2, result.getUnmatched().size());
        assertEquals("P1", result.getUnmatched().get(0).getScopePackageId());
        assertEquals("P9", result.getUnmatched().get(1).getScopePackageId());
        assertEquals(4, result.getUnmatched().get(1).getCount());
        assertTrue(result.getWarnings().stream().anyMatch(w -> w.getCode() == WarningCode.UNMATCHED_EVIDENCE));
    }

    @Test
    @DisplayName("Two rows for the same key and type abort the cycle")
    void duplicateEvidence() {
        GrainViolationException e = assertThrows(GrainViolationException.class, () -> reconciler.reconcile(
                spine(K1),
                List.of(received(K1, EvidenceType.IMAGES, 3, BEFORE),
                        new EvidenceAggregate(" P1", "F1 ", EvidenceType.IMAGES, true, BEFORE, 5)),
                AS_OF));

        assertEquals(GrainViolationException.Kind.DUPLICATE_EVIDENCE, e.getKind());
    }

    @Test
    @DisplayName("Keys lookup on a row not in the spine yields the empty profile")
    void profileForUnknownKey() {
        EvidenceReconciliation result = reconciler.reconcile(spine(K1), List.of(), AS_OF);

        assertEquals(EvidenceProfile.empty(), result.profileFor(K2));
        assertEquals(3, result.getWarnings().size());
    }
}
