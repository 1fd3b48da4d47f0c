package com.flagship.billing_eligibility.grain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Grain Resolver tests.
 *
 * These tests verify that:
 * - The spine has one row per (package, floc) of the latest upload version
 * - Assignment status is CURRENT, STALE or UNRESOLVED as of the cycle timestamp
 * - Duplicate lines and overlapping intervals abort with a grain violation
 * - Keys are normalized before joining
 */
class GrainResolverTest {

    private static final Instant JAN_1 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant FEB_1 = Instant.parse("2024-02-01T00:00:00Z");
    private static final Instant MAR_1 = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant MAR_15 = Instant.parse("2024-03-15T00:00:00Z");

    private GrainResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new GrainResolver(Set.of());
    }

    private static ScopePackage pkg(String id, int version) {
        return new ScopePackage(id, "ACME", "ACTIVE", version);
    }

    private static PackageLine line(String pkg, String floc, int version) {
        return new PackageLine(pkg, floc, version);
    }

    private static AssignmentInterval interval(String floc, String pkg, Instant start, Instant end) {
        return new AssignmentInterval(floc, pkg, start, end);
    }

    @Nested
    @DisplayName("Assignment resolution")
    class AssignmentResolution {

        @Test
        @DisplayName("Line assigned to its own package as of the cycle is CURRENT")
        void currentAssignment() {
            List<SpineRow> spine = resolver.resolve(
                    List.of(pkg("P1", 1)),
                    List.of(line("P1", "F1", 1)),
                    List.of(interval("F1", "P1", JAN_1, null)),
                    MAR_1);

            assertEquals(1, spine.size());
            assertEquals(AssignmentStatus.CURRENT, spine.get(0).getAssignmentStatus());
            assertEquals("P1", spine.get(0).getAssignedPackageId());
            assertTrue(spine.get(0).isCurrentAssignment());
        }

        @Test
        @DisplayName("FLOC reassigned to another package is STALE for the old package")
        void reassignedFlocIsStale() {
            List<SpineRow> spine = resolver.resolve(
                    List.of(pkg("P1", 1), pkg("P2", 1)),
                    List.of(line("P1", "F1", 1), line("P2", "F1", 1)),
                    List.of(interval("F1", "P1", JAN_1, FEB_1), interval("F1", "P2", FEB_1, null)),
                    MAR_1);

            assertEquals(2, spine.size());
            assertEquals(new ScopeKey("P1", "F1"), spine.get(0).getKey());
            assertEquals(AssignmentStatus.STALE, spine.get(0).getAssignmentStatus());
            assertEquals("P2", spine.get(0).getAssignedPackageId());
            assertEquals(AssignmentStatus.CURRENT, spine.get(1).getAssignmentStatus());
        }

        @Test
        @DisplayName("Before the reassignment the old package is still CURRENT")
        void reassignmentDependsOnAsOf() {
            List<SpineRow> spine = resolver.resolve(
                    List.of(pkg("P1", 1)),
                    List.of(line("P1", "F1", 1)),
                    List.of(interval("F1", "P1", JAN_1, FEB_1), interval("F1", "P2", FEB_1, null)),
                    JAN_1.plusSeconds(3600));

            assertEquals(AssignmentStatus.CURRENT, spine.get(0).getAssignmentStatus());
        }

        @Test
        @DisplayName("Interval end is exclusive")
        void intervalEndIsExclusive() {
            List<SpineRow> spine = resolver.resolve(
                    List.of(pkg("P1", 1)),
                    List.of(line("P1", "F1", 1)),
                    List.of(interval("F1", "P1", JAN_1, FEB_1)),
                    FEB_1);

            assertEquals(AssignmentStatus.UNRESOLVED, spine.get(0).getAssignmentStatus());
            assertNull(spine.get(0).getAssignedPackageId());
        }

        @Test
        @DisplayName("Line without any interval stays in the spine as UNRESOLVED")
        void noIntervalIsUnresolved() {
            List<SpineRow> spine = resolver.resolve(
                    List.of(pkg("P1", 1)),
                    List.of(line("P1", "F1", 1)),
                    List.of(),
                    MAR_1);

            assertEquals(1, spine.size());
            assertEquals(AssignmentStatus.UNRESOLVED, spine.get(0).getAssignmentStatus());
        }

        @Test
        @DisplayName("assignmentAt returns the covering interval")
        void assignmentAt() {
            List<AssignmentInterval> intervals = List.of(
                    interval("F1", "P1", JAN_1, FEB_1),
                    interval("F1", "P2", FEB_1, null));

            Optional<AssignmentInterval> jan = resolver.assignmentAt("F1", intervals, JAN_1);
            Optional<AssignmentInterval> mar = resolver.assignmentAt(" F1 ", intervals, MAR_15);

            assertEquals("P1", jan.orElseThrow().getScopePackageId());
            assertEquals("P2", mar.orElseThrow().getScopePackageId());
            assertTrue(resolver.assignmentAt("F1", intervals, JAN_1.minusSeconds(1)).isEmpty());
        }
    }

    @Nested
    @DisplayName("Spine shape")
    class SpineShape {

        @Test
        @DisplayName("Only the latest upload version of a package contributes lines")
        void latestUploadVersionWins() {
            List<SpineRow> spine = resolver.resolve(
                    List.of(pkg("P1", 1), pkg("P1", 2)),
                    List.of(line("P1", "F1", 1), line("P1", "F2", 1), line("P1", "F2", 2), line("P1", "F3", 2)),
                    List.of(),
                    MAR_1);

            assertEquals(List.of(new ScopeKey("P1", "F2"), new ScopeKey("P1", "F3")),
                    spine.stream().map(SpineRow::getKey).toList());
        }

        @Test
        @DisplayName("Spine is ordered by package then floc regardless of input order")
        void spineIsOrdered() {
            List<SpineRow> spine = resolver.resolve(
                    List.of(pkg("P2", 1), pkg("P1", 1)),
                    List.of(line("P2", "F1", 1), line("P1", "F9", 1), line("P1", "F1", 1)),
                    List.of(),
                    MAR_1);

            assertEquals(List.of("P1|F1", "P1|F9", "P2|F1"),
                    spine.stream().map(row -> row.getKey().businessKey()).toList());
        }

        @Test
        @DisplayName("Keys are trimmed and a blank package id falls into the compliance bucket")
        void keysAreNormalized() {
            List<SpineRow> spine = resolver.resolve(
                    List.of(pkg("P1", 1), pkg("  ", 1)),
                    List.of(line(" P1 ", " F1", 1), line("", "F2", 1)),
                    List.of(interval("F1 ", "P1", JAN_1, null)),
                    MAR_1);

            assertEquals(new ScopeKey(ScopeKey.COMPLIANCE_PACKAGE, "F2"), spine.get(0).getKey());
            assertEquals(new ScopeKey("P1", "F1"), spine.get(1).getKey());
            assertEquals(AssignmentStatus.CURRENT, spine.get(1).getAssignmentStatus());
        }

        @Test
        @DisplayName("Empty inputs produce an empty spine")
        void emptyInputs() {
            assertTrue(resolver.resolve(List.of(), List.of(), List.of(), MAR_1).isEmpty());
        }
    }

    @Nested
    @DisplayName("Grain violations")
    class GrainViolations {

        @Test
        @DisplayName("Duplicate line in one upload version aborts")
        void duplicateLine() {
            GrainViolationException e = assertThrows(GrainViolationException.class, () -> resolver.resolve(
                    List.of(pkg("P1", 1)),
                    List.of(line("P1", "F1", 1), line("P1", " F1 ", 1)),
                    List.of(),
                    MAR_1));

            assertEquals(GrainViolationException.Kind.DUPLICATE_LINE, e.getKind());
            assertEquals("GRAIN_VIOLATION", e.getErrorCode());
        }

        @Test
        @DisplayName("Overlapping intervals for one FLOC abort")
        void overlappingIntervals() {
            GrainViolationException e = assertThrows(GrainViolationException.class, () -> resolver.resolve(
                    List.of(pkg("P1", 1)),
                    List.of(line("P1", "F1", 1)),
                    List.of(interval("F1", "P1", JAN_1, MAR_1), interval("F1", "P2", FEB_1, null)),
                    MAR_15));

            assertEquals(GrainViolationException.Kind.OVERLAPPING_INTERVALS, e.getKind());
        }

        @Test
        @DisplayName("An open interval followed by another interval overlaps")
        void openIntervalNotLast() {
            GrainViolationException e = assertThrows(GrainViolationException.class, () -> resolver.resolve(
                    List.of(),
                    List.of(),
                    List.of(interval("F1", "P1", JAN_1, null), interval("F1", "P2", MAR_1, null)),
                    MAR_15));

            assertEquals(GrainViolationException.Kind.OVERLAPPING_INTERVALS, e.getKind());
        }

        @Test
        @DisplayName("Adjacent intervals do not overlap")
        void adjacentIntervalsAreFine() {
            assertDoesNotThrow(() -> resolver.resolve(
                    List.of(),
                    List.of(),
                    List.of(interval("F1", "P1", JAN_1, FEB_1), interval("F1", "P2", FEB_1, MAR_1),
                            interval("F1", "P1", MAR_1, null)),
                    MAR_15));
        }

        @Test
        @DisplayName("Interval ending at or before its start aborts")
        void emptyInterval() {
            GrainViolationException e = assertThrows(GrainViolationException.class, () -> resolver.resolve(
                    List.of(), List.of(), List.of(interval("F1", "P1", FEB_1, FEB_1)), MAR_1));

            assertEquals(GrainViolationException.Kind.INVALID_INTERVAL, e.getKind());
        }

        @Test
        @DisplayName("Blank floc id aborts")
        void blankFloc() {
            GrainViolationException e = assertThrows(GrainViolationException.class, () -> resolver.resolve(
                    List.of(pkg("P1", 1)), List.of(line("P1", "  ", 1)), List.of(), MAR_1));

            assertEquals(GrainViolationException.Kind.BLANK_KEY, e.getKind());
        }

        @Test
        @DisplayName("Line of an unknown package aborts")
        void unknownPackage() {
            GrainViolationException e = assertThrows(GrainViolationException.class, () -> resolver.resolve(
                    List.of(pkg("P1", 1)), List.of(line("P9", "F1", 1)), List.of(), MAR_1));

            assertEquals(GrainViolationException.Kind.UNKNOWN_PACKAGE, e.getKind());
        }

        @Test
        @DisplayName("Vendor outside the allow-list aborts")
        void unknownVendor() {
            GrainResolver restricted = new GrainResolver(Set.of("ACME"));

            GrainViolationException e = assertThrows(GrainViolationException.class, () -> restricted.resolve(
                    List.of(new ScopePackage("P1", "Globex", "ACTIVE", 1)),
                    List.of(line("P1", "F1", 1)),
                    List.of(),
                    MAR_1));

            assertEquals(GrainViolationException.Kind.UNKNOWN_VENDOR, e.getKind());
        }

        @Test
        @DisplayName("Missing as-of is rejected")
        void missingAsOf() {
            assertThrows(IllegalArgumentException.class,
                    () -> resolver.resolve(List.of(), List.of(), List.of(), null));
        }
    }
}
