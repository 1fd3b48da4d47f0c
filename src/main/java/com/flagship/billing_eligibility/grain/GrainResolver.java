package com.flagship.billing_eligibility.grain;

import com.flagship.billing_eligibility.config.EligibilityProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds the canonical (package, line) spine and resolves each line's
 * assignment as of a timestamp.
 *
 * Rules enforced here:
 * - Only the latest upload version of each package contributes lines
 * - A (package, floc) pair appears at most once per upload version
 * - Assignment intervals of one FLOC never overlap and only the last may be open
 * - A line with no interval covering as-of stays in the spine as UNRESOLVED
 *
 * Violations raise {@link GrainViolationException}. The resolver holds no
 * mutable state and is safe to call concurrently.
 */
@Component
@Slf4j
public class GrainResolver {

    private final Set<String> allowedVendors;

    public GrainResolver(EligibilityProperties properties) {
        this(properties.getVendors().getAllowed());
    }

    GrainResolver(Set<String> allowedVendors) {
        this.allowedVendors = allowedVendors.stream()
                .map(String::trim)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Resolves the spine.
     *
     * @param packages scope packages owning the lines
     * @param lines all package lines visible at as-of, every upload version
     * @param intervals all assignment intervals
     * @param asOf resolution instant
     * @return spine rows ordered by (package, floc)
     * @throws GrainViolationException on duplicate lines, overlapping intervals,
     *         blank keys, or lines of unknown packages or vendors
     */
    public List<SpineRow> resolve(Collection<ScopePackage> packages,
                                  Collection<PackageLine> lines,
                                  Collection<AssignmentInterval> intervals,
                                  Instant asOf) {
        if (asOf == null) {
            throw new IllegalArgumentException("as_of_ts is required");
        }

        Map<String, List<AssignmentInterval>> intervalsByFloc = validateIntervals(intervals);
        Map<String, ScopePackage> packagesById = indexPackages(packages);
        Map<String, Integer> latestVersion = latestUploadVersions(lines);

        Set<String> seen = new HashSet<>();
        List<SpineRow> spine = new ArrayList<>();
        for (PackageLine line : lines) {
            ScopeKey key = ScopeKey.of(line.getScopePackageId(), line.getFlocId());

            String versionedKey = key.businessKey() + "@" + line.getUploadVersion();
            if (!seen.add(versionedKey)) {
                throw new GrainViolationException(GrainViolationException.Kind.DUPLICATE_LINE,
                        String.format("Duplicate package line %s in upload version %d",
                                key, line.getUploadVersion()));
            }

            if (line.getUploadVersion() != latestVersion.get(key.getScopePackageId())) {
                continue;
            }

            ScopePackage scopePackage = packagesById.get(key.getScopePackageId());
            if (scopePackage == null) {
                throw new GrainViolationException(GrainViolationException.Kind.UNKNOWN_PACKAGE,
                        "Package line " + key + " references unknown scope package");
            }

            spine.add(resolveRow(key, scopePackage.getVendor(),
                    intervalsByFloc.getOrDefault(key.getFlocId(), List.of()), asOf));
        }

        spine.sort(Comparator.comparing(SpineRow::getKey));

        if (log.isDebugEnabled()) {
            Map<AssignmentStatus, Long> byStatus = spine.stream()
                    .collect(Collectors.groupingBy(SpineRow::getAssignmentStatus, TreeMap::new, Collectors.counting()));
            log.debug("Resolved spine: rows={}, byStatus={}, asOf={}", spine.size(), byStatus, asOf);
        }
        return spine;
    }

    /**
     * Returns the interval covering {@code asOf} for one FLOC, after validating
     * that FLOC's intervals.
     */
    public Optional<AssignmentInterval> assignmentAt(String flocId,
                                                     Collection<AssignmentInterval> intervals,
                                                     Instant asOf) {
        String floc = ScopeKey.normalizeFloc(flocId);
        List<AssignmentInterval> forFloc = validateIntervals(intervals).getOrDefault(floc, List.of());
        return forFloc.stream().filter(i -> i.contains(asOf)).findFirst();
    }

    private SpineRow resolveRow(ScopeKey key, String vendor,
                                List<AssignmentInterval> flocIntervals, Instant asOf) {
        for (AssignmentInterval interval : flocIntervals) {
            if (interval.contains(asOf)) {
                String assignedPackage = ScopeKey.normalizePackage(interval.getScopePackageId());
                AssignmentStatus status = assignedPackage.equals(key.getScopePackageId())
                        ? AssignmentStatus.CURRENT
                        : AssignmentStatus.STALE;
                return new SpineRow(key, vendor, status, assignedPackage);
            }
        }
        return new SpineRow(key, vendor, AssignmentStatus.UNRESOLVED, null);
    }

    /**
     * Groups intervals by FLOC, sorted by start, and checks the no-overlap
     * invariant. Runs before every resolution.
     */
    Map<String, List<AssignmentInterval>> validateIntervals(Collection<AssignmentInterval> intervals) {
        Map<String, List<AssignmentInterval>> byFloc = new HashMap<>();
        for (AssignmentInterval interval : intervals) {
            String floc = ScopeKey.normalizeFloc(interval.getFlocId());
            if (floc.isEmpty()) {
                throw new GrainViolationException(GrainViolationException.Kind.BLANK_KEY,
                        "Assignment interval with blank floc_id for package " + interval.getScopePackageId());
            }
            if (interval.getEffectiveStart() == null) {
                throw new GrainViolationException(GrainViolationException.Kind.INVALID_INTERVAL,
                        "Assignment interval for " + floc + " has no effective start");
            }
            if (!interval.isOpen()
                    && !interval.getEffectiveEnd().isAfter(interval.getEffectiveStart())) {
                throw new GrainViolationException(GrainViolationException.Kind.INVALID_INTERVAL,
                        String.format("Assignment interval for %s ends at %s, not after its start %s",
                                floc, interval.getEffectiveEnd(), interval.getEffectiveStart()));
            }
            byFloc.computeIfAbsent(floc, k -> new ArrayList<>()).add(interval);
        }

        for (Map.Entry<String, List<AssignmentInterval>> entry : byFloc.entrySet()) {
            List<AssignmentInterval> sorted = entry.getValue();
            sorted.sort(Comparator.comparing(AssignmentInterval::getEffectiveStart));
            for (int i = 0; i + 1 < sorted.size(); i++) {
                AssignmentInterval current = sorted.get(i);
                AssignmentInterval next = sorted.get(i + 1);
                if (current.overlapsNext(next)) {
                    throw new GrainViolationException(GrainViolationException.Kind.OVERLAPPING_INTERVALS,
                            String.format("Overlapping assignment intervals for %s: [%s, %s) %s and [%s, %s) %s",
                                    entry.getKey(),
                                    current.getEffectiveStart(), current.getEffectiveEnd(), current.getScopePackageId(),
                                    next.getEffectiveStart(), next.getEffectiveEnd(), next.getScopePackageId()));
                }
            }
        }
        return byFloc;
    }

    private Map<String, ScopePackage> indexPackages(Collection<ScopePackage> packages) {
        Map<String, ScopePackage> byId = new HashMap<>();
        for (ScopePackage scopePackage : packages) {
            String id = ScopeKey.normalizePackage(scopePackage.getScopePackageId());
            String vendor = scopePackage.getVendor() == null ? "" : scopePackage.getVendor().trim();
            if (!allowedVendors.isEmpty() && !allowedVendors.contains(vendor)) {
                throw new GrainViolationException(GrainViolationException.Kind.UNKNOWN_VENDOR,
                        String.format("Unknown vendor '%s' on scope package %s. Allowed: %s",
                                vendor, id, allowedVendors.stream().sorted().toList()));
            }
            byId.merge(id, scopePackage, (a, b) -> a.getUploadVersion() >= b.getUploadVersion() ? a : b);
        }
        return byId;
    }

    private Map<String, Integer> latestUploadVersions(Collection<PackageLine> lines) {
        Map<String, Integer> latest = new HashMap<>();
        for (PackageLine line : lines) {
            latest.merge(ScopeKey.normalizePackage(line.getScopePackageId()),
                    line.getUploadVersion(), Math::max);
        }
        return latest;
    }
}
