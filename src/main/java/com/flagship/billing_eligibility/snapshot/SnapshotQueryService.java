package com.flagship.billing_eligibility.snapshot;

import com.flagship.billing_eligibility.config.EligibilityProperties;
import com.flagship.billing_eligibility.summary.SnapshotSummary;
import com.flagship.billing_eligibility.summary.SummaryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side for presentation and export consumers.
 *
 * Published data never changes, so reads take no locks.
 * Lines of snapshots that are not PUBLISHED are never returned.
 */
@Service
@RequiredArgsConstructor
public class SnapshotQueryService {

    private final SnapshotPersistenceService persistenceService;
    private final SnapshotLineStore lineStore;
    private final SummaryService summaryService;
    private final CurrentPointerStore pointerStore;
    private final EligibilityProperties properties;

    @Transactional(readOnly = true)
    public Optional<CurrentPointer> currentPointer() {
        return pointerStore.find(properties.getPublish().getEnvironment());
    }

    @Transactional(readOnly = true)
    public Optional<UUID> currentSnapshotId() {
        return currentPointer().map(CurrentPointer::getSnapshotId);
    }

    @Transactional(readOnly = true)
    public Optional<Snapshot> findSnapshot(UUID snapshotId) {
        return persistenceService.findById(snapshotId);
    }

    @Transactional(readOnly = true)
    public List<SnapshotLine> findLines(UUID snapshotId) {
        return persistenceService.findById(snapshotId)
                .filter(Snapshot::isPublished)
                .map(snapshot -> lineStore.findBySnapshotId(snapshotId))
                .orElse(List.of());
    }

    @Transactional(readOnly = true)
    public List<SnapshotSummary> findSummaries(UUID snapshotId) {
        return summaryService.findSummaries(snapshotId);
    }

    /**
     * All snapshots minted for an as-of in this environment, oldest first, including failed ones.
     */
    @Transactional(readOnly = true)
    public List<Snapshot> listSnapshots(Instant asOfTs) {
        return persistenceService.findByAsOf(properties.getPublish().getEnvironment(), asOfTs);
    }
}
