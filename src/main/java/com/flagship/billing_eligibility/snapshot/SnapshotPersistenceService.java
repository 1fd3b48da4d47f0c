package com.flagship.billing_eligibility.snapshot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the snapshot header domain object and its JPA entity.
 *
 * Headers are flushed immediately: snapshot lines are written through
 * JDBC in the same transaction and reference the header row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotPersistenceService {

    private final SnapshotRepository snapshotRepository;

    @Transactional
    public Snapshot insert(Snapshot snapshot) {
        if (snapshotRepository.existsById(snapshot.getSnapshotId())) {
            throw new IllegalStateException("Snapshot already exists: " + snapshot.getSnapshotId());
        }
        SnapshotEntity saved = snapshotRepository.saveAndFlush(SnapshotEntity.fromDomain(snapshot));
        log.debug("Inserted snapshot {} in {} status", saved.getSnapshotId(), saved.getStatus());
        return saved.toDomain();
    }

    /**
     * Applies a transition computed on the domain object.
     * The entity refuses edits to terminal snapshots other than the summary status.
     */
    @Transactional
    public Snapshot update(Snapshot snapshot) {
        SnapshotEntity existing = snapshotRepository.findById(snapshot.getSnapshotId())
            .orElseThrow(() -> new IllegalArgumentException("Snapshot not found: " + snapshot.getSnapshotId()));
        existing.updateFromDomain(snapshot);
        SnapshotEntity updated = snapshotRepository.saveAndFlush(existing);
        log.debug("Updated snapshot {} to {} / summary {}",
                updated.getSnapshotId(), updated.getStatus(), updated.getSummaryStatus());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Snapshot> findById(UUID snapshotId) {
        return snapshotRepository.findById(snapshotId).map(SnapshotEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Snapshot> findByAsOf(String environment, Instant asOfTs) {
        return snapshotRepository.findByEnvironmentAndAsOfTsOrderByCreatedAtAsc(environment, asOfTs)
            .stream()
            .map(SnapshotEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Snapshot> findAwaitingSummary(int limit) {
        return snapshotRepository.findPublishedBySummaryStatus(SummaryStatus.PENDING_REGENERATION)
            .stream()
            .limit(limit)
            .map(SnapshotEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countAwaitingSummary() {
        return snapshotRepository.countByStatusAndSummaryStatus(
                SnapshotStatus.PUBLISHED, SummaryStatus.PENDING_REGENERATION);
    }
}
