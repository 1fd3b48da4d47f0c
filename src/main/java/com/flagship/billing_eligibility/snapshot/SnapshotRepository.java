package com.flagship.billing_eligibility.snapshot;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SnapshotRepository extends JpaRepository<SnapshotEntity, UUID> {

    /**
     * Finds the published snapshot minted for a caller request key.
     */
    Optional<SnapshotEntity> findByRequestKeyAndStatus(String requestKey, SnapshotStatus status);

    List<SnapshotEntity> findByEnvironmentAndAsOfTsOrderByCreatedAtAsc(String environment, Instant asOfTs);

    /**
     * Published snapshots whose summary must be regenerated, oldest first.
     */
    @Query("""
        SELECT s FROM SnapshotEntity s
        WHERE s.status = com.flagship.billing_eligibility.snapshot.SnapshotStatus.PUBLISHED
        AND s.summaryStatus = :summaryStatus
        ORDER BY s.publishedAt ASC
        """)
    List<SnapshotEntity> findPublishedBySummaryStatus(@Param("summaryStatus") SummaryStatus summaryStatus);

    long countByStatusAndSummaryStatus(SnapshotStatus status, SummaryStatus summaryStatus);
}
