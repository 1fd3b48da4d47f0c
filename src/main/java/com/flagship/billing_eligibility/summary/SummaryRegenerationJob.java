package com.flagship.billing_eligibility.summary;

import com.flagship.billing_eligibility.snapshot.Snapshot;
import com.flagship.billing_eligibility.snapshot.SnapshotPersistenceService;
import com.flagship.billing_eligibility.snapshot.SummaryStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

/**
 * Retries summaries of published snapshots marked PENDING_REGENERATION.
 *
 * Each snapshot is handled in its own transaction so one bad snapshot
 * does not hold back the rest.
 */
@Component
@ConditionalOnProperty(name = "eligibility.summary.regeneration.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class SummaryRegenerationJob {

    private final SnapshotPersistenceService persistenceService;
    private final SummaryService summaryService;
    private final TransactionTemplate transactionTemplate;

    @Value("${eligibility.summary.regeneration.batch-size:20}")
    private int batchSize;

    public SummaryRegenerationJob(SnapshotPersistenceService persistenceService, SummaryService summaryService,
                                  TransactionTemplate transactionTemplate) {
        this.persistenceService = persistenceService;
        this.summaryService = summaryService;
        this.transactionTemplate = transactionTemplate;
    }

    @Scheduled(fixedDelayString = "${eligibility.summary.regeneration.interval-ms:60000}")
    public void regeneratePending() {
        List<UUID> pending = persistenceService.findAwaitingSummary(batchSize)
                .stream()
                .map(Snapshot::getSnapshotId)
                .toList();
        if (pending.isEmpty()) {
            return;
        }

        log.info("Regenerating summaries for {} snapshots", pending.size());
        int regenerated = 0;
        for (UUID snapshotId : pending) {
            try {
                transactionTemplate.executeWithoutResult(status -> regenerate(snapshotId));
                regenerated++;
            } catch (Exception e) {
                log.error("Summary regeneration failed: snapshotId={}, error={}", snapshotId, e.getMessage());
            }
        }
        log.info("Summary regeneration finished: regenerated={}, failed={}", regenerated, pending.size() - regenerated);
    }

    /**
     * Regenerates one snapshot's summary and marks it COMPLETE. Must run in a transaction.
     */
    void regenerate(UUID snapshotId) {
        Snapshot snapshot = persistenceService.findById(snapshotId)
                .orElseThrow(() -> new IllegalStateException("Snapshot not found: " + snapshotId));
        if (snapshot.getSummaryStatus() != SummaryStatus.PENDING_REGENERATION) {
            return;
        }
        summaryService.summarizeStored(snapshotId, snapshot.getAsOfTs(), snapshot.getRuleVersion());
        persistenceService.update(snapshot.withSummaryStatus(SummaryStatus.COMPLETE));
        log.info("Summary regenerated: snapshotId={}", snapshotId);
    }
}
