package com.flagship.billing_eligibility.snapshot;

import com.flagship.billing_eligibility.outbox.OutboxService;
import com.flagship.billing_eligibility.pipeline.DraftSnapshot;
import com.flagship.billing_eligibility.summary.SummaryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes a draft snapshot to the store.
 *
 * The commit is one transaction:
 * 1. Header inserted in COMMITTING status
 * 2. Lines appended
 * 3. Summary rows written under a savepoint
 * 4. Header moved to PUBLISHED
 * 5. Current pointer advanced (forward-only in as-of)
 * 6. SnapshotPublished written to the outbox
 *
 * Readers never see a snapshot whose lines are partially written, and the
 * pointer never names a snapshot before its lines are committed. A summary
 * failure rolls back to the savepoint only; the snapshot still publishes
 * with its summary marked PENDING_REGENERATION.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotCommitService {

    private final SnapshotPersistenceService persistenceService;
    private final SnapshotLineStore lineStore;
    private final SummaryService summaryService;
    private final CurrentPointerStore pointerStore;
    private final OutboxService outboxService;
    private final Clock clock;

    @Transactional
    public CommitOutcome commit(UUID snapshotId, String environment, String requestKey, DraftSnapshot draft) {
        Instant now = clock.instant();
        Instant asOfTs = draft.getAsOfTs();
        String ruleVersion = draft.getRuleVersion();

        Snapshot committing = persistenceService.insert(
                Snapshot.draft(snapshotId, asOfTs, ruleVersion, environment, requestKey, draft.getLines().size(), now)
                        .beginCommit());

        List<SnapshotLine> lines = draft.getLines().stream()
                .map(line -> SnapshotLine.bind(snapshotId, asOfTs, ruleVersion, line))
                .toList();
        lineStore.appendLines(lines);

        SummaryStatus summaryStatus;
        try {
            summaryService.summarizeCommitted(snapshotId, asOfTs, ruleVersion, lines);
            summaryStatus = SummaryStatus.COMPLETE;
        } catch (RuntimeException e) {
            log.warn("Summary failed, snapshot will publish with summary pending regeneration: snapshotId={}, error={}",
                    snapshotId, e.getMessage());
            summaryStatus = SummaryStatus.PENDING_REGENERATION;
        }

        Snapshot published = persistenceService.update(committing.publish(now).withSummaryStatus(summaryStatus));

        boolean advanced = pointerStore.advance(environment, snapshotId, asOfTs, now);

        outboxService.saveEvent(
                SnapshotPublishedEvent.AGGREGATE_TYPE,
                snapshotId,
                SnapshotPublishedEvent.EVENT_TYPE,
                new SnapshotPublishedEvent(snapshotId, environment, asOfTs, ruleVersion,
                        lines.size(), draft.readyCount(), advanced, now)
        );

        log.info("Snapshot committed: snapshotId={}, lines={}, summaryStatus={}, pointerAdvanced={}",
                snapshotId, lines.size(), summaryStatus, advanced);
        return new CommitOutcome(published, advanced);
    }

    /**
     * Records a FAILED header for a cycle whose commit rolled back.
     * Runs in its own transaction; no lines and no request key are stored.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Snapshot recordFailure(UUID snapshotId, String environment, Instant asOfTs, String ruleVersion,
                                  String reason) {
        Snapshot failed = persistenceService.insert(
                Snapshot.draft(snapshotId, asOfTs, ruleVersion, environment, null, 0, clock.instant())
                        .fail(reason));
        log.warn("Snapshot recorded as FAILED: snapshotId={}, reason={}", snapshotId, reason);
        return failed;
    }
}
