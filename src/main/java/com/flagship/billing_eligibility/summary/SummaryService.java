package com.flagship.billing_eligibility.summary;

import com.flagship.billing_eligibility.snapshot.SnapshotLine;
import com.flagship.billing_eligibility.snapshot.SnapshotLineStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes summary rows for a snapshot.
 *
 * During a commit the rows are aggregated in memory and inserted under a
 * JDBC savepoint of the commit transaction: if either step fails, only the
 * summary rows roll back and the commit carries on with the snapshot
 * marked for regeneration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SummaryService {

    private final SummaryAggregator aggregator;
    private final SnapshotSummaryStore summaryStore;
    private final SnapshotLineStore lineStore;

    /**
     * Summarizes lines that the enclosing commit just appended. Runs in the
     * caller's transaction without a transactional proxy of its own, so a
     * failure here never marks the commit rollback-only.
     */
    public List<SnapshotSummary> summarizeCommitted(UUID snapshotId, Instant asOfTs, String ruleVersion,
                                                    List<SnapshotLine> lines) {
        List<SnapshotSummary> summaries = aggregator.aggregate(snapshotId, asOfTs, ruleVersion, lines);
        summaryStore.appendUnderSavepoint(summaries);
        log.debug("Summaries written: snapshotId={}, packages={}", snapshotId, summaries.size());
        return summaries;
    }

    /**
     * Rebuilds summaries from the stored lines of a published snapshot.
     * Does nothing if summary rows already exist.
     *
     * @return true if rows were written
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean summarizeStored(UUID snapshotId, Instant asOfTs, String ruleVersion) {
        if (summaryStore.exists(snapshotId)) {
            log.info("Summaries already present: snapshotId={}", snapshotId);
            return false;
        }
        List<SnapshotLine> lines = lineStore.findBySnapshotId(snapshotId);
        summaryStore.append(aggregator.aggregate(snapshotId, asOfTs, ruleVersion, lines));
        return true;
    }

    @Transactional(readOnly = true)
    public List<SnapshotSummary> findSummaries(UUID snapshotId) {
        return summaryStore.findBySnapshotId(snapshotId);
    }
}
