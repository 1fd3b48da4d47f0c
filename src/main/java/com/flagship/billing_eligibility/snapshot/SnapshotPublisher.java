package com.flagship.billing_eligibility.snapshot;

import com.flagship.billing_eligibility.config.EligibilityProperties;
import com.flagship.billing_eligibility.exception.EligibilityException;
import com.flagship.billing_eligibility.input.EligibilityInputSource;
import com.flagship.billing_eligibility.observability.CorrelationContext;
import com.flagship.billing_eligibility.observability.PublishMetrics;
import com.flagship.billing_eligibility.pipeline.DraftSnapshot;
import com.flagship.billing_eligibility.pipeline.EligibilityPipeline;
import com.flagship.billing_eligibility.rules.RuleRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs publish cycles: DRAFT -> COMMITTING -> PUBLISHED, or FAILED.
 *
 * Flow:
 * 1. Request key check (caller short-circuit)
 * 2. Rule version resolved, so an unknown version fails before anything else
 * 3. Lease taken for (environment, as-of); a held lease fails fast
 * 4. Inputs loaded and the draft computed in memory
 * 5. Commit transaction (see {@link SnapshotCommitService})
 * 6. Lease released
 *
 * Failures before the commit write nothing. A failed commit rolls back
 * entirely and leaves a FAILED header; the current pointer is untouched
 * either way. Dry runs do steps 2 and 4 only: no lease, no writes.
 */
@Service
@Slf4j
public class SnapshotPublisher {

    private final EligibilityInputSource inputSource;
    private final EligibilityPipeline pipeline;
    private final RuleRegistry ruleRegistry;
    private final PublishLeaseService leaseService;
    private final SnapshotCommitService commitService;
    private final SnapshotPersistenceService persistenceService;
    private final PublishRequestKeyService requestKeyService;
    private final PublishMetrics metrics;
    private final EligibilityProperties properties;

    public SnapshotPublisher(EligibilityInputSource inputSource,
                             EligibilityPipeline pipeline,
                             RuleRegistry ruleRegistry,
                             PublishLeaseService leaseService,
                             SnapshotCommitService commitService,
                             SnapshotPersistenceService persistenceService,
                             PublishRequestKeyService requestKeyService,
                             PublishMetrics metrics,
                             EligibilityProperties properties) {
        this.inputSource = inputSource;
        this.pipeline = pipeline;
        this.ruleRegistry = ruleRegistry;
        this.leaseService = leaseService;
        this.commitService = commitService;
        this.persistenceService = persistenceService;
        this.requestKeyService = requestKeyService;
        this.metrics = metrics;
        this.properties = properties;
    }

    public PublishResult publish(PublishRequest request) {
        if (request == null || request.getAsOfTs() == null) {
            throw new IllegalArgumentException("as_of_ts is required");
        }
        String ruleVersion = request.getRuleVersion() != null
                ? request.getRuleVersion()
                : properties.getPublish().getDefaultRuleVersion();
        String environment = properties.getPublish().getEnvironment();

        boolean ownsCorrelation = !CorrelationContext.hasCorrelationId();
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
        MDC.put(CorrelationContext.AS_OF_MDC_KEY, request.getAsOfTs().toString());
        MDC.put(CorrelationContext.RULE_VERSION_MDC_KEY, ruleVersion);
        long start = System.nanoTime();
        try {
            PublishResult result = request.isDryRun()
                    ? dryRun(request, ruleVersion)
                    : commitCycle(request, ruleVersion, environment);
            metrics.recordCycle(outcomeTag(result.getOutcome()), ruleVersion);
            return result;
        } catch (ConcurrentPublishConflictException e) {
            metrics.incrementLeaseConflicts();
            metrics.recordCycle(PublishMetrics.OUTCOME_CONFLICT, ruleVersion);
            throw e;
        } catch (EligibilityException e) {
            log.error("Publish cycle aborted: errorCode={}, error={}", e.getErrorCode(), e.getMessage());
            metrics.recordCycle(PublishMetrics.OUTCOME_FAILED, ruleVersion);
            metrics.recordFailure(ruleVersion, e.getErrorCode());
            throw e;
        } catch (RuntimeException e) {
            log.error("Publish cycle failed", e);
            metrics.recordCycle(PublishMetrics.OUTCOME_FAILED, ruleVersion);
            metrics.recordFailure(ruleVersion, e.getClass().getSimpleName());
            throw e;
        } finally {
            metrics.recordDuration(Duration.ofNanos(System.nanoTime() - start));
            MDC.remove(CorrelationContext.AS_OF_MDC_KEY);
            MDC.remove(CorrelationContext.RULE_VERSION_MDC_KEY);
            MDC.remove(CorrelationContext.SNAPSHOT_ID_MDC_KEY);
            if (ownsCorrelation) {
                MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
                CorrelationContext.clear();
            }
        }
    }

    private PublishResult dryRun(PublishRequest request, String ruleVersion) {
        ruleRegistry.resolve(ruleVersion);
        DraftSnapshot draft = pipeline.compute(inputSource.load(request.getAsOfTs()), request.getAsOfTs(), ruleVersion);
        log.info("Dry run complete: lines={}, ready={}, warnings={}",
                draft.getLines().size(), draft.readyCount(), draft.getWarnings().size());
        return PublishResult.dryRun(draft);
    }

    private PublishResult commitCycle(PublishRequest request, String ruleVersion, String environment) {
        String requestKey = request.getRequestKey();
        if (requestKey != null) {
            Optional<Snapshot> existing = requestKeyService.findPublishedSnapshot(requestKey)
                    .flatMap(persistenceService::findById);
            if (existing.isPresent()) {
                log.info("Request key already published: requestKey={}, snapshotId={}",
                        requestKey, existing.get().getSnapshotId());
                return PublishResult.alreadyPublished(existing.get());
            }
        }

        ruleRegistry.resolve(ruleVersion);

        PublishLease lease = leaseService.acquire(environment, request.getAsOfTs());
        try {
            DraftSnapshot draft = pipeline.compute(
                    inputSource.load(request.getAsOfTs()), request.getAsOfTs(), ruleVersion);

            UUID snapshotId = UUID.randomUUID();
            MDC.put(CorrelationContext.SNAPSHOT_ID_MDC_KEY, snapshotId.toString());

            CommitOutcome commit;
            try {
                commit = commitService.commit(snapshotId, environment, requestKey, draft);
            } catch (RuntimeException e) {
                recordFailure(snapshotId, environment, draft, e);
                throw e;
            }

            if (requestKey != null) {
                requestKeyService.remember(requestKey, snapshotId);
            }
            metrics.recordLines(draft.readyCount(), draft.getLines().size() - draft.readyCount());
            metrics.recordWarnings(draft.getWarnings());
            if (commit.getSnapshot().getSummaryStatus() == SummaryStatus.PENDING_REGENERATION) {
                metrics.incrementSummariesPending();
            }

            log.info("Snapshot published: snapshotId={}, lines={}, ready={}, current={}",
                    snapshotId, draft.getLines().size(), draft.readyCount(), commit.isPointerAdvanced());
            return PublishResult.published(commit, draft);
        } finally {
            leaseService.release(lease);
        }
    }

    private void recordFailure(UUID snapshotId, String environment, DraftSnapshot draft, RuntimeException cause) {
        try {
            commitService.recordFailure(snapshotId, environment, draft.getAsOfTs(), draft.getRuleVersion(),
                    cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not record FAILED header: snapshotId={}, error={}", snapshotId, e.getMessage());
            cause.addSuppressed(e);
        }
    }

    private static String outcomeTag(PublishResult.Outcome outcome) {
        return switch (outcome) {
            case PUBLISHED -> PublishMetrics.OUTCOME_PUBLISHED;
            case DRY_RUN -> PublishMetrics.OUTCOME_DRY_RUN;
            case ALREADY_PUBLISHED -> PublishMetrics.OUTCOME_ALREADY_PUBLISHED;
        };
    }
}
