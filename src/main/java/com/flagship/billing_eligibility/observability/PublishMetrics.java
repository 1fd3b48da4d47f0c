package com.flagship.billing_eligibility.observability;

import com.flagship.billing_eligibility.quality.CycleWarning;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Centralized metrics for publish cycles.
 *
 * Metrics exposed:
 * - eligibility.publish.cycles: Counter of cycles by outcome and rule version
 * - eligibility.publish.duration: Timer for whole cycles
 * - eligibility.publish.lines: Counter of committed lines by readiness
 * - eligibility.publish.warnings: Counter of cycle warnings by code
 * - eligibility.publish.conflicts: Counter of lease conflicts
 * - eligibility.summary.regeneration: Counter of summaries left for regeneration
 */
@Component
public class PublishMetrics {

    public static final String OUTCOME_PUBLISHED = "published";
    public static final String OUTCOME_DRY_RUN = "dry_run";
    public static final String OUTCOME_ALREADY_PUBLISHED = "already_published";
    public static final String OUTCOME_CONFLICT = "conflict";
    public static final String OUTCOME_FAILED = "failed";

    private final MeterRegistry registry;

    private final Counter leaseConflicts;
    private final Counter summariesPending;
    private final Timer publishTimer;

    public PublishMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.leaseConflicts = Counter.builder("eligibility.publish.conflicts")
                .description("Publish attempts rejected because another cycle held the lease")
                .register(registry);

        this.summariesPending = Counter.builder("eligibility.summary.regeneration")
                .description("Snapshots published with their summary pending regeneration")
                .register(registry);

        this.publishTimer = Timer.builder("eligibility.publish.duration")
                .description("Time taken by a publish cycle")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordCycle(String outcome, String ruleVersion) {
        registry.counter("eligibility.publish.cycles",
                "outcome", outcome,
                "rule_version", sanitizeTag(ruleVersion)
        ).increment();
    }

    public void recordFailure(String ruleVersion, String errorCode) {
        registry.counter("eligibility.publish.failures",
                "rule_version", sanitizeTag(ruleVersion),
                "error_code", sanitizeTag(errorCode)
        ).increment();
    }

    public void recordDuration(Duration duration) {
        publishTimer.record(duration);
    }

    public void recordLines(long ready, long blocked) {
        registry.counter("eligibility.publish.lines", "ready", "true").increment(ready);
        registry.counter("eligibility.publish.lines", "ready", "false").increment(blocked);
    }

    public void recordWarnings(List<CycleWarning> warnings) {
        for (CycleWarning warning : warnings) {
            registry.counter("eligibility.publish.warnings",
                    "code", warning.getCode().name(),
                    "source", sanitizeTag(warning.getSource())
            ).increment();
        }
    }

    public void incrementLeaseConflicts() {
        leaseConflicts.increment();
    }

    public void incrementSummariesPending() {
        summariesPending.increment();
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
    }
}
