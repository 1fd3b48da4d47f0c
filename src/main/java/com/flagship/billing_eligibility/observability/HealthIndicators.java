package com.flagship.billing_eligibility.observability;

import com.flagship.billing_eligibility.outbox.OutboxEventRepository;
import com.flagship.billing_eligibility.snapshot.CurrentPointer;
import com.flagship.billing_eligibility.snapshot.SnapshotPersistenceService;
import com.flagship.billing_eligibility.snapshot.SnapshotQueryService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Actuator health indicators for the publisher.
 */
public class HealthIndicators {

    /**
     * UNKNOWN until the first snapshot is published, then reports what the pointer names.
     */
    @Component("currentSnapshotHealth")
    public static class CurrentSnapshotHealthIndicator implements HealthIndicator {

        private final SnapshotQueryService queryService;

        public CurrentSnapshotHealthIndicator(SnapshotQueryService queryService) {
            this.queryService = queryService;
        }

        @Override
        public Health health() {
            try {
                Optional<CurrentPointer> pointer = queryService.currentPointer();
                if (pointer.isEmpty()) {
                    return Health.unknown()
                            .withDetail("note", "No snapshot published yet")
                            .build();
                }
                return Health.up()
                        .withDetail("snapshotId", pointer.get().getSnapshotId())
                        .withDetail("asOfTs", pointer.get().getAsOfTs())
                        .withDetail("updatedAt", pointer.get().getUpdatedAt())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Unhealthy if too many snapshot events are waiting to be relayed.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 100;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 1000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();
                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Published snapshots whose summaries still need regenerating.
     * Lines are unaffected, so this only degrades, never fails.
     */
    @Component("summaryBacklogHealth")
    public static class SummaryBacklogHealthIndicator implements HealthIndicator {

        private final SnapshotPersistenceService persistenceService;

        public SummaryBacklogHealthIndicator(SnapshotPersistenceService persistenceService) {
            this.persistenceService = persistenceService;
        }

        @Override
        public Health health() {
            try {
                long pending = persistenceService.countAwaitingSummary();
                return (pending == 0 ? Health.up() : Health.status("DEGRADED"))
                        .withDetail("pendingRegeneration", pending)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }
}
