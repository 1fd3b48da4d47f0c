package com.flagship.billing_eligibility.snapshot;

import com.flagship.billing_eligibility.exception.EligibilityException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Publishes on a schedule with as-of truncated to the minute and the default rule version.
 * Off unless {@code eligibility.publish.schedule.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "eligibility.publish.schedule.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ScheduledPublishJob {

    private final SnapshotPublisher publisher;
    private final Clock clock;

    @Scheduled(cron = "${eligibility.publish.schedule.cron:0 0 * * * *}")
    public void publishScheduled() {
        Instant asOf = clock.instant().truncatedTo(ChronoUnit.MINUTES);
        try {
            PublishResult result = publisher.publish(PublishRequest.of(asOf, null));
            log.info("Scheduled publish done: asOfTs={}, snapshotId={}", asOf, result.getSnapshotId().orElse(null));
        } catch (ConcurrentPublishConflictException e) {
            log.warn("Scheduled publish skipped, another cycle holds the lease: {}", e.getLeaseKey());
        } catch (EligibilityException e) {
            log.error("Scheduled publish aborted: asOfTs={}, errorCode={}, error={}",
                    asOf, e.getErrorCode(), e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled publish failed: asOfTs={}", asOf, e);
        }
    }
}
