package com.flagship.billing_eligibility.snapshot;

import com.flagship.billing_eligibility.config.EligibilityProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Guarantees at most one publish cycle in flight per (environment, as-of).
 *
 * A lease is a row in {@code publish_leases} keyed by environment and as-of.
 * The insert commits in its own transaction so a competing cycle sees it
 * immediately; the primary key turns the second insert into a conflict.
 * Leases carry an expiry so a crashed holder does not block the key forever.
 */
@Service
@Slf4j
public class PublishLeaseService {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final Duration leaseTtl;

    public PublishLeaseService(JdbcTemplate jdbcTemplate, Clock clock, EligibilityProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.leaseTtl = properties.getPublish().getLeaseTtl();
    }

    /**
     * Takes the lease for an environment and as-of.
     *
     * @throws ConcurrentPublishConflictException if a live lease exists
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PublishLease acquire(String environment, Instant asOfTs) {
        String leaseKey = PublishLease.keyFor(environment, asOfTs);
        Instant now = clock.instant();

        int expired = jdbcTemplate.update(
            "DELETE FROM publish_leases WHERE lease_key = ? AND expires_at <= ?",
            leaseKey,
            Timestamp.from(now)
        );
        if (expired > 0) {
            log.warn("Took over expired publish lease: leaseKey={}", leaseKey);
        }

        PublishLease lease = new PublishLease(leaseKey, UUID.randomUUID(), now, now.plus(leaseTtl));
        try {
            jdbcTemplate.update(
                "INSERT INTO publish_leases (lease_key, holder_id, acquired_at, expires_at) VALUES (?, ?, ?, ?)",
                lease.getLeaseKey(),
                lease.getHolderId(),
                Timestamp.from(lease.getAcquiredAt()),
                Timestamp.from(lease.getExpiresAt())
            );
        } catch (DuplicateKeyException e) {
            log.warn("Publish lease already held: leaseKey={}", leaseKey);
            throw new ConcurrentPublishConflictException(leaseKey);
        }

        log.debug("Acquired publish lease: leaseKey={}, holderId={}, expiresAt={}",
                leaseKey, lease.getHolderId(), lease.getExpiresAt());
        return lease;
    }

    /**
     * Releases a lease. Only the holder's own row is removed, so a lease
     * taken over after expiry is left to its new holder.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void release(PublishLease lease) {
        int removed = jdbcTemplate.update(
            "DELETE FROM publish_leases WHERE lease_key = ? AND holder_id = ?",
            lease.getLeaseKey(),
            lease.getHolderId()
        );
        if (removed == 0) {
            log.warn("Publish lease was no longer held at release: leaseKey={}, holderId={}",
                    lease.getLeaseKey(), lease.getHolderId());
        }
    }
}
