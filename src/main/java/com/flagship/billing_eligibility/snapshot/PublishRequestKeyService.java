package com.flagship.billing_eligibility.snapshot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps caller request keys to the snapshot they already produced.
 *
 * Redis is the fast path; the unique {@code snapshots.request_key} column
 * is the source of truth. Only PUBLISHED snapshots count: a failed cycle
 * stores no key, so the caller may retry with the same one.
 */
@Service
@Slf4j
public class PublishRequestKeyService {

    private static final String REDIS_KEY_PREFIX = "eligibility:publish-request:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final SnapshotRepository snapshotRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public PublishRequestKeyService(SnapshotRepository snapshotRepository,
                                    Optional<StringRedisTemplate> redisTemplate) {
        this.snapshotRepository = snapshotRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the snapshot already published for this key, if any
     */
    public Optional<UUID> findPublishedSnapshot(String requestKey) {
        requireKey(requestKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + requestKey);
                if (cached != null) {
                    log.debug("Request key found in Redis: {}", requestKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for request key: {}. Falling back to database. Error: {}",
                        requestKey, e.getMessage());
            }
        }

        Optional<UUID> stored = snapshotRepository
                .findByRequestKeyAndStatus(requestKey, SnapshotStatus.PUBLISHED)
                .map(SnapshotEntity::getSnapshotId);
        stored.ifPresent(snapshotId -> {
            log.debug("Request key found in database: {}", requestKey);
            cache(requestKey, snapshotId);
        });
        return stored;
    }

    /**
     * Caches a key after its snapshot committed. The database row is already written.
     */
    public void remember(String requestKey, UUID snapshotId) {
        requireKey(requestKey);
        if (snapshotId == null) {
            throw new IllegalArgumentException("Snapshot ID cannot be null");
        }
        cache(requestKey, snapshotId);
    }

    private void cache(String requestKey, UUID snapshotId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + requestKey, snapshotId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache request key in Redis: {}. Error: {}", requestKey, e.getMessage());
        }
    }

    private static void requireKey(String requestKey) {
        if (requestKey == null || requestKey.isBlank()) {
            throw new IllegalArgumentException("Request key cannot be null or blank");
        }
    }
}
