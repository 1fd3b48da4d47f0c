package com.flagship.billing_eligibility.snapshot;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PublishRequestKeyServiceTest {

    private static final String KEY = "req-42";
    private static final String REDIS_KEY = "eligibility:publish-request:" + KEY;

    @Mock
    private SnapshotRepository snapshotRepository;
    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private PublishRequestKeyService service() {
        return new PublishRequestKeyService(snapshotRepository, Optional.of(redisTemplate));
    }

    @Test
    @DisplayName("Redis hit skips the database")
    void redisHit() {
        UUID snapshotId = UUID.randomUUID();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(REDIS_KEY)).thenReturn(snapshotId.toString());

        assertEquals(Optional.of(snapshotId), service().findPublishedSnapshot(KEY));
        verify(snapshotRepository, never()).findByRequestKeyAndStatus(anyString(), any());
    }

    @Test
    @DisplayName("Redis outage falls back to the published snapshot in the database")
    void redisDownFallsBackToDatabase() {
        UUID snapshotId = UUID.randomUUID();
        SnapshotEntity entity = mock(SnapshotEntity.class);
        when(entity.getSnapshotId()).thenReturn(snapshotId);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(REDIS_KEY)).thenThrow(new IllegalStateException("Redis down"));
        doThrow(new IllegalStateException("Redis down"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));
        when(snapshotRepository.findByRequestKeyAndStatus(KEY, SnapshotStatus.PUBLISHED))
                .thenReturn(Optional.of(entity));

        assertEquals(Optional.of(snapshotId), service().findPublishedSnapshot(KEY));
    }

    @Test
    @DisplayName("Without Redis only the database is consulted")
    void noRedis() {
        when(snapshotRepository.findByRequestKeyAndStatus(KEY, SnapshotStatus.PUBLISHED)).thenReturn(Optional.empty());

        PublishRequestKeyService service = new PublishRequestKeyService(snapshotRepository, Optional.empty());

        assertTrue(service.findPublishedSnapshot(KEY).isEmpty());
        assertDoesNotThrow(() -> service.remember(KEY, UUID.randomUUID()));
    }

    @Test
    @DisplayName("Blank keys are rejected")
    void blankKeyRejected() {
        assertThrows(IllegalArgumentException.class, () -> service().findPublishedSnapshot(" "));
    }
}
