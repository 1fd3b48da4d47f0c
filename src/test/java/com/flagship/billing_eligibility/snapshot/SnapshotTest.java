package com.flagship.billing_eligibility.snapshot;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Snapshot header state machine: DRAFT -> COMMITTING -> PUBLISHED, or FAILED.
 */
class SnapshotTest {

    private static final Instant AS_OF = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant NOW = Instant.parse("2024-03-01T00:05:00Z");

    private static Snapshot draft() {
        return Snapshot.draft(UUID.randomUUID(), AS_OF, "v1", "test", "req-1", 10, NOW);
    }

    @Test
    @DisplayName("Happy path reaches PUBLISHED with summary still pending")
    void publishPath() {
        Snapshot published = draft().beginCommit().publish(NOW);

        assertEquals(SnapshotStatus.PUBLISHED, published.getStatus());
        assertEquals(SummaryStatus.PENDING, published.getSummaryStatus());
        assertEquals(NOW, published.getPublishedAt());
        assertEquals("req-1", published.getRequestKey());
        assertTrue(published.isTerminal());
    }

    @Test
    @DisplayName("Cannot publish without committing first")
    void publishRequiresCommitting() {
        assertThrows(IllegalStateException.class, () -> draft().publish(NOW));
    }

    @Test
    @DisplayName("A published snapshot cannot fail or commit again")
    void publishedIsTerminal() {
        Snapshot published = draft().beginCommit().publish(NOW);

        assertThrows(IllegalStateException.class, () -> published.fail("late"));
        assertThrows(IllegalStateException.class, published::beginCommit);
        assertFalse(published.canTransitionTo(SnapshotStatus.FAILED));
    }

    @Test
    @DisplayName("Failing drops the lines and the request key")
    void failDropsContent() {
        Snapshot failed = draft().beginCommit().fail("constraint violation");

        assertEquals(SnapshotStatus.FAILED, failed.getStatus());
        assertEquals(0, failed.getLineCount());
        assertNull(failed.getRequestKey());
        assertEquals("constraint violation", failed.getFailureReason());
    }

    @Test
    @DisplayName("Only published snapshots take a summary status")
    void summaryStatusOnlyWhenPublished() {
        Snapshot published = draft().beginCommit().publish(NOW);

        assertEquals(SummaryStatus.PENDING_REGENERATION,
                published.withSummaryStatus(SummaryStatus.PENDING_REGENERATION).getSummaryStatus());
        assertThrows(IllegalStateException.class, () -> draft().withSummaryStatus(SummaryStatus.COMPLETE));
    }

    @Test
    @DisplayName("Allowed transitions")
    void transitions() {
        Snapshot draft = draft();
        assertTrue(draft.canTransitionTo(SnapshotStatus.COMMITTING));
        assertTrue(draft.canTransitionTo(SnapshotStatus.FAILED));
        assertFalse(draft.canTransitionTo(SnapshotStatus.PUBLISHED));
        assertTrue(draft.beginCommit().canTransitionTo(SnapshotStatus.PUBLISHED));
    }
}
