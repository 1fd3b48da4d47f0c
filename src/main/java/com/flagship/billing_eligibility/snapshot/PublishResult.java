package com.flagship.billing_eligibility.snapshot;

import com.flagship.billing_eligibility.pipeline.DraftSnapshot;
import lombok.Value;

import java.util.Optional;
import java.util.UUID;

/**
 * What a publish call produced.
 *
 * A dry run carries the draft and no snapshot. A committed publish carries
 * the published header and the draft it was built from. A request key hit
 * carries only the earlier snapshot.
 */
@Value
public class PublishResult {

    public enum Outcome {
        PUBLISHED,
        DRY_RUN,
        ALREADY_PUBLISHED
    }

    Outcome outcome;
    Snapshot snapshot;
    DraftSnapshot draft;
    boolean pointerAdvanced;

    static PublishResult published(CommitOutcome commit, DraftSnapshot draft) {
        return new PublishResult(Outcome.PUBLISHED, commit.getSnapshot(), draft, commit.isPointerAdvanced());
    }

    static PublishResult dryRun(DraftSnapshot draft) {
        return new PublishResult(Outcome.DRY_RUN, null, draft, false);
    }

    static PublishResult alreadyPublished(Snapshot snapshot) {
        return new PublishResult(Outcome.ALREADY_PUBLISHED, snapshot, null, false);
    }

    /**
     * Empty for dry runs, which have no persisted identity.
     */
    public Optional<UUID> getSnapshotId() {
        return Optional.ofNullable(snapshot).map(Snapshot::getSnapshotId);
    }
}
