package com.flagship.billing_eligibility.snapshot;

import lombok.Value;

@Value
public class CommitOutcome {
    Snapshot snapshot;
    boolean pointerAdvanced;
}
