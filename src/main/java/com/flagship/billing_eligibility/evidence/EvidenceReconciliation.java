package com.flagship.billing_eligibility.evidence;

import com.flagship.billing_eligibility.grain.ScopeKey;
import com.flagship.billing_eligibility.quality.CycleWarning;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of the evidence left join: a profile for every spine key plus the
 * data-quality findings of the join.
 */
@Value
public class EvidenceReconciliation {
    Map<ScopeKey, EvidenceProfile> profiles;
    List<UnmatchedEvidence> unmatched;
    List<CycleWarning> warnings;

    public EvidenceProfile profileFor(ScopeKey key) {
        return profiles.getOrDefault(key, EvidenceProfile.empty());
    }
}
