package com.flagship.billing_eligibility.evidence;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Evidence status for every known {@link EvidenceType} of one spine row.
 */
@EqualsAndHashCode
@ToString
public final class EvidenceProfile {

    private static final EvidenceProfile EMPTY = new EvidenceProfile(new EnumMap<>(EvidenceType.class));

    private final Map<EvidenceType, EvidenceStatus> statuses;

    private EvidenceProfile(EnumMap<EvidenceType, EvidenceStatus> statuses) {
        for (EvidenceType type : EvidenceType.values()) {
            statuses.putIfAbsent(type, EvidenceStatus.NOT_RECEIVED);
        }
        this.statuses = Collections.unmodifiableMap(statuses);
    }

    public static EvidenceProfile empty() {
        return EMPTY;
    }

    public static EvidenceProfile of(Map<EvidenceType, EvidenceStatus> statuses) {
        EnumMap<EvidenceType, EvidenceStatus> copy = new EnumMap<>(EvidenceType.class);
        copy.putAll(statuses);
        return new EvidenceProfile(copy);
    }

    public EvidenceStatus get(EvidenceType type) {
        return statuses.get(type);
    }

    public boolean isReceived(EvidenceType type) {
        return statuses.get(type).isReceived();
    }

    public int count(EvidenceType type) {
        return statuses.get(type).getCount();
    }
}
