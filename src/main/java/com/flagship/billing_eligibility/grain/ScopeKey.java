package com.flagship.billing_eligibility.grain;

import lombok.Value;

import java.util.Comparator;

/**
 * The (scope_package_id, floc_id) grain every relation is joined on.
 *
 * Both parts are trimmed. A blank package id falls into the compliance
 * bucket {@value #COMPLIANCE_PACKAGE}; a blank FLOC cannot form a key.
 */
@Value
public class ScopeKey implements Comparable<ScopeKey> {

    public static final String COMPLIANCE_PACKAGE = "COMP";

    private static final Comparator<ScopeKey> ORDER = Comparator
            .comparing(ScopeKey::getScopePackageId)
            .thenComparing(ScopeKey::getFlocId);

    String scopePackageId;
    String flocId;

    public static ScopeKey of(String scopePackageId, String flocId) {
        String floc = normalizeFloc(flocId);
        if (floc.isEmpty()) {
            throw new GrainViolationException(GrainViolationException.Kind.BLANK_KEY,
                    "Blank floc_id for scope package '" + scopePackageId + "'");
        }
        return new ScopeKey(normalizePackage(scopePackageId), floc);
    }

    public static String normalizePackage(String scopePackageId) {
        String trimmed = scopePackageId == null ? "" : scopePackageId.trim();
        return trimmed.isEmpty() ? COMPLIANCE_PACKAGE : trimmed;
    }

    public static String normalizeFloc(String flocId) {
        return flocId == null ? "" : flocId.trim();
    }

    /**
     * Composite business key, {@code package|floc}.
     */
    public String businessKey() {
        return scopePackageId + "|" + flocId;
    }

    @Override
    public int compareTo(ScopeKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return businessKey();
    }
}
