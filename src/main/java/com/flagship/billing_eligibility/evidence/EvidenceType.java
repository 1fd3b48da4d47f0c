package com.flagship.billing_eligibility.evidence;

/**
 * Deliverable signals proving completion of a FLOC.
 */
public enum EvidenceType {
    SURVEY,
    IMAGES,
    DELIVERIES
}
