package com.flagship.billing_eligibility.evidence;

import com.flagship.billing_eligibility.grain.GrainViolationException;
import com.flagship.billing_eligibility.grain.ScopeKey;
import com.flagship.billing_eligibility.grain.SpineRow;
import com.flagship.billing_eligibility.quality.CycleWarning;
import com.flagship.billing_eligibility.quality.WarningCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Left-joins conformed evidence aggregates onto the spine.
 *
 * Every spine row gets a status for every {@link EvidenceType}; a missing
 * aggregate means "not received". Evidence stamped after as-of is not yet
 * visible and also reads as not received; a type with no row visible at
 * as-of is reported as ingestion incomplete.
 *
 * A second aggregate for the same (package, floc, type) breaks the join-safety
 * contract and aborts with {@link GrainViolationException}.
 */
@Component
@Slf4j
public class EvidenceReconciler {

    public EvidenceReconciliation reconcile(List<SpineRow> spine,
                                            Collection<EvidenceAggregate> aggregates,
                                            Instant asOf) {
        Map<EvidenceType, Map<ScopeKey, EvidenceAggregate>> byType = indexByType(aggregates);

        List<CycleWarning> warnings = new ArrayList<>();
        for (EvidenceType type : EvidenceType.values()) {
            if (byType.get(type).values().stream().noneMatch(a -> isVisible(a, asOf))) {
                log.warn("Ingestion incomplete: no {} evidence delivered, asOf={}", type, asOf);
                warnings.add(CycleWarning.ingestionIncomplete(type.name()));
            }
        }

        Map<ScopeKey, EvidenceProfile> profiles = new LinkedHashMap<>();
        for (SpineRow row : spine) {
            EnumMap<EvidenceType, EvidenceStatus> statuses = new EnumMap<>(EvidenceType.class);
            for (EvidenceType type : EvidenceType.values()) {
                EvidenceAggregate aggregate = byType.get(type).get(row.getKey());
                statuses.put(type, toStatus(aggregate, asOf));
            }
            profiles.put(row.getKey(), EvidenceProfile.of(statuses));
        }

        List<UnmatchedEvidence> unmatched = new ArrayList<>();
        for (EvidenceType type : EvidenceType.values()) {
            for (Map.Entry<ScopeKey, EvidenceAggregate> entry : byType.get(type).entrySet()) {
                if (!profiles.containsKey(entry.getKey())) {
                    unmatched.add(new UnmatchedEvidence(entry.getKey().getScopePackageId(),
                            entry.getKey().getFlocId(), type, entry.getValue().getCount()));
                }
            }
        }
        unmatched.sort(Comparator.comparing(UnmatchedEvidence::getScopePackageId)
                .thenComparing(UnmatchedEvidence::getFlocId)
                .thenComparing(UnmatchedEvidence::getEvidenceType));

        if (!unmatched.isEmpty()) {
            log.warn("Evidence for keys absent from the spine: unmatched={}, asOf={}", unmatched.size(), asOf);
            warnings.add(new CycleWarning(WarningCode.UNMATCHED_EVIDENCE, "EVIDENCE", unmatched.size(),
                    unmatched.size() + " evidence rows reference keys absent from the spine"));
        }

        return new EvidenceReconciliation(
                Collections.unmodifiableMap(profiles),
                List.copyOf(unmatched),
                List.copyOf(warnings));
    }

    private EvidenceStatus toStatus(EvidenceAggregate aggregate, Instant asOf) {
        if (aggregate == null) {
            return EvidenceStatus.NOT_RECEIVED;
        }
        if (!isVisible(aggregate, asOf)) {
            return EvidenceStatus.NOT_RECEIVED;
        }
        return new EvidenceStatus(aggregate.isReceived(), aggregate.getEvidenceTs(), aggregate.getCount());
    }

    private static boolean isVisible(EvidenceAggregate aggregate, Instant asOf) {
        return aggregate.getEvidenceTs() == null || !aggregate.getEvidenceTs().isAfter(asOf);
    }

    private Map<EvidenceType, Map<ScopeKey, EvidenceAggregate>> indexByType(Collection<EvidenceAggregate> aggregates) {
        Map<EvidenceType, Map<ScopeKey, EvidenceAggregate>> byType = new EnumMap<>(EvidenceType.class);
        for (EvidenceType type : EvidenceType.values()) {
            byType.put(type, new HashMap<>());
        }
        for (EvidenceAggregate aggregate : aggregates) {
            if (aggregate.getEvidenceType() == null) {
                throw new IllegalArgumentException("Evidence aggregate without evidence_type for floc "
                        + aggregate.getFlocId());
            }
            ScopeKey key = ScopeKey.of(aggregate.getScopePackageId(), aggregate.getFlocId());
            EvidenceAggregate previous = byType.get(aggregate.getEvidenceType()).putIfAbsent(key, aggregate);
            if (previous != null) {
                throw new GrainViolationException(GrainViolationException.Kind.DUPLICATE_EVIDENCE,
                        String.format("More than one %s evidence row for %s",
                                aggregate.getEvidenceType(), key));
            }
        }
        return byType;
    }
}
