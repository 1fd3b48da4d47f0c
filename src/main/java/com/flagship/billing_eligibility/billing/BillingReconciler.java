package com.flagship.billing_eligibility.billing;

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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Joins invoice facts onto the spine and derives invoiced / paid flags.
 *
 * - invoiced: some line for the key has invoiced_ts <= as-of and no reversal
 *   of that invoice line with reversed_ts <= as-of
 * - paid: same, using paid_ts
 *
 * Facts for keys absent from the spine are orphans: logged, returned, and
 * excluded from the join.
 */
@Component
@Slf4j
public class BillingReconciler {

    static final String INVOICE_SOURCE = "INVOICES";

    public BillingReconciliation reconcile(List<SpineRow> spine,
                                           Collection<InvoiceLineFact> facts,
                                           Collection<InvoiceReversal> reversals,
                                           Instant asOf) {
        List<CycleWarning> warnings = new ArrayList<>();
        if (facts.isEmpty()) {
            log.warn("Ingestion incomplete: no invoice lines delivered, asOf={}", asOf);
            warnings.add(CycleWarning.ingestionIncomplete(INVOICE_SOURCE));
        }

        Set<String> reversed = reversedInvoiceLines(reversals, asOf);

        Map<ScopeKey, BillingStatus> statuses = new LinkedHashMap<>();
        for (SpineRow row : spine) {
            statuses.put(row.getKey(), BillingStatus.NOT_INVOICED);
        }

        List<OrphanInvoiceLine> orphans = new ArrayList<>();
        for (InvoiceLineFact fact : facts) {
            if (fact.getInvoicedTs() == null || fact.getInvoicedTs().isAfter(asOf)) {
                continue;
            }
            ScopeKey key = ScopeKey.of(fact.getScopePackageId(), fact.getFlocId());
            BillingStatus current = statuses.get(key);
            if (current == null) {
                orphans.add(new OrphanInvoiceLine(fact.getInvoiceId(), key.getScopePackageId(),
                        key.getFlocId(), fact.getInvoicedTs()));
                continue;
            }
            if (reversed.contains(reversalKey(fact.getInvoiceId(), key))) {
                continue;
            }
            boolean paid = fact.getPaidTs() != null && !fact.getPaidTs().isAfter(asOf);
            statuses.put(key, new BillingStatus(true, current.isPaid() || paid));
        }

        orphans.sort(Comparator.comparing(OrphanInvoiceLine::getScopePackageId)
                .thenComparing(OrphanInvoiceLine::getFlocId)
                .thenComparing(OrphanInvoiceLine::getInvoiceId, Comparator.nullsFirst(Comparator.naturalOrder())));

        if (!orphans.isEmpty()) {
            for (OrphanInvoiceLine orphan : orphans) {
                log.warn("Orphan invoice line excluded from billing join: invoiceId={}, key={}|{}",
                        orphan.getInvoiceId(), orphan.getScopePackageId(), orphan.getFlocId());
            }
            warnings.add(new CycleWarning(WarningCode.ORPHAN_INVOICE_LINE, INVOICE_SOURCE, orphans.size(),
                    orphans.size() + " invoice lines reference keys absent from the spine"));
        }

        return new BillingReconciliation(
                Collections.unmodifiableMap(statuses),
                List.copyOf(orphans),
                List.copyOf(warnings));
    }

    private Set<String> reversedInvoiceLines(Collection<InvoiceReversal> reversals, Instant asOf) {
        Set<String> reversed = new HashSet<>();
        for (InvoiceReversal reversal : reversals) {
            if (reversal.getReversedTs() != null && !reversal.getReversedTs().isAfter(asOf)) {
                reversed.add(reversalKey(reversal.getInvoiceId(),
                        ScopeKey.of(reversal.getScopePackageId(), reversal.getFlocId())));
            }
        }
        return reversed;
    }

    private static String reversalKey(String invoiceId, ScopeKey key) {
        return invoiceId + "#" + key.businessKey();
    }
}
