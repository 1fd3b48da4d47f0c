package com.flagship.billing_eligibility.summary;

import com.flagship.billing_eligibility.snapshot.SnapshotLine;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Rolls snapshot lines up to one row per scope package.
 *
 * Every line is either ready or blocked, so ready + blocked = total.
 * Invoiced and paid are counted independently of readiness.
 * Rows come out ordered by package id.
 */
@Component
public class SummaryAggregator {

    static final int RATE_SCALE = 4;

    public List<SnapshotSummary> aggregate(UUID snapshotId, Instant asOfTs, String ruleVersion,
                                           List<SnapshotLine> lines) {
        Map<String, int[]> counts = new TreeMap<>();
        for (SnapshotLine line : lines) {
            if (!snapshotId.equals(line.getSnapshotId())) {
                throw new IllegalArgumentException(
                    "Line of snapshot " + line.getSnapshotId() + " passed for snapshot " + snapshotId);
            }
            // total, ready, invoiced, paid
            int[] c = counts.computeIfAbsent(line.getScopePackageId(), k -> new int[4]);
            c[0]++;
            if (line.isReadyToInvoice()) {
                c[1]++;
            }
            if (line.isInvoiced()) {
                c[2]++;
            }
            if (line.isPaid()) {
                c[3]++;
            }
        }

        List<SnapshotSummary> summaries = new ArrayList<>(counts.size());
        counts.forEach((packageId, c) -> summaries.add(new SnapshotSummary(
            snapshotId,
            packageId,
            c[0],
            c[1],
            c[0] - c[1],
            c[2],
            c[3],
            readyRate(c[1], c[0]),
            asOfTs,
            ruleVersion
        )));
        return List.copyOf(summaries);
    }

    static BigDecimal readyRate(int ready, int total) {
        if (total == 0) {
            return BigDecimal.ZERO.setScale(RATE_SCALE);
        }
        return BigDecimal.valueOf(ready).divide(BigDecimal.valueOf(total), RATE_SCALE, RoundingMode.HALF_UP);
    }
}
