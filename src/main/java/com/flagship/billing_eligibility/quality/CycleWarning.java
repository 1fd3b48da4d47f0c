package com.flagship.billing_eligibility.quality;

import lombok.Value;

/**
 * A non-fatal condition recorded during a publish cycle.
 *
 * {@code source} names the relation the warning is about (an evidence type
 * or {@code INVOICES}); {@code affectedRows} counts the rows involved.
 */
@Value
public class CycleWarning {
    WarningCode code;
    String source;
    int affectedRows;
    String message;

    public static CycleWarning ingestionIncomplete(String source) {
        return new CycleWarning(WarningCode.INGESTION_INCOMPLETE, source, 0,
                "No " + source + " rows delivered for this cycle; treated as not received");
    }
}
