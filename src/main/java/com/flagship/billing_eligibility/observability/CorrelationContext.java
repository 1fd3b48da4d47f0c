package com.flagship.billing_eligibility.observability;

import java.util.UUID;

/**
 * Thread-local correlation ID for a publish cycle.
 *
 * The correlation ID flows through every log line of the cycle (via MDC)
 * so the draft, commit and summary steps of one publish can be traced
 * together.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String SNAPSHOT_ID_MDC_KEY = "snapshotId";
    public static final String AS_OF_MDC_KEY = "asOfTs";
    public static final String RULE_VERSION_MDC_KEY = "ruleVersion";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short format for readability in logs.
     */
    private static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }
}
