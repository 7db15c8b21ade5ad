package com.flagship.class_enrollment.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local context for correlation ID propagation.
 *
 * The correlation ID flows through HTTP requests (from header or generated),
 * every log statement via MDC, and the enrollment transaction. Enrollment code
 * adds the account, student and current workflow state to the MDC so a single
 * purchase can be followed across its steps.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";
    public static final String STUDENT_ID_MDC_KEY = "studentId";
    public static final String ENROLLMENT_STATE_MDC_KEY = "enrollmentState";

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

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    /**
     * Puts the purchasing account and student in the MDC.
     */
    public static void putEnrollmentContext(UUID accountId, UUID studentId) {
        if (accountId != null) {
            MDC.put(ACCOUNT_ID_MDC_KEY, accountId.toString());
        }
        if (studentId != null) {
            MDC.put(STUDENT_ID_MDC_KEY, studentId.toString());
        }
    }

    public static void putEnrollmentState(String state) {
        MDC.put(ENROLLMENT_STATE_MDC_KEY, state);
    }

    public static void clearEnrollmentContext() {
        MDC.remove(ACCOUNT_ID_MDC_KEY);
        MDC.remove(STUDENT_ID_MDC_KEY);
        MDC.remove(ENROLLMENT_STATE_MDC_KEY);
    }

    /**
     * Clears the correlation ID from the current thread.
     * Should be called at the end of request processing.
     */
    public static void clear() {
        correlationId.remove();
    }

    /**
     * Generates a new correlation ID.
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }
}
