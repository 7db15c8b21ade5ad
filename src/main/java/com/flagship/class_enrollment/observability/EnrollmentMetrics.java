package com.flagship.class_enrollment.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for enrollment operations.
 *
 * Metrics exposed:
 * - enrollments.completed{shape,status}: committed purchases and trials
 * - enrollments.latency{operation}: end-to-end duration of an enrollment
 * - enrollments.rolled_back{reason}: enrollments that did not commit
 * - payments.charged{status}: gateway charge outcomes
 * - charges.compensated{result}: reversals of charges whose enrollment rolled back
 * - idempotency.cache{result}: duplicate-charge guard lookups
 */
@Component
public class EnrollmentMetrics {

    private final MeterRegistry registry;

    public EnrollmentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEnrollmentCompleted(String shape, String status) {
        registry.counter("enrollments.completed",
                "shape", sanitizeTag(shape),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordEnrollmentLatency(String operation, long durationMs) {
        registry.timer("enrollments.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordRolledBack(String reason) {
        registry.counter("enrollments.rolled_back",
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordCharge(String status) {
        registry.counter("payments.charged",
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordCompensation(String result) {
        registry.counter("charges.compensated",
                "result", sanitizeTag(result)
        ).increment();
    }

    /**
     * Records a duplicate-charge guard hit (key already charged).
     */
    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
