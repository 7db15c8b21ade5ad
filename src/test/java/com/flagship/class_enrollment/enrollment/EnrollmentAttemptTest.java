package com.flagship.class_enrollment.enrollment;

import com.flagship.class_enrollment.observability.CorrelationContext;
import com.flagship.class_enrollment.payment.CompensationResult;
import com.flagship.class_enrollment.payment.GatewayCharge;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnrollmentAttemptTest {

    private final GatewayCharge charge = new GatewayCharge("pi_1", 7000, "succeeded", Map.of());

    @AfterEach
    void tearDown() {
        CorrelationContext.clearEnrollmentContext();
    }

    @Test
    @DisplayName("New attempt starts in VALIDATING")
    void startsValidating() {
        EnrollmentAttempt attempt = new EnrollmentAttempt();

        assertEquals(EnrollmentState.VALIDATING, attempt.getState());
        assertEquals(List.of(EnrollmentState.VALIDATING), attempt.getVisited());
        assertEquals("VALIDATING", MDC.get(CorrelationContext.ENROLLMENT_STATE_MDC_KEY));
    }

    @Test
    @DisplayName("States only move forward")
    void forwardOnly() {
        EnrollmentAttempt attempt = new EnrollmentAttempt();
        attempt.transitionTo(EnrollmentState.PRICING);
        attempt.transitionTo(EnrollmentState.APPLYING_CREDIT);

        assertThrows(IllegalStateException.class, () -> attempt.transitionTo(EnrollmentState.APPLYING_PROMOTION));
        assertThrows(IllegalStateException.class, () -> attempt.transitionTo(EnrollmentState.APPLYING_CREDIT));
        assertEquals(EnrollmentState.APPLYING_CREDIT, attempt.getState());
    }

    @Test
    @DisplayName("Terminal states accept no further transition")
    void terminal() {
        EnrollmentAttempt attempt = new EnrollmentAttempt();
        attempt.transitionTo(EnrollmentState.ROLLED_BACK);

        assertThrows(IllegalStateException.class, () -> attempt.transitionTo(EnrollmentState.COMPLETED));
    }

    @Test
    @DisplayName("Charge can only be recorded while CHARGING")
    void chargeOnlyWhileCharging() {
        EnrollmentAttempt attempt = new EnrollmentAttempt();
        attempt.transitionTo(EnrollmentState.PERSISTING_ENROLLMENTS);

        assertThrows(IllegalStateException.class, () -> attempt.recordCharge(charge, "key1-abc"));

        attempt.transitionTo(EnrollmentState.CHARGING);
        attempt.recordCharge(charge, "key1-abc");
        assertEquals(charge, attempt.capturedChargeIfAny().orElseThrow());
        assertEquals("key1-abc", attempt.getChargeKey());
    }

    @Test
    @DisplayName("Rolled-back charge stays visible until it is refunded or queued")
    void chargedButNotCommitted() {
        EnrollmentAttempt attempt = new EnrollmentAttempt();
        attempt.transitionTo(EnrollmentState.CHARGING);
        attempt.recordCharge(charge, "key1-abc");
        attempt.transitionTo(EnrollmentState.ROLLED_BACK);

        assertTrue(attempt.isChargedButNotCommitted());

        attempt.recordCompensation(CompensationResult.QUEUED);

        assertFalse(attempt.isChargedButNotCommitted());
        assertTrue(attempt.isReversalQueued());
        assertFalse(attempt.isCompensated());
    }

    @Test
    @DisplayName("Charge owned by a committed payment is neither refunded nor stranded")
    void chargeOwnedByCommittedPayment() {
        EnrollmentAttempt attempt = new EnrollmentAttempt();
        attempt.transitionTo(EnrollmentState.CHARGING);
        attempt.recordCharge(charge, "key1-abc");
        attempt.transitionTo(EnrollmentState.ROLLED_BACK);

        attempt.recordCompensation(CompensationResult.ALREADY_COMMITTED);

        assertFalse(attempt.isChargedButNotCommitted());
        assertFalse(attempt.isCompensated());
        assertFalse(attempt.isReversalQueued());
    }

    @Test
    @DisplayName("Compensation without a captured charge is a programming error")
    void compensationWithoutCharge() {
        EnrollmentAttempt attempt = new EnrollmentAttempt();

        assertThrows(IllegalStateException.class, () -> attempt.recordCompensation(CompensationResult.REFUNDED));
    }
}
