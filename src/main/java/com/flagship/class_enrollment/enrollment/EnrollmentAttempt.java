package com.flagship.class_enrollment.enrollment;

import com.flagship.class_enrollment.observability.CorrelationContext;
import com.flagship.class_enrollment.payment.CompensationResult;
import com.flagship.class_enrollment.payment.GatewayCharge;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Progress of one enrollment request through {@link EnrollmentState}.
 *
 * States only move forward. A captured charge is recorded here so that a
 * failure after capture is visible as "charged but not committed" until it is
 * compensated. Not thread-safe: an attempt belongs to the request thread.
 */
@Getter
public class EnrollmentAttempt {

    private final UUID id;
    private EnrollmentState state;
    private GatewayCharge capturedCharge;
    private String chargeKey;
    private CompensationResult compensation;

    private final List<EnrollmentState> visited = new ArrayList<>();

    public EnrollmentAttempt() {
        this.id = UUID.randomUUID();
        enter(EnrollmentState.VALIDATING);
    }

    /**
     * @throws IllegalStateException if the attempt is finished or {@code next} is not ahead of the current state
     */
    public void transitionTo(EnrollmentState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException(
                String.format("Enrollment attempt %s is already %s", id, state));
        }
        if (next.ordinal() <= state.ordinal()) {
            throw new IllegalStateException(
                String.format("Cannot move enrollment attempt %s from %s back to %s", id, state, next));
        }
        enter(next);
    }

    /**
     * @param chargeKey gateway idempotency key the charge was made with
     */
    public void recordCharge(GatewayCharge charge, String chargeKey) {
        if (state != EnrollmentState.CHARGING) {
            throw new IllegalStateException("A charge can only be captured while CHARGING, not " + state);
        }
        this.capturedCharge = charge;
        this.chargeKey = chargeKey;
    }

    public void recordCompensation(CompensationResult result) {
        if (capturedCharge == null) {
            throw new IllegalStateException("No charge to compensate on attempt " + id);
        }
        this.compensation = result;
    }

    public boolean isCompensated() {
        return compensation == CompensationResult.REFUNDED;
    }

    public boolean isReversalQueued() {
        return compensation == CompensationResult.QUEUED;
    }

    public Optional<GatewayCharge> capturedChargeIfAny() {
        return Optional.ofNullable(capturedCharge);
    }

    /**
     * True once money was taken and the attempt did not commit, until that is dealt with.
     */
    public boolean isChargedButNotCommitted() {
        return capturedCharge != null && state == EnrollmentState.ROLLED_BACK && compensation == null;
    }

    public List<EnrollmentState> getVisited() {
        return Collections.unmodifiableList(visited);
    }

    private void enter(EnrollmentState next) {
        this.state = next;
        this.visited.add(next);
        CorrelationContext.putEnrollmentState(next.name());
    }
}
