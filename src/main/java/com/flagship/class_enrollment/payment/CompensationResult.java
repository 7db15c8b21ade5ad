package com.flagship.class_enrollment.payment;

/**
 * What happened to a charge whose enrollment transaction did not commit.
 */
public enum CompensationResult {
    /** Refunded at the gateway. */
    REFUNDED,

    /** Refund failed; a reconciliation row will retry it. */
    QUEUED,

    /** The gateway transaction belongs to a committed payment, so it was left alone. */
    ALREADY_COMMITTED
}
