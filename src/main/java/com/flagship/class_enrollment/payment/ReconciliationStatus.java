package com.flagship.class_enrollment.payment;

/**
 * State of a captured charge whose enrollment transaction did not commit.
 */
public enum ReconciliationStatus {
    /** Charge still captured; a reversal will be retried. */
    PENDING,

    /** Charge reversed at the gateway. Terminal. */
    REVERSED,

    /** Retries exhausted; needs manual follow-up. Terminal. */
    ABANDONED,

    /** The charge turned out to be recorded by a committed payment; nothing to reverse. Terminal. */
    COMMITTED
}
