package com.flagship.class_enrollment.payment;

import com.flagship.class_enrollment.exception.PaymentFailureException;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * External payment gateway.
 *
 * Calls are not transactional: a capture that succeeded stays captured whatever
 * happens to the caller's database transaction, which is why {@link #refund} exists.
 * Both calls take an idempotency key so a retried request cannot charge or refund twice.
 */
public interface PaymentGateway {

    /**
     * Captures a charge.
     *
     * @param amount amount in major currency units (e.g. 70.00)
     * @param paymentToken single-use payment method token from the client
     * @param idempotencyKey key scoped to one enrollment attempt, see {@link GatewayKeys#chargeKey}
     * @return the captured charge
     * @throws PaymentFailureException if the gateway declines or errors
     */
    GatewayCharge charge(BigDecimal amount, String paymentToken, String idempotencyKey);

    /**
     * Reverses a previously captured charge in full.
     *
     * @throws PaymentFailureException if the reversal could not be made
     */
    GatewayRefund refund(String transactionId, String idempotencyKey);

    /**
     * Looks up a refund already made, or still in flight, for a captured charge.
     *
     * @throws PaymentFailureException if the gateway cannot be queried
     */
    Optional<GatewayRefund> findRefund(String transactionId);
}
