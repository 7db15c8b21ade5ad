package com.flagship.class_enrollment.payment;

import java.util.UUID;

/**
 * Idempotency keys sent to the payment gateway.
 *
 * The enrollment key (first class id + student id) identifies the purchase and is
 * what {@code payment_transactions.idempotency_key} stores. The gateway keeps the
 * response of a key for a day, refunds and declines included, so a charge key is
 * scoped to one enrollment attempt: the client library's own network retries
 * share it, a new request for the same purchase does not. Duplicate purchases are
 * stopped by the already-paid check under the account lock instead.
 */
public final class GatewayKeys {

    static final String REFUND_PREFIX = "refund-";
    static final String RETRY_SUFFIX = "-retry-";

    private GatewayKeys() {
    }

    public static String chargeKey(String enrollmentKey, UUID attemptId) {
        return enrollmentKey + "-" + attemptId;
    }

    /**
     * Key of the immediate refund made when the enrollment rolls back.
     */
    public static String refundKey(String chargeKey) {
        return REFUND_PREFIX + chargeKey;
    }

    /**
     * Key of a scheduled refund retry. Each retry gets its own key so a stored
     * gateway error is not replayed.
     */
    public static String retryRefundKey(String chargeKey, int attempt) {
        return refundKey(chargeKey) + RETRY_SUFFIX + attempt;
    }
}
