package com.flagship.class_enrollment.payment;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A committed payment for one enrollment request and the enrollments it paid for.
 */
@Value
public class PaymentTransaction {
    UUID id;
    long amountInCents;
    String gatewayTransactionId;
    String idempotencyKey;
    String details;
    List<UUID> enrollmentIds;
    Instant createdAt;
}
