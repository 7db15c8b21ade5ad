package com.flagship.class_enrollment.payment;

import lombok.Value;

import java.util.Map;

/**
 * A charge captured by the gateway, with the raw details it returned.
 */
@Value
public class GatewayCharge {
    String transactionId;
    long amountInCents;
    String status;
    Map<String, Object> details;
}
