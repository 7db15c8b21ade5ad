package com.flagship.class_enrollment.payment;

import lombok.Value;

@Value
public class GatewayRefund {
    String refundId;
    String transactionId;
    String status;
}
