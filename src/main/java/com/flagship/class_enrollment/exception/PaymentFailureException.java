package com.flagship.class_enrollment.exception;

import java.util.Map;

/**
 * The payment gateway declined or could not process a charge or refund.
 */
public class PaymentFailureException extends EnrollmentException {

    public PaymentFailureException(String message) {
        super(ErrorKind.PAYMENT_FAILURE, message, null, null);
    }

    public PaymentFailureException(String message, Throwable cause) {
        super(ErrorKind.PAYMENT_FAILURE, message, null, cause);
    }

    public PaymentFailureException(String message, Map<String, String> details, Throwable cause) {
        super(ErrorKind.PAYMENT_FAILURE, message, details, cause);
    }
}
