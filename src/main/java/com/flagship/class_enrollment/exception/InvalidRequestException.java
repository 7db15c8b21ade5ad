package com.flagship.class_enrollment.exception;

import java.util.Map;

/**
 * Request is well-formed but cannot be honoured: empty class list, not enough
 * credit, an ineligible promotion, a duplicate charge.
 */
public class InvalidRequestException extends EnrollmentException {

    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message, null, null);
    }

    public InvalidRequestException(String message, Map<String, String> details) {
        super(ErrorKind.INVALID_REQUEST, message, details, null);
    }
}
