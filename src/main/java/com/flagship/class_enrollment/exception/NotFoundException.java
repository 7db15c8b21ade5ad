package com.flagship.class_enrollment.exception;

import java.util.Map;

public class NotFoundException extends EnrollmentException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message, null, null);
    }

    public NotFoundException(String message, Map<String, String> details) {
        super(ErrorKind.NOT_FOUND, message, details, null);
    }
}
