package com.flagship.class_enrollment.exception;

public class UnauthenticatedException extends EnrollmentException {

    public UnauthenticatedException(String message) {
        super(ErrorKind.UNAUTHENTICATED, message, null, null);
    }
}
