package com.flagship.class_enrollment.exception;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable failure kinds surfaced to callers.
 */
public enum ErrorKind {
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    PAYMENT_FAILURE(HttpStatus.PAYMENT_REQUIRED),
    TRANSACTION_ABORT(HttpStatus.CONFLICT);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
