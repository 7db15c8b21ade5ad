package com.flagship.class_enrollment.exception;

/**
 * The store aborted the unit of work (lock conflict, deadlock, timeout, failed commit).
 */
public class TransactionAbortException extends EnrollmentException {

    public TransactionAbortException(String message, Throwable cause) {
        super(ErrorKind.TRANSACTION_ABORT, message, null, cause);
    }
}
