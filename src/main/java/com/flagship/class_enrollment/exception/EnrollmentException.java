package com.flagship.class_enrollment.exception;

import java.util.Map;

/**
 * Base type for every failure the enrollment workflow reports to its caller.
 *
 * Subclasses fix the {@link ErrorKind}; the message is human-readable and the
 * details map carries the offending request values where useful.
 */
public abstract class EnrollmentException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, String> details;

    protected EnrollmentException(ErrorKind kind, String message, Map<String, String> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
