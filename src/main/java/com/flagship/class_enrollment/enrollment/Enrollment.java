package com.flagship.class_enrollment.enrollment;

import com.flagship.class_enrollment.account.Student;
import com.flagship.class_enrollment.catalog.CourseClass;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A student's seat in a class, with the attribution and the promotion and
 * credit used to pay for it. Created once, never modified.
 */
@Value
public class Enrollment {
    UUID id;
    Student student;
    CourseClass courseClass;
    String source;
    String campaign;
    UUID promotionId;
    UUID creditId;
    Instant createdAt;
}
