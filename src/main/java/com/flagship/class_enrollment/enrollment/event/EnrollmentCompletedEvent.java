package com.flagship.class_enrollment.enrollment.event;

import com.flagship.class_enrollment.enrollment.Enrollment;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published once enrollments have committed, for notification and analytics
 * consumers. Carries every enrollment created by the request.
 */
@Value
public class EnrollmentCompletedEvent {
    UUID eventId;
    Instant occurredAt;
    UUID accountId;
    List<EnrolledClass> enrollments;

    public static final String EVENT_TYPE = "EnrollmentCompleted";
    public static final String AGGREGATE_TYPE = "Enrollment";

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static EnrollmentCompletedEvent of(UUID accountId, List<Enrollment> enrollments) {
        if (enrollments.isEmpty()) {
            throw new IllegalArgumentException("An enrollment event needs at least one enrollment");
        }
        return new EnrollmentCompletedEvent(
            UUID.randomUUID(),
            Instant.now(),
            accountId,
            enrollments.stream().map(EnrolledClass::from).toList()
        );
    }

    @Value
    public static class EnrolledClass {
        UUID enrollmentId;
        UUID studentId;
        String studentName;
        UUID classId;
        UUID courseId;
        String courseName;

        static EnrolledClass from(Enrollment enrollment) {
            return new EnrolledClass(
                enrollment.getId(),
                enrollment.getStudent().getId(),
                enrollment.getStudent().getName(),
                enrollment.getCourseClass().getId(),
                enrollment.getCourseClass().getCourse().getId(),
                enrollment.getCourseClass().getCourse().getName()
            );
        }
    }
}
