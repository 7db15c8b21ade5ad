package com.flagship.class_enrollment.enrollment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.class_enrollment.enrollment.Enrollment;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An enrollment with its student and class resolved.
 */
@Value
@Builder
public class EnrollmentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("student")
    StudentView student;

    @JsonProperty("class")
    ClassView courseClass;

    @JsonProperty("source")
    String source;

    @JsonProperty("campaign")
    String campaign;

    @JsonProperty("promotion_id")
    UUID promotionId;

    @JsonProperty("credit_id")
    UUID creditId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static EnrollmentResponse from(Enrollment enrollment) {
        return EnrollmentResponse.builder()
            .id(enrollment.getId())
            .student(new StudentView(enrollment.getStudent().getId(), enrollment.getStudent().getName()))
            .courseClass(new ClassView(
                enrollment.getCourseClass().getId(),
                enrollment.getCourseClass().getCourse().getId(),
                enrollment.getCourseClass().getCourse().getName(),
                enrollment.getCourseClass().getStartDate()))
            .source(enrollment.getSource())
            .campaign(enrollment.getCampaign())
            .promotionId(enrollment.getPromotionId())
            .creditId(enrollment.getCreditId())
            .createdAt(enrollment.getCreatedAt())
            .build();
    }

    @Value
    public static class StudentView {
        @JsonProperty("id")
        UUID id;

        @JsonProperty("name")
        String name;
    }

    @Value
    public static class ClassView {
        @JsonProperty("id")
        UUID id;

        @JsonProperty("course_id")
        UUID courseId;

        @JsonProperty("course_name")
        String courseName;

        @JsonProperty("start_date")
        Instant startDate;
    }
}
