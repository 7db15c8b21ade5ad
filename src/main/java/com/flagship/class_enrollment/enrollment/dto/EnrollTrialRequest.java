package com.flagship.class_enrollment.enrollment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class EnrollTrialRequest {

    @NotNull(message = "Class ID is required")
    @JsonProperty("class_id")
    UUID classId;

    @NotNull(message = "Student ID is required")
    @JsonProperty("student_id")
    UUID studentId;
}
