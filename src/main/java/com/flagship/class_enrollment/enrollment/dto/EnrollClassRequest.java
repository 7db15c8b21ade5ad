package com.flagship.class_enrollment.enrollment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.UUID;

/**
 * Request body for a class purchase. Class ids are checked by the enrollment
 * validator, which also resolves them.
 */
@Value
@Builder
@Jacksonized
public class EnrollClassRequest {

    @JsonProperty("class_ids")
    List<UUID> classIds;

    @NotNull(message = "Student ID is required")
    @JsonProperty("student_id")
    UUID studentId;

    @PositiveOrZero(message = "Credit must not be negative")
    @JsonProperty("credit")
    Long credit;

    @JsonProperty("promotion_id")
    UUID promotionId;

    @JsonProperty("payment_method_nonce")
    String paymentMethodNonce;

    @JsonProperty("whole_series")
    Boolean wholeSeries;
}
