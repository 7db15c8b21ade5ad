package com.flagship.class_enrollment.credit;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * Attribution stored with each credit row as JSON.
 */
@Value
@Builder
@Jacksonized
public class CreditDetails {
    String reason;
    String createdBy;
    Attribution attribution;

    @Value
    @Builder
    @Jacksonized
    public static class Attribution {
        UUID userId;
        UUID classId;
    }
}
