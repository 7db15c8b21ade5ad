package com.flagship.class_enrollment.enrollment;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * A parent's request to enroll one student in one or more classes.
 *
 * {@code accountId} is the authenticated caller, or null when the request
 * carried no identity.
 */
@Value
@Builder
public class EnrollClassCommand {
    UUID accountId;
    List<UUID> classIds;
    UUID studentId;
    long credit;
    UUID promotionId;
    String paymentMethodNonce;
    boolean wholeSeries;
    @Builder.Default
    EnrollmentAttribution attribution = EnrollmentAttribution.none();

    /**
     * Key the gateway charge is made with: first requested class id followed by the student id.
     * A retried request for the same purchase maps to the same key.
     */
    public String chargeIdempotencyKey() {
        return classIds.get(0).toString() + studentId;
    }
}
