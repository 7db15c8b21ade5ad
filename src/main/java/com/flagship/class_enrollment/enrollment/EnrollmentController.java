package com.flagship.class_enrollment.enrollment;

import com.flagship.class_enrollment.enrollment.dto.EnrollClassRequest;
import com.flagship.class_enrollment.enrollment.dto.EnrollTrialRequest;
import com.flagship.class_enrollment.enrollment.dto.EnrollmentResponse;
import com.flagship.class_enrollment.exception.UnauthenticatedException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for enrollments.
 *
 * The caller's identity comes from the {@code X-Account-Id} header set by the
 * authenticating gateway in front of this service; UTM headers become the
 * enrollment's attribution.
 */
@RestController
@RequestMapping("/api/enrollments")
@RequiredArgsConstructor
@Slf4j
public class EnrollmentController {

    static final String ACCOUNT_ID_HEADER = "X-Account-Id";
    static final String UTM_SOURCE_HEADER = "X-Utm-Source";
    static final String UTM_CAMPAIGN_HEADER = "X-Utm-Campaign";

    private final EnrollmentTransactionCoordinator coordinator;
    private final TrialEnrollmentService trialEnrollmentService;

    @PostMapping("/classes")
    public ResponseEntity<List<EnrollmentResponse>> enrollClass(
            @Valid @RequestBody EnrollClassRequest request,
            @RequestHeader(value = ACCOUNT_ID_HEADER, required = false) String accountId,
            @RequestHeader(value = UTM_SOURCE_HEADER, required = false) String source,
            @RequestHeader(value = UTM_CAMPAIGN_HEADER, required = false) String campaign) {

        log.info("Received enrollment request: classIds={}, studentId={}, credit={}, promotionId={}, wholeSeries={}",
                request.getClassIds(), request.getStudentId(), request.getCredit(),
                request.getPromotionId(), request.getWholeSeries());

        EnrollClassCommand command = EnrollClassCommand.builder()
                .accountId(parseAccountId(accountId))
                .classIds(request.getClassIds())
                .studentId(request.getStudentId())
                .credit(request.getCredit() != null ? request.getCredit() : 0L)
                .promotionId(request.getPromotionId())
                .paymentMethodNonce(request.getPaymentMethodNonce())
                .wholeSeries(Boolean.TRUE.equals(request.getWholeSeries()))
                .attribution(EnrollmentAttribution.of(source, campaign))
                .build();

        List<EnrollmentResponse> body = coordinator.enrollClass(command).stream()
                .map(EnrollmentResponse::from)
                .toList();
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/trial")
    public ResponseEntity<EnrollmentResponse> enrollTrial(
            @Valid @RequestBody EnrollTrialRequest request,
            @RequestHeader(value = ACCOUNT_ID_HEADER, required = false) String accountId,
            @RequestHeader(value = UTM_SOURCE_HEADER, required = false) String source,
            @RequestHeader(value = UTM_CAMPAIGN_HEADER, required = false) String campaign) {

        log.info("Received trial enrollment request: classId={}, studentId={}",
                request.getClassId(), request.getStudentId());

        Enrollment enrollment = trialEnrollmentService.enrollTrial(
                parseAccountId(accountId),
                request.getClassId(),
                request.getStudentId(),
                EnrollmentAttribution.of(source, campaign));
        return ResponseEntity.status(HttpStatus.CREATED).body(EnrollmentResponse.from(enrollment));
    }

    private static UUID parseAccountId(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(header.trim());
        } catch (IllegalArgumentException e) {
            throw new UnauthenticatedException(EnrollmentRequestValidator.LOGIN_REQUIRED);
        }
    }
}
