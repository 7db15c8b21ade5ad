package com.flagship.class_enrollment.enrollment;

import com.flagship.class_enrollment.account.Account;
import com.flagship.class_enrollment.account.Student;
import com.flagship.class_enrollment.catalog.CourseClass;
import com.flagship.class_enrollment.catalog.CourseClassEntity;
import com.flagship.class_enrollment.catalog.CourseClassRepository;
import com.flagship.class_enrollment.enrollment.event.EnrollmentCompletedEvent;
import com.flagship.class_enrollment.exception.EnrollmentException;
import com.flagship.class_enrollment.exception.InvalidRequestException;
import com.flagship.class_enrollment.exception.NotFoundException;
import com.flagship.class_enrollment.observability.CorrelationContext;
import com.flagship.class_enrollment.observability.EnrollmentMetrics;
import com.flagship.class_enrollment.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Express checkout for a free introductory class: no pricing, no payment.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrialEnrollmentService {

    static final String TRIAL_ONLY = "Only introductory class is available for express checkout";

    private final EnrollmentRequestValidator validator;
    private final CourseClassRepository courseClassRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final OutboxService outboxService;
    private final EnrollmentMetrics metrics;

    /**
     * @throws InvalidRequestException if no class is given or its course is not a trial course
     * @throws NotFoundException if the class does not exist or the student does not belong to the caller
     */
    @Transactional
    public Enrollment enrollTrial(UUID accountId, UUID classId, UUID studentId, EnrollmentAttribution attribution) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.putEnrollmentContext(accountId, studentId);

        try {
            Account account = validator.requireAccount(accountId);
            if (classId == null) {
                throw new InvalidRequestException("invalid classId");
            }
            CourseClass courseClass = courseClassRepository.findWithCourseById(classId)
                .map(CourseClassEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("class not found",
                    Map.of("classId", classId.toString())));
            Student student = validator.requireStudent(studentId, account.getId());

            if (!courseClass.getCourse().isTrial()) {
                throw new InvalidRequestException(TRIAL_ONLY, Map.of("classId", classId.toString()));
            }

            EnrollmentEntity saved = enrollmentRepository.save(
                EnrollmentEntity.create(student.getId(), courseClass.getId(), attribution, null, null));
            Enrollment enrollment = saved.toDomain(student, courseClass);

            outboxService.saveEvent(EnrollmentCompletedEvent.AGGREGATE_TYPE, student.getId(),
                EnrollmentCompletedEvent.EVENT_TYPE, EnrollmentCompletedEvent.of(account.getId(), List.of(enrollment)));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordEnrollmentCompleted("TRIAL", "success");
            metrics.recordEnrollmentLatency("enroll_trial", duration);
            log.info("Enrolled student {} in trial class {}", student.getId(), courseClass.getId());
            return enrollment;

        } catch (EnrollmentException e) {
            log.warn("Trial enrollment rejected: {}", e.getMessage());
            metrics.recordEnrollmentCompleted("TRIAL", "rejected");
            throw e;
        } finally {
            CorrelationContext.clearEnrollmentContext();
        }
    }
}
