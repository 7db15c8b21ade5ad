package com.flagship.class_enrollment.enrollment;

import com.flagship.class_enrollment.account.Account;
import com.flagship.class_enrollment.account.Student;
import com.flagship.class_enrollment.catalog.CourseClass;
import com.flagship.class_enrollment.catalog.CourseClassEntity;
import com.flagship.class_enrollment.catalog.CourseClassRepository;
import com.flagship.class_enrollment.enrollment.event.EnrollmentCompletedEvent;
import com.flagship.class_enrollment.exception.InvalidRequestException;
import com.flagship.class_enrollment.exception.NotFoundException;
import com.flagship.class_enrollment.observability.EnrollmentMetrics;
import com.flagship.class_enrollment.outbox.OutboxService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.UUID;

import static com.flagship.class_enrollment.TestFixtures.classOf;
import static com.flagship.class_enrollment.TestFixtures.regularCourse;
import static com.flagship.class_enrollment.TestFixtures.studentOf;
import static com.flagship.class_enrollment.TestFixtures.trialCourse;
import static com.flagship.class_enrollment.TestFixtures.unpaidAccount;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TrialEnrollmentServiceTest {

    private EnrollmentRequestValidator validator;
    private CourseClassRepository courseClassRepository;
    private EnrollmentRepository enrollmentRepository;
    private OutboxService outboxService;
    private SimpleMeterRegistry meterRegistry;
    private TrialEnrollmentService service;

    private Account account;
    private Student student;

    @BeforeEach
    void setUp() {
        validator = mock(EnrollmentRequestValidator.class);
        courseClassRepository = mock(CourseClassRepository.class);
        enrollmentRepository = mock(EnrollmentRepository.class);
        outboxService = mock(OutboxService.class);
        meterRegistry = new SimpleMeterRegistry();
        service = new TrialEnrollmentService(validator, courseClassRepository, enrollmentRepository, outboxService,
            new EnrollmentMetrics(meterRegistry));

        account = unpaidAccount();
        student = studentOf(account);
        when(validator.requireAccount(account.getId())).thenReturn(account);
        when(validator.requireStudent(student.getId(), account.getId())).thenReturn(student);
        when(enrollmentRepository.save(any(EnrollmentEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private void stubClass(CourseClass courseClass) {
        CourseClassEntity entity = mock(CourseClassEntity.class);
        when(entity.toDomain()).thenReturn(courseClass);
        when(courseClassRepository.findWithCourseById(courseClass.getId())).thenReturn(Optional.of(entity));
    }

    @Test
    @DisplayName("Trial class is enrolled and announced")
    void enrollsTrial() {
        CourseClass intro = classOf(trialCourse("Intro"));
        stubClass(intro);

        Enrollment enrollment = service.enrollTrial(account.getId(), intro.getId(), student.getId(),
            EnrollmentAttribution.none());

        assertEquals(intro, enrollment.getCourseClass());
        assertEquals(student.getId(), enrollment.getStudent().getId());
        verify(outboxService).saveEvent(eq(EnrollmentCompletedEvent.AGGREGATE_TYPE), eq(student.getId()),
            eq(EnrollmentCompletedEvent.EVENT_TYPE), any(EnrollmentCompletedEvent.class));
        assertEquals(1.0, meterRegistry.counter("enrollments.completed", "shape", "TRIAL", "status", "success").count());
    }

    @Test
    @DisplayName("Unknown class is not found")
    void unknownClass() {
        UUID missing = UUID.randomUUID();
        when(courseClassRepository.findWithCourseById(missing)).thenReturn(Optional.empty());

        NotFoundException e = assertThrows(NotFoundException.class,
            () -> service.enrollTrial(account.getId(), missing, student.getId(), EnrollmentAttribution.none()));

        assertEquals("class not found", e.getMessage());
        assertEquals(missing.toString(), e.getDetails().get("classId"));
        verifyNoInteractions(enrollmentRepository, outboxService);
        assertEquals(1.0, meterRegistry.counter("enrollments.completed", "shape", "TRIAL", "status", "rejected").count());
    }

    @Test
    @DisplayName("Missing class id is an invalid request")
    void missingClassId() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
            () -> service.enrollTrial(account.getId(), null, student.getId(), EnrollmentAttribution.none()));

        assertEquals("invalid classId", e.getMessage());
        verifyNoInteractions(courseClassRepository, enrollmentRepository);
    }

    @Test
    @DisplayName("Regular class is refused for express checkout")
    void regularClass() {
        CourseClass math = classOf(regularCourse("Math 1", 1, 10000));
        stubClass(math);

        InvalidRequestException e = assertThrows(InvalidRequestException.class,
            () -> service.enrollTrial(account.getId(), math.getId(), student.getId(), EnrollmentAttribution.none()));

        assertEquals(TrialEnrollmentService.TRIAL_ONLY, e.getMessage());
        verifyNoInteractions(enrollmentRepository, outboxService);
    }
}
