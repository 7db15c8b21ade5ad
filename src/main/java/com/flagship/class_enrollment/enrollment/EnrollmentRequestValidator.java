package com.flagship.class_enrollment.enrollment;

import com.flagship.class_enrollment.account.Account;
import com.flagship.class_enrollment.account.AccountEntity;
import com.flagship.class_enrollment.account.AccountRepository;
import com.flagship.class_enrollment.account.Student;
import com.flagship.class_enrollment.account.StudentEntity;
import com.flagship.class_enrollment.account.StudentRepository;
import com.flagship.class_enrollment.catalog.CourseClass;
import com.flagship.class_enrollment.catalog.CourseClassEntity;
import com.flagship.class_enrollment.catalog.CourseClassRepository;
import com.flagship.class_enrollment.credit.CreditLedger;
import com.flagship.class_enrollment.exception.InvalidRequestException;
import com.flagship.class_enrollment.exception.NotFoundException;
import com.flagship.class_enrollment.exception.UnauthenticatedException;
import com.flagship.class_enrollment.observability.EnrollmentMetrics;
import com.flagship.class_enrollment.payment.ChargeIdempotencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Checks an enrollment request before any transaction opens. A rejected request
 * writes nothing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EnrollmentRequestValidator {

    static final String LOGIN_REQUIRED = "You must login first";

    private final AccountRepository accountRepository;
    private final StudentRepository studentRepository;
    private final CourseClassRepository courseClassRepository;
    private final CreditLedger creditLedger;
    private final ChargeIdempotencyService chargeIdempotencyService;
    private final EnrollmentMetrics metrics;

    /**
     * @throws UnauthenticatedException if there is no caller
     * @throws InvalidRequestException for unknown classes, a credit above the balance or an already paid purchase
     * @throws NotFoundException if the student does not belong to the caller
     */
    @Transactional(readOnly = true)
    public ValidatedEnrollment validate(EnrollClassCommand command) {
        Account account = requireAccount(command.getAccountId());
        List<CourseClass> classes = requireClasses(command.getClassIds());
        Student student = requireStudent(command.getStudentId(), account.getId());

        if (command.getCredit() < 0) {
            throw new InvalidRequestException("credit must not be negative",
                Map.of("credit", String.valueOf(command.getCredit())));
        }
        if (command.getCredit() > 0) {
            long balance = creditLedger.balanceOf(account.getId());
            if (command.getCredit() > balance) {
                throw new InvalidRequestException("you do not have enough credit",
                    Map.of("credit", String.valueOf(command.getCredit()), "balance", String.valueOf(balance)));
            }
        }

        String chargeKey = command.chargeIdempotencyKey();
        Optional<UUID> committed = chargeIdempotencyService.findCommittedCharge(chargeKey);
        if (committed.isPresent()) {
            metrics.recordIdempotencyHit();
            log.warn("Enrollment {} was already paid by transaction {}", chargeKey, committed.get());
            throw new InvalidRequestException("enrollment already paid",
                Map.of("paymentTransactionId", committed.get().toString()));
        }
        metrics.recordIdempotencyMiss();

        return new ValidatedEnrollment(account, student, classes, chargeKey);
    }

    /**
     * @throws UnauthenticatedException if the id is null or names no account
     */
    public Account requireAccount(UUID accountId) {
        if (accountId == null) {
            throw new UnauthenticatedException(LOGIN_REQUIRED);
        }
        return accountRepository.findById(accountId)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> new UnauthenticatedException(LOGIN_REQUIRED));
    }

    public Student requireStudent(UUID studentId, UUID accountId) {
        if (studentId == null) {
            throw new InvalidRequestException("student_id is required");
        }
        return studentRepository.findByIdAndParentId(studentId, accountId)
            .map(StudentEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("student not found",
                Map.of("studentId", studentId.toString())));
    }

    /**
     * Resolves the classes with their courses, in request order. Repeated ids are collapsed.
     */
    public List<CourseClass> requireClasses(List<UUID> classIds) {
        if (classIds == null || classIds.isEmpty() || classIds.contains(null)) {
            throw new InvalidRequestException("invalid classIds");
        }
        Set<UUID> requested = new LinkedHashSet<>(classIds);
        Map<UUID, CourseClass> found = courseClassRepository.findAllWithCourseByIdIn(requested).stream()
            .map(CourseClassEntity::toDomain)
            .collect(Collectors.toMap(CourseClass::getId, Function.identity()));

        List<CourseClass> classes = new ArrayList<>(requested.size());
        for (UUID id : requested) {
            CourseClass courseClass = found.get(id);
            if (courseClass == null) {
                throw new InvalidRequestException("invalid classIds", Map.of("classId", id.toString()));
            }
            classes.add(courseClass);
        }
        return classes;
    }
}
