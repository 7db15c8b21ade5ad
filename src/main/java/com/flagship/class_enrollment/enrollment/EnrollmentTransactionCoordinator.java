package com.flagship.class_enrollment.enrollment;

import com.flagship.class_enrollment.account.Account;
import com.flagship.class_enrollment.account.AccountEntity;
import com.flagship.class_enrollment.account.AccountRepository;
import com.flagship.class_enrollment.account.Student;
import com.flagship.class_enrollment.catalog.CourseClass;
import com.flagship.class_enrollment.config.EnrollmentProperties;
import com.flagship.class_enrollment.credit.Credit;
import com.flagship.class_enrollment.credit.CreditApplication;
import com.flagship.class_enrollment.credit.CreditDetails;
import com.flagship.class_enrollment.credit.CreditLedger;
import com.flagship.class_enrollment.enrollment.event.EnrollmentCompletedEvent;
import com.flagship.class_enrollment.exception.EnrollmentException;
import com.flagship.class_enrollment.exception.InvalidRequestException;
import com.flagship.class_enrollment.exception.PaymentFailureException;
import com.flagship.class_enrollment.exception.TransactionAbortException;
import com.flagship.class_enrollment.exception.UnauthenticatedException;
import com.flagship.class_enrollment.observability.CorrelationContext;
import com.flagship.class_enrollment.observability.EnrollmentMetrics;
import com.flagship.class_enrollment.outbox.OutboxService;
import com.flagship.class_enrollment.payment.ChargeCompensator;
import com.flagship.class_enrollment.payment.ChargeIdempotencyService;
import com.flagship.class_enrollment.payment.CompensationResult;
import com.flagship.class_enrollment.payment.GatewayCharge;
import com.flagship.class_enrollment.payment.GatewayKeys;
import com.flagship.class_enrollment.payment.PaymentGateway;
import com.flagship.class_enrollment.payment.PaymentTransaction;
import com.flagship.class_enrollment.payment.PaymentTransactionService;
import com.flagship.class_enrollment.pricing.PriceQuote;
import com.flagship.class_enrollment.pricing.PricingCalculator;
import com.flagship.class_enrollment.promotion.Promotion;
import com.flagship.class_enrollment.promotion.PromotionValidator;
import com.flagship.class_enrollment.referral.ReferralCreditIssuer;
import com.flagship.class_enrollment.referral.ReferralOutcome;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs a class purchase as one all-or-nothing unit.
 *
 * Validation happens first, outside any transaction. Pricing, promotion use,
 * credit consumption, the referral grant, the enrollment rows, the gateway
 * charge, the payment record and the staged completion event then share a
 * single READ_COMMITTED transaction. The account row is locked for its whole
 * duration, gateway round trip included; the transaction timeout bounds that.
 *
 * The already-paid check is repeated under the account lock, which serializes
 * concurrent purchases for the same student. If anything fails after the charge
 * was captured, the charge is reversed before the error is surfaced, unless a
 * committed payment records it.
 */
@Service
@Slf4j
public class EnrollmentTransactionCoordinator {

    static final String CREDIT_CREATED_BY = "webportal";

    private final EnrollmentRequestValidator validator;
    private final AccountRepository accountRepository;
    private final PricingCalculator pricingCalculator;
    private final PromotionValidator promotionValidator;
    private final CreditLedger creditLedger;
    private final ReferralCreditIssuer referralCreditIssuer;
    private final EnrollmentRepository enrollmentRepository;
    private final PaymentGateway paymentGateway;
    private final PaymentTransactionService paymentTransactionService;
    private final ChargeIdempotencyService chargeIdempotencyService;
    private final ChargeCompensator chargeCompensator;
    private final OutboxService outboxService;
    private final EnrollmentMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    public EnrollmentTransactionCoordinator(EnrollmentRequestValidator validator,
                                            AccountRepository accountRepository,
                                            PricingCalculator pricingCalculator,
                                            PromotionValidator promotionValidator,
                                            CreditLedger creditLedger,
                                            ReferralCreditIssuer referralCreditIssuer,
                                            EnrollmentRepository enrollmentRepository,
                                            PaymentGateway paymentGateway,
                                            PaymentTransactionService paymentTransactionService,
                                            ChargeIdempotencyService chargeIdempotencyService,
                                            ChargeCompensator chargeCompensator,
                                            OutboxService outboxService,
                                            EnrollmentMetrics metrics,
                                            PlatformTransactionManager transactionManager,
                                            EnrollmentProperties properties) {
        this.validator = validator;
        this.accountRepository = accountRepository;
        this.pricingCalculator = pricingCalculator;
        this.promotionValidator = promotionValidator;
        this.creditLedger = creditLedger;
        this.referralCreditIssuer = referralCreditIssuer;
        this.enrollmentRepository = enrollmentRepository;
        this.paymentGateway = paymentGateway;
        this.paymentTransactionService = paymentTransactionService;
        this.chargeIdempotencyService = chargeIdempotencyService;
        this.chargeCompensator = chargeCompensator;
        this.outboxService = outboxService;
        this.metrics = metrics;

        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate.setTimeout(properties.getTransaction().getTimeoutSeconds());
    }

    /**
     * Enrolls a student in the requested classes and charges for them.
     *
     * @return the created enrollments, one per distinct requested class
     * @throws EnrollmentException describing why nothing was enrolled
     */
    public List<Enrollment> enrollClass(EnrollClassCommand command) {
        return enrollClass(command, new EnrollmentAttempt());
    }

    List<Enrollment> enrollClass(EnrollClassCommand command, EnrollmentAttempt attempt) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.putEnrollmentContext(command.getAccountId(), command.getStudentId());

        try {
            ValidatedEnrollment validated;
            try {
                validated = validator.validate(command);
            } catch (EnrollmentException e) {
                log.warn("Enrollment rejected: kind={}, message={}", e.getKind(), e.getMessage());
                metrics.recordEnrollmentCompleted("unknown", "rejected");
                throw e;
            }

            Outcome outcome;
            try {
                outcome = transactionTemplate.execute(status -> runUnitOfWork(command, validated, attempt));
            } catch (RuntimeException e) {
                throw rollBack(attempt, e);
            }

            attempt.transitionTo(EnrollmentState.EMITTING_EVENT);
            outcome.paymentTransactionIfAny().ifPresent(transaction ->
                chargeIdempotencyService.remember(validated.getChargeIdempotencyKey(), transaction.getId()));
            attempt.transitionTo(EnrollmentState.COMPLETED);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordEnrollmentCompleted(outcome.getQuote().getShape().name(), "success");
            metrics.recordEnrollmentLatency("enroll_class", duration);
            log.info("Enrolled student {} in {} classes, paid {} cents, duration={}ms",
                validated.getStudent().getId(), outcome.getEnrollments().size(), outcome.getPaidInCents(), duration);

            return outcome.getEnrollments();
        } finally {
            CorrelationContext.clearEnrollmentContext();
        }
    }

    private Outcome runUnitOfWork(EnrollClassCommand command, ValidatedEnrollment validated, EnrollmentAttempt attempt) {
        Account account = accountRepository.findByIdForUpdate(validated.getAccount().getId())
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> new UnauthenticatedException(EnrollmentRequestValidator.LOGIN_REQUIRED));
        Student student = validated.getStudent();
        requireUnpaid(validated.getChargeIdempotencyKey());

        attempt.transitionTo(EnrollmentState.PRICING);
        PriceQuote quote = pricingCalculator.quote(validated.getClasses(), command.isWholeSeries());
        CourseClass mainClass = quote.getMainClass();
        long price = quote.getTotalInCents();
        log.debug("Priced {} purchase at {} cents, main class {}", quote.getShape(), price, mainClass.getId());

        attempt.transitionTo(EnrollmentState.APPLYING_PROMOTION);
        Promotion promotion = null;
        if (price > 0 && command.getPromotionId() != null) {
            UUID promotionId = command.getPromotionId();
            promotion = promotionValidator.findQualified(promotionId, account, mainClass.getCourse())
                .orElseThrow(() -> new InvalidRequestException(
                    String.format("promotion %s is not valid", promotionId),
                    Map.of("promotionId", promotionId.toString())));
            promotionValidator.recordUse(promotion);
            long discounted = promotionValidator.applyDiscount(quote, price, promotion);
            log.info("Used coupon {}: {} -> {} cents", promotion.getCode(), price, discounted);
            price = discounted;
        }

        attempt.transitionTo(EnrollmentState.APPLYING_CREDIT);
        Credit credit = null;
        if (price > 0 && command.getCredit() > 0) {
            long balance = creditLedger.balanceOf(account.getId());
            CreditApplication application = creditLedger.apply(price, command.getCredit(), balance);
            if (application.getUsed() > 0) {
                credit = creditLedger.recordPurchase(account.getId(), application.getUsed(),
                    purchaseDetails(account, mainClass));
                log.info("Used {} cents of credit, {} cents left to pay", application.getUsed(), application.getResult());
            }
            price = application.getResult();
        }

        attempt.transitionTo(EnrollmentState.APPLYING_REFERRAL);
        ReferralOutcome referral = referralCreditIssuer.issue(account, mainClass, price);
        if (referral.isPaidTransitioned()) {
            log.debug("Account {} completed its first regular purchase", account.getId());
        }

        attempt.transitionTo(EnrollmentState.PERSISTING_ENROLLMENTS);
        UUID promotionId = promotion != null ? promotion.getId() : null;
        UUID creditId = credit != null ? credit.getId() : null;
        List<EnrollmentEntity> rows = validated.getClasses().stream()
            .map(courseClass -> EnrollmentEntity.create(
                student.getId(), courseClass.getId(), command.getAttribution(), promotionId, creditId))
            .toList();
        List<EnrollmentEntity> saved = enrollmentRepository.saveAllAndFlush(rows);
        List<Enrollment> enrollments = toDomain(saved, student, validated.getClasses());

        attempt.transitionTo(EnrollmentState.CHARGING);
        GatewayCharge charge = null;
        if (price > 0) {
            String chargeKey = GatewayKeys.chargeKey(validated.getChargeIdempotencyKey(), attempt.getId());
            charge = charge(price, command.getPaymentMethodNonce(), chargeKey);
            attempt.recordCharge(charge, chargeKey);
            log.info("Paid {} cents with gateway transaction {}", charge.getAmountInCents(), charge.getTransactionId());
        }

        attempt.transitionTo(EnrollmentState.PERSISTING_TRANSACTION);
        PaymentTransaction paymentTransaction = null;
        if (charge != null) {
            paymentTransaction = paymentTransactionService.record(charge, validated.getChargeIdempotencyKey(),
                enrollments.stream().map(Enrollment::getId).toList());
        }
        outboxService.saveEvent(EnrollmentCompletedEvent.AGGREGATE_TYPE, student.getId(),
            EnrollmentCompletedEvent.EVENT_TYPE, EnrollmentCompletedEvent.of(account.getId(), enrollments));

        attempt.transitionTo(EnrollmentState.COMMITTING);
        return new Outcome(enrollments, quote, paymentTransaction, price);
    }

    private void requireUnpaid(String enrollmentKey) {
        Optional<PaymentTransaction> paid = paymentTransactionService.findByIdempotencyKey(enrollmentKey);
        if (paid.isPresent()) {
            log.warn("Enrollment {} was paid by transaction {} while this request waited", enrollmentKey, paid.get().getId());
            throw new InvalidRequestException("enrollment already paid",
                Map.of("paymentTransactionId", paid.get().getId().toString()));
        }
    }

    private GatewayCharge charge(long priceInCents, String paymentToken, String idempotencyKey) {
        try {
            GatewayCharge charge = paymentGateway.charge(BigDecimal.valueOf(priceInCents, 2), paymentToken, idempotencyKey);
            metrics.recordCharge("captured");
            return charge;
        } catch (PaymentFailureException e) {
            metrics.recordCharge("failed");
            throw e;
        }
    }

    /**
     * Marks the attempt rolled back, reverses a captured charge and returns the exception to surface.
     */
    private RuntimeException rollBack(EnrollmentAttempt attempt, RuntimeException cause) {
        EnrollmentState failedAt = attempt.getState();
        attempt.transitionTo(EnrollmentState.ROLLED_BACK);
        RuntimeException surfaced = translate(cause);

        attempt.capturedChargeIfAny().ifPresent(charge -> {
            CompensationResult result = chargeCompensator.compensate(charge, attempt.getChargeKey());
            attempt.recordCompensation(result);
        });

        String reason = surfaced instanceof EnrollmentException
            ? ((EnrollmentException) surfaced).getKind().name()
            : "INTERNAL";
        metrics.recordRolledBack(reason);
        log.error("Enrollment rolled back at {}: {} ({})", failedAt, surfaced.getMessage(), reason);
        return surfaced;
    }

    static RuntimeException translate(RuntimeException e) {
        if (e instanceof EnrollmentException) {
            return e;
        }
        if (e instanceof ConcurrencyFailureException
            || e instanceof DataIntegrityViolationException
            || e instanceof TransactionSystemException
            || e instanceof TransactionTimedOutException
            || e instanceof QueryTimeoutException) {
            return new TransactionAbortException("enrollment transaction aborted, please retry", e);
        }
        return e;
    }

    private static CreditDetails purchaseDetails(Account account, CourseClass mainClass) {
        return CreditDetails.builder()
            .reason("Purchase " + mainClass.getCourse().getName())
            .createdBy(CREDIT_CREATED_BY)
            .attribution(CreditDetails.Attribution.builder()
                .userId(account.getId())
                .classId(mainClass.getId())
                .build())
            .build();
    }

    private static List<Enrollment> toDomain(List<EnrollmentEntity> saved, Student student, List<CourseClass> classes) {
        Map<UUID, CourseClass> byId = classes.stream()
            .collect(Collectors.toMap(CourseClass::getId, c -> c));
        return saved.stream()
            .map(entity -> entity.toDomain(student, byId.get(entity.getClassId())))
            .toList();
    }

    @Value
    private static class Outcome {
        List<Enrollment> enrollments;
        PriceQuote quote;
        PaymentTransaction paymentTransaction;
        long paidInCents;

        Optional<PaymentTransaction> paymentTransactionIfAny() {
            return Optional.ofNullable(paymentTransaction);
        }
    }
}
