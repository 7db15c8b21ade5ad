package com.flagship.class_enrollment.promotion;

import com.flagship.class_enrollment.account.Account;
import com.flagship.class_enrollment.catalog.Course;
import com.flagship.class_enrollment.catalog.CourseClass;
import com.flagship.class_enrollment.exception.InvalidRequestException;
import com.flagship.class_enrollment.pricing.PriceQuote;
import com.flagship.class_enrollment.pricing.PurchaseShape;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.flagship.class_enrollment.TestFixtures.amountOff;
import static com.flagship.class_enrollment.TestFixtures.classOf;
import static com.flagship.class_enrollment.TestFixtures.paidAccount;
import static com.flagship.class_enrollment.TestFixtures.percentOff;
import static com.flagship.class_enrollment.TestFixtures.regularCourse;
import static com.flagship.class_enrollment.TestFixtures.unpaidAccount;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PromotionValidatorTest {

    private PromotionRepository promotionRepository;
    private PromotionValidator validator;

    private Account account;
    private Course course;
    private final Instant now = Instant.now();

    @BeforeEach
    void setUp() {
        promotionRepository = mock(PromotionRepository.class);
        validator = new PromotionValidator(promotionRepository);
        account = unpaidAccount();
        course = regularCourse("Math 1", 1, 10000);
    }

    private Promotion promotion(int counts, Integer maxCounts, Instant expiresAt, boolean firstPurchaseOnly,
                                UUID accountId, Set<UUID> courseIds) {
        return new Promotion(UUID.randomUUID(), "SPRING", PromotionType.PERCENT_OFF, 10,
            counts, maxCounts, expiresAt, firstPurchaseOnly, accountId, courseIds);
    }

    @Test
    @DisplayName("Unknown promotion does not qualify")
    void unknownPromotion() {
        UUID id = UUID.randomUUID();
        when(promotionRepository.findById(id)).thenReturn(Optional.empty());

        assertTrue(validator.findQualified(id, account, course).isEmpty());
    }

    @Test
    @DisplayName("Eligible promotion is returned")
    void eligiblePromotion() {
        Promotion promotion = promotion(0, 10, now.plus(1, ChronoUnit.DAYS), false, null, Set.of(course.getId()));
        PromotionEntity entity = mock(PromotionEntity.class);
        when(entity.toDomain()).thenReturn(promotion);
        when(promotionRepository.findById(promotion.getId())).thenReturn(Optional.of(entity));

        assertEquals(Optional.of(promotion), validator.findQualified(promotion.getId(), account, course));
    }

    @Test
    @DisplayName("Expired, exhausted, foreign and course-restricted promotions are rejected")
    void ineligiblePromotions() {
        assertEquals("expired", PromotionValidator.rejectionReason(
            promotion(0, null, now, false, null, Set.of()), account, course, now));
        assertEquals("exhausted", PromotionValidator.rejectionReason(
            promotion(5, 5, null, false, null, Set.of()), account, course, now));
        assertEquals("restricted to another account", PromotionValidator.rejectionReason(
            promotion(0, null, null, false, UUID.randomUUID(), Set.of()), account, course, now));
        assertNotNull(PromotionValidator.rejectionReason(
            promotion(0, null, null, false, null, Set.of(UUID.randomUUID())), account, course, now));
    }

    @Test
    @DisplayName("First-purchase promotions are only for accounts that never paid")
    void firstPurchaseOnly() {
        Promotion promotion = promotion(0, null, null, true, null, Set.of());

        assertNull(PromotionValidator.rejectionReason(promotion, account, course, now));
        assertEquals("first purchase only",
            PromotionValidator.rejectionReason(promotion, paidAccount(), course, now));
    }

    @Test
    @DisplayName("Recording a use fails when a concurrent use took the last slot")
    void recordUseOnExhaustedPromotion() {
        Promotion promotion = promotion(0, 1, null, false, null, Set.of());
        when(promotionRepository.incrementUsage(promotion.getId())).thenReturn(0);

        InvalidRequestException e = assertThrows(InvalidRequestException.class, () -> validator.recordUse(promotion));
        assertEquals("promotion " + promotion.getId() + " is not valid", e.getMessage());
    }

    @Test
    @DisplayName("Recording a use succeeds when the guarded increment updates the row")
    void recordUse() {
        Promotion promotion = promotion(0, 1, null, false, null, Set.of());
        when(promotionRepository.incrementUsage(promotion.getId())).thenReturn(1);

        assertDoesNotThrow(() -> validator.recordUse(promotion));
    }

    @Test
    @DisplayName("Amount-off subtracts once and never goes below zero")
    void amountOffDiscount() {
        CourseClass klass = classOf(course);
        PriceQuote single = new PriceQuote(klass, PurchaseShape.SINGLE, 10000, 10000);

        assertEquals(7500, validator.applyDiscount(single, 10000, amountOff(2500)));
        assertEquals(0, validator.applyDiscount(single, 10000, amountOff(20000)));
    }

    @Test
    @DisplayName("Percent-off discounts the whole price of a single class or a series")
    void percentOffSingleAndSeries() {
        CourseClass klass = classOf(course);

        assertEquals(8000, validator.applyDiscount(
            new PriceQuote(klass, PurchaseShape.SINGLE, 10000, 10000), 10000, percentOff(20)));
        assertEquals(16000, validator.applyDiscount(
            new PriceQuote(klass, PurchaseShape.WHOLE_SERIES, 20000, 10000), 20000, percentOff(20)));
    }

    @Test
    @DisplayName("Percent-off on a bundle discounts only the main class portion")
    void percentOffBundle() {
        PriceQuote bundle = new PriceQuote(classOf(course), PurchaseShape.BUNDLE, 17000, 8000);

        assertEquals(17000 - 4000, validator.applyDiscount(bundle, 17000, percentOff(50)));
    }
}
