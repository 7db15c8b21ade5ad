package com.flagship.class_enrollment.promotion;

import com.flagship.class_enrollment.account.Account;
import com.flagship.class_enrollment.catalog.Course;
import com.flagship.class_enrollment.exception.InvalidRequestException;
import com.flagship.class_enrollment.pricing.PriceQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether a promotion can be used for a purchase, records its use and
 * applies its discount.
 *
 * Eligibility is checked against the snapshot read here; the cap is enforced
 * again by the atomic increment in {@link #recordUse(Promotion)}, which is what
 * actually protects a limited promotion under concurrency.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromotionValidator {

    private final PromotionRepository promotionRepository;

    /**
     * Returns the promotion if it exists and the account and main course qualify.
     *
     * @param promotionId promotion supplied by the caller
     * @param account purchasing account
     * @param mainCourse course of the main class
     * @return the promotion, or empty if it is missing, expired, exhausted or not eligible
     */
    @Transactional(readOnly = true)
    public Optional<Promotion> findQualified(UUID promotionId, Account account, Course mainCourse) {
        Optional<Promotion> found = promotionRepository.findById(promotionId).map(PromotionEntity::toDomain);
        if (found.isEmpty()) {
            log.debug("Promotion {} does not exist", promotionId);
            return Optional.empty();
        }

        Promotion promotion = found.get();
        String rejection = rejectionReason(promotion, account, mainCourse, Instant.now());
        if (rejection != null) {
            log.debug("Promotion {} rejected for account {}: {}", promotion.getCode(), account.getId(), rejection);
            return Optional.empty();
        }
        return found;
    }

    /**
     * Consumes one use of the promotion inside the caller's transaction.
     * Rolling that transaction back gives the use back.
     *
     * @throws InvalidRequestException if a concurrent use exhausted the promotion
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordUse(Promotion promotion) {
        int updated = promotionRepository.incrementUsage(promotion.getId());
        if (updated == 0) {
            throw new InvalidRequestException(
                String.format("promotion %s is not valid", promotion.getId()),
                Map.of("promotionId", promotion.getId().toString(), "reason", "exhausted"));
        }
    }

    /**
     * Applies the promotion to the current price.
     *
     * Amount-off promotions subtract their cents once whatever the purchase shape.
     * Percent-off promotions discount the current price, except for bundles where
     * only the main class portion is discounted: add-ons already carry the bundle
     * discount.
     *
     * @return the discounted price, never below zero
     */
    public long applyDiscount(PriceQuote quote, long priceInCents, Promotion promotion) {
        long discount = switch (promotion.getType()) {
            case AMOUNT_OFF -> promotion.getAmount();
            case PERCENT_OFF -> {
                long base = quote.isBundle()
                    ? Math.min(priceInCents, quote.getMainClassInCents())
                    : priceInCents;
                yield base * Math.min(100, promotion.getAmount()) / 100;
            }
        };
        return Math.max(0, priceInCents - discount);
    }

    static String rejectionReason(Promotion promotion, Account account, Course mainCourse, Instant now) {
        if (promotion.isExpired(now)) {
            return "expired";
        }
        if (promotion.isExhausted()) {
            return "exhausted";
        }
        if (promotion.getAccountId() != null && !promotion.getAccountId().equals(account.getId())) {
            return "restricted to another account";
        }
        if (promotion.isFirstPurchaseOnly() && account.isPaid()) {
            return "first purchase only";
        }
        if (!promotion.getCourseIds().isEmpty() && !promotion.getCourseIds().contains(mainCourse.getId())) {
            return "not valid for course " + mainCourse.getName();
        }
        return null;
    }
}
