package com.flagship.class_enrollment.promotion;

import lombok.Value;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * A promotion code with its eligibility rules.
 *
 * {@code maxCounts} null means unlimited uses; {@code accountId} null means any
 * account; an empty {@code courseIds} means any course.
 */
@Value
public class Promotion {
    UUID id;
    String code;
    PromotionType type;
    long amount;
    int counts;
    Integer maxCounts;
    Instant expiresAt;
    boolean firstPurchaseOnly;
    UUID accountId;
    Set<UUID> courseIds;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean isExhausted() {
        return maxCounts != null && counts >= maxCounts;
    }
}
