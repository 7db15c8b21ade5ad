package com.flagship.class_enrollment.promotion;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * JPA entity for promotions.
 *
 * {@code counts} is never written through the entity: usage goes through the
 * guarded increment in {@link PromotionRepository#incrementUsage(UUID)}.
 */
@Entity
@Table(name = "promotions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PromotionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PromotionType type;

    @Column(nullable = false)
    private long amount;

    @Column(nullable = false, insertable = false, updatable = false)
    private int counts;

    @Column(name = "max_counts")
    private Integer maxCounts;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "first_purchase_only", nullable = false)
    private boolean firstPurchaseOnly;

    @Column(name = "account_id")
    private UUID accountId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "promotion_courses", joinColumns = @JoinColumn(name = "promotion_id"))
    @Column(name = "course_id", nullable = false)
    private Set<UUID> courseIds = new HashSet<>();

    public Promotion toDomain() {
        return new Promotion(
            id,
            code,
            type,
            amount,
            counts,
            maxCounts,
            expiresAt,
            firstPurchaseOnly,
            accountId,
            Set.copyOf(courseIds)
        );
    }
}
