package com.flagship.class_enrollment.promotion;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface PromotionRepository extends JpaRepository<PromotionEntity, UUID> {

    /**
     * Atomically consumes one use of a promotion.
     *
     * The cap is re-checked in the same statement, so concurrent enrollments
     * serialize on the row and the counter can never pass {@code max_counts}.
     *
     * @return 1 if a use was recorded, 0 if the promotion is exhausted
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
        UPDATE promotions
        SET counts = counts + 1
        WHERE id = :id AND (max_counts IS NULL OR counts < max_counts)
        """, nativeQuery = true)
    int incrementUsage(@Param("id") UUID id);
}
