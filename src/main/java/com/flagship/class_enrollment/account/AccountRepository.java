package com.flagship.class_enrollment.account;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    /**
     * Find account with pessimistic write lock.
     *
     * Serializes concurrent enrollments of the same account so that credit
     * consumption is checked against a balance nobody else is spending.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AccountEntity a WHERE a.id = :id")
    Optional<AccountEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Compare-and-set of the paid flag.
     *
     * @return 1 if this call flipped the flag, 0 if it was already set
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AccountEntity a SET a.paid = true WHERE a.id = :id AND a.paid = false")
    int markPaid(@Param("id") UUID id);
}
