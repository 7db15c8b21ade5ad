package com.flagship.class_enrollment.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ChargeReconciliationRepository extends JpaRepository<ChargeReconciliationEntity, UUID> {

    List<ChargeReconciliationEntity> findByStatusOrderByCreatedAtAsc(ReconciliationStatus status);

    long countByStatus(ReconciliationStatus status);
}
