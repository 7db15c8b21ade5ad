package com.flagship.class_enrollment.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransactionEntity, UUID> {

    Optional<PaymentTransactionEntity> findByIdempotencyKey(String idempotencyKey);

    boolean existsByGatewayTransactionId(String gatewayTransactionId);
}
