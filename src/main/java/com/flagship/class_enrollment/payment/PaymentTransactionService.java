package com.flagship.class_enrollment.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists the record of a captured charge and links it to the enrollments it paid for.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentTransactionService {

    private final PaymentTransactionRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves the transaction inside the caller's unit of work.
     *
     * @param charge charge returned by the gateway
     * @param idempotencyKey the enrollment key of the purchase
     * @param enrollmentIds enrollments paid by this charge
     * @return the persisted transaction
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public PaymentTransaction record(GatewayCharge charge, String idempotencyKey, List<UUID> enrollmentIds) {
        PaymentTransactionEntity entity = PaymentTransactionEntity.record(
            charge, idempotencyKey, serializeDetails(charge), enrollmentIds);
        PaymentTransactionEntity saved = repository.saveAndFlush(entity);
        log.debug("Saved payment transaction {} for gateway transaction {}",
            saved.getId(), charge.getTransactionId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<PaymentTransaction> findByIdempotencyKey(String idempotencyKey) {
        return repository.findByIdempotencyKey(idempotencyKey).map(PaymentTransactionEntity::toDomain);
    }

    /**
     * True if a committed payment already records this gateway transaction.
     * Such a charge must never be reversed on behalf of another request.
     */
    @Transactional(readOnly = true)
    public boolean isRecorded(String gatewayTransactionId) {
        return repository.existsByGatewayTransactionId(gatewayTransactionId);
    }

    private String serializeDetails(GatewayCharge charge) {
        try {
            return objectMapper.writeValueAsString(charge.getDetails());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize gateway details", e);
        }
    }
}
