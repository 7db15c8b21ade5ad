package com.flagship.class_enrollment.payment;

import com.flagship.class_enrollment.config.EnrollmentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Ledger of stranded charges.
 *
 * Every write runs in its own transaction: rows are written after the enrollment
 * transaction has already rolled back, and must survive regardless.
 */
@Service
@Slf4j
public class ChargeReconciliationService {

    private final ChargeReconciliationRepository repository;
    private final int maxAttempts;

    public ChargeReconciliationService(ChargeReconciliationRepository repository,
                                       EnrollmentProperties properties) {
        this.repository = repository;
        this.maxAttempts = properties.getReconciliation().getMaxAttempts();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UUID recordPending(GatewayCharge charge, String idempotencyKey, String error) {
        ChargeReconciliationEntity saved = repository.save(
            ChargeReconciliationEntity.pending(charge, idempotencyKey, error));
        log.error("Charge {} ({} cents) is captured but its enrollment did not commit; queued for reversal: {}",
            charge.getTransactionId(), charge.getAmountInCents(), error);
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public List<ChargeReconciliationEntity> findPending() {
        return repository.findByStatusOrderByCreatedAtAsc(ReconciliationStatus.PENDING);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markReversed(UUID reconciliationId) {
        repository.findById(reconciliationId).ifPresent(entity -> {
            entity.markReversed();
            repository.save(entity);
            log.info("Reversed stranded charge {}", entity.getGatewayTransactionId());
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markCommitted(UUID reconciliationId) {
        repository.findById(reconciliationId).ifPresent(entity -> {
            entity.markCommitted();
            repository.save(entity);
            log.warn("Charge {} is recorded by a committed payment, closing its reversal without a refund",
                entity.getGatewayTransactionId());
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markAttemptFailed(UUID reconciliationId, String error) {
        repository.findById(reconciliationId).ifPresent(entity -> {
            entity.markAttemptFailed(error, maxAttempts);
            repository.save(entity);
            if (entity.getStatus() == ReconciliationStatus.ABANDONED) {
                log.error("Giving up reversing charge {} after {} attempts, manual refund required: {}",
                    entity.getGatewayTransactionId(), entity.getAttempts(), error);
            } else {
                log.warn("Reversal of charge {} failed (attempt #{}): {}",
                    entity.getGatewayTransactionId(), entity.getAttempts(), error);
            }
        });
    }

    @Transactional(readOnly = true)
    public long countPending() {
        return repository.countByStatus(ReconciliationStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public long countAbandoned() {
        return repository.countByStatus(ReconciliationStatus.ABANDONED);
    }
}
