package com.flagship.class_enrollment.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for charges captured by the gateway whose enrollment never committed
 * and whose immediate reversal failed.
 */
@Entity
@Table(
    name = "charge_reconciliations",
    indexes = {
        @Index(name = "idx_charge_reconciliations_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ChargeReconciliationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "gateway_transaction_id", nullable = false, updatable = false)
    private String gatewayTransactionId;

    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;

    @Column(name = "amount_in_cents", nullable = false, updatable = false)
    private long amountInCents;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReconciliationStatus status;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static ChargeReconciliationEntity pending(GatewayCharge charge, String idempotencyKey, String error) {
        ChargeReconciliationEntity entity = new ChargeReconciliationEntity();
        entity.id = UUID.randomUUID();
        entity.gatewayTransactionId = charge.getTransactionId();
        entity.idempotencyKey = idempotencyKey;
        entity.amountInCents = charge.getAmountInCents();
        entity.status = ReconciliationStatus.PENDING;
        entity.attempts = 1;
        entity.lastError = error;
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    void markReversed() {
        requirePending();
        this.status = ReconciliationStatus.REVERSED;
        this.lastError = null;
    }

    void markCommitted() {
        requirePending();
        this.status = ReconciliationStatus.COMMITTED;
        this.lastError = null;
    }

    /**
     * Counts a failed reversal; abandons the row once {@code maxAttempts} is reached.
     */
    void markAttemptFailed(String error, int maxAttempts) {
        requirePending();
        this.attempts++;
        this.lastError = error;
        if (this.attempts >= maxAttempts) {
            this.status = ReconciliationStatus.ABANDONED;
        }
    }

    private void requirePending() {
        if (status != ReconciliationStatus.PENDING) {
            throw new IllegalStateException(
                "Reconciliation " + id + " is " + status + ", only PENDING rows can change");
        }
    }
}
