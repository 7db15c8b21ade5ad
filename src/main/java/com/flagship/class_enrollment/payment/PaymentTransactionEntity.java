package com.flagship.class_enrollment.payment;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA Entity for payment transactions.
 *
 * Key design principles:
 * - Insert-only: no setters, no update method
 * - Controlled factory: {@link #record} is the only way to create instances
 * - Unique idempotency key: a second transaction for the same enrollment key
 *   fails at the database, whatever the application thinks
 */
@Entity
@Table(
    name = "payment_transactions",
    indexes = {
        @Index(name = "idx_payment_transactions_gateway_id", columnList = "gateway_transaction_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "amount_in_cents", nullable = false, updatable = false)
    private long amountInCents;

    @Column(name = "gateway_transaction_id", nullable = false, updatable = false)
    private String gatewayTransactionId;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "details", nullable = false, columnDefinition = "jsonb", updatable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String details;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "payment_transaction_enrollments",
        joinColumns = @JoinColumn(name = "payment_transaction_id"))
    @Column(name = "enrollment_id", nullable = false, updatable = false)
    private List<UUID> enrollmentIds = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static PaymentTransactionEntity record(GatewayCharge charge, String idempotencyKey,
                                           String detailsJson, List<UUID> enrollmentIds) {
        return new PaymentTransactionEntity(
            UUID.randomUUID(),
            charge.getAmountInCents(),
            charge.getTransactionId(),
            idempotencyKey,
            detailsJson,
            new ArrayList<>(enrollmentIds),
            null // createdAt - set by @PrePersist
        );
    }

    public PaymentTransaction toDomain() {
        return new PaymentTransaction(
            id,
            amountInCents,
            gatewayTransactionId,
            idempotencyKey,
            details,
            List.copyOf(enrollmentIds),
            createdAt
        );
    }
}
