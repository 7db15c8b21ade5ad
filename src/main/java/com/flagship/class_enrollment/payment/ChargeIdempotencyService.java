package com.flagship.class_enrollment.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Remembers which enrollment keys already have a committed charge.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the unique idempotency_key of payment_transactions
 * 3. Cache database hits in Redis for future lookups
 *
 * The database is the source of truth; Redis is only a cache.
 */
@Service
@Slf4j
public class ChargeIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "enrollment-charge:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PaymentTransactionRepository transactionRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public ChargeIdempotencyService(PaymentTransactionRepository transactionRepository,
                                    Optional<StringRedisTemplate> redisTemplate) {
        this.transactionRepository = transactionRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Looks up a committed payment transaction for an enrollment key.
     *
     * @param idempotencyKey the enrollment's charge key
     * @return the payment transaction id if the key was already charged and committed
     */
    public Optional<UUID> findCommittedCharge(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String transactionId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (transactionId != null) {
                    log.debug("Charge key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(transactionId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for charge key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> committed = transactionRepository.findByIdempotencyKey(idempotencyKey)
                .map(PaymentTransactionEntity::getId);
        committed.ifPresent(id -> {
            log.debug("Charge key found in database: {}", idempotencyKey);
            cache(idempotencyKey, id);
        });
        return committed;
    }

    /**
     * Remembers a committed charge. Call only after the transaction has committed:
     * Redis does not roll back with the database.
     */
    public void remember(String idempotencyKey, UUID paymentTransactionId) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (paymentTransactionId == null) {
            throw new IllegalArgumentException("Payment transaction ID cannot be null");
        }
        cache(idempotencyKey, paymentTransactionId);
    }

    private void cache(String idempotencyKey, UUID paymentTransactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue()
                    .set(REDIS_KEY_PREFIX + idempotencyKey, paymentTransactionId.toString(), REDIS_TTL);
            log.debug("Stored charge key in Redis: {} -> {}", idempotencyKey, paymentTransactionId);
        } catch (Exception e) {
            log.warn("Failed to store charge key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }
}
