package com.flagship.class_enrollment.credit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.class_enrollment.exception.InvalidRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Account credit ledger.
 *
 * Core invariants:
 * 1. Credit rows are immutable once written
 * 2. Balances are derived from the rows, never stored
 * 3. A purchase never consumes more than the balance read at transaction start
 *
 * JDBC directly: the ledger is append-only and the balance is a single aggregate.
 */
@Service
@Slf4j
public class CreditLedger {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public CreditLedger(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Gets the credit balance of an account in cents.
     */
    public long balanceOf(UUID accountId) {
        Long balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(cents), 0) FROM credits WHERE account_id = ?",
            Long.class,
            accountId
        );
        return balance != null ? balance : 0L;
    }

    /**
     * Offsets a price with stored credit. Pure: nothing is written.
     *
     * @param priceInCents current price
     * @param requestedCents credit the caller asked to spend
     * @param balanceInCents the account's available balance
     * @return how much was used and what remains to pay
     * @throws InvalidRequestException if the request exceeds the balance
     */
    public CreditApplication apply(long priceInCents, long requestedCents, long balanceInCents) {
        if (requestedCents < 0) {
            throw new InvalidRequestException("credit must not be negative",
                Map.of("credit", String.valueOf(requestedCents)));
        }
        if (requestedCents > balanceInCents) {
            throw new InvalidRequestException("you do not have enough credit",
                Map.of("credit", String.valueOf(requestedCents), "balance", String.valueOf(balanceInCents)));
        }
        long used = Math.min(requestedCents, Math.max(0, priceInCents));
        return new CreditApplication(used, Math.max(0, priceInCents) - used);
    }

    /**
     * Records credit spent on a purchase as a negative row, in the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Credit recordPurchase(UUID accountId, long usedCents, CreditDetails details) {
        if (usedCents <= 0) {
            throw new IllegalArgumentException("Used credit must be positive");
        }
        return insert(accountId, -usedCents, CreditType.PURCHASE, details);
    }

    /**
     * Records a referral bonus for the referring account, in the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Credit recordReferral(UUID refererId, long bonusCents, CreditDetails details) {
        if (bonusCents <= 0) {
            throw new IllegalArgumentException("Referral bonus must be positive");
        }
        return insert(refererId, bonusCents, CreditType.REFERRAL, details);
    }

    /**
     * Gets all credit rows of an account, oldest first.
     */
    public List<Credit> getCredits(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT id, account_id, cents, type, details, created_at " +
            "FROM credits WHERE account_id = ? ORDER BY created_at, id",
            creditRowMapper(),
            accountId
        );
    }

    private Credit insert(UUID accountId, long cents, CreditType type, CreditDetails details) {
        UUID id = UUID.randomUUID();
        Instant createdAt = Instant.now();
        jdbcTemplate.update(
            "INSERT INTO credits (id, account_id, cents, type, details, created_at) VALUES (?, ?, ?, ?, ?::jsonb, ?)",
            id,
            accountId,
            cents,
            type.name(),
            serialize(details),
            Timestamp.from(createdAt)
        );
        log.debug("Recorded {} credit of {} cents for account {}", type, cents, accountId);
        return new Credit(id, accountId, cents, type, details, createdAt);
    }

    private RowMapper<Credit> creditRowMapper() {
        return (rs, rowNum) -> new Credit(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("account_id")),
            rs.getLong("cents"),
            CreditType.valueOf(rs.getString("type")),
            deserialize(rs.getString("details")),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private String serialize(CreditDetails details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize credit details", e);
        }
    }

    private CreditDetails deserialize(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, CreditDetails.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable credit details: " + json, e);
        }
    }
}
