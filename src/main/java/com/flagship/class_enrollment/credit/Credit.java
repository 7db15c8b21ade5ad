package com.flagship.class_enrollment.credit;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for a credit ledger row.
 * Rows are immutable: balances change only by inserting new rows.
 */
@Value
public class Credit {
    UUID id;
    UUID accountId;
    long cents;
    CreditType type;
    CreditDetails details;
    Instant createdAt;
}
