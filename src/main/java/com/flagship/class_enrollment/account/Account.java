package com.flagship.class_enrollment.account;

import lombok.Value;

import java.util.UUID;

/**
 * A parent account. The credit balance is not part of this object: it is derived
 * from the credit ledger on demand.
 *
 * {@code paid} becomes true once, on the first purchase of a regular course.
 */
@Value
public class Account {
    UUID id;
    String firstName;
    String email;
    boolean paid;
    UUID refererId;

    public boolean hasReferer() {
        return refererId != null;
    }
}
