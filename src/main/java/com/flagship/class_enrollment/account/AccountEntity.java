package com.flagship.class_enrollment.account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * JPA entity for parent accounts.
 *
 * No setters: the only mutation this service performs is the paid flag, and that
 * goes through {@link AccountRepository#markPaid(UUID)} as a conditional update.
 */
@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "first_name", nullable = false)
    private String firstName;

    @Column(nullable = false)
    private String email;

    @Column(nullable = false)
    private boolean paid;

    @Column(name = "referer_id")
    private UUID refererId;

    public Account toDomain() {
        return new Account(id, firstName, email, paid, refererId);
    }
}
