package com.flagship.class_enrollment.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * JPA entity for courses. Read-only from this service's point of view.
 */
@Entity
@Table(name = "courses")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CourseEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private int level;

    @Column(name = "is_trial", nullable = false)
    private boolean trial;

    @Column(name = "is_regular", nullable = false)
    private boolean regular;

    @Column(name = "price_in_cents", nullable = false)
    private long priceInCents;

    public Course toDomain() {
        return new Course(id, name, level, trial, regular, priceInCents);
    }
}
