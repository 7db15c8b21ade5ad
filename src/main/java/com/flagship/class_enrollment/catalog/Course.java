package com.flagship.class_enrollment.catalog;

import lombok.Value;

import java.util.UUID;

/**
 * A course offering. Classes of the same subject track are ordered by {@code level};
 * the price is the nominal price of one class of this course.
 */
@Value
public class Course {
    UUID id;
    String name;
    int level;
    boolean trial;
    boolean regular;
    long priceInCents;
}
