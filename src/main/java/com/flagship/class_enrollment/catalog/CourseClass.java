package com.flagship.class_enrollment.catalog;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A scheduled instance of a {@link Course}.
 */
@Value
public class CourseClass {
    UUID id;
    Course course;
    Instant startDate;
    Instant endDate;
}
