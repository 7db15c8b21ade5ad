package com.flagship.class_enrollment.pricing;

import com.flagship.class_enrollment.catalog.CourseClass;
import lombok.Value;

/**
 * Result of pricing a class selection, before promotions and credit.
 *
 * {@code mainClassInCents} is the part of the total owed for the main class; for
 * a bundle it is the only undiscounted portion.
 */
@Value
public class PriceQuote {
    CourseClass mainClass;
    PurchaseShape shape;
    long totalInCents;
    long mainClassInCents;

    public boolean isBundle() {
        return shape == PurchaseShape.BUNDLE;
    }

    public boolean isWholeSeries() {
        return shape == PurchaseShape.WHOLE_SERIES;
    }
}
