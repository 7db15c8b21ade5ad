package com.flagship.class_enrollment.pricing;

import com.flagship.class_enrollment.catalog.CourseClass;
import com.flagship.class_enrollment.config.EnrollmentProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Computes the charge for a selection of classes.
 *
 * The class with the lowest course level is the main selection and the rest are
 * add-ons. Pricing is a pure function of the classes, their order and the series
 * flag: no clock, no store, no randomness, so a retried request prices the same.
 *
 * <ul>
 *   <li>SINGLE: the course price.</li>
 *   <li>BUNDLE: main class at full price, each add-on less the bundle discount.</li>
 *   <li>WHOLE_SERIES: sum of all classes less the series discount.</li>
 * </ul>
 *
 * Trial courses are free in every shape.
 */
@Component
public class PricingCalculator {

    private final EnrollmentProperties.Pricing pricing;

    public PricingCalculator(EnrollmentProperties properties) {
        this.pricing = properties.getPricing();
    }

    /**
     * Prices the given classes.
     *
     * @param classes resolved classes, each with its course; must not be empty
     * @param wholeSeries whether the caller is buying the whole series
     * @return the quote, never negative
     */
    public PriceQuote quote(List<CourseClass> classes, boolean wholeSeries) {
        if (classes == null || classes.isEmpty()) {
            throw new IllegalArgumentException("At least one class is required for pricing");
        }

        CourseClass mainClass = findMainClass(classes);
        long mainPrice = priceOf(mainClass);

        PurchaseShape shape = wholeSeries
            ? PurchaseShape.WHOLE_SERIES
            : classes.size() > 1 ? PurchaseShape.BUNDLE : PurchaseShape.SINGLE;

        long total = switch (shape) {
            case SINGLE -> mainPrice;
            case BUNDLE -> mainPrice + addOnTotal(classes, mainClass);
            case WHOLE_SERIES -> {
                long sum = classes.stream().mapToLong(PricingCalculator::priceOf).sum();
                yield sum - percentOf(sum, pricing.getWholeSeriesDiscountPercent());
            }
        };

        return new PriceQuote(mainClass, shape, Math.max(0, total), mainPrice);
    }

    /**
     * Lowest course level wins; on a tie the earliest class in the selection does.
     */
    public static CourseClass findMainClass(List<CourseClass> classes) {
        CourseClass main = classes.get(0);
        for (CourseClass klass : classes) {
            if (klass.getCourse().getLevel() < main.getCourse().getLevel()) {
                main = klass;
            }
        }
        return main;
    }

    private long addOnTotal(List<CourseClass> classes, CourseClass mainClass) {
        long total = 0;
        boolean mainSkipped = false;
        for (CourseClass klass : classes) {
            if (!mainSkipped && klass == mainClass) {
                mainSkipped = true;
                continue;
            }
            long price = priceOf(klass);
            total += price - percentOf(price, pricing.getBundleDiscountPercent());
        }
        return total;
    }

    private static long priceOf(CourseClass klass) {
        return klass.getCourse().isTrial() ? 0 : Math.max(0, klass.getCourse().getPriceInCents());
    }

    static long percentOf(long cents, int percent) {
        return cents * percent / 100;
    }
}
