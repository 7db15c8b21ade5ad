package com.flagship.class_enrollment.pricing;

/**
 * How a selection of classes is priced.
 */
public enum PurchaseShape {
    /** One class, no series flag. */
    SINGLE,

    /** Several classes without the series flag: add-ons get the bundle discount. */
    BUNDLE,

    /** The whole class sequence of a series, priced with the series discount. */
    WHOLE_SERIES
}
