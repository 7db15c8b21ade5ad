package com.flagship.class_enrollment.promotion;

public enum PromotionType {
    /** {@code amount} is a percentage, 1 to 100. */
    PERCENT_OFF,

    /** {@code amount} is a fixed number of cents. */
    AMOUNT_OFF
}
