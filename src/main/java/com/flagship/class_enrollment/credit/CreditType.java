package com.flagship.class_enrollment.credit;

/**
 * Why a credit row exists.
 */
public enum CreditType {
    /** Credit spent on a purchase; always negative. */
    PURCHASE,

    /** Bonus granted to a referring account; always positive. */
    REFERRAL
}
