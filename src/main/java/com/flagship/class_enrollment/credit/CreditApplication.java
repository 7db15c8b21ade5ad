package com.flagship.class_enrollment.credit;

import lombok.Value;

/**
 * Outcome of offsetting a price with stored credit.
 * {@code used} never exceeds the price, so {@code result} is never negative.
 */
@Value
public class CreditApplication {
    long used;
    long result;
}
