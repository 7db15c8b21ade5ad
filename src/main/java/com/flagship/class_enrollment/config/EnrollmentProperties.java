package com.flagship.class_enrollment.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Enrollment configuration: pricing rules, referral bonus, transaction bounds and
 * reconciliation of charges that could not be committed.
 */
@ConfigurationProperties(prefix = "enrollment")
@Data
public class EnrollmentProperties {

    private Pricing pricing = new Pricing();
    private Referral referral = new Referral();
    private Transaction transaction = new Transaction();
    private Reconciliation reconciliation = new Reconciliation();

    /** ISO currency the gateway charges in. */
    private String currency = "usd";

    @Data
    public static class Pricing {
        /** Discount on each add-on class of a multi-class bundle, in percent. */
        private int bundleDiscountPercent = 10;

        /** Discount on the summed price of a whole-series purchase, in percent. */
        private int wholeSeriesDiscountPercent = 20;
    }

    @Data
    public static class Referral {
        /** Credit granted to the referring account on a referred first purchase. */
        private long purchaseBonusCents = 2000;
    }

    @Data
    public static class Transaction {
        /** Upper bound on one enrollment unit of work, gateway round trip included. */
        private int timeoutSeconds = 30;
    }

    @Data
    public static class Reconciliation {
        /** Reversal attempts before a stranded charge is left for manual follow-up. */
        private int maxAttempts = 5;

        /** Delay between reversal sweeps, in milliseconds. */
        private long pollIntervalMs = 60000;
    }
}
