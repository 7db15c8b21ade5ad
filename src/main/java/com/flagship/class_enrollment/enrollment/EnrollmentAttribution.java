package com.flagship.class_enrollment.enrollment;

import lombok.Value;

/**
 * Marketing attribution stored with every enrollment. Missing values are stored
 * as empty strings.
 */
@Value
public class EnrollmentAttribution {

    private static final EnrollmentAttribution NONE = new EnrollmentAttribution("", "");

    String source;
    String campaign;

    public static EnrollmentAttribution of(String source, String campaign) {
        return new EnrollmentAttribution(source == null ? "" : source.trim(), campaign == null ? "" : campaign.trim());
    }

    public static EnrollmentAttribution none() {
        return NONE;
    }
}
