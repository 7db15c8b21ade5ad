package com.flagship.class_enrollment.referral;

import com.flagship.class_enrollment.credit.Credit;
import lombok.Value;

import java.util.Optional;

/**
 * What the referral step changed: whether this purchase flipped the account to
 * paid, and the bonus credit granted to the referer if any.
 */
@Value
public class ReferralOutcome {

    private static final ReferralOutcome NONE = new ReferralOutcome(false, null);

    boolean paidTransitioned;
    Credit referralCredit;

    public static ReferralOutcome none() {
        return NONE;
    }

    public Optional<Credit> referralCreditIfIssued() {
        return Optional.ofNullable(referralCredit);
    }
}
