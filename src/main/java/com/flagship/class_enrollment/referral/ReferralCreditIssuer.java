package com.flagship.class_enrollment.referral;

import com.flagship.class_enrollment.account.Account;
import com.flagship.class_enrollment.account.AccountRepository;
import com.flagship.class_enrollment.catalog.Course;
import com.flagship.class_enrollment.catalog.CourseClass;
import com.flagship.class_enrollment.config.EnrollmentProperties;
import com.flagship.class_enrollment.credit.Credit;
import com.flagship.class_enrollment.credit.CreditDetails;
import com.flagship.class_enrollment.credit.CreditLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Flips an account to paid on its first regular-course purchase and grants the
 * referring account a one-time bonus.
 *
 * The bonus is tied to the paid transition, not to the number of purchases:
 * only the call that wins the compare-and-set on {@code accounts.paid} may issue
 * it, so replays and concurrent purchases grant it at most once.
 */
@Service
@Slf4j
public class ReferralCreditIssuer {

    static final String CREATED_BY = "firstPurchase";

    private final AccountRepository accountRepository;
    private final CreditLedger creditLedger;
    private final long purchaseBonusCents;

    public ReferralCreditIssuer(AccountRepository accountRepository,
                                CreditLedger creditLedger,
                                EnrollmentProperties properties) {
        this.accountRepository = accountRepository;
        this.creditLedger = creditLedger;
        this.purchaseBonusCents = properties.getReferral().getPurchaseBonusCents();
    }

    /**
     * Runs the referral step inside the caller's transaction.
     *
     * @param account purchasing account as read at transaction start
     * @param mainClass main class of the purchase
     * @param priceInCents price left after promotion and credit
     * @return the transition that happened, never null
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ReferralOutcome issue(Account account, CourseClass mainClass, long priceInCents) {
        Course course = mainClass.getCourse();
        if (!course.isRegular() || account.isPaid()) {
            return ReferralOutcome.none();
        }

        boolean transitioned = accountRepository.markPaid(account.getId()) == 1;
        if (!transitioned) {
            log.debug("Account {} was already marked paid by another purchase", account.getId());
            return ReferralOutcome.none();
        }

        if (priceInCents <= 0 || !account.hasReferer()) {
            return new ReferralOutcome(true, null);
        }

        CreditDetails details = CreditDetails.builder()
            .reason(String.format("%s has purchased %s", account.getFirstName(), course.getName()))
            .createdBy(CREATED_BY)
            .attribution(CreditDetails.Attribution.builder()
                .userId(account.getId())
                .classId(mainClass.getId())
                .build())
            .build();

        Credit credit = creditLedger.recordReferral(account.getRefererId(), purchaseBonusCents, details);
        log.info("Granted referral credit: refererId={}, cents={}", account.getRefererId(), purchaseBonusCents);
        return new ReferralOutcome(true, credit);
    }
}
