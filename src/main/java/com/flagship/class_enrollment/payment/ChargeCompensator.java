package com.flagship.class_enrollment.payment;

import com.flagship.class_enrollment.observability.EnrollmentMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reverses a charge whose enrollment transaction did not commit.
 *
 * Called outside any transaction, after the rollback. A charge that a committed
 * payment already records is never refunded: a concurrent duplicate of a paid
 * request gets the first request's charge replayed by the gateway. If the refund
 * cannot be made now, the charge goes to the reconciliation ledger and
 * {@link ChargeReversalRetryJob} takes over.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChargeCompensator {

    private final PaymentGateway paymentGateway;
    private final PaymentTransactionService paymentTransactionService;
    private final ChargeReconciliationService reconciliationService;
    private final EnrollmentMetrics metrics;

    /**
     * @param charge the captured charge
     * @param chargeKey gateway key the charge was made with
     */
    public CompensationResult compensate(GatewayCharge charge, String chargeKey) {
        try {
            if (paymentTransactionService.isRecorded(charge.getTransactionId())) {
                log.warn("Charge {} belongs to a committed payment, not refunding it", charge.getTransactionId());
                metrics.recordCompensation("already_committed");
                return CompensationResult.ALREADY_COMMITTED;
            }

            GatewayRefund refund = paymentGateway.refund(charge.getTransactionId(), GatewayKeys.refundKey(chargeKey));
            log.warn("Refunded charge {} ({} cents) after enrollment rollback: refundId={}",
                charge.getTransactionId(), charge.getAmountInCents(), refund.getRefundId());
            metrics.recordCompensation("refunded");
            return CompensationResult.REFUNDED;
        } catch (RuntimeException e) {
            log.error("Could not refund charge {} after enrollment rollback", charge.getTransactionId(), e);
            reconciliationService.recordPending(charge, chargeKey, describe(e));
            metrics.recordCompensation("queued");
            return CompensationResult.QUEUED;
        }
    }

    static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
