package com.flagship.class_enrollment.payment;

import com.flagship.class_enrollment.observability.EnrollmentMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Retries the reversal of stranded charges.
 *
 * Before refunding, the gateway is asked for an existing refund of the charge, so
 * a refund that went through before a timeout is not issued twice. Each retry uses
 * its own idempotency key; the gateway would otherwise replay the stored error of
 * the first attempt for a day.
 */
@Component
@ConditionalOnProperty(name = "enrollment.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ChargeReversalRetryJob {

    private final ChargeReconciliationService reconciliationService;
    private final PaymentTransactionService paymentTransactionService;
    private final PaymentGateway paymentGateway;
    private final EnrollmentMetrics metrics;

    @Scheduled(fixedDelayString = "${enrollment.reconciliation.poll-interval-ms:60000}")
    public void retryPendingReversals() {
        try {
            List<ChargeReconciliationEntity> pending = reconciliationService.findPending();
            if (pending.isEmpty()) {
                return;
            }

            log.info("Retrying reversal of {} stranded charges", pending.size());
            for (ChargeReconciliationEntity reconciliation : pending) {
                retry(reconciliation);
            }
        } catch (Exception e) {
            log.error("Error in charge reversal loop", e);
        }
    }

    private void retry(ChargeReconciliationEntity reconciliation) {
        String transactionId = reconciliation.getGatewayTransactionId();
        try {
            if (paymentTransactionService.isRecorded(transactionId)) {
                reconciliationService.markCommitted(reconciliation.getId());
                metrics.recordCompensation("already_committed");
                return;
            }

            Optional<GatewayRefund> existing = paymentGateway.findRefund(transactionId);
            if (existing.isPresent()) {
                log.info("Charge {} already has refund {}", transactionId, existing.get().getRefundId());
            } else {
                paymentGateway.refund(transactionId,
                    GatewayKeys.retryRefundKey(reconciliation.getIdempotencyKey(), reconciliation.getAttempts()));
            }
            reconciliationService.markReversed(reconciliation.getId());
            metrics.recordCompensation("refunded");
        } catch (RuntimeException e) {
            reconciliationService.markAttemptFailed(reconciliation.getId(), ChargeCompensator.describe(e));
            metrics.recordCompensation("retry_failed");
        }
    }
}
