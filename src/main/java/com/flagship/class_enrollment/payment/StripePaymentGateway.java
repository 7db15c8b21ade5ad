package com.flagship.class_enrollment.payment;

import com.flagship.class_enrollment.config.EnrollmentProperties;
import com.flagship.class_enrollment.exception.PaymentFailureException;
import com.stripe.StripeClient;
import com.stripe.exception.CardException;
import com.stripe.exception.StripeException;
import com.stripe.model.Charge;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Refund;
import com.stripe.net.RequestOptions;
import com.stripe.param.PaymentIntentCreateParams;
import com.stripe.param.RefundCreateParams;
import com.stripe.param.RefundListParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link PaymentGateway} backed by Stripe PaymentIntents.
 *
 * The charge is created and confirmed in one call with the client's payment
 * method token; Stripe's idempotency key makes a replayed call return the first
 * result instead of charging again. A replayed intent whose charge has since been
 * refunded is not a payment and is rejected.
 */
@Service
@Slf4j
public class StripePaymentGateway implements PaymentGateway {

    private static final String SUCCEEDED = "succeeded";
    private static final Set<String> LIVE_REFUND_STATUSES = Set.of("succeeded", "pending", "requires_action");

    private final String currency;

    @Autowired(required = false)
    private StripeClient stripeClient;

    public StripePaymentGateway(EnrollmentProperties properties) {
        this.currency = properties.getCurrency();
    }

    @Override
    public GatewayCharge charge(BigDecimal amount, String paymentToken, String idempotencyKey) {
        if (!StringUtils.hasText(paymentToken)) {
            throw new PaymentFailureException("A payment method is required for a paid enrollment");
        }
        long amountInCents = toCents(amount);
        if (amountInCents <= 0) {
            throw new IllegalArgumentException("Charge amount must be positive: " + amount);
        }

        PaymentIntentCreateParams params = PaymentIntentCreateParams.builder()
                .setAmount(amountInCents)
                .setCurrency(currency)
                .setPaymentMethod(paymentToken)
                .setConfirm(true)
                .setAutomaticPaymentMethods(
                        PaymentIntentCreateParams.AutomaticPaymentMethods.builder()
                                .setEnabled(true)
                                .setAllowRedirects(
                                        PaymentIntentCreateParams.AutomaticPaymentMethods.AllowRedirects.NEVER)
                                .build())
                .putMetadata("chargeKey", idempotencyKey)
                .addExpand("latest_charge")
                .build();
        RequestOptions options = RequestOptions.builder().setIdempotencyKey(idempotencyKey).build();

        try {
            PaymentIntent intent = (stripeClient != null)
                    ? stripeClient.paymentIntents().create(params, options)
                    : PaymentIntent.create(params, options);

            if (!SUCCEEDED.equals(intent.getStatus())) {
                log.warn("Stripe payment intent not captured: id={}, status={}", intent.getId(), intent.getStatus());
                throw new PaymentFailureException(
                        "Payment was not completed",
                        Map.of("status", String.valueOf(intent.getStatus())),
                        null);
            }

            if (isRefunded(intent.getLatestChargeObject())) {
                log.warn("Stripe payment intent {} was replayed but its charge is refunded", intent.getId());
                throw new PaymentFailureException(
                        "Payment was already refunded, please retry",
                        Map.of("status", "refunded"),
                        null);
            }

            log.info("Captured Stripe payment intent id={} amountInCents={}", intent.getId(), intent.getAmount());
            return new GatewayCharge(intent.getId(), intent.getAmount(), intent.getStatus(), detailsOf(intent));
        } catch (CardException e) {
            log.warn("Card declined: code={}, declineCode={}", e.getCode(), e.getDeclineCode());
            throw new PaymentFailureException(
                    e.getMessage() != null ? e.getMessage() : "Your card was declined",
                    Map.of("code", String.valueOf(e.getCode())),
                    e);
        } catch (StripeException e) {
            log.error("Stripe charge failed for key={}: {}", idempotencyKey, e.getMessage());
            throw new PaymentFailureException("Payment gateway error", e);
        }
    }

    @Override
    public GatewayRefund refund(String transactionId, String idempotencyKey) {
        RefundCreateParams params = RefundCreateParams.builder()
                .setPaymentIntent(transactionId)
                .build();
        RequestOptions options = RequestOptions.builder().setIdempotencyKey(idempotencyKey).build();

        try {
            Refund refund = (stripeClient != null)
                    ? stripeClient.refunds().create(params, options)
                    : Refund.create(params, options);
            log.info("Refunded Stripe payment intent id={} refundId={} status={}",
                    transactionId, refund.getId(), refund.getStatus());
            return new GatewayRefund(refund.getId(), transactionId, refund.getStatus());
        } catch (StripeException e) {
            log.error("Stripe refund failed for payment intent {}: {}", transactionId, e.getMessage());
            throw new PaymentFailureException("Refund failed for " + transactionId, e);
        }
    }

    @Override
    public Optional<GatewayRefund> findRefund(String transactionId) {
        RefundListParams params = RefundListParams.builder()
                .setPaymentIntent(transactionId)
                .build();

        try {
            List<Refund> refunds = (stripeClient != null)
                    ? stripeClient.refunds().list(params).getData()
                    : Refund.list(params).getData();
            return refunds.stream()
                    .filter(refund -> LIVE_REFUND_STATUSES.contains(refund.getStatus()))
                    .findFirst()
                    .map(refund -> new GatewayRefund(refund.getId(), transactionId, refund.getStatus()));
        } catch (StripeException e) {
            log.error("Stripe refund lookup failed for payment intent {}: {}", transactionId, e.getMessage());
            throw new PaymentFailureException("Refund lookup failed for " + transactionId, e);
        }
    }

    static boolean isRefunded(Charge charge) {
        if (charge == null) {
            return false;
        }
        return Boolean.TRUE.equals(charge.getRefunded())
                || (charge.getAmountRefunded() != null && charge.getAmountRefunded() > 0);
    }

    static long toCents(BigDecimal amount) {
        return amount.movePointRight(2).longValueExact();
    }

    private Map<String, Object> detailsOf(PaymentIntent intent) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("id", intent.getId());
        details.put("status", intent.getStatus());
        details.put("amount", intent.getAmount());
        details.put("currency", intent.getCurrency());
        details.put("latestCharge", intent.getLatestCharge());
        details.put("paymentMethod", intent.getPaymentMethod());
        details.put("created", intent.getCreated());
        return details;
    }
}
