package com.flagship.class_enrollment.payment;

import com.flagship.class_enrollment.config.EnrollmentProperties;
import com.flagship.class_enrollment.exception.ErrorKind;
import com.flagship.class_enrollment.exception.PaymentFailureException;
import com.stripe.StripeClient;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.CardException;
import com.stripe.exception.StripeException;
import com.stripe.model.Charge;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Refund;
import com.stripe.model.StripeCollection;
import com.stripe.net.RequestOptions;
import com.stripe.param.PaymentIntentCreateParams;
import com.stripe.param.RefundCreateParams;
import com.stripe.param.RefundListParams;
import com.stripe.service.PaymentIntentService;
import com.stripe.service.RefundService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StripePaymentGatewayTest {

    private StripePaymentGateway gateway;
    private PaymentIntentService paymentIntents;
    private RefundService refunds;

    @BeforeEach
    void setUp() {
        gateway = new StripePaymentGateway(new EnrollmentProperties());
        StripeClient stripeClient = mock(StripeClient.class);
        paymentIntents = mock(PaymentIntentService.class);
        refunds = mock(RefundService.class);
        when(stripeClient.paymentIntents()).thenReturn(paymentIntents);
        when(stripeClient.refunds()).thenReturn(refunds);
        ReflectionTestUtils.setField(gateway, "stripeClient", stripeClient);
    }

    private static PaymentIntent intent(String status, Charge latestCharge) {
        PaymentIntent intent = new PaymentIntent();
        intent.setId("pi_123");
        intent.setStatus(status);
        intent.setAmount(7000L);
        intent.setCurrency("usd");
        intent.setLatestChargeObject(latestCharge);
        return intent;
    }

    private static Charge charge(boolean refunded, long amountRefunded) {
        Charge charge = new Charge();
        charge.setId("ch_123");
        charge.setRefunded(refunded);
        charge.setAmountRefunded(amountRefunded);
        return charge;
    }

    private static Refund refund(String id, String status) {
        Refund refund = new Refund();
        refund.setId(id);
        refund.setStatus(status);
        return refund;
    }

    @Test
    @DisplayName("Captured intent becomes a charge, made with the given idempotency key")
    void capturesCharge() throws StripeException {
        when(paymentIntents.create(any(PaymentIntentCreateParams.class), any(RequestOptions.class)))
            .thenReturn(intent("succeeded", charge(false, 0)));

        GatewayCharge captured = gateway.charge(new BigDecimal("70.00"), "pm_card_visa", "key1-attempt");

        assertEquals("pi_123", captured.getTransactionId());
        assertEquals(7000, captured.getAmountInCents());
        ArgumentCaptor<PaymentIntentCreateParams> params = ArgumentCaptor.forClass(PaymentIntentCreateParams.class);
        ArgumentCaptor<RequestOptions> options = ArgumentCaptor.forClass(RequestOptions.class);
        verify(paymentIntents).create(params.capture(), options.capture());
        assertEquals(7000L, params.getValue().getAmount());
        assertEquals("pm_card_visa", params.getValue().getPaymentMethod());
        assertTrue(params.getValue().getExpand().contains("latest_charge"));
        assertEquals("key1-attempt", options.getValue().getIdempotencyKey());
    }

    @Test
    @DisplayName("Intent that did not succeed is a payment failure carrying its status")
    void notSucceeded() throws StripeException {
        when(paymentIntents.create(any(PaymentIntentCreateParams.class), any(RequestOptions.class)))
            .thenReturn(intent("requires_action", null));

        PaymentFailureException e = assertThrows(PaymentFailureException.class,
            () -> gateway.charge(new BigDecimal("70.00"), "pm_card_visa", "key1"));

        assertEquals("Payment was not completed", e.getMessage());
        assertEquals("requires_action", e.getDetails().get("status"));
    }

    @Test
    @DisplayName("Replayed intent whose charge was refunded is not accepted as payment")
    void refundedReplay() throws StripeException {
        when(paymentIntents.create(any(PaymentIntentCreateParams.class), any(RequestOptions.class)))
            .thenReturn(intent("succeeded", charge(true, 7000)));

        PaymentFailureException e = assertThrows(PaymentFailureException.class,
            () -> gateway.charge(new BigDecimal("70.00"), "pm_card_visa", "key1"));

        assertEquals("refunded", e.getDetails().get("status"));
    }

    @Test
    @DisplayName("Partly refunded charge counts as refunded")
    void partlyRefunded() {
        assertTrue(StripePaymentGateway.isRefunded(charge(false, 100)));
        assertFalse(StripePaymentGateway.isRefunded(charge(false, 0)));
        assertFalse(StripePaymentGateway.isRefunded(null));
    }

    @Test
    @DisplayName("Card decline keeps the gateway message and code")
    void cardDeclined() throws StripeException {
        CardException declined = mock(CardException.class);
        when(declined.getMessage()).thenReturn("Your card has insufficient funds.");
        when(declined.getCode()).thenReturn("card_declined");
        when(declined.getDeclineCode()).thenReturn("insufficient_funds");
        when(paymentIntents.create(any(PaymentIntentCreateParams.class), any(RequestOptions.class)))
            .thenThrow(declined);

        PaymentFailureException e = assertThrows(PaymentFailureException.class,
            () -> gateway.charge(new BigDecimal("70.00"), "pm_card_visa", "key1"));

        assertEquals(ErrorKind.PAYMENT_FAILURE, e.getKind());
        assertEquals("Your card has insufficient funds.", e.getMessage());
        assertEquals("card_declined", e.getDetails().get("code"));
        assertSame(declined, e.getCause());
    }

    @Test
    @DisplayName("Card decline without a message gets a generic one")
    void cardDeclinedWithoutMessage() throws StripeException {
        CardException declined = mock(CardException.class);
        when(paymentIntents.create(any(PaymentIntentCreateParams.class), any(RequestOptions.class)))
            .thenThrow(declined);

        PaymentFailureException e = assertThrows(PaymentFailureException.class,
            () -> gateway.charge(new BigDecimal("70.00"), "pm_card_visa", "key1"));

        assertEquals("Your card was declined", e.getMessage());
        assertEquals("null", e.getDetails().get("code"));
    }

    @Test
    @DisplayName("Other gateway errors become a generic payment failure")
    void gatewayError() throws StripeException {
        ApiConnectionException unreachable = mock(ApiConnectionException.class);
        when(unreachable.getMessage()).thenReturn("Connection reset");
        when(paymentIntents.create(any(PaymentIntentCreateParams.class), any(RequestOptions.class)))
            .thenThrow(unreachable);

        PaymentFailureException e = assertThrows(PaymentFailureException.class,
            () -> gateway.charge(new BigDecimal("70.00"), "pm_card_visa", "key1"));

        assertEquals("Payment gateway error", e.getMessage());
        assertSame(unreachable, e.getCause());
    }

    @Test
    @DisplayName("Refund is made against the payment intent with the given key")
    void refunds() throws StripeException {
        when(refunds.create(any(RefundCreateParams.class), any(RequestOptions.class)))
            .thenReturn(refund("re_1", "succeeded"));

        GatewayRefund refund = gateway.refund("pi_123", "refund-key1");

        assertEquals("re_1", refund.getRefundId());
        assertEquals("pi_123", refund.getTransactionId());
        ArgumentCaptor<RefundCreateParams> params = ArgumentCaptor.forClass(RefundCreateParams.class);
        ArgumentCaptor<RequestOptions> options = ArgumentCaptor.forClass(RequestOptions.class);
        verify(refunds).create(params.capture(), options.capture());
        assertEquals("pi_123", params.getValue().getPaymentIntent());
        assertEquals("refund-key1", options.getValue().getIdempotencyKey());
    }

    @Test
    @DisplayName("Refund error is a payment failure naming the charge")
    void refundFails() throws StripeException {
        ApiConnectionException unreachable = mock(ApiConnectionException.class);
        when(refunds.create(any(RefundCreateParams.class), any(RequestOptions.class))).thenThrow(unreachable);

        PaymentFailureException e = assertThrows(PaymentFailureException.class,
            () -> gateway.refund("pi_123", "refund-key1"));

        assertEquals("Refund failed for pi_123", e.getMessage());
        assertSame(unreachable, e.getCause());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Existing refund is found, failed and canceled ones are ignored")
    void findsExistingRefund() throws StripeException {
        StripeCollection<Refund> listed = mock(StripeCollection.class);
        when(listed.getData()).thenReturn(List.of(refund("re_0", "failed"), refund("re_1", "pending")));
        when(refunds.list(any(RefundListParams.class))).thenReturn(listed);

        Optional<GatewayRefund> found = gateway.findRefund("pi_123");

        assertEquals("re_1", found.orElseThrow().getRefundId());
        ArgumentCaptor<RefundListParams> params = ArgumentCaptor.forClass(RefundListParams.class);
        verify(refunds).list(params.capture());
        assertEquals("pi_123", params.getValue().getPaymentIntent());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("No live refund means none is found")
    void noExistingRefund() throws StripeException {
        StripeCollection<Refund> listed = mock(StripeCollection.class);
        when(listed.getData()).thenReturn(List.of(refund("re_0", "canceled")));
        when(refunds.list(any(RefundListParams.class))).thenReturn(listed);

        assertTrue(gateway.findRefund("pi_123").isEmpty());
    }

    @Test
    @DisplayName("Refund lookup error is a payment failure")
    void findRefundFails() throws StripeException {
        when(refunds.list(any(RefundListParams.class))).thenThrow(mock(ApiConnectionException.class));

        PaymentFailureException e = assertThrows(PaymentFailureException.class, () -> gateway.findRefund("pi_123"));

        assertEquals("Refund lookup failed for pi_123", e.getMessage());
    }

    @Test
    @DisplayName("Decimal amounts convert to exact cents")
    void toCents() {
        assertEquals(7000, StripePaymentGateway.toCents(new BigDecimal("70.00")));
        assertEquals(7000, StripePaymentGateway.toCents(BigDecimal.valueOf(7000, 2)));
        assertEquals(1, StripePaymentGateway.toCents(new BigDecimal("0.01")));
    }

    @Test
    @DisplayName("Fractions of a cent are refused")
    void fractionalCents() {
        assertThrows(ArithmeticException.class, () -> StripePaymentGateway.toCents(new BigDecimal("0.005")));
    }

    @Test
    @DisplayName("Paid charge without a payment method fails before calling Stripe")
    void missingPaymentMethod() {
        PaymentFailureException e = assertThrows(PaymentFailureException.class,
            () -> gateway.charge(new BigDecimal("70.00"), " ", "key1"));

        assertEquals(ErrorKind.PAYMENT_FAILURE, e.getKind());
    }

    @Test
    @DisplayName("Non-positive amounts are a programming error")
    void nonPositiveAmount() {
        assertThrows(IllegalArgumentException.class,
            () -> gateway.charge(BigDecimal.ZERO, "pm_card_visa", "key1"));
    }
}
