package com.flagship.class_enrollment.payment;

import com.stripe.Stripe;
import com.stripe.StripeClient;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Stripe client configuration.
 * Initializes the global API key and exposes a typed client for the gateway adapter.
 */
@Configuration
@RequiredArgsConstructor
public class StripeClientConfig {

    private final StripeProperties stripe;

    @PostConstruct
    void init() {
        if (StringUtils.hasText(stripe.getSecretKey())) {
            Stripe.apiKey = stripe.getSecretKey();
        }
    }

    /**
     * Provide a reusable StripeClient only when the secret key is configured.
     */
    @Bean
    @ConditionalOnProperty(name = "stripe.secret-key")
    public StripeClient stripeClient() {
        return new StripeClient(stripe.getSecretKey());
    }
}
