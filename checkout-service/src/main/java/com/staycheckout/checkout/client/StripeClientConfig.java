package com.staycheckout.checkout.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.RequestInterceptor;
import feign.codec.ErrorDecoder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;

/**
 * Per-client Feign configuration for {@link StripeClient}. Deliberately not a
 * {@code @Configuration}, so these beans stay in the Stripe client's own context.
 */
public class StripeClientConfig {

    @Bean
    public RequestInterceptor stripeAuthInterceptor(
            @Value("${checkout.payment.stripe.secret-key:}") String secretKey) {
        return template -> template.header("Authorization", "Bearer " + secretKey);
    }

    @Bean
    public ErrorDecoder stripeErrorDecoder(ObjectMapper objectMapper) {
        return new StripeErrorDecoder(objectMapper);
    }
}
