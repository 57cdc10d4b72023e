package com.staycheckout.checkout.client;

import com.staycheckout.checkout.client.dto.StripeCheckoutSession;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

import java.util.Map;

/**
 * Feign client for the Stripe REST API.
 * Stripe takes form-encoded bodies with bracketed keys (e.g. {@code line_items[0][quantity]}).
 * Timeouts are configured under {@code spring.cloud.openfeign.client.config.stripe}.
 */
@FeignClient(
        name = "stripe",
        url = "${checkout.payment.stripe.api-url:https://api.stripe.com}",
        configuration = StripeClientConfig.class)
public interface StripeClient {

    @PostMapping(value = "/v1/checkout/sessions", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    StripeCheckoutSession createCheckoutSession(@RequestHeader("Idempotency-Key") String idempotencyKey,
                                                @RequestBody Map<String, ?> form);
}
