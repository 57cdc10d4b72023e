package com.staycheckout.checkout.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Subset of Stripe's Checkout Session object this service reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StripeCheckoutSession(
        String id,
        String url,
        String status
) {
}
