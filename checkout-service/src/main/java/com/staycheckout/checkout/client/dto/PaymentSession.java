package com.staycheckout.checkout.client.dto;

/**
 * Created payment session: gateway id and the URL the guest completes payment at.
 */
public record PaymentSession(
        String id,
        String url
) {
}
