package com.staycheckout.checkout.client.dto;

import java.time.Instant;
import java.util.Map;

/**
 * Request for a hosted payment session.
 *
 * @param amountCents    Amount in minor units
 * @param currency       Lower-case ISO currency code, as the gateway expects it
 * @param metadata       Echoed back by the gateway on confirmation; carries the reservation id
 * @param idempotencyKey Same key for retries of the same reservation (e.g. "reservation-42")
 * @param expiresAt      When the hosted page stops accepting payment; null keeps the gateway default
 */
public record PaymentSessionRequest(
        long amountCents,
        String currency,
        String productName,
        String description,
        String successUrl,
        String cancelUrl,
        String customerEmail,
        Map<String, String> metadata,
        String idempotencyKey,
        Instant expiresAt
) {
}
