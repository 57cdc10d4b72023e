package com.staycheckout.checkout.saga;

/**
 * Result of a successful checkout: the pending reservation and where to pay for it.
 */
public record BookingConfirmation(
        Long reservationId,
        String paymentUrl,
        long amountCents,
        String currency
) {
}
