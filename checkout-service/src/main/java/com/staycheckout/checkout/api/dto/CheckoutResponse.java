package com.staycheckout.checkout.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.staycheckout.checkout.saga.BookingConfirmation;

@JsonPropertyOrder({"ok", "reservation_id", "checkout_url", "amount_cents", "currency"})
public record CheckoutResponse(
        boolean ok,
        @JsonProperty("reservation_id") Long reservationId,
        @JsonProperty("checkout_url") String checkoutUrl,
        @JsonProperty("amount_cents") long amountCents,
        String currency
) {
    public static CheckoutResponse from(BookingConfirmation confirmation) {
        return new CheckoutResponse(
                true,
                confirmation.reservationId(),
                confirmation.paymentUrl(),
                confirmation.amountCents(),
                confirmation.currency()
        );
    }
}
