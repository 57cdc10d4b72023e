package com.staycheckout.checkout.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.staycheckout.checkout.domain.service.BookingService;
import com.staycheckout.checkout.domain.service.Quote;

import java.time.LocalDate;

@JsonPropertyOrder({"ok", "property", "checkin", "checkout", "nights", "currency",
        "price_per_night_cents", "total_cents", "total_formatted"})
public record QuoteResponse(
        boolean ok,
        PropertySummary property,
        LocalDate checkin,
        LocalDate checkout,
        long nights,
        String currency,
        @JsonProperty("price_per_night_cents") long pricePerNightCents,
        @JsonProperty("total_cents") long totalCents,
        @JsonProperty("total_formatted") String totalFormatted
) {
    public static QuoteResponse from(BookingService.PricedStay pricedStay) {
        Quote quote = pricedStay.quote();
        return new QuoteResponse(
                true,
                PropertySummary.from(pricedStay.property()),
                quote.period().checkin(),
                quote.period().checkout(),
                quote.nights(),
                quote.currency(),
                quote.nightlyRateCents(),
                quote.totalCents(),
                quote.totalFormatted()
        );
    }
}
