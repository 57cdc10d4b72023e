package com.staycheckout.checkout.domain.service;

import com.staycheckout.checkout.domain.model.StayPeriod;

import java.math.BigDecimal;

/**
 * Price of a stay. All amounts are integer minor units (cents).
 */
public record Quote(
        StayPeriod period,
        long nights,
        long nightlyRateCents,
        long totalCents,
        String currency
) {

    /**
     * Total in major units with two decimals and the currency code, e.g. {@code "300.00 EUR"}.
     */
    public String totalFormatted() {
        return formatAmount(totalCents, currency);
    }

    public static String formatAmount(long amountCents, String currency) {
        return BigDecimal.valueOf(amountCents, 2).toPlainString() + " " + currency;
    }
}
