package com.staycheckout.checkout.domain.service;

import com.staycheckout.checkout.domain.model.StayPeriod;
import com.staycheckout.common.result.Result;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Computes nights and total price for a stay. Pure integer arithmetic on minor units.
 */
@Component
public class PricingEngine {

    static final String DATES_MISSING = "checkin/checkout missing";
    static final String INVALID_RANGE = "checkout must be after checkin";
    static final String AMOUNT_TOO_LARGE = "stay total exceeds the supported amount";

    /**
     * Checks both dates are present and checkout is strictly after checkin.
     */
    public Result<StayPeriod> validateRange(LocalDate checkin, LocalDate checkout) {
        if (checkin == null || checkout == null) {
            return Result.invalidInput(DATES_MISSING);
        }
        StayPeriod period = new StayPeriod(checkin, checkout);
        if (!period.isValid()) {
            return Result.invalidInput(INVALID_RANGE);
        }
        return Result.success(period);
    }

    public Result<Quote> quote(LocalDate checkin, LocalDate checkout, long nightlyRateCents, String currency) {
        return validateRange(checkin, checkout)
                .flatMap(period -> price(period, nightlyRateCents, currency));
    }

    public Result<Quote> price(StayPeriod period, long nightlyRateCents, String currency) {
        if (!period.isValid()) {
            return Result.invalidInput(INVALID_RANGE);
        }
        long nights = period.nights();
        try {
            long total = Math.multiplyExact(nights, nightlyRateCents);
            return Result.success(new Quote(period, nights, nightlyRateCents, total, currency));
        } catch (ArithmeticException e) {
            return Result.invalidInput(AMOUNT_TOO_LARGE);
        }
    }
}
