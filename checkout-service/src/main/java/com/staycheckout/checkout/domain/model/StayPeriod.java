package com.staycheckout.checkout.domain.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Half-open calendar range [checkin, checkout). The checkout day is free for the next guest.
 */
public record StayPeriod(LocalDate checkin, LocalDate checkout) {

    public StayPeriod {
        Objects.requireNonNull(checkin, "checkin");
        Objects.requireNonNull(checkout, "checkout");
    }

    /**
     * True when checkout is strictly after checkin, i.e. the stay covers at least one night.
     */
    public boolean isValid() {
        return checkout.isAfter(checkin);
    }

    /**
     * Number of nights. Dates carry no time component, so the day count is already whole.
     */
    public long nights() {
        return ChronoUnit.DAYS.between(checkin, checkout);
    }

    @Override
    public String toString() {
        return checkin + " → " + checkout;
    }
}
