package com.staycheckout.checkout.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Reservation lifecycle. Stored and serialized in lower case ({@code pending}, {@code paid},
 * {@code cancelled}) because the payment confirmation flow outside this service writes those values.
 * <p>
 * This service creates {@link #PENDING} reservations and cancels orphaned ones; {@link #PAID} is
 * set by payment confirmation and only respected here.
 */
public enum ReservationStatus {
    PENDING("pending"),
    PAID("paid"),
    CANCELLED("cancelled");

    /** Statuses that occupy the calendar. */
    public static final List<ReservationStatus> BLOCKING = List.of(PENDING, PAID);

    private final String value;

    ReservationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static ReservationStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown reservation status: " + value));
    }
}
