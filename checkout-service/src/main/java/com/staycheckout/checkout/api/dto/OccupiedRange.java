package com.staycheckout.checkout.api.dto;

import com.staycheckout.checkout.domain.model.Reservation;
import com.staycheckout.checkout.domain.model.ReservationStatus;

import java.time.LocalDate;

public record OccupiedRange(
        Long id,
        LocalDate checkin,
        LocalDate checkout,
        ReservationStatus status
) {
    public static OccupiedRange from(Reservation reservation) {
        return new OccupiedRange(
                reservation.getId(),
                reservation.getCheckin(),
                reservation.getCheckout(),
                reservation.getStatus()
        );
    }
}
