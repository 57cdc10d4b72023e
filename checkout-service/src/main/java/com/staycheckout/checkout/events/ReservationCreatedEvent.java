package com.staycheckout.checkout.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Published once a pending reservation has a payment session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReservationCreatedEvent {
    private Long reservationId;
    private Long propertyId;
    private String propertySlug;
    private LocalDate checkin;
    private LocalDate checkout;
    private Integer guests;
    private String email;
    private long amountCents;
    private String currency;
    private String paymentSessionId;
    private Instant timestamp;
}
