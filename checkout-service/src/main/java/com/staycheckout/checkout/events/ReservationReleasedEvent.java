package com.staycheckout.checkout.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Published when a pending reservation frees its dates again, either through compensation
 * after a failed payment session or through the orphan recovery job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReservationReleasedEvent {
    private Long reservationId;
    private Long propertyId;
    private LocalDate checkin;
    private LocalDate checkout;
    private String reason;
    private Instant timestamp;
}
