package com.staycheckout.checkout.api.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.staycheckout.checkout.domain.service.BookingService;

import java.util.List;

@JsonPropertyOrder({"ok", "property", "range", "occupied"})
public record AvailabilityResponse(
        boolean ok,
        PropertySummary property,
        DateRange range,
        List<OccupiedRange> occupied
) {
    public static AvailabilityResponse from(BookingService.Availability availability) {
        return new AvailabilityResponse(
                true,
                PropertySummary.from(availability.property()),
                new DateRange(availability.from(), availability.to()),
                availability.occupied().stream().map(OccupiedRange::from).toList()
        );
    }
}
