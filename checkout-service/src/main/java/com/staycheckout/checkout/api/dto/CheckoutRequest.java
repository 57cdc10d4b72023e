package com.staycheckout.checkout.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.staycheckout.checkout.domain.model.PropertyReference;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;

/**
 * Checkout body. Missing email and dates are reported by the booking service so the
 * validation order stays email, dates, property.
 */
public record CheckoutRequest(
        @JsonProperty("property_slug")
        String propertySlug,

        @JsonProperty("property_id")
        Long propertyId,

        LocalDate checkin,

        LocalDate checkout,

        @Email(message = "email is invalid")
        String email,

        @Positive(message = "guests must be at least 1")
        Integer guests
) {
    public PropertyReference propertyReference() {
        return new PropertyReference(propertyId, propertySlug);
    }
}
