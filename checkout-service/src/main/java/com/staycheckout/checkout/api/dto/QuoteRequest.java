package com.staycheckout.checkout.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.staycheckout.checkout.domain.model.PropertyReference;

import java.time.LocalDate;

public record QuoteRequest(
        @JsonProperty("property_slug")
        String propertySlug,

        @JsonProperty("property_id")
        Long propertyId,

        LocalDate checkin,

        LocalDate checkout
) {
    public PropertyReference propertyReference() {
        return new PropertyReference(propertyId, propertySlug);
    }
}
