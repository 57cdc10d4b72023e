package com.staycheckout.checkout.api.dto;

import com.staycheckout.checkout.domain.model.Property;

public record PropertySummary(
        Long id,
        String slug,
        String name
) {
    public static PropertySummary from(Property property) {
        return new PropertySummary(property.getId(), property.getSlug(), property.getName());
    }
}
