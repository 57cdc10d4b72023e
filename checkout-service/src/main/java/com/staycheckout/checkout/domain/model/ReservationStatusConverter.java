package com.staycheckout.checkout.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ReservationStatusConverter implements AttributeConverter<ReservationStatus, String> {

    @Override
    public String convertToDatabaseColumn(ReservationStatus status) {
        return status == null ? null : status.value();
    }

    @Override
    public ReservationStatus convertToEntityAttribute(String value) {
        return value == null ? null : ReservationStatus.fromValue(value);
    }
}
