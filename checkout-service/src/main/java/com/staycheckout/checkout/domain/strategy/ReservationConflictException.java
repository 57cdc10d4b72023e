package com.staycheckout.checkout.domain.strategy;

import com.staycheckout.checkout.domain.model.StayPeriod;
import com.staycheckout.common.exception.BusinessException;
import com.staycheckout.common.result.ErrorKind;

/**
 * Thrown inside the booking transaction when the pre-check finds an overlapping reservation,
 * so the transaction rolls back before anything is inserted.
 */
public class ReservationConflictException extends BusinessException {

    public ReservationConflictException(Long propertyId, StayPeriod period) {
        super(String.format("Property %d is already booked for %s", propertyId, period), ErrorKind.CONFLICT);
    }
}
