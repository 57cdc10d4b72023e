package com.staycheckout.checkout.domain.strategy;

import com.staycheckout.checkout.domain.model.Property;
import com.staycheckout.checkout.domain.model.Reservation;

/**
 * Strategy for the conflict-check-and-insert step of a booking, each with a different way of
 * closing the check-then-insert race.
 * <p>
 * Implementations (bean names):
 * - constraint: pre-check, then rely on the database exclusion constraint
 * - pessimistic: lock the property row (SELECT FOR UPDATE) before the pre-check
 * <p>
 * Either way the method runs in its own transaction and the reservation is committed when it
 * returns.
 */
public interface ReservationStrategy {

    /**
     * Inserts {@code pending} for {@code property} if its dates are free.
     *
     * @return the persisted reservation with its generated id
     * @throws ReservationConflictException when an overlapping pending/paid reservation exists
     * @throws org.springframework.dao.DataIntegrityViolationException when the exclusion constraint
     *         rejects the insert
     */
    Reservation reserve(Property property, Reservation pending);

    /**
     * Returns the strategy type name for identification.
     */
    String getStrategyType();
}
