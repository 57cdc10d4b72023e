package com.staycheckout.checkout.domain.strategy;

import com.staycheckout.checkout.domain.model.Property;
import com.staycheckout.checkout.domain.model.Reservation;
import com.staycheckout.checkout.domain.repository.ReservationRepository;
import com.staycheckout.checkout.domain.service.AvailabilityChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reservation strategy relying on the {@code excl_reservations_no_overlap} exclusion constraint.
 * <p>
 * The pre-check only rejects conflicts that are already committed. Two concurrent attempts can
 * both pass it; the second INSERT then waits on the first transaction and fails with an
 * exclusion violation once the first commits. That violation is the authoritative conflict.
 * <p>
 * Flow:
 * 1. Count overlapping pending/paid reservations (fast path)
 * 2. Insert and flush, so a constraint violation surfaces here
 * 3. Commit
 */
@Slf4j
@Component("constraint")
@RequiredArgsConstructor
public class ExclusionConstraintReservationStrategy implements ReservationStrategy {

    private final ReservationRepository reservationRepository;
    private final AvailabilityChecker availabilityChecker;

    @Override
    @Transactional
    public Reservation reserve(Property property, Reservation pending) {
        if (availabilityChecker.hasConflict(property.getId(), pending.stayPeriod())) {
            throw new ReservationConflictException(property.getId(), pending.stayPeriod());
        }
        Reservation saved = reservationRepository.saveAndFlush(pending);
        log.debug("Inserted pending reservation {} for property {}", saved.getId(), property.getId());
        return saved;
    }

    @Override
    public String getStrategyType() {
        return "EXCLUSION_CONSTRAINT";
    }
}
