package com.staycheckout.checkout.domain.strategy;

import com.staycheckout.checkout.domain.model.Property;
import com.staycheckout.checkout.domain.model.Reservation;
import com.staycheckout.checkout.domain.repository.PropertyRepository;
import com.staycheckout.checkout.domain.repository.ReservationRepository;
import com.staycheckout.checkout.domain.service.AvailabilityChecker;
import com.staycheckout.common.exception.BusinessException;
import com.staycheckout.common.result.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reservation strategy using a pessimistic lock on the property row (SELECT FOR UPDATE).
 * <p>
 * Booking attempts for the same property queue on the lock, so the conflict check of the second
 * attempt sees the first one's committed insert. Attempts for different properties do not block
 * each other. The exclusion constraint still backs this up.
 * <p>
 * Flow:
 * 1. Acquire the property row lock
 * 2. Check for overlapping pending/paid reservations
 * 3. Insert and flush
 * 4. Commit (releases lock)
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockReservationStrategy implements ReservationStrategy {

    private final PropertyRepository propertyRepository;
    private final ReservationRepository reservationRepository;
    private final AvailabilityChecker availabilityChecker;

    @Override
    @Transactional
    public Reservation reserve(Property property, Reservation pending) {
        propertyRepository.findByIdWithLock(property.getId())
                .orElseThrow(() -> new BusinessException("property not found", ErrorKind.NOT_FOUND));

        if (availabilityChecker.hasConflict(property.getId(), pending.stayPeriod())) {
            throw new ReservationConflictException(property.getId(), pending.stayPeriod());
        }
        Reservation saved = reservationRepository.saveAndFlush(pending);
        log.debug("Inserted pending reservation {} for property {} under row lock", saved.getId(), property.getId());
        return saved;
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
