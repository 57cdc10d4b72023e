package com.staycheckout.checkout.domain.service;

import com.staycheckout.checkout.domain.model.Reservation;
import com.staycheckout.checkout.domain.model.ReservationStatus;
import com.staycheckout.checkout.domain.model.StayPeriod;
import com.staycheckout.checkout.domain.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Finds the pending and paid reservations that occupy a date range.
 * <p>
 * Used on its own for the public availability view (read committed, no locks), and re-run
 * inside the booking transaction by the reservation strategies as the conflict pre-check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityChecker {

    private final ReservationRepository reservationRepository;

    /**
     * Pending/paid reservations overlapping [from, to), ordered by checkin.
     */
    @Transactional(readOnly = true)
    public List<Reservation> findOccupied(Long propertyId, LocalDate from, LocalDate to) {
        List<Reservation> occupied = reservationRepository.findOverlapping(
                propertyId, from, to, ReservationStatus.BLOCKING);
        log.debug("Property {} has {} occupied range(s) within {}-{}", propertyId, occupied.size(), from, to);
        return occupied;
    }

    /**
     * Joins the caller's transaction when there is one, so the check sees the same
     * connection as the insert that follows it.
     */
    @Transactional(readOnly = true)
    public boolean hasConflict(Long propertyId, StayPeriod period) {
        return reservationRepository.countOverlapping(
                propertyId, period.checkin(), period.checkout(), ReservationStatus.BLOCKING) > 0;
    }
}
