package com.staycheckout.checkout.domain.service;

import com.staycheckout.checkout.domain.model.Reservation;
import com.staycheckout.checkout.domain.model.ReservationStatus;
import com.staycheckout.checkout.domain.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Short write transactions that run after the booking transaction has committed:
 * compensating release, recording the payment session, and expiring orphans.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationStore {

    private final ReservationRepository reservationRepository;

    /**
     * Compensating transaction: removes a pending reservation whose payment session could not be
     * created. Returns false when nothing was deleted (already gone or no longer pending).
     */
    @Transactional
    public boolean release(Long reservationId) {
        int deleted = reservationRepository.deleteByIdAndStatus(reservationId, ReservationStatus.PENDING);
        if (deleted == 0) {
            log.warn("Reservation {} was not released: not found or no longer pending", reservationId);
            return false;
        }
        log.info("Released pending reservation {}", reservationId);
        return true;
    }

    @Transactional
    public void attachPaymentSession(Long reservationId, String paymentSessionId) {
        int updated = reservationRepository.attachPaymentSession(reservationId, paymentSessionId, LocalDateTime.now());
        if (updated == 0) {
            log.warn("Payment session {} not attached: reservation {} not found", paymentSessionId, reservationId);
        }
    }

    /**
     * Cancels pending reservations created before {@code createdBefore} that never received a
     * payment session. Returns the reservations actually cancelled.
     */
    @Transactional
    public List<Reservation> cancelOrphans(LocalDateTime createdBefore) {
        List<Reservation> candidates = reservationRepository
                .findByStatusAndPaymentSessionIdIsNullAndCreatedAtBefore(ReservationStatus.PENDING, createdBefore);
        List<Reservation> cancelled = new ArrayList<>();
        for (Reservation reservation : candidates) {
            int updated = reservationRepository.cancelIfOrphaned(
                    reservation.getId(), ReservationStatus.PENDING, ReservationStatus.CANCELLED, LocalDateTime.now());
            if (updated == 1) {
                reservation.setStatus(ReservationStatus.CANCELLED);
                cancelled.add(reservation);
            }
        }
        return cancelled;
    }
}
