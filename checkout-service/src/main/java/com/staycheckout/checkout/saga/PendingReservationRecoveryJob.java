package com.staycheckout.checkout.saga;

import com.staycheckout.checkout.domain.model.Reservation;
import com.staycheckout.checkout.domain.service.ReservationStore;
import com.staycheckout.checkout.events.ReservationEventPublisher;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Scheduled job that cancels pending reservations which never received a payment session,
 * e.g. when the process died between the booking commit and the compensating delete, or the
 * session id could not be recorded.
 * <p>
 * The orphan threshold must exceed the payment session expiry, so that a hosted payment page
 * is no longer payable once its reservation is cancelled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PendingReservationRecoveryJob {

    static final String RELEASE_REASON = "orphaned pending reservation expired";

    private final ReservationStore reservationStore;
    private final ReservationEventPublisher eventPublisher;

    @Value("${checkout.recovery.enabled:true}")
    private boolean recoveryEnabled;

    @Value("${checkout.recovery.orphan-threshold-minutes:45}")
    private int orphanThresholdMinutes;

    @Value("${checkout.payment.session-expiry-minutes:30}")
    private int sessionExpiryMinutes;

    @PostConstruct
    void checkThreshold() {
        if (orphanThresholdMinutes <= sessionExpiryMinutes) {
            throw new IllegalStateException("checkout.recovery.orphan-threshold-minutes (" + orphanThresholdMinutes
                    + ") must exceed checkout.payment.session-expiry-minutes (" + sessionExpiryMinutes + ")");
        }
    }

    @Scheduled(fixedDelayString = "${checkout.recovery.interval-ms:60000}")
    public void releaseOrphanedReservations() {
        if (!recoveryEnabled) return;
        LocalDateTime threshold = LocalDateTime.now().minusMinutes(orphanThresholdMinutes);
        List<Reservation> cancelled;
        try {
            cancelled = reservationStore.cancelOrphans(threshold);
        } catch (DataAccessException e) {
            log.error("Orphan recovery failed, retrying on next run", e);
            return;
        }
        if (cancelled.isEmpty()) return;
        log.info("Orphan recovery: cancelled {} pending reservation(s) created before {}", cancelled.size(), threshold);
        for (Reservation reservation : cancelled) {
            log.warn("Cancelled orphaned reservation {} for property {} ({})",
                    reservation.getId(), reservation.getPropertyId(), reservation.stayPeriod());
            eventPublisher.publishReservationReleased(reservation, RELEASE_REASON);
        }
    }
}
