package com.staycheckout.checkout.saga;

import com.staycheckout.checkout.client.PaymentGatewayException;
import com.staycheckout.checkout.client.PaymentSessionFactory;
import com.staycheckout.checkout.client.dto.PaymentSession;
import com.staycheckout.checkout.client.dto.PaymentSessionRequest;
import com.staycheckout.checkout.domain.model.Property;
import com.staycheckout.checkout.domain.model.Reservation;
import com.staycheckout.checkout.domain.model.StayPeriod;
import com.staycheckout.checkout.domain.service.PricingEngine;
import com.staycheckout.checkout.domain.service.Quote;
import com.staycheckout.checkout.domain.service.ReservationStore;
import com.staycheckout.checkout.domain.strategy.ReservationConflictException;
import com.staycheckout.checkout.domain.strategy.ReservationStrategy;
import com.staycheckout.checkout.events.ReservationEventPublisher;
import com.staycheckout.common.exception.BusinessException;
import com.staycheckout.common.result.ErrorKind;
import com.staycheckout.common.result.Result;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Orchestrates a checkout: reserve the dates, then open a payment session for them.
 * <p>
 * Flow:
 * 1. Price the stay (invalid range fails before any database access)
 * 2. Conflict check and insert of a pending reservation, committed by the configured
 *    {@link ReservationStrategy}
 * 3. Create the payment session, outside any transaction
 * 4. Success: record the session id and publish reservation-created
 * <p>
 * If step 3 fails the compensating transaction deletes the pending reservation, so the dates
 * become available again. Should the compensation itself fail, the row is left for
 * {@link PendingReservationRecoveryJob}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationTransactionManager {

    static final String DATES_NOT_AVAILABLE = "dates not available";
    static final String BOOKING_FAILED = "could not store the reservation";
    static final int MAX_LOCK_ATTEMPTS = 3;
    private static final String EXCLUSION_VIOLATION = "23P01";

    private final PricingEngine pricingEngine;
    private final Map<String, ReservationStrategy> strategies;
    private final PaymentSessionFactory paymentSessionFactory;
    private final ReservationStore reservationStore;
    private final ReservationEventPublisher eventPublisher;

    @Value("${checkout.reservation.strategy:constraint}")
    private String strategyName;

    @Value("${checkout.frontend-url:http://localhost:3000}")
    private String frontendUrl;

    @Value("${checkout.payment.session-expiry-minutes:30}")
    private int sessionExpiryMinutes;

    @PostConstruct
    void logStrategy() {
        log.info("Reservation strategy: {} (available: {})", strategyName, strategies.keySet());
    }

    public Result<BookingConfirmation> createBooking(Property property, LocalDate checkin, LocalDate checkout,
                                                     int guests, String email) {
        Result<Quote> priced = pricingEngine.quote(checkin, checkout, property.nightlyRateCents(), property.currencyCode());
        if (priced instanceof Result.Failure<Quote> failure) {
            return Result.failure(failure.kind(), failure.message());
        }
        Quote quote = ((Result.Success<Quote>) priced).value();

        Result<Reservation> reserved = reserve(property, quote.period(), guests, email);
        if (reserved instanceof Result.Failure<Reservation> failure) {
            return Result.failure(failure.kind(), failure.message());
        }
        Reservation reservation = ((Result.Success<Reservation>) reserved).value();

        PaymentSession session;
        try {
            session = paymentSessionFactory.createSession(paymentRequest(property, reservation, quote));
        } catch (PaymentGatewayException e) {
            log.error("Payment session failed for reservation {} (transient={}, status={})",
                    reservation.getId(), e.isTransientFailure(), e.getStatus(), e);
            compensate(reservation, "payment session failed");
            return Result.failure(ErrorKind.UPSTREAM_FAILURE, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure creating payment session for reservation {}", reservation.getId(), e);
            compensate(reservation, "payment session failed");
            return Result.failure(ErrorKind.INTERNAL, e.getMessage());
        }

        recordSession(reservation, session);
        eventPublisher.publishReservationCreated(property, reservation, quote.totalCents(), quote.currency());
        log.info("Checkout ready for reservation {} on property {} ({}), total {}",
                reservation.getId(), property.getSlug(), quote.period(), quote.totalFormatted());
        return Result.success(new BookingConfirmation(
                reservation.getId(), session.url(), quote.totalCents(), quote.currency()));
    }

    private Result<Reservation> reserve(Property property, StayPeriod period, int guests, String email) {
        ReservationStrategy strategy = currentStrategy();
        for (int attempt = 1; ; attempt++) {
            try {
                Reservation saved = strategy.reserve(property, Reservation.pending(property, period, guests, email));
                log.info("Pending reservation {} committed for property {} ({}) using {}",
                        saved.getId(), property.getId(), period, strategy.getStrategyType());
                return Result.success(saved);
            } catch (ReservationConflictException e) {
                log.warn("Booking rejected: {}", e.getMessage());
                return Result.conflict(DATES_NOT_AVAILABLE);
            } catch (BusinessException e) {
                log.warn("Booking rejected for property {}: {}", property.getId(), e.getMessage());
                return Result.failure(e.getKind(), e.getMessage());
            } catch (DataIntegrityViolationException e) {
                if (isExclusionViolation(e)) {
                    log.warn("Booking rejected by exclusion constraint: property {} already booked for {}",
                            property.getId(), period);
                    return Result.conflict(DATES_NOT_AVAILABLE);
                }
                log.error("Integrity violation storing reservation for property {}", property.getId(), e);
                return Result.failure(ErrorKind.INTERNAL, BOOKING_FAILED);
            } catch (PessimisticLockingFailureException e) {
                // concurrent inserts waiting on each other's exclusion check can deadlock;
                // the rerun's pre-check sees whichever attempt committed
                if (attempt >= MAX_LOCK_ATTEMPTS) {
                    log.error("Giving up storing reservation for property {} after {} lock failures",
                            property.getId(), attempt, e);
                    return Result.failure(ErrorKind.INTERNAL, BOOKING_FAILED);
                }
                log.warn("Lock failure storing reservation for property {} (attempt {}), retrying: {}",
                        property.getId(), attempt, e.getMessage());
            } catch (DataAccessException | TransactionException e) {
                log.error("Database failure storing reservation for property {}", property.getId(), e);
                return Result.failure(ErrorKind.INTERNAL, BOOKING_FAILED);
            }
        }
    }

    private ReservationStrategy currentStrategy() {
        ReservationStrategy strategy = strategies.get(strategyName);
        if (strategy == null) {
            throw new IllegalStateException("Unknown reservation strategy: " + strategyName
                    + " (available: " + strategies.keySet() + ")");
        }
        return strategy;
    }

    private PaymentSessionRequest paymentRequest(Property property, Reservation reservation, Quote quote) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("reservation_id", String.valueOf(reservation.getId()));
        metadata.put("property_id", String.valueOf(property.getId()));
        metadata.put("property_slug", property.getSlug());
        metadata.put("checkin", reservation.getCheckin().toString());
        metadata.put("checkout", reservation.getCheckout().toString());

        String description = String.format("%s → %s · %d nights",
                reservation.getCheckin(), reservation.getCheckout(), quote.nights());
        String base = frontendUrl.endsWith("/") ? frontendUrl.substring(0, frontendUrl.length() - 1) : frontendUrl;

        return new PaymentSessionRequest(
                quote.totalCents(),
                quote.currency().toLowerCase(Locale.ROOT),
                "Stay: " + property.getName(),
                description,
                base + "/success?session_id={CHECKOUT_SESSION_ID}&reservation_id=" + reservation.getId(),
                base + "/cancel?reservation_id=" + reservation.getId(),
                reservation.getEmail(),
                metadata,
                "reservation-" + reservation.getId(),
                Instant.now().plus(Duration.ofMinutes(sessionExpiryMinutes)));
    }

    private void recordSession(Reservation reservation, PaymentSession session) {
        try {
            reservationStore.attachPaymentSession(reservation.getId(), session.id());
            reservation.setPaymentSessionId(session.id());
        } catch (DataAccessException | TransactionException e) {
            // the session expires before the recovery job may cancel the reservation
            log.error("Could not record payment session {} on reservation {}",
                    session.id(), reservation.getId(), e);
        }
    }

    /**
     * Compensating transaction for a reservation that will never get a payment session.
     */
    private void compensate(Reservation reservation, String reason) {
        try {
            if (reservationStore.release(reservation.getId())) {
                eventPublisher.publishReservationReleased(reservation, reason);
            }
        } catch (DataAccessException | TransactionException e) {
            log.error("Compensation failed for reservation {}, left for recovery", reservation.getId(), e);
        }
    }

    private static boolean isExclusionViolation(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sql && EXCLUSION_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
