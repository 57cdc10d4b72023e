package com.staycheckout.checkout.domain.repository;

import com.staycheckout.checkout.domain.model.Reservation;
import com.staycheckout.checkout.domain.model.ReservationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    /**
     * Reservations in the given statuses whose [checkin, checkout) overlaps [from, to),
     * ordered by checkin.
     */
    @Query("""
           SELECT r FROM Reservation r
           WHERE r.propertyId = :propertyId
             AND r.status IN :statuses
             AND NOT (r.checkout <= :from OR r.checkin >= :to)
           ORDER BY r.checkin ASC, r.id ASC
           """)
    List<Reservation> findOverlapping(@Param("propertyId") Long propertyId,
                                      @Param("from") LocalDate from,
                                      @Param("to") LocalDate to,
                                      @Param("statuses") Collection<ReservationStatus> statuses);

    @Query("""
           SELECT COUNT(r) FROM Reservation r
           WHERE r.propertyId = :propertyId
             AND r.status IN :statuses
             AND NOT (r.checkout <= :from OR r.checkin >= :to)
           """)
    long countOverlapping(@Param("propertyId") Long propertyId,
                          @Param("from") LocalDate from,
                          @Param("to") LocalDate to,
                          @Param("statuses") Collection<ReservationStatus> statuses);

    /**
     * Compensating delete. Only removes the row while it is still in {@code status},
     * so a reservation that was confirmed in the meantime is left alone.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Reservation r WHERE r.id = :id AND r.status = :status")
    int deleteByIdAndStatus(@Param("id") Long id, @Param("status") ReservationStatus status);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Reservation r
           SET r.paymentSessionId = :sessionId, r.updatedAt = :now
           WHERE r.id = :id
           """)
    int attachPaymentSession(@Param("id") Long id,
                             @Param("sessionId") String sessionId,
                             @Param("now") LocalDateTime now);

    /** For recovery: pending reservations that never got a payment session. */
    List<Reservation> findByStatusAndPaymentSessionIdIsNullAndCreatedAtBefore(ReservationStatus status,
                                                                             LocalDateTime before);

    /**
     * Cancels an orphan, guarded so a row that got its session or changed status concurrently
     * is not touched. Returns 1 when the row was cancelled.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Reservation r
           SET r.status = :cancelled, r.updatedAt = :now
           WHERE r.id = :id
             AND r.status = :pending
             AND r.paymentSessionId IS NULL
           """)
    int cancelIfOrphaned(@Param("id") Long id,
                         @Param("pending") ReservationStatus pending,
                         @Param("cancelled") ReservationStatus cancelled,
                         @Param("now") LocalDateTime now);
}
