package com.staycheckout.checkout.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Reservation of a property for a half-open date range.
 * The database excludes overlapping pending/paid rows per property
 * (see {@code excl_reservations_no_overlap}).
 */
@Entity
@Table(name = "reservations", indexes = {
        @Index(name = "idx_reservations_property_dates", columnList = "property_id,checkin,checkout"),
        @Index(name = "idx_reservations_status_created", columnList = "status,created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reservation {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    @Column(name = "checkin", nullable = false)
    private LocalDate checkin;

    @Column(name = "checkout", nullable = false)
    private LocalDate checkout;

    @Column(name = "guests", nullable = false)
    private Integer guests;

    @Column(name = "email", nullable = false, length = 320)
    private String email;

    @Column(name = "status", nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "payment_session_id")
    private String paymentSessionId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (status == null) {
            status = ReservationStatus.PENDING;
        }
        if (guests == null) {
            guests = 1;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public StayPeriod stayPeriod() {
        return new StayPeriod(checkin, checkout);
    }

    public static Reservation pending(Property property, StayPeriod period, int guests, String email) {
        return Reservation.builder()
                .propertyId(property.getId())
                .checkin(period.checkin())
                .checkout(period.checkout())
                .guests(guests)
                .email(email)
                .status(ReservationStatus.PENDING)
                .build();
    }
}
