package com.staycheckout.checkout.events;

import com.staycheckout.checkout.domain.model.Property;
import com.staycheckout.checkout.domain.model.Reservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for reservation lifecycle events.
 * <p>
 * Events published:
 * - reservation-created: pending reservation with a payment session
 * - reservation-released: pending reservation removed or cancelled
 * <p>
 * Publishing never fails the caller: the reservation is already committed when these are sent,
 * so send errors are logged only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationEventPublisher {

    static final String TOPIC_RESERVATION_CREATED = "reservation-created";
    static final String TOPIC_RESERVATION_RELEASED = "reservation-released";

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${checkout.events.enabled:true}")
    private boolean enabled;

    public void publishReservationCreated(Property property, Reservation reservation,
                                          long amountCents, String currency) {
        ReservationCreatedEvent event = ReservationCreatedEvent.builder()
                .reservationId(reservation.getId())
                .propertyId(property.getId())
                .propertySlug(property.getSlug())
                .checkin(reservation.getCheckin())
                .checkout(reservation.getCheckout())
                .guests(reservation.getGuests())
                .email(reservation.getEmail())
                .amountCents(amountCents)
                .currency(currency)
                .paymentSessionId(reservation.getPaymentSessionId())
                .timestamp(Instant.now())
                .build();

        publishEvent(TOPIC_RESERVATION_CREATED, String.valueOf(reservation.getId()), event);
    }

    public void publishReservationReleased(Reservation reservation, String reason) {
        ReservationReleasedEvent event = ReservationReleasedEvent.builder()
                .reservationId(reservation.getId())
                .propertyId(reservation.getPropertyId())
                .checkin(reservation.getCheckin())
                .checkout(reservation.getCheckout())
                .reason(reason)
                .timestamp(Instant.now())
                .build();

        publishEvent(TOPIC_RESERVATION_RELEASED, String.valueOf(reservation.getId()), event);
    }

    private void publishEvent(String topic, String key, Object event) {
        if (!enabled) {
            log.debug("Event publishing disabled, skipping {} for key {}", topic, key);
            return;
        }
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            // metadata fetch timed out or the producer could not be created
            log.error("Failed to send event to topic {} for key {}", topic, key, e);
            return;
        }

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {}", topic, ex);
            }
        });
    }
}
