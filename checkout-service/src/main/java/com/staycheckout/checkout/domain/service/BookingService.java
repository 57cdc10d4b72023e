package com.staycheckout.checkout.domain.service;

import com.staycheckout.checkout.domain.model.Property;
import com.staycheckout.checkout.domain.model.PropertyReference;
import com.staycheckout.checkout.domain.model.Reservation;
import com.staycheckout.checkout.saga.BookingConfirmation;
import com.staycheckout.checkout.saga.ReservationTransactionManager;
import com.staycheckout.common.result.Result;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Entry point for the three public operations. Validates in the order the HTTP contract
 * promises and delegates to the lookup, pricing and booking components.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    static final String RANGE_MISSING = "from/to missing";
    static final String EMAIL_MISSING = "email missing";

    private final PropertyLookup propertyLookup;
    private final AvailabilityChecker availabilityChecker;
    private final PricingEngine pricingEngine;
    private final ReservationTransactionManager transactionManager;

    public record Availability(Property property, LocalDate from, LocalDate to, List<Reservation> occupied) {
    }

    public record PricedStay(Property property, Quote quote) {
    }

    /**
     * Occupied ranges of a property within [from, to). The range itself is not checked for order;
     * an empty or reversed range simply yields no occupied ranges.
     */
    public Result<Availability> getAvailability(PropertyReference reference, LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            return Result.invalidInput(RANGE_MISSING);
        }
        return propertyLookup.find(reference)
                .map(property -> new Availability(property, from, to,
                        availabilityChecker.findOccupied(property.getId(), from, to)));
    }

    public Result<PricedStay> quote(PropertyReference reference, LocalDate checkin, LocalDate checkout) {
        return pricingEngine.validateRange(checkin, checkout)
                .flatMap(period -> propertyLookup.find(reference)
                        .flatMap(property -> pricingEngine
                                .price(period, property.nightlyRateCents(), property.currencyCode())
                                .map(quote -> new PricedStay(property, quote))));
    }

    public Result<BookingConfirmation> checkout(PropertyReference reference, LocalDate checkin, LocalDate checkout,
                                                Integer guests, String email) {
        if (email == null || email.isBlank()) {
            return Result.invalidInput(EMAIL_MISSING);
        }
        String customerEmail = email.trim();
        int guestCount = guests != null ? guests : 1;
        return pricingEngine.validateRange(checkin, checkout)
                .flatMap(period -> propertyLookup.find(reference))
                .flatMap(property -> {
                    log.info("Checkout requested for property {} ({} → {}), guests: {}",
                            property.getSlug(), checkin, checkout, guestCount);
                    return transactionManager.createBooking(property, checkin, checkout, guestCount, customerEmail);
                });
    }
}
