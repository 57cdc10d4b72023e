package com.staycheckout.checkout.api.controller;

import com.staycheckout.checkout.api.dto.AvailabilityResponse;
import com.staycheckout.checkout.api.dto.QuoteRequest;
import com.staycheckout.checkout.api.dto.QuoteResponse;
import com.staycheckout.checkout.domain.model.PropertyReference;
import com.staycheckout.checkout.domain.service.BookingService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * Read-only endpoints: occupied ranges and price quotes.
 */
@RestController
@RequiredArgsConstructor
public class AvailabilityController {

    private final BookingService bookingService;

    @GetMapping("/availability")
    public ResponseEntity<Object> getAvailability(
            @RequestParam(name = "property_slug", required = false) String propertySlug,
            @RequestParam(name = "property_id", required = false) Long propertyId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return bookingService.getAvailability(new PropertyReference(propertyId, propertySlug), from, to)
                .map(AvailabilityResponse::from)
                .toResponse(HttpStatus.OK);
    }

    @PostMapping("/quote")
    public ResponseEntity<Object> quote(@RequestBody QuoteRequest request) {
        return bookingService.quote(request.propertyReference(), request.checkin(), request.checkout())
                .map(QuoteResponse::from)
                .toResponse(HttpStatus.OK);
    }
}
