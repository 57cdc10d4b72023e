package com.staycheckout.checkout.api.controller;

import com.staycheckout.checkout.api.dto.CheckoutRequest;
import com.staycheckout.checkout.api.dto.CheckoutResponse;
import com.staycheckout.checkout.domain.service.BookingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Creates a pending reservation and returns the hosted payment page for it.
 */
@RestController
@RequiredArgsConstructor
public class CheckoutController {

    private final BookingService bookingService;

    @PostMapping("/checkout")
    public ResponseEntity<Object> checkout(@Valid @RequestBody CheckoutRequest request) {
        return bookingService.checkout(request.propertyReference(), request.checkin(), request.checkout(),
                        request.guests(), request.email())
                .map(CheckoutResponse::from)
                .toResponse(HttpStatus.CREATED);
    }
}
