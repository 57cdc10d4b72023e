package com.staycheckout.checkout.api.dto;

import java.time.LocalDate;

public record DateRange(
        LocalDate from,
        LocalDate to
) {
}
