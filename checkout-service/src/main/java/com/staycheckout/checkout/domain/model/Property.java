package com.staycheckout.checkout.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Bookable property. Owned by the catalog; this service only reads it.
 */
@Entity
@Table(name = "properties")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Property {

    public static final String DEFAULT_CURRENCY = "EUR";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "slug", nullable = false, unique = true, updatable = false)
    private String slug;

    @Column(name = "name", nullable = false, updatable = false)
    private String name;

    @Column(name = "currency", length = 3, updatable = false)
    private String currency;

    @Column(name = "price_per_night_cents", nullable = false, updatable = false)
    private Long pricePerNightCents;

    /**
     * ISO currency code in upper case, {@value #DEFAULT_CURRENCY} when the row has none.
     */
    public String currencyCode() {
        if (currency == null || currency.isBlank()) {
            return DEFAULT_CURRENCY;
        }
        return currency.trim().toUpperCase(Locale.ROOT);
    }

    public long nightlyRateCents() {
        return pricePerNightCents == null ? 0L : pricePerNightCents;
    }
}
