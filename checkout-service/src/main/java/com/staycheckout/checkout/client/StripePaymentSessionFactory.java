package com.staycheckout.checkout.client;

import com.staycheckout.checkout.client.dto.PaymentSession;
import com.staycheckout.checkout.client.dto.PaymentSessionRequest;
import com.staycheckout.checkout.client.dto.StripeCheckoutSession;
import feign.FeignException;
import feign.RetryableException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates Stripe Checkout sessions (one line item, payment mode).
 * <p>
 * Transient failures are retried by Resilience4j ({@code payment-gateway} instance); the
 * {@code Idempotency-Key} header makes a retried call return the session of the first attempt
 * instead of creating a second one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StripePaymentSessionFactory implements PaymentSessionFactory {

    private final StripeClient stripeClient;

    @Override
    @Retry(name = "payment-gateway")
    public PaymentSession createSession(PaymentSessionRequest request) {
        log.info("Creating Stripe checkout session, idempotency key: {}, amount: {} {}",
                request.idempotencyKey(), request.amountCents(), request.currency());
        StripeCheckoutSession session;
        try {
            session = stripeClient.createCheckoutSession(request.idempotencyKey(), toForm(request));
        } catch (PaymentGatewayException e) {
            throw e;
        } catch (RetryableException e) {
            // connect/read timeout or connection refused
            throw PaymentGatewayException.unavailable("payment gateway unreachable: " + e.getMessage(), e);
        } catch (FeignException e) {
            boolean transientFailure = e.status() < 0 || e.status() == 429 || e.status() >= 500;
            throw new PaymentGatewayException("payment gateway error: " + e.getMessage(), e,
                    transientFailure, e.status());
        }

        if (session == null || session.url() == null || session.url().isBlank()) {
            throw new PaymentGatewayException("payment gateway returned no session url", false, 200);
        }
        log.info("Stripe checkout session {} created for key {}", session.id(), request.idempotencyKey());
        return new PaymentSession(session.id(), session.url());
    }

    /**
     * Stripe's form encoding of a Checkout Session with a single priced line item.
     */
    Map<String, Object> toForm(PaymentSessionRequest request) {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("mode", "payment");
        form.put("success_url", request.successUrl());
        form.put("cancel_url", request.cancelUrl());
        if (request.expiresAt() != null) {
            form.put("expires_at", request.expiresAt().getEpochSecond());
        }
        if (request.customerEmail() != null) {
            form.put("customer_email", request.customerEmail());
        }
        form.put("line_items[0][quantity]", 1);
        form.put("line_items[0][price_data][currency]", request.currency());
        form.put("line_items[0][price_data][unit_amount]", request.amountCents());
        form.put("line_items[0][price_data][product_data][name]", request.productName());
        if (request.description() != null) {
            form.put("line_items[0][price_data][product_data][description]", request.description());
        }
        if (request.metadata() != null) {
            request.metadata().forEach((key, value) -> form.put("metadata[" + key + "]", value));
        }
        return form;
    }
}
