package com.staycheckout.checkout.client;

import java.util.function.Predicate;

/**
 * Retry predicate for the {@code payment-gateway} Resilience4j instance: only transient gateway
 * failures are retried, a rejected request never is.
 */
public class TransientPaymentFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof PaymentGatewayException e && e.isTransientFailure();
    }
}
