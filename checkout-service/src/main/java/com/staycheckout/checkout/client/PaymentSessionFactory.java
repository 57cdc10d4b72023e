package com.staycheckout.checkout.client;

import com.staycheckout.checkout.client.dto.PaymentSession;
import com.staycheckout.checkout.client.dto.PaymentSessionRequest;

/**
 * Payment gateway boundary: creates a hosted payment session the guest is redirected to.
 * Implementations: StripePaymentSessionFactory (Stripe Checkout).
 */
public interface PaymentSessionFactory {

    /**
     * @return the created session with its hosted URL
     * @throws PaymentGatewayException when the gateway rejects the request or cannot be reached
     *         in time; {@link PaymentGatewayException#isTransientFailure()} tells the two apart
     */
    PaymentSession createSession(PaymentSessionRequest request);
}
