package com.staycheckout.checkout.client;

import lombok.Getter;

/**
 * Payment session could not be created.
 * <p>
 * {@code transientFailure} is true for rate limiting, 5xx, I/O errors and timeouts (worth a retry),
 * false when the gateway rejected the request itself (bad amount, currency, parameters).
 */
@Getter
public class PaymentGatewayException extends RuntimeException {

    private final boolean transientFailure;

    /** HTTP status returned by the gateway, or -1 when there was no response. */
    private final int status;

    public PaymentGatewayException(String message, boolean transientFailure, int status) {
        super(message);
        this.transientFailure = transientFailure;
        this.status = status;
    }

    public PaymentGatewayException(String message, Throwable cause, boolean transientFailure, int status) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.status = status;
    }

    public static PaymentGatewayException rejected(int status, String message) {
        return new PaymentGatewayException(message, false, status);
    }

    public static PaymentGatewayException unavailable(String message, Throwable cause) {
        return new PaymentGatewayException(message, cause, true, -1);
    }
}
