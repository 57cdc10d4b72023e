package com.staycheckout.checkout.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Request;
import feign.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StripeErrorDecoderTest {

    private final StripeErrorDecoder decoder = new StripeErrorDecoder(new ObjectMapper());

    private static Response response(int status, String body) {
        Request request = Request.create(Request.HttpMethod.POST, "https://api.stripe.com/v1/checkout/sessions",
                Map.of(), null, StandardCharsets.UTF_8, null);
        Response.Builder builder = Response.builder()
                .status(status)
                .reason("reason " + status)
                .request(request)
                .headers(Map.of());
        if (body != null) {
            builder.body(body, StandardCharsets.UTF_8);
        }
        return builder.build();
    }

    @Test
    @DisplayName("4xx is a rejection carrying Stripe's error message")
    void decode_validationError() {
        Exception e = decoder.decode("StripeClient#createCheckoutSession",
                response(400, "{\"error\":{\"type\":\"invalid_request_error\",\"message\":\"Invalid currency: xyz\"}}"));

        assertThat(e).isInstanceOf(PaymentGatewayException.class);
        PaymentGatewayException pge = (PaymentGatewayException) e;
        assertThat(pge.isTransientFailure()).isFalse();
        assertThat(pge.getStatus()).isEqualTo(400);
        assertThat(pge.getMessage()).isEqualTo("payment gateway error (HTTP 400): Invalid currency: xyz");
    }

    @Test
    @DisplayName("429 and 5xx are transient")
    void decode_transient() {
        PaymentGatewayException rateLimited = (PaymentGatewayException) decoder.decode("m", response(429, "{}"));
        PaymentGatewayException unavailable = (PaymentGatewayException) decoder.decode("m", response(503, null));

        assertThat(rateLimited.isTransientFailure()).isTrue();
        assertThat(unavailable.isTransientFailure()).isTrue();
        assertThat(unavailable.getMessage()).isEqualTo("payment gateway error (HTTP 503): reason 503");
    }

    @Test
    @DisplayName("a body that is not JSON falls back to the HTTP reason")
    void decode_unreadableBody() {
        PaymentGatewayException e = (PaymentGatewayException) decoder.decode("m", response(402, "<html>nope</html>"));

        assertThat(e.isTransientFailure()).isFalse();
        assertThat(e.getMessage()).isEqualTo("payment gateway error (HTTP 402): reason 402");
    }
}
