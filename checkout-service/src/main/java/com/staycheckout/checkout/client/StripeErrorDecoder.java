package com.staycheckout.checkout.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Response;
import feign.Util;
import feign.codec.ErrorDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Turns Stripe error responses into {@link PaymentGatewayException}.
 * 429 and 5xx are transient; any other status means Stripe rejected the request.
 * The message is taken from Stripe's {@code {"error": {"message": ...}}} body when present.
 */
@Slf4j
@RequiredArgsConstructor
public class StripeErrorDecoder implements ErrorDecoder {

    private final ObjectMapper objectMapper;

    @Override
    public Exception decode(String methodKey, Response response) {
        int status = response.status();
        boolean transientFailure = status == 429 || status >= 500;
        String message = "payment gateway error (HTTP " + status + "): " + extractMessage(response);
        log.warn("Stripe call {} failed: {}", methodKey, message);
        return new PaymentGatewayException(message, transientFailure, status);
    }

    private String extractMessage(Response response) {
        if (response.body() == null) {
            return fallbackMessage(response);
        }
        try (Reader reader = response.body().asReader(StandardCharsets.UTF_8)) {
            String body = Util.toString(reader);
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            return message.isTextual() ? message.asText() : fallbackMessage(response);
        } catch (IOException e) {
            log.debug("Could not read Stripe error body: {}", e.getMessage());
            return fallbackMessage(response);
        }
    }

    private String fallbackMessage(Response response) {
        return response.reason() != null ? response.reason() : "no details";
    }
}
