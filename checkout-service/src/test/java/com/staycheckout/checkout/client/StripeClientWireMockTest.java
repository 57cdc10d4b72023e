package com.staycheckout.checkout.client;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import com.staycheckout.checkout.client.dto.PaymentSession;
import com.staycheckout.checkout.client.dto.PaymentSessionRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.http.HttpMessageConvertersAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.cloud.openfeign.FeignAutoConfiguration;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.time.Instant;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Wire contract of the Stripe Feign client against a WireMock server: headers, form encoding,
 * error decoding and the read timeout.
 */
@SpringBootTest(classes = StripeClientWireMockTest.FeignTestConfig.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "checkout.payment.stripe.secret-key=sk_test_123",
                "spring.cloud.openfeign.client.config.stripe.connect-timeout=500",
                "spring.cloud.openfeign.client.config.stripe.read-timeout=500"
        })
class StripeClientWireMockTest {

    @RegisterExtension
    static WireMockExtension stripe = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    @DynamicPropertySource
    static void stripeUrl(DynamicPropertyRegistry registry) {
        registry.add("checkout.payment.stripe.api-url", stripe::baseUrl);
    }

    @Configuration
    @EnableFeignClients(clients = StripeClient.class)
    @ImportAutoConfiguration({
            JacksonAutoConfiguration.class,
            HttpMessageConvertersAutoConfiguration.class,
            FeignAutoConfiguration.class
    })
    static class FeignTestConfig {
    }

    @Autowired
    private StripeClient stripeClient;

    private StripePaymentSessionFactory factory;

    @BeforeEach
    void setUp() {
        factory = new StripePaymentSessionFactory(stripeClient);
    }

    private static PaymentSessionRequest request() {
        return new PaymentSessionRequest(
                30_000L, "eur", "Stay: Villa X", "3 nights",
                "http://localhost:3000/success", "http://localhost:3000/cancel",
                "guest@example.com", Map.of("reservation_id", "42"), "reservation-42",
                Instant.ofEpochSecond(1_717_200_000L));
    }

    @Test
    @DisplayName("posts a form-encoded session with bearer auth and idempotency key")
    void createSession_success() {
        stripe.stubFor(post(urlEqualTo("/v1/checkout/sessions"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"id\":\"cs_test_1\",\"object\":\"checkout.session\","
                                + "\"url\":\"https://checkout.stripe.com/c/pay/cs_test_1\",\"status\":\"open\"}")));

        PaymentSession session = factory.createSession(request());

        assertThat(session.id()).isEqualTo("cs_test_1");
        assertThat(session.url()).isEqualTo("https://checkout.stripe.com/c/pay/cs_test_1");
        stripe.verify(postRequestedFor(urlEqualTo("/v1/checkout/sessions"))
                .withHeader("Authorization", equalTo("Bearer sk_test_123"))
                .withHeader("Idempotency-Key", equalTo("reservation-42"))
                .withHeader("Content-Type", containing("application/x-www-form-urlencoded"))
                .withRequestBody(containing("mode=payment"))
                .withRequestBody(containing("line_items%5B0%5D%5Bprice_data%5D%5Bunit_amount%5D=30000"))
                .withRequestBody(containing("metadata%5Breservation_id%5D=42"))
                .withRequestBody(containing("expires_at=1717200000")));
    }

    @Test
    @DisplayName("a Stripe validation error is a non-transient failure with Stripe's message")
    void createSession_validationError() {
        stripe.stubFor(post(urlEqualTo("/v1/checkout/sessions"))
                .willReturn(aResponse()
                        .withStatus(400)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"error\":{\"type\":\"invalid_request_error\",\"message\":\"Invalid currency: eur\"}}")));

        assertThatThrownBy(() -> factory.createSession(request()))
                .isInstanceOf(PaymentGatewayException.class)
                .hasMessageContaining("Invalid currency: eur")
                .satisfies(e -> assertThat(((PaymentGatewayException) e).isTransientFailure()).isFalse());
    }

    @Test
    @DisplayName("a response slower than the read timeout is a transient failure")
    void createSession_timeout() {
        stripe.stubFor(post(urlEqualTo("/v1/checkout/sessions"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withFixedDelay(2_000)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"id\":\"cs_slow\",\"url\":\"https://checkout.stripe.com/c/pay/cs_slow\"}")));

        assertThatThrownBy(() -> factory.createSession(request()))
                .isInstanceOf(PaymentGatewayException.class)
                .satisfies(e -> assertThat(((PaymentGatewayException) e).isTransientFailure()).isTrue());
    }
}
