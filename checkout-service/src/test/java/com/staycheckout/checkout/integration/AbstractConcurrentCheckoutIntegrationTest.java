package com.staycheckout.checkout.integration;

import com.staycheckout.checkout.client.PaymentGatewayException;
import com.staycheckout.checkout.client.PaymentSessionFactory;
import com.staycheckout.checkout.client.dto.PaymentSession;
import com.staycheckout.checkout.client.dto.PaymentSessionRequest;
import com.staycheckout.checkout.domain.model.Property;
import com.staycheckout.checkout.domain.model.PropertyReference;
import com.staycheckout.checkout.domain.model.ReservationStatus;
import com.staycheckout.checkout.domain.repository.PropertyRepository;
import com.staycheckout.checkout.domain.repository.ReservationRepository;
import com.staycheckout.checkout.domain.service.BookingService;
import com.staycheckout.checkout.events.ReservationEventPublisher;
import com.staycheckout.checkout.saga.BookingConfirmation;
import com.staycheckout.common.result.ErrorKind;
import com.staycheckout.common.result.Result;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * End-to-end booking flow against PostgreSQL, run once per reservation strategy.
 * The payment gateway and Kafka publisher are mocked.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@Testcontainers
abstract class AbstractConcurrentCheckoutIntegrationTest {

    private static final int ATTEMPTS = 8;
    private static final LocalDate JUNE_1 = LocalDate.of(2024, 6, 1);
    private static final LocalDate JUNE_3 = LocalDate.of(2024, 6, 3);
    private static final LocalDate JUNE_4 = LocalDate.of(2024, 6, 4);
    private static final LocalDate JUNE_5 = LocalDate.of(2024, 6, 5);
    private static final LocalDate JUNE_8 = LocalDate.of(2024, 6, 8);

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("checkout_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("checkout.recovery.enabled", () -> "false");
    }

    @Autowired
    private BookingService bookingService;

    @Autowired
    private PropertyRepository propertyRepository;

    @Autowired
    private ReservationRepository reservationRepository;

    @MockBean
    private PaymentSessionFactory paymentSessionFactory;

    @MockBean
    private ReservationEventPublisher eventPublisher;

    private PropertyReference villa;

    @BeforeEach
    void setUp() {
        Property saved = propertyRepository.save(Property.builder()
                .slug("villa-x").name("Villa X").currency("EUR").pricePerNightCents(10_000L).build());
        villa = new PropertyReference(saved.getId(), null);
        when(paymentSessionFactory.createSession(any(PaymentSessionRequest.class))).thenAnswer(inv -> {
            PaymentSessionRequest request = inv.getArgument(0);
            String sessionId = "cs_" + request.idempotencyKey();
            return new PaymentSession(sessionId, "https://checkout.stripe.com/c/pay/" + sessionId);
        });
    }

    @AfterEach
    void tearDown() {
        reservationRepository.deleteAll();
        propertyRepository.deleteAll();
    }

    @Test
    @DisplayName("sequential overlap: first stay is booked, the overlapping one is a conflict")
    void checkout_thenOverlap() {
        Result<BookingConfirmation> first = bookingService.checkout(villa, JUNE_1, JUNE_4, 2, "a@example.com");
        Result<BookingConfirmation> second = bookingService.checkout(villa, JUNE_3, JUNE_5, 2, "b@example.com");
        Result<BookingConfirmation> backToBack = bookingService.checkout(villa, JUNE_4, JUNE_5, 2, "c@example.com");

        assertThat(first.isSuccess()).isTrue();
        BookingConfirmation confirmation = ((Result.Success<BookingConfirmation>) first).value();
        assertThat(confirmation.amountCents()).isEqualTo(30_000L);
        assertThat(reservationRepository.findById(confirmation.reservationId()).orElseThrow().getPaymentSessionId())
                .isEqualTo("cs_reservation-" + confirmation.reservationId());
        assertThat(second).isEqualTo(Result.failure(ErrorKind.CONFLICT, "dates not available"));
        assertThat(backToBack.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("N concurrent overlapping checkouts: exactly one succeeds, the rest are conflicts")
    void concurrentCheckouts_exactlyOneWins() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(ATTEMPTS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Result<BookingConfirmation>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < ATTEMPTS; i++) {
                String email = "guest" + i + "@example.com";
                Callable<Result<BookingConfirmation>> attempt = () -> {
                    start.await();
                    return bookingService.checkout(villa, JUNE_1, JUNE_8, 1, email);
                };
                futures.add(executor.submit(attempt));
            }
            start.countDown();

            List<Result<BookingConfirmation>> results = new ArrayList<>();
            for (Future<Result<BookingConfirmation>> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }

            assertThat(results).filteredOn(Result::isSuccess).hasSize(1);
            assertThat(results).filteredOn(r -> !r.isSuccess())
                    .hasSize(ATTEMPTS - 1)
                    .allSatisfy(r -> assertThat(r).isEqualTo(Result.failure(ErrorKind.CONFLICT, "dates not available")));
            assertThat(reservationRepository.countOverlapping(
                    villa.id(), JUNE_1, JUNE_8, ReservationStatus.BLOCKING)).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("payment session failure leaves no reservation behind")
    void gatewayFailure_leavesNoRow() {
        when(paymentSessionFactory.createSession(any(PaymentSessionRequest.class)))
                .thenThrow(PaymentGatewayException.rejected(400, "payment gateway error (HTTP 400): Invalid currency"));

        Result<BookingConfirmation> result = bookingService.checkout(villa, JUNE_1, JUNE_4, 2, "a@example.com");

        assertThat(result).isEqualTo(Result.failure(ErrorKind.UPSTREAM_FAILURE,
                "payment gateway error (HTTP 400): Invalid currency"));
        assertThat(reservationRepository.count()).isZero();
    }
}
