package com.cred.freestyle.ordersaga.repository;

import com.cred.freestyle.ordersaga.domain.model.Reservation;
import com.cred.freestyle.ordersaga.domain.model.Reservation.ReservationStatus;
import com.cred.freestyle.ordersaga.domain.model.ReservedItem;
import com.cred.freestyle.ordersaga.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the conditional transitions against a real PostgreSQL database.
 * Each repository call commits on its own, so racing threads see each other's writes.
 */
@DataJpaTest
@Testcontainers
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("ReservationRepository Integration Tests")
class ReservationRepositoryIT {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("ordersaga_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private ReservationRepository reservationRepository;

    @BeforeEach
    void setUp() {
        reservationRepository.deleteAll();
    }

    @RepeatedTest(5)
    @DisplayName("commit vs release - Concurrent: Exactly one transition wins")
    void commitAndReleaseRace() throws Exception {
        // Given
        Reservation active = reservationRepository.saveAndFlush(TestDataBuilder.activeReservation("order-race"));
        String reservationId = active.getReservationId();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        Callable<Integer> commit = () -> {
            start.await();
            return reservationRepository.commit(reservationId, Instant.now());
        };
        Callable<Integer> release = () -> {
            start.await();
            return reservationRepository.release(reservationId, Instant.now(), "customer_request");
        };

        // When
        Future<Integer> committed = executor.submit(commit);
        Future<Integer> released = executor.submit(release);
        start.countDown();
        int commitRows = committed.get(10, TimeUnit.SECONDS);
        int releaseRows = released.get(10, TimeUnit.SECONDS);
        executor.shutdown();

        // Then
        assertThat(commitRows + releaseRows).isEqualTo(1);
        Reservation found = reservationRepository.findById(reservationId).orElseThrow();
        assertThat(found.getStatus())
                .isEqualTo(commitRows == 1 ? ReservationStatus.COMMITTED : ReservationStatus.RELEASED);
        assertThat(found.getActiveOrderKey()).isNull();
    }

    @Test
    @DisplayName("save - Second ACTIVE reservation for an order: Should violate the unique active key")
    void secondActiveReservationRejected() {
        reservationRepository.saveAndFlush(TestDataBuilder.activeReservation("order-dup"));

        Reservation duplicate = TestDataBuilder.activeReservation("order-dup");
        duplicate.setReservationId(null);

        assertThatThrownBy(() -> reservationRepository.saveAndFlush(duplicate))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("save - 200-line order: Should store and read back every item")
    void largeItemListRoundTrip() {
        Reservation reservation = TestDataBuilder.activeReservation("order-large");
        List<ReservedItem> items = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            items.add(new ReservedItem(String.format("SKU-WAREHOUSE-EAST-%04d", i), 1, new BigDecimal("19.99")));
        }
        reservation.setItems(items);

        reservationRepository.saveAndFlush(reservation);

        assertThat(reservationRepository.findActiveByOrderId("order-large").orElseThrow().getItems())
                .hasSize(200)
                .last()
                .satisfies(item -> assertThat(item.getSkuId()).isEqualTo("SKU-WAREHOUSE-EAST-0199"));
    }
}
