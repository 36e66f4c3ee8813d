package com.cred.freestyle.ordersaga.infrastructure.scheduler;

import com.cred.freestyle.ordersaga.domain.model.Reservation;
import com.cred.freestyle.ordersaga.domain.model.Reservation.ReservationStatus;
import com.cred.freestyle.ordersaga.infrastructure.metrics.SagaMetricsService;
import com.cred.freestyle.ordersaga.repository.ReservationRepository;
import com.cred.freestyle.ordersaga.service.inventory.InventoryParticipant;
import com.cred.freestyle.ordersaga.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ReservationExpiryScheduler.
 *
 * @author Order Saga Team
 */
@ExtendWith(MockitoExtension.class)
class ReservationExpirySchedulerTest {

    @Mock
    private ReservationRepository reservationRepository;

    @Mock
    private InventoryParticipant inventoryParticipant;

    @Mock
    private SagaMetricsService metricsService;

    private ReservationExpiryScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ReservationExpiryScheduler(reservationRepository, inventoryParticipant, metricsService);
        ReflectionTestUtils.setField(scheduler, "schedulerEnabled", true);
        ReflectionTestUtils.setField(scheduler, "batchSize", 50);
    }

    @Test
    @DisplayName("releaseExpiredReservations - Should expire each overdue reservation in one batch")
    void releaseExpired() {
        // Arrange
        Reservation first = TestDataBuilder.expiredReservation("o1");
        Reservation second = TestDataBuilder.expiredReservation("o2");
        when(reservationRepository.findExpiredReservations(eq(ReservationStatus.ACTIVE), any(Instant.class),
                any(Pageable.class))).thenReturn(List.of(first, second));
        when(inventoryParticipant.expireReservation(first)).thenReturn(true);
        when(inventoryParticipant.expireReservation(second)).thenReturn(false);

        // Act
        scheduler.releaseExpiredReservations();

        // Assert
        verify(inventoryParticipant).expireReservation(first);
        verify(inventoryParticipant).expireReservation(second);
        verify(reservationRepository).findExpiredReservations(eq(ReservationStatus.ACTIVE), any(Instant.class),
                argThat(page -> page.getPageSize() == 50));
    }

    @Test
    @DisplayName("releaseExpiredReservations - One reservation throws: Should continue with the rest")
    void releaseExpired_PerItemFailure() {
        // Arrange
        Reservation first = TestDataBuilder.expiredReservation("o1");
        Reservation second = TestDataBuilder.expiredReservation("o2");
        when(reservationRepository.findExpiredReservations(any(), any(), any())).thenReturn(List.of(first, second));
        when(inventoryParticipant.expireReservation(first)).thenThrow(new IllegalStateException("boom"));
        when(inventoryParticipant.expireReservation(second)).thenReturn(true);

        // Act
        scheduler.releaseExpiredReservations();

        // Assert
        verify(inventoryParticipant).expireReservation(second);
        verify(metricsService).recordError("RESERVATION_EXPIRY_PROCESSING_ERROR", "releaseExpiredReservations");
    }

    @Test
    @DisplayName("releaseExpiredReservations - Query fails: Should record a scheduler error")
    void releaseExpired_QueryFailure() {
        when(reservationRepository.findExpiredReservations(any(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        scheduler.releaseExpiredReservations();

        verify(metricsService).recordError("RESERVATION_EXPIRY_SCHEDULER_ERROR", "releaseExpiredReservations");
        verifyNoInteractions(inventoryParticipant);
    }

    @Test
    @DisplayName("releaseExpiredReservations - Disabled: Should not query")
    void releaseExpired_Disabled() {
        ReflectionTestUtils.setField(scheduler, "schedulerEnabled", false);

        scheduler.releaseExpiredReservations();

        verifyNoInteractions(reservationRepository, inventoryParticipant);
    }

    @Test
    @DisplayName("triggerSweepNow - Should return the number released")
    void triggerSweepNow() {
        Reservation first = TestDataBuilder.expiredReservation("o1");
        Reservation second = TestDataBuilder.expiredReservation("o2");
        when(reservationRepository.findExpiredReservations(any(), any(), any())).thenReturn(List.of(first, second));
        when(inventoryParticipant.expireReservation(first)).thenReturn(true);
        when(inventoryParticipant.expireReservation(second)).thenReturn(false);

        assertThat(scheduler.triggerSweepNow()).isEqualTo(1);
    }
}
