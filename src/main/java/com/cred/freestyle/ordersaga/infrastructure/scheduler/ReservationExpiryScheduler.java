package com.cred.freestyle.ordersaga.infrastructure.scheduler;

import com.cred.freestyle.ordersaga.domain.model.Reservation;
import com.cred.freestyle.ordersaga.domain.model.Reservation.ReservationStatus;
import com.cred.freestyle.ordersaga.infrastructure.metrics.SagaMetricsService;
import com.cred.freestyle.ordersaga.repository.ReservationRepository;
import com.cred.freestyle.ordersaga.service.inventory.InventoryParticipant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Scheduled job releasing ACTIVE reservations whose hold has elapsed.
 *
 * This scheduler:
 * 1. Runs every 30 seconds (configurable)
 * 2. Finds ACTIVE reservations where expires_at < NOW() (one batch per run)
 * 3. Releases each with reason reservation_expired through the inventory participant
 * 4. The participant publishes inventory.released
 *
 * A reservation committed between the query and the release is left alone:
 * the conditional release affects zero rows.
 *
 * @author Order Saga Team
 */
@Service
public class ReservationExpiryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ReservationExpiryScheduler.class);

    private final ReservationRepository reservationRepository;
    private final InventoryParticipant inventoryParticipant;
    private final SagaMetricsService metricsService;

    @Value("${ordersaga.inventory.expiry-sweeper.enabled:true}")
    private boolean schedulerEnabled;

    @Value("${ordersaga.inventory.expiry-sweeper.batch-size:100}")
    private int batchSize;

    public ReservationExpiryScheduler(
            ReservationRepository reservationRepository,
            InventoryParticipant inventoryParticipant,
            SagaMetricsService metricsService
    ) {
        this.reservationRepository = reservationRepository;
        this.inventoryParticipant = inventoryParticipant;
        this.metricsService = metricsService;
    }

    /**
     * Scheduled sweep for expired reservations.
     * Fixed delay: the next run starts the configured interval after the previous one completes.
     */
    @Scheduled(fixedDelayString = "${ordersaga.inventory.expiry-sweeper.interval-ms:30000}")
    public void releaseExpiredReservations() {
        if (!schedulerEnabled) {
            logger.debug("Reservation expiry sweeper is disabled");
            return;
        }

        long startTime = System.currentTimeMillis();

        try {
            List<Reservation> expiredReservations = findExpired(Instant.now());

            if (expiredReservations.isEmpty()) {
                logger.debug("No expired reservations found");
                return;
            }

            logger.info("Found {} expired reservations to release", expiredReservations.size());

            int releasedCount = 0;
            int skippedCount = 0;
            int failedCount = 0;

            for (Reservation reservation : expiredReservations) {
                try {
                    if (inventoryParticipant.expireReservation(reservation)) {
                        releasedCount++;
                    } else {
                        skippedCount++;
                    }
                } catch (Exception e) {
                    logger.error("Error releasing expired reservation: {}", reservation.getReservationId(), e);
                    failedCount++;
                    metricsService.recordError("RESERVATION_EXPIRY_PROCESSING_ERROR", "releaseExpiredReservations");
                }
            }

            long duration = System.currentTimeMillis() - startTime;
            logger.info("Expiry sweep completed: {} released, {} already settled, {} failed, duration: {}ms",
                    releasedCount, skippedCount, failedCount, duration);

        } catch (Exception e) {
            logger.error("Error in reservation expiry sweeper", e);
            metricsService.recordError("RESERVATION_EXPIRY_SCHEDULER_ERROR", "releaseExpiredReservations");
        }
    }

    /**
     * Manual trigger for a sweep (admin operation, used for testing).
     *
     * @return Number of reservations released
     */
    public int triggerSweepNow() {
        logger.info("Manual expiry sweep triggered");

        int released = 0;
        for (Reservation reservation : findExpired(Instant.now())) {
            try {
                if (inventoryParticipant.expireReservation(reservation)) {
                    released++;
                }
            } catch (Exception e) {
                logger.error("Error releasing reservation: {}", reservation.getReservationId(), e);
            }
        }

        logger.info("Manual expiry sweep completed: {} reservations released", released);
        return released;
    }

    private List<Reservation> findExpired(Instant now) {
        return reservationRepository.findExpiredReservations(
                ReservationStatus.ACTIVE, now, PageRequest.of(0, batchSize));
    }
}
