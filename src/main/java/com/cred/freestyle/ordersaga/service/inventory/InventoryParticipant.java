package com.cred.freestyle.ordersaga.service.inventory;

import com.cred.freestyle.ordersaga.domain.event.payload.LineItemPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.StockCommittedPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.StockFailedPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.StockReleasedPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.StockReservedPayload;
import com.cred.freestyle.ordersaga.domain.model.Reservation;
import com.cred.freestyle.ordersaga.domain.model.Reservation.ReservationStatus;
import com.cred.freestyle.ordersaga.domain.model.ReservedItem;
import com.cred.freestyle.ordersaga.infrastructure.messaging.InventoryEventPublisher;
import com.cred.freestyle.ordersaga.infrastructure.metrics.SagaMetricsService;
import com.cred.freestyle.ordersaga.repository.ReservationRepository;
import com.cred.freestyle.ordersaga.saga.HandlerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Inventory participant of the order saga.
 *
 * Reservation flow:
 * 1. order.created: place an ACTIVE hold on the order's items
 * 2. payment.completed: commit the hold (ACTIVE to COMMITTED)
 * 3. order.canceled or hold expiry: release the hold (ACTIVE to RELEASED)
 *
 * Every operation is idempotent. Transitions are conditional updates on the
 * ACTIVE status, so a redelivered or concurrent event can never move a
 * reservation twice or revert a terminal state.
 *
 * No operation here opens a surrounding transaction: each store read and
 * conditional write commits on its own, and the follow-up event is published
 * only after the write succeeded.
 *
 * @author Order Saga Team
 */
@Service
public class InventoryParticipant {

    private static final Logger logger = LoggerFactory.getLogger(InventoryParticipant.class);

    public static final String NO_VALID_ITEMS = "NO_VALID_ITEMS";
    public static final String RESERVATION_ERROR = "RESERVATION_ERROR";
    public static final String EXPIRED_REASON = "reservation_expired";
    static final String EXPIRY_SOURCE_EVENT = "reservation.expired";

    private final ReservationRepository reservationRepository;
    private final InventoryEventPublisher eventPublisher;
    private final SagaMetricsService metricsService;
    private final long reservationTtlMinutes;

    public InventoryParticipant(
            ReservationRepository reservationRepository,
            InventoryEventPublisher eventPublisher,
            SagaMetricsService metricsService,
            @Value("${ordersaga.inventory.reservation-ttl-minutes:30}") long reservationTtlMinutes) {
        this.reservationRepository = reservationRepository;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.reservationTtlMinutes = reservationTtlMinutes;
    }

    /**
     * Reserve stock for a newly created order.
     *
     * @param orderId Order ID
     * @param userId User ID
     * @param items Order lines as sent by the order service
     * @param sourceEvent Type of the triggering event, copied into outbound metadata
     * @return APPLIED with the reservation id, SKIPPED if the order already holds
     *         or consumed a reservation, FAILED on NO_VALID_ITEMS or RESERVATION_ERROR
     */
    public HandlerResult handleOrderCreated(String orderId, String userId, List<LineItemPayload> items,
                                            String sourceEvent) {
        logger.info("Reserving stock for order {}, user {}", orderId, userId);

        try {
            Optional<Reservation> existing = reservationRepository.findActiveOrCommittedByOrderId(orderId);
            if (existing.isPresent()) {
                logger.info("Order {} already has reservation {} in status {}, skipping",
                        orderId, existing.get().getReservationId(), existing.get().getStatus());
                return HandlerResult.skipped(existing.get().getReservationId(), "reservation already exists");
            }

            List<ReservedItem> reservedItems = resolveItems(items);
            if (reservedItems.isEmpty()) {
                logger.warn("Order {} has no item with a resolvable SKU, nothing reserved", orderId);
                metricsService.recordError(NO_VALID_ITEMS, "reserve");
                eventPublisher.publishStockFailed(new StockFailedPayload(
                        orderId, userId, NO_VALID_ITEMS, "No items with sku_id, product_id or id",
                        metadata(sourceEvent)));
                return HandlerResult.failed(NO_VALID_ITEMS, "no valid items");
            }

            Instant now = Instant.now();
            Reservation reservation = Reservation.builder()
                    .orderId(orderId)
                    .userId(userId)
                    .items(reservedItems)
                    .status(ReservationStatus.ACTIVE)
                    .createdAt(now)
                    .expiresAt(now.plus(Duration.ofMinutes(reservationTtlMinutes)))
                    .metadata(metadata(sourceEvent))
                    .build();

            Reservation saved;
            try {
                saved = reservationRepository.saveAndFlush(reservation);
            } catch (DataIntegrityViolationException e) {
                // Only a row for the order proves another delivery won the insert
                Optional<Reservation> winner = reservationRepository.findActiveOrCommittedByOrderId(orderId);
                if (winner.isEmpty()) {
                    throw e;
                }
                logger.info("Concurrent reservation {} already exists for order {}, skipping",
                        winner.get().getReservationId(), orderId);
                return HandlerResult.skipped(winner.get().getReservationId(), "reservation created concurrently");
            }

            metricsService.recordReservationTransition("created");
            logger.info("Reservation {} created for order {}, {} units across {} lines, expires at {}",
                    saved.getReservationId(), orderId, saved.getTotalQuantity(), reservedItems.size(),
                    saved.getExpiresAt());

            eventPublisher.publishStockReserved(new StockReservedPayload(
                    orderId, userId, saved.getReservationId(), saved.getItems(), saved.getExpiresAt(),
                    metadata(sourceEvent)));
            return HandlerResult.applied(saved.getReservationId());

        } catch (RuntimeException e) {
            logger.error("Failed to reserve stock for order {}", orderId, e);
            metricsService.recordError(RESERVATION_ERROR, "reserve");
            eventPublisher.publishStockFailed(new StockFailedPayload(
                    orderId, userId, RESERVATION_ERROR, e.getMessage(), metadata(sourceEvent)));
            return HandlerResult.retryableFailure(null, RESERVATION_ERROR, e.getMessage());
        }
    }

    /**
     * Commit the order's ACTIVE reservation after payment.
     *
     * @param orderId Order ID
     * @param userId User ID (may be null; the reservation's user is used then)
     * @param sourceEvent Type of the triggering event
     * @return APPLIED if this call committed the reservation, SKIPPED otherwise
     */
    public HandlerResult handlePaymentCompleted(String orderId, String userId, String sourceEvent) {
        try {
            Optional<Reservation> active = reservationRepository.findActiveByOrderId(orderId);
            if (active.isEmpty()) {
                logger.info("No active reservation for order {} on payment, nothing to commit", orderId);
                return HandlerResult.skipped("no active reservation");
            }

            Reservation reservation = active.get();
            Instant now = Instant.now();
            int updated = reservationRepository.commit(reservation.getReservationId(), now);
            if (updated == 0) {
                logger.info("Reservation {} for order {} left ACTIVE concurrently, commit skipped",
                        reservation.getReservationId(), orderId);
                return HandlerResult.skipped(reservation.getReservationId(), "reservation no longer active");
            }

            metricsService.recordReservationTransition("committed");
            logger.info("Reservation {} committed for order {}", reservation.getReservationId(), orderId);

            eventPublisher.publishStockCommitted(new StockCommittedPayload(
                    orderId, userIdOr(userId, reservation), reservation.getReservationId(),
                    reservation.getItems(), now, metadata(sourceEvent)));
            return HandlerResult.applied(reservation.getReservationId());

        } catch (RuntimeException e) {
            logger.error("Failed to commit reservation for order {}", orderId, e);
            metricsService.recordError(RESERVATION_ERROR, "commit");
            eventPublisher.publishStockFailed(new StockFailedPayload(
                    orderId, userId, RESERVATION_ERROR, e.getMessage(), metadata(sourceEvent)));
            return HandlerResult.retryableFailure(null, RESERVATION_ERROR, e.getMessage());
        }
    }

    /**
     * Release the order's ACTIVE reservation. A committed reservation is never reverted.
     *
     * @param orderId Order ID
     * @param userId User ID (may be null; only used when the release itself fails)
     * @param reason Cancellation reason, carried on inventory.released
     * @param sourceEvent Type of the triggering event
     * @return APPLIED if this call released the reservation, SKIPPED otherwise
     */
    public HandlerResult handleOrderCanceled(String orderId, String userId, String reason, String sourceEvent) {
        try {
            Optional<Reservation> active = reservationRepository.findActiveByOrderId(orderId);
            if (active.isEmpty()) {
                logger.info("No active reservation for order {} on cancel, nothing to release", orderId);
                return HandlerResult.skipped("no active reservation");
            }
            return release(active.get(), reason, sourceEvent);

        } catch (RuntimeException e) {
            logger.error("Failed to release reservation for order {}", orderId, e);
            metricsService.recordError(RESERVATION_ERROR, "release");
            eventPublisher.publishStockFailed(new StockFailedPayload(
                    orderId, userId, RESERVATION_ERROR, e.getMessage(), metadata(sourceEvent)));
            return HandlerResult.retryableFailure(null, RESERVATION_ERROR, e.getMessage());
        }
    }

    /**
     * Release a reservation whose hold elapsed. Called by the expiry sweeper.
     *
     * @param reservation Expired ACTIVE reservation
     * @return true if this call released it, false if it had already left ACTIVE
     */
    public boolean expireReservation(Reservation reservation) {
        HandlerResult result = release(reservation, EXPIRED_REASON, EXPIRY_SOURCE_EVENT);
        if (result.getOutcome() == HandlerResult.Outcome.APPLIED) {
            metricsService.recordReservationTransition("expired");
            return true;
        }
        return false;
    }

    private HandlerResult release(Reservation reservation, String reason, String sourceEvent) {
        Instant now = Instant.now();
        int updated = reservationRepository.release(reservation.getReservationId(), now, reason);
        if (updated == 0) {
            logger.info("Reservation {} for order {} left ACTIVE concurrently, release skipped",
                    reservation.getReservationId(), reservation.getOrderId());
            return HandlerResult.skipped(reservation.getReservationId(), "reservation no longer active");
        }

        metricsService.recordReservationTransition("released");
        logger.info("Reservation {} released for order {}, reason: {}",
                reservation.getReservationId(), reservation.getOrderId(), reason);

        eventPublisher.publishStockReleased(new StockReleasedPayload(
                reservation.getOrderId(), reservation.getUserId(), reservation.getReservationId(),
                reservation.getItems(), reason, now, metadata(sourceEvent)));
        return HandlerResult.applied(reservation.getReservationId());
    }

    /**
     * Keep lines whose SKU resolves from sku_id, product_id or id.
     */
    static List<ReservedItem> resolveItems(List<LineItemPayload> items) {
        List<ReservedItem> resolved = new ArrayList<>();
        if (items == null) {
            return resolved;
        }
        for (LineItemPayload item : items) {
            if (item == null) {
                continue;
            }
            String sku = item.resolvedSku();
            if (sku == null) {
                logger.debug("Dropping order line without SKU: {}", item);
                continue;
            }
            resolved.add(ReservedItem.builder()
                    .skuId(sku)
                    .quantity(item.resolvedQuantity())
                    .unitPrice(item.unitPrice())
                    .build());
        }
        return resolved;
    }

    private static String userIdOr(String userId, Reservation reservation) {
        return userId != null ? userId : reservation.getUserId();
    }

    private static Map<String, Object> metadata(String sourceEvent) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source_event", sourceEvent);
        return metadata;
    }
}
