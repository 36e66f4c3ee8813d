package com.cred.freestyle.ordersaga.service.fulfillment;

import com.cred.freestyle.ordersaga.domain.event.payload.LabelCreatedPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.LineItemPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.ShipmentCanceledPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.ShipmentFailedPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.ShipmentPreparedPayload;
import com.cred.freestyle.ordersaga.domain.model.Shipment;
import com.cred.freestyle.ordersaga.domain.model.Shipment.ShipmentStatus;
import com.cred.freestyle.ordersaga.domain.model.ShipmentItem;
import com.cred.freestyle.ordersaga.exception.FulfillmentProviderException;
import com.cred.freestyle.ordersaga.infrastructure.messaging.FulfillmentEventPublisher;
import com.cred.freestyle.ordersaga.infrastructure.metrics.SagaMetricsService;
import com.cred.freestyle.ordersaga.infrastructure.provider.FulfillmentProvider;
import com.cred.freestyle.ordersaga.infrastructure.provider.ShippingLabel;
import com.cred.freestyle.ordersaga.repository.ShipmentRepository;
import com.cred.freestyle.ordersaga.saga.HandlerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fulfillment participant of the order saga.
 *
 * Shipment flow:
 * 1. tax.calculated: prepare a CREATED shipment with weights and address
 * 2. payment.completed: buy a label from the shipping provider (CREATED to LABEL_PURCHASED)
 * 3. order.canceled: cancel the shipment, flagging a shipping refund when a label was bought
 *
 * Events may arrive in any order. A payment or cancel for an order without a
 * shipment is a no-op; a second delivery of any event is a no-op.
 *
 * @author Order Saga Team
 */
@Service
public class FulfillmentParticipant {

    private static final Logger logger = LoggerFactory.getLogger(FulfillmentParticipant.class);

    public static final String PREPARATION_ERROR = "PREPARATION_ERROR";
    public static final String LABEL_CREATION_ERROR = "LABEL_CREATION_ERROR";
    public static final String CANCELLATION_ERROR = "CANCELLATION_ERROR";

    private static final int MAX_CANCEL_ATTEMPTS = 3;

    private final ShipmentRepository shipmentRepository;
    private final FulfillmentProvider fulfillmentProvider;
    private final FulfillmentEventPublisher eventPublisher;
    private final SagaMetricsService metricsService;
    private final int defaultItemWeightGrams;

    public FulfillmentParticipant(
            ShipmentRepository shipmentRepository,
            FulfillmentProvider fulfillmentProvider,
            FulfillmentEventPublisher eventPublisher,
            SagaMetricsService metricsService,
            @Value("${ordersaga.fulfillment.default-item-weight-grams:500}") int defaultItemWeightGrams) {
        this.shipmentRepository = shipmentRepository;
        this.fulfillmentProvider = fulfillmentProvider;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.defaultItemWeightGrams = defaultItemWeightGrams;
    }

    /**
     * Prepare a shipment once taxes are known.
     *
     * @param orderId Order ID
     * @param userId User ID
     * @param shippingAddress Destination address
     * @param items Order lines; when empty a single placeholder line is shipped
     * @param sourceEvent Type of the triggering event
     * @return APPLIED with the shipment id, SKIPPED if the order already has a shipment,
     *         FAILED with PREPARATION_ERROR on persistence failure
     */
    public HandlerResult handleTaxCalculated(String orderId, String userId, Map<String, Object> shippingAddress,
                                             List<LineItemPayload> items, String sourceEvent) {
        logger.info("Preparing shipment for order {}", orderId);

        try {
            Optional<Shipment> existing = shipmentRepository.findByOrderId(orderId);
            if (existing.isPresent()) {
                logger.info("Order {} already has shipment {} in status {}, skipping",
                        orderId, existing.get().getShipmentId(), existing.get().getStatus());
                return HandlerResult.skipped(existing.get().getShipmentId(), "shipment already exists");
            }

            List<ShipmentItem> shipmentItems = toShipmentItems(items);
            if (shipmentItems.isEmpty()) {
                logger.info("No items for order {}, shipping a placeholder line", orderId);
                shipmentItems.add(ShipmentItem.placeholder(defaultItemWeightGrams));
            }

            Shipment shipment = Shipment.builder()
                    .orderId(orderId)
                    .userId(userId)
                    .items(shipmentItems)
                    .shippingAddress(shippingAddress == null ? new LinkedHashMap<>() : new LinkedHashMap<>(shippingAddress))
                    .status(ShipmentStatus.CREATED)
                    .createdAt(Instant.now())
                    .metadata(metadata(sourceEvent))
                    .build();

            int estimatedWeightGrams = shipment.getEstimatedWeightGrams();

            Shipment saved;
            try {
                saved = shipmentRepository.saveAndFlush(shipment);
            } catch (DataIntegrityViolationException e) {
                // Only a row for the order proves another delivery won the insert
                Optional<Shipment> winner = shipmentRepository.findByOrderId(orderId);
                if (winner.isEmpty()) {
                    throw e;
                }
                logger.info("Concurrent shipment {} already exists for order {}, skipping",
                        winner.get().getShipmentId(), orderId);
                return HandlerResult.skipped(winner.get().getShipmentId(), "shipment created concurrently");
            }

            metricsService.recordShipmentTransition("prepared");
            logger.info("Shipment {} prepared for order {}, estimated weight {}g",
                    saved.getShipmentId(), orderId, estimatedWeightGrams);

            eventPublisher.publishShipmentPrepared(new ShipmentPreparedPayload(
                    orderId, userId, saved.getShipmentId(), saved.getItems(), estimatedWeightGrams,
                    saved.getShippingAddress(), metadata(sourceEvent)));
            return HandlerResult.applied(saved.getShipmentId());

        } catch (ArithmeticException e) {
            // Redelivery computes the same weights, so this failure is final
            logger.error("Shipment weight for order {} exceeds the supported range", orderId);
            metricsService.recordError(PREPARATION_ERROR, "prepare");
            eventPublisher.publishShipmentFailed(new ShipmentFailedPayload(
                    orderId, userId, null, PREPARATION_ERROR, "shipment weight out of range", metadata(sourceEvent)));
            return HandlerResult.failed(PREPARATION_ERROR, "shipment weight out of range");
        } catch (RuntimeException e) {
            logger.error("Failed to prepare shipment for order {}", orderId, e);
            metricsService.recordError(PREPARATION_ERROR, "prepare");
            eventPublisher.publishShipmentFailed(new ShipmentFailedPayload(
                    orderId, userId, null, PREPARATION_ERROR, e.getMessage(), metadata(sourceEvent)));
            return HandlerResult.retryableFailure(null, PREPARATION_ERROR, e.getMessage());
        }
    }

    /**
     * Buy a shipping label once the order is paid.
     *
     * @param orderId Order ID
     * @param userId User ID (may be null; the shipment's user is used then)
     * @param sourceEvent Type of the triggering event
     * @return APPLIED if this call purchased the label, SKIPPED when there is nothing to do,
     *         FAILED with LABEL_CREATION_ERROR when the provider or store failed
     */
    public HandlerResult handlePaymentCompleted(String orderId, String userId, String sourceEvent) {
        Shipment shipment = null;
        try {
            Optional<Shipment> existing = shipmentRepository.findByOrderId(orderId);
            if (existing.isEmpty()) {
                logger.info("No shipment for order {} on payment, nothing to label", orderId);
                return HandlerResult.skipped("no shipment");
            }

            shipment = existing.get();
            if (shipment.getStatus() != ShipmentStatus.CREATED) {
                logger.info("Shipment {} for order {} is {}, label not purchased",
                        shipment.getShipmentId(), orderId, shipment.getStatus());
                return HandlerResult.skipped(shipment.getShipmentId(), "shipment is " + shipment.getStatus());
            }

            long start = System.currentTimeMillis();
            ShippingLabel label = fulfillmentProvider.createShipment(shipment);
            metricsService.recordLabelLatency(System.currentTimeMillis() - start);

            Instant now = Instant.now();
            int updated = shipmentRepository.purchaseLabel(shipment.getShipmentId(), label.carrier(),
                    label.trackingNumber(), label.labelUrl(), now);
            if (updated == 0) {
                logger.warn("Shipment {} left CREATED while label {} ({}) was being purchased, "
                                + "label not recorded and must be voided with the carrier",
                        shipment.getShipmentId(), label.trackingNumber(), label.carrier());
                metricsService.recordOrphanedLabel(label.carrier());
                return HandlerResult.skipped(shipment.getShipmentId(), "shipment no longer created");
            }

            metricsService.recordShipmentTransition("label_created");
            logger.info("Label purchased for shipment {} (order {}): {} {}",
                    shipment.getShipmentId(), orderId, label.carrier(), label.trackingNumber());

            eventPublisher.publishLabelCreated(new LabelCreatedPayload(
                    orderId, userIdOr(userId, shipment), shipment.getShipmentId(), label.carrier(),
                    label.trackingNumber(), label.labelUrl(), label.estimatedDelivery(), metadata(sourceEvent)));
            return HandlerResult.applied(shipment.getShipmentId());

        } catch (FulfillmentProviderException e) {
            logger.error("Shipping provider failed for order {}: {}", orderId, e.getMessage());
            return labelFailure(orderId, userId, shipment, e, sourceEvent);
        } catch (RuntimeException e) {
            logger.error("Failed to purchase label for order {}", orderId, e);
            return labelFailure(orderId, userId, shipment, e, sourceEvent);
        }
    }

    /**
     * Cancel the order's shipment.
     *
     * @param orderId Order ID
     * @param userId User ID (may be null; the shipment's user is used then)
     * @param reason Cancellation reason
     * @param sourceEvent Type of the triggering event
     * @return APPLIED if this call canceled the shipment, SKIPPED when already canceled,
     *         absent or past the point of cancellation
     */
    public HandlerResult handleOrderCanceled(String orderId, String userId, String reason, String sourceEvent) {
        try {
            // A label purchase racing with the cancel changes the status under us; re-read and retry
            for (int attempt = 1; attempt <= MAX_CANCEL_ATTEMPTS; attempt++) {
                Optional<Shipment> existing = shipmentRepository.findByOrderId(orderId);
                if (existing.isEmpty()) {
                    logger.info("No shipment for order {} on cancel, nothing to cancel", orderId);
                    return HandlerResult.skipped("no shipment");
                }

                Shipment shipment = existing.get();
                ShipmentStatus current = shipment.getStatus();
                if (current == ShipmentStatus.CANCELED) {
                    logger.info("Shipment {} for order {} already canceled", shipment.getShipmentId(), orderId);
                    return HandlerResult.skipped(shipment.getShipmentId(), "already canceled");
                }
                if (!current.canTransitionTo(ShipmentStatus.CANCELED)) {
                    logger.warn("Shipment {} for order {} is {} and can no longer be canceled",
                            shipment.getShipmentId(), orderId, current);
                    return HandlerResult.skipped(shipment.getShipmentId(), "shipment is " + current);
                }

                boolean refundShipping = current == ShipmentStatus.LABEL_PURCHASED;
                Instant now = Instant.now();
                int updated = shipmentRepository.cancel(shipment.getShipmentId(), current, reason, now);
                if (updated == 0) {
                    logger.info("Shipment {} changed status during cancel (attempt {}), retrying",
                            shipment.getShipmentId(), attempt);
                    continue;
                }

                metricsService.recordShipmentTransition("canceled");
                if (refundShipping) {
                    metricsService.recordShippingRefund();
                }
                logger.info("Shipment {} canceled for order {}, reason: {}, refund shipping: {}",
                        shipment.getShipmentId(), orderId, reason, refundShipping);

                eventPublisher.publishShipmentCanceled(new ShipmentCanceledPayload(
                        orderId, userIdOr(userId, shipment), shipment.getShipmentId(), reason, refundShipping,
                        metadata(sourceEvent)));
                return HandlerResult.applied(shipment.getShipmentId());
            }

            logger.warn("Gave up canceling shipment for order {} after {} attempts", orderId, MAX_CANCEL_ATTEMPTS);
            return HandlerResult.retryableFailure(null, CANCELLATION_ERROR, "shipment status kept changing");

        } catch (RuntimeException e) {
            logger.error("Failed to cancel shipment for order {}", orderId, e);
            metricsService.recordError(CANCELLATION_ERROR, "cancel");
            eventPublisher.publishShipmentFailed(new ShipmentFailedPayload(
                    orderId, userId, null, CANCELLATION_ERROR, e.getMessage(), metadata(sourceEvent)));
            return HandlerResult.retryableFailure(null, CANCELLATION_ERROR, e.getMessage());
        }
    }

    private HandlerResult labelFailure(String orderId, String userId, Shipment shipment, RuntimeException e,
                                       String sourceEvent) {
        String shipmentId = shipment == null ? null : shipment.getShipmentId();
        metricsService.recordError(LABEL_CREATION_ERROR, "label");
        eventPublisher.publishShipmentFailed(new ShipmentFailedPayload(
                orderId, shipment == null ? userId : userIdOr(userId, shipment), shipmentId,
                LABEL_CREATION_ERROR, e.getMessage(), metadata(sourceEvent)));
        return HandlerResult.retryableFailure(shipmentId, LABEL_CREATION_ERROR, e.getMessage());
    }

    /**
     * Line weight is the unit weight (default when unspecified) times quantity.
     *
     * @throws ArithmeticException if a line weight does not fit in an int
     */
    List<ShipmentItem> toShipmentItems(List<LineItemPayload> items) {
        List<ShipmentItem> shipmentItems = new ArrayList<>();
        if (items == null) {
            return shipmentItems;
        }
        for (LineItemPayload item : items) {
            if (item == null) {
                continue;
            }
            String sku = item.resolvedSku();
            if (sku == null) {
                logger.debug("Dropping shipment line without SKU: {}", item);
                continue;
            }
            int quantity = item.resolvedQuantity();
            int unitWeight = item.weightGrams() != null && item.weightGrams() > 0
                    ? item.weightGrams()
                    : defaultItemWeightGrams;
            shipmentItems.add(new ShipmentItem(sku, quantity, Math.multiplyExact(unitWeight, quantity)));
        }
        return shipmentItems;
    }

    private static String userIdOr(String userId, Shipment shipment) {
        return userId != null ? userId : shipment.getUserId();
    }

    private static Map<String, Object> metadata(String sourceEvent) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source_event", sourceEvent);
        return metadata;
    }
}
