package com.cred.freestyle.ordersaga.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics service for the saga participants.
 * Publishes custom metrics through Micrometer (CloudWatch when enabled).
 *
 * Key Metrics:
 * - Reservation and shipment transitions
 * - Handler outcomes per participant and event type
 * - Publish failures
 * - Shipping label latency
 *
 * @author Order Saga Team
 */
@Service
public class SagaMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(SagaMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "ordersaga.";
    private static final String INVENTORY_PREFIX = METRIC_PREFIX + "inventory.";
    private static final String FULFILLMENT_PREFIX = METRIC_PREFIX + "fulfillment.";
    private static final String EVENTS_PREFIX = METRIC_PREFIX + "events.";

    public SagaMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a reservation status transition.
     *
     * @param transition "created", "committed", "released" or "expired"
     */
    public void recordReservationTransition(String transition) {
        Counter.builder(INVENTORY_PREFIX + "reservation." + transition)
                .description("Reservation transitions")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded reservation transition: {}", transition);
    }

    /**
     * Record a shipment status transition.
     *
     * @param transition "prepared", "label_created" or "canceled"
     */
    public void recordShipmentTransition(String transition) {
        Counter.builder(FULFILLMENT_PREFIX + "shipment." + transition)
                .description("Shipment transitions")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded shipment transition: {}", transition);
    }

    /**
     * Record cancellation of a shipment whose label was already paid for.
     */
    public void recordShippingRefund() {
        Counter.builder(FULFILLMENT_PREFIX + "shipment.refund")
                .description("Shipments canceled after label purchase")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a label bought from the provider but never attached to a shipment,
     * because the shipment left CREATED while the label was being purchased.
     * Each one is a paid label that needs a manual void with the carrier.
     *
     * @param carrier Carrier that issued the label
     */
    public void recordOrphanedLabel(String carrier) {
        Counter.builder(FULFILLMENT_PREFIX + "label.orphaned")
                .tag("carrier", carrier == null ? "unknown" : carrier)
                .description("Purchased labels not recorded on any shipment")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an inbound event received by the dispatcher.
     *
     * @param subject Routing subject (source.type)
     */
    public void recordEventReceived(String subject) {
        Counter.builder(EVENTS_PREFIX + "received")
                .tag("subject", subject)
                .description("Inbound events received")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record the outcome of one participant handling one event.
     *
     * @param participant Participant name
     * @param eventType Event type
     * @param outcome Handler outcome
     */
    public void recordHandlerOutcome(String participant, String eventType, String outcome) {
        Counter.builder(EVENTS_PREFIX + "handled")
                .tag("participant", participant)
                .tag("event_type", eventType)
                .tag("outcome", outcome)
                .description("Handler outcomes")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an inbound event skipped because it was already processed.
     */
    public void recordDuplicateEvent(String subject) {
        Counter.builder(EVENTS_PREFIX + "duplicate")
                .tag("subject", subject)
                .description("Redelivered events skipped by the processed-event cache")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a failed outbound publish.
     *
     * @param eventType Event type that could not be published
     */
    public void recordPublishFailure(String eventType) {
        Counter.builder(EVENTS_PREFIX + "publish.failure")
                .tag("event_type", eventType)
                .description("Outbound events that could not be published")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded publish failure for event type: {}", eventType);
    }

    /**
     * Record shipping provider latency.
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordLabelLatency(long durationMs) {
        Timer.builder(FULFILLMENT_PREFIX + "label.latency")
                .description("Shipping label creation latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record error.
     *
     * @param errorType Error type (stable error code)
     * @param operation Operation that failed
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("System errors")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded error: {}, operation: {}", errorType, operation);
    }
}
