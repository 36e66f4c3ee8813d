package com.cred.freestyle.ordersaga.infrastructure.messaging;

import com.cred.freestyle.ordersaga.domain.event.DomainEvent;
import com.cred.freestyle.ordersaga.infrastructure.metrics.SagaMetricsService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Best-effort publisher of a participant's outbound events.
 *
 * Local state is the system of record: a failed publish is logged as a
 * warning and counted, never propagated to the handler that triggered it.
 *
 * @author Order Saga Team
 */
public abstract class EventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final EventBus eventBus;
    private final ObjectMapper objectMapper;
    private final SagaMetricsService metricsService;
    private final String source;

    protected EventPublisher(EventBus eventBus, ObjectMapper objectMapper,
                             SagaMetricsService metricsService, String source) {
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    /**
     * Wrap a payload in a new event and hand it to the bus.
     *
     * @param type Event type
     * @param payload Typed payload record
     * @return true if the bus accepted the event, false if it could not be built or sent
     */
    protected boolean publish(String type, Object payload) {
        DomainEvent event;
        try {
            Map<String, Object> data = objectMapper.convertValue(payload, MAP_TYPE);
            event = DomainEvent.of(type, source, data);
        } catch (IllegalArgumentException e) {
            logger.warn("Failed to build {} event from {}", type, payload, e);
            metricsService.recordPublishFailure(type);
            return false;
        }

        try {
            CompletableFuture<Void> future = eventBus.publish(event);
            future.whenComplete((ignored, ex) -> {
                if (ex != null) {
                    logger.warn("Failed to publish {} for order {}: {}",
                            event.getSubject(), event.getOrderId(), ex.getMessage());
                    metricsService.recordPublishFailure(type);
                } else {
                    logger.info("Published {} for order {}", event.getSubject(), event.getOrderId());
                }
            });
            return true;
        } catch (RuntimeException e) {
            logger.warn("Failed to publish {} for order {}: {}",
                    event.getSubject(), event.getOrderId(), e.getMessage());
            metricsService.recordPublishFailure(type);
            return false;
        }
    }
}
