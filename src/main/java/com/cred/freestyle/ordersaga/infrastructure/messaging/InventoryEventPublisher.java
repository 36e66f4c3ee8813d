package com.cred.freestyle.ordersaga.infrastructure.messaging;

import com.cred.freestyle.ordersaga.domain.event.EventTypes;
import com.cred.freestyle.ordersaga.domain.event.payload.StockCommittedPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.StockFailedPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.StockReleasedPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.StockReservedPayload;
import com.cred.freestyle.ordersaga.infrastructure.metrics.SagaMetricsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Publishes inventory.* events with source inventory_service.
 *
 * @author Order Saga Team
 */
@Component
public class InventoryEventPublisher extends EventPublisher {

    public InventoryEventPublisher(
            EventBus eventBus,
            ObjectMapper objectMapper,
            SagaMetricsService metricsService,
            @Value("${ordersaga.inventory.service-name:inventory_service}") String serviceName) {
        super(eventBus, objectMapper, metricsService, serviceName);
    }

    public boolean publishStockReserved(StockReservedPayload payload) {
        return publish(EventTypes.INVENTORY_RESERVED, payload);
    }

    public boolean publishStockCommitted(StockCommittedPayload payload) {
        return publish(EventTypes.INVENTORY_COMMITTED, payload);
    }

    public boolean publishStockReleased(StockReleasedPayload payload) {
        return publish(EventTypes.INVENTORY_RELEASED, payload);
    }

    public boolean publishStockFailed(StockFailedPayload payload) {
        return publish(EventTypes.INVENTORY_FAILED, payload);
    }
}
