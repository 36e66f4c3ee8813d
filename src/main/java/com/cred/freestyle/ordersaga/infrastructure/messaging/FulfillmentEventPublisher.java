package com.cred.freestyle.ordersaga.infrastructure.messaging;

import com.cred.freestyle.ordersaga.domain.event.EventTypes;
import com.cred.freestyle.ordersaga.domain.event.payload.LabelCreatedPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.ShipmentCanceledPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.ShipmentFailedPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.ShipmentPreparedPayload;
import com.cred.freestyle.ordersaga.infrastructure.metrics.SagaMetricsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Publishes fulfillment.* events with source fulfillment_service.
 *
 * @author Order Saga Team
 */
@Component
public class FulfillmentEventPublisher extends EventPublisher {

    public FulfillmentEventPublisher(
            EventBus eventBus,
            ObjectMapper objectMapper,
            SagaMetricsService metricsService,
            @Value("${ordersaga.fulfillment.service-name:fulfillment_service}") String serviceName) {
        super(eventBus, objectMapper, metricsService, serviceName);
    }

    public boolean publishShipmentPrepared(ShipmentPreparedPayload payload) {
        return publish(EventTypes.SHIPMENT_PREPARED, payload);
    }

    public boolean publishLabelCreated(LabelCreatedPayload payload) {
        return publish(EventTypes.LABEL_CREATED, payload);
    }

    public boolean publishShipmentCanceled(ShipmentCanceledPayload payload) {
        return publish(EventTypes.SHIPMENT_CANCELED, payload);
    }

    public boolean publishShipmentFailed(ShipmentFailedPayload payload) {
        return publish(EventTypes.SHIPMENT_FAILED, payload);
    }
}
