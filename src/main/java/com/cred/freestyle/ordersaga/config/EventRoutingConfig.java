package com.cred.freestyle.ordersaga.config;

import com.cred.freestyle.ordersaga.domain.event.EventTypes;
import com.cred.freestyle.ordersaga.infrastructure.metrics.SagaMetricsService;
import com.cred.freestyle.ordersaga.saga.EventRouter;
import com.cred.freestyle.ordersaga.service.fulfillment.FulfillmentEventHandler;
import com.cred.freestyle.ordersaga.service.inventory.InventoryEventHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static com.cred.freestyle.ordersaga.domain.event.EventTypes.subject;

/**
 * Routing table of the saga: which participants react to which upstream subject.
 *
 * @author Order Saga Team
 */
@Configuration
public class EventRoutingConfig {

    @Bean
    public EventRouter eventRouter(InventoryEventHandler inventoryHandler,
                                   FulfillmentEventHandler fulfillmentHandler,
                                   SagaMetricsService metricsService) {
        return EventRouter.builder(metricsService)
                .route(subject(EventTypes.ORDER_SERVICE, EventTypes.ORDER_CREATED), inventoryHandler)
                .route(subject(EventTypes.ORDER_SERVICE, EventTypes.ORDER_CANCELED), inventoryHandler, fulfillmentHandler)
                .route(subject(EventTypes.PAYMENT_SERVICE, EventTypes.PAYMENT_COMPLETED), inventoryHandler, fulfillmentHandler)
                .route(subject(EventTypes.TAX_SERVICE, EventTypes.TAX_CALCULATED), fulfillmentHandler)
                .build();
    }
}
