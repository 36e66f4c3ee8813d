package com.cred.freestyle.ordersaga.service.inventory;

import com.cred.freestyle.ordersaga.domain.event.DomainEvent;
import com.cred.freestyle.ordersaga.domain.event.EventTypes;
import com.cred.freestyle.ordersaga.domain.event.payload.OrderCanceledPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.OrderCreatedPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.PaymentCompletedPayload;
import com.cred.freestyle.ordersaga.exception.EventValidationException;
import com.cred.freestyle.ordersaga.saga.EventPayloadReader;
import com.cred.freestyle.ordersaga.saga.HandlerResult;
import com.cred.freestyle.ordersaga.saga.SagaEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes order.created, payment.completed and order.canceled to the inventory participant.
 *
 * @author Order Saga Team
 */
@Component
public class InventoryEventHandler implements SagaEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(InventoryEventHandler.class);

    private final InventoryParticipant participant;
    private final EventPayloadReader payloadReader;

    public InventoryEventHandler(InventoryParticipant participant, EventPayloadReader payloadReader) {
        this.participant = participant;
        this.payloadReader = payloadReader;
    }

    @Override
    public String participant() {
        return "inventory";
    }

    @Override
    public HandlerResult handle(DomainEvent event) {
        try {
            switch (event.getType()) {
                case EventTypes.ORDER_CREATED: {
                    OrderCreatedPayload payload = payloadReader.read(event, OrderCreatedPayload.class);
                    return participant.handleOrderCreated(
                            payload.orderId(), payload.userId(), payload.items(), event.getType());
                }
                case EventTypes.PAYMENT_COMPLETED: {
                    PaymentCompletedPayload payload = payloadReader.read(event, PaymentCompletedPayload.class);
                    return participant.handlePaymentCompleted(payload.orderId(), payload.userId(), event.getType());
                }
                case EventTypes.ORDER_CANCELED: {
                    OrderCanceledPayload payload = payloadReader.read(event, OrderCanceledPayload.class);
                    return participant.handleOrderCanceled(
                            payload.orderId(), payload.userId(), payload.effectiveReason(), event.getType());
                }
                default:
                    logger.debug("Inventory ignores event type {}", event.getType());
                    return HandlerResult.skipped("unhandled event type " + event.getType());
            }
        } catch (EventValidationException e) {
            logger.warn("Dropping event {}: {}", event.getId(), e.getMessage());
            return HandlerResult.rejected(e.getMessage());
        }
    }
}
