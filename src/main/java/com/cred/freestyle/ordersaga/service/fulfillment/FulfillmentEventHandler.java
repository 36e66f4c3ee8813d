package com.cred.freestyle.ordersaga.service.fulfillment;

import com.cred.freestyle.ordersaga.domain.event.DomainEvent;
import com.cred.freestyle.ordersaga.domain.event.EventTypes;
import com.cred.freestyle.ordersaga.domain.event.payload.OrderCanceledPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.PaymentCompletedPayload;
import com.cred.freestyle.ordersaga.domain.event.payload.TaxCalculatedPayload;
import com.cred.freestyle.ordersaga.exception.EventValidationException;
import com.cred.freestyle.ordersaga.saga.EventPayloadReader;
import com.cred.freestyle.ordersaga.saga.HandlerResult;
import com.cred.freestyle.ordersaga.saga.SagaEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes tax.calculated, payment.completed and order.canceled to the fulfillment participant.
 *
 * @author Order Saga Team
 */
@Component
public class FulfillmentEventHandler implements SagaEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(FulfillmentEventHandler.class);

    private final FulfillmentParticipant participant;
    private final EventPayloadReader payloadReader;

    public FulfillmentEventHandler(FulfillmentParticipant participant, EventPayloadReader payloadReader) {
        this.participant = participant;
        this.payloadReader = payloadReader;
    }

    @Override
    public String participant() {
        return "fulfillment";
    }

    @Override
    public HandlerResult handle(DomainEvent event) {
        try {
            switch (event.getType()) {
                case EventTypes.TAX_CALCULATED: {
                    TaxCalculatedPayload payload = payloadReader.read(event, TaxCalculatedPayload.class);
                    return participant.handleTaxCalculated(payload.orderId(), payload.userId(),
                            payload.resolvedShippingAddress(), payload.resolvedItems(), event.getType());
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
                    logger.debug("Fulfillment ignores event type {}", event.getType());
                    return HandlerResult.skipped("unhandled event type " + event.getType());
            }
        } catch (EventValidationException e) {
            logger.warn("Dropping event {}: {}", event.getId(), e.getMessage());
            return HandlerResult.rejected(e.getMessage());
        }
    }
}
