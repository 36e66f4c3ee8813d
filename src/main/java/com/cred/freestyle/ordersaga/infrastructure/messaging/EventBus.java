package com.cred.freestyle.ordersaga.infrastructure.messaging;

import com.cred.freestyle.ordersaga.domain.event.DomainEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Transport for domain events. Delivery is at-least-once with no ordering
 * guarantee across subjects.
 *
 * @author Order Saga Team
 */
public interface EventBus {

    /**
     * Publish an event on subject {@code <source>.<type>}.
     *
     * @param event Event to publish
     * @return future completed when the broker acknowledged the event
     */
    CompletableFuture<Void> publish(DomainEvent event);
}
