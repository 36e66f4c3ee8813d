package com.cred.freestyle.ordersaga.saga;

import com.cred.freestyle.ordersaga.domain.event.DomainEvent;

/**
 * A saga participant's entry point for routed events.
 *
 * Implementations must be idempotent and must not throw for business or
 * infrastructure failures; those are reported through the returned result.
 *
 * @author Order Saga Team
 */
public interface SagaEventHandler {

    /**
     * Participant name used in logs and metrics.
     */
    String participant();

    HandlerResult handle(DomainEvent event);
}
