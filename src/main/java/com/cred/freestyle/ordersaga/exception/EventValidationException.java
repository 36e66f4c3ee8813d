package com.cred.freestyle.ordersaga.exception;

/**
 * Exception thrown when an inbound event payload is missing required fields
 * or cannot be mapped to its typed payload. Such events are dropped.
 *
 * @author Order Saga Team
 */
public class EventValidationException extends RuntimeException {

    private final String eventType;

    public EventValidationException(String eventType, String message) {
        super(String.format("Invalid %s payload: %s", eventType, message));
        this.eventType = eventType;
    }

    public EventValidationException(String eventType, String message, Throwable cause) {
        super(String.format("Invalid %s payload: %s", eventType, message), cause);
        this.eventType = eventType;
    }

    public String getEventType() {
        return eventType;
    }
}
